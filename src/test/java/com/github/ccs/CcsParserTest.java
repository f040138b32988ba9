package com.github.ccs;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import com.github.ccs.CcsException.Code;

/**
 * Tests to maintain the sanity and correctness of CcsParser.
 */
public class CcsParserTest {
  private static final Process nil = Process.deadlock();

  private final SpecificationParser parser = new CcsParser();

  @Test
  public void testPrecedence() throws CcsException {
    // postfix, then prefix, then |, then +
    final Process parsed = parser.parseProcess("a.P \\ b | c.0 + tau.0");
    final Process expected = Process.choice(
        Process.parallel(Process.prefix("a", Process.restrict(Process.reference("P"), "b")),
            Process.prefix("c", nil)),
        Process.prefix(Action.TAU, nil));
    assertEquals(expected, parsed);
  }

  @Test
  public void testBinaryOperatorsNestRight() throws CcsException {
    assertEquals(
        Process.choice(Process.prefix("a", nil),
            Process.choice(Process.prefix("b", nil), Process.prefix("c", nil))),
        parser.parseProcess("a.0 + b.0 + c.0"));
    assertEquals(
        Process.choice(
            Process.choice(Process.prefix("a", nil), Process.prefix("b", nil)),
            Process.prefix("c", nil)),
        parser.parseProcess("(a.0 + b.0) + c.0"));
  }

  @Test
  public void testRestrictionAndRelabeling() throws CcsException {
    assertEquals(Process.restrict(Process.reference("P"), "a", "b"),
        parser.parseProcess("P \\ a \\ b"));
    assertEquals(Process.relabel(Process.reference("P"), "a", "b"),
        parser.parseProcess("P[a/b]"));
    assertEquals(
        Process.relabel(Process.prefix("b'", nil), renaming("b", "a", "c", "d")),
        parser.parseProcess("(b'.0)[a/b, d/c]"));
    assertEquals(Process.prefix(Action.TAU, nil), parser.parseProcess("τ.0"));
  }

  @Test
  public void testSpecification() throws CcsException {
    final Environment environment = parser.parse("Buffer = in.Full\n"
        + "Full = out'.Buffer\n"
        + "_ = (Buffer | out.0) \\ out\n");
    assertEquals(3, environment.size());
    assertEquals(Process.reference("Buffer"), environment.getMainProcess().get());
    assertEquals(Process.prefix("out'", Process.reference("Buffer")),
        environment.lookup("Full"));
    assertEquals(1, environment.getAnonymousDefinitions().size());
  }

  @Test
  public void testPrintedFormParsesBack() throws CcsException {
    final Environment environment = parser.parse(
        "Main = (Left | Right) \\ mid \\ ack\n"
        + "Left = in.mid'.ack.Left + tau.Left\n"
        + "Right = mid.(out'.ack'.Right + (b.0)[c/b])\n"
        + "Spare = ((a.0 | a'.0) \\ a)[x/a, y/z] + 0\n"
        + "_ = Main | Spare\n");
    final Environment reparsed = parser.parse(environment.toString());
    assertEquals(environment, reparsed);
    assertEquals(environment.toString(), reparsed.toString());
  }

  @Test
  public void testGeneratedSpecificationParsesBack() throws CcsException {
    final Environment environment = RandomLtsGenerator.generate(20, 4, 50, 3L);
    assertEquals(environment, parser.parse(environment.toString()));
  }

  @Test
  public void testSyntaxErrors() {
    for (final String text : Arrays.asList("P = ", "P = a.", "P = a", "P = (a.0", "p = 0",
        "P = 0 \\ tau", "P = 0 \\ a'", "P = 0[a/b", "P = Q'", "P = #", "P = tau'.0",
        "P = 0[a/b, c/b]")) {
      try {
        parser.parse(text);
        fail("Expected a syntax error for " + text);
      } catch (CcsException exception) {
        assertEquals(text, Code.SYNTAX_ERROR, exception.getCode());
        assertTrue(exception.getMessage(), exception.getMessage().startsWith("Line 1, column")
            || exception.getMessage().startsWith("Specification"));
      }
    }
  }

  @Test
  public void testErrorPosition() {
    try {
      parser.parse("P = a.0\nQ = b.)");
      fail("Expected a syntax error");
    } catch (CcsException exception) {
      assertEquals(Code.SYNTAX_ERROR, exception.getCode());
      assertTrue(exception.getMessage(), exception.getMessage().startsWith("Line 2, column 7"));
    }
  }

  @Test
  public void testUnknownCharacterPosition() {
    try {
      parser.parse("P = a.0\n\nQ = b.0 # c.0");
      fail("Expected a syntax error");
    } catch (CcsException exception) {
      assertEquals(Code.SYNTAX_ERROR, exception.getCode());
      assertTrue(exception.getMessage(), exception.getMessage().startsWith("Line 3, column 9"));
    }
  }

  @Test
  public void testRestrictionsSplitByRelabeling() throws CcsException {
    assertEquals(
        Process.restrict(Process.relabel(Process.restrict(Process.reference("P"), "a", "b"),
            "x", "y"), "c"),
        parser.parseProcess("P \\ a \\ b [x/y] \\ c"));
    assertEquals(Process.restrict(Process.restrict(Process.reference("P"), "a"), "b"),
        parser.parseProcess("(P \\ a) \\ b"));
  }

  @Test
  public void testEmptySpecification() {
    try {
      parser.parse("  \n ");
      fail("Expected a syntax error");
    } catch (CcsException exception) {
      assertEquals(Code.SYNTAX_ERROR, exception.getCode());
    }
  }

  @Test
  public void testAnonymousReference() {
    try {
      parser.parse("_ = a.0\nP = b._");
      fail("Expected an anonymous reference failure");
    } catch (CcsException exception) {
      assertEquals(Code.ANONYMOUS_PROCESS_REFERENCE, exception.getCode());
    }
  }

  @Test
  public void testValidationErrorsPassThrough() {
    try {
      parser.parse("P = a.Q");
      fail("Expected an undefined process");
    } catch (CcsException exception) {
      assertEquals(Code.UNDEFINED_PROCESS, exception.getCode());
    }
    try {
      parser.parse("P = Q + a.0\nQ = P");
      fail("Expected unguarded recursion");
    } catch (CcsException exception) {
      assertEquals(Code.UNGUARDED_RECURSION, exception.getCode());
    }
  }

  // alternating old and new names
  private static Map<String, String> renaming(final String... pairs) {
    final Map<String, String> renaming = new LinkedHashMap<>();
    for (int iter = 0; iter < pairs.length; iter += 2) {
      renaming.put(pairs[iter], pairs[iter + 1]);
    }
    return renaming;
  }

}
