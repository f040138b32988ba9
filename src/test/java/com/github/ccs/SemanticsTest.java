package com.github.ccs;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the SOS rules.
 */
public class SemanticsTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2.properties");
  }

  private static final Process nil = Process.deadlock();

  @Test
  public void testDeadlockHasNoTransitions() throws CcsException {
    assertTrue(Semantics.step(nil, Environment.empty()).isEmpty());
    final Environment environment = Environment.EnvironmentBuilder.newBuilder()
        .define("P", Process.prefix("a", Process.reference("P"))).build();
    assertTrue(Semantics.step(nil, environment).isEmpty());
  }

  @Test
  public void testPrefix() throws CcsException {
    final Process continuation =
        Process.parallel(Process.prefix("b", nil), Process.choice(Process.prefix("c", nil), nil));
    final Set<Transition> transitions =
        Semantics.step(Process.prefix("a", continuation), Environment.empty());
    assertEquals(1, transitions.size());
    final Transition transition = transitions.iterator().next();
    assertEquals(Action.of("a"), transition.getLabel());
    assertEquals(continuation, transition.getTarget());
  }

  @Test
  public void testChoiceIsUnionOfOperands() throws CcsException {
    final Process left = Process.choice(Process.prefix("a", nil), Process.prefix("b", nil));
    final Process right = Process.prefix("c", Process.prefix("d", nil));
    final Set<Transition> expected = new HashSet<>(Semantics.step(left, Environment.empty()));
    expected.addAll(Semantics.step(right, Environment.empty()));

    final Set<Transition> transitions =
        Semantics.step(Process.choice(left, right), Environment.empty());
    assertEquals(expected, transitions);
    assertEquals(3, transitions.size());
  }

  @Test
  public void testChoiceMergesDuplicateMoves() throws CcsException {
    final Process term = Process.choice(Process.prefix("a", nil), Process.prefix("a", nil));
    assertEquals(1, Semantics.step(term, Environment.empty()).size());
  }

  @Test
  public void testParallelInterleavesAndSynchronizes() throws CcsException {
    // 1. a.0 | a'.0
    final Process left = Process.prefix("a", nil);
    final Process right = Process.prefix("a'", nil);
    final Set<Transition> transitions =
        Semantics.step(Process.parallel(left, right), Environment.empty());

    // 2. both interleavings plus one synchronization
    assertEquals(3, transitions.size());
    assertTrue(transitions.contains(new Transition(Action.of("a"), Process.parallel(nil, right))));
    assertTrue(transitions.contains(new Transition(Action.of("a'"), Process.parallel(left, nil))));
    assertTrue(transitions.contains(new Transition(Action.TAU, Process.parallel(nil, nil))));
  }

  @Test
  public void testParallelMergesEqualSynchronizations() throws CcsException {
    // a.0 + a.0 offers a once, so there is a single synchronization with a'.0
    final Process left = Process.choice(Process.prefix("a", nil), Process.prefix("a", nil));
    final Process right = Process.prefix("a'", nil);
    int silent = 0;
    for (final Transition transition : Semantics.step(Process.parallel(left, right),
        Environment.empty())) {
      if (transition.getLabel().isSilent()) {
        silent++;
      }
    }
    assertEquals(1, silent);
  }

  @Test
  public void testParallelDoesNotSynchronizeEqualPolarity() throws CcsException {
    final Process term = Process.parallel(Process.prefix("a", nil), Process.prefix("a", nil));
    for (final Transition transition : Semantics.step(term, Environment.empty())) {
      assertFalse(transition.getLabel().isSilent());
    }
  }

  @Test
  public void testRestrictionFiltersBothPolarities() throws CcsException {
    // (a.0 | a'.0 | b.0 | tau.0)\a
    final Process inner = Process.parallel(Process.prefix("a", nil), Process.prefix("a'", nil),
        Process.prefix("b", nil), Process.prefix(Action.TAU, nil));
    final Set<Transition> unrestricted = Semantics.step(inner, Environment.empty());
    final Set<Transition> transitions =
        Semantics.step(Process.restrict(inner, "a"), Environment.empty());

    int expected = 0;
    for (final Transition transition : unrestricted) {
      final Action label = transition.getLabel();
      if (label.isSilent() || !label.getName().equals("a")) {
        expected++;
        assertTrue(transitions.contains(new Transition(label,
            Process.restrict(transition.getTarget(), "a"))));
      }
    }
    assertEquals(expected, transitions.size());
    for (final Transition transition : transitions) {
      assertFalse(!transition.getLabel().isSilent()
          && transition.getLabel().getName().equals("a"));
    }
  }

  @Test
  public void testRelabelKeepsPolarityAndTau() throws CcsException {
    // (b.0 + b'.0 + tau.0)[a/b]
    final Process inner = Process.choice(Process.prefix("b", nil), Process.prefix("b'", nil),
        Process.prefix(Action.TAU, nil));
    final Set<Transition> transitions =
        Semantics.step(Process.relabel(inner, "a", "b"), Environment.empty());
    final Process target = Process.relabel(nil, "a", "b");
    assertEquals(3, transitions.size());
    assertTrue(transitions.contains(new Transition(Action.of("a"), target)));
    assertTrue(transitions.contains(new Transition(Action.of("a'"), target)));
    assertTrue(transitions.contains(new Transition(Action.TAU, target)));
  }

  @Test
  public void testReferenceResolvesThroughEnvironment() throws CcsException {
    final Environment environment = Environment.EnvironmentBuilder.newBuilder()
        .define("P", Process.reference("Q"))
        .define("Q", Process.prefix("a", Process.reference("P"))).build();
    final Set<Transition> transitions = Semantics.step(Process.reference("P"), environment);
    assertEquals(1, transitions.size());
    assertEquals(new Transition(Action.of("a"), Process.reference("P")),
        transitions.iterator().next());
  }

  @Test
  public void testUndefinedReference() {
    try {
      Semantics.step(Process.reference("Missing"), Environment.empty());
      assertTrue(false);
    } catch (CcsException exception) {
      assertEquals(CcsException.Code.UNDEFINED_PROCESS, exception.getCode());
      assertTrue(exception.getMessage().contains("Missing"));
    }
  }

  @Test
  public void testActionComplement() {
    final Action a = Action.of("a");
    assertEquals(Action.of("a'"), a.complement());
    assertEquals(a, a.complement().complement());
    assertTrue(a.complements(Action.of("a'")));
    assertFalse(a.complements(Action.of("b'")));
    assertFalse(Action.TAU.complements(Action.TAU));
    assertEquals(Action.TAU, Action.of(Action.TAU_KEYWORD));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIllegalActionName() {
    Action.of("A");
  }

}
