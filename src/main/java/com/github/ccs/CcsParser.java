package com.github.ccs;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.ccs.CcsException.Code;

/**
 * Parser for the CCS input language, driven by the {@code CcsSyntax} grammar. The generated parser
 * builds the syntax tree, {@link TermBuilder} turns it into {@link Process} terms.
 *
 * Notes:<br>
 * 1. precedence from tightest to loosest: postfix restriction and relabeling, prefix, parallel
 * composition, choice. Binary operators nest to the right, {@code P + Q + R} is
 * {@code P + (Q + R)}<br>
 * 2. consecutive restrictions {@code P \ a \ b} form one restriction of both names<br>
 * 3. the silent action is written {@code tau} or {@code τ}<br>
 * 4. whitespace, including line breaks, only separates tokens. A definition ends where its
 * expression cannot be continued<br>
 * 5. the first syntax error aborts parsing, there is no recovery<br>
 */
public final class CcsParser implements SpecificationParser {
  private static final Logger logger = LogManager.getLogger(CcsParser.class.getSimpleName());

  @Override
  public Environment parse(final String specification) throws CcsException {
    final CcsSyntaxParser parser = newParser(specification);
    final Environment.EnvironmentBuilder builder = Environment.EnvironmentBuilder.newBuilder();
    final TermBuilder terms = new TermBuilder();
    int definitions = 0;
    try {
      for (final CcsSyntaxParser.DefinitionContext definition : parser.specification()
          .definition()) {
        final Token name = definition.name;
        if (!Process.isValidProcessName(name.getText())) {
          throw syntaxError(name, "a process name");
        }
        final Process term = terms.visit(definition.choice());
        if (Process.ANONYMOUS_NAME.equals(name.getText())) {
          builder.anonymous(term);
        } else {
          builder.define(name.getText(), term);
        }
        definitions++;
      }
    } catch (ParseFailure failure) {
      throw failure.getCause();
    }
    if (definitions == 0) {
      throw new CcsException(Code.SYNTAX_ERROR, "Specification defines no process");
    }
    final Environment environment = builder.build();
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + definitions + " definitions");
    }
    return environment;
  }

  @Override
  public Process parseProcess(final String expression) throws CcsException {
    final CcsSyntaxParser parser = newParser(expression);
    try {
      return new TermBuilder().visit(parser.expression().choice());
    } catch (ParseFailure failure) {
      throw failure.getCause();
    }
  }

  private static CcsSyntaxParser newParser(final String text) throws CcsException {
    if (text == null) {
      throw new CcsException(Code.SYNTAX_ERROR, "Input cannot be null");
    }
    final CcsSyntaxLexer lexer = new CcsSyntaxLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(FailFastListener.INSTANCE);
    final CcsSyntaxParser parser = new CcsSyntaxParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(FailFastListener.INSTANCE);
    return parser;
  }

  private static ParseFailure syntaxError(final Token found, final String expected) {
    return new ParseFailure(new CcsException(Code.SYNTAX_ERROR, position(found.getLine(),
        found.getCharPositionInLine()) + "expected " + expected + " but found '"
        + found.getText() + "'"));
  }

  private static String position(final int line, final int charPositionInLine) {
    return "Line " + line + ", column " + (charPositionInLine + 1) + ": ";
  }

  /**
   * Builds terms bottom-up from the syntax tree. Checks the grammar leaves to the tree, such as
   * action names starting lowercase and process names starting uppercase.
   */
  private static final class TermBuilder extends CcsSyntaxBaseVisitor<Process> {

    @Override
    public Process visitChoice(final CcsSyntaxParser.ChoiceContext ctx) {
      final Process left = visit(ctx.parallel());
      if (ctx.choice() != null) {
        return Process.choice(left, visit(ctx.choice()));
      }
      return left;
    }

    @Override
    public Process visitParallel(final CcsSyntaxParser.ParallelContext ctx) {
      final Process left = visit(ctx.prefixed());
      if (ctx.parallel() != null) {
        return Process.parallel(left, visit(ctx.parallel()));
      }
      return left;
    }

    @Override
    public Process visitPrefix(final CcsSyntaxParser.PrefixContext ctx) {
      return Process.prefix(toAction(ctx.action()), visit(ctx.prefixed()));
    }

    @Override
    public Process visitPlain(final CcsSyntaxParser.PlainContext ctx) {
      return visit(ctx.postfixed());
    }

    @Override
    public Process visitPostfixed(final CcsSyntaxParser.PostfixedContext ctx) {
      Process term = visit(ctx.atom());
      Set<String> restricted = new LinkedHashSet<>();
      for (final CcsSyntaxParser.SuffixContext suffix : ctx.suffix()) {
        if (suffix instanceof CcsSyntaxParser.RestrictionContext) {
          restricted.add(
              actionName(((CcsSyntaxParser.RestrictionContext) suffix).IDENTIFIER().getSymbol()));
          continue;
        }
        if (!restricted.isEmpty()) {
          term = Process.restrict(term, restricted);
          restricted = new LinkedHashSet<>();
        }
        term = Process.relabel(term, renaming((CcsSyntaxParser.RelabelingContext) suffix));
      }
      if (!restricted.isEmpty()) {
        term = Process.restrict(term, restricted);
      }
      return term;
    }

    @Override
    public Process visitDeadlock(final CcsSyntaxParser.DeadlockContext ctx) {
      return Process.deadlock();
    }

    @Override
    public Process visitReference(final CcsSyntaxParser.ReferenceContext ctx) {
      final Token token = ctx.IDENTIFIER().getSymbol();
      if (Process.ANONYMOUS_NAME.equals(token.getText())) {
        throw new ParseFailure(new CcsException(Code.ANONYMOUS_PROCESS_REFERENCE,
            position(token.getLine(), token.getCharPositionInLine())
                + Code.ANONYMOUS_PROCESS_REFERENCE.getDescription()));
      }
      if (!Process.isValidProcessName(token.getText())) {
        throw syntaxError(token, "a process");
      }
      return Process.reference(token.getText());
    }

    @Override
    public Process visitGroup(final CcsSyntaxParser.GroupContext ctx) {
      return visit(ctx.choice());
    }

    private static Map<String, String> renaming(final CcsSyntaxParser.RelabelingContext ctx) {
      final Map<String, String> renaming = new LinkedHashMap<>();
      for (final CcsSyntaxParser.RenamingContext pair : ctx.renaming()) {
        final String newName = actionName(pair.newName);
        final String oldName = actionName(pair.oldName);
        if (renaming.put(oldName, newName) != null) {
          throw new ParseFailure(new CcsException(Code.SYNTAX_ERROR,
              position(pair.oldName.getLine(), pair.oldName.getCharPositionInLine()) + "action "
                  + oldName + " is renamed more than once"));
        }
      }
      return renaming;
    }

    private static Action toAction(final CcsSyntaxParser.ActionContext ctx) {
      if (ctx.TAU() != null) {
        return Action.TAU;
      }
      final Token token = ctx.IDENTIFIER().getSymbol();
      final String text = token.getText();
      final boolean complement = text.endsWith("'");
      final String name = complement ? text.substring(0, text.length() - 1) : text;
      if (!Action.isValidName(name)) {
        throw syntaxError(token, "an action");
      }
      return Action.named(name, complement);
    }

    // restricted and renamed names are plain visible names, never primed and never τ
    private static String actionName(final Token token) {
      if (!Action.isValidName(token.getText())) {
        throw syntaxError(token, "an action name");
      }
      return token.getText();
    }
  }

  /**
   * Turns the first lexer or parser error into a {@link Code#SYNTAX_ERROR} carrying its position.
   */
  private static final class FailFastListener extends BaseErrorListener {
    private static final FailFastListener INSTANCE = new FailFastListener();

    @Override
    public void syntaxError(final Recognizer<?, ?> recognizer, final Object offendingSymbol,
        final int line, final int charPositionInLine, final String message,
        final RecognitionException exception) {
      throw new ParseFailure(new CcsException(Code.SYNTAX_ERROR,
          position(line, charPositionInLine) + message));
    }
  }

  /**
   * Carries a {@link CcsException} through the generated code, whose callbacks cannot throw
   * checked exceptions.
   */
  private static final class ParseFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private ParseFailure(final CcsException cause) {
      super(cause);
    }

    @Override
    public synchronized CcsException getCause() {
      return (CcsException) super.getCause();
    }
  }

}
