package com.github.statecharts.uml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateMachineException;
import com.github.statecharts.StateMachineException.Code;
import com.github.statecharts.model.ChartAction;
import com.github.statecharts.model.PragmaKind;

/**
 * Recursive descent parser of the statechart notation:
 *
 * <pre>
 * chart        ::= "@startuml" body "@enduml"
 * body         ::= ( comment | pragma | directive | state_block | state_clause
 *                  | transition | note | region_sep )*
 * state_block  ::= "state" STATE ( "{" body "}" )?
 * state_clause ::= STATE ":" keyword label
 * transition   ::= STATE ARROW STATE ( ":" label )?
 * label        ::= WORD* PARAMETERS? GUARD? ( ACTION | BLOCK_ACTION )?
 * </pre>
 *
 * The first malformed line aborts parsing with a {@link Code#SYNTAX_ERROR} carrying the position
 * and the expected construct. No partial tree is returned.
 */
public final class StatechartParser {
  private static final Logger logger = LogManager.getLogger(StatechartParser.class.getSimpleName());

  private static final List<String> ENTRY_KEYWORDS = Arrays.asList("entry", "entering");
  private static final List<String> EXIT_KEYWORDS = Arrays.asList("exit", "leaving");
  private static final List<String> EVENT_KEYWORDS = Arrays.asList("on", "event");
  private static final List<String> ACTIVITY_KEYWORDS = Arrays.asList("do", "activity");
  private static final String COMMENT_KEYWORD = "comment";

  private final List<Token> tokens;
  private int position;

  private StatechartParser(final List<Token> tokens) {
    this.tokens = tokens;
  }

  public static SyntaxTree.ChartNode parse(final String source) throws StateMachineException {
    final StatechartParser parser = new StatechartParser(Lexer.tokenize(source));
    final SyntaxTree.ChartNode chart = parser.chart();
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed chart '" + chart.getName() + "' with " + chart.getBody().size()
          + " top-level nodes");
    }
    return chart;
  }

  static StateMachineException syntaxError(final int line, final int column,
      final String message) {
    final Diagnostic diagnostic = Diagnostic.error(line, column, message);
    return new StateMachineException(Code.SYNTAX_ERROR, "Syntax error at " + line + ":" + column
        + ": " + message, Collections.singletonList(diagnostic));
  }

  private SyntaxTree.ChartNode chart() throws StateMachineException {
    skipComments();
    final Token start = expect(TokenType.START, "'@startuml'");
    expect(TokenType.EOL, "end of line after '@startuml'");
    final List<SyntaxTree.Node> body = new ArrayList<>();
    final List<List<SyntaxTree.Node>> regions = new ArrayList<>();
    regions.add(body);
    body(regions, false);
    expect(TokenType.END, "'@enduml'");
    expect(TokenType.EOL, "end of line after '@enduml'");
    skipComments();
    expect(TokenType.EOF, "end of input after '@enduml'");
    return new SyntaxTree.ChartNode(start.getLine(), start.getColumn(), start.getText(), body);
  }

  /**
   * Parse lines until '@enduml' (top level) or '}' (inside a block), appending nodes to the last
   * region. Region separators open a new region and are only legal inside a block.
   */
  private void body(final List<List<SyntaxTree.Node>> regions, final boolean inBlock)
      throws StateMachineException {
    while (true) {
      final Token token = peek();
      final List<SyntaxTree.Node> region = regions.get(regions.size() - 1);
      switch (token.getType()) {
        case COMMENT:
          next();
          region.add(new SyntaxTree.CommentNode(token.getLine(), token.getColumn(),
              token.getText()));
          expect(TokenType.EOL, "end of line");
          break;
        case PRAGMA:
          region.add(pragma());
          break;
        case DIRECTIVE:
          next();
          region.add(new SyntaxTree.DirectiveNode(token.getLine(), token.getColumn(),
              token.getText()));
          expect(TokenType.EOL, "end of line");
          break;
        case STATE_KEYWORD:
          region.add(stateBlock());
          break;
        case NOTE_KEYWORD:
          region.add(note());
          break;
        case REGION_SEPARATOR:
          if (!inBlock) {
            throw syntaxError(token.getLine(), token.getColumn(),
                "region separator '" + token.getText() + "' outside of a state block");
          }
          next();
          expect(TokenType.EOL, "end of line after region separator");
          regions.add(new ArrayList<SyntaxTree.Node>());
          break;
        case IDENTIFIER:
        case INITIAL_MARKER:
          region.add(clauseOrTransition());
          break;
        case RBRACE:
          if (!inBlock) {
            throw syntaxError(token.getLine(), token.getColumn(), "unmatched '}'");
          }
          return;
        case END:
          if (inBlock) {
            throw syntaxError(token.getLine(), token.getColumn(),
                "expected '}' closing the state block before '@enduml'");
          }
          return;
        default:
          throw syntaxError(token.getLine(), token.getColumn(),
              "expected a state, a transition, a comment or " + (inBlock ? "'}'" : "'@enduml'")
                  + " but found " + token.getType().getDescription());
      }
    }
  }

  private SyntaxTree.PragmaNode pragma() throws StateMachineException {
    final Token kind = next();
    if (PragmaKind.fromTag(kind.getText()) == null) {
      throw syntaxError(kind.getLine(), kind.getColumn(), "unknown pragma '[" + kind.getText()
          + "]', expected one of " + Arrays.toString(PragmaKind.values()).toLowerCase());
    }
    final Token text = expect(TokenType.PRAGMA_TEXT, "pragma text");
    expect(TokenType.EOL, "end of line");
    return new SyntaxTree.PragmaNode(kind.getLine(), kind.getColumn(), kind.getText(),
        text.getText());
  }

  private SyntaxTree.StateBlockNode stateBlock() throws StateMachineException {
    final Token keyword = next();
    final Token name = expect(TokenType.IDENTIFIER, "state name after 'state'");
    final List<List<SyntaxTree.Node>> regions = new ArrayList<>();
    if (peek().is(TokenType.LBRACE)) {
      next();
      if (peek().is(TokenType.RBRACE)) {
        next();
        expect(TokenType.EOL, "end of line after state declaration");
        return new SyntaxTree.StateBlockNode(keyword.getLine(), keyword.getColumn(),
            name.getText(), regions);
      }
      expect(TokenType.EOL, "end of line after '{'");
      regions.add(new ArrayList<SyntaxTree.Node>());
      body(regions, true);
      expect(TokenType.RBRACE, "'}'");
      if (regions.size() == 1 && regions.get(0).isEmpty()) {
        regions.clear();
      }
    }
    expect(TokenType.EOL, "end of line after state declaration");
    return new SyntaxTree.StateBlockNode(keyword.getLine(), keyword.getColumn(), name.getText(),
        regions);
  }

  private SyntaxTree.NoteNode note() throws StateMachineException {
    final Token side = next();
    final Token state = expect(TokenType.IDENTIFIER, "state name of the note");
    final Token text = expect(TokenType.NOTE_TEXT, "note text");
    if (peek().is(TokenType.END_NOTE)) {
      next();
    }
    expect(TokenType.EOL, "end of line after note");
    return new SyntaxTree.NoteNode(side.getLine(), side.getColumn(), side.getText(),
        state.getText(), text.getText());
  }

  private SyntaxTree.Node clauseOrTransition() throws StateMachineException {
    final Token first = next();
    final Token following = peek();
    if (following.is(TokenType.ARROW)) {
      next();
      final Token second = peek();
      if (!second.is(TokenType.IDENTIFIER) && !second.is(TokenType.INITIAL_MARKER)) {
        throw syntaxError(second.getLine(), second.getColumn(),
            "expected a state name or '[*]' after '" + following.getText() + "' but found "
                + second.getType().getDescription());
      }
      next();
      SyntaxTree.Label label = SyntaxTree.Label.EMPTY;
      if (peek().is(TokenType.COLON)) {
        next();
        label = label();
      }
      expect(TokenType.EOL, "end of line after transition");
      return new SyntaxTree.TransitionNode(first.getLine(), first.getColumn(), first.getText(),
          following.getText(), second.getText(), label);
    }
    if (following.is(TokenType.COLON)) {
      if (first.is(TokenType.INITIAL_MARKER)) {
        throw syntaxError(first.getLine(), first.getColumn(),
            "'[*]' cannot carry state clauses, expected an arrow");
      }
      next();
      return stateClause(first);
    }
    throw syntaxError(following.getLine(), following.getColumn(),
        "expected an arrow or ':' after '" + first.getText() + "' but found "
            + following.getType().getDescription());
  }

  private SyntaxTree.StateClauseNode stateClause(final Token state) throws StateMachineException {
    final Token keyword = peek();
    if (!keyword.is(TokenType.WORD)) {
      throw syntaxError(keyword.getLine(), keyword.getColumn(),
          "expected entry, exit, on, do or comment after ':'");
    }
    next();
    final String what = keyword.getText();
    final SyntaxTree.Label label = label();
    if (ENTRY_KEYWORDS.contains(what) || EXIT_KEYWORDS.contains(what)
        || ACTIVITY_KEYWORDS.contains(what)) {
      if (!label.getWords().isEmpty() || label.getGuard().isPresent()
          || label.getParameters().isPresent() || !label.getAction().isPresent()) {
        throw syntaxError(keyword.getLine(), keyword.getColumn(),
            "expected '/ action' after '" + what + "'");
      }
    } else if (EVENT_KEYWORDS.contains(what)) {
      if (label.getWords().isEmpty()) {
        throw syntaxError(keyword.getLine(), keyword.getColumn(),
            "expected an event name after '" + what + "'");
      }
    } else if (COMMENT_KEYWORD.equals(what)) {
      if (!label.getWords().isEmpty() || label.getGuard().isPresent()
          || label.getParameters().isPresent()) {
        throw syntaxError(keyword.getLine(), keyword.getColumn(),
            "expected '/ text' after 'comment'");
      }
    } else {
      throw syntaxError(keyword.getLine(), keyword.getColumn(), "unknown state clause '" + what
          + "', expected entry, entering, exit, leaving, on, event, do, activity or comment");
    }
    expect(TokenType.EOL, "end of line after state clause");
    return new SyntaxTree.StateClauseNode(state.getLine(), state.getColumn(), state.getText(),
        what, label);
  }

  private SyntaxTree.Label label() throws StateMachineException {
    final List<String> words = new ArrayList<>();
    while (peek().is(TokenType.WORD)) {
      words.add(next().getText());
    }
    String parameters = null;
    if (peek().is(TokenType.PARAMETERS)) {
      final Token token = next();
      if (words.isEmpty()) {
        throw syntaxError(token.getLine(), token.getColumn(),
            "event parameters without an event name");
      }
      parameters = token.getText();
    }
    String guard = null;
    if (peek().is(TokenType.GUARD)) {
      guard = next().getText();
    }
    ChartAction action = null;
    if (peek().is(TokenType.ACTION)) {
      action = ChartAction.singleLine(next().getText());
    } else if (peek().is(TokenType.BLOCK_ACTION)) {
      action = ChartAction.block(next().getText());
    }
    final Token rest = peek();
    if (!rest.is(TokenType.EOL)) {
      throw syntaxError(rest.getLine(), rest.getColumn(),
          "expected 'event [guard] / action' in this order but found "
              + rest.getType().getDescription());
    }
    return new SyntaxTree.Label(words, parameters, guard, action);
  }

  private void skipComments() throws StateMachineException {
    while (peek().is(TokenType.COMMENT)) {
      next();
      expect(TokenType.EOL, "end of line");
    }
  }

  private Token expect(final TokenType type, final String expected)
      throws StateMachineException {
    final Token token = peek();
    if (!token.is(type)) {
      throw syntaxError(token.getLine(), token.getColumn(),
          "expected " + expected + " but found " + token.getType().getDescription()
              + (token.getText().isEmpty() ? "" : " '" + token.getText() + "'"));
    }
    return next();
  }

  private Token peek() {
    return tokens.get(position);
  }

  private Token next() {
    final Token token = tokens.get(position);
    if (!token.is(TokenType.EOF)) {
      position++;
    }
    return token;
  }
}
