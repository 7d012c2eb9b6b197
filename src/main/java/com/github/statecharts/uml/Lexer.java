package com.github.statecharts.uml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateMachineException;

/**
 * Line-oriented tokenizer of the PlantUML statechart subset.
 *
 * Every non-blank line produces its tokens followed by one {@link TokenType#EOL}. Comments, notes
 * and directives are recognized as whole lines. Anything after a {@code :} is a label and is lexed
 * in label mode: words, {@code (parameters)}, {@code [guard]}, and a trailing action either as
 * {@code / text} or as {@code \n--\n text}. Guard, parameter and action text is never interpreted.
 */
public final class Lexer {
  private static final Logger logger = LogManager.getLogger(Lexer.class.getSimpleName());

  // the PlantUML label separator, as the six characters written in the source
  static final String BLOCK_SEPARATOR = "\\n--\\n";

  private static final List<String> ARROWS = Arrays.asList("-->", "->", "<--", "<-");
  private static final List<String> DIRECTIVES = Arrays.asList("skinparam", "skin", "hide", "show");

  private static final Pattern PRAGMA_PATTERN = Pattern.compile("^'\\s*\\[([A-Za-z]+)\\]\\s?(.*)$");
  private static final Pattern NOTE_PATTERN = Pattern.compile(
      "^note\\s+(left|right|top|bottom)\\s+of\\s+([A-Za-z_][A-Za-z0-9_.]*)\\s*(?::(.*))?$");
  private static final Pattern END_NOTE_PATTERN = Pattern.compile("^end\\s*note$");

  private final List<Token> tokens = new ArrayList<>();

  private boolean inBlockComment;
  private int blockCommentLine;
  private boolean inNote;
  private int noteLine;
  private final StringBuilder noteText = new StringBuilder();

  private Lexer() {}

  /**
   * Split the source into tokens. The last token is always {@link TokenType#EOF}.
   */
  public static List<Token> tokenize(final String source) throws StateMachineException {
    final Lexer lexer = new Lexer();
    final String[] lines = (source == null ? "" : source).split("\\r?\\n", -1);
    for (int index = 0; index < lines.length; index++) {
      lexer.scanLine(lines[index], index + 1);
    }
    if (lexer.inBlockComment) {
      throw StatechartParser.syntaxError(lexer.blockCommentLine, 1,
          "unterminated block comment, expected '/");
    }
    if (lexer.inNote) {
      throw StatechartParser.syntaxError(lexer.noteLine, 1, "unterminated note, expected 'end note'");
    }
    lexer.tokens.add(new Token(TokenType.EOF, "", lines.length, 1));
    if (logger.isDebugEnabled()) {
      logger.debug("Tokenized " + lines.length + " lines into " + lexer.tokens.size() + " tokens");
    }
    return Collections.unmodifiableList(lexer.tokens);
  }

  private void scanLine(final String raw, final int line) throws StateMachineException {
    int indent = 0;
    while (indent < raw.length() && raw.charAt(indent) <= ' ') {
      indent++;
    }
    final String text = raw.trim();

    if (inBlockComment) {
      if (text.contains("'/")) {
        inBlockComment = false;
      }
      return;
    }
    if (inNote) {
      if (END_NOTE_PATTERN.matcher(text).matches()) {
        add(TokenType.NOTE_TEXT, noteText.toString(), noteLine, 1);
        add(TokenType.END_NOTE, text, line, indent + 1);
        add(TokenType.EOL, "", line, raw.length() + 1);
        inNote = false;
      } else {
        if (noteText.length() > 0) {
          noteText.append('\n');
        }
        noteText.append(text);
      }
      return;
    }
    if (text.isEmpty()) {
      return;
    }
    if (text.startsWith("/'")) {
      if (text.indexOf("'/", 2) < 0) {
        inBlockComment = true;
        blockCommentLine = line;
      }
      return;
    }

    if (text.charAt(0) == '\'') {
      final Matcher pragma = PRAGMA_PATTERN.matcher(text);
      if (pragma.matches()) {
        add(TokenType.PRAGMA, pragma.group(1), line, indent + 1 + text.indexOf('['));
        add(TokenType.PRAGMA_TEXT, pragma.group(2).trim(), line, indent + 1 + pragma.start(2));
      } else {
        add(TokenType.COMMENT, text.substring(1).trim(), line, indent + 1);
      }
    } else if (text.startsWith("@startuml")) {
      add(TokenType.START, text.substring("@startuml".length()).trim(), line, indent + 1);
    } else if (text.startsWith("@enduml")) {
      add(TokenType.END, "", line, indent + 1);
    } else if (DIRECTIVES.contains(firstWord(text))) {
      add(TokenType.DIRECTIVE, text, line, indent + 1);
    } else if (text.equals("--") || text.equals("||")) {
      add(TokenType.REGION_SEPARATOR, text, line, indent + 1);
    } else if (firstWord(text).equals("note")) {
      final Matcher note = NOTE_PATTERN.matcher(text);
      if (!note.matches()) {
        throw StatechartParser.syntaxError(line, indent + 1,
            "malformed note, expected 'note left|right|top|bottom of STATE'");
      }
      add(TokenType.NOTE_KEYWORD, note.group(1), line, indent + 1);
      add(TokenType.IDENTIFIER, note.group(2), line, indent + 1 + note.start(2));
      if (note.group(3) == null) {
        inNote = true;
        noteLine = line;
        noteText.setLength(0);
        return;
      }
      add(TokenType.NOTE_TEXT, note.group(3).trim(), line, indent + 1 + note.start(3));
    } else {
      scanStructure(text, line, indent);
    }
    add(TokenType.EOL, "", line, raw.length() + 1);
  }

  private void scanStructure(final String text, final int line, final int indent)
      throws StateMachineException {
    int pos = 0;
    while (pos < text.length()) {
      final char c = text.charAt(pos);
      final int column = indent + pos + 1;
      if (Character.isWhitespace(c)) {
        pos++;
        continue;
      }
      if (text.startsWith("[*]", pos)) {
        add(TokenType.INITIAL_MARKER, "[*]", line, column);
        pos += 3;
        continue;
      }
      final String arrow = arrowAt(text, pos);
      if (arrow != null) {
        add(TokenType.ARROW, arrow, line, column);
        pos += arrow.length();
      } else if (c == '{') {
        add(TokenType.LBRACE, "{", line, column);
        pos++;
      } else if (c == '}') {
        add(TokenType.RBRACE, "}", line, column);
        pos++;
      } else if (c == ':') {
        add(TokenType.COLON, ":", line, column);
        scanLabel(text, pos + 1, line, indent);
        return;
      } else if (Character.isLetter(c) || c == '_') {
        int end = pos + 1;
        while (end < text.length() && isIdentifierPart(text.charAt(end))) {
          end++;
        }
        final String word = text.substring(pos, end);
        final boolean keyword = word.equals("state") && tokensOnLine(line) == 0
            && end < text.length() && Character.isWhitespace(text.charAt(end));
        add(keyword ? TokenType.STATE_KEYWORD : TokenType.IDENTIFIER, word, line, column);
        pos = end;
      } else {
        throw StatechartParser.syntaxError(line, column, "unexpected character '" + c + "'");
      }
    }
  }

  private void scanLabel(final String text, final int from, final int line, final int indent)
      throws StateMachineException {
    int pos = from;
    while (pos < text.length()) {
      final char c = text.charAt(pos);
      final int column = indent + pos + 1;
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (text.startsWith(BLOCK_SEPARATOR, pos)) {
        add(TokenType.BLOCK_ACTION, text.substring(pos + BLOCK_SEPARATOR.length()).trim(), line,
            column);
        return;
      } else if (c == '/') {
        add(TokenType.ACTION, text.substring(pos + 1).trim(), line, column);
        return;
      } else if (c == '[' || c == '(') {
        final char close = c == '[' ? ']' : ')';
        final int end = matching(text, pos, c, close);
        if (end < 0) {
          throw StatechartParser.syntaxError(line, column,
              "unterminated " + (c == '[' ? "guard" : "event parameters") + ", expected '" + close
                  + "'");
        }
        add(c == '[' ? TokenType.GUARD : TokenType.PARAMETERS, text.substring(pos + 1, end).trim(),
            line, column);
        pos = end + 1;
      } else {
        int end = pos;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))
            && "[(/".indexOf(text.charAt(end)) < 0 && !text.startsWith(BLOCK_SEPARATOR, end)) {
          end++;
        }
        add(TokenType.WORD, text.substring(pos, end), line, column);
        pos = end;
      }
    }
  }

  private static int matching(final String text, final int open, final char opening,
      final char closing) {
    int depth = 0;
    for (int pos = open; pos < text.length(); pos++) {
      final char c = text.charAt(pos);
      if (c == opening) {
        depth++;
      } else if (c == closing) {
        depth--;
        if (depth == 0) {
          return pos;
        }
      }
    }
    return -1;
  }

  private static String arrowAt(final String text, final int pos) {
    for (String arrow : ARROWS) {
      if (text.startsWith(arrow, pos)) {
        return arrow;
      }
    }
    return null;
  }

  private static boolean isIdentifierPart(final char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }

  private static String firstWord(final String text) {
    int end = 0;
    while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
      end++;
    }
    return text.substring(0, end);
  }

  private int tokensOnLine(final int line) {
    int count = 0;
    for (int index = tokens.size() - 1; index >= 0 && tokens.get(index).getLine() == line; index--) {
      count++;
    }
    return count;
  }

  private void add(final TokenType type, final String text, final int line, final int column) {
    tokens.add(new Token(type, text, line, column));
  }
}
