package com.github.statecharts.uml;

/**
 * A lexeme with its position. The text of guards, parameters and actions is the payload only,
 * delimiters stripped and surrounding blanks trimmed.
 */
public final class Token {
  private final TokenType type;
  private final String text;
  private final int line;
  private final int column;

  public Token(final TokenType type, final String text, final int line, final int column) {
    this.type = type;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public TokenType getType() {
    return type;
  }

  public String getText() {
    return text;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public boolean is(final TokenType expected) {
    return type == expected;
  }

  @Override
  public String toString() {
    return type + "(" + text + ")@" + line + ":" + column;
  }
}
