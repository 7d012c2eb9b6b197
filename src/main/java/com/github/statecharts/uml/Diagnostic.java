package com.github.statecharts.uml;

/**
 * A located message produced by the parser or the validator. Lines and columns are 1-based, a zero
 * column means the whole line.
 */
public final class Diagnostic {

  public static enum Severity {
    // makes the chart unusable
    ERROR,
    // informational, the chart stays usable
    WARNING;
  }

  private final Severity severity;
  private final int line;
  private final int column;
  private final String message;

  public Diagnostic(final Severity severity, final int line, final int column,
      final String message) {
    this.severity = severity;
    this.line = line;
    this.column = column;
    this.message = message;
  }

  public static Diagnostic error(final int line, final int column, final String message) {
    return new Diagnostic(Severity.ERROR, line, column, message);
  }

  public static Diagnostic warning(final int line, final String message) {
    return new Diagnostic(Severity.WARNING, line, 0, message);
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return line + ":" + column + ": " + severity.name().toLowerCase() + ": " + message;
  }
}
