package com.github.statecharts.model;

import java.util.Objects;

/**
 * A verbatim text fragment tagged by kind.
 */
public final class Pragma {
  private final PragmaKind kind;
  private final String text;
  private final int line;

  public Pragma(final PragmaKind kind, final String text, final int line) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.text = text == null ? "" : text;
    this.line = line;
  }

  public PragmaKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return "'[" + kind.getTag() + "] " + text;
  }
}
