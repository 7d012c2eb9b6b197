package com.github.statecharts.model;

/**
 * The per-state clauses that bind a reaction. A state holds at most one of each kind.
 */
public enum HandlerKind {
  ENTRY("entry"),
  EXIT("exit"),
  ACTIVITY("do"),
  INTERNAL("on");

  private final String keyword;

  private HandlerKind(final String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }
}
