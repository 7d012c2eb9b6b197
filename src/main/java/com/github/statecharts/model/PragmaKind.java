package com.github.statecharts.model;

/**
 * Tags of the {@code '[kind] text} pragma comments. Their text is never interpreted, it is handed
 * verbatim to the emission backend at the location the kind names.
 */
public enum PragmaKind {
  // class level comment
  BRIEF("brief"),
  // code placed before the generated machine
  HEADER("header"),
  // code placed after the generated machine
  FOOTER("footer"),
  // extra constructor parameter
  PARAM("param"),
  // constructor initializer list entry
  CONS("cons"),
  // statement run by the constructor and by reset
  INIT("init"),
  // extra member code
  CODE("code"),
  // code for the generated unit tests
  TEST("test");

  private final String tag;

  private PragmaKind(final String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Lookup by tag, null when the tag is unknown.
   */
  public static PragmaKind fromTag(final String tag) {
    for (PragmaKind kind : values()) {
      if (kind.tag.equals(tag)) {
        return kind;
      }
    }
    return null;
  }
}
