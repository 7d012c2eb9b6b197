package com.github.statecharts.uml;

/**
 * Lexical categories of the statechart notation.
 */
public enum TokenType {
  START("'@startuml'"),
  END("'@enduml'"),
  COMMENT("comment"),
  PRAGMA("pragma"),
  PRAGMA_TEXT("pragma text"),
  DIRECTIVE("skin directive"),
  STATE_KEYWORD("'state'"),
  NOTE_KEYWORD("'note'"),
  NOTE_TEXT("note text"),
  END_NOTE("'end note'"),
  IDENTIFIER("state name"),
  INITIAL_MARKER("'[*]'"),
  ARROW("arrow"),
  LBRACE("'{'"),
  RBRACE("'}'"),
  REGION_SEPARATOR("region separator"),
  COLON("':'"),
  WORD("word"),
  PARAMETERS("event parameters"),
  GUARD("guard"),
  ACTION("action"),
  BLOCK_ACTION("block action"),
  EOL("end of line"),
  EOF("end of input");

  private final String description;

  private TokenType(final String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
