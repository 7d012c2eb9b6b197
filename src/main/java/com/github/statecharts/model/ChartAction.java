package com.github.statecharts.model;

import java.util.Objects;

/**
 * Opaque statement text of a transition or a state clause, kept exactly as written.
 */
public final class ChartAction {

  public static enum Form {
    // "/ text" up to the end of the line
    SINGLE_LINE,
    // "\n--\n text", the PlantUML label separator
    BLOCK;
  }

  private final String text;
  private final Form form;

  public ChartAction(final String text, final Form form) {
    this.text = Objects.requireNonNull(text, "text");
    this.form = Objects.requireNonNull(form, "form");
  }

  public static ChartAction singleLine(final String text) {
    return new ChartAction(text, Form.SINGLE_LINE);
  }

  public static ChartAction block(final String text) {
    return new ChartAction(text, Form.BLOCK);
  }

  public String getText() {
    return text;
  }

  public Form getForm() {
    return form;
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, form);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ChartAction)) {
      return false;
    }
    ChartAction other = (ChartAction) obj;
    return text.equals(other.text) && form == other.form;
  }

  @Override
  public String toString() {
    return form == Form.SINGLE_LINE ? "/ " + text : "\\n--\\n" + text;
  }
}
