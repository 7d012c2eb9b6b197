package com.github.statecharts.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An event name made of one or more words, plus optional verbatim parameter text. How the words
 * are joined into an identifier is left to the emission backend; {@link #getKey()} is only the
 * grouping key used by transition tables.
 */
public final class ChartEvent {
  private final List<String> words;
  private final Optional<String> parameters;

  public ChartEvent(final List<String> words, final String parameters) {
    if (words == null || words.isEmpty()) {
      throw new IllegalArgumentException("An event needs at least one word");
    }
    this.words = Collections.unmodifiableList(new ArrayList<>(words));
    this.parameters = Optional.ofNullable(parameters);
  }

  public List<String> getWords() {
    return words;
  }

  /**
   * Text between the parentheses, without them. Empty parentheses yield an empty string.
   */
  public Optional<String> getParameters() {
    return parameters;
  }

  public String getKey() {
    return String.join(" ", words);
  }

  @Override
  public int hashCode() {
    return Objects.hash(words, parameters);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ChartEvent)) {
      return false;
    }
    ChartEvent other = (ChartEvent) obj;
    return words.equals(other.words) && parameters.equals(other.parameters);
  }

  @Override
  public String toString() {
    return getKey() + (parameters.isPresent() ? "(" + parameters.get() + ")" : "");
  }
}
