package com.github.statecharts.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named state of one scope. Handler clauses are kept as written, duplicates included, so that
 * validation can report them; {@link #getHandler(HandlerKind)} returns the first one.
 *
 * A composite state owns one child scope per concurrent region: none for a simple state, one for a
 * plain composite, two or more for an orthogonal state.
 */
public final class ChartState {
  private final String name;
  private final int line;
  private final int declarations;
  private final Map<HandlerKind, List<ChartAction>> handlers;
  private final String comment;
  private final List<Statechart> regions;

  ChartState(final String name, final int line, final int declarations,
      final Map<HandlerKind, List<ChartAction>> handlers, final String comment,
      final List<Statechart> regions) {
    this.name = name;
    this.line = line;
    this.declarations = declarations;
    final Map<HandlerKind, List<ChartAction>> frozen = new EnumMap<>(HandlerKind.class);
    for (Map.Entry<HandlerKind, List<ChartAction>> entry : handlers.entrySet()) {
      frozen.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    this.handlers = Collections.unmodifiableMap(frozen);
    this.comment = comment;
    this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
  }

  public String getName() {
    return name;
  }

  /**
   * Line where the state first appeared.
   */
  public int getLine() {
    return line;
  }

  /**
   * How many times the state was declared with the {@code state} keyword in its scope.
   */
  public int getDeclarations() {
    return declarations;
  }

  public Optional<ChartAction> getHandler(final HandlerKind kind) {
    final List<ChartAction> clauses = handlers.get(kind);
    return clauses == null || clauses.isEmpty() ? Optional.<ChartAction>empty()
        : Optional.of(clauses.get(0));
  }

  public List<ChartAction> getHandlers(final HandlerKind kind) {
    final List<ChartAction> clauses = handlers.get(kind);
    return clauses == null ? Collections.<ChartAction>emptyList() : clauses;
  }

  public Optional<String> getComment() {
    return comment == null || comment.isEmpty() ? Optional.<String>empty() : Optional.of(comment);
  }

  public List<Statechart> getRegions() {
    return regions;
  }

  public boolean isComposite() {
    return !regions.isEmpty();
  }

  public boolean isOrthogonal() {
    return regions.size() > 1;
  }

  @Override
  public String toString() {
    return "ChartState [name=" + name + ", handlers=" + handlers.keySet() + ", regions="
        + regions.size() + "]";
  }
}
