package com.github.statecharts.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A (source, destination, event?, guard?, action?) tuple of the IR. Endpoints are state names of
 * the enclosing scope, or {@link #PSEUDO_STATE} for the initial/final marker.
 */
public final class ChartTransition {
  public static final String PSEUDO_STATE = "[*]";

  private final String source;
  private final String destination;
  private final Optional<ChartEvent> event;
  private final Optional<String> guard;
  private final Optional<ChartAction> action;
  private final String arrow;
  private final boolean internal;
  private final int line;

  private ChartTransition(final TransitionBuilder builder) {
    this.source = builder.source;
    this.destination = builder.destination;
    this.event = Optional.ofNullable(builder.event);
    this.guard = Optional.ofNullable(builder.guard);
    this.action = Optional.ofNullable(builder.action);
    this.arrow = builder.arrow;
    this.internal = builder.internal;
    this.line = builder.line;
  }

  public String getSource() {
    return source;
  }

  public String getDestination() {
    return destination;
  }

  public Optional<ChartEvent> getEvent() {
    return event;
  }

  /**
   * Grouping key of the triggering event, empty string for event-less transitions.
   */
  public String getEventKey() {
    return event.isPresent() ? event.get().getKey() : "";
  }

  public Optional<String> getGuard() {
    return guard;
  }

  public Optional<ChartAction> getAction() {
    return action;
  }

  /**
   * The arrow as written, source and destination are already swapped for reversed arrows.
   */
  public String getArrow() {
    return arrow;
  }

  /**
   * True for the self-transition derived from a {@code STATE : on event} clause.
   */
  public boolean isInternal() {
    return internal;
  }

  public boolean isInitial() {
    return PSEUDO_STATE.equals(source);
  }

  public boolean isFinal() {
    return PSEUDO_STATE.equals(destination);
  }

  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder().append(source).append(" -> ")
        .append(destination);
    if (event.isPresent() || guard.isPresent() || action.isPresent()) {
      builder.append(" :");
    }
    if (event.isPresent()) {
      builder.append(' ').append(event.get());
    }
    if (guard.isPresent()) {
      builder.append(" [").append(guard.get()).append(']');
    }
    if (action.isPresent()) {
      builder.append(' ').append(action.get());
    }
    return builder.toString();
  }

  public final static class TransitionBuilder {
    private String source;
    private String destination;
    private ChartEvent event;
    private String guard;
    private ChartAction action;
    private String arrow = "->";
    private boolean internal;
    private int line;

    public static TransitionBuilder newBuilder(final String source, final String destination) {
      return new TransitionBuilder(source, destination);
    }

    public TransitionBuilder event(final ChartEvent event) {
      this.event = event;
      return this;
    }

    public TransitionBuilder guard(final String guard) {
      this.guard = guard;
      return this;
    }

    public TransitionBuilder action(final ChartAction action) {
      this.action = action;
      return this;
    }

    public TransitionBuilder arrow(final String arrow) {
      this.arrow = arrow;
      return this;
    }

    public TransitionBuilder internal(final boolean internal) {
      this.internal = internal;
      return this;
    }

    public TransitionBuilder line(final int line) {
      this.line = line;
      return this;
    }

    public ChartTransition build() {
      return new ChartTransition(this);
    }

    private TransitionBuilder(final String source, final String destination) {
      this.source = Objects.requireNonNull(source, "source");
      this.destination = Objects.requireNonNull(destination, "destination");
    }
  }
}
