package com.github.statecharts;

import java.util.Optional;

/**
 * Up to four optional bound callables of a state: entry, exit, activity and internal-event
 * handler. Owned by whoever built the machine; the engine only borrows them during dispatch.
 */
public final class StateHandlers {
  public static final StateHandlers NONE = StateHandlersBuilder.newBuilder().build();

  private final Optional<Reaction> entry;
  private final Optional<Reaction> exit;
  private final Optional<Reaction> activity;
  private final Optional<Reaction> internal;

  private StateHandlers(final Reaction entry, final Reaction exit, final Reaction activity,
      final Reaction internal) {
    this.entry = Optional.ofNullable(entry);
    this.exit = Optional.ofNullable(exit);
    this.activity = Optional.ofNullable(activity);
    this.internal = Optional.ofNullable(internal);
  }

  public Optional<Reaction> getEntry() {
    return entry;
  }

  public Optional<Reaction> getExit() {
    return exit;
  }

  /**
   * The "do" activity. Kept for the execution backend, the dispatch engine never invokes it.
   */
  public Optional<Reaction> getActivity() {
    return activity;
  }

  /**
   * When present, replaces exit and entry handling for every accepted transition leaving the state.
   */
  public Optional<Reaction> getInternal() {
    return internal;
  }

  @Override
  public String toString() {
    return "StateHandlers [entry=" + entry.isPresent() + ", exit=" + exit.isPresent()
        + ", activity=" + activity.isPresent() + ", internal=" + internal.isPresent() + "]";
  }

  public final static class StateHandlersBuilder {
    private Reaction entry;
    private Reaction exit;
    private Reaction activity;
    private Reaction internal;

    public static StateHandlersBuilder newBuilder() {
      return new StateHandlersBuilder();
    }

    public StateHandlersBuilder entry(final Reaction entry) {
      this.entry = entry;
      return this;
    }

    public StateHandlersBuilder exit(final Reaction exit) {
      this.exit = exit;
      return this;
    }

    public StateHandlersBuilder activity(final Reaction activity) {
      this.activity = activity;
      return this;
    }

    public StateHandlersBuilder internal(final Reaction internal) {
      this.internal = internal;
      return this;
    }

    public StateHandlers build() {
      return new StateHandlers(entry, exit, activity, internal);
    }

    private StateHandlersBuilder() {}
  }
}
