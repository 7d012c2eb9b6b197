package com.github.statecharts;

/**
 * This object encapsulates the result of one {@link StateMachine#dispatch(TransitionTable)} call.
 *
 * Only {@link Kind#FATAL} denotes an error and it is only ever observed when the configured
 * {@link FatalErrorHandler} returns instead of terminating the process. Ignored and rejected
 * events are ordinary, recoverable outcomes.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class DispatchOutcome {

  public static enum Kind {
    // an accepted transition ran; the machine now sits in {@link #getState()}
    TRANSITIONED,
    // no transition from the current state, or an explicit IGNORING_EVENT destination
    IGNORED,
    // every guard refused; state unchanged since the start of the refused step
    REJECTED,
    // reentrant request recorded for the running dispatch cycle to drain
    QUEUED,
    // CANNOT_HAPPEN or unknown destination reached
    FATAL;
  }

  private final Kind kind;
  private final StateId state;
  private final String reason;
  private final int steps;

  private DispatchOutcome(final Kind kind, final StateId state, final String reason,
      final int steps) {
    this.kind = kind;
    this.state = state;
    this.reason = reason;
    this.steps = steps;
  }

  static DispatchOutcome transitioned(final StateId to, final int steps) {
    return new DispatchOutcome(Kind.TRANSITIONED, to, null, steps);
  }

  static DispatchOutcome ignored(final StateId current, final int steps) {
    return new DispatchOutcome(Kind.IGNORED, current, null, steps);
  }

  static DispatchOutcome rejected(final StateId current, final int steps) {
    return new DispatchOutcome(Kind.REJECTED, current, null, steps);
  }

  static DispatchOutcome queued(final StateId destination) {
    return new DispatchOutcome(Kind.QUEUED, destination, null, 0);
  }

  static DispatchOutcome fatal(final StateId current, final String reason, final int steps) {
    return new DispatchOutcome(Kind.FATAL, current, reason, steps);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The state the machine is in once the cycle ended. For {@link Kind#QUEUED} this is the
   * requested destination instead.
   */
  public StateId getState() {
    return state;
  }

  public String getReason() {
    return reason;
  }

  /**
   * Number of drained steps, including the ones triggered by reentrant requests.
   */
  public int getSteps() {
    return steps;
  }

  public boolean isTransitioned() {
    return kind == Kind.TRANSITIONED;
  }

  @Override
  public String toString() {
    return "DispatchOutcome [kind=" + kind + ", state=" + (state == null ? null : state.getName())
        + ", reason=" + reason + ", steps=" + steps + "]";
  }
}
