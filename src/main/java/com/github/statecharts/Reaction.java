package com.github.statecharts;

/**
 * Bound side effect: a transition action or a state's entry, exit, activity or internal-event
 * handler. A reaction may itself call {@link StateMachine#dispatch(TransitionTable)}; such calls
 * are queued and drained by the outer dispatch instead of recursing.
 */
@FunctionalInterface
public interface Reaction {
  void run();
}
