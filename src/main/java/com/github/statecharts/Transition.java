package com.github.statecharts;

import java.util.Optional;

import com.github.statecharts.StateMachineException.Code;

/**
 * A (destination, guard, action) tuple. The source state is the key under which the transition is
 * registered in a {@link TransitionTable}. The destination may be one of the {@link StateId}
 * sentinels.
 */
public final class Transition {
  private final StateId destination;
  private final Optional<Guard> guard;
  private final Optional<Reaction> action;

  public Transition(final StateId destination, final Guard guard, final Reaction action)
      throws StateMachineException {
    if (destination == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    this.destination = destination;
    this.guard = Optional.ofNullable(guard);
    this.action = Optional.ofNullable(action);
  }

  public static Transition to(final StateId destination) throws StateMachineException {
    return new Transition(destination, null, null);
  }

  public StateId getDestination() {
    return destination;
  }

  public Optional<Guard> getGuard() {
    return guard;
  }

  public Optional<Reaction> getAction() {
    return action;
  }

  @Override
  public String toString() {
    return "Transition [destination=" + destination.getName() + ", guarded=" + guard.isPresent()
        + ", action=" + action.isPresent() + "]";
  }
}
