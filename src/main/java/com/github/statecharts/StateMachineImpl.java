package com.github.statecharts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateMachineException.Code;

/**
 * A flat, deterministic Finite State Machine.
 *
 * Notes for users:<br>
 * 1. this FSM instance is thread-safe. Outer dispatches take the dispatch lock with a bounded
 * wait; reentrant dispatches from the owning thread only fill the pending slot.<br>
 *
 * 2. the pending slot is a single-entry work queue. A handler requesting a transition never runs
 * it; the outer dispatch drains the slot iteratively once the current step has finished. If a
 * step requests more than one transition, the last request wins.<br>
 *
 * 3. during a step the current state already reports the destination, so that reactions observe
 * the machine as transitioned. A refused guard restores the source state.<br>
 *
 * 4. when the source state of an accepted transition declares an internal-event handler, that
 * handler replaces exit and entry handling and the cycle stops, even if the destination differs
 * from the source.<br>
 */
final class StateMachineImpl implements StateMachine {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();

  private final StateMachineConfiguration config;
  private final List<StateId> states;
  private final List<StateHandlers> handlers;
  private final StateId initialState;
  private final StateMachineStatistics machineStats;

  private final ReentrantLock dispatchLock = new ReentrantLock(true);

  private volatile StateId currentState;

  // scratch state of the running dispatch cycle, only touched while holding dispatchLock
  private List<Transition> pending;

  StateMachineImpl(final StateMachineConfiguration config, final List<StateId> states,
      final List<StateHandlers> handlers, final StateId initialState)
      throws StateMachineException {
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG);
    }
    if (states == null || states.isEmpty() || handlers == null
        || handlers.size() != states.size()) {
      throw new StateMachineException(Code.INVALID_STATE,
          "State machine needs at least one state and one handler record per state");
    }
    for (int index = 0; index < states.size(); index++) {
      if (states.get(index).getIndex() != index) {
        throw new StateMachineException(Code.INVALID_STATE,
            "State " + states.get(index).getName() + " is not at its declared index " + index);
      }
    }
    this.config = config;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
    if (initialState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    if (initialState.isSentinel()) {
      throw new StateMachineException(Code.RESERVED_STATE,
          "Initial state cannot be " + initialState.getName());
    }
    if (!isDeclared(initialState)) {
      throw new StateMachineException(Code.UNKNOWN_STATE,
          "Initial state " + initialState.getName() + " is not declared");
    }
    this.initialState = initialState;
    this.currentState = initialState;
    this.machineStats = new StateMachineStatistics(machineId);
    logInfo(machineId, "Fired up state machine with " + states.size() + " states, initial state "
        + stringify(initialState));
  }

  @Override
  public DispatchOutcome dispatch(final TransitionTable transitions)
      throws StateMachineException {
    if (transitions == null) {
      throw new StateMachineException(Code.INVALID_TRANSITIONS, "Transition table is null");
    }
    if (dispatchLock.isHeldByCurrentThread()) {
      return enqueue(transitions);
    }
    try {
      if (dispatchLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          machineStats.dispatchCycles++;
          final List<Transition> candidates = transitions.candidatesFrom(currentState);
          if (candidates.isEmpty()) {
            logDebug(machineId, "Ignoring event " + transitions.getEvent() + " in state "
                + stringify(currentState));
            machineStats.ignoredEvents++;
            return DispatchOutcome.ignored(currentState, 0);
          }
          pending = candidates;
          return drain();
        } finally {
          pending = null;
          dispatchLock.unlock();
        }
      } else {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to dispatch event " + transitions.getEvent());
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  /**
   * Reentrant request coming from a guard, action or handler of the running cycle: memorize and
   * leave, the outer loop picks it up.
   */
  private DispatchOutcome enqueue(final TransitionTable transitions) {
    final List<Transition> candidates = transitions.candidatesFrom(currentState);
    if (candidates.isEmpty()) {
      logDebug(machineId, "Ignoring internal event " + transitions.getEvent() + " in state "
          + stringify(currentState));
      return DispatchOutcome.ignored(currentState, 0);
    }
    if (pending != null) {
      logWarning(machineId, "Internal event " + transitions.getEvent()
          + " replaces a transition request not yet processed");
    }
    pending = candidates;
    final StateId destination = candidates.get(0).getDestination();
    logDebug(machineId, "Internal event " + transitions.getEvent() + ". Memorize state "
        + stringify(destination));
    return DispatchOutcome.queued(destination);
  }

  /**
   * Drains the pending slot until it stays empty. Caller holds the dispatch lock.
   */
  private DispatchOutcome drain() throws StateMachineException {
    DispatchOutcome outcome = null;
    int steps = 0;
    while (pending != null) {
      final List<Transition> candidates = pending;
      pending = null;
      steps++;
      if (steps > machineStats.longestChain) {
        machineStats.longestChain = steps;
      }

      final StateId source = currentState;
      Transition accepted = null;
      for (final Transition candidate : candidates) {
        final StateId destination = candidate.getDestination();
        if (destination == StateId.CANNOT_HAPPEN) {
          return fatal(source, "Forbidden event in state " + stringify(source), steps);
        }
        if (destination == StateId.IGNORING_EVENT) {
          logDebug(machineId, "Ignoring external event in state " + stringify(source));
          machineStats.ignoredEvents++;
          return DispatchOutcome.ignored(source, steps);
        }
        if (!isDeclared(destination)) {
          return fatal(source, "Unknown state " + destination.getName(), steps);
        }
        // optimistic: reactions invoked from here on see the machine as transitioned
        currentState = destination;
        if (guardHolds(candidate, source)) {
          accepted = candidate;
          break;
        }
        logDebug(machineId, "Transition refused by the " + stringify(destination)
            + " guard. Stay in state " + stringify(source));
        currentState = source;
        // requests raised by a refused guard were resolved against its destination
        pending = null;
      }
      if (accepted == null) {
        pending = null;
        machineStats.rejectedTransitions++;
        return DispatchOutcome.rejected(source, steps);
      }

      final StateId destination = accepted.getDestination();
      logDebug(machineId, "Transitioning to new state " + stringify(destination));
      machineStats.transitions++;
      if (accepted.getAction().isPresent()) {
        logDebug(machineId, "Do the action of transition " + stringify(source) + " -> "
            + stringify(destination));
        react(accepted.getAction().get(), "action of transition " + stringify(source) + " -> "
            + stringify(destination));
      }

      final StateHandlers leaving = handlers.get(source.getIndex());
      final StateHandlers entering = handlers.get(destination.getIndex());
      if (leaving.getInternal().isPresent()) {
        logDebug(machineId, "Do the state " + stringify(source) + " 'on event' action");
        react(leaving.getInternal().get(), "'on event' handler of " + stringify(source));
        if (pending != null) {
          logDebug(machineId, "Dropping transition request raised by the 'on event' handler of "
              + stringify(source));
          pending = null;
        }
        return DispatchOutcome.transitioned(currentState, steps);
      } else if (!source.equals(destination)) {
        if (leaving.getExit().isPresent()) {
          logDebug(machineId, "Do the state " + stringify(source) + " 'on leaving' action");
          react(leaving.getExit().get(), "'on leaving' handler of " + stringify(source));
        }
        if (entering.getEntry().isPresent()) {
          logDebug(machineId, "Do the state " + stringify(destination) + " 'on entry' action");
          react(entering.getEntry().get(), "'on entry' handler of " + stringify(destination));
        }
      } else {
        logDebug(machineId, "Was previously in this state: no actions to perform");
      }
      outcome = DispatchOutcome.transitioned(currentState, steps);
    }
    return outcome;
  }

  private boolean guardHolds(final Transition transition, final StateId source)
      throws StateMachineException {
    if (!transition.getGuard().isPresent()) {
      return true;
    }
    try {
      return transition.getGuard().get().test();
    } catch (RuntimeException problem) {
      currentState = source;
      pending = null;
      logError(machineId, "Guard of transition " + stringify(source) + " -> "
          + stringify(transition.getDestination()) + " failed", problem);
      throw new StateMachineException(Code.TRANSITION_FAILURE, problem);
    }
  }

  private void react(final Reaction reaction, final String what) throws StateMachineException {
    try {
      reaction.run();
    } catch (RuntimeException problem) {
      pending = null;
      logError(machineId, "Failed to run the " + what, problem);
      throw new StateMachineException(Code.TRANSITION_FAILURE, problem);
    }
  }

  private DispatchOutcome fatal(final StateId current, final String reason, final int steps) {
    pending = null;
    machineStats.fatalAborts++;
    logError(machineId, reason);
    config.getFatalErrorHandler().onFatal(machineId, reason);
    return DispatchOutcome.fatal(current, reason, steps);
  }

  @Override
  public void reset() throws StateMachineException {
    if (dispatchLock.isHeldByCurrentThread()) {
      resetLocked();
      return;
    }
    try {
      if (dispatchLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          resetLocked();
        } finally {
          dispatchLock.unlock();
        }
      } else {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to reset state machine");
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  private void resetLocked() {
    currentState = initialState;
    pending = null;
    logInfo(machineId, "Reset state machine to " + stringify(initialState));
  }

  @Override
  public StateId currentState() {
    return currentState;
  }

  @Override
  public StateId initialState() {
    return initialState;
  }

  @Override
  public List<StateId> getStates() {
    return states;
  }

  @Override
  public StateHandlers getHandlers(final StateId state) throws StateMachineException {
    if (state == null || !isDeclared(state)) {
      throw new StateMachineException(Code.UNKNOWN_STATE, "State " + state + " is not declared");
    }
    return handlers.get(state.getIndex());
  }

  @Override
  public String stringify(final StateId state) {
    return state == null ? "null" : config.getStringifier().apply(state);
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  private boolean isDeclared(final StateId state) {
    final int index = state.getIndex();
    return index >= 0 && index < states.size() && states.get(index).equals(state);
  }

  private static void logError(final String machineId, final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logError(final String machineId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  private static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

}
