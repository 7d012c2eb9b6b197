package com.github.statecharts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A flat, deterministic Finite State Machine reacting to events supplied as transition tables.
 *
 * Notes for users:<br>
 * 1. the machine holds a single current state. Composite and concurrent structure of a chart is
 * not executed here.<br>
 *
 * 2. an event is a {@link TransitionTable}: the transitions applicable to it keyed by source
 * state. The machine never advances on its own, every step starts from a dispatch call.<br>
 *
 * 3. guards, actions and state handlers may dispatch further events. Those reentrant requests are
 * queued and drained iteratively by the outer dispatch, so the stack depth stays constant however
 * long the chain of reactions is.<br>
 *
 * 4. an instance may be shared across threads; outer dispatches are serialized by a per-machine
 * lock. Reentrant dispatches from the owning thread never block.<br>
 *
 * 5. reaching {@link StateId#CANNOT_HAPPEN} or an undeclared destination is an authoring defect
 * and aborts the process through the configured {@link FatalErrorHandler}.<br>
 */
public interface StateMachine {

  /**
   * React to an event. Returns once the dispatch cycle reached quiescence, or immediately with
   * {@link DispatchOutcome.Kind#QUEUED} when called from a handler of a running cycle.
   */
  DispatchOutcome dispatch(final TransitionTable transitions) throws StateMachineException;

  /**
   * Restore the initial state and drop any queued reentrant request.
   */
  void reset() throws StateMachineException;

  /**
   * Read/report the current state of the state machine. No side effects.
   */
  StateId currentState();

  StateId initialState();

  /**
   * States of this machine, in table order.
   */
  List<StateId> getStates();

  StateHandlers getHandlers(final StateId state) throws StateMachineException;

  /**
   * Render a state with the configured stringifier.
   */
  String stringify(final StateId state);

  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  StateMachineConfiguration getConfiguration();

  StateMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder {
    private StateMachineConfiguration config;
    private final Map<String, StateHandlers> states = new LinkedHashMap<>();
    private String initialState;

    public static StateMachineBuilder newBuilder() {
      return new StateMachineBuilder();
    }

    public StateMachineBuilder config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineBuilder state(final String name) {
      return state(name, StateHandlers.NONE);
    }

    public StateMachineBuilder state(final String name, final StateHandlers handlers) {
      this.states.put(name, handlers == null ? StateHandlers.NONE : handlers);
      return this;
    }

    public StateMachineBuilder initialState(final String initialState) {
      this.initialState = initialState;
      return this;
    }

    public StateMachine build() throws StateMachineException {
      final List<StateId> ids = new ArrayList<>(states.size());
      final List<StateHandlers> handlers = new ArrayList<>(states.size());
      StateId initial = null;
      int index = 0;
      for (final Map.Entry<String, StateHandlers> state : states.entrySet()) {
        final StateId id = StateId.of(index++, state.getKey());
        ids.add(id);
        handlers.add(state.getValue());
        if (id.getName().equals(initialState == null ? null : initialState.trim())) {
          initial = id;
        }
      }
      if (initial == null && initialState != null && StateId.isReserved(initialState.trim())) {
        throw new StateMachineException(StateMachineException.Code.RESERVED_STATE,
            "Initial state " + initialState + " is reserved");
      }
      if (initial == null) {
        throw new StateMachineException(StateMachineException.Code.UNKNOWN_STATE,
            "Initial state " + initialState + " is not declared");
      }
      return new StateMachineImpl(config == null ? StateMachineConfiguration.defaults() : config,
          ids, handlers, initial);
    }

    private StateMachineBuilder() {}
  }

}
