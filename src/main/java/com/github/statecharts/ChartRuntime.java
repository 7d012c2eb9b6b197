package com.github.statecharts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateHandlers.StateHandlersBuilder;
import com.github.statecharts.StateMachine.StateMachineBuilder;
import com.github.statecharts.StateMachineException.Code;
import com.github.statecharts.TransitionTable.TransitionTableBuilder;
import com.github.statecharts.model.ChartAction;
import com.github.statecharts.model.ChartState;
import com.github.statecharts.model.ChartTransition;
import com.github.statecharts.model.HandlerKind;
import com.github.statecharts.model.Statechart;
import com.github.statecharts.uml.StatechartValidator;

/**
 * Runs the top-level scope of a validated {@link Statechart} on a flat {@link StateMachine}.
 *
 * States keep their declaration order; a chart reaching {@code [*]} gets one extra terminal state
 * named {@code [*]}. Every event key becomes one {@link TransitionTable}, event-less transitions
 * live under the empty key. Nested regions are not executed.
 */
public final class ChartRuntime {
  private static final Logger logger = LogManager.getLogger(ChartRuntime.class.getSimpleName());

  private final Statechart chart;
  private final StateMachine machine;
  private final Map<String, TransitionTable> tables;

  private ChartRuntime(final Statechart chart, final StateMachine machine,
      final Map<String, TransitionTable> tables) {
    this.chart = chart;
    this.machine = machine;
    this.tables = Collections.unmodifiableMap(tables);
  }

  /**
   * Dispatch the table of the given event key. A key the chart never mentions is ignored.
   */
  public DispatchOutcome fire(final String eventKey) throws StateMachineException {
    final String key = eventKey == null ? "" : eventKey.trim();
    TransitionTable table = tables.get(key);
    if (table == null) {
      logger.debug("Event '" + key + "' is unknown to " + chart.getName());
      table = TransitionTableBuilder.newBuilder(key).build();
    }
    return machine.dispatch(table);
  }

  /**
   * Dispatch the event-less transitions of the current state, if any.
   */
  public DispatchOutcome fireEventless() throws StateMachineException {
    return fire("");
  }

  public Optional<TransitionTable> table(final String eventKey) {
    return Optional.ofNullable(tables.get(eventKey));
  }

  public Set<String> getEventKeys() {
    return tables.keySet();
  }

  public StateId currentState() {
    return machine.currentState();
  }

  public void reset() throws StateMachineException {
    machine.reset();
  }

  public StateMachine machine() {
    return machine;
  }

  public Statechart getChart() {
    return chart;
  }

  @Override
  public String toString() {
    return "ChartRuntime [chart=" + chart.getName() + ", events=" + tables.keySet()
        + ", currentState=" + machine.currentState().getName() + "]";
  }

  public final static class ChartRuntimeBuilder {
    private final Statechart chart;
    private ChartBindings bindings = ChartBindings.NONE;
    private StateMachineConfiguration config;

    public static ChartRuntimeBuilder newBuilder(final Statechart chart) {
      return new ChartRuntimeBuilder(chart);
    }

    public ChartRuntimeBuilder bindings(final ChartBindings bindings) {
      this.bindings = bindings;
      return this;
    }

    public ChartRuntimeBuilder config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public ChartRuntime build() throws StateMachineException {
      if (chart == null) {
        throw new StateMachineException(Code.INVALID_CHART, "Statechart is null");
      }
      if (bindings == null) {
        throw new StateMachineException(Code.UNBOUND_BINDING, "Chart bindings are null");
      }
      StatechartValidator.validate(chart).usableChart();
      checkBindings();

      final StateMachineBuilder machineBuilder =
          StateMachineBuilder.newBuilder().config(config);
      for (ChartState state : chart.getStates().values()) {
        machineBuilder.state(state.getName(), handlers(state));
      }
      if (chart.hasFinalState()) {
        machineBuilder.state(ChartTransition.PSEUDO_STATE);
      }
      machineBuilder.initialState(chart.getInitialState().get());
      final StateMachine machine = machineBuilder.build();

      final Map<String, StateId> ids = new LinkedHashMap<>();
      for (StateId id : machine.getStates()) {
        ids.put(id.getName(), id);
      }
      final Map<String, TransitionTable> tables = new LinkedHashMap<>();
      for (Map.Entry<String, List<ChartTransition>> event : chart.getTransitionsByEvent()
          .entrySet()) {
        final TransitionTableBuilder table = TransitionTableBuilder.newBuilder(event.getKey());
        for (ChartTransition transition : event.getValue()) {
          table.from(ids.get(transition.getSource()), transition(transition, ids));
        }
        tables.put(event.getKey(), table.build());
      }
      logger.info("Built runtime for " + chart.getName() + " with " + ids.size()
          + " states and events " + tables.keySet());
      return new ChartRuntime(chart, machine, tables);
    }

    /**
     * Fails naming every guard and action text of the executed scope that has no binding.
     */
    private void checkBindings() throws StateMachineException {
      final Set<String> missing = new LinkedHashSet<>();
      for (ChartTransition transition : chart.getTransitions()) {
        if (transition.isInitial()) {
          continue;
        }
        if (transition.getGuard().isPresent() && !bindings.hasGuard(transition.getGuard().get())) {
          missing.add("guard [" + transition.getGuard().get() + "] at line "
              + transition.getLine());
        }
        if (!transition.isInternal() && transition.getAction().isPresent()
            && !bindings.hasAction(transition.getAction().get().getText())) {
          missing.add("action '" + transition.getAction().get().getText() + "' at line "
              + transition.getLine());
        }
      }
      for (ChartState state : chart.getStates().values()) {
        for (HandlerKind kind : HandlerKind.values()) {
          final Optional<ChartAction> handler = state.getHandler(kind);
          if (handler.isPresent() && !bindings.hasAction(handler.get().getText())) {
            missing.add("'" + kind.getKeyword() + "' handler '" + handler.get().getText()
                + "' of state " + state.getName());
          }
        }
      }
      if (!missing.isEmpty()) {
        throw new StateMachineException(Code.UNBOUND_BINDING,
            "Statechart " + chart.getName() + " has unbound text: " + String.join(", ", missing));
      }
    }

    private Transition transition(final ChartTransition transition,
        final Map<String, StateId> ids) throws StateMachineException {
      StateId destination = StateId.sentinel(transition.getDestination());
      if (destination == null) {
        destination = ids.get(transition.getDestination());
      }
      final Guard guard =
          transition.getGuard().isPresent() ? bindings.guard(transition.getGuard().get()) : null;
      // the 'on' clause action runs as the internal handler, not as the transition action
      final Reaction action = !transition.isInternal() && transition.getAction().isPresent()
          ? bindings.action(transition.getAction().get().getText())
          : null;
      return new Transition(destination, guard, action);
    }

    private StateHandlers handlers(final ChartState state) throws StateMachineException {
      final StateHandlersBuilder builder = StateHandlersBuilder.newBuilder();
      final Optional<ChartAction> entry = state.getHandler(HandlerKind.ENTRY);
      if (entry.isPresent()) {
        builder.entry(bindings.action(entry.get().getText()));
      }
      final Optional<ChartAction> exit = state.getHandler(HandlerKind.EXIT);
      if (exit.isPresent()) {
        builder.exit(bindings.action(exit.get().getText()));
      }
      final Optional<ChartAction> activity = state.getHandler(HandlerKind.ACTIVITY);
      if (activity.isPresent()) {
        builder.activity(bindings.action(activity.get().getText()));
      }
      final Optional<ChartAction> internal = state.getHandler(HandlerKind.INTERNAL);
      if (internal.isPresent()) {
        builder.internal(bindings.action(internal.get().getText()));
      }
      return builder.build();
    }

    private ChartRuntimeBuilder(final Statechart chart) {
      this.chart = chart;
    }
  }
}
