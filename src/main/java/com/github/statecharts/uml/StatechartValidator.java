package com.github.statecharts.uml;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateId;
import com.github.statecharts.model.ChartState;
import com.github.statecharts.model.ChartTransition;
import com.github.statecharts.model.HandlerKind;
import com.github.statecharts.model.Statechart;

/**
 * Checks a {@link Statechart} and every nested scope, accumulating diagnostics instead of stopping
 * at the first violation.
 *
 * Errors make the chart unusable: duplicate declarations, reserved names used as states, a scope
 * without exactly one initial marker, transition endpoints not declared in their scope and more
 * than one handler of a kind on a state. Warnings flag charts that run but are likely wrong.
 */
public final class StatechartValidator {
  private static final Logger logger =
      LogManager.getLogger(StatechartValidator.class.getSimpleName());

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private StatechartValidator() {}

  public static ValidationReport validate(final Statechart chart) {
    final StatechartValidator validator = new StatechartValidator();
    validator.checkScope(chart, true);
    final ValidationReport report = new ValidationReport(chart, validator.diagnostics);
    if (logger.isDebugEnabled()) {
      logger.debug("Validated " + chart.getName() + ", " + report.getErrors().size()
          + " error(s), " + report.getWarnings().size() + " warning(s)");
    }
    return report;
  }

  private void checkScope(final Statechart scope, final boolean topLevel) {
    checkStates(scope);
    checkInitialMarkers(scope);
    checkEndpoints(scope);
    if (topLevel) {
      checkEvents(scope);
    }
    checkIncoming(scope);
    checkDeterminism(scope);
    checkEventlessCycles(scope);
    for (Statechart child : scope.getChildren()) {
      checkScope(child, false);
    }
  }

  private void checkStates(final Statechart scope) {
    for (ChartState state : scope.getStates().values()) {
      if (state.getDeclarations() > 1) {
        error(state.getLine(), "State " + state.getName() + " is declared "
            + state.getDeclarations() + " times in " + describe(scope));
      }
      if (StateId.isReserved(state.getName())) {
        error(state.getLine(),
            "State name " + state.getName() + " is reserved and cannot be declared");
      }
      for (HandlerKind kind : HandlerKind.values()) {
        final int count = state.getHandlers(kind).size();
        if (count > 1) {
          error(state.getLine(), "State " + state.getName() + " has " + count + " '"
              + kind.getKeyword() + "' handlers, at most one is allowed");
        }
      }
    }
  }

  private void checkInitialMarkers(final Statechart scope) {
    final List<ChartTransition> initials = scope.getInitialTransitions();
    if (initials.isEmpty()) {
      error(0, "Missing initial state in " + describe(scope));
    } else if (initials.size() > 1) {
      error(initials.get(1).getLine(), describe(scope) + " has " + initials.size()
          + " initial markers, exactly one is allowed");
    }
    for (ChartTransition initial : initials) {
      final String destination = initial.getDestination();
      if (ChartTransition.PSEUDO_STATE.equals(destination)
          || StateId.sentinel(destination) != null) {
        error(initial.getLine(), "Initial state of " + describe(scope) + " cannot be "
            + destination);
      }
    }
  }

  private void checkEndpoints(final Statechart scope) {
    for (ChartTransition transition : scope.getTransitions()) {
      final String source = transition.getSource();
      if (!ChartTransition.PSEUDO_STATE.equals(source) && !scope.getStates().containsKey(source)) {
        error(transition.getLine(),
            "Source state " + source + " is not declared in " + describe(scope));
      }
      final String destination = transition.getDestination();
      if (!ChartTransition.PSEUDO_STATE.equals(destination)
          && StateId.sentinel(destination) == null
          && !scope.getStates().containsKey(destination)) {
        error(transition.getLine(),
            "Destination state " + destination + " is not declared in " + describe(scope));
      }
    }
  }

  private void checkEvents(final Statechart scope) {
    for (ChartTransition transition : scope.getTransitions()) {
      if (!transition.getEventKey().isEmpty()) {
        return;
      }
    }
    warning(0, describe(scope) + " shall have at least one event");
  }

  private void checkIncoming(final Statechart scope) {
    final Set<String> reached = new HashSet<>();
    for (ChartTransition transition : scope.getTransitions()) {
      reached.add(transition.getDestination());
    }
    for (ChartState state : scope.getStates().values()) {
      if (!reached.contains(state.getName())) {
        warning(state.getLine(),
            "State " + state.getName() + " shall have at least one incoming transition");
      }
    }
  }

  private void checkDeterminism(final Statechart scope) {
    final Map<String, List<ChartTransition>> outgoing = new LinkedHashMap<>();
    for (ChartTransition transition : scope.getTransitions()) {
      if (!transition.isInitial() && !transition.isInternal()) {
        outgoing.computeIfAbsent(transition.getSource(), key -> new ArrayList<>())
            .add(transition);
      }
    }
    for (Map.Entry<String, List<ChartTransition>> entry : outgoing.entrySet()) {
      if (entry.getValue().size() <= 1) {
        continue;
      }
      for (ChartTransition transition : entry.getValue()) {
        if (transition.getEventKey().isEmpty() && !transition.getGuard().isPresent()) {
          warning(transition.getLine(), "State " + entry.getKey()
              + " has several outgoing transitions while the one to "
              + transition.getDestination()
              + " has neither event nor guard, the choice is non-deterministic");
        }
      }
    }
  }

  /**
   * Reports the first cycle of two or more states joined only by event-less transitions.
   */
  private void checkEventlessCycles(final Statechart scope) {
    final Map<String, Set<String>> graph = new LinkedHashMap<>();
    for (ChartTransition transition : scope.getTransitions()) {
      if (transition.isInitial() || transition.isInternal()
          || !transition.getEventKey().isEmpty()
          || transition.getSource().equals(transition.getDestination())) {
        continue;
      }
      graph.computeIfAbsent(transition.getSource(), key -> new LinkedHashSet<>())
          .add(transition.getDestination());
    }
    final Map<String, Integer> marks = new HashMap<>();
    for (String start : graph.keySet()) {
      final List<String> path = new ArrayList<>();
      final List<String> cycle = findCycle(start, graph, marks, path);
      if (cycle != null) {
        warning(0, describe(scope) + " has an infinite loop " + String.join(" -> ", cycle)
            + ", add an event");
        return;
      }
    }
  }

  // marks: 1 on the current path, 2 fully explored
  private static List<String> findCycle(final String state, final Map<String, Set<String>> graph,
      final Map<String, Integer> marks, final List<String> path) {
    final Integer mark = marks.get(state);
    if (mark != null) {
      if (mark == 1) {
        final List<String> cycle = new ArrayList<>(path.subList(path.indexOf(state), path.size()));
        cycle.add(state);
        return cycle;
      }
      return null;
    }
    marks.put(state, 1);
    path.add(state);
    final Set<String> next = graph.get(state);
    if (next != null) {
      for (String destination : next) {
        final List<String> cycle = findCycle(destination, graph, marks, path);
        if (cycle != null) {
          return cycle;
        }
      }
    }
    path.remove(path.size() - 1);
    marks.put(state, 2);
    return null;
  }

  private static String describe(final Statechart scope) {
    return "scope " + (scope.getName().isEmpty() ? "<unnamed>" : scope.getName());
  }

  private void error(final int line, final String message) {
    diagnostics.add(Diagnostic.error(line, 0, message));
  }

  private void warning(final int line, final String message) {
    diagnostics.add(Diagnostic.warning(line, message));
  }
}
