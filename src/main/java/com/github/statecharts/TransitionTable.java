package com.github.statecharts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.statecharts.StateMachineException.Code;

/**
 * The transitions applicable to one event, keyed by source state. This is one column of the
 * sparse states/events matrix: a missing row means the event is ignored in that state.
 *
 * A source may hold several guarded alternatives; they are tried in insertion order and the first
 * one whose guard holds is taken.
 */
public final class TransitionTable {
  private final String event;
  // K=source state, V=alternatives in declaration order
  private final Map<StateId, List<Transition>> rows;

  private TransitionTable(final String event, final Map<StateId, List<Transition>> rows) {
    this.event = event;
    this.rows = rows;
  }

  public String getEvent() {
    return event;
  }

  /**
   * Candidates leaving the given state, empty if the event is ignored there.
   */
  public List<Transition> candidatesFrom(final StateId source) {
    final List<Transition> candidates = rows.get(source);
    return candidates == null ? Collections.<Transition>emptyList() : candidates;
  }

  public Map<StateId, List<Transition>> getRows() {
    return rows;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override
  public String toString() {
    return "TransitionTable [event=" + event + ", rows=" + rows + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build transition tables.
   */
  public final static class TransitionTableBuilder {
    private final String event;
    private final Map<StateId, List<Transition>> rows = new LinkedHashMap<>();

    public static TransitionTableBuilder newBuilder(final String event) {
      return new TransitionTableBuilder(event);
    }

    public TransitionTableBuilder from(final StateId source, final Transition transition)
        throws StateMachineException {
      if (source == null || source.isSentinel()) {
        throw new StateMachineException(Code.INVALID_TRANSITIONS,
            "Transition source must be a declared state, found " + source);
      }
      if (transition == null) {
        throw new StateMachineException(Code.INVALID_TRANSITIONS);
      }
      rows.computeIfAbsent(source, key -> new ArrayList<>()).add(transition);
      return this;
    }

    public TransitionTableBuilder from(final StateId source, final StateId destination)
        throws StateMachineException {
      return from(source, Transition.to(destination));
    }

    public TransitionTable build() {
      final Map<StateId, List<Transition>> frozen = new LinkedHashMap<>();
      for (Map.Entry<StateId, List<Transition>> row : rows.entrySet()) {
        frozen.put(row.getKey(), Collections.unmodifiableList(new ArrayList<>(row.getValue())));
      }
      return new TransitionTable(event == null ? "" : event, Collections.unmodifiableMap(frozen));
    }

    private TransitionTableBuilder(final String event) {
      this.event = event;
    }
  }
}
