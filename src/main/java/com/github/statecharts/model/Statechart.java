package com.github.statecharts.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One scope of a statechart: the whole chart, a composite state's body or one concurrent region of
 * it. States keep their insertion order. Instances are immutable; they are produced by a
 * {@link ScopeBuilder}.
 */
public final class Statechart {
  private final String name;
  private final Map<String, ChartState> states;
  private final List<ChartTransition> transitions;
  private final List<Pragma> pragmas;

  private Statechart(final String name, final Map<String, ChartState> states,
      final List<ChartTransition> transitions, final List<Pragma> pragmas) {
    this.name = name;
    this.states = Collections.unmodifiableMap(states);
    this.transitions = Collections.unmodifiableList(transitions);
    this.pragmas = Collections.unmodifiableList(pragmas);
  }

  public String getName() {
    return name;
  }

  public Map<String, ChartState> getStates() {
    return states;
  }

  public Optional<ChartState> getState(final String stateName) {
    return Optional.ofNullable(states.get(stateName));
  }

  /**
   * Every transition of this scope in declaration order, initial-marker transitions included.
   */
  public List<ChartTransition> getTransitions() {
    return transitions;
  }

  public List<ChartTransition> getInitialTransitions() {
    final List<ChartTransition> initials = new ArrayList<>();
    for (ChartTransition transition : transitions) {
      if (transition.isInitial()) {
        initials.add(transition);
      }
    }
    return initials;
  }

  /**
   * Destination of the first initial-marker transition.
   */
  public Optional<String> getInitialState() {
    for (ChartTransition transition : transitions) {
      if (transition.isInitial()) {
        return Optional.of(transition.getDestination());
      }
    }
    return Optional.empty();
  }

  public boolean hasFinalState() {
    for (ChartTransition transition : transitions) {
      if (transition.isFinal()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Transitions leaving the given state, initial-marker transitions excluded.
   */
  public List<ChartTransition> getTransitionsFrom(final String source) {
    final List<ChartTransition> outgoing = new ArrayList<>();
    for (ChartTransition transition : transitions) {
      if (!transition.isInitial() && transition.getSource().equals(source)) {
        outgoing.add(transition);
      }
    }
    return outgoing;
  }

  /**
   * Non-initial transitions grouped by event key, keys and transitions in declaration order.
   * Event-less transitions sit under the empty key.
   */
  public Map<String, List<ChartTransition>> getTransitionsByEvent() {
    final Map<String, List<ChartTransition>> byEvent = new LinkedHashMap<>();
    for (ChartTransition transition : transitions) {
      if (!transition.isInitial()) {
        byEvent.computeIfAbsent(transition.getEventKey(), key -> new ArrayList<>())
            .add(transition);
      }
    }
    return byEvent;
  }

  public List<Pragma> getPragmas() {
    return pragmas;
  }

  /**
   * Pragma texts of one kind, in declaration order.
   */
  public List<String> getPragmas(final PragmaKind kind) {
    final List<String> texts = new ArrayList<>();
    for (Pragma pragma : pragmas) {
      if (pragma.getKind() == kind) {
        texts.add(pragma.getText());
      }
    }
    return texts;
  }

  /**
   * Child scopes of every composite state of this scope, one per region.
   */
  public List<Statechart> getChildren() {
    final List<Statechart> children = new ArrayList<>();
    for (ChartState state : states.values()) {
      children.addAll(state.getRegions());
    }
    return children;
  }

  @Override
  public String toString() {
    return "Statechart [name=" + name + ", states=" + states.keySet() + ", transitions="
        + transitions.size() + ", pragmas=" + pragmas.size() + "]";
  }

  /**
   * Mutable counterpart of one scope, filled while walking a parse tree or by hand.
   */
  public final static class ScopeBuilder {
    private final String name;
    private final Map<String, StateDraft> states = new LinkedHashMap<>();
    private final List<ChartTransition> transitions = new ArrayList<>();
    private final List<Pragma> pragmas = new ArrayList<>();

    public static ScopeBuilder newBuilder(final String name) {
      return new ScopeBuilder(name);
    }

    /**
     * Explicit declaration with the {@code state} keyword. Counted, so duplicates can be reported.
     */
    public ScopeBuilder declareState(final String stateName, final int line) {
      draft(stateName, line).declarations++;
      return this;
    }

    /**
     * Implicit declaration: referencing a state creates it if it does not exist yet.
     */
    public ScopeBuilder touchState(final String stateName, final int line) {
      if (!ChartTransition.PSEUDO_STATE.equals(stateName)) {
        draft(stateName, line);
      }
      return this;
    }

    public boolean hasState(final String stateName) {
      return states.containsKey(stateName);
    }

    public ScopeBuilder handler(final String stateName, final HandlerKind kind,
        final ChartAction action, final int line) {
      draft(stateName, line).handlers.computeIfAbsent(kind, key -> new ArrayList<>())
          .add(action);
      return this;
    }

    public ScopeBuilder comment(final String stateName, final String comment, final int line) {
      final StateDraft draft = draft(stateName, line);
      if (comment != null && !comment.isEmpty()) {
        if (draft.comment.length() > 0) {
          draft.comment.append('\n');
        }
        draft.comment.append(comment);
      }
      return this;
    }

    /**
     * Open a new child scope (region) under the given state.
     */
    public ScopeBuilder region(final String stateName, final int line) {
      final StateDraft draft = draft(stateName, line);
      final ScopeBuilder child =
          new ScopeBuilder(stateName + (draft.regions.isEmpty() ? "" : "#" + draft.regions.size()));
      draft.regions.add(child);
      return child;
    }

    public ScopeBuilder transition(final ChartTransition transition) {
      transitions.add(transition);
      return this;
    }

    public ScopeBuilder pragma(final Pragma pragma) {
      pragmas.add(pragma);
      return this;
    }

    public Statechart build() {
      final Map<String, ChartState> built = new LinkedHashMap<>();
      for (StateDraft draft : states.values()) {
        final List<Statechart> regions = new ArrayList<>(draft.regions.size());
        for (ScopeBuilder region : draft.regions) {
          regions.add(region.build());
        }
        built.put(draft.name, new ChartState(draft.name, draft.line, draft.declarations,
            draft.handlers, draft.comment.toString(), regions));
      }
      return new Statechart(name, built, new ArrayList<>(transitions), new ArrayList<>(pragmas));
    }

    private StateDraft draft(final String stateName, final int line) {
      StateDraft draft = states.get(stateName);
      if (draft == null) {
        draft = new StateDraft(stateName, line);
        states.put(stateName, draft);
      }
      return draft;
    }

    private ScopeBuilder(final String name) {
      this.name = name == null ? "" : name;
    }
  }

  private final static class StateDraft {
    private final String name;
    private final int line;
    private int declarations;
    private final Map<HandlerKind, List<ChartAction>> handlers = new EnumMap<>(HandlerKind.class);
    private final StringBuilder comment = new StringBuilder();
    private final List<ScopeBuilder> regions = new ArrayList<>();

    private StateDraft(final String name, final int line) {
      this.name = name;
      this.line = line;
    }
  }
}
