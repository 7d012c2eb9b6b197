package com.github.statecharts;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.github.statecharts.StateMachineException.Code;

/**
 * Binds the opaque guard and action texts of a chart to callables. Texts are matched verbatim
 * after trimming, so {@code [count > 0]} must be bound as {@code "count > 0"}.
 *
 * Lookups are strict: a text without a binding fails with {@link Code#UNBOUND_BINDING}.
 */
public final class ChartBindings {
  public static final ChartBindings NONE = BindingsBuilder.newBuilder().build();

  private final Map<String, Guard> guards;
  private final Map<String, Reaction> actions;

  private ChartBindings(final Map<String, Guard> guards, final Map<String, Reaction> actions) {
    this.guards = Collections.unmodifiableMap(new HashMap<>(guards));
    this.actions = Collections.unmodifiableMap(new HashMap<>(actions));
  }

  public Guard guard(final String text) throws StateMachineException {
    final Guard guard = guards.get(normalize(text));
    if (guard == null) {
      throw new StateMachineException(Code.UNBOUND_BINDING, "No guard bound to [" + text + "]");
    }
    return guard;
  }

  public Reaction action(final String text) throws StateMachineException {
    final Reaction action = actions.get(normalize(text));
    if (action == null) {
      throw new StateMachineException(Code.UNBOUND_BINDING, "No action bound to '" + text + "'");
    }
    return action;
  }

  public boolean hasGuard(final String text) {
    return guards.containsKey(normalize(text));
  }

  public boolean hasAction(final String text) {
    return actions.containsKey(normalize(text));
  }

  public Set<String> getGuardTexts() {
    return guards.keySet();
  }

  public Set<String> getActionTexts() {
    return actions.keySet();
  }

  private static String normalize(final String text) {
    return text == null ? "" : text.trim();
  }

  @Override
  public String toString() {
    return "ChartBindings [guards=" + guards.keySet() + ", actions=" + actions.keySet() + "]";
  }

  public final static class BindingsBuilder {
    private final Map<String, Guard> guards = new HashMap<>();
    private final Map<String, Reaction> actions = new HashMap<>();

    public static BindingsBuilder newBuilder() {
      return new BindingsBuilder();
    }

    public BindingsBuilder guard(final String text, final Guard guard) {
      guards.put(normalize(text), guard);
      return this;
    }

    /**
     * Bind a transition action or a state clause action (entry, exit, do, on).
     */
    public BindingsBuilder action(final String text, final Reaction action) {
      actions.put(normalize(text), action);
      return this;
    }

    public ChartBindings build() {
      return new ChartBindings(guards, actions);
    }

    private BindingsBuilder() {}
  }
}
