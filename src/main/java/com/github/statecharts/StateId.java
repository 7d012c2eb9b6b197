package com.github.statecharts;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.statecharts.StateMachineException.Code;

/**
 * This object represents the immutable identity of a state: its position in the machine's state
 * table and its name.
 *
 * Two sentinels exist outside of any machine's table and may only appear as transition
 * destinations: {@link #IGNORING_EVENT} (no reaction) and {@link #CANNOT_HAPPEN} (forbidden,
 * aborts the process). The name {@code MAX_STATES} is also reserved, it stands for the implicit
 * state-count bound.
 */
public final class StateId {
  public static final String IGNORING_EVENT_NAME = "IGNORING_EVENT";
  public static final String CANNOT_HAPPEN_NAME = "CANNOT_HAPPEN";
  public static final String MAX_STATES_NAME = "MAX_STATES";

  public static final List<String> RESERVED_NAMES = Collections
      .unmodifiableList(Arrays.asList(IGNORING_EVENT_NAME, CANNOT_HAPPEN_NAME, MAX_STATES_NAME));

  public static final StateId IGNORING_EVENT = new StateId(-1, IGNORING_EVENT_NAME);
  public static final StateId CANNOT_HAPPEN = new StateId(-2, CANNOT_HAPPEN_NAME);

  private final int index;
  private final String name;

  private StateId(final int index, final String name) {
    this.index = index;
    this.name = name;
  }

  /**
   * Create the id of a user state. The index is the state's position in the machine's state table.
   */
  public static StateId of(final int index, final String name) throws StateMachineException {
    if (name == null || name.trim().isEmpty()) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    if (isReserved(name.trim())) {
      throw new StateMachineException(Code.RESERVED_STATE,
          "State name " + name.trim() + " is reserved");
    }
    if (index < 0) {
      throw new StateMachineException(Code.INVALID_STATE, "State index cannot be negative");
    }
    return new StateId(index, name.trim());
  }

  public static boolean isReserved(final String name) {
    return RESERVED_NAMES.contains(name);
  }

  /**
   * Returns the sentinel spelled by the given name, null for any other name.
   */
  public static StateId sentinel(final String name) {
    if (IGNORING_EVENT_NAME.equals(name)) {
      return IGNORING_EVENT;
    }
    if (CANNOT_HAPPEN_NAME.equals(name)) {
      return CANNOT_HAPPEN;
    }
    return null;
  }

  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  public boolean isSentinel() {
    return this == IGNORING_EVENT || this == CANNOT_HAPPEN;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + index;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    StateId other = (StateId) obj;
    if (index != other.index) {
      return false;
    }
    if (name == null) {
      if (other.name != null) {
        return false;
      }
    } else if (!name.equals(other.name)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "StateId [index=" + index + ", name=" + name + "]";
  }
}
