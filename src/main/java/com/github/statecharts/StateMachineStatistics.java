package com.github.statecharts;

/**
 * Holder of dispatch statistics for one machine. Counters are only mutated while the dispatch lock
 * is held.
 */
public final class StateMachineStatistics {
  private final String stateMachineId;

  StateMachineStatistics(final String stateMachineId) {
    this.stateMachineId = stateMachineId;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  volatile long dispatchCycles;
  volatile long transitions;
  volatile long ignoredEvents;
  volatile long rejectedTransitions;
  volatile long fatalAborts;
  volatile int longestChain;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getMachineId() {
    return stateMachineId;
  }

  /**
   * Outer, non-reentrant dispatch calls.
   */
  public long getDispatchCycles() {
    return dispatchCycles;
  }

  public long getTransitions() {
    return transitions;
  }

  public long getIgnoredEvents() {
    return ignoredEvents;
  }

  public long getRejectedTransitions() {
    return rejectedTransitions;
  }

  public long getFatalAborts() {
    return fatalAborts;
  }

  /**
   * Longest run of steps drained within a single dispatch cycle.
   */
  public int getLongestChain() {
    return longestChain;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [stateMachineId=" + stateMachineId + ", startTstampMillis="
        + startTstampMillis + ", dispatchCycles=" + dispatchCycles + ", transitions="
        + transitions + ", ignoredEvents=" + ignoredEvents + ", rejectedTransitions="
        + rejectedTransitions + ", fatalAborts=" + fatalAborts + ", longestChain=" + longestChain
        + "]";
  }

}
