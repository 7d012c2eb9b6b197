package com.github.statecharts;

/**
 * Bound boolean condition gating a transition. Evaluated while the machine already reports the
 * transition's destination as its current state.
 */
@FunctionalInterface
public interface Guard {
  boolean test();
}
