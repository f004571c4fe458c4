package com.flamingo.ai.adaptiverag.domain.model;

/**
 * Ceiling for one retry loop. Counters compared against a budget only ever grow during a run, so
 * once {@link #allowsAnother(int)} returns false it stays false.
 */
public record RetryBudget(int ceiling) {

  public RetryBudget {
    if (ceiling < 0) {
      throw new IllegalArgumentException("ceiling must be >= 0, got " + ceiling);
    }
  }

  public boolean allowsAnother(int attemptsSoFar) {
    return attemptsSoFar < ceiling;
  }
}
