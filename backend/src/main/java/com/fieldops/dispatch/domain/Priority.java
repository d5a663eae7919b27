package com.fieldops.dispatch.domain;

/**
 * Work order priority. Lower rank is dispatched first.
 */
public enum Priority {
  EMERGENCY(0),
  URGENT(1),
  ROUTINE(2),
  MAINTENANCE(3);

  private final int rank;

  Priority(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }
}
