package com.gentoro.fetchgate.batch;

/** Lifecycle of one batch run. */
public enum BatchState {
  /** Validated, waiting for an admission slot. */
  PENDING,
  /** Holds an admission slot. */
  ADMITTED,
  /** Fetches are in flight. */
  RUNNING,
  /** Every job has a status. */
  COMPLETED,
  /** A fetch failed and the batch was abandoned. */
  FAILED,
  /** The batch was cancelled from outside. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  boolean canTransitionTo(BatchState next) {
    return switch (this) {
      case PENDING -> next == ADMITTED || next == CANCELLED || next == FAILED;
      case ADMITTED -> next == RUNNING || next.isTerminal();
      case RUNNING -> next.isTerminal();
      case COMPLETED, FAILED, CANCELLED -> false;
    };
  }
}
