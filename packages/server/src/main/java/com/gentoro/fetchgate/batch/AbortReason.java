package com.gentoro.fetchgate.batch;

/** Why a batch was abandoned. Callers see the same outcome either way. */
public enum AbortReason {
  FETCH_FAILED,
  CANCELLED
}
