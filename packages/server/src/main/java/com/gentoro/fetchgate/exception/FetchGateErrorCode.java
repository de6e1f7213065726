package com.gentoro.fetchgate.exception;

/** Stable error codes attached to {@link FetchGateException}s. */
public enum FetchGateErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  NETWORK_ERROR,
  STATE_ERROR,
  VALIDATION_ERROR,
  FETCH_ERROR,
  CANCELLED,
  UNAVAILABLE
}
