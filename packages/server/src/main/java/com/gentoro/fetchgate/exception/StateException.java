package com.gentoro.fetchgate.exception;

/** A component was used in a lifecycle state that does not allow the call. */
public class StateException extends FetchGateException {
  public StateException(String message) {
    super(FetchGateErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(FetchGateErrorCode.STATE_ERROR, message, cause);
  }
}
