package com.gentoro.fetchgate.exception;

/** An inbound batch was rejected before any fetch started. */
public class ValidationException extends FetchGateException {
  public ValidationException(String message) {
    super(FetchGateErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(FetchGateErrorCode.VALIDATION_ERROR, message, cause);
  }
}
