package com.gentoro.fetchgate.exception;

/** Raised when a batch is submitted after graceful shutdown has begun. */
public class ShuttingDownException extends FetchGateException {
  public ShuttingDownException(String message) {
    super(FetchGateErrorCode.UNAVAILABLE, message);
  }
}
