package com.gentoro.fetchgate.exception;

/** Failures binding or running the HTTP listener. */
public class NetworkException extends FetchGateException {
  public NetworkException(String message) {
    super(FetchGateErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(FetchGateErrorCode.NETWORK_ERROR, message, cause);
  }
}
