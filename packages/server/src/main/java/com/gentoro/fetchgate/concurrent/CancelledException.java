package com.gentoro.fetchgate.concurrent;

/** Thrown by cooperative code that observed a cancelled {@link CancellationToken}. */
public class CancelledException extends Exception {
  public CancelledException(String message) {
    super(message);
  }

  public CancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
