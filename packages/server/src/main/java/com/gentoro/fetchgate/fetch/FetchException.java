package com.gentoro.fetchgate.fetch;

/** A single identifier could not be retrieved. */
public class FetchException extends Exception {
  private final String identifier;
  private final FetchFailure failure;

  public FetchException(String identifier, FetchFailure failure, String message) {
    super(message);
    this.identifier = identifier;
    this.failure = failure;
  }

  public FetchException(String identifier, FetchFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.identifier = identifier;
    this.failure = failure;
  }

  public String identifier() {
    return identifier;
  }

  public FetchFailure failure() {
    return failure;
  }
}
