package com.gentoro.fetchgate.endpoints;

import com.gentoro.fetchgate.exception.ValidationException;

/** The request body exceeds the largest possible valid batch. */
public class RequestTooLargeException extends ValidationException {
  public RequestTooLargeException(String message) {
    super(message);
  }
}
