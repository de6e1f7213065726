package com.gentoro.fetchgate.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base unchecked exception carrying an error code and optional structured context. */
public class FetchGateException extends RuntimeException {
  private final FetchGateErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public FetchGateException(FetchGateErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public FetchGateException(FetchGateErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public FetchGateErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry, returning this exception for chaining. */
  public FetchGateException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
