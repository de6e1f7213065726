package com.gentoro.fetchgate.batch;

import com.gentoro.fetchgate.exception.FetchGateErrorCode;
import com.gentoro.fetchgate.exception.FetchGateException;

/** The single error a batch produces when any fetch fails or the batch is cancelled. */
public class BatchAbortedException extends FetchGateException {
  private final AbortReason reason;
  private final String identifier;

  public BatchAbortedException(
      AbortReason reason, String identifier, String message, Throwable cause) {
    super(
        reason == AbortReason.CANCELLED
            ? FetchGateErrorCode.CANCELLED
            : FetchGateErrorCode.FETCH_ERROR,
        message,
        cause);
    this.reason = reason;
    this.identifier = identifier;
    if (identifier != null) withContext("identifier", identifier);
    withContext("reason", reason.name());
  }

  public AbortReason reason() {
    return reason;
  }

  /** Identifier whose fetch triggered the abort, or {@code null} for external cancellation. */
  public String identifier() {
    return identifier;
  }
}
