package com.gentoro.fetchgate.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened error representation used for logs and JSON error bodies. */
public record ErrorDetails(
    String type,
    String message,
    FetchGateErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
