package com.gentoro.fetchgate.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/** Helpers for turning exceptions into log lines and error details. */
public final class ExceptionUtil {
  private static final String OWN_PACKAGE = "com.gentoro.fetchgate.";
  private static final int MAX_CAUSE_DEPTH = 16;

  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging.
   *
   * <p>Code and context come from the first {@link FetchGateException} in the cause chain, so a
   * batch error wrapped by a future still reports its identifier and abort reason. When the root
   * cause is a different throwable, it is added to the context under {@code rootCause}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    FetchGateErrorCode code = FetchGateErrorCode.UNKNOWN;
    Map<String, Object> context = new LinkedHashMap<>();
    FetchGateException own = firstOwn(t);
    if (own != null) {
      code = own.getCode();
      context.putAll(own.getContext());
    }
    Throwable root = rootCause(t);
    if (root != t) {
      context.put("rootCause", describe(root));
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        code,
        Collections.unmodifiableMap(context),
        Instant.now());
  }

  /**
   * Single-line summary of where a throwable came from, keeping only FetchGate frames.
   *
   * <p>Example: {@code IllegalStateException: boom @ BatchOrchestrator.fetchOne:118 > ...(4) >
   * BatchService.execute:70 <- IOException: reset}. Runs of library and JDK frames collapse into
   * {@code ...(n)}; the root cause follows {@code <-} when it differs from {@code t}.
   *
   * @param maxFrames maximum number of FetchGate frames to include; if <= 0, includes all of them
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StringBuilder sb = new StringBuilder(describe(t));
    StackTraceElement[] elements = t.getStackTrace();
    int shown = 0;
    int skipped = 0;
    boolean first = true;
    for (StackTraceElement e : elements) {
      if (maxFrames > 0 && shown >= maxFrames) break;
      if (!e.getClassName().startsWith(OWN_PACKAGE)) {
        skipped++;
        continue;
      }
      sb.append(first ? " @ " : " > ");
      first = false;
      if (skipped > 0) {
        sb.append("...(").append(skipped).append(") > ");
        skipped = 0;
      }
      String className = e.getClassName();
      sb.append(className.substring(className.lastIndexOf('.') + 1))
          .append('.')
          .append(e.getMethodName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      shown++;
    }
    Throwable root = rootCause(t);
    if (root != t) {
      sb.append(" <- ").append(describe(root));
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static FetchGateException firstOwn(Throwable t) {
    Throwable current = t;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof FetchGateException ex) return ex;
      current = current.getCause();
    }
    return null;
  }

  private static Throwable rootCause(Throwable t) {
    Throwable current = t;
    for (int depth = 0; current.getCause() != null && depth < MAX_CAUSE_DEPTH; depth++) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank()
        ? t.getClass().getSimpleName()
        : t.getClass().getSimpleName() + ": " + message.trim();
  }

  /**
   * Extract a user-facing message from a throwable. The deepest cause that carries a message wins,
   * since wrappers around fetch failures usually repeat less specific text.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    if (t instanceof FetchGateException && t.getMessage() != null && !t.getMessage().isBlank()) {
      return t.getMessage();
    }
    String found = null;
    Throwable current = t;
    int depth = 0;
    while (current != null && depth++ < MAX_CAUSE_DEPTH) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        found = current.getClass().getSimpleName() + ": " + message.trim();
      }
      current = current.getCause();
    }
    return found != null ? found : t.getClass().getSimpleName();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static FetchGateException rethrowIfUnchecked(
      Throwable t, Function<Throwable, FetchGateException> supplier) {
    if (t instanceof FetchGateException) {
      return (FetchGateException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
