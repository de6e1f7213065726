package com.gentoro.fetchgate;

import com.gentoro.fetchgate.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable, validated view over the tunables in {@code application.yaml}.
 *
 * @param maxIdentifiers largest accepted batch
 * @param maxIdentifierLength longest accepted identifier, in characters
 * @param maxConcurrentFetches fetches allowed in flight per batch
 * @param maxConcurrentBatches batches allowed to run system-wide
 * @param fetchTimeout bound on a single retrieval
 * @param historySize number of finished batch runs kept for diagnostics
 * @param shutdownGrace time granted to in-flight batches during graceful shutdown
 */
public record FetchGateSettings(
    int maxIdentifiers,
    int maxIdentifierLength,
    int maxConcurrentFetches,
    int maxConcurrentBatches,
    Duration fetchTimeout,
    int historySize,
    Duration shutdownGrace) {

  public static final int DEFAULT_MAX_IDENTIFIERS = 20;
  public static final int DEFAULT_MAX_IDENTIFIER_LENGTH = 2048;
  public static final int DEFAULT_MAX_CONCURRENT_FETCHES = 4;
  public static final int DEFAULT_MAX_CONCURRENT_BATCHES = 100;
  public static final long DEFAULT_FETCH_TIMEOUT_MS = 1000;
  public static final int DEFAULT_HISTORY_SIZE = 100;
  public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5000;

  public FetchGateSettings {
    requirePositive("batch.max-identifiers", maxIdentifiers);
    requirePositive("batch.max-identifier-length", maxIdentifierLength);
    requirePositive("batch.max-concurrent-fetches", maxConcurrentFetches);
    requirePositive("admission.max-concurrent-batches", maxConcurrentBatches);
    requirePositive("fetch.timeout-ms", fetchTimeout == null ? 0 : fetchTimeout.toMillis());
    if (historySize < 0) {
      throw new ConfigException("batch.history-size must not be negative: " + historySize);
    }
    if (shutdownGrace == null || shutdownGrace.isNegative()) {
      throw new ConfigException("shutdown.grace-ms must not be negative");
    }
  }

  public static FetchGateSettings defaults() {
    return new FetchGateSettings(
        DEFAULT_MAX_IDENTIFIERS,
        DEFAULT_MAX_IDENTIFIER_LENGTH,
        DEFAULT_MAX_CONCURRENT_FETCHES,
        DEFAULT_MAX_CONCURRENT_BATCHES,
        Duration.ofMillis(DEFAULT_FETCH_TIMEOUT_MS),
        DEFAULT_HISTORY_SIZE,
        Duration.ofMillis(DEFAULT_SHUTDOWN_GRACE_MS));
  }

  public static FetchGateSettings from(Configuration config) {
    try {
      return new FetchGateSettings(
          config.getInt("batch.max-identifiers", DEFAULT_MAX_IDENTIFIERS),
          config.getInt("batch.max-identifier-length", DEFAULT_MAX_IDENTIFIER_LENGTH),
          config.getInt("batch.max-concurrent-fetches", DEFAULT_MAX_CONCURRENT_FETCHES),
          config.getInt("admission.max-concurrent-batches", DEFAULT_MAX_CONCURRENT_BATCHES),
          Duration.ofMillis(config.getLong("fetch.timeout-ms", DEFAULT_FETCH_TIMEOUT_MS)),
          config.getInt("batch.history-size", DEFAULT_HISTORY_SIZE),
          Duration.ofMillis(config.getLong("shutdown.grace-ms", DEFAULT_SHUTDOWN_GRACE_MS)));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid batch/fetch configuration", e);
    }
  }

  /**
   * Upper bound for a request body: every identifier at maximum length plus quotes, comma and
   * whitespace, plus the enclosing brackets.
   */
  public long maxBodyBytes() {
    return (long) maxIdentifiers * (maxIdentifierLength + 4) + 3;
  }

  private static void requirePositive(String key, long value) {
    if (value <= 0) {
      throw new ConfigException(key + " must be positive: " + value);
    }
  }
}
