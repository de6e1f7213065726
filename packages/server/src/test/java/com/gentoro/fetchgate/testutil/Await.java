package com.gentoro.fetchgate.testutil;

import static org.junit.jupiter.api.Assertions.fail;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/** Polling helper for asynchronous assertions. */
public final class Await {
  private Await() {}

  public static void until(String description, Duration timeout, BooleanSupplier condition)
      throws InterruptedException {
    long end = System.currentTimeMillis() + timeout.toMillis();
    while (System.currentTimeMillis() < end) {
      if (condition.getAsBoolean()) return;
      Thread.sleep(10);
    }
    if (!condition.getAsBoolean()) {
      fail("Timeout waiting for " + description);
    }
  }
}
