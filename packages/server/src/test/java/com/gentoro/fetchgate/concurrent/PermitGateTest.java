package com.gentoro.fetchgate.concurrent;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class PermitGateTest {

  @Test
  @DisplayName("closing a permit twice releases the slot once")
  void permitReleasesExactlyOnce() throws Exception {
    PermitGate gate = new PermitGate("test", 2);
    PermitGate.Permit permit = gate.acquire();
    assertEquals(1, gate.inUse());

    permit.close();
    permit.close();
    assertTrue(permit.isReleased());
    assertEquals(0, gate.inUse());
    assertEquals(2, gate.available());
  }

  @Test
  void tryAcquireFailsWhenFull() throws Exception {
    PermitGate gate = new PermitGate("test", 1);
    try (PermitGate.Permit held = gate.acquire()) {
      assertTrue(gate.tryAcquire().isEmpty());
    }
    assertTrue(gate.tryAcquire().isPresent());
  }

  @Test
  @DisplayName("a blocked acquire proceeds once a slot frees")
  void blockedAcquireProceedsAfterRelease() throws Exception {
    PermitGate gate = new PermitGate("test", 1);
    CancellationToken token = new CancellationToken();
    PermitGate.Permit first = gate.acquire();

    CompletableFuture<PermitGate.Permit> second =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return gate.acquire(token);
              } catch (Exception e) {
                throw new RuntimeException(e);
              }
            });

    assertThrows(TimeoutException.class, () -> second.get(150, TimeUnit.MILLISECONDS));
    first.close();
    PermitGate.Permit acquired = second.get(2, TimeUnit.SECONDS);
    assertEquals(1, gate.inUse());
    acquired.close();
    assertEquals(0, gate.inUse());
  }

  @Test
  @DisplayName("cancelling the token ends a blocked acquire without taking a slot")
  void cancellationEndsWait() throws Exception {
    PermitGate gate = new PermitGate("test", 1);
    CancellationToken token = new CancellationToken();
    PermitGate.Permit held = gate.acquire();

    CompletableFuture<PermitGate.Permit> waiter =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return gate.acquire(token);
              } catch (Exception e) {
                throw new RuntimeException(e);
              }
            });

    Thread.sleep(50);
    long start = System.nanoTime();
    token.cancel("give up");
    ExecutionException e =
        assertThrows(ExecutionException.class, () -> waiter.get(2, TimeUnit.SECONDS));
    assertInstanceOf(CancelledException.class, e.getCause().getCause());
    assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1000);

    held.close();
    assertEquals(0, gate.inUse());
  }

  @Test
  void acquireWithCancelledTokenFailsImmediately() {
    PermitGate gate = new PermitGate("test", 1);
    CancellationToken token = new CancellationToken();
    token.cancel("already");
    assertThrows(CancelledException.class, () -> gate.acquire(token));
    assertEquals(1, gate.available());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new PermitGate("bad", 0));
  }
}
