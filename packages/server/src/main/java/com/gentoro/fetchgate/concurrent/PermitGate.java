package com.gentoro.fetchgate.concurrent;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counted-permit gate. A {@link Permit} is handed out per successful acquisition and releases its
 * slot exactly once, however many times it is closed, so callers can rely on try-with-resources on
 * every exit path.
 */
public final class PermitGate {
  static final long POLL_INTERVAL_MS = 25;

  private final String name;
  private final int capacity;
  private final Semaphore semaphore;

  public PermitGate(String name, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0: " + capacity);
    }
    this.name = name;
    this.capacity = capacity;
    this.semaphore = new Semaphore(capacity);
  }

  /** Block until a slot is free. */
  public Permit acquire() throws InterruptedException {
    semaphore.acquire();
    return new Permit();
  }

  /**
   * Block until a slot is free or the token is cancelled, whichever happens first. A slot that
   * becomes available after cancellation is handed straight back.
   */
  public Permit acquire(CancellationToken token) throws InterruptedException, CancelledException {
    token.throwIfCancelled();
    while (!semaphore.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
      token.throwIfCancelled();
    }
    Permit permit = new Permit();
    if (token.isCancelled()) {
      permit.close();
      throw token.toException();
    }
    return permit;
  }

  public Optional<Permit> tryAcquire() {
    return semaphore.tryAcquire() ? Optional.of(new Permit()) : Optional.empty();
  }

  public String name() {
    return name;
  }

  public int capacity() {
    return capacity;
  }

  public int available() {
    return semaphore.availablePermits();
  }

  public int inUse() {
    return capacity - semaphore.availablePermits();
  }

  @Override
  public String toString() {
    return "PermitGate[" + name + " " + inUse() + "/" + capacity + "]";
  }

  /** One held slot of the enclosing gate. */
  public final class Permit implements AutoCloseable {
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Permit() {}

    public boolean isReleased() {
      return released.get();
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        semaphore.release();
      }
    }
  }
}
