package com.gentoro.fetchgate.concurrent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;

/**
 * One-way cancellation signal shared by a batch and every fetch it spawns.
 *
 * <p>A token starts active and can be cancelled once; later {@link #cancel} calls are ignored and
 * the first reason is kept. Listeners registered through {@link #onCancel(Runnable)} run exactly
 * once, on the cancelling thread, or immediately on the registering thread when the token is
 * already cancelled. Derived tokens created by {@link #child()} are cancelled together with their
 * parent but never propagate upwards.
 */
public final class CancellationToken {
  private static final Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(CancellationToken.class);

  private final Object lock = new Object();
  private final Set<Runnable> listeners = new LinkedHashSet<>();
  private volatile boolean cancelled;
  private volatile String reason;
  private volatile Throwable cause;
  private volatile Registration parentLink;

  /** Handle returned by {@link #onCancel(Runnable)}; closing it deregisters the listener. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Reason given to the first successful {@link #cancel} call, or {@code null} while active. */
  public String reason() {
    return reason;
  }

  /** Optional throwable that triggered cancellation. */
  public Throwable cause() {
    return cause;
  }

  public boolean cancel(String reason) {
    return cancel(reason, null);
  }

  /**
   * Cancel this token and notify listeners.
   *
   * @return {@code true} if this call performed the transition, {@code false} if the token was
   *     already cancelled
   */
  public boolean cancel(String reason, Throwable cause) {
    List<Runnable> toNotify;
    synchronized (lock) {
      if (cancelled) return false;
      this.reason = reason == null ? "cancelled" : reason;
      this.cause = cause;
      this.cancelled = true;
      toNotify = new ArrayList<>(listeners);
      listeners.clear();
    }
    for (Runnable listener : toNotify) {
      runListener(listener);
    }
    return true;
  }

  /** Register a callback to run when this token is cancelled. */
  public Registration onCancel(Runnable listener) {
    synchronized (lock) {
      if (!cancelled) {
        listeners.add(listener);
        return () -> {
          synchronized (lock) {
            listeners.remove(listener);
          }
        };
      }
    }
    runListener(listener);
    return () -> {};
  }

  /**
   * Create a token that is cancelled whenever this one is. Cancelling the child leaves this token
   * untouched. Call {@link #detach()} on the child once it is no longer needed so the parent does
   * not keep a reference to it.
   */
  public CancellationToken child() {
    CancellationToken child = new CancellationToken();
    child.parentLink = onCancel(() -> child.cancel(reason, cause));
    return child;
  }

  /** Drop the link to the parent token, if any. Safe to call more than once. */
  public void detach() {
    Registration link = parentLink;
    parentLink = null;
    if (link != null) link.close();
  }

  public void throwIfCancelled() throws CancelledException {
    if (cancelled) {
      throw toException();
    }
  }

  /** Build the exception describing this token's cancellation. */
  public CancelledException toException() {
    String why = reason == null ? "cancelled" : reason;
    return cause == null ? new CancelledException(why) : new CancelledException(why, cause);
  }

  /** Number of registered listeners, exposed for leak checks. */
  int listenerCount() {
    synchronized (lock) {
      return listeners.size();
    }
  }

  private static void runListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException e) {
      log.warn("Cancellation listener failed: {}", e.toString());
    }
  }
}
