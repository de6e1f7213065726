package com.gentoro.fetchgate.batch;

import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.exception.StateException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bookkeeping for one batch: its state machine, timestamps and how many jobs completed. The job
 * count survives an abort, so failed runs show how far they got.
 */
public final class BatchRun {
  private final String id;
  private final List<String> identifiers;
  private final CancellationToken token;
  private final Instant createdAt = Instant.now();
  private final AtomicInteger completedJobs = new AtomicInteger();

  private volatile BatchState state = BatchState.PENDING;
  private volatile Instant admittedAt;
  private volatile Instant finishedAt;
  private volatile String message;

  public BatchRun(String id, List<String> identifiers, CancellationToken token) {
    this.id = id;
    this.identifiers = List.copyOf(identifiers);
    this.token = token;
  }

  public String id() {
    return id;
  }

  public List<String> identifiers() {
    return identifiers;
  }

  public CancellationToken token() {
    return token;
  }

  public BatchState state() {
    return state;
  }

  public int completedJobs() {
    return completedJobs.get();
  }

  void jobCompleted() {
    completedJobs.incrementAndGet();
  }

  synchronized void transition(BatchState next) {
    if (!state.canTransitionTo(next)) {
      throw new StateException("Batch " + id + " cannot move from " + state + " to " + next);
    }
    if (next == BatchState.ADMITTED) admittedAt = Instant.now();
    if (next.isTerminal()) finishedAt = Instant.now();
    state = next;
  }

  synchronized void finish(BatchState terminal, String message) {
    this.message = message;
    transition(terminal);
  }

  public View view() {
    return new View(
        id,
        state.name(),
        identifiers.size(),
        completedJobs.get(),
        message,
        createdAt,
        admittedAt,
        finishedAt);
  }

  /** Read-only snapshot for the diagnostics endpoint. */
  public record View(
      String batchId,
      String state,
      int jobs,
      int completedJobs,
      String message,
      Instant createdAt,
      Instant admittedAt,
      Instant finishedAt) {}
}
