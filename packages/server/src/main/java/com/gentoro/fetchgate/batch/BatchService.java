package com.gentoro.fetchgate.batch;

import com.gentoro.fetchgate.FetchGateSettings;
import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.concurrent.CancelledException;
import com.gentoro.fetchgate.concurrent.PermitGate;
import com.gentoro.fetchgate.exception.ExceptionUtil;
import com.gentoro.fetchgate.exception.ShuttingDownException;
import com.gentoro.fetchgate.fetch.Job;
import com.gentoro.fetchgate.fetch.ResourceFetcher;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Runs batches through the admission gate and the orchestrator and keeps track of them.
 *
 * <p>State per run: {@code PENDING -> ADMITTED -> RUNNING -> COMPLETED | FAILED | CANCELLED}. The
 * admission slot is released when the run leaves {@code RUNNING}, on every path.
 */
public final class BatchService implements AutoCloseable {
  private static final Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(BatchService.class);

  private final AdmissionGate admission;
  private final BatchOrchestrator orchestrator;
  private final BatchRegistry registry;
  private final ExecutorService batchExecutor;
  private final ExecutorService fetchExecutor;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public BatchService(ResourceFetcher fetcher, FetchGateSettings settings) {
    this.fetchExecutor = Executors.newCachedThreadPool(daemonThreads("fetch-worker"));
    this.batchExecutor = Executors.newCachedThreadPool(daemonThreads("batch-worker"));
    this.admission = new AdmissionGate(settings.maxConcurrentBatches());
    this.orchestrator =
        new BatchOrchestrator(fetcher, fetchExecutor, settings.maxConcurrentFetches());
    this.registry = new BatchRegistry(settings.historySize());
  }

  /**
   * Run one batch on the calling thread.
   *
   * @return jobs in input order, each with a status
   * @throws BatchAbortedException if a fetch failed or the batch was cancelled
   * @throws ShuttingDownException if graceful shutdown has begun
   */
  public List<Job> execute(List<String> identifiers, CancellationToken token)
      throws InterruptedException {
    if (shuttingDown.get()) {
      throw new ShuttingDownException("Server is shutting down, batch not accepted");
    }
    BatchRun run = new BatchRun(UUID.randomUUID().toString(), identifiers, token);
    registry.register(run);
    log.debug("Batch {} pending with {} identifiers", run.id(), identifiers.size());
    try {
      try (PermitGate.Permit permit = admission.admit(token)) {
        run.transition(BatchState.ADMITTED);
        run.transition(BatchState.RUNNING);
        List<Job> jobs = orchestrator.run(identifiers, token, run);
        run.finish(BatchState.COMPLETED, null);
        log.info("Batch {} completed: {} jobs", run.id(), jobs.size());
        return jobs;
      }
    } catch (CancelledException e) {
      run.finish(BatchState.CANCELLED, e.getMessage());
      log.info("Batch {} cancelled before admission: {}", run.id(), e.getMessage());
      throw new BatchAbortedException(
          AbortReason.CANCELLED, null, "Batch cancelled: " + e.getMessage(), e);
    } catch (BatchAbortedException e) {
      BatchState terminal =
          e.reason() == AbortReason.CANCELLED ? BatchState.CANCELLED : BatchState.FAILED;
      run.finish(terminal, e.getMessage());
      log.info("Batch {} {}: {}", run.id(), terminal.name().toLowerCase(), e.getMessage());
      throw e;
    } catch (InterruptedException e) {
      run.finish(BatchState.CANCELLED, "interrupted");
      throw e;
    } catch (RuntimeException e) {
      run.finish(BatchState.FAILED, ExceptionUtil.extractErrorMessage(e));
      log.error(
          "Batch {} failed unexpectedly: {}", run.id(), ExceptionUtil.formatCompactStackTrace(e));
      throw e;
    } finally {
      registry.finished(run);
    }
  }

  /** Run one batch on the batch executor. The future completes with the same outcome. */
  public CompletableFuture<List<Job>> submit(List<String> identifiers, CancellationToken token) {
    if (shuttingDown.get()) {
      return CompletableFuture.failedFuture(
          new ShuttingDownException("Server is shutting down, batch not accepted"));
    }
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return execute(identifiers, token);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(
                new BatchAbortedException(
                    AbortReason.CANCELLED, null, "Batch interrupted", e));
          }
        },
        batchExecutor);
  }

  /** Stop accepting new batches. Batches already submitted keep running. */
  public void beginShutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("No longer accepting batches; {} in flight", registry.activeCount());
    }
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  /**
   * Wait until no batch is active or the timeout elapses.
   *
   * @return {@code true} if the service went idle in time
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (registry.activeCount() > 0) {
      if (System.nanoTime() >= deadline) return false;
      Thread.sleep(20);
    }
    return true;
  }

  /** Cancel every active batch. */
  public int cancelAll(String reason) {
    int cancelled = 0;
    for (BatchRun run : registry.active()) {
      if (run.token().cancel(reason)) cancelled++;
    }
    if (cancelled > 0) log.warn("Cancelled {} in-flight batches: {}", cancelled, reason);
    return cancelled;
  }

  public AdmissionGate admission() {
    return admission;
  }

  public BatchRegistry registry() {
    return registry;
  }

  @Override
  public void close() {
    beginShutdown();
    batchExecutor.shutdown();
    fetchExecutor.shutdown();
    try {
      if (!fetchExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
        fetchExecutor.shutdownNow();
      }
      if (!batchExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
        batchExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      fetchExecutor.shutdownNow();
      batchExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
