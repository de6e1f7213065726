package com.gentoro.fetchgate.batch;

import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.concurrent.CancelledException;
import com.gentoro.fetchgate.concurrent.PermitGate;
import com.gentoro.fetchgate.exception.ExceptionUtil;
import com.gentoro.fetchgate.fetch.FetchException;
import com.gentoro.fetchgate.fetch.Job;
import com.gentoro.fetchgate.fetch.ResourceFetcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;

/**
 * Fans a batch out to one fetch task per identifier and folds the outcomes into an all-or-nothing
 * result.
 *
 * <p>All tasks of a batch share a batch-local {@link PermitGate}, so at most {@code
 * maxConcurrentFetches} retrievals are in flight per batch. The orchestrator waits on a queue fed
 * by the tasks and by the external token; the first failure or cancellation wins. On abort it
 * cancels a derived token (aborting in-flight calls) and the outstanding futures (unblocking tasks
 * still waiting for a slot), then returns without waiting for stragglers. Each task releases its
 * own slot in a try-with-resources block, whether or not anybody still listens for its result.
 */
public final class BatchOrchestrator {
  private static final Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(BatchOrchestrator.class);

  private final ResourceFetcher fetcher;
  private final ExecutorService fetchExecutor;
  private final int maxConcurrentFetches;

  public BatchOrchestrator(
      ResourceFetcher fetcher, ExecutorService fetchExecutor, int maxConcurrentFetches) {
    if (maxConcurrentFetches <= 0) {
      throw new IllegalArgumentException("maxConcurrentFetches must be > 0");
    }
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
    this.maxConcurrentFetches = maxConcurrentFetches;
  }

  public List<Job> run(List<String> identifiers, CancellationToken external)
      throws InterruptedException {
    return run(identifiers, external, null);
  }

  /**
   * Fetch every identifier and return the jobs in input order.
   *
   * @param run optional bookkeeping updated as jobs complete
   * @throws BatchAbortedException if any fetch failed or {@code external} was cancelled
   * @throws InterruptedException if the calling thread was interrupted while waiting
   */
  public List<Job> run(List<String> identifiers, CancellationToken external, BatchRun run)
      throws InterruptedException {
    List<Job> jobs = new ArrayList<>(identifiers.size());
    for (String identifier : identifiers) {
      jobs.add(new Job(identifier));
    }
    if (jobs.isEmpty()) return jobs;

    CancellationToken batchToken = external.child();
    PermitGate slots = new PermitGate("batch-fetch", maxConcurrentFetches);
    BlockingQueue<Outcome> outcomes = new LinkedBlockingQueue<>();
    List<Future<?>> tasks = new ArrayList<>(jobs.size());

    try (CancellationToken.Registration ignored =
        external.onCancel(() -> outcomes.offer(Outcome.externallyCancelled()))) {
      for (Job job : jobs) {
        tasks.add(fetchExecutor.submit(() -> fetchOne(job, slots, batchToken, outcomes)));
      }

      int completed = 0;
      while (completed < jobs.size()) {
        Outcome outcome = outcomes.take();
        if (!outcome.succeeded()) {
          BatchAbortedException error = toAbort(outcome, external);
          abort(batchToken, tasks, error.getMessage());
          throw error;
        }
        completed++;
        if (run != null) run.jobCompleted();
      }

      // a cancellation observable at the same instant as the last completion wins
      if (external.isCancelled()) {
        BatchAbortedException error = toAbort(Outcome.externallyCancelled(), external);
        abort(batchToken, tasks, error.getMessage());
        throw error;
      }
      return jobs;
    } catch (InterruptedException e) {
      abort(batchToken, tasks, "orchestrator interrupted");
      throw e;
    } finally {
      batchToken.detach();
    }
  }

  private void fetchOne(
      Job job, PermitGate slots, CancellationToken token, BlockingQueue<Outcome> outcomes) {
    try (PermitGate.Permit permit = slots.acquire(token)) {
      token.throwIfCancelled();
      int status = fetcher.fetch(job.identifier(), token);
      job.complete(status);
      outcomes.offer(Outcome.success(job));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      outcomes.offer(Outcome.failure(job, token.isCancelled() ? token.toException() : e));
    } catch (FetchException | CancelledException | RuntimeException e) {
      outcomes.offer(Outcome.failure(job, e));
    } catch (Error e) {
      // exactly one outcome per task
      outcomes.offer(Outcome.failure(job, new ExecutionException(e)));
      throw e;
    }
  }

  private static void abort(CancellationToken batchToken, List<Future<?>> tasks, String reason) {
    batchToken.cancel(reason);
    for (Future<?> task : tasks) {
      task.cancel(true);
    }
  }

  private static BatchAbortedException toAbort(Outcome outcome, CancellationToken external) {
    if (outcome.job() == null || outcome.error() instanceof CancelledException) {
      String reason = external.reason() != null ? external.reason() : "cancelled";
      log.debug("Batch cancelled: {}", reason);
      return new BatchAbortedException(
          AbortReason.CANCELLED, null, "Batch cancelled: " + reason, external.cause());
    }
    Exception error = outcome.error();
    String identifier = outcome.job().identifier();
    if (error instanceof FetchException fe) {
      log.debug("Fetch of {} failed ({}): {}", identifier, fe.failure(), fe.getMessage());
    } else {
      log.warn(
          "Unexpected error fetching {}: {}",
          identifier,
          ExceptionUtil.formatCompactStackTrace(error));
    }
    return new BatchAbortedException(
        AbortReason.FETCH_FAILED, identifier, describe(identifier, error), error);
  }

  private static String describe(String identifier, Exception error) {
    if (error instanceof ExecutionException && error.getCause() != null) {
      return "Failed to fetch " + identifier + ": " + error.getCause().getClass().getSimpleName();
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return "Failed to fetch " + identifier + ": " + error.getClass().getSimpleName();
    }
    return message;
  }

  /** One report on the outcome queue. {@code job == null} marks external cancellation. */
  private record Outcome(Job job, Exception error) {
    static Outcome success(Job job) {
      return new Outcome(job, null);
    }

    static Outcome failure(Job job, Exception error) {
      return new Outcome(job, error);
    }

    static Outcome externallyCancelled() {
      return new Outcome(null, null);
    }

    boolean succeeded() {
      return job != null && error == null;
    }
  }
}
