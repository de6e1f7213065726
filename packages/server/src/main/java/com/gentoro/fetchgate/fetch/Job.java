package com.gentoro.fetchgate.fetch;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One identifier of a batch together with the status code of its retrieval. The status is
 * write-once: it is set by the fetch that owns the job and read-only afterwards.
 */
public final class Job {
  private final String identifier;
  private final AtomicReference<Integer> status = new AtomicReference<>();

  public Job(String identifier) {
    this.identifier = Objects.requireNonNull(identifier, "identifier");
  }

  public String identifier() {
    return identifier;
  }

  /** Status code of the retrieval, or {@code null} while the job is unfinished. */
  public Integer status() {
    return status.get();
  }

  public boolean isCompleted() {
    return status.get() != null;
  }

  /**
   * Record the retrieval outcome.
   *
   * @throws IllegalStateException if the job was already completed
   */
  public void complete(int statusCode) {
    if (!status.compareAndSet(null, statusCode)) {
      throw new IllegalStateException(
          "Job for " + identifier + " already completed with status " + status.get());
    }
  }

  @Override
  public String toString() {
    return "Job{" + identifier + " -> " + status.get() + "}";
  }
}
