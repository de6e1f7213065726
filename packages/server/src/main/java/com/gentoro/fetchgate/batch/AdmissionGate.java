package com.gentoro.fetchgate.batch;

import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.concurrent.CancelledException;
import com.gentoro.fetchgate.concurrent.PermitGate;

/**
 * System-wide cap on concurrently running batches. Waiting is unbounded: there is no timeout and no
 * limit on the number of waiters. Only cancellation of the waiting batch or interruption ends the
 * wait early.
 */
public final class AdmissionGate {
  private final PermitGate permits;

  public AdmissionGate(int maxConcurrentBatches) {
    this.permits = new PermitGate("admission", maxConcurrentBatches);
  }

  /** Block until the batch owning {@code token} may run. Close the permit when it is done. */
  public PermitGate.Permit admit(CancellationToken token)
      throws InterruptedException, CancelledException {
    return permits.acquire(token);
  }

  public int capacity() {
    return permits.capacity();
  }

  public int inUse() {
    return permits.inUse();
  }

  public int available() {
    return permits.available();
  }
}
