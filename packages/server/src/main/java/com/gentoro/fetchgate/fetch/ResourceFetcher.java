package com.gentoro.fetchgate.fetch;

import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.concurrent.CancelledException;

/** Performs one timed, cancellable retrieval of one identifier. */
@FunctionalInterface
public interface ResourceFetcher {

  /**
   * Retrieve {@code identifier}.
   *
   * <p>Implementations check {@code token} before issuing the call and abort the call when the
   * token fires while it is in flight.
   *
   * @return the status code reported by the remote resource
   * @throws FetchException on malformed identifiers, network errors and timeouts
   * @throws CancelledException if cancellation was observed before or during the call
   */
  int fetch(String identifier, CancellationToken token)
      throws FetchException, CancelledException;
}
