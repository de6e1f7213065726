package com.gentoro.fetchgate.fetch;

/** Kind of a single retrieval failure; only used for diagnostics. */
public enum FetchFailure {
  /** The identifier is not an absolute http(s) URL. No request was sent. */
  MALFORMED_IDENTIFIER,
  /** The retrieval did not finish within the fetch timeout. */
  TIMEOUT,
  /** Connection, TLS or protocol error. */
  NETWORK
}
