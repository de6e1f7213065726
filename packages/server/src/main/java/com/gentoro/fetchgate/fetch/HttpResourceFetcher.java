package com.gentoro.fetchgate.fetch;

import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.concurrent.CancelledException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;

/**
 * {@link ResourceFetcher} issuing a single GET through OkHttp. The client's call timeout bounds the
 * whole exchange; the response body is closed without being read.
 */
public final class HttpResourceFetcher implements ResourceFetcher {
  private static final Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(HttpResourceFetcher.class);

  private final OkHttpClient client;

  public HttpResourceFetcher(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public int fetch(String identifier, CancellationToken token)
      throws FetchException, CancelledException {
    token.throwIfCancelled();

    HttpUrl url = identifier == null ? null : HttpUrl.parse(identifier);
    if (url == null) {
      throw new FetchException(
          identifier,
          FetchFailure.MALFORMED_IDENTIFIER,
          "Malformed identifier, expected an absolute http(s) URL: " + identifier);
    }

    Call call = client.newCall(new Request.Builder().url(url).get().build());
    try (CancellationToken.Registration ignored = token.onCancel(call::cancel);
        Response response = call.execute()) {
      log.debug("Fetched {} -> {}", identifier, response.code());
      return response.code();
    } catch (InterruptedIOException e) {
      if (token.isCancelled()) throw cancelled(token, e);
      throw new FetchException(
          identifier, FetchFailure.TIMEOUT, "Timed out fetching " + identifier, e);
    } catch (IOException e) {
      if (token.isCancelled() || call.isCanceled()) throw cancelled(token, e);
      throw new FetchException(
          identifier,
          FetchFailure.NETWORK,
          "Failed to fetch " + identifier + ": " + e.getMessage(),
          e);
    }
  }

  private static CancelledException cancelled(CancellationToken token, IOException e) {
    String reason = token.reason() != null ? token.reason() : "fetch cancelled";
    return new CancelledException(reason, e);
  }
}
