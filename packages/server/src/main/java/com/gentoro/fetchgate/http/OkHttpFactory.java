package com.gentoro.fetchgate.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client for resource fetches. The call timeout bounds connect, TLS, redirects and the response
   * headers as a whole; connection failures are never retried.
   */
  public static OkHttpClient create(Duration fetchTimeout, int maxIdleConnections) {
    if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
      throw new IllegalArgumentException("fetchTimeout must be positive");
    }
    return new OkHttpClient.Builder()
        .callTimeout(fetchTimeout)
        .connectTimeout(fetchTimeout)
        .readTimeout(fetchTimeout)
        .retryOnConnectionFailure(false)
        .followRedirects(true)
        .connectionPool(new ConnectionPool(Math.max(1, maxIdleConnections), 30, TimeUnit.SECONDS))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /** Release pooled connections and dispatcher threads. */
  public static void shutdown(OkHttpClient client) {
    if (client == null) return;
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
