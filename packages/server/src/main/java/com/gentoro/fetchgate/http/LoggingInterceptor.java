package com.gentoro.fetchgate.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs every outbound fetch with its outcome and duration. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (InterruptedIOException e) {
      log.warn(
          "Request timed out or was cancelled: {} {} ({}ms)",
          request.method(),
          request.url(),
          elapsedMillis(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMillis(startTime),
          messageOf(e));
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMillis(startTime),
          messageOf(e));
      throw e;
    }

    log.debug(
        "Received {} for {} {} in {} ms",
        response.code(),
        request.method(),
        response.request().url(),
        elapsedMillis(startTime));
    return response;
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String messageOf(IOException e) {
    String message = e.getMessage();
    return message == null || message.isEmpty() ? e.getClass().getSimpleName() : message;
  }
}
