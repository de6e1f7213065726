package com.gentoro.fetchgate.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fetchgate.batch.BatchAbortedException;
import com.gentoro.fetchgate.batch.BatchService;
import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.exception.ExceptionUtil;
import com.gentoro.fetchgate.exception.ShuttingDownException;
import com.gentoro.fetchgate.exception.ValidationException;
import com.gentoro.fetchgate.fetch.Job;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;

/**
 * POST with a JSON array of URLs: fetches all of them and answers with {@code
 * [{"url":...,"status":...}]} in request order, or with a single plain-text error.
 *
 * <p>The batch runs off the request thread; the request stays open through an {@link AsyncContext}.
 * A {@link ClientDisconnectWatch} cancels the batch when the client goes away.
 */
public final class FetchServlet extends HttpServlet {
  private static final Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(FetchServlet.class);

  private final BatchService batches;
  private final BatchRequestParser parser;
  private final ObjectMapper mapper;

  public FetchServlet(BatchService batches, BatchRequestParser parser, ObjectMapper mapper) {
    this.batches = batches;
    this.parser = parser;
    this.mapper = mapper;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    log.debug("Got new batch request");

    List<String> identifiers;
    try {
      if (req.getContentLengthLong() > parser.maxBodyBytes()) {
        throw new RequestTooLargeException(
            "Request body exceeds " + parser.maxBodyBytes() + " bytes");
      }
      identifiers = parser.parse(req.getInputStream());
    } catch (RequestTooLargeException e) {
      log.info("Client error: {}", e.getMessage());
      writeText(resp, HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE, e.getMessage());
      return;
    } catch (ValidationException e) {
      log.info("Client error: {}", e.getMessage());
      writeText(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
      return;
    }

    if (batches.isShuttingDown()) {
      writeText(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
      return;
    }

    CancellationToken token = new CancellationToken();
    AsyncContext async = req.startAsync();
    async.setTimeout(0);
    ClientDisconnectWatch watch = ClientDisconnectWatch.start(req, token);
    async.addListener(new CancelOnAsyncError(watch));
    if (watch.holdsConnection()) {
      resp.setHeader("Connection", "close");
    }

    batches
        .submit(identifiers, token)
        .whenComplete(
            (jobs, error) -> {
              watch.finish();
              HttpServletResponse response = (HttpServletResponse) async.getResponse();
              try {
                if (error == null) {
                  writeJobs(response, jobs);
                } else {
                  writeFailure(response, token, watch.disconnected(), unwrap(error));
                }
              } catch (IOException | RuntimeException e) {
                log.debug("Could not write batch response: {}", e.toString());
              } finally {
                async.complete();
              }
            });
  }

  private void writeJobs(HttpServletResponse resp, List<Job> jobs) throws IOException {
    ArrayNode body = mapper.createArrayNode();
    for (Job job : jobs) {
      ObjectNode node = body.addObject();
      node.put("url", job.identifier());
      node.put("status", job.status());
    }
    resp.setStatus(HttpServletResponse.SC_OK);
    resp.setContentType("application/json; charset=UTF-8");
    resp.getOutputStream().write(mapper.writeValueAsBytes(body));
  }

  private void writeFailure(
      HttpServletResponse resp, CancellationToken token, boolean clientGone, Throwable error)
      throws IOException {
    if (error instanceof ShuttingDownException) {
      writeText(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, error.getMessage());
      return;
    }
    if (error instanceof BatchAbortedException aborted) {
      if (clientGone) {
        log.debug("Batch cancelled by client: {}", aborted.getMessage());
        return;
      }
      int status =
          token.isCancelled()
              ? HttpServletResponse.SC_SERVICE_UNAVAILABLE
              : HttpServletResponse.SC_BAD_GATEWAY;
      log.info("Batch aborted: {}", ExceptionUtil.toErrorDetails(aborted));
      writeText(resp, status, aborted.getMessage());
      return;
    }
    log.error("Batch failed unexpectedly", error);
    writeText(
        resp,
        HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
        ExceptionUtil.extractErrorMessage(error));
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  static void writeText(HttpServletResponse resp, int status, String message) throws IOException {
    resp.setStatus(status);
    resp.setContentType("text/plain; charset=UTF-8");
    resp.getOutputStream().write((message == null ? "" : message).getBytes(StandardCharsets.UTF_8));
  }

  /** Forwards container-reported request errors and timeouts to the disconnect watch. */
  private static final class CancelOnAsyncError implements AsyncListener {
    private final ClientDisconnectWatch watch;

    CancelOnAsyncError(ClientDisconnectWatch watch) {
      this.watch = watch;
    }

    @Override
    public void onError(AsyncEvent event) {
      Throwable cause = event.getThrowable();
      watch.clientGone(cause != null ? cause : new IOException("request failed"));
    }

    @Override
    public void onTimeout(AsyncEvent event) {
      watch.clientGone(new IOException("async timeout"));
    }

    @Override
    public void onComplete(AsyncEvent event) {}

    @Override
    public void onStartAsync(AsyncEvent event) {}
  }
}
