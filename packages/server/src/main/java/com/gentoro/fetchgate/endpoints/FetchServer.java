package com.gentoro.fetchgate.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.fetchgate.FetchGateSettings;
import com.gentoro.fetchgate.batch.BatchService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the public endpoints on the shared Jetty context.
 *
 * <ul>
 *   <li>{@code POST /} (any path not matched below): run a batch
 *   <li>{@code GET /health}: liveness and gate occupancy
 *   <li>{@code GET /batches[/id]}: diagnostics of recent batch runs
 * </ul>
 */
public final class FetchServer {
  private static final org.slf4j.Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(FetchServer.class);

  private final BatchService batches;
  private final FetchGateSettings settings;
  private final ObjectMapper mapper = new ObjectMapper();

  public FetchServer(BatchService batches, FetchGateSettings settings) {
    this.batches = batches;
    this.settings = settings;
  }

  public void register(ServletContextHandler ctx) {
    BatchRequestParser parser = new BatchRequestParser(mapper, settings);

    ServletHolder fetch = new ServletHolder(new FetchServlet(batches, parser, mapper));
    fetch.setAsyncSupported(true);
    ctx.addServlet(fetch, "/");

    ctx.addServlet(new ServletHolder(new HealthServlet(batches, mapper)), "/health");
    ctx.addServlet(
        new ServletHolder(new BatchStatusServlet(batches.registry(), mapper)), "/batches/*");

    log.info(
        "Fetch endpoints registered (max {} URLs per batch, {} fetches per batch, {} batches)",
        settings.maxIdentifiers(),
        settings.maxConcurrentFetches(),
        settings.maxConcurrentBatches());
  }
}
