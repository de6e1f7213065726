package com.gentoro.fetchgate;

import com.gentoro.fetchgate.batch.BatchService;
import com.gentoro.fetchgate.endpoints.FetchServer;
import com.gentoro.fetchgate.exception.NetworkException;
import com.gentoro.fetchgate.exception.StateException;
import com.gentoro.fetchgate.fetch.HttpResourceFetcher;
import com.gentoro.fetchgate.fetch.ResourceFetcher;
import com.gentoro.fetchgate.http.EmbeddedJettyServer;
import com.gentoro.fetchgate.http.OkHttpFactory;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Application container: wires configuration, the fetch pipeline and the HTTP server. */
public class FetchGate {

  private static final org.slf4j.Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(FetchGate.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private FetchGateSettings settings;
  private OkHttpClient httpClient;
  private BatchService batchService;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public FetchGate(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.fetchgate.logging.LoggingService.applyConfiguration(configuration());
    this.settings = FetchGateSettings.from(configuration());

    this.httpClient =
        OkHttpFactory.create(settings.fetchTimeout(), settings.maxConcurrentFetches());
    this.batchService = new BatchService(createFetcher(httpClient), settings);

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new FetchServer(batchService, settings).register(httpServer.getContextHandler());
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info("FetchGate started on port {}", httpServer.getPort());
  }

  /** Hook for tests and embedders that want a different fetcher. */
  protected ResourceFetcher createFetcher(OkHttpClient client) {
    return new HttpResourceFetcher(client);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "fetchgate-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Graceful shutdown: stop accepting batches, give in-flight batches the configured grace period,
   * cancel whatever is left, then stop Jetty. Safe to call multiple times; executed only once.
   */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    log.info("Shutting down");
    try {
      if (batchService != null) {
        batchService.beginShutdown();
        try {
          if (!batchService.awaitIdle(settings.shutdownGrace())) {
            batchService.cancelAll("server shutting down");
            batchService.awaitIdle(java.time.Duration.ofSeconds(1));
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          batchService.cancelAll("server shutting down");
        }
      }
      if (httpServer != null) {
        httpServer.stop(1000);
      }
    } finally {
      if (batchService != null) batchService.close();
      OkHttpFactory.shutdown(httpClient);
      shutdownLatch.countDown();
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("FetchGate not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public FetchGateSettings settings() {
    return settings;
  }

  public BatchService batchService() {
    return batchService;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
