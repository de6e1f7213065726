package com.gentoro.fetchgate.http;

import com.gentoro.fetchgate.exception.ConfigException;
import com.gentoro.fetchgate.exception.ExceptionUtil;
import com.gentoro.fetchgate.exception.NetworkException;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle and exposes the root {@link ServletContextHandler} so that
 * other components can register their servlets.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  public static final int DEFAULT_PORT = 62985;

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    log.trace("Initializing Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", DEFAULT_PORT);
        log.trace("Resolving http.port: {}", port);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
        log.trace("Resolving http.hostname: {}", hostname);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");

        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize jetty service. "
                + "Please, check if the chosen port and hostname are available",
            e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() throws Exception {
    log.trace("Starting Jetty server");
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "There was a problem while attempting to start jetty service. "
                        + "Please, check if the chosen port and hostname are available",
                    ex));
      }
    }
  }

  /**
   * Stop Jetty, waiting at most {@code stopTimeoutMillis} for open requests. Errors are logged and
   * not rethrown so that the remaining shutdown steps still run.
   */
  public void stop(long stopTimeoutMillis) {
    log.trace("Stopping Jetty server");
    synchronized (lifecycleLock) {
      if (server == null) return;
      Server s = server;
      try {
        if (s.isRunning() || s.isStarted() || s.isStarting()) {
          s.setStopTimeout(stopTimeoutMillis);
          s.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping jetty server, continuing shutdown", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public void stop() {
    stop(2000);
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started (useful with {@code http.port: 0}), else the configured port. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        for (Connector connector : server.getConnectors()) {
          if (connector instanceof ServerConnector sc && sc.getLocalPort() > 0) {
            return sc.getLocalPort();
          }
        }
      }
      return configuration.getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
