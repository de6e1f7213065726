package com.gentoro.fetchgate.testutil;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Local HTTP server standing in for fetched resources.
 *
 * <ul>
 *   <li>{@code /ok}: 200
 *   <li>{@code /slow}: sleeps {@code slowMillis}, then 200
 *   <li>{@code /status/{code}}: responds with {@code code}
 * </ul>
 */
public final class UpstreamServer implements AutoCloseable {
  private final Server server;
  private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
  private final AtomicInteger totalHits = new AtomicInteger();
  private final long slowMillis;

  public UpstreamServer(long slowMillis) throws Exception {
    this.slowMillis = slowMillis;
    server = new Server();
    ServerConnector connector = new ServerConnector(server);
    connector.setHost("127.0.0.1");
    connector.setPort(0);
    server.addConnector(connector);
    ServletContextHandler ctx = new ServletContextHandler();
    ctx.setContextPath("/");
    ctx.addServlet(new ServletHolder(new ResourceServlet()), "/");
    server.setHandler(ctx);
    server.setStopTimeout(500);
    server.start();
  }

  public String url(String path) {
    int port = ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    return "http://127.0.0.1:" + port + path;
  }

  public int hits(String path) {
    AtomicInteger count = hits.get(path);
    return count == null ? 0 : count.get();
  }

  public int totalHits() {
    return totalHits.get();
  }

  @Override
  public void close() throws Exception {
    server.stop();
  }

  private final class ResourceServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String path = req.getRequestURI();
      hits.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
      totalHits.incrementAndGet();

      if (path.startsWith("/slow")) {
        try {
          Thread.sleep(slowMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        resp.setStatus(200);
      } else if (path.startsWith("/status/")) {
        resp.setStatus(Integer.parseInt(path.substring("/status/".length())));
      } else if (path.startsWith("/ok")) {
        resp.setStatus(200);
      } else {
        resp.setStatus(404);
      }
      resp.setContentType("text/plain");
      resp.getWriter().write("body of " + path);
    }
  }
}
