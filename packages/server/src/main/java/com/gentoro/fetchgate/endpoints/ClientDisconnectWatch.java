package com.gentoro.fetchgate.endpoints;

import com.gentoro.fetchgate.concurrent.CancellationToken;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.jetty.ee10.servlet.ServletContextRequest;
import org.eclipse.jetty.io.EndPoint;
import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;

/**
 * Cancels a batch when its client goes away.
 *
 * <p>Once the request body has been read, Jetty stops reading from the connection, so a client
 * that closes its socket goes unnoticed until the response is written. The watch puts a read
 * interest on the connection and treats end-of-stream as a disconnect. It also listens for
 * failures Jetty reports on the request itself.
 *
 * <p>While the watch holds the read interest, the connection cannot serve a pipelined request, so
 * the response is sent with {@code Connection: close}.
 */
final class ClientDisconnectWatch implements Callback {
  private static final Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(ClientDisconnectWatch.class);

  private final CancellationToken token;
  private final EndPoint endPoint;
  private final AtomicBoolean finished = new AtomicBoolean(false);
  private volatile boolean disconnected;
  private volatile boolean reading;

  private ClientDisconnectWatch(CancellationToken token, EndPoint endPoint) {
    this.token = token;
    this.endPoint = endPoint;
  }

  /**
   * Start watching the connection behind {@code req}.
   *
   * @return the watch; {@link #holdsConnection()} tells whether it is reading the connection
   */
  static ClientDisconnectWatch start(HttpServletRequest req, CancellationToken token) {
    ServletContextRequest request = ServletContextRequest.getServletContextRequest(req);
    EndPoint endPoint = null;
    if (request != null && request.getConnectionMetaData().getConnection() != null) {
      endPoint = request.getConnectionMetaData().getConnection().getEndPoint();
    }
    ClientDisconnectWatch watch = new ClientDisconnectWatch(token, endPoint);
    if (request != null) {
      request.addFailureListener(watch::clientGone);
    }
    watch.arm();
    return watch;
  }

  boolean holdsConnection() {
    return reading;
  }

  boolean disconnected() {
    return disconnected;
  }

  /** Stop reacting to connection events; called before the response is written. */
  void finish() {
    finished.set(true);
  }

  /** Record a disconnect reported by the container and cancel the batch. */
  void clientGone(Throwable cause) {
    if (finished.get()) return;
    disconnected = true;
    if (token.cancel("client connection closed", cause)) {
      log.info("Client went away, cancelling batch: {}", cause.toString());
    }
  }

  private void arm() {
    if (endPoint == null || !endPoint.isOpen()) return;
    if (endPoint.tryFillInterested(this)) {
      reading = true;
    } else if (!reading) {
      log.debug("Connection already has a reader, relying on request failure events");
    }
  }

  @Override
  public void succeeded() {
    ByteBuffer buffer = BufferUtil.allocate(1);
    try {
      int filled = endPoint.fill(buffer);
      if (filled < 0) {
        clientGone(new EofException("client closed connection"));
      } else if (filled == 0) {
        arm();
      } else if (!finished.get()) {
        log.debug("Client sent data while its batch is in flight, no longer watching");
      }
    } catch (IOException e) {
      clientGone(e);
    }
  }

  @Override
  public void failed(Throwable x) {
    clientGone(x);
  }
}
