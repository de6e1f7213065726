package com.gentoro.fetchgate;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.fetchgate.batch.BatchRun;
import com.gentoro.fetchgate.batch.BatchService;
import com.gentoro.fetchgate.batch.BatchState;
import com.gentoro.fetchgate.testutil.Await;
import com.gentoro.fetchgate.testutil.UpstreamServer;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

/** Boots the whole server on an ephemeral port and talks to it over real HTTP. */
@Timeout(60)
class FetchGateIntegrationTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static UpstreamServer upstream;
  private static FetchGate gate;
  private static HttpClient http;
  private static String base;

  @BeforeAll
  static void start() throws Exception {
    upstream = new UpstreamServer(2000);
    gate = new FetchGate(new String[] {"--config", "classpath:test-application.yaml"});
    gate.initialize();
    base = "http://127.0.0.1:" + gate.httpServer().getPort();
    http =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(2))
            .build();
  }

  @AfterAll
  static void stop() throws Exception {
    if (gate != null) gate.shutdown();
    if (upstream != null) upstream.close();
  }

  private static HttpResponse<String> postUrls(List<String> urls) throws Exception {
    return post(MAPPER.writeValueAsString(urls));
  }

  private static HttpResponse<String> post(String body) throws Exception {
    HttpRequest req =
        HttpRequest.newBuilder(URI.create(base + "/"))
            .header("Content-Type", "application/json")
            .timeout(Duration.ofSeconds(10))
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    return http.send(req, HttpResponse.BodyHandlers.ofString());
  }

  private static HttpResponse<String> get(String path) throws Exception {
    HttpRequest req =
        HttpRequest.newBuilder(URI.create(base + path))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
    return http.send(req, HttpResponse.BodyHandlers.ofString());
  }

  @Test
  void loadsTestConfiguration() {
    assertEquals(Duration.ofMillis(300), gate.settings().fetchTimeout());
    assertEquals(4, gate.settings().maxConcurrentFetches());
    assertTrue(gate.httpServer().isRunning());
  }

  @Test
  @DisplayName("two reachable URLs answer with both statuses in request order")
  void allReachable() throws Exception {
    String a = upstream.url("/ok/a");
    String b = upstream.url("/status/404");

    HttpResponse<String> resp = postUrls(List.of(a, b));

    assertEquals(200, resp.statusCode());
    JsonNode body = MAPPER.readTree(resp.body());
    assertEquals(2, body.size());
    assertEquals(a, body.get(0).get("url").asText());
    assertEquals(200, body.get(0).get("status").asInt());
    assertEquals(b, body.get(1).get("url").asText());
    assertEquals(404, body.get(1).get("status").asInt());
  }

  @Test
  @DisplayName("one slow URL turns the whole response into a single error")
  void slowUrlFailsBatch() throws Exception {
    String slow = upstream.url("/slow/batch");

    long start = System.nanoTime();
    HttpResponse<String> resp = postUrls(List.of(upstream.url("/ok/b"), slow));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(502, resp.statusCode());
    assertTrue(resp.body().contains(slow), resp.body());
    assertFalse(resp.body().contains("\"status\""));
    assertTrue(elapsedMs < 1500, "answered after " + elapsedMs + "ms");
  }

  @Test
  @DisplayName("a malformed URL fails the batch without reaching the network")
  void malformedUrlFailsBatch() throws Exception {
    HttpResponse<String> resp = postUrls(List.of(upstream.url("/ok/c"), "not a url"));
    assertEquals(502, resp.statusCode());
    assertTrue(resp.body().contains("not a url"));
  }

  @Test
  void twentyOneUrlsAreRejectedWithoutFetching() throws Exception {
    int before = upstream.totalHits();
    List<String> urls = new ArrayList<>();
    for (int i = 0; i < 21; i++) urls.add(upstream.url("/ok/many-" + i));

    HttpResponse<String> resp = postUrls(urls);

    assertEquals(400, resp.statusCode());
    assertEquals("Too many URLs: 21, please send no more than 20", resp.body());
    Thread.sleep(100);
    assertEquals(before, upstream.totalHits());
  }

  @Test
  void twentyUrlsAreFetched() throws Exception {
    List<String> urls = new ArrayList<>();
    for (int i = 0; i < 20; i++) urls.add(upstream.url("/ok/twenty-" + i));

    HttpResponse<String> resp = postUrls(urls);

    assertEquals(200, resp.statusCode());
    JsonNode body = MAPPER.readTree(resp.body());
    assertEquals(20, body.size());
    for (int i = 0; i < 20; i++) {
      assertEquals(urls.get(i), body.get(i).get("url").asText());
    }
  }

  @Test
  void invalidBodyIsBadRequest() throws Exception {
    assertEquals(400, post("{\"urls\": []}").statusCode());
    assertEquals(400, post("[]").statusCode());
  }

  @Test
  void concurrentBatchesAllComplete() throws Exception {
    List<CompletableFuture<HttpResponse<String>>> responses = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      String body = MAPPER.writeValueAsString(List.of(upstream.url("/ok/concurrent-" + i)));
      HttpRequest req =
          HttpRequest.newBuilder(URI.create(base + "/"))
              .timeout(Duration.ofSeconds(10))
              .POST(HttpRequest.BodyPublishers.ofString(body))
              .build();
      responses.add(http.sendAsync(req, HttpResponse.BodyHandlers.ofString()));
    }
    for (CompletableFuture<HttpResponse<String>> response : responses) {
      assertEquals(200, response.get(10, TimeUnit.SECONDS).statusCode());
    }
    Await.until(
        "no batches in flight",
        Duration.ofSeconds(2),
        () -> gate.batchService().registry().activeCount() == 0);
    assertEquals(0, gate.batchService().admission().inUse());
  }

  @Test
  void healthAndBatchDiagnostics() throws Exception {
    postUrls(List.of(upstream.url("/ok/diag")));

    HttpResponse<String> health = get("/health");
    assertEquals(200, health.statusCode());
    assertEquals("UP", MAPPER.readTree(health.body()).get("status").asText());

    HttpResponse<String> batches = get("/batches");
    assertEquals(200, batches.statusCode());
    assertTrue(MAPPER.readTree(batches.body()).size() > 0);
  }

  @Test
  @DisplayName("a client closing its socket mid-batch cancels the batch and frees its slot")
  void clientDisconnectCancelsBatch(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("application.yaml");
    Files.writeString(
        config,
        String.join(
            "\n",
            "http:",
            "  hostname: 127.0.0.1",
            "  port: 0",
            "fetch:",
            "  timeout-ms: 5000",
            "shutdown:",
            "  grace-ms: 500",
            ""));
    FetchGate patient = new FetchGate(new String[] {"--config", config.toString()});
    patient.initialize();
    try {
      BatchService service = patient.batchService();
      String slow = upstream.url("/slow/disconnect");
      byte[] body = MAPPER.writeValueAsBytes(List.of(slow));
      String head =
          "POST / HTTP/1.1\r\n"
              + "Host: 127.0.0.1\r\n"
              + "Content-Type: application/json\r\n"
              + "Content-Length: "
              + body.length
              + "\r\n\r\n";

      BatchRun run;
      try (Socket socket = new Socket("127.0.0.1", patient.httpServer().getPort())) {
        OutputStream out = socket.getOutputStream();
        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
        Await.until(
            "upstream request in flight",
            Duration.ofSeconds(2),
            () -> upstream.hits("/slow/disconnect") > 0);
        run = service.registry().active().iterator().next();
        assertEquals(BatchState.RUNNING, run.state());
      }

      long closedAt = System.nanoTime();
      Await.until(
          "batch finished after disconnect",
          Duration.ofMillis(1000),
          () -> service.registry().activeCount() == 0 && service.admission().inUse() == 0);
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - closedAt);

      assertEquals(BatchState.CANCELLED, run.state());
      assertTrue(elapsedMs < 1000, "cancelled after " + elapsedMs + "ms");
    } finally {
      patient.shutdown();
    }
  }
}
