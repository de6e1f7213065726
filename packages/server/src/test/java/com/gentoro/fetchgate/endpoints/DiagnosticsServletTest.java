package com.gentoro.fetchgate.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.fetchgate.FetchGateSettings;
import com.gentoro.fetchgate.batch.BatchAbortedException;
import com.gentoro.fetchgate.batch.BatchService;
import com.gentoro.fetchgate.concurrent.CancellationToken;
import com.gentoro.fetchgate.fetch.FetchException;
import com.gentoro.fetchgate.fetch.FetchFailure;
import java.util.List;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiagnosticsServletTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private BatchService batches;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    batches =
        new BatchService(
            (identifier, token) -> {
              if (identifier.contains("broken")) {
                throw new FetchException(identifier, FetchFailure.NETWORK, "refused");
              }
              return 200;
            },
            FetchGateSettings.defaults());
    tester = new ServletTester();
    tester.addServlet(new ServletHolder(new HealthServlet(batches, mapper)), "/health");
    tester.addServlet(
        new ServletHolder(new BatchStatusServlet(batches.registry(), mapper)), "/batches/*");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
    batches.close();
  }

  private HttpTester.Response get(String uri) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("GET");
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void healthReportsAdmissionCapacity() throws Exception {
    HttpTester.Response resp = get("/health");

    assertEquals(200, resp.getStatus());
    JsonNode body = mapper.readTree(resp.getContent());
    assertEquals("UP", body.get("status").asText());
    assertEquals(0, body.get("batchesInFlight").asInt());
    assertEquals(100, body.get("admissionCapacity").asInt());
    assertEquals(100, body.get("admissionAvailable").asInt());
  }

  @Test
  void healthIsUnavailableDuringShutdown() throws Exception {
    batches.beginShutdown();
    HttpTester.Response resp = get("/health");
    assertEquals(503, resp.getStatus());
    assertTrue(resp.getContent().contains("SHUTTING_DOWN"));
  }

  @Test
  void listsFinishedBatchesNewestFirst() throws Exception {
    batches.execute(List.of("https://a.example/"), new CancellationToken());
    assertThrows(
        BatchAbortedException.class,
        () -> batches.execute(List.of("https://broken.example/"), new CancellationToken()));

    HttpTester.Response resp = get("/batches");

    assertEquals(200, resp.getStatus());
    JsonNode list = mapper.readTree(resp.getContent());
    assertEquals(2, list.size());
    assertEquals("FAILED", list.get(0).get("state").asText());
    assertEquals("refused", list.get(0).get("message").asText());
    assertEquals("COMPLETED", list.get(1).get("state").asText());
    assertEquals(1, list.get(1).get("completedJobs").asInt());

    String id = list.get(1).get("batchId").asText();
    HttpTester.Response one = get("/batches/" + id);
    assertEquals(200, one.getStatus());
    assertEquals(id, mapper.readTree(one.getContent()).get("batchId").asText());
  }

  @Test
  void unknownBatchIsNotFound() throws Exception {
    assertEquals(404, get("/batches/does-not-exist").getStatus());
  }
}
