package com.gentoro.fetchgate.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fetchgate.batch.BatchService;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /health */
public final class HealthServlet extends HttpServlet {
  private final BatchService batches;
  private final ObjectMapper mapper;

  public HealthServlet(BatchService batches, ObjectMapper mapper) {
    this.batches = batches;
    this.mapper = mapper;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", batches.isShuttingDown() ? "SHUTTING_DOWN" : "UP");
    node.put("batchesInFlight", batches.registry().activeCount());
    node.put("admissionAvailable", batches.admission().available());
    node.put("admissionCapacity", batches.admission().capacity());

    resp.setStatus(batches.isShuttingDown() ? 503 : 200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
