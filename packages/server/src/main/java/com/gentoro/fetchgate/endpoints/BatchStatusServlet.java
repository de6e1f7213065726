package com.gentoro.fetchgate.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fetchgate.batch.BatchRegistry;
import com.gentoro.fetchgate.batch.BatchRun;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /batches and GET /batches/{id}: diagnostic views of active and recent batch runs. */
public final class BatchStatusServlet extends HttpServlet {
  private final BatchRegistry registry;
  private final ObjectMapper mapper;

  public BatchStatusServlet(BatchRegistry registry, ObjectMapper mapper) {
    this.registry = registry;
    this.mapper = mapper;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) {
      ArrayNode list = mapper.createArrayNode();
      for (BatchRun run : registry.recent()) {
        list.add(toJson(run.view()));
      }
      writeJson(resp, list.toString());
      return;
    }

    String batchId = path.substring(1);
    var run = registry.get(batchId);
    if (run.isEmpty()) {
      resp.sendError(404, "Unknown batchId");
      return;
    }
    writeJson(resp, mapper.writeValueAsString(toJson(run.get().view())));
  }

  private ObjectNode toJson(BatchRun.View v) {
    ObjectNode node = mapper.createObjectNode();
    node.put("batchId", v.batchId());
    node.put("state", v.state());
    node.put("jobs", v.jobs());
    node.put("completedJobs", v.completedJobs());
    if (v.message() != null) node.put("message", v.message());
    if (v.createdAt() != null) node.put("createdAt", v.createdAt().toString());
    if (v.admittedAt() != null) node.put("admittedAt", v.admittedAt().toString());
    if (v.finishedAt() != null) node.put("finishedAt", v.finishedAt().toString());
    return node;
  }

  private static void writeJson(HttpServletResponse resp, String json) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(json);
  }
}
