package com.gentoro.fetchgate.batch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory record of active batch runs plus a bounded history of finished ones. */
public final class BatchRegistry {
  private final Map<String, BatchRun> active = new ConcurrentHashMap<>();
  private final Deque<BatchRun> history = new ArrayDeque<>();
  private final int historySize;

  public BatchRegistry(int historySize) {
    this.historySize = historySize;
  }

  void register(BatchRun run) {
    active.put(run.id(), run);
  }

  void finished(BatchRun run) {
    active.remove(run.id());
    if (historySize == 0) return;
    synchronized (history) {
      history.addFirst(run);
      while (history.size() > historySize) {
        history.removeLast();
      }
    }
  }

  public Optional<BatchRun> get(String id) {
    BatchRun run = active.get(id);
    if (run != null) return Optional.of(run);
    synchronized (history) {
      return history.stream().filter(r -> r.id().equals(id)).findFirst();
    }
  }

  public Collection<BatchRun> active() {
    return List.copyOf(active.values());
  }

  public int activeCount() {
    return active.size();
  }

  /** Active runs first, then finished runs from newest to oldest. */
  public List<BatchRun> recent() {
    List<BatchRun> all = new ArrayList<>(active.values());
    synchronized (history) {
      all.addAll(history);
    }
    return all;
  }
}
