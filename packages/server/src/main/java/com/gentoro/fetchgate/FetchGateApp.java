package com.gentoro.fetchgate;

public class FetchGateApp {

  private static final org.slf4j.Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(FetchGateApp.class);

  public static void main(String[] args) {
    try {
      FetchGate app = new FetchGate(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
