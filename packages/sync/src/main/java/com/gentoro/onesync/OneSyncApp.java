package com.gentoro.onesync;

public class OneSyncApp {

  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(OneSyncApp.class);

  public static void main(String[] args) {
    try {
      OneSync app = new OneSync(args);
      app.initialize();
      if (app.isWatching()) {
        app.waitShutdownSignal();
      }
    } catch (Exception e) {
      log.error("Application failed", e);
      System.exit(1);
    }
  }
}
