package com.gentoro.onesync;

import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.exception.StateException;
import com.gentoro.onesync.report.SyncReportGenerator;
import com.gentoro.onesync.source.SourceLoader;
import com.gentoro.onesync.source.SourceLoaderFactory;
import com.gentoro.onesync.store.ContentStore;
import com.gentoro.onesync.sync.ContentMirror;
import com.gentoro.onesync.sync.SyncResult;
import com.gentoro.onesync.sync.SyncService;
import com.gentoro.onesync.utility.StdoutUtility;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

public class OneSync {

  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(OneSync.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private SyncConfiguration syncConfiguration;
  private ContentStore store;
  private SourceLoader loader;
  private SyncService syncService;
  private ContentMirror mirror;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public OneSync(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // OkHttp reports through java.util.logging; everything else goes through SLF4J.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    String mode = startupParameters.mode();
    if (StartupParameters.MODE_HELP.equals(mode)) {
      printHelp();
      shutdown();
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.onesync.logging.LoggingService.applyConfiguration(configuration());
    this.syncConfiguration = SyncConfiguration.from(configuration());

    this.store = new ContentStore(syncConfiguration.databasePath());
    store.initialize();
    try {
      this.loader = SourceLoaderFactory.create(syncConfiguration);
      this.syncService = new SyncService(loader, store, syncConfiguration);
      this.mirror = new ContentMirror(syncService);

      switch (mode) {
        case StartupParameters.MODE_SYNC:
          StdoutUtility.printSyncResult(syncService.syncFromSource());
          printReport();
          shutdown();
          break;
        case StartupParameters.MODE_REPORT:
          printReport();
          shutdown();
          break;
        case StartupParameters.MODE_WATCH:
          startWatching();
          break;
        default:
          throw new IllegalArgumentException("Invalid mode: " + mode);
      }
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  private void startWatching() {
    if (syncConfiguration.syncOnStartup()) {
      SyncResult result = syncService.syncFromSource();
      StdoutUtility.printSyncResult(result);
    }
    if (syncConfiguration.autoSyncEnabled()) {
      syncService.startPeriodicSync();
      StdoutUtility.printNewLine(
          "Watching %s every %d minutes, press Ctrl+C to stop"
              .formatted(loader.describe(), syncConfiguration.syncIntervalMinutes()));
    } else {
      log.warn("sync.auto-sync-enabled is false; watch mode will not schedule any sync");
    }
  }

  private void printReport() {
    StdoutUtility.printNewLine(new SyncReportGenerator().generate(mirror, loader.describe()));
  }

  private void printHelp() {
    StdoutUtility.printNewLine(
        """
        Usage: onesync [--config-file <location>] [--mode <sync|watch|report|help>]

          --config-file  YAML configuration: classpath:<resource>, file:<uri> or a path
                         (default classpath:application.yaml)
          --mode         sync    run one pass and print the mirror report (default)
                         watch   sync on startup and periodically until interrupted
                         report  print the mirror report without syncing
                         help    print this message""");
  }

  /** Whether the application keeps running after {@link #initialize()} returns. */
  public boolean isWatching() {
    return StartupParameters.MODE_WATCH.equals(startupParameters.mode()) && !shuttingDown.get();
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "onesync-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(syncService);
        closeQuietly(store);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("OneSync not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public SyncConfiguration syncConfiguration() {
    return syncConfiguration;
  }

  public ContentMirror mirror() {
    return mirror;
  }

  public SyncService syncService() {
    return syncService;
  }
}
