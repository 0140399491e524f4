package com.gentoro.onesync.sync;

import com.gentoro.onesync.config.ScheduleMode;
import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.exception.ExceptionUtil;
import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.MirrorSnapshot;
import com.gentoro.onesync.model.PersonaModel;
import com.gentoro.onesync.model.RuleModel;
import com.gentoro.onesync.model.SyncStatus;
import com.gentoro.onesync.source.SourceLoader;
import com.gentoro.onesync.store.ContentStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * Pulls content from a {@link SourceLoader} into a {@link ContentStore}.
 *
 * <p>A pass handles commands, personas and rules in that order. A failure in one category is
 * recorded and does not stop the others; nothing is rolled back. Only one pass runs at a time:
 * a request arriving while a pass is in flight is rejected, not queued. Timer ticks and on-demand
 * calls share that guard.
 */
public class SyncService implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(SyncService.class);

  static final String TIMER_THREAD_NAME = "onesync-sync-timer";
  static final String WORKER_THREAD_NAME = "onesync-sync-worker";

  private final SourceLoader loader;
  private final ContentStore store;
  private final ChangeDetector changeDetector;
  private final Duration interval;
  private final ScheduleMode scheduleMode;
  private final AtomicBoolean syncing = new AtomicBoolean(false);

  private ScheduledExecutorService scheduler;
  private ThreadPoolExecutor worker;
  private ScheduledFuture<?> periodicTask;

  public SyncService(SourceLoader loader, ContentStore store, SyncConfiguration config) {
    this(
        loader,
        store,
        Duration.ofMinutes(config.syncIntervalMinutes()),
        config.scheduleMode(),
        Clock.systemUTC());
  }

  public SyncService(
      SourceLoader loader,
      ContentStore store,
      Duration interval,
      ScheduleMode scheduleMode,
      Clock clock) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.store = Objects.requireNonNull(store, "store");
    this.changeDetector = new ChangeDetector(clock);
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Sync interval must be positive: " + interval);
    }
    this.interval = interval;
    this.scheduleMode = Objects.requireNonNull(scheduleMode, "scheduleMode");
  }

  /**
   * Runs one full pass.
   *
   * @return the outcome, or a result with {@code skipped == true} if a pass was already running.
   */
  public SyncResult syncFromSource() {
    if (!syncing.compareAndSet(false, true)) {
      log.warn("Sync already in progress, skipping request");
      return SyncResult.skippedPass();
    }

    long started = System.nanoTime();
    try {
      log.info("Starting sync from {}", loader.describe());
      loader.clearUnparsedFiles();
      List<String> errors = new ArrayList<>();

      int commands = syncCategory("Commands", errors, this::syncCommands);
      int personas = syncCategory("Personas", errors, this::syncPersonas);
      int rules = syncCategory("Rules", errors, this::syncRules);

      store.replaceUnparsedFiles(loader.getUnparsedFiles());

      SyncStatus status = errors.isEmpty() ? SyncStatus.SUCCESS : SyncStatus.FAILED;
      store.updateSyncMetadata(status, errors.isEmpty() ? null : String.join("; ", errors));

      SyncResult result =
          new SyncResult(
              status,
              commands,
              personas,
              rules,
              errors,
              Duration.ofNanos(System.nanoTime() - started),
              false);
      if (result.isSuccess()) {
        log.info(
            "Sync completed in {} ms: {} commands, {} personas, {} rules updated",
            result.duration().toMillis(),
            commands,
            personas,
            rules);
      } else {
        log.warn("Sync completed with errors: {}", String.join("; ", errors));
      }
      return result;
    } catch (RuntimeException e) {
      log.error("Sync failed: {}", ExceptionUtil.describe(e), e);
      try {
        store.updateSyncMetadata(SyncStatus.FAILED, "Sync: " + ExceptionUtil.describe(e));
      } catch (RuntimeException metadataError) {
        e.addSuppressed(metadataError);
        log.error("Failed to record sync failure: {}", ExceptionUtil.describe(metadataError));
      }
      throw e;
    } finally {
      syncing.set(false);
    }
  }

  private int syncCategory(String category, List<String> errors, IntSupplier pass) {
    try {
      return pass.getAsInt();
    } catch (RuntimeException e) {
      log.error("Failed to sync {}: {}", category.toLowerCase(), ExceptionUtil.describe(e), e);
      errors.add(category + ": " + ExceptionUtil.describe(e));
      return 0;
    }
  }

  private int syncCommands() {
    ChangeDetector.ChangeSet<CommandModel> changes =
        changeDetector.detect(loader.loadCommands(), store.getAllCommands(), CommandModel::of);
    store.upsertCommands(changes.models());
    log.debug("Commands: {} loaded, {} updated", changes.models().size(), changes.updated());
    return changes.updated();
  }

  private int syncPersonas() {
    ChangeDetector.ChangeSet<PersonaModel> changes =
        changeDetector.detect(loader.loadPersonas(), store.getAllPersonas(), PersonaModel::of);
    store.upsertPersonas(changes.models());
    log.debug("Personas: {} loaded, {} updated", changes.models().size(), changes.updated());
    return changes.updated();
  }

  private int syncRules() {
    ChangeDetector.ChangeSet<RuleModel> changes =
        changeDetector.detect(loader.loadRules().rules(), store.getAllRules(), RuleModel::of);
    store.upsertRules(changes.models());
    log.debug("Rules: {} loaded, {} updated", changes.models().size(), changes.updated());
    return changes.updated();
  }

  /** Reads the current mirror without touching the source. */
  public MirrorSnapshot loadFromDatabase() {
    Map<String, PersonaModel> personas = new LinkedHashMap<>();
    for (PersonaModel persona : store.getAllPersonas()) {
      personas.put(persona.id(), persona);
    }
    return new MirrorSnapshot(
        store.getAllCommands(), Collections.unmodifiableMap(personas), store.getAllRules());
  }

  /**
   * Schedules a pass every interval. The first pass runs one interval from now. Calling this while
   * the timer runs has no effect.
   *
   * <p>In fixed-rate mode the timer thread only hands each tick to a single worker that has no
   * queue, so a tick landing while a pass runs is dropped instead of being replayed once the pass
   * ends. Fixed-delay ticks run on the timer thread itself, which never lets them overlap.
   */
  public synchronized void startPeriodicSync() {
    if (periodicTask != null) {
      log.warn("Periodic sync already running");
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads(TIMER_THREAD_NAME));
    long period = interval.toMillis();
    if (scheduleMode == ScheduleMode.FIXED_DELAY) {
      periodicTask =
          scheduler.scheduleWithFixedDelay(
              this::runScheduledSync, period, period, TimeUnit.MILLISECONDS);
    } else {
      worker =
          new ThreadPoolExecutor(
              1,
              1,
              0L,
              TimeUnit.MILLISECONDS,
              new SynchronousQueue<>(),
              daemonThreads(WORKER_THREAD_NAME));
      periodicTask =
          scheduler.scheduleAtFixedRate(this::dispatchTick, period, period, TimeUnit.MILLISECONDS);
    }
    log.info("Periodic sync started: every {} ({})", interval, scheduleMode);
  }

  public synchronized void stopPeriodicSync() {
    if (periodicTask == null) return;
    periodicTask.cancel(false);
    scheduler.shutdown();
    if (worker != null) {
      worker.shutdown();
    }
    periodicTask = null;
    scheduler = null;
    worker = null;
    log.info("Periodic sync stopped");
  }

  private static ThreadFactory daemonThreads(String name) {
    return runnable -> {
      Thread thread = new Thread(runnable, name);
      thread.setDaemon(true);
      return thread;
    };
  }

  private void dispatchTick() {
    ThreadPoolExecutor current;
    synchronized (this) {
      current = worker;
    }
    if (current == null) return;
    try {
      current.execute(this::runScheduledSync);
    } catch (RejectedExecutionException e) {
      log.debug("Scheduled sync skipped, previous pass still running");
    }
  }

  private void runScheduledSync() {
    try {
      SyncResult result = syncFromSource();
      if (result.skipped()) {
        log.debug("Scheduled sync skipped, previous pass still running");
      }
    } catch (Exception e) {
      // An escaping exception would cancel every future tick.
      log.error("Scheduled sync failed: {}", ExceptionUtil.describe(e), e);
    }
  }

  public boolean isSyncing() {
    return syncing.get();
  }

  public synchronized boolean isPeriodicSyncRunning() {
    return periodicTask != null;
  }

  public SourceLoader getLoader() {
    return loader;
  }

  public ContentStore getStore() {
    return store;
  }

  @Override
  public void close() {
    stopPeriodicSync();
  }
}
