package com.gentoro.onesync.store;

import com.gentoro.onesync.exception.StateException;
import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.ContentModel;
import com.gentoro.onesync.model.Database;
import com.gentoro.onesync.model.PersonaModel;
import com.gentoro.onesync.model.RuleModel;
import com.gentoro.onesync.model.SyncMetadata;
import com.gentoro.onesync.model.SyncStatus;
import com.gentoro.onesync.model.UnparsedFile;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Document store for the mirror. Every mutation re-reads the backing document, applies the change
 * and writes the whole document back. Methods are synchronized so the timer thread and callers
 * never interleave a read-modify-write.
 */
public class ContentStore implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(ContentStore.class);

  static final String NOT_INITIALIZED = "Content store not initialized. Call initialize() first.";

  private final DocumentStorage storage;
  private final Clock clock;
  private boolean initialized;

  public ContentStore(Path databaseFile) {
    this(new FileDocumentStorage(databaseFile), Clock.systemUTC());
  }

  public ContentStore(DocumentStorage storage, Clock clock) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Opens the storage and writes an empty document if none exists yet. Idempotent. */
  public synchronized void initialize() {
    if (initialized) return;
    storage.open();
    try {
      if (storage.read().isEmpty()) {
        storage.write(Database.empty());
        log.info("Created empty database at {}", storage.describe());
      }
    } catch (RuntimeException e) {
      storage.close();
      throw e;
    }
    initialized = true;
    log.debug("Content store initialized at {}", storage.describe());
  }

  public synchronized boolean isInitialized() {
    return initialized;
  }

  public void upsertCommand(CommandModel command) {
    upsertCommands(List.of(command));
  }

  public synchronized void upsertCommands(List<CommandModel> commands) {
    upsert(commands, Database::getCommands, Database::setCommands);
  }

  public void upsertPersona(PersonaModel persona) {
    upsertPersonas(List.of(persona));
  }

  public synchronized void upsertPersonas(List<PersonaModel> personas) {
    upsert(personas, Database::getPersonas, Database::setPersonas);
  }

  public void upsertRule(RuleModel rule) {
    upsertRules(List.of(rule));
  }

  public synchronized void upsertRules(List<RuleModel> rules) {
    upsert(rules, Database::getRules, Database::setRules);
  }

  private <T extends ContentModel<?>> void upsert(
      List<T> items, Function<Database, List<T>> getter, BiConsumer<Database, List<T>> setter) {
    Database database = read();
    if (items.isEmpty()) return;
    List<T> merged = new ArrayList<>(getter.apply(database));
    for (T item : items) {
      int index = indexOf(merged, item.id());
      if (index >= 0) {
        merged.set(index, item);
      } else {
        merged.add(item);
      }
    }
    setter.accept(database, merged);
    write(database);
  }

  private static int indexOf(List<? extends ContentModel<?>> items, String id) {
    for (int i = 0; i < items.size(); i++) {
      if (Objects.equals(items.get(i).id(), id)) return i;
    }
    return -1;
  }

  public synchronized List<CommandModel> getAllCommands() {
    return List.copyOf(read().getCommands());
  }

  public synchronized List<PersonaModel> getAllPersonas() {
    return List.copyOf(read().getPersonas());
  }

  public synchronized List<RuleModel> getAllRules() {
    return List.copyOf(read().getRules());
  }

  public synchronized Instant getLastSync() {
    return read().getSyncMetadata().lastSync();
  }

  public synchronized SyncMetadata getSyncMetadata() {
    return read().getSyncMetadata();
  }

  public void updateSyncMetadata(SyncStatus status) {
    updateSyncMetadata(status, null);
  }

  /** Overwrites the metadata with {@code lastSync = now}. */
  public synchronized void updateSyncMetadata(SyncStatus status, String errorMessage) {
    Database database = read();
    database.setSyncMetadata(new SyncMetadata(clock.instant(), status, errorMessage));
    write(database);
  }

  public synchronized void replaceUnparsedFiles(List<UnparsedFile> unparsedFiles) {
    Database database = read();
    database.setUnparsedFiles(unparsedFiles);
    write(database);
  }

  public synchronized List<UnparsedFile> getUnparsedFiles() {
    return List.copyOf(read().getUnparsedFiles());
  }

  public void clearUnparsedFiles() {
    replaceUnparsedFiles(List.of());
  }

  /** Replaces the whole document with a fresh empty one. */
  public synchronized void clearAll() {
    read();
    write(Database.empty());
    log.info("Cleared database at {}", storage.describe());
  }

  /** Releases the storage. The store must be initialized again before further use. */
  @Override
  public synchronized void close() {
    if (!initialized) return;
    initialized = false;
    storage.close();
    log.debug("Content store closed");
  }

  private Database read() {
    ensureInitialized();
    return storage.read().orElseGet(Database::empty);
  }

  private void write(Database database) {
    ensureInitialized();
    storage.write(database);
  }

  private void ensureInitialized() {
    if (!initialized) {
      throw new StateException(NOT_INITIALIZED);
    }
  }
}
