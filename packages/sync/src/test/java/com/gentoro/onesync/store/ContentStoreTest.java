package com.gentoro.onesync.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.MutableClock;
import com.gentoro.onesync.exception.StateException;
import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.PersonaModel;
import com.gentoro.onesync.model.RuleModel;
import com.gentoro.onesync.model.SyncMetadata;
import com.gentoro.onesync.model.SyncStatus;
import com.gentoro.onesync.model.UnparsedFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentStoreTest {

  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

  @TempDir Path tempDir;

  private final MutableClock clock = new MutableClock(T0);

  private static CommandModel command(String name, String hash) {
    return new CommandModel(name, hash, T0, name, "desc " + hash, "prompt", null, null);
  }

  @Test
  @DisplayName("Every operation before initialize() fails fast")
  void rejectsUseBeforeInitialize() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);

    StateException error = assertThrows(StateException.class, store::getAllCommands);
    assertEquals("Content store not initialized. Call initialize() first.", error.getMessage());
    assertThrows(StateException.class, () -> store.upsertCommand(command("a", "1")));
    assertThrows(StateException.class, () -> store.updateSyncMetadata(SyncStatus.SUCCESS));
    assertThrows(StateException.class, store::clearAll);
  }

  @Test
  void freshStoreHasZeroedMetadata() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();
    store.initialize();

    SyncMetadata metadata = store.getSyncMetadata();
    assertEquals(Instant.EPOCH, metadata.lastSync());
    assertEquals(SyncStatus.FAILED, metadata.syncStatus());
    assertEquals("never synchronized", metadata.errorMessage());
    assertTrue(store.getAllCommands().isEmpty());
  }

  @Test
  void upsertReplacesByIdAndAppendsNewItems() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();

    store.upsertCommands(List.of(command("a", "1"), command("b", "1")));
    store.upsertCommand(command("a", "2"));
    store.upsertCommand(command("c", "1"));

    List<CommandModel> commands = store.getAllCommands();
    assertEquals(List.of("a", "b", "c"), commands.stream().map(CommandModel::id).toList());
    assertEquals("2", commands.get(0).hash());
  }

  @Test
  void personasAndRulesAreKeptSeparately() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();

    store.upsertPersona(new PersonaModel("architect", "h", T0, "architect", "d", "i"));
    store.upsertRule(new RuleModel("KISS", "h", T0, "KISS", "Keep it simple"));

    assertEquals(1, store.getAllPersonas().size());
    assertEquals("Keep it simple", store.getAllRules().get(0).content());
    assertTrue(store.getAllCommands().isEmpty());
  }

  @Test
  void syncMetadataUsesStoreClock() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();
    clock.advance(Duration.ofMinutes(3));

    store.updateSyncMetadata(SyncStatus.FAILED, "Personas: boom");

    assertEquals(T0.plus(Duration.ofMinutes(3)), store.getLastSync());
    assertEquals("Personas: boom", store.getSyncMetadata().errorMessage());

    store.updateSyncMetadata(SyncStatus.SUCCESS);
    assertTrue(store.getSyncMetadata().isSuccess());
    assertNull(store.getSyncMetadata().errorMessage());
  }

  @Test
  void unparsedFilesAreReplacedAndCleared() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();

    store.replaceUnparsedFiles(List.of(new UnparsedFile("a.yaml", "bad", T0, "local")));
    assertEquals(1, store.getUnparsedFiles().size());

    store.clearUnparsedFiles();
    assertTrue(store.getUnparsedFiles().isEmpty());
  }

  @Test
  void clearAllResetsDocument() {
    ContentStore store = new ContentStore(new InMemoryDocumentStorage(), clock);
    store.initialize();
    store.upsertCommand(command("a", "1"));
    store.updateSyncMetadata(SyncStatus.SUCCESS);

    store.clearAll();

    assertTrue(store.getAllCommands().isEmpty());
    assertEquals(Instant.EPOCH, store.getLastSync());
  }

  @Test
  void fileStorePersistsAcrossReopen() {
    Path file = tempDir.resolve("nested/dir/db.json");

    ContentStore first = new ContentStore(new FileDocumentStorage(file), clock);
    first.initialize();
    first.upsertCommand(command("a", "1"));
    first.updateSyncMetadata(SyncStatus.SUCCESS);
    first.close();

    assertTrue(Files.isRegularFile(file));
    assertThrows(StateException.class, first::getAllCommands);

    ContentStore second = new ContentStore(new FileDocumentStorage(file), clock);
    second.initialize();
    assertEquals(List.of(command("a", "1")), second.getAllCommands());
    assertEquals(SyncStatus.SUCCESS, second.getSyncMetadata().syncStatus());
    second.close();
  }

  @Test
  void secondOwnerIsRejectedWhileFirstIsOpen() {
    Path file = tempDir.resolve("db.json");
    ContentStore owner = new ContentStore(new FileDocumentStorage(file), clock);
    owner.initialize();

    ContentStore intruder = new ContentStore(new FileDocumentStorage(file), clock);
    assertThrows(StateException.class, intruder::initialize);
    assertFalse(intruder.isInitialized());

    owner.close();
    intruder.initialize();
    assertTrue(intruder.isInitialized());
    intruder.close();
  }
}
