package com.gentoro.onesync.store;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onesync.exception.SerializationException;
import com.gentoro.onesync.model.CommandArgument;
import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.Database;
import com.gentoro.onesync.model.SyncMetadata;
import com.gentoro.onesync.model.SyncStatus;
import com.gentoro.onesync.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDocumentStorageTest {

  @TempDir Path tempDir;

  @Test
  void missingFileReadsAsEmpty() {
    assertTrue(new FileDocumentStorage(tempDir.resolve("db.json")).read().isEmpty());
  }

  @Test
  void writesIsoTimestampsAndOmitsAbsentFields() throws Exception {
    Path file = tempDir.resolve("db.json");
    FileDocumentStorage storage = new FileDocumentStorage(file);
    storage.open();

    Database database = Database.empty();
    database.setCommands(
        List.of(
            new CommandModel(
                "build",
                "abc",
                Instant.parse("2025-01-01T10:15:30Z"),
                "build",
                "Build",
                "Build $TARGET",
                null,
                List.of(new CommandArgument("TARGET", "Argument: $TARGET", true)))));
    database.setSyncMetadata(
        new SyncMetadata(Instant.parse("2025-01-01T10:16:00Z"), SyncStatus.SUCCESS, null));
    storage.write(database);
    storage.close();

    JsonNode json = JacksonUtility.getJsonMapper().readTree(file.toFile());
    JsonNode command = json.get("commands").get(0);
    assertEquals("2025-01-01T10:15:30Z", command.get("lastUpdated").asText());
    assertFalse(command.has("messages"));
    assertEquals("success", json.get("syncMetadata").get("syncStatus").asText());
    assertFalse(json.get("syncMetadata").has("errorMessage"));
    assertTrue(json.get("unparsedFiles").isArray());
    assertFalse(Files.exists(tempDir.resolve("db.json.tmp")));
  }

  @Test
  void malformedFileIsReportedAsSerializationError() throws Exception {
    Path file = tempDir.resolve("db.json");
    Files.writeString(file, "{ not json");

    assertThrows(SerializationException.class, () -> new FileDocumentStorage(file).read());
  }

  @Test
  void readsDocumentsWithoutOptionalSections() throws Exception {
    Path file = tempDir.resolve("db.json");
    Files.writeString(
        file,
        """
        {"commands": [], "personas": [], "rules": [],
         "syncMetadata": {"lastSync": "2025-01-01T00:00:00Z", "syncStatus": "failed",
                          "errorMessage": "Rules: offline"}}
        """);

    Database database = new FileDocumentStorage(file).read().orElseThrow();

    assertTrue(database.getUnparsedFiles().isEmpty());
    assertEquals("Rules: offline", database.getSyncMetadata().errorMessage());
  }
}
