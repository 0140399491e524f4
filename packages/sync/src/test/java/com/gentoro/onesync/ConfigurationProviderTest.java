package com.gentoro.onesync;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.config.ScheduleMode;
import com.gentoro.onesync.config.SourceType;
import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void loadsClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:test-application.yaml").config();

    SyncConfiguration config = SyncConfiguration.from(cfg);
    assertEquals(SourceType.FILESYSTEM, config.sourceType());
    assertEquals(15, config.syncIntervalMinutes());
    assertEquals(ScheduleMode.FIXED_DELAY, config.scheduleMode());
    assertEquals(Path.of("target/test-db/db.json"), config.databasePath());
  }

  @Test
  void bundledConfigurationEnablesWatchScheduling() {
    Configuration cfg = new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION).config();

    SyncConfiguration config = SyncConfiguration.from(cfg);
    assertEquals(SourceType.REMOTE, config.sourceType());
    assertEquals(30, config.syncIntervalMinutes());
    assertTrue(config.autoSyncEnabled());
    assertTrue(config.syncOnStartup());
    assertEquals(ScheduleMode.FIXED_RATE, config.scheduleMode());
  }

  @Test
  void missingClasspathResourceGivesEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:nope.yaml").config();

    assertTrue(cfg.isEmpty());
  }

  @Test
  void loadsPlainPathAndFileUri() throws Exception {
    Path file = tempDir.resolve("onesync.yaml");
    Files.writeString(file, "sync:\n  interval-minutes: 7\n");

    assertEquals(7, new ConfigurationProvider(file.toString()).config().getInt("sync.interval-minutes"));
    assertEquals(
        7, new ConfigurationProvider(file.toUri().toString()).config().getInt("sync.interval-minutes"));
  }

  @Test
  void interpolatesSystemProperties() throws Exception {
    Path file = tempDir.resolve("onesync.yaml");
    Files.writeString(file, "database:\n  path: ${sys:java.io.tmpdir}/db.json\n");

    String path = new ConfigurationProvider(file.toString()).config().getString("database.path");

    assertEquals(System.getProperty("java.io.tmpdir") + "/db.json", path);
  }

  @Test
  void missingFileIsAConfigError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tempDir.resolve("absent.yaml").toString()));
  }

  @Test
  void envLookupFallsBackToFirstExistingFile() throws Exception {
    Path envFile = tempDir.resolve(".env.local");
    Files.writeString(
        envFile,
        """
        # comment
        ONESYNC_TEST_TOKEN="quoted value"
        ONESYNC_TEST_PLAIN = plain
        not a pair
        """);

    ConfigurationProvider.EnvFileLookup lookup =
        new ConfigurationProvider.EnvFileLookup(List.of(tempDir.resolve("missing.env"), envFile));

    assertEquals("quoted value", lookup.lookup("ONESYNC_TEST_TOKEN"));
    assertEquals("plain", lookup.lookup("ONESYNC_TEST_PLAIN"));
    assertNull(lookup.lookup("ONESYNC_TEST_ABSENT"));
  }
}
