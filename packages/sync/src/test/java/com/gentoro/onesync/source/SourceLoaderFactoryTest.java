package com.gentoro.onesync.source;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onesync.config.ScheduleMode;
import com.gentoro.onesync.config.SourceType;
import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.exception.ConfigException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceLoaderFactoryTest {

  @TempDir Path tempDir;

  private SyncConfiguration config(SourceType type, SyncConfiguration.Remote remote) {
    return new SyncConfiguration(
        type,
        new SyncConfiguration.Filesystem(tempDir),
        remote,
        30,
        false,
        false,
        ScheduleMode.FIXED_RATE,
        tempDir.resolve("db.json"));
  }

  @Test
  void createsFileSystemLoader() {
    SourceLoader loader =
        SourceLoaderFactory.create(config(SourceType.FILESYSTEM, null));

    assertInstanceOf(FileSystemSourceLoader.class, loader);
    assertEquals(tempDir.toAbsolutePath().normalize(), ((FileSystemSourceLoader) loader).getBasePath());
  }

  @Test
  void createsRemoteLoader() {
    SourceLoader loader =
        SourceLoaderFactory.create(
            config(
                SourceType.REMOTE,
                SyncConfiguration.Remote.defaults("https://github.com/NomenAK/SuperClaude")));

    assertInstanceOf(RemoteSourceLoader.class, loader);
    assertTrue(loader.describe().contains("NomenAK/SuperClaude"));
  }

  @Test
  void remoteRequiresUrl() {
    SyncConfiguration cfg = config(SourceType.REMOTE, SyncConfiguration.Remote.defaults(" "));
    assertThrows(ConfigException.class, () -> SourceLoaderFactory.create(cfg));
  }

  @Test
  void remoteRejectsUnparsableUrl() {
    SyncConfiguration cfg =
        config(SourceType.REMOTE, SyncConfiguration.Remote.defaults("not a url"));
    assertThrows(ConfigException.class, () -> SourceLoaderFactory.create(cfg));
  }
}
