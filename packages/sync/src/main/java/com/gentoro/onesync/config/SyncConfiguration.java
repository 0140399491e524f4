package com.gentoro.onesync.config;

import com.gentoro.onesync.exception.ConfigException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Fully resolved engine configuration. Precedence between environment, files and command line is
 * settled before this object is built; the engine only reads it.
 */
public record SyncConfiguration(
    SourceType sourceType,
    Filesystem filesystem,
    Remote remote,
    int syncIntervalMinutes,
    boolean autoSyncEnabled,
    boolean syncOnStartup,
    ScheduleMode scheduleMode,
    Path databasePath) {

  public static final String DEFAULT_REMOTE_URL = "https://github.com/NomenAK/SuperClaude";
  public static final String DEFAULT_BRANCH = "master";
  public static final int DEFAULT_CACHE_TTL_MINUTES = 5;
  public static final int DEFAULT_SYNC_INTERVAL_MINUTES = 30;

  /** Local directory tree settings. */
  public record Filesystem(Path path) {}

  /**
   * Hosted repository settings.
   *
   * @param url repository URL, e.g. {@code https://github.com/owner/repo}
   * @param branch branch or ref to read from
   * @param cacheTtlMinutes how long listing and content responses stay cached
   * @param contentRoot repository directory holding {@code commands/} and {@code shared/}
   * @param apiBaseUrl base URL of the directory-listing API
   * @param rawBaseUrl base URL of the raw-content API
   */
  public record Remote(
      String url,
      String branch,
      int cacheTtlMinutes,
      String contentRoot,
      String apiBaseUrl,
      String rawBaseUrl) {

    public static Remote defaults(String url) {
      return new Remote(
          url,
          DEFAULT_BRANCH,
          DEFAULT_CACHE_TTL_MINUTES,
          ".claude",
          "https://api.github.com",
          "https://raw.githubusercontent.com");
    }
  }

  public SyncConfiguration {
    Objects.requireNonNull(sourceType, "sourceType");
    Objects.requireNonNull(scheduleMode, "scheduleMode");
    Objects.requireNonNull(databasePath, "databasePath");
    if (syncIntervalMinutes < 1) {
      throw new ConfigException(
          "sync.interval-minutes must be at least 1, got " + syncIntervalMinutes);
    }
    if (remote != null && remote.cacheTtlMinutes() < 1) {
      throw new ConfigException(
          "source.remote.cache-ttl-minutes must be at least 1, got " + remote.cacheTtlMinutes());
    }
  }

  /** Reads the {@code source}, {@code sync} and {@code database} keys. */
  public static SyncConfiguration from(Configuration cfg) {
    SourceType type = SourceType.parse(cfg.getString("source.type", "remote"));

    Filesystem filesystem =
        new Filesystem(Paths.get(cfg.getString("source.filesystem.path", ".claude")));

    Remote remote =
        new Remote(
            cfg.getString("source.remote.url", DEFAULT_REMOTE_URL),
            cfg.getString("source.remote.branch", DEFAULT_BRANCH),
            intValue(cfg, "source.remote.cache-ttl-minutes", DEFAULT_CACHE_TTL_MINUTES),
            cfg.getString("source.remote.content-root", ".claude"),
            cfg.getString("source.remote.api-base-url", "https://api.github.com"),
            cfg.getString("source.remote.raw-base-url", "https://raw.githubusercontent.com"));

    String dbPath = cfg.getString("database.path", null);
    Path databasePath =
        dbPath == null || dbPath.isBlank()
            ? Paths.get(System.getProperty("user.home"), ".onesync", "data", "db.json")
            : Paths.get(dbPath.trim());

    return new SyncConfiguration(
        type,
        filesystem,
        remote,
        intValue(cfg, "sync.interval-minutes", DEFAULT_SYNC_INTERVAL_MINUTES),
        booleanValue(cfg, "sync.auto-sync-enabled", false),
        booleanValue(cfg, "sync.on-startup", false),
        ScheduleMode.parse(cfg.getString("sync.schedule-mode", null)),
        databasePath);
  }

  private static int intValue(Configuration cfg, String key, int defaultValue) {
    try {
      return cfg.getInt(key, defaultValue);
    } catch (Exception e) {
      throw new ConfigException("Failed to resolve " + key + " configuration", e);
    }
  }

  private static boolean booleanValue(Configuration cfg, String key, boolean defaultValue) {
    try {
      return cfg.getBoolean(key, defaultValue);
    } catch (Exception e) {
      throw new ConfigException("Failed to resolve " + key + " configuration", e);
    }
  }
}
