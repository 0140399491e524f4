package com.gentoro.onesync.source;

import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.exception.ConfigException;
import com.gentoro.onesync.http.OkHttpFactory;
import java.nio.file.Files;
import java.time.Clock;
import java.util.Locale;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

/** Builds the {@link SourceLoader} selected by the configured source type. */
public final class SourceLoaderFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(SourceLoaderFactory.class);

  private SourceLoaderFactory() {}

  public static SourceLoader create(SyncConfiguration config) {
    return create(config, OkHttpFactory.create(), Clock.systemUTC());
  }

  public static SourceLoader create(
      SyncConfiguration config, OkHttpClient httpClient, Clock clock) {
    return switch (config.sourceType()) {
      case FILESYSTEM -> createFileSystemLoader(config, clock);
      case REMOTE -> createRemoteLoader(config, httpClient, clock);
    };
  }

  private static SourceLoader createFileSystemLoader(SyncConfiguration config, Clock clock) {
    if (config.filesystem() == null || config.filesystem().path() == null) {
      throw new ConfigException("source.filesystem.path is required for the filesystem source");
    }
    if (!Files.isDirectory(config.filesystem().path())) {
      log.warn(
          "Source directory {} does not exist; loads will return nothing until it is created",
          config.filesystem().path().toAbsolutePath());
    }
    SourceLoader loader = new FileSystemSourceLoader(config.filesystem().path(), clock);
    log.info("Using {}", loader.describe());
    return loader;
  }

  private static SourceLoader createRemoteLoader(
      SyncConfiguration config, OkHttpClient httpClient, Clock clock) {
    SyncConfiguration.Remote remote = config.remote();
    if (remote == null || remote.url() == null || remote.url().isBlank()) {
      throw new ConfigException("source.remote.url is required for the remote source");
    }
    HttpUrl url = HttpUrl.parse(remote.url().trim());
    if (url == null) {
      throw new ConfigException("Invalid repository URL: " + remote.url());
    }
    String host = url.host().toLowerCase(Locale.ROOT);
    if (!host.equals("github.com") && !host.equals("www.github.com")) {
      log.warn("Repository host {} is not github.com; assuming a GitHub-compatible API", host);
    }
    if (remote.branch() == null || remote.branch().isBlank()) {
      throw new ConfigException("source.remote.branch must not be blank");
    }
    SourceLoader loader = new RemoteSourceLoader(remote, httpClient, clock);
    log.info("Using {}", loader.describe());
    return loader;
  }
}
