package com.gentoro.onesync;

import com.gentoro.onesync.exception.ConfigException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML application configuration into an Apache Commons Configuration instance.
 *
 * <p>Supported locations: {@code classpath:some/path.yaml}, a {@code file:} URI, or a plain
 * filesystem path. {@code ${env:NAME}} placeholders resolve against the process environment and
 * then against a {@code .env.local} file.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = withEnvLookup(load(location));
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration load(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith("classpath:")) {
      return loadFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadFromFile(new File(loc));
  }

  private static YAMLConfiguration loadFromClasspath(String resourceName) {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
      if (input == null) {
        log.warn("Configuration resource {} not found on classpath, using defaults", resourceName);
        return new YAMLConfiguration();
      }
      log.info("Loading configuration from classpath resource: {}", resourceName);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new InputStreamReader(input, StandardCharsets.UTF_8));
      return config;
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static YAMLConfiguration loadFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration withEnvLookup(Configuration config) {
    config
        .getInterpolator()
        .registerLookup(
            "env",
            new EnvFileLookup(
                List.of(Paths.get(".env.local"), Paths.get("packages/sync/.env.local"))));
    return config;
  }

  /** Environment lookup that falls back to the first {@code .env.local} file found. */
  static final class EnvFileLookup implements Lookup {
    private final List<Path> candidates;
    private volatile Map<String, String> fallback;

    EnvFileLookup(List<Path> candidates) {
      this.candidates = candidates;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return fallback().get(key);
    }

    private Map<String, String> fallback() {
      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback =
                candidates.stream()
                    .filter(Files::isRegularFile)
                    .findFirst()
                    .map(EnvFileLookup::readKeyValueFile)
                    .orElseGet(
                        () -> {
                          log.debug("No .env.local file found in {}", candidates);
                          return Map.of();
                        });
          }
        }
      }
      return fallback;
    }

    private static Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading environment fallback from {}", path.toAbsolutePath());
      Map<String, String> values = new HashMap<>();
      try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        String line;
        while ((line = reader.readLine()) != null) {
          line = line.trim();
          int idx = line.indexOf('=');
          if (line.isEmpty() || line.startsWith("#") || idx <= 0) continue;
          String value = line.substring(idx + 1).trim();
          if (value.length() >= 2
              && ((value.startsWith("\"") && value.endsWith("\""))
                  || (value.startsWith("'") && value.endsWith("'")))) {
            value = value.substring(1, value.length() - 1);
          }
          values.put(line.substring(0, idx).trim(), value);
        }
      } catch (IOException e) {
        log.warn("Failed to read {}: {}", path, e.getMessage());
      }
      return values;
    }
  }
}
