package com.gentoro.onesync.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onesync.config.SourceType;
import com.gentoro.onesync.config.SyncConfiguration;
import com.gentoro.onesync.exception.ConfigException;
import com.gentoro.onesync.exception.NetworkException;
import com.gentoro.onesync.exception.NotFoundException;
import com.gentoro.onesync.exception.RateLimitException;
import com.gentoro.onesync.exception.SerializationException;
import com.gentoro.onesync.http.OkHttpFactory;
import com.gentoro.onesync.model.Command;
import com.gentoro.onesync.model.Persona;
import com.gentoro.onesync.model.RuleSet;
import com.gentoro.onesync.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Reads content from a GitHub-hosted repository through the contents listing API and the raw
 * content host. Every response body is cached by URL for the configured TTL.
 *
 * <p>Each top-level load absorbs transport failures and returns an empty result.
 */
public class RemoteSourceLoader extends AbstractSourceLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(RemoteSourceLoader.class);

  static final String PERSONAS_FILE = "shared/superclaude-personas.yml";
  static final String RULES_FILE = "shared/superclaude-rules.yml";
  private static final String LISTING_MEDIA_TYPE = "application/vnd.github.v3+json";
  private static final String RAW_MEDIA_TYPE = "text/plain";

  /** One row of a directory listing. {@code type} is {@code file} or {@code dir}. */
  record RepositoryEntry(String name, String path, String type) {
    boolean isFile() {
      return "file".equals(type);
    }

    boolean isDirectory() {
      return "dir".equals(type);
    }
  }

  private final SyncConfiguration.Remote remote;
  private final OkHttpClient client;
  private final ResponseCache cache;
  private final String owner;
  private final String repository;
  private final HttpUrl apiBase;
  private final HttpUrl rawBase;

  public RemoteSourceLoader(SyncConfiguration.Remote remote) {
    this(remote, OkHttpFactory.create(), Clock.systemUTC());
  }

  public RemoteSourceLoader(SyncConfiguration.Remote remote, OkHttpClient client, Clock clock) {
    super(SourceType.REMOTE.tag(), clock);
    this.remote = remote;
    this.client = client;
    this.cache = new ResponseCache(Duration.ofMinutes(remote.cacheTtlMinutes()), clock);

    HttpUrl url = parseUrl(remote.url(), "source.remote.url");
    List<String> segments =
        url.pathSegments().stream().filter(segment -> !segment.isBlank()).toList();
    if (segments.size() < 2) {
      throw new ConfigException("Repository URL must point to <owner>/<repo>: " + remote.url());
    }
    this.owner = segments.get(0);
    this.repository =
        segments.get(1).endsWith(".git")
            ? segments.get(1).substring(0, segments.get(1).length() - 4)
            : segments.get(1);
    this.apiBase = parseUrl(remote.apiBaseUrl(), "source.remote.api-base-url");
    this.rawBase = parseUrl(remote.rawBaseUrl(), "source.remote.raw-base-url");
  }

  private static HttpUrl parseUrl(String value, String key) {
    HttpUrl url = value == null ? null : HttpUrl.parse(value.trim());
    if (url == null) {
      throw new ConfigException("Invalid URL for " + key + ": " + value);
    }
    return url;
  }

  @Override
  public List<Command> loadCommands() {
    try {
      List<Command> commands = new ArrayList<>();
      collectMarkdownCommands(repositoryPath("commands"), commands);
      collectSharedCommands(commands);
      log.debug("Loaded {} commands from {}", commands.size(), describe());
      return commands;
    } catch (RateLimitException e) {
      log.warn(
          "Rate limited while loading commands from {}, resets at {}",
          describe(),
          e.contextValue("resetAt").orElse("unknown"));
      return List.of();
    } catch (RuntimeException e) {
      log.error("Failed to load commands from {}: {}", describe(), e.getMessage());
      return List.of();
    }
  }

  private void collectMarkdownCommands(String directory, List<Command> commands) {
    for (RepositoryEntry entry : listDirectory(directory)) {
      if (entry.isDirectory()) {
        // shared/ holds include fragments, not commands
        if (!"shared".equals(entry.name())) {
          collectMarkdownCommands(entry.path(), commands);
        }
      } else if (entry.isFile() && isMarkdownFile(entry.name())) {
        try {
          commands.add(parseMarkdownCommand(stem(entry.name()), fetchRaw(entry.path())));
        } catch (RateLimitException e) {
          throw e;
        } catch (RuntimeException e) {
          log.warn("Failed to load command {}: {}", entry.path(), e.getMessage());
        }
      } else {
        log.trace("Skipping {}", entry.path());
      }
    }
  }

  private void collectSharedCommands(List<Command> commands) {
    List<RepositoryEntry> entries;
    try {
      entries = listDirectory(repositoryPath("shared"));
    } catch (NotFoundException e) {
      return;
    }
    for (RepositoryEntry entry : entries) {
      if (!entry.isFile() || !isYamlFile(entry.name())) continue;
      try {
        JsonNode data = readYamlQuietly(fetchRaw(entry.path()), entry.path());
        Command command = isCommandDocument(data) ? parseCommand(data, entry.path()) : null;
        if (command != null) {
          commands.add(command);
        }
      } catch (RateLimitException e) {
        throw e;
      } catch (RuntimeException e) {
        log.debug("Skipping shared file {}: {}", entry.path(), e.getMessage());
      }
    }
  }

  @Override
  public List<Persona> loadPersonas() {
    String path = repositoryPath(PERSONAS_FILE);
    try {
      JsonNode data = parseYamlContent(fetchRaw(path), path);
      List<Persona> personas = data == null ? List.of() : parsePersonas(data, path);
      log.debug("Loaded {} personas from {}", personas.size(), describe());
      return personas;
    } catch (NotFoundException e) {
      log.warn("No personas file at {} in {}", path, describe());
      return List.of();
    } catch (RateLimitException e) {
      log.warn(
          "Rate limited while loading personas from {}, resets at {}",
          describe(),
          e.contextValue("resetAt").orElse("unknown"));
      return List.of();
    } catch (RuntimeException e) {
      log.error("Failed to load personas from {}: {}", describe(), e.getMessage());
      return List.of();
    }
  }

  @Override
  public RuleSet loadRules() {
    String path = repositoryPath(RULES_FILE);
    try {
      JsonNode data = parseYamlContent(fetchRaw(path), path);
      return data == null ? RuleSet.empty() : parseRules(data, path);
    } catch (NotFoundException e) {
      log.info("No rules defined in {}", describe());
      return RuleSet.empty();
    } catch (RateLimitException e) {
      log.warn(
          "Rate limited while loading rules from {}, resets at {}",
          describe(),
          e.contextValue("resetAt").orElse("unknown"));
      return RuleSet.empty();
    } catch (RuntimeException e) {
      log.error("Failed to load rules from {}: {}", describe(), e.getMessage());
      return RuleSet.empty();
    }
  }

  @Override
  public void clearCache() {
    cache.clear();
    log.debug("Cleared response cache for {}", describe());
  }

  @Override
  public String loadSharedIncludes(List<String> references) {
    List<String> fragments = new ArrayList<>();
    for (String reference : references) {
      String ref = normalizeInclude(reference);
      if (ref.isEmpty()) continue;
      Optional<String> body = resolveInclude(ref);
      if (body.isPresent()) {
        fragments.add(body.get());
      } else {
        log.warn("Include '{}' not found in {}", ref, describe());
      }
    }
    return joinFragments(fragments.stream());
  }

  private Optional<String> resolveInclude(String ref) {
    for (String candidate : List.of(ref, "commands/shared/" + ref, "shared/" + ref)) {
      try {
        return Optional.of(fetchRaw(repositoryPath(candidate)));
      } catch (NotFoundException e) {
        log.trace("Include candidate {} not found", candidate);
      } catch (RuntimeException e) {
        log.warn("Failed to fetch include candidate {}: {}", candidate, e.getMessage());
      }
    }
    return Optional.empty();
  }

  @Override
  public String describe() {
    return "GitHub repository " + owner + "/" + repository + "@" + remote.branch();
  }

  List<RepositoryEntry> listDirectory(String path) {
    HttpUrl url =
        apiBase
            .newBuilder()
            .addPathSegment("repos")
            .addPathSegment(owner)
            .addPathSegment(repository)
            .addPathSegment("contents")
            .addPathSegments(path)
            .addQueryParameter("ref", remote.branch())
            .build();
    String body = fetch(url, LISTING_MEDIA_TYPE, path);
    try {
      JsonNode tree = JacksonUtility.getJsonMapper().readTree(body);
      if (tree == null || !tree.isArray()) {
        throw new SerializationException("Expected a directory listing at " + path);
      }
      return JacksonUtility.getJsonMapper()
          .convertValue(tree, new TypeReference<List<RepositoryEntry>>() {});
    } catch (IOException | IllegalArgumentException e) {
      throw new SerializationException("Malformed directory listing at " + path, e);
    }
  }

  String fetchRaw(String path) {
    HttpUrl url =
        rawBase
            .newBuilder()
            .addPathSegment(owner)
            .addPathSegment(repository)
            .addPathSegments(remote.branch())
            .addPathSegments(path)
            .build();
    return fetch(url, RAW_MEDIA_TYPE, path);
  }

  private String fetch(HttpUrl url, String accept, String path) {
    String key = url.toString();
    Optional<String> cached = cache.get(key);
    if (cached.isPresent()) {
      log.debug("Cache hit for {}", key);
      return cached.get();
    }

    Request request = new Request.Builder().url(url).header("Accept", accept).get().build();
    try (Response response = client.newCall(request).execute()) {
      int code = response.code();
      if (response.isSuccessful()) {
        ResponseBody body = response.body();
        String text = body == null ? "" : body.string();
        cache.put(key, text);
        return text;
      }
      if (code == 404) {
        throw new NotFoundException("Not found: " + path, path);
      }
      if (code == 429 || (code == 403 && "0".equals(response.header("X-RateLimit-Remaining")))) {
        throw new RateLimitException(
            "Rate limit exceeded for " + key, key, response.header("X-RateLimit-Reset"));
      }
      throw new NetworkException("Unexpected HTTP status " + code + " for " + key);
    } catch (IOException e) {
      throw new NetworkException("Failed to fetch " + key + ": " + e.getMessage(), e);
    }
  }

  private String repositoryPath(String relative) {
    String root = remote.contentRoot() == null ? "" : remote.contentRoot().trim();
    while (root.endsWith("/")) {
      root = root.substring(0, root.length() - 1);
    }
    return root.isEmpty() ? relative : root + "/" + relative;
  }
}
