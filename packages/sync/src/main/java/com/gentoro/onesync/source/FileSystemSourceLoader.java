package com.gentoro.onesync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onesync.config.SourceType;
import com.gentoro.onesync.exception.IoException;
import com.gentoro.onesync.model.Command;
import com.gentoro.onesync.model.Persona;
import com.gentoro.onesync.model.RuleSet;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/** Reads content from a local directory laid out as {@code commands/}, {@code shared/}, etc. */
public class FileSystemSourceLoader extends AbstractSourceLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(FileSystemSourceLoader.class);

  static final List<String> PERSONA_CANDIDATES =
      List.of("shared/superclaude-personas.yaml", "shared/superclaude-personas.yml");
  static final List<String> RULE_CANDIDATES =
      List.of(
          "shared/superclaude-rules.yaml", "shared/superclaude-rules.yml", "rules/rules.yaml");

  private final Path basePath;

  public FileSystemSourceLoader(Path basePath) {
    this(basePath, Clock.systemUTC());
  }

  public FileSystemSourceLoader(Path basePath, Clock clock) {
    super(SourceType.FILESYSTEM.tag(), clock);
    this.basePath = basePath.toAbsolutePath().normalize();
  }

  /** Any {@code shared/} directory below {@code commands/} holds include fragments. */
  private static boolean isInFragmentsDirectory(Path commandsDir, Path file) {
    Path parent = commandsDir.relativize(file).getParent();
    if (parent == null) return false;
    for (Path segment : parent) {
      if ("shared".equals(segment.toString())) return true;
    }
    return false;
  }

  public Path getBasePath() {
    return basePath;
  }

  @Override
  public List<Command> loadCommands() {
    List<Command> commands = new ArrayList<>();
    Path commandsDir = basePath.resolve("commands");
    if (Files.isDirectory(commandsDir)) {
      for (Path file : listFiles(commandsDir, Integer.MAX_VALUE, "commands")) {
        if (isInFragmentsDirectory(commandsDir, file)) continue;
        String filename = file.getFileName().toString();
        if (!isYamlFile(filename) && !isMarkdownFile(filename)) continue;
        Command command = loadCommandFile(file);
        if (command != null) {
          commands.add(command);
        }
      }
    } else {
      log.debug("No commands directory at {}", commandsDir);
    }

    Path sharedDir = basePath.resolve("shared");
    if (Files.isDirectory(sharedDir)) {
      for (Path file : listFiles(sharedDir, 1, "commands")) {
        if (!isYamlFile(file.getFileName().toString())) continue;
        String content = readFile(file);
        if (content == null) continue;
        JsonNode data = readYamlQuietly(content, file.toString());
        Command command = isCommandDocument(data) ? parseCommand(data, file.toString()) : null;
        if (command != null) {
          commands.add(command);
        }
      }
    }

    log.debug("Loaded {} commands from {}", commands.size(), basePath);
    return commands;
  }

  private Command loadCommandFile(Path file) {
    String content = readFile(file);
    if (content == null) return null;
    String filename = file.getFileName().toString();
    if (isMarkdownFile(filename)) {
      return parseMarkdownCommand(stem(filename), content);
    }
    JsonNode data = parseYamlContent(content, file.toString());
    return data == null ? null : parseCommand(data, file.toString());
  }

  @Override
  public List<Persona> loadPersonas() {
    List<Persona> personas = new ArrayList<>();

    firstExisting(PERSONA_CANDIDATES)
        .ifPresent(
            file -> {
              String content = readFile(file);
              JsonNode data = content == null ? null : parseYamlContent(content, file.toString());
              if (data != null) {
                personas.addAll(parsePersonas(data, file.toString()));
              }
            });

    Path legacyDir = basePath.resolve("personas");
    if (Files.isDirectory(legacyDir)) {
      for (Path file : listFiles(legacyDir, 1, "personas")) {
        String filename = file.getFileName().toString();
        if (!isYamlFile(filename)) continue;
        String content = readFile(file);
        JsonNode data = content == null ? null : parseYamlContent(content, file.toString());
        if (data != null) {
          personas.add(parsePersona(data, stem(filename)));
        }
      }
    }

    log.debug("Loaded {} personas from {}", personas.size(), basePath);
    return personas;
  }

  @Override
  public RuleSet loadRules() {
    for (String candidate : RULE_CANDIDATES) {
      Path file = basePath.resolve(candidate);
      if (!Files.isRegularFile(file)) continue;
      String content = readFile(file);
      JsonNode data = content == null ? null : parseYamlContent(content, file.toString());
      if (data != null) {
        RuleSet rules = parseRules(data, file.toString());
        log.debug("Loaded {} rules from {}", rules.rules().size(), file);
        return rules;
      }
    }
    log.debug("No rules found under {}", basePath);
    return RuleSet.empty();
  }

  @Override
  public void clearCache() {
    // Nothing is cached; every load reads the directory tree.
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
        log.warn("Include '{}' not found under {}", ref, basePath);
      }
    }
    return joinFragments(fragments.stream());
  }

  private Optional<String> resolveInclude(String ref) {
    List<Path> roots =
        List.of(
            basePath, basePath.resolve("commands").resolve("shared"), basePath.resolve("shared"));
    for (Path root : roots) {
      Path candidate = root.resolve(ref).normalize();
      if (!candidate.startsWith(basePath)) {
        log.warn("Include '{}' resolves outside of {}, ignoring", ref, basePath);
        return Optional.empty();
      }
      if (!Files.isRegularFile(candidate)) continue;
      try {
        return Optional.of(Files.readString(candidate, StandardCharsets.UTF_8));
      } catch (IOException e) {
        log.warn("Failed to read include {}: {}", candidate, e.getMessage());
      }
    }
    return Optional.empty();
  }

  @Override
  public String describe() {
    return "local directory " + basePath;
  }

  private Optional<Path> firstExisting(List<String> candidates) {
    return candidates.stream().map(basePath::resolve).filter(Files::isRegularFile).findFirst();
  }

  private List<Path> listFiles(Path dir, int depth, String category) {
    try (Stream<Path> walk = Files.walk(dir, depth)) {
      return walk.filter(Files::isRegularFile).sorted().toList();
    } catch (IOException | UncheckedIOException e) {
      throw new IoException("Failed to load " + category + ": " + e.getMessage(), e);
    }
  }

  private String readFile(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      trackUnparsedFile(file.toString(), "Failed to read file: " + e.getMessage());
      return null;
    }
  }
}
