package com.gentoro.onesync.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onesync.exception.ExceptionUtil;
import com.gentoro.onesync.model.Command;
import com.gentoro.onesync.model.CommandArgument;
import com.gentoro.onesync.model.CommandMessage;
import com.gentoro.onesync.model.Persona;
import com.gentoro.onesync.model.Rule;
import com.gentoro.onesync.model.RuleSet;
import com.gentoro.onesync.model.UnparsedFile;
import com.gentoro.onesync.utility.JacksonUtility;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Shared parsing for source loaders: YAML with a lenient fallback, mapping of parsed documents to
 * commands, personas and rules, and bookkeeping of files that could not be parsed.
 */
public abstract class AbstractSourceLoader implements SourceLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(AbstractSourceLoader.class);

  static final String INCLUDE_MARKER = "@include";

  private static final Pattern PURPOSE = Pattern.compile("\\*\\*Purpose\\*\\*:\\s*(.+)");
  private static final Pattern ARGUMENT = Pattern.compile("\\$([A-Z_]+)");
  private static final List<String> PERSONA_INSTRUCTION_FIELDS =
      List.of(
          "instructions",
          "Identity",
          "Core_Belief",
          "Primary_Question",
          "Decision_Framework",
          "Problem_Solving",
          "Focus");

  private final List<UnparsedFile> unparsedFiles = new ArrayList<>();
  private final String sourceTag;
  protected final Clock clock;

  protected AbstractSourceLoader(String sourceTag, Clock clock) {
    this.sourceTag = Objects.requireNonNull(sourceTag, "sourceTag");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized List<UnparsedFile> getUnparsedFiles() {
    return List.copyOf(unparsedFiles);
  }

  @Override
  public synchronized void clearUnparsedFiles() {
    unparsedFiles.clear();
  }

  protected synchronized void trackUnparsedFile(String path, String error) {
    unparsedFiles.add(new UnparsedFile(path, error, clock.instant(), sourceTag));
    log.warn("Failed to parse file {}, tracking as unparsed: {}", path, error);
  }

  /**
   * Parses a YAML document into a tree. Strict parsing is attempted first; documents it rejects
   * (tabs, stray indicators, unquoted colons) get a line-based lenient pass. If both fail the file
   * is recorded as unparsed.
   *
   * @return the document root as an object node, or {@code null} when the file is unparsable.
   */
  protected JsonNode parseYamlContent(String content, String filePath) {
    if (content == null || content.isBlank()) {
      trackUnparsedFile(filePath, "Empty document");
      return null;
    }
    Exception strictError;
    try {
      JsonNode root = JacksonUtility.getYamlMapper().readTree(content);
      if (root != null && root.isObject()) {
        return root;
      }
      strictError = new IllegalArgumentException("Expected a mapping at the document root");
    } catch (Exception e) {
      strictError = e;
    }

    log.debug("Strict YAML parsing failed for {}, trying lenient parser", filePath);
    try {
      return parseLeniently(content);
    } catch (Exception lenientError) {
      log.debug("Lenient YAML parsing failed for {}: {}", filePath, lenientError.getMessage());
      trackUnparsedFile(filePath, firstLine(ExceptionUtil.describe(strictError)));
      return null;
    }
  }

  /**
   * Strict parse that never records a failure. Used to probe files that may or may not hold
   * content of the expected kind.
   */
  protected JsonNode readYamlQuietly(String content, String filePath) {
    try {
      JsonNode root = JacksonUtility.getYamlMapper().readTree(content);
      return root != null && root.isObject() ? root : null;
    } catch (Exception e) {
      log.debug("Skipping {}: {}", filePath, firstLine(e.getMessage()));
      return null;
    }
  }

  /**
   * Line-based parser covering the subset of YAML found in hand-written content files:
   * {@code key: value}, nested {@code key:} blocks and {@code - item} lists. Quotes around values
   * are stripped; later duplicate keys win.
   */
  static ObjectNode parseLeniently(String content) {
    ObjectNode root = JacksonUtility.getYamlMapper().createObjectNode();
    List<Block> stack = new ArrayList<>();
    stack.add(new Block(-1, null, null, root));

    String[] lines = content.split("\\r?\\n");
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.equals("---")) continue;

      int indent = line.length() - line.stripLeading().length();
      boolean listItem = trimmed.startsWith("- ") || trimmed.equals("-");

      // List items may sit at the same indent as their key; other lines close deeper blocks.
      while (stack.size() > 1) {
        int top = stack.get(stack.size() - 1).indent;
        if (listItem ? indent < top : indent <= top) {
          stack.remove(stack.size() - 1);
        } else {
          break;
        }
      }
      Block current = stack.get(stack.size() - 1);

      if (listItem) {
        if (current.parent == null) {
          throw new IllegalArgumentException(
              "List item without an enclosing key at line " + (i + 1));
        }
        current.asArray().add(unquote(trimmed.substring(1).trim()));
        continue;
      }

      int colon = trimmed.indexOf(':');
      if (colon <= 0) {
        throw new IllegalArgumentException("Unrecognized content at line " + (i + 1));
      }
      if (current.array != null) {
        throw new IllegalArgumentException("Mapping entry inside a list at line " + (i + 1));
      }
      String key = unquote(trimmed.substring(0, colon).trim());
      String value = trimmed.substring(colon + 1).trim();
      if (!value.isEmpty()) {
        current.object.put(key, unquote(value));
      } else {
        ObjectNode child = current.object.putObject(key);
        stack.add(new Block(indent, current.object, key, child));
      }
    }

    if (root.isEmpty()) {
      throw new IllegalArgumentException("No key/value content found");
    }
    return root;
  }

  private static final class Block {
    final int indent;
    final ObjectNode parent;
    final String key;
    final ObjectNode object;
    ArrayNode array;

    Block(int indent, ObjectNode parent, String key, ObjectNode object) {
      this.indent = indent;
      this.parent = parent;
      this.key = key;
      this.object = object;
    }

    ArrayNode asArray() {
      if (array == null) {
        if (!object.isEmpty()) {
          throw new IllegalArgumentException(
              "Key '" + key + "' mixes mapping entries and list items");
        }
        array = parent.putArray(key);
      }
      return array;
    }
  }

  private static String unquote(String value) {
    if (value.length() >= 2
        && ((value.startsWith("\"") && value.endsWith("\""))
            || (value.startsWith("'") && value.endsWith("'")))) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  /** A document describes a command when it carries both a name and a prompt. */
  protected boolean isCommandDocument(JsonNode data) {
    return data != null && text(data, "name") != null && text(data, "prompt") != null;
  }

  protected Command parseCommand(JsonNode data, String filePath) {
    if (!isCommandDocument(data)) {
      trackUnparsedFile(filePath, "Missing required command fields: name, prompt");
      return null;
    }
    String name = text(data, "name");
    String description = Objects.requireNonNullElse(text(data, "description"), "Command: " + name);
    try {
      List<CommandMessage> messages =
          data.has("messages")
              ? JacksonUtility.getYamlMapper()
                  .convertValue(data.get("messages"), new TypeReference<List<CommandMessage>>() {})
              : null;
      List<CommandArgument> arguments =
          data.has("arguments")
              ? JacksonUtility.getYamlMapper()
                  .convertValue(
                      data.get("arguments"), new TypeReference<List<CommandArgument>>() {})
              : null;
      return new Command(name, description, text(data, "prompt"), messages, arguments);
    } catch (IllegalArgumentException e) {
      trackUnparsedFile(filePath, "Invalid command fields: " + firstLine(e.getMessage()));
      return null;
    }
  }

  /**
   * Builds a command from a markdown prompt file: the whole text is the prompt, the description is
   * taken from a {@code **Purpose**:} line and every distinct {@code $UPPER_CASE} token becomes a
   * required argument.
   */
  protected Command parseMarkdownCommand(String name, String content) {
    Matcher purpose = PURPOSE.matcher(content);
    String description = purpose.find() ? purpose.group(1).trim() : "Command: " + name;

    Set<String> argumentNames = new LinkedHashSet<>();
    Matcher argument = ARGUMENT.matcher(content);
    while (argument.find()) {
      argumentNames.add(argument.group(1));
    }
    List<CommandArgument> arguments =
        argumentNames.isEmpty()
            ? null
            : argumentNames.stream()
                .map(arg -> new CommandArgument(arg, "Argument: $" + arg, true))
                .toList();

    return new Command(name, description, content, null, arguments);
  }

  /** Reads personas from an {@code All_Personas} or {@code personas} section, or the root map. */
  protected List<Persona> parsePersonas(JsonNode data, String filePath) {
    List<Persona> personas = new ArrayList<>();
    JsonNode container = data;
    if (data.path("All_Personas").isObject()) {
      container = data.get("All_Personas");
    } else if (data.path("personas").isObject()) {
      container = data.get("personas");
    }

    Iterator<Map.Entry<String, JsonNode>> fields = container.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isObject()) {
        personas.add(parsePersona(field.getValue(), field.getKey()));
      }
    }
    log.debug("Parsed {} personas from {}", personas.size(), filePath);
    return personas;
  }

  protected Persona parsePersona(JsonNode data, String defaultName) {
    String identity = text(data, "Identity");
    String name = text(data, "name");
    if (name == null) {
      // A piped Identity lists traits, not a name.
      name = identity != null && !identity.contains("|") ? identity : defaultName;
    }
    String description = text(data, "description");
    if (description == null) {
      description = Objects.requireNonNullElse(text(data, "Core_Belief"), name + " persona");
    }
    String instructions =
        PERSONA_INSTRUCTION_FIELDS.stream()
            .map(field -> text(data, field))
            .filter(Objects::nonNull)
            .collect(Collectors.joining(". "));
    return new Persona(name, description, instructions.isEmpty() ? description : instructions);
  }

  /**
   * Reads a {@code rules: [{name, content}]} array when present; otherwise every string leaf of
   * the document becomes a rule named after its own key.
   */
  protected RuleSet parseRules(JsonNode data, String filePath) {
    List<Rule> rules = new ArrayList<>();
    JsonNode declared = data.get("rules");
    if (declared != null && declared.isArray()) {
      for (JsonNode rule : declared) {
        String name = text(rule, "name");
        String content = text(rule, "content");
        if (name != null && content != null) {
          rules.add(new Rule(name, content));
        }
      }
    } else {
      extractRules(data, null, rules);
    }
    log.debug("Parsed {} rules from {}", rules.size(), filePath);
    return new RuleSet(rules);
  }

  private void extractRules(JsonNode node, String key, List<Rule> rules) {
    if (node.isTextual()) {
      if (key != null && !node.asText().isBlank()) {
        rules.add(new Rule(key, node.asText()));
      }
    } else if (node.isObject()) {
      node.fields().forEachRemaining(e -> extractRules(e.getValue(), e.getKey(), rules));
    } else if (node.isArray()) {
      boolean allText = true;
      for (JsonNode element : node) {
        allText &= element.isTextual();
      }
      if (allText && key != null && !node.isEmpty()) {
        List<String> items = new ArrayList<>();
        node.forEach(element -> items.add(element.asText()));
        rules.add(new Rule(key, String.join("\n", items)));
      } else {
        node.forEach(element -> extractRules(element, key, rules));
      }
    }
  }

  /** Strips the optional {@code @include} marker and surrounding whitespace from a reference. */
  protected static String normalizeInclude(String reference) {
    String ref = reference == null ? "" : reference.trim();
    if (ref.startsWith(INCLUDE_MARKER)) {
      ref = ref.substring(INCLUDE_MARKER.length()).trim();
    }
    return ref;
  }

  protected static String joinFragments(Stream<String> fragments) {
    return fragments.collect(Collectors.joining("\n\n"));
  }

  protected boolean isYamlFile(String filename) {
    return filename.endsWith(".yaml") || filename.endsWith(".yml");
  }

  protected boolean isMarkdownFile(String filename) {
    return filename.endsWith(".md");
  }

  protected static String stem(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isValueNode() || value.isNull()) return null;
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static String firstLine(String message) {
    if (message == null) return "Unknown error";
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }
}
