package com.gentoro.onesync.report;

import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.MirrorSnapshot;
import com.gentoro.onesync.model.PersonaModel;
import com.gentoro.onesync.model.RuleModel;
import com.gentoro.onesync.model.SyncMetadata;
import com.gentoro.onesync.model.UnparsedFile;
import com.gentoro.onesync.sync.ContentMirror;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the mirror as a text tree:
 *
 * <pre>
 * Source: GitHub repository owner/repo@master
 * Last sync: 2025-01-01T00:00:00Z (success)
 * ├── Commands (2)
 * │   ├── analyze [1 arg] 3f2a1b9c
 * │   └── build 9d81c0aa
 * ├── Personas (1)
 * │   └── architect 5e0c7d12
 * └── Rules (0)
 * </pre>
 *
 * Unparsed files, if any, are listed after the tree.
 */
public class SyncReportGenerator {
  static final int SHORT_HASH_LENGTH = 8;

  public String generate(ContentMirror mirror, String sourceDescription) {
    return generate(
        sourceDescription,
        mirror.getSyncMetadata(),
        mirror.loadFromDatabase(),
        mirror.getUnparsedFiles());
  }

  public String generate(
      String sourceDescription,
      SyncMetadata metadata,
      MirrorSnapshot snapshot,
      List<UnparsedFile> unparsedFiles) {
    StringBuilder sb = new StringBuilder();
    if (sourceDescription != null) {
      sb.append("Source: ").append(sourceDescription).append('\n');
    }
    sb.append("Last sync: ").append(describeLastSync(metadata)).append('\n');
    if (!metadata.isSuccess() && metadata.errorMessage() != null) {
      sb.append("Errors: ").append(metadata.errorMessage()).append('\n');
    }

    List<String> commands = new ArrayList<>();
    for (CommandModel command : snapshot.commands()) {
      int args = command.arguments() == null ? 0 : command.arguments().size();
      String argLabel = args == 0 ? "" : " [" + args + (args == 1 ? " arg]" : " args]");
      commands.add(command.id() + argLabel + " " + shortHash(command.hash()));
    }
    List<String> personas = new ArrayList<>();
    for (PersonaModel persona : snapshot.personas().values()) {
      personas.add(persona.id() + " " + shortHash(persona.hash()));
    }
    List<String> rules = new ArrayList<>();
    for (RuleModel rule : snapshot.rules()) {
      rules.add(rule.id() + " " + shortHash(rule.hash()));
    }

    appendBranch(sb, "Commands", commands, false);
    appendBranch(sb, "Personas", personas, false);
    appendBranch(sb, "Rules", rules, true);

    if (!unparsedFiles.isEmpty()) {
      sb.append("Unparsed files (").append(unparsedFiles.size()).append(")\n");
      for (UnparsedFile file : unparsedFiles) {
        sb.append("  - ").append(file.path()).append(": ").append(file.error()).append('\n');
      }
    }
    return sb.toString();
  }

  private static String describeLastSync(SyncMetadata metadata) {
    if (Instant.EPOCH.equals(metadata.lastSync())) {
      return "never";
    }
    return metadata.lastSync() + " (" + metadata.syncStatus().value() + ")";
  }

  private static void appendBranch(
      StringBuilder sb, String title, List<String> items, boolean last) {
    sb.append(last ? "└── " : "├── ")
        .append(title)
        .append(" (")
        .append(items.size())
        .append(")\n");
    String indent = last ? "    " : "│   ";
    for (int i = 0; i < items.size(); i++) {
      sb.append(indent)
          .append(i == items.size() - 1 ? "└── " : "├── ")
          .append(items.get(i))
          .append('\n');
    }
  }

  private static String shortHash(String hash) {
    if (hash == null) return "";
    return hash.length() <= SHORT_HASH_LENGTH ? hash : hash.substring(0, SHORT_HASH_LENGTH);
  }
}
