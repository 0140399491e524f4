package com.gentoro.onesync.source;

import com.gentoro.onesync.model.Command;
import com.gentoro.onesync.model.Persona;
import com.gentoro.onesync.model.RuleSet;
import com.gentoro.onesync.model.UnparsedFile;
import java.util.List;

public interface SourceLoader {
  /**
   * Loads every command currently published by the source.
   *
   * @return the full current set; empty when the source cannot be reached.
   */
  List<Command> loadCommands();

  /**
   * Loads every persona currently published by the source.
   *
   * @return the full current set; empty when the source cannot be reached.
   */
  List<Persona> loadPersonas();

  /**
   * Loads the rules singleton.
   *
   * @return the current rules; {@link RuleSet#empty()} when none are defined or the source cannot
   *     be reached.
   */
  RuleSet loadRules();

  /** Invalidates any in-memory response cache. */
  void clearCache();

  /**
   * Resolves include references (optionally prefixed with {@code @include }) against the loader's
   * candidate locations and concatenates the resolved fragments in input order, separated by a
   * blank line. Unresolved references are skipped.
   *
   * @param references fragment references, e.g. {@code "@include flags.yml"}.
   * @return the concatenated fragment bodies, or an empty string when nothing resolved.
   */
  String loadSharedIncludes(List<String> references);

  /**
   * Returns the files that failed to parse since the last {@link #clearUnparsedFiles()}.
   *
   * @return a snapshot copy of the recorded failures.
   */
  List<UnparsedFile> getUnparsedFiles();

  /** Forgets previously recorded parse failures. Called at the start of each sync pass. */
  void clearUnparsedFiles();

  /**
   * Returns a short, human-readable description of the source, used in logs and reports.
   *
   * @return the description.
   */
  String describe();
}
