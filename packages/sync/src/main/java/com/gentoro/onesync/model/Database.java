package com.gentoro.onesync.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The whole mirror as a single JSON document. Collections are kept as lists; id uniqueness within
 * each list is maintained by the store.
 */
public class Database {
  private List<CommandModel> commands;
  private List<PersonaModel> personas;
  private List<RuleModel> rules;
  private SyncMetadata syncMetadata;
  private List<UnparsedFile> unparsedFiles;

  public Database() {
    this.commands = new ArrayList<>();
    this.personas = new ArrayList<>();
    this.rules = new ArrayList<>();
    this.syncMetadata = SyncMetadata.initial();
    this.unparsedFiles = new ArrayList<>();
  }

  public static Database empty() {
    return new Database();
  }

  public List<CommandModel> getCommands() {
    return commands;
  }

  public void setCommands(List<CommandModel> commands) {
    this.commands = new ArrayList<>(Objects.requireNonNullElse(commands, List.of()));
  }

  public List<PersonaModel> getPersonas() {
    return personas;
  }

  public void setPersonas(List<PersonaModel> personas) {
    this.personas = new ArrayList<>(Objects.requireNonNullElse(personas, List.of()));
  }

  public List<RuleModel> getRules() {
    return rules;
  }

  public void setRules(List<RuleModel> rules) {
    this.rules = new ArrayList<>(Objects.requireNonNullElse(rules, List.of()));
  }

  public SyncMetadata getSyncMetadata() {
    return syncMetadata;
  }

  public void setSyncMetadata(SyncMetadata syncMetadata) {
    this.syncMetadata = Objects.requireNonNullElse(syncMetadata, SyncMetadata.initial());
  }

  public List<UnparsedFile> getUnparsedFiles() {
    return unparsedFiles;
  }

  public void setUnparsedFiles(List<UnparsedFile> unparsedFiles) {
    this.unparsedFiles = new ArrayList<>(Objects.requireNonNullElse(unparsedFiles, List.of()));
  }
}
