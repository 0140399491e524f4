package com.gentoro.onesync.sync;

import com.gentoro.onesync.model.CommandModel;
import com.gentoro.onesync.model.MirrorSnapshot;
import com.gentoro.onesync.model.PersonaModel;
import com.gentoro.onesync.model.RuleModel;
import com.gentoro.onesync.model.SyncMetadata;
import com.gentoro.onesync.model.UnparsedFile;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** Read access to the mirror plus an on-demand refresh, for whatever serves the content. */
public class ContentMirror {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(ContentMirror.class);

  private final SyncService syncService;

  public ContentMirror(SyncService syncService) {
    this.syncService = Objects.requireNonNull(syncService, "syncService");
  }

  public List<CommandModel> getAllCommands() {
    return syncService.getStore().getAllCommands();
  }

  public List<PersonaModel> getAllPersonas() {
    return syncService.getStore().getAllPersonas();
  }

  public List<RuleModel> getAllRules() {
    return syncService.getStore().getAllRules();
  }

  public MirrorSnapshot loadFromDatabase() {
    return syncService.loadFromDatabase();
  }

  /** Drops cached source responses and runs a pass right away. */
  public SyncResult triggerSync() {
    log.info("Manual sync requested");
    syncService.getLoader().clearCache();
    return syncService.syncFromSource();
  }

  public Instant getLastSync() {
    return syncService.getStore().getLastSync();
  }

  public SyncMetadata getSyncMetadata() {
    return syncService.getStore().getSyncMetadata();
  }

  public List<UnparsedFile> getUnparsedFiles() {
    return syncService.getStore().getUnparsedFiles();
  }
}
