package com.gentoro.onesync.sync;

import com.gentoro.onesync.model.SyncStatus;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of one call to {@link SyncService#syncFromSource()}.
 *
 * @param status aggregate status; {@code null} when the pass was skipped
 * @param commandsUpdated commands that were new or changed
 * @param personasUpdated personas that were new or changed
 * @param rulesUpdated rules that were new or changed
 * @param errors per-category failures, formatted as {@code "<Category>: <message>"}
 * @param duration wall-clock time of the pass
 * @param skipped whether the pass was rejected because another one was running
 */
public record SyncResult(
    SyncStatus status,
    int commandsUpdated,
    int personasUpdated,
    int rulesUpdated,
    List<String> errors,
    Duration duration,
    boolean skipped) {

  public SyncResult {
    errors = List.copyOf(errors);
  }

  static SyncResult skippedPass() {
    return new SyncResult(null, 0, 0, 0, List.of(), Duration.ZERO, true);
  }

  public boolean isSuccess() {
    return status == SyncStatus.SUCCESS;
  }

  public int totalUpdated() {
    return commandsUpdated + personasUpdated + rulesUpdated;
  }
}
