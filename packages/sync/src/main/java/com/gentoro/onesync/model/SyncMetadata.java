package com.gentoro.onesync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Outcome of the most recent sync pass.
 *
 * @param lastSync when the metadata was last written
 * @param syncStatus aggregate status of the pass
 * @param errorMessage "; "-joined per-category failures, {@code null} on success
 */
public record SyncMetadata(Instant lastSync, SyncStatus syncStatus, String errorMessage) {

  static final String NEVER_SYNCED = "never synchronized";

  /** Zeroed metadata for a store that has never completed a pass. */
  public static SyncMetadata initial() {
    return new SyncMetadata(Instant.EPOCH, SyncStatus.FAILED, NEVER_SYNCED);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return syncStatus == SyncStatus.SUCCESS;
  }
}
