package com.gentoro.onesync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {
  SUCCESS("success"),
  FAILED("failed");

  private final String value;

  SyncStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static SyncStatus fromValue(String value) {
    for (SyncStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sync status: " + value);
  }
}
