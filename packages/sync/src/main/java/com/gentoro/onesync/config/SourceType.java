package com.gentoro.onesync.config;

import com.gentoro.onesync.exception.ConfigException;
import java.util.Locale;

/** Where the authoritative content lives. */
public enum SourceType {
  FILESYSTEM("local"),
  REMOTE("remote");

  private final String tag;

  SourceType(String tag) {
    this.tag = tag;
  }

  /** Short tag recorded on unparsed files. */
  public String tag() {
    return tag;
  }

  public static SourceType parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigException("Missing source.type configuration");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "filesystem", "local" -> FILESYSTEM;
      case "remote", "github" -> REMOTE;
      default -> throw new ConfigException("Unsupported source type: " + value);
    };
  }
}
