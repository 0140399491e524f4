package com.gentoro.onesync.exception;

/** Configuration is missing, malformed or inconsistent. */
public class ConfigException extends OneSyncException {
  public ConfigException(String message) {
    super(OneSyncErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(OneSyncErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
