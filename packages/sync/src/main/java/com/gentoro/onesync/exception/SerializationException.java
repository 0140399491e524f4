package com.gentoro.onesync.exception;

/** Failed to serialize or deserialize JSON/YAML content. */
public class SerializationException extends OneSyncException {
  public SerializationException(String message) {
    super(OneSyncErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(OneSyncErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
