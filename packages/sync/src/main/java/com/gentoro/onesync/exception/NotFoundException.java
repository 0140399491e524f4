package com.gentoro.onesync.exception;

import java.util.Map;

/** The requested resource does not exist at the source. */
public class NotFoundException extends OneSyncException {
  public NotFoundException(String message) {
    super(OneSyncErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, String resource) {
    super(OneSyncErrorCode.NOT_FOUND, message, Map.of("resource", resource));
  }
}
