package com.gentoro.onesync.exception;

/** I/O operation failed (filesystem, backing document, lock file). */
public class IoException extends OneSyncException {
  public IoException(String message) {
    super(OneSyncErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(OneSyncErrorCode.IO_ERROR, message, cause);
  }
}
