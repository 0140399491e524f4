package com.gentoro.onesync.exception;

/** Illegal or unexpected state encountered, e.g. using a component before it was initialized. */
public class StateException extends OneSyncException {
  public StateException(String message) {
    super(OneSyncErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(OneSyncErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
