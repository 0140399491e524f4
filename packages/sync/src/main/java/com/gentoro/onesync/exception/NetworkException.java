package com.gentoro.onesync.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends OneSyncException {
  public NetworkException(String message) {
    super(OneSyncErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(OneSyncErrorCode.NETWORK_ERROR, message, cause);
  }
}
