package com.gentoro.onesync.exception;

/**
 * Canonical error codes for OneSync. Codes are stable and suitable for logs and for the sync
 * metadata persisted alongside the mirror. Prefer the most specific code that reflects the origin
 * of the failure.
 */
public enum OneSyncErrorCode {
  // Generic
  FAILED_PRECONDITION,
  NOT_FOUND,
  RESOURCE_EXHAUSTED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  NETWORK_ERROR,
}
