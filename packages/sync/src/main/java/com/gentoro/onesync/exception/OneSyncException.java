package com.gentoro.onesync.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base runtime exception for the sync engine. Carries a stable {@link OneSyncErrorCode} and a
 * read-only snapshot of diagnostic details (the resource that failed, a rate-limit reset time).
 */
public class OneSyncException extends RuntimeException {
  private final OneSyncErrorCode code;
  private final Map<String, Object> context;

  public OneSyncException(OneSyncErrorCode code, String message) {
    this(code, message, null, null);
  }

  public OneSyncException(OneSyncErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public OneSyncException(OneSyncErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public OneSyncException(
      OneSyncErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public OneSyncErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  /** String form of a context entry, if the exception recorded one under {@code key}. */
  public Optional<String> contextValue(String key) {
    return Optional.ofNullable(context.get(key)).map(String::valueOf);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("]: ").append(getMessage());
    if (!context.isEmpty()) {
      sb.append(' ').append(context);
    }
    return sb.toString();
  }
}
