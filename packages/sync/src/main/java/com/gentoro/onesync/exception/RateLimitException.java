package com.gentoro.onesync.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** The source refused the request because the caller exceeded its rate limit. */
public class RateLimitException extends OneSyncException {
  public RateLimitException(String message, String resource, String resetAt) {
    super(OneSyncErrorCode.RESOURCE_EXHAUSTED, message, context(resource, resetAt));
  }

  private static Map<String, Object> context(String resource, String resetAt) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("resource", resource);
    if (resetAt != null) ctx.put("resetAt", resetAt);
    return ctx;
  }
}
