package com.gentoro.onesync.source;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** TTL-bounded cache of raw response bodies keyed by request URL. */
public class ResponseCache {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(ResponseCache.class);

  private record Entry(String body, Instant storedAt) {}

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public ResponseCache(Duration ttl, Clock clock) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
    }
    this.ttl = ttl;
    this.clock = clock;
  }

  /** Returns the cached body if it was stored less than one TTL ago. */
  public Optional<String> get(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (Duration.between(entry.storedAt(), clock.instant()).compareTo(ttl) >= 0) {
      entries.remove(key, entry);
      log.trace("Cache entry expired: {}", key);
      return Optional.empty();
    }
    return Optional.of(entry.body());
  }

  public void put(String key, String body) {
    entries.put(key, new Entry(body, clock.instant()));
  }

  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }
}
