package com.gentoro.onesync.sync;

import com.gentoro.onesync.model.ContentItem;
import com.gentoro.onesync.model.ContentModel;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns freshly loaded content into persisted models, carrying {@code lastUpdated} forward for
 * items whose hash did not change.
 */
public class ChangeDetector {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(ChangeDetector.class);

  /** Builds the persisted form of a content item. */
  @FunctionalInterface
  public interface ModelFactory<C extends ContentItem, M extends ContentModel<C>> {
    M create(C content, String hash, Instant lastUpdated);
  }

  /**
   * @param models one model per incoming item, in load order
   * @param updated how many of them are new or changed
   */
  public record ChangeSet<M>(List<M> models, int updated) {}

  private final Clock clock;

  public ChangeDetector(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public <C extends ContentItem, M extends ContentModel<C>> ChangeSet<M> detect(
      List<C> incoming, List<M> stored, ModelFactory<C, M> factory) {
    Map<String, M> storedById = new HashMap<>();
    for (M model : stored) {
      storedById.put(model.id(), model);
    }

    Instant now = clock.instant();
    List<M> models = new ArrayList<>(incoming.size());
    int updated = 0;
    for (C item : incoming) {
      String hash = ContentHasher.hash(item);
      M existing = storedById.get(item.name());
      if (existing != null && hash.equals(existing.hash())) {
        models.add(factory.create(item, hash, existing.lastUpdated()));
      } else {
        log.debug("{} '{}'", existing == null ? "New" : "Changed", item.name());
        models.add(factory.create(item, hash, now));
        updated++;
      }
    }
    return new ChangeSet<>(models, updated);
  }
}
