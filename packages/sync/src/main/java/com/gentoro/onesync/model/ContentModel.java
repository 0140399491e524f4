package com.gentoro.onesync.model;

import java.time.Instant;

/**
 * A content item as persisted in the mirror.
 *
 * @param <C> the content-only type this record was built from
 */
public interface ContentModel<C extends ContentItem> {

  /** Stable identifier, derived from the item's natural name. */
  String id();

  /** SHA-256 digest over the canonical serialization of {@link #toContent()}. */
  String hash();

  /** Moves only when the id is new or the hash changed. */
  Instant lastUpdated();

  /** Strips identity and versioning, returning the content fields only. */
  C toContent();
}
