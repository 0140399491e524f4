package com.gentoro.onesync.model;

/** A named unit of content as delivered by a source. Sources carry no identity or versioning. */
public interface ContentItem {
  String name();
}
