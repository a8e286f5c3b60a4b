package com.codeheadsystems.gplot.server.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Index entry for a stored image. Immutable; the group is the sole access-control attribute.
 *
 * @param guid      the image identifier
 * @param format    blob format
 * @param sizeBytes blob size
 * @param createdAt creation time, null when missing or unparseable in the index
 * @param group     owning group, null for ungrouped images
 * @param extra     additional attributes, carried through unchanged
 */
public record ImageMetadata(
    String guid,
    String format,
    long sizeBytes,
    Instant createdAt,
    String group,
    Map<String, Object> extra) {

  public ImageMetadata {
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public ImageMetadata(String guid, String format, long sizeBytes, Instant createdAt, String group) {
    this(guid, format, sizeBytes, createdAt, group, Map.of());
  }
}
