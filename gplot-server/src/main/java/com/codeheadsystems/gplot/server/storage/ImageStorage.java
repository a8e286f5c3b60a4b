package com.codeheadsystems.gplot.server.storage;

import java.util.List;
import java.util.Optional;

/**
 * GUID-addressed, group-scoped image store.
 * <p>
 * Wherever a {@code group} argument is non-null, an image owned by a different group (or by no
 * group) raises {@link com.codeheadsystems.gplot.server.exceptions.PermissionDeniedException}.
 * A null group is ungated internal access. Malformed identifiers raise
 * {@link com.codeheadsystems.gplot.server.exceptions.InvalidIdentifierException}; absent images
 * are reported as empty or false. Artifacts are immutable once stored.
 */
public interface ImageStorage {

  /**
   * Stores an image under a fresh guid. Writes the blob, then the metadata entry; if the
   * metadata write fails the blob is left behind and the call throws.
   *
   * @param data   image bytes
   * @param format image format
   * @param group  owning group, may be null
   * @return the new guid
   */
  String saveImage(byte[] data, String format, String group);

  Optional<StoredImage> getImage(String guid, String group);

  /**
   * Deletes the blob(s) and metadata for an image.
   *
   * @param guid  the guid
   * @param group requesting group, may be null
   * @return true if anything was deleted
   */
  boolean deleteImage(String guid, String group);

  List<String> listImages(String group);

  /**
   * Whether the image exists and is visible to the group. Malformed identifiers are reported as
   * absent rather than raised.
   *
   * @param guid  the guid
   * @param group requesting group, may be null
   * @return true if present and visible
   */
  boolean exists(String guid, String group);

  /**
   * Deletes images older than {@code ageDays} ({@code 0} for all) within an optional group.
   * Metadata entries whose blob is gone are deleted regardless of age when they match the group.
   * Blobs without metadata are never touched.
   *
   * @param ageDays minimum age in days, 0 for all
   * @param group   group filter, may be null
   * @return number of entries deleted
   */
  int purge(int ageDays, String group);
}
