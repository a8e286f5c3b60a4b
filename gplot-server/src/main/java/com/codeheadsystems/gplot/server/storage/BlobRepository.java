package com.codeheadsystems.gplot.server.storage;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Raw artifact bytes keyed by (guid, format). At most one blob exists per pair.
 * <p>
 * Implementations reject malformed identifiers with
 * {@link com.codeheadsystems.gplot.server.exceptions.InvalidIdentifierException} and wrap
 * I/O failures in {@link com.codeheadsystems.gplot.server.exceptions.StorageException}.
 */
public interface BlobRepository {

  /**
   * Formats a blob may be stored as.
   */
  Set<String> SUPPORTED_FORMATS = Set.of("png", "jpg", "jpeg", "svg", "pdf");

  void save(String guid, byte[] data, String format);

  Optional<byte[]> get(String guid, String format);

  /**
   * Deletes one format, or every supported format when {@code format} is null.
   *
   * @param guid   the guid
   * @param format the format, or null for all
   * @return true if any blob was removed
   */
  boolean delete(String guid, String format);

  /**
   * Whether a blob exists for the format, or for any format when {@code format} is null.
   *
   * @param guid   the guid
   * @param format the format, or null for any
   * @return true if present
   */
  boolean exists(String guid, String format);

  /**
   * Guids of all stored blobs. Entries whose names are not valid identifiers are skipped.
   *
   * @return sorted guids
   */
  List<String> listAll();

  /**
   * The first supported format for which a blob exists.
   *
   * @param guid the guid
   * @return the format, or empty
   */
  Optional<String> findFormat(String guid);
}
