package com.codeheadsystems.gplot.server.storage;

import java.util.List;
import java.util.Optional;

/**
 * Image metadata index keyed by guid. Every mutation is durable before it returns.
 */
public interface MetadataRepository {

  void save(ImageMetadata metadata);

  Optional<ImageMetadata> get(String guid);

  boolean delete(String guid);

  /**
   * Guids in the index, restricted to one group when {@code group} is non-null.
   *
   * @param group group filter, may be null
   * @return the guids
   */
  List<String> listAll(String group);

  boolean exists(String guid);

  /**
   * Entries created more than {@code ageDays} days ago, restricted to a group when given.
   * <p>
   * {@code ageDays == 0} matches every entry. Entries whose creation time is missing or
   * unparseable always match.
   *
   * @param ageDays minimum age in days, 0 for all
   * @param group   group filter, may be null
   * @return matching entries
   */
  List<ImageMetadata> filterByAge(int ageDays, String group);
}
