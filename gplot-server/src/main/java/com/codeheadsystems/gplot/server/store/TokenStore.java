package com.codeheadsystems.gplot.server.store;

import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for issued tokens.
 * <p>
 * Implementations must be thread-safe. A store may be shared by several processes; in that
 * case {@link #reload()} re-reads the shared state so that tokens created or revoked elsewhere
 * become visible without a restart.
 */
public interface TokenStore {

  /**
   * Stores a record keyed by its token id and persists it immediately.
   *
   * @param record the record
   */
  void store(TokenRecord record);

  /**
   * Loads a record, revoked or not, from the current in-process view.
   *
   * @param tokenId the token id
   * @return the record, or empty if unknown
   */
  Optional<TokenRecord> load(String tokenId);

  /**
   * Marks a token revoked. The record itself is kept.
   *
   * @param tokenId the token id
   * @return true if a live token was revoked, false if unknown or already revoked
   */
  boolean revoke(String tokenId);

  /**
   * All records, including revoked ones.
   *
   * @return the records
   */
  List<TokenRecord> list();

  /**
   * Re-reads shared state. No-op for stores that are not shared.
   */
  default void reload() {
  }
}
