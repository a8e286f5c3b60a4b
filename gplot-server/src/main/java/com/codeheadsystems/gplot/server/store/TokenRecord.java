package com.codeheadsystems.gplot.server.store;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted state of an issued token.
 * <p>
 * Records are never deleted; revocation sets {@link #revoked()} and keeps the record for audit.
 *
 * @param tokenId     the JWT ID
 * @param group       the group the token grants
 * @param issuedAt    when the token was issued
 * @param expiresAt   when the token expires
 * @param revoked     whether the token was revoked
 * @param fingerprint bound device fingerprint, or null when unbound
 * @param extra       fields written by other tools, carried through unchanged
 */
public record TokenRecord(
    String tokenId,
    String group,
    Instant issuedAt,
    Instant expiresAt,
    boolean revoked,
    String fingerprint,
    Map<String, Object> extra) {

  public TokenRecord {
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public TokenRecord(String tokenId, String group, Instant issuedAt, Instant expiresAt, String fingerprint) {
    this(tokenId, group, issuedAt, expiresAt, false, fingerprint, Map.of());
  }

  /**
   * A copy of this record marked revoked.
   *
   * @return the tombstone
   */
  public TokenRecord asRevoked() {
    return new TokenRecord(tokenId, group, issuedAt, expiresAt, true, fingerprint, extra);
  }
}
