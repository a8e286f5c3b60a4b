package com.codeheadsystems.gplot.server.auth;

import java.time.Instant;

/**
 * Result of a successful token verification.
 *
 * @param group     the group the token grants
 * @param issuedAt  issue time
 * @param expiresAt expiry time
 * @param tokenId   the JWT ID
 */
public record TokenInfo(String group, Instant issuedAt, Instant expiresAt, String tokenId) {
}
