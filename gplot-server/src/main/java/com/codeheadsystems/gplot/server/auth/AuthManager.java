package com.codeheadsystems.gplot.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.gplot.server.auth.TokenVerificationException.Reason;
import com.codeheadsystems.gplot.server.store.TokenRecord;
import com.codeheadsystems.gplot.server.store.TokenStore;
import com.codeheadsystems.gplot.server.util.Digests;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies group-scoped JWT bearer tokens.
 * <p>
 * Tokens are signed with HMAC-SHA256 and carry a {@code group} claim. Each token's JTI is
 * recorded in a {@link TokenStore}. Verification checks signature and expiry first, then
 * reloads the store so that tokens created or revoked by another process sharing the store
 * are observed, then checks revocation and device fingerprint binding.
 */
public class AuthManager {

  /**
   * Claim carrying the token's group.
   */
  public static final String GROUP_CLAIM = "group";

  private static final Logger log = LoggerFactory.getLogger(AuthManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final TokenStore tokenStore;
  private final String issuer;
  private final String secretFingerprint;
  private final Clock clock;

  /**
   * Creates a new AuthManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param tokenStore backing store for token state and revocation
   */
  public AuthManager(String secret, String issuer, TokenStore tokenStore) {
    this(secret.getBytes(StandardCharsets.UTF_8), issuer, tokenStore, Clock.systemUTC());
  }

  /**
   * Creates a new AuthManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param tokenStore backing store for token state and revocation
   * @param clock      time source for issue and expiry checks
   */
  public AuthManager(byte[] secret, String issuer, TokenStore tokenStore, Clock clock) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("JWT secret must not be empty");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.clock = clock;
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.tokenStore = tokenStore;
    this.issuer = issuer;
    this.secretFingerprint = "sha256:" + Digests.sha256Hex(secret).substring(0, 12);
  }

  /**
   * Issues an unbound token.
   *
   * @param group            the group the token grants
   * @param expiresInSeconds time to live
   * @return signed JWT string
   */
  public String createToken(String group, long expiresInSeconds) {
    return createToken(group, expiresInSeconds, null);
  }

  /**
   * Issues a token and records it in the store before returning it.
   *
   * @param group            the group the token grants
   * @param expiresInSeconds time to live
   * @param fingerprint      device fingerprint to bind, or null
   * @return signed JWT string
   */
  public String createToken(String group, long expiresInSeconds, String fingerprint) {
    Objects.requireNonNull(group, "group");
    if (expiresInSeconds <= 0) {
      throw new IllegalArgumentException("expiresInSeconds must be positive: " + expiresInSeconds);
    }
    String jti = UUID.randomUUID().toString();
    // JWT dates have second precision
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plusSeconds(expiresInSeconds);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withClaim(GROUP_CLAIM, group)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    tokenStore.store(new TokenRecord(jti, group, now, expiresAt, fingerprint));
    log.debug("Issued token jti={} group={} bound={}", jti, group, fingerprint != null);
    return token;
  }

  /**
   * Verifies a token that is not presented with a fingerprint.
   *
   * @param token JWT string
   * @return token info
   * @throws TokenVerificationException if the token is refused
   */
  public TokenInfo verifyToken(String token) {
    return verifyToken(token, null);
  }

  /**
   * Verifies a token.
   * <p>
   * A token bound to a fingerprint at issuance must be presented with the same fingerprint;
   * a missing fingerprint counts as a mismatch.
   *
   * @param token       JWT string
   * @param fingerprint fingerprint of the presenting device, may be null
   * @return token info
   * @throws TokenVerificationException if the token is refused
   */
  public TokenInfo verifyToken(String token, String fingerprint) {
    if (token == null || token.isBlank()) {
      throw new TokenVerificationException(Reason.MALFORMED, "empty token");
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (TokenExpiredException e) {
      throw new TokenVerificationException(Reason.EXPIRED, "token expired", e);
    } catch (SignatureVerificationException e) {
      throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "invalid signature", e);
    } catch (JWTDecodeException e) {
      throw new TokenVerificationException(Reason.MALFORMED, "malformed token", e);
    } catch (JWTVerificationException e) {
      throw new TokenVerificationException(Reason.MALFORMED, e.getMessage(), e);
    }
    String jti = decoded.getId();
    if (jti == null) {
      throw new TokenVerificationException(Reason.MALFORMED, "token has no id");
    }

    tokenStore.reload();
    TokenRecord record = tokenStore.load(jti)
        .orElseThrow(() -> new TokenVerificationException(Reason.UNKNOWN_TOKEN, "unknown token " + jti));
    if (record.revoked()) {
      throw new TokenVerificationException(Reason.REVOKED, "token " + jti + " revoked");
    }
    if (record.fingerprint() != null && !record.fingerprint().equals(fingerprint)) {
      throw new TokenVerificationException(Reason.FINGERPRINT_MISMATCH,
          "fingerprint mismatch for token " + jti);
    }

    String group = Optional.ofNullable(decoded.getClaim(GROUP_CLAIM).asString()).orElse(record.group());
    log.debug("Verified token jti={} group={}", jti, group);
    return new TokenInfo(group, decoded.getIssuedAtAsInstant(), decoded.getExpiresAtAsInstant(), jti);
  }

  /**
   * Revokes a token by its JTI. The store keeps the record as a tombstone.
   *
   * @param tokenId the JWT ID
   * @return true if a live token was revoked
   */
  public boolean revokeToken(String tokenId) {
    boolean revoked = tokenStore.revoke(tokenId);
    if (revoked) {
      log.info("Revoked token jti={}", tokenId);
    }
    return revoked;
  }

  /**
   * All tokens in the store after reloading it.
   *
   * @return token records, revoked included
   */
  public List<TokenRecord> listTokens() {
    tokenStore.reload();
    return tokenStore.list();
  }

  /**
   * Short non-reversible hash of the signing secret, safe to log.
   *
   * @return {@code sha256:} followed by 12 hex characters
   */
  public String getSecretFingerprint() {
    return secretFingerprint;
  }
}
