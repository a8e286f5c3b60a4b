package com.codeheadsystems.gplot.server.auth;

/**
 * Token verification failure.
 * <p>
 * {@link #getMessage()} is always the same generic text so that callers cannot tell why a token
 * was refused. The {@link Reason} and detail are for the audit log only.
 */
public class TokenVerificationException extends SecurityException {

  /**
   * Generic client-facing message.
   */
  public static final String GENERIC_MESSAGE = "Authentication failed";

  /**
   * Why verification failed.
   */
  public enum Reason {
    MALFORMED,
    INVALID_SIGNATURE,
    EXPIRED,
    UNKNOWN_TOKEN,
    REVOKED,
    FINGERPRINT_MISMATCH
  }

  private final Reason reason;
  private final String detail;

  /**
   * Instantiates a new Token verification exception.
   *
   * @param reason the reason
   * @param detail audit detail
   */
  public TokenVerificationException(final Reason reason, final String detail) {
    super(GENERIC_MESSAGE);
    this.reason = reason;
    this.detail = detail;
  }

  /**
   * Instantiates a new Token verification exception.
   *
   * @param reason the reason
   * @param detail audit detail
   * @param cause  the cause
   */
  public TokenVerificationException(final Reason reason, final String detail, final Throwable cause) {
    super(GENERIC_MESSAGE, cause);
    this.reason = reason;
    this.detail = detail;
  }

  public Reason getReason() {
    return reason;
  }

  public String getDetail() {
    return detail;
  }
}
