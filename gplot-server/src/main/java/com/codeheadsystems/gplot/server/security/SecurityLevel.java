package com.codeheadsystems.gplot.server.security;

/**
 * Severity of a security event, ordered INFO &lt; WARNING &lt; ERROR &lt; CRITICAL.
 */
public enum SecurityLevel {
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  /**
   * Whether this level is at or above the threshold.
   *
   * @param threshold the minimum level
   * @return true if this level should be recorded
   */
  public boolean isAtLeast(SecurityLevel threshold) {
    return compareTo(threshold) >= 0;
  }
}
