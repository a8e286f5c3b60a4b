package com.codeheadsystems.gplot.server.security;

import java.time.Duration;
import java.util.Locale;

/**
 * Thrown when a (client, endpoint) bucket cannot cover the cost of a request.
 */
public class RateLimitExceededException extends Exception {

  private final int limit;
  private final long windowSeconds;
  private final double retryAfterSeconds;

  /**
   * Instantiates a new Rate limit exceeded exception.
   *
   * @param limit             requests allowed per window
   * @param windowSeconds     window length
   * @param retryAfterSeconds seconds until the request could succeed
   */
  public RateLimitExceededException(int limit, long windowSeconds, double retryAfterSeconds) {
    super(String.format(Locale.ROOT, "Rate limit exceeded: %d requests per %ds. Retry after %.1fs",
        limit, windowSeconds, retryAfterSeconds));
    this.limit = limit;
    this.windowSeconds = windowSeconds;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public int getLimit() {
    return limit;
  }

  public long getWindowSeconds() {
    return windowSeconds;
  }

  public double getRetryAfterSeconds() {
    return retryAfterSeconds;
  }

  /**
   * Retry-after rounded up to whole seconds, as sent in a {@code Retry-After} header.
   *
   * @return the retry duration
   */
  public Duration getRetryDuration() {
    return Duration.ofSeconds((long) Math.ceil(retryAfterSeconds));
  }
}
