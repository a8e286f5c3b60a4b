package com.codeheadsystems.gplot.server.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket with lazy refill.
 * <p>
 * Tokens accrue at {@code refillRate} per second of elapsed clock time, capped at
 * {@code capacity}. Refill is computed on access; there is no background timer. The
 * refill-and-consume sequence is atomic per bucket.
 */
public class TokenBucket {

  private final int capacity;
  private final double refillRate;
  private final Clock clock;
  private double tokens;
  private Instant lastRefill;

  /**
   * Creates a full bucket.
   *
   * @param capacity   maximum number of tokens
   * @param refillRate tokens added per second
   * @param clock      time source
   */
  public TokenBucket(int capacity, double refillRate, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    if (refillRate <= 0) {
      throw new IllegalArgumentException("refillRate must be positive: " + refillRate);
    }
    this.capacity = capacity;
    this.refillRate = refillRate;
    this.clock = clock;
    this.tokens = capacity;
    this.lastRefill = clock.instant();
  }

  /**
   * Outcome of a consume call.
   *
   * @param allowed           whether the tokens were taken
   * @param retryAfterSeconds seconds until enough tokens accrue, zero when allowed
   */
  public record ConsumeResult(boolean allowed, double retryAfterSeconds) {

    static final ConsumeResult ALLOWED = new ConsumeResult(true, 0.0);
  }

  /**
   * Refills from elapsed time, then takes {@code cost} tokens if available.
   *
   * @param cost number of tokens this call needs, at least 1
   * @return the result
   * @throws IllegalArgumentException if {@code cost} is not positive
   */
  public synchronized ConsumeResult consume(int cost) {
    if (cost <= 0) {
      throw new IllegalArgumentException("cost must be positive: " + cost);
    }
    refill();
    if (tokens >= cost) {
      tokens -= cost;
      return ConsumeResult.ALLOWED;
    }
    return new ConsumeResult(false, (cost - tokens) / refillRate);
  }

  private void refill() {
    Instant now = clock.instant();
    Duration elapsed = Duration.between(lastRefill, now);
    if (!elapsed.isNegative()) {
      double seconds = elapsed.toNanos() / 1_000_000_000.0;
      tokens = Math.min(capacity, tokens + seconds * refillRate);
    }
    lastRefill = now;
  }

  /**
   * Tokens currently held, without refilling.
   *
   * @return the token count
   */
  public synchronized double tokens() {
    return tokens;
  }

  /**
   * Time of the last refill, which is the time of the last access.
   *
   * @return the instant
   */
  public synchronized Instant lastRefill() {
    return lastRefill;
  }

  public int capacity() {
    return capacity;
  }

  public double refillRate() {
    return refillRate;
  }
}
