package com.codeheadsystems.gplot.server.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-client, per-endpoint rate limiter built from {@link TokenBucket}s.
 * <p>
 * Buckets are created lazily on first access to a (client, endpoint) key with
 * {@code capacity = limit} and {@code refillRate = limit / window}. A bucket keeps the limit that
 * was in effect when it was created: changing an endpoint override afterwards does not resize
 * existing buckets, and a denial reports the limit and window the bucket was sized with. Use
 * {@link #resetClient(String, String)} to force a bucket to pick up a new limit. A null endpoint
 * means {@link #DEFAULT_ENDPOINT}.
 * <p>
 * Keys are held in a {@link ConcurrentHashMap}, so distinct keys never contend beyond the map
 * itself. Eviction is explicit via {@link #cleanupStaleBuckets(Duration)} and
 * {@link #resetClient(String)}; nothing is swept on a schedule.
 */
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  /**
   * Endpoint used when the caller does not name one.
   */
  public static final String DEFAULT_ENDPOINT = "default";

  private final int defaultLimit;
  private final long windowSeconds;
  private final boolean enabled;
  private final Clock clock;
  private final ConcurrentHashMap<String, EndpointLimit> endpointLimits = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<BucketKey, LimitedBucket> buckets = new ConcurrentHashMap<>();

  /**
   * Requests per window for one endpoint.
   *
   * @param limit         requests allowed per window
   * @param windowSeconds window length
   */
  public record EndpointLimit(int limit, long windowSeconds) {
  }

  /**
   * Snapshot of limiter state for diagnostics.
   *
   * @param enabled        whether limiting is applied
   * @param defaultLimit   default requests per window
   * @param windowSeconds  default window
   * @param endpointLimits configured overrides
   * @param activeBuckets  number of live buckets
   * @param clients        number of distinct clients with a bucket
   */
  public record RateLimiterStats(boolean enabled,
                                 int defaultLimit,
                                 long windowSeconds,
                                 Map<String, EndpointLimit> endpointLimits,
                                 int activeBuckets,
                                 long clients) {
  }

  private record BucketKey(String clientId, String endpoint) {
  }

  // The limit a bucket was sized from, reported when that bucket denies a request.
  private record LimitedBucket(TokenBucket bucket, EndpointLimit limit) {
  }

  /**
   * Creates a limiter on the system UTC clock.
   *
   * @param defaultLimit  default requests per window
   * @param windowSeconds default window length in seconds
   * @param enabled       when false, {@link #checkLimit} never throws
   */
  public RateLimiter(int defaultLimit, long windowSeconds, boolean enabled) {
    this(defaultLimit, windowSeconds, enabled, Clock.systemUTC());
  }

  /**
   * Creates a limiter.
   *
   * @param defaultLimit  default requests per window
   * @param windowSeconds default window length in seconds
   * @param enabled       when false, {@link #checkLimit} never throws
   * @param clock         time source for every bucket
   */
  public RateLimiter(int defaultLimit, long windowSeconds, boolean enabled, Clock clock) {
    if (defaultLimit <= 0 || windowSeconds <= 0) {
      throw new IllegalArgumentException("defaultLimit and windowSeconds must be positive");
    }
    this.defaultLimit = defaultLimit;
    this.windowSeconds = windowSeconds;
    this.enabled = enabled;
    this.clock = clock;
  }

  /**
   * Sets an override for an endpoint using the default window.
   *
   * @param endpoint endpoint path, e.g. {@code /render}
   * @param limit    requests per window
   */
  public void setEndpointLimit(String endpoint, int limit) {
    setEndpointLimit(endpoint, limit, windowSeconds);
  }

  /**
   * Sets an override for an endpoint. Applies to buckets created after this call.
   *
   * @param endpoint      endpoint path
   * @param limit         requests per window
   * @param windowSeconds window length in seconds
   */
  public void setEndpointLimit(String endpoint, int limit, long windowSeconds) {
    if (limit <= 0 || windowSeconds <= 0) {
      throw new IllegalArgumentException("limit and windowSeconds must be positive");
    }
    endpointLimits.put(resolve(endpoint), new EndpointLimit(limit, windowSeconds));
    log.debug("Endpoint limit set: {} -> {} per {}s", endpoint, limit, windowSeconds);
  }

  /**
   * The override for an endpoint, or the default pair.
   *
   * @param endpoint endpoint path
   * @return the limit
   */
  public EndpointLimit getLimit(String endpoint) {
    return Optional.ofNullable(endpointLimits.get(resolve(endpoint)))
        .orElseGet(() -> new EndpointLimit(defaultLimit, windowSeconds));
  }

  /**
   * Consumes from the bucket for the key, creating it if needed. Ignores {@link #isEnabled()}.
   *
   * @param clientId client identifier
   * @param endpoint endpoint path
   * @param cost     tokens to take
   * @return the consume result
   */
  public TokenBucket.ConsumeResult consume(String clientId, String endpoint, int cost) {
    return bucketFor(clientId, resolve(endpoint)).bucket().consume(cost);
  }

  /**
   * Checks a single-cost request.
   *
   * @param clientId client identifier
   * @param endpoint endpoint path
   * @throws RateLimitExceededException if the bucket is exhausted
   */
  public void checkLimit(String clientId, String endpoint) throws RateLimitExceededException {
    checkLimit(clientId, endpoint, 1);
  }

  /**
   * Checks a request against the limit. No-op when the limiter is disabled.
   *
   * @param clientId client identifier
   * @param endpoint endpoint path
   * @param cost     tokens this request costs
   * @throws RateLimitExceededException carrying limit, window and retry-after when denied
   */
  public void checkLimit(String clientId, String endpoint, int cost) throws RateLimitExceededException {
    if (!enabled) {
      return;
    }
    String resolved = resolve(endpoint);
    LimitedBucket limited = bucketFor(clientId, resolved);
    TokenBucket.ConsumeResult result = limited.bucket().consume(cost);
    if (!result.allowed()) {
      log.debug("Rate limit hit for client={} endpoint={}", clientId, resolved);
      throw new RateLimitExceededException(limited.limit().limit(),
          limited.limit().windowSeconds(), result.retryAfterSeconds());
    }
  }

  private static String resolve(String endpoint) {
    return endpoint == null ? DEFAULT_ENDPOINT : endpoint;
  }

  private LimitedBucket bucketFor(String clientId, String endpoint) {
    return buckets.computeIfAbsent(new BucketKey(clientId, endpoint), key -> {
      EndpointLimit limit = getLimit(key.endpoint());
      return new LimitedBucket(
          new TokenBucket(limit.limit(), (double) limit.limit() / limit.windowSeconds(), clock), limit);
    });
  }

  /**
   * Removes every bucket belonging to a client.
   *
   * @param clientId client identifier
   */
  public void resetClient(String clientId) {
    buckets.keySet().removeIf(key -> key.clientId().equals(clientId));
  }

  /**
   * Removes one bucket.
   *
   * @param clientId client identifier
   * @param endpoint endpoint path
   */
  public void resetClient(String clientId, String endpoint) {
    buckets.remove(new BucketKey(clientId, resolve(endpoint)));
  }

  /**
   * Removes buckets not touched within {@code maxAge}.
   *
   * @param maxAge maximum idle time
   * @return number of buckets removed
   */
  public int cleanupStaleBuckets(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    int removed = 0;
    for (Map.Entry<BucketKey, LimitedBucket> entry : buckets.entrySet()) {
      if (entry.getValue().bucket().lastRefill().isBefore(cutoff)
          && buckets.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Removed {} stale rate-limit bucket(s)", removed);
    }
    return removed;
  }

  /**
   * Current statistics.
   *
   * @return the stats
   */
  public RateLimiterStats getStats() {
    long clients = buckets.keySet().stream().map(BucketKey::clientId).distinct().count();
    return new RateLimiterStats(enabled, defaultLimit, windowSeconds, Map.copyOf(endpointLimits),
        buckets.size(), clients);
  }

  public boolean isEnabled() {
    return enabled;
  }
}
