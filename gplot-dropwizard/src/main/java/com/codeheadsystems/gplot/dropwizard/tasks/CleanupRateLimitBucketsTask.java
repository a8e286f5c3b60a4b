package com.codeheadsystems.gplot.dropwizard.tasks;

import com.codeheadsystems.gplot.server.security.RateLimiter;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Admin task dropping rate-limit buckets idle for longer than {@code maxAgeSeconds}
 * (default one hour).
 */
public class CleanupRateLimitBucketsTask extends Task {

  static final long DEFAULT_MAX_AGE_SECONDS = 3600;

  private final RateLimiter rateLimiter;

  public CleanupRateLimitBucketsTask(RateLimiter rateLimiter) {
    super("cleanup-rate-limit-buckets");
    this.rateLimiter = rateLimiter;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) {
    Integer maxAge = TaskParameters.intValue(parameters, "maxAgeSeconds");
    if (maxAge != null && maxAge < 0) {
      output.println("Usage: cleanup-rate-limit-buckets[?maxAgeSeconds=<seconds>]");
      return;
    }
    long seconds = maxAge == null ? DEFAULT_MAX_AGE_SECONDS : maxAge;
    int removed = rateLimiter.cleanupStaleBuckets(Duration.ofSeconds(seconds));
    output.println("Removed " + removed + " stale bucket(s); "
        + rateLimiter.getStats().activeBuckets() + " active");
  }
}
