package com.codeheadsystems.gplot.dropwizard.filter;

import com.codeheadsystems.gplot.server.resource.RequestContexts;
import com.codeheadsystems.gplot.server.security.RateLimitExceededException;
import com.codeheadsystems.gplot.server.security.RateLimiter;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@link RateLimiter} to every request before routing and authentication.
 * <p>
 * Buckets are keyed by the caller's remote address and the first path segment, so
 * {@code /images/abc} and {@code /images} share the {@code /images} bucket. Rejections answer
 * 429 with a {@code Retry-After} header in whole seconds and are audited.
 */
@PreMatching
@Priority(Priorities.AUTHENTICATION - 100)
public class RateLimitFilter implements ContainerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  private final RateLimiter rateLimiter;
  private final SecurityAuditor auditor;

  public RateLimitFilter(RateLimiter rateLimiter, SecurityAuditor auditor) {
    this.rateLimiter = rateLimiter;
    this.auditor = auditor;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    String clientAddress = RequestContexts.clientAddress(requestContext);
    String endpoint = endpointOf(requestContext.getUriInfo().getPath());
    try {
      rateLimiter.checkLimit(clientAddress, endpoint);
    } catch (RateLimitExceededException e) {
      log.debug("Rejecting {} {}: {}", clientAddress, endpoint, e.getMessage());
      auditor.logRateLimit(clientAddress, endpoint, e.getLimit(), e.getWindowSeconds());
      requestContext.abortWith(Response.status(Response.Status.TOO_MANY_REQUESTS)
          .header(HttpHeaders.RETRY_AFTER, e.getRetryDuration().toSeconds())
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(Map.of("code", 429, "message", e.getMessage()))
          .build());
    }
  }

  /**
   * Bucket key for a request path: {@code /} followed by its first segment.
   *
   * @param path the request path, with or without a leading slash
   * @return the endpoint key
   */
  static String endpointOf(String path) {
    if (path == null) {
      return "/";
    }
    String trimmed = path.startsWith("/") ? path.substring(1) : path;
    int slash = trimmed.indexOf('/');
    return "/" + (slash < 0 ? trimmed : trimmed.substring(0, slash));
  }
}
