package com.codeheadsystems.gplot.dropwizard.auth;

import com.codeheadsystems.gplot.server.auth.DeviceFingerprints;
import com.codeheadsystems.gplot.server.resource.RequestContexts;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import java.security.Principal;

/**
 * Bearer-token filter that also derives a device fingerprint from the {@code User-Agent}
 * header and the remote address, so tokens bound to a device are only accepted from it.
 *
 * @param <P> the principal type
 */
@Priority(Priorities.AUTHENTICATION)
public class GplotAuthFilter<P extends Principal> extends AuthFilter<GplotCredentials, P> {

  private GplotAuthFilter() {
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    String token = bearerToken(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));
    GplotCredentials credentials = null;
    if (token != null) {
      String clientAddress = RequestContexts.clientAddress(requestContext);
      String fingerprint = DeviceFingerprints.of(
          requestContext.getHeaderString(HttpHeaders.USER_AGENT), clientAddress);
      credentials = new GplotCredentials(token, fingerprint, clientAddress,
          "/" + requestContext.getUriInfo().getPath());
    }
    if (!authenticate(requestContext, credentials, "Bearer")) {
      throw unauthorizedHandler.buildException(prefix, realm);
    }
  }

  private String bearerToken(String header) {
    if (header == null) {
      return null;
    }
    int space = header.indexOf(' ');
    if (space <= 0 || !prefix.equalsIgnoreCase(header.substring(0, space))) {
      return null;
    }
    String token = header.substring(space + 1).trim();
    return token.isEmpty() ? null : token;
  }

  /**
   * Builder for {@link GplotAuthFilter}.
   *
   * @param <P> the principal type
   */
  public static class Builder<P extends Principal>
      extends AuthFilterBuilder<GplotCredentials, P, GplotAuthFilter<P>> {

    @Override
    protected GplotAuthFilter<P> newInstance() {
      return new GplotAuthFilter<>();
    }
  }
}
