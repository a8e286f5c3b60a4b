package com.codeheadsystems.gplot.server.resource;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;

/**
 * Helpers for reading caller identity off a JAX-RS request.
 */
public final class RequestContexts {

  /**
   * Request property holding the caller's remote address, set by the hosting container.
   */
  public static final String CLIENT_ADDRESS_PROPERTY = "com.codeheadsystems.gplot.clientAddress";

  private static final String UNKNOWN = "unknown";

  private RequestContexts() {
  }

  /**
   * The remote address recorded for the request, or {@code unknown}.
   *
   * @param request the request, may be null
   * @return the address
   */
  public static String clientAddress(ContainerRequestContext request) {
    if (request == null) {
      return UNKNOWN;
    }
    Object address = request.getProperty(CLIENT_ADDRESS_PROPERTY);
    return address instanceof String s && !s.isEmpty() ? s : UNKNOWN;
  }

  /**
   * The caller's group: the authenticated principal's name, or null when unauthenticated.
   *
   * @param securityContext the security context, may be null
   * @return the group
   */
  public static String group(SecurityContext securityContext) {
    if (securityContext == null) {
      return null;
    }
    Principal principal = securityContext.getUserPrincipal();
    return principal == null ? null : principal.getName();
  }
}
