package com.codeheadsystems.gplot.dropwizard.filter;

import com.codeheadsystems.gplot.server.resource.RequestContexts;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets a {@link HttpServletRequest} attribute with the remote address of the connection. Jersey
 * exposes servlet attributes as {@link jakarta.ws.rs.container.ContainerRequestContext} properties,
 * so the rate limiter, the auth filter and the resources read it through
 * {@link RequestContexts#clientAddress}.
 */
public class RemoteAddressFilter implements Filter {

  private static final Logger log = LoggerFactory.getLogger(RemoteAddressFilter.class);

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    if (request instanceof HttpServletRequest httpServletRequest) {
      request.setAttribute(RequestContexts.CLIENT_ADDRESS_PROPERTY, httpServletRequest.getRemoteAddr());
    } else {
      log.warn("request was of unexpected type: {}", request.getClass());
    }
    chain.doFilter(request, response);
  }
}
