package com.codeheadsystems.gplot.dropwizard.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gplot.server.resource.RequestContexts;
import com.codeheadsystems.gplot.server.security.RateLimiter;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

  @Mock private ContainerRequestContext requestContext;
  @Mock private UriInfo uriInfo;
  @Mock private SecurityAuditor auditor;

  private RateLimitFilter filter;

  @BeforeEach
  void setUp() {
    filter = new RateLimitFilter(new RateLimiter(2, 60, true), auditor);
  }

  @ParameterizedTest
  @CsvSource({
      "images, /images",
      "images/abc, /images",
      "/render, /render",
      "'', /",
      "a/b/c, /a"
  })
  void endpointOf_usesFirstSegment(String path, String expected) {
    assertThat(RateLimitFilter.endpointOf(path)).isEqualTo(expected);
  }

  @Test
  void exhaustedBucket_abortsWith429AndAudits() {
    when(requestContext.getProperty(RequestContexts.CLIENT_ADDRESS_PROPERTY)).thenReturn("10.0.0.1");
    when(requestContext.getUriInfo()).thenReturn(uriInfo);
    when(uriInfo.getPath()).thenReturn("images/abc");

    filter.filter(requestContext);
    filter.filter(requestContext);
    verify(requestContext, never()).abortWith(any());

    filter.filter(requestContext);

    ArgumentCaptor<Response> captor = ArgumentCaptor.forClass(Response.class);
    verify(requestContext).abortWith(captor.capture());
    assertThat(captor.getValue().getStatus()).isEqualTo(429);
    assertThat(captor.getValue().getHeaderString(HttpHeaders.RETRY_AFTER)).isEqualTo("30");
    verify(auditor).logRateLimit("10.0.0.1", "/images", 2, 60);
  }

  @Test
  void disabledLimiter_neverAborts() {
    filter = new RateLimitFilter(new RateLimiter(1, 60, false), auditor);
    when(requestContext.getUriInfo()).thenReturn(uriInfo);
    when(uriInfo.getPath()).thenReturn("images");

    for (int i = 0; i < 5; i++) {
      filter.filter(requestContext);
    }

    verify(requestContext, never()).abortWith(any());
  }
}
