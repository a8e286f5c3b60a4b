package com.codeheadsystems.gplot.dropwizard.auth;

import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.auth.TokenInfo;
import com.codeheadsystems.gplot.server.auth.TokenVerificationException;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import io.dropwizard.auth.Authenticator;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates JWT bearer tokens using {@link AuthManager}.
 * <p>
 * Every failure is audited with its specific reason; the caller only ever sees a generic 401.
 */
public class GplotAuthenticator implements Authenticator<GplotCredentials, GplotPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(GplotAuthenticator.class);

  private final AuthManager authManager;
  private final SecurityAuditor auditor;

  /**
   * Instantiates a new authenticator.
   *
   * @param authManager the auth manager
   * @param auditor     the security auditor
   */
  public GplotAuthenticator(AuthManager authManager, SecurityAuditor auditor) {
    this.authManager = authManager;
    this.auditor = auditor;
  }

  @Override
  public Optional<GplotPrincipal> authenticate(GplotCredentials credentials) {
    try {
      TokenInfo info = authManager.verifyToken(credentials.token(), credentials.fingerprint());
      auditor.logAuthSuccess(credentials.clientAddress(), info.group(), credentials.endpoint());
      return Optional.of(new GplotPrincipal(info.group(), info.tokenId()));
    } catch (TokenVerificationException e) {
      String reason = e.getReason().name().toLowerCase(Locale.ROOT);
      log.debug("Token rejected: {} ({})", reason, e.getDetail());
      Map<String, Object> details = new HashMap<>();
      if (e.getDetail() != null) {
        details.put("detail", e.getDetail());
      }
      auditor.logAuthFailure(credentials.clientAddress(), reason, credentials.endpoint(), details);
      return Optional.empty();
    }
  }
}
