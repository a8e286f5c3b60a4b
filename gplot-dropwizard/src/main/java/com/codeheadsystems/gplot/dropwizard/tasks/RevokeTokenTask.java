package com.codeheadsystems.gplot.dropwizard.tasks;

import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/**
 * Admin task revoking a token by its JWT ID. Successful revocations are audited.
 */
public class RevokeTokenTask extends Task {

  static final String ADMIN_CLIENT = "admin";

  private final AuthManager authManager;
  private final SecurityAuditor auditor;

  public RevokeTokenTask(AuthManager authManager, SecurityAuditor auditor) {
    super("revoke-token");
    this.authManager = authManager;
    this.auditor = auditor;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) {
    String tokenId = TaskParameters.value(parameters, "tokenId");
    if (tokenId == null) {
      output.println("Usage: revoke-token?tokenId=<jti>[&reason=<reason>]");
      return;
    }
    String reason = TaskParameters.value(parameters, "reason");
    if (authManager.revokeToken(tokenId)) {
      auditor.logTokenRevoked(ADMIN_CLIENT, reason == null ? "admin request" : reason, tokenId);
      output.println("Revoked " + tokenId);
    } else {
      output.println("No live token " + tokenId);
    }
  }
}
