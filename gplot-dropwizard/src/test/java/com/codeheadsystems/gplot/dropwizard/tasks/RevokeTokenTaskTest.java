package com.codeheadsystems.gplot.dropwizard.tasks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import com.codeheadsystems.gplot.server.store.InMemoryTokenStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RevokeTokenTaskTest {

  @Mock private SecurityAuditor auditor;

  private AuthManager authManager;
  private RevokeTokenTask task;
  private StringWriter output;

  @BeforeEach
  void setUp() {
    authManager = new AuthManager("task-secret", "gplot", new InMemoryTokenStore());
    task = new RevokeTokenTask(authManager, auditor);
    output = new StringWriter();
  }

  @Test
  void revokesLiveToken_andAudits() {
    String tokenId = authManager.verifyToken(authManager.createToken("team1", 60)).tokenId();

    task.execute(Map.of("tokenId", List.of(tokenId), "reason", List.of("lost laptop")),
        new PrintWriter(output, true));

    assertThat(output.toString()).contains("Revoked " + tokenId);
    assertThat(authManager.listTokens()).singleElement().satisfies(r -> assertThat(r.revoked()).isTrue());
    verify(auditor).logTokenRevoked(RevokeTokenTask.ADMIN_CLIENT, "lost laptop", tokenId);
  }

  @Test
  void unknownToken_isReportedAndNotAudited() {
    task.execute(Map.of("tokenId", List.of("nope")), new PrintWriter(output, true));

    assertThat(output.toString()).contains("No live token nope");
    verifyNoInteractions(auditor);
  }

  @Test
  void missingTokenId_printsUsage() {
    task.execute(Map.of(), new PrintWriter(output, true));

    assertThat(output.toString()).contains("Usage: revoke-token");
  }
}
