package com.codeheadsystems.gplot.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.auth.DeviceFingerprints;
import com.codeheadsystems.gplot.server.store.JsonFileTokenStore;
import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for JWT bearer authentication: token lifecycle across processes sharing
 * the token store file, revocation, expiry and device binding.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthIntegrationTest {

  private static final Path DATA_DIR = TestDirectories.create("gplot-auth-it");
  private static final Path AUDIT_LOG = DATA_DIR.resolve("security.log");
  private static final String SECRET = "integration-test-secret";
  private static final String ISSUER = "gplot-test";
  private static final String USER_AGENT = "gplot-it/1.0";

  static final DropwizardAppExtension<GplotConfiguration> APP =
      new DropwizardAppExtension<>(
          GplotApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("dataDir", DATA_DIR.toString()),
          ConfigOverride.config("audit.logFile", AUDIT_LOG.toString()));

  private HttpClient httpClient;
  private AuthManager tokenIssuer;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    tokenIssuer = new AuthManager(SECRET, ISSUER, tokenStore());
  }

  @Test
  void tokenIssuedByAnotherProcess_isAcceptedOnFirstUse() throws Exception {
    String token = tokenIssuer.createToken("team1", 300);

    HttpResponse<String> response = get("/whoami", token, USER_AGENT);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"group\":\"team1\"");
  }

  @Test
  void inProcessBundleManager_issuesUsableTokens() throws Exception {
    GplotApplication application = APP.getApplication();
    String token = application.bundle().getAuthManager().createToken("team9", 300);

    assertThat(get("/whoami", token, USER_AGENT).body()).contains("\"group\":\"team9\"");
  }

  @Test
  void noToken_returns401() throws Exception {
    assertThat(get("/images", null, USER_AGENT).statusCode()).isEqualTo(401);
  }

  @Test
  void bogusToken_returns401_andAuditsReason() throws Exception {
    HttpResponse<String> response = get("/images", "not-a-real-token", USER_AGENT);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).doesNotContain("malformed");
    assertThat(Files.readString(AUDIT_LOG)).contains("Authentication failed: malformed");
  }

  @Test
  void tokenSignedWithAnotherSecret_returns401() throws Exception {
    AuthManager stranger = new AuthManager("some-other-secret", ISSUER, tokenStore());

    assertThat(get("/images", stranger.createToken("team1", 300), USER_AGENT).statusCode()).isEqualTo(401);
  }

  @Test
  void expiredToken_returns401() throws Exception {
    Clock twoHoursAgo = Clock.fixed(Instant.now().minus(Duration.ofHours(2)), ZoneOffset.UTC);
    AuthManager pastIssuer = new AuthManager(SECRET.getBytes(StandardCharsets.UTF_8), ISSUER, tokenStore(),
        twoHoursAgo);

    assertThat(get("/images", pastIssuer.createToken("team1", 60), USER_AGENT).statusCode()).isEqualTo(401);
  }

  @Test
  void tokenRevokedByAnotherProcess_isRejected() throws Exception {
    String token = tokenIssuer.createToken("team1", 300);
    assertThat(get("/images", token, USER_AGENT).statusCode()).isEqualTo(200);

    String tokenId = tokenIssuer.verifyToken(token).tokenId();
    assertThat(new AuthManager(SECRET, ISSUER, tokenStore()).revokeToken(tokenId)).isTrue();

    assertThat(get("/images", token, USER_AGENT).statusCode()).isEqualTo(401);
    assertThat(Files.readString(AUDIT_LOG)).contains("Authentication failed: revoked");
  }

  @Test
  void revokeTokenTask_revokesAndAudits() throws Exception {
    String token = tokenIssuer.createToken("team1", 300);
    String tokenId = tokenIssuer.verifyToken(token).tokenId();

    HttpResponse<String> task = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(String.format("http://127.0.0.1:%d/tasks/revoke-token?tokenId=%s&reason=leaked",
                APP.getAdminPort(), tokenId)))
            .POST(HttpRequest.BodyPublishers.noBody())
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(task.statusCode()).isEqualTo(200);
    assertThat(task.body()).contains("Revoked " + tokenId);
    assertThat(get("/images", token, USER_AGENT).statusCode()).isEqualTo(401);
    assertThat(Files.readString(AUDIT_LOG)).contains("Token revoked: leaked");
  }

  @Test
  void deviceBoundToken_onlyWorksFromThatDevice() throws Exception {
    String fingerprint = DeviceFingerprints.of(USER_AGENT, "127.0.0.1");
    String token = tokenIssuer.createToken("team1", 300, fingerprint);

    assertThat(get("/images", token, USER_AGENT).statusCode()).isEqualTo(200);
    assertThat(get("/images", token, "some-other-agent/2.0").statusCode()).isEqualTo(401);
    assertThat(Files.readString(AUDIT_LOG)).contains("Authentication failed: fingerprint_mismatch");
  }

  private JsonFileTokenStore tokenStore() {
    return new JsonFileTokenStore(DATA_DIR.resolve("auth").resolve("tokens.json"));
  }

  private HttpResponse<String> get(String path, String token, String userAgent) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://127.0.0.1:%d%s", APP.getLocalPort(), path)))
        .header("User-Agent", userAgent)
        .GET();
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }
}
