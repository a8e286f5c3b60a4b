package com.codeheadsystems.gplot.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.gplot.model.image.ImageListResponse;
import com.codeheadsystems.gplot.model.image.PurgeRequest;
import com.codeheadsystems.gplot.model.image.PurgeResponse;
import com.codeheadsystems.gplot.model.render.RenderRequest;
import com.codeheadsystems.gplot.model.render.RenderResponse;
import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.store.JsonFileTokenStore;
import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link GplotBundle}.
 * <p>
 * Starts a real embedded Jetty server with the stub renderer and exercises rendering,
 * group-scoped image access and purging over HTTP. Tokens are minted by a separate
 * {@link AuthManager} sharing the server's token store file.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class GplotBundleIntegrationTest {

  private static final Path DATA_DIR = TestDirectories.create("gplot-bundle-it");
  private static final Path AUDIT_LOG = DATA_DIR.resolve("audit").resolve("security.log");

  static final DropwizardAppExtension<GplotConfiguration> APP =
      new DropwizardAppExtension<>(
          GplotApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("dataDir", DATA_DIR.toString()),
          ConfigOverride.config("audit.logFile", AUDIT_LOG.toString()));

  private static final String GUID_NOT_STORED = "00000000-0000-4000-8000-000000000000";

  private AuthManager tokenIssuer;

  @BeforeEach
  void setUp() {
    tokenIssuer = new AuthManager("integration-test-secret", "gplot-test",
        new JsonFileTokenStore(DATA_DIR.resolve("auth").resolve("tokens.json")));
  }

  // ── Health check ─────────────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    String body = response.readEntity(String.class);
    assertThat(body).contains("image-storage");
    assertThat(body).contains("\"healthy\":true");
  }

  // ── Render ───────────────────────────────────────────────────────────────

  @Test
  void renderInline_returnsBase64Image() {
    Response response = request("/render", "team1")
        .post(Entity.json(renderRequest("svg", false)));

    assertThat(response.getStatus()).isEqualTo(200);
    RenderResponse body = response.readEntity(RenderResponse.class);
    assertThat(body.format()).isEqualTo("svg");
    assertThat(body.guid()).isNull();
    assertThat(new String(Base64.getDecoder().decode(body.imageBase64()), StandardCharsets.UTF_8))
        .isEqualTo("<svg><title>line:Quarterly</title></svg>");
  }

  @Test
  void renderRejectsUnknownChartType_andAuditsIt() throws Exception {
    RenderRequest bad = new RenderRequest("pie", "Quarterly", List.of(1.0), List.of(2.0),
        null, null, "png", null, false);

    Response response = request("/render", "team1").post(Entity.json(bad));

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(Files.readString(AUDIT_LOG)).contains("\"event_type\":\"sanitization_failure\"");
  }

  // ── Full proxy render + fetch + list + delete round trip ─────────────────

  @Test
  void proxyRenderThenFetchListAndDelete() {
    String guid = proxyRender("team1");

    Response fetched = request("/images/" + guid, "team1").get();
    assertThat(fetched.getStatus()).isEqualTo(200);
    assertThat(fetched.getHeaderString(HttpHeaders.CONTENT_TYPE)).startsWith("image/svg+xml");
    assertThat(new String(fetched.readEntity(byte[].class), StandardCharsets.UTF_8))
        .isEqualTo("<svg><title>line:Quarterly</title></svg>");

    ImageListResponse listed = request("/images", "team1").get(ImageListResponse.class);
    assertThat(listed.guids()).contains(guid);

    assertThat(request("/images/" + guid, "team1").delete().getStatus()).isEqualTo(204);
    assertThat(request("/images/" + guid, "team1").get().getStatus()).isEqualTo(404);
    assertThat(request("/images/" + guid, "team1").delete().getStatus()).isEqualTo(404);
  }

  // ── Group isolation ──────────────────────────────────────────────────────

  @Test
  void otherGroupIsDenied_andAudited() throws Exception {
    String guid = proxyRender("team1");

    assertThat(request("/images/" + guid, "team2").get().getStatus()).isEqualTo(403);
    assertThat(request("/images/" + guid, "team2").delete().getStatus()).isEqualTo(403);
    assertThat(request("/images", "team2").get(ImageListResponse.class).guids()).doesNotContain(guid);
    assertThat(request("/images/" + guid, "team1").get().getStatus()).isEqualTo(200);
    assertThat(Files.readString(AUDIT_LOG))
        .contains("\"event_type\":\"permission_denied\"")
        .contains("image/" + guid);
  }

  @Test
  void malformedGuid_returns400() {
    assertThat(request("/images/not-a-guid", "team1").get().getStatus()).isEqualTo(400);
  }

  @Test
  void unknownGuid_returns404() {
    assertThat(request("/images/" + GUID_NOT_STORED, "team1").get().getStatus()).isEqualTo(404);
  }

  @Test
  void purgeIsScopedToCallersGroup() {
    String mine1 = proxyRender("purge-a");
    String mine2 = proxyRender("purge-a");
    String theirs = proxyRender("purge-b");

    PurgeResponse purged = request("/images/purge", "purge-a")
        .post(Entity.json(new PurgeRequest(0)), PurgeResponse.class);

    assertThat(purged.deleted()).isEqualTo(2);
    assertThat(request("/images/" + mine1, "purge-a").get().getStatus()).isEqualTo(404);
    assertThat(request("/images/" + mine2, "purge-a").get().getStatus()).isEqualTo(404);
    assertThat(request("/images", "purge-b").get(ImageListResponse.class).guids()).containsExactly(theirs);
  }

  @Test
  void purgeWithNegativeAge_returns400() {
    Response response = request("/images/purge", "team1").post(Entity.json(new PurgeRequest(-1)));

    assertThat(response.getStatus()).isEqualTo(400);
  }

  @Test
  void purgeWithoutAgeDays_returns400AndKeepsImages() {
    String guid = proxyRender("purge-empty");

    Response response = request("/images/purge", "purge-empty").post(Entity.json("{}"));

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(request("/images/" + guid, "purge-empty").get().getStatus()).isEqualTo(200);
  }

  // ── Admin tasks ──────────────────────────────────────────────────────────

  @Test
  void purgeImagesTask_purgesNamedGroup() {
    String guid = proxyRender("task-group");

    Response response = APP.client()
        .target(String.format("http://localhost:%d/tasks/purge-images?ageDays=0&group=task-group",
            APP.getAdminPort()))
        .request()
        .post(Entity.text(""));

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("Purged 1 image(s)");
    assertThat(request("/images/" + guid, "task-group").get().getStatus()).isEqualTo(404);
  }

  private String proxyRender(String group) {
    Response response = request("/render", group).post(Entity.json(renderRequest("svg", true)));
    assertThat(response.getStatus()).isEqualTo(200);
    RenderResponse body = response.readEntity(RenderResponse.class);
    assertThat(body.imagePath()).isEqualTo("/images/" + body.guid());
    return body.guid();
  }

  private Invocation.Builder request(String path, String group) {
    return APP.client()
        .target(baseUrl() + path)
        .request(MediaType.WILDCARD)
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenIssuer.createToken(group, 300));
  }

  private static RenderRequest renderRequest(String format, boolean proxy) {
    return new RenderRequest("line", "Quarterly", List.of(1.0, 2.0, 3.0), List.of(4.0, 5.0, 6.0),
        "Month", "Sales", format, null, proxy);
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
