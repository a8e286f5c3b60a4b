package com.codeheadsystems.gplot.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.gplot.model.image.ImageListResponse;
import com.codeheadsystems.gplot.model.render.RenderRequest;
import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the rate-limit filter, run with authentication disabled and a small
 * default limit of 3 requests per minute ({@code /render}: 1 per two minutes).
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class RateLimitIntegrationTest {

  private static final Path DATA_DIR = TestDirectories.create("gplot-rate-limit-it");
  private static final Path AUDIT_LOG = DATA_DIR.resolve("security.log");
  private static final String CLIENT = "127.0.0.1";

  static final DropwizardAppExtension<GplotConfiguration> APP =
      new DropwizardAppExtension<>(
          GplotApplication.class,
          ResourceHelpers.resourceFilePath("rate-limit-test-config.yml"),
          ConfigOverride.config("dataDir", DATA_DIR.toString()),
          ConfigOverride.config("audit.logFile", AUDIT_LOG.toString()));

  @BeforeEach
  void resetBuckets() {
    GplotApplication application = APP.getApplication();
    application.bundle().getRateLimiter().resetClient(CLIENT);
  }

  @Test
  void requestsBeyondTheLimit_areRejectedWithRetryAfter() throws Exception {
    for (int i = 0; i < 3; i++) {
      assertThat(get("/images").getStatus()).isEqualTo(200);
    }

    Response rejected = get("/images");

    assertThat(rejected.getStatus()).isEqualTo(429);
    assertThat(Long.parseLong(rejected.getHeaderString(HttpHeaders.RETRY_AFTER))).isBetween(1L, 20L);
    assertThat(Files.readString(AUDIT_LOG))
        .contains("\"event_type\":\"rate_limit_exceeded\"")
        .contains("Rate limit exceeded: 3 requests per 60s");
  }

  @Test
  void bucketsAreKeyedByFirstPathSegment() {
    for (int i = 0; i < 3; i++) {
      assertThat(get("/images").getStatus()).isEqualTo(200);
    }
    assertThat(get("/images/00000000-0000-4000-8000-000000000000").getStatus()).isEqualTo(429);

    // /render has its own, stricter bucket
    RenderRequest request = new RenderRequest("bar", "Limits", List.of(1.0), List.of(2.0),
        null, null, "svg", "dark", false);
    assertThat(post("/render", request).getStatus()).isEqualTo(200);
    assertThat(post("/render", request).getStatus()).isEqualTo(429);
  }

  @Test
  void withoutAuth_noTokenIsNeeded() {
    Response response = get("/images");

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(ImageListResponse.class).guids()).isNotNull();
  }

  @Test
  void cleanupTask_reportsBuckets() {
    get("/images");

    Response response = APP.client()
        .target(String.format("http://localhost:%d/tasks/cleanup-rate-limit-buckets?maxAgeSeconds=3600",
            APP.getAdminPort()))
        .request()
        .post(Entity.text(""));

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("Removed 0 stale bucket(s)");
  }

  private Response get(String path) {
    return APP.client().target(url(path)).request().get();
  }

  private Response post(String path, Object body) {
    return APP.client().target(url(path)).request().post(Entity.json(body));
  }

  private String url(String path) {
    return String.format("http://%s:%d%s", CLIENT, APP.getLocalPort(), path);
  }
}
