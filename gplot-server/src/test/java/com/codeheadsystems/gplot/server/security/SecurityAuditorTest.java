package com.codeheadsystems.gplot.server.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.codeheadsystems.gplot.server.util.TestClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SecurityAuditorTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir
  Path tempDir;

  private Path logFile;
  private SecurityAuditor auditor;

  @BeforeEach
  void setUp() {
    logFile = tempDir.resolve("audit/security.log");
    auditor = new SecurityAuditor(logFile, false, SecurityLevel.INFO,
        TestClock.pinned(Instant.parse("2025-02-03T04:05:06Z")));
  }

  private List<JsonNode> lines() throws IOException {
    List<JsonNode> result = new ArrayList<>();
    for (String line : Files.readAllLines(logFile)) {
      result.add(MAPPER.readTree(line));
    }
    return result;
  }

  @Test
  void logAuthFailure_writesOneJsonLineWithReason() throws IOException {
    auditor.logAuthFailure("10.0.0.1", "token expired", "/images");

    List<JsonNode> events = lines();
    assertThat(events).hasSize(1);
    JsonNode event = events.get(0);
    assertThat(event.get("timestamp").asText()).isEqualTo("2025-02-03T04:05:06Z");
    assertThat(event.get("level").asText()).isEqualTo("WARNING");
    assertThat(event.get("event_type").asText()).isEqualTo("auth_failure");
    assertThat(event.get("client_id").asText()).isEqualTo("10.0.0.1");
    assertThat(event.get("endpoint").asText()).isEqualTo("/images");
    assertThat(event.get("message").asText()).isEqualTo("Authentication failed: token expired");
    assertThat(event.get("details").get("reason").asText()).isEqualTo("token expired");
  }

  @Test
  void wrappers_useFixedEventShapes() throws IOException {
    auditor.logAuthSuccess("c", null, "/render");
    auditor.logRateLimit("c", "/render", 10, 60);
    auditor.logSanitizationFailure("c", "path", "traversal", "/render");
    auditor.logSuspiciousPattern("c", "xss", "script tag", null);
    auditor.logTokenRevoked("admin", "compromised", "jti-1");
    auditor.logPermissionDenied("c", "image/abc", "read", "/images");
    auditor.logCriticalEvent("c", "secret leaked", null);

    List<JsonNode> events = lines();
    assertThat(events).extracting(e -> e.get("event_type").asText()).containsExactly(
        "auth_success", "rate_limit_exceeded", "sanitization_failure", "suspicious_pattern",
        "token_revoked", "permission_denied", "critical_security_event");
    assertThat(events).extracting(e -> e.get("level").asText()).containsExactly(
        "INFO", "WARNING", "ERROR", "ERROR", "INFO", "WARNING", "CRITICAL");
    assertThat(events).extracting(e -> e.get("message").asText()).containsExactly(
        "Authentication successful for unknown",
        "Rate limit exceeded: 10 requests per 60s",
        "Input sanitization failed for path: traversal",
        "Suspicious xss pattern detected: script tag",
        "Token revoked: compromised",
        "Permission denied: read on image/abc",
        "CRITICAL: secret leaked");
    assertThat(events.get(4).get("details").get("token_id").asText()).isEqualTo("jti-1");
    assertThat(events.get(4).get("endpoint").isNull()).isTrue();
  }

  @Test
  void logEvent_belowMinLevel_isDropped() throws IOException {
    SecurityAuditor errorsOnly = new SecurityAuditor(logFile, false, SecurityLevel.ERROR);
    errorsOnly.logAuthSuccess("c", "u", null);
    errorsOnly.logRateLimit("c", "/x", 1, 1);
    errorsOnly.logCriticalEvent("c", "boom", null);

    assertThat(lines()).extracting(e -> e.get("event_type").asText())
        .containsExactly("critical_security_event");
  }

  @Test
  void logEvent_noDetails_writesNullDetails() throws IOException {
    auditor.logEvent(SecurityLevel.INFO, "custom", "c", "hello", null, null);
    assertThat(lines().get(0).get("details").isNull()).isTrue();
  }

  @Test
  void logEvent_unwritableFile_doesNotThrow() throws IOException {
    Path directory = Files.createDirectories(tempDir.resolve("not-a-file"));
    SecurityAuditor broken = new SecurityAuditor(directory, true, SecurityLevel.INFO);

    assertThatCode(() -> broken.logAuthFailure("c", "bad", null)).doesNotThrowAnyException();
  }

  @Test
  void securityLevel_totalOrder() {
    assertThat(SecurityLevel.CRITICAL.isAtLeast(SecurityLevel.ERROR)).isTrue();
    assertThat(SecurityLevel.WARNING.isAtLeast(SecurityLevel.INFO)).isTrue();
    assertThat(SecurityLevel.INFO.isAtLeast(SecurityLevel.WARNING)).isFalse();
  }
}
