package com.codeheadsystems.gplot.server.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only security event log.
 * <p>
 * Events at or above the minimum level go to an optional JSON-lines file and to the
 * {@value #AUDIT_LOGGER_NAME} SLF4J logger. Auditing is best-effort: a failed file write is
 * reported on this class's logger and never propagates to the caller.
 */
public class SecurityAuditor {

  /**
   * Name of the logger that receives the console sink.
   */
  public static final String AUDIT_LOGGER_NAME = "gplot.security.audit";

  private static final Logger log = LoggerFactory.getLogger(SecurityAuditor.class);
  private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

  private final Path logFile;
  private final boolean console;
  private final SecurityLevel minLevel;
  private final Clock clock;
  private final ObjectMapper objectMapper;
  private final Object fileLock = new Object();

  /**
   * Creates an auditor on the system UTC clock.
   *
   * @param logFile  JSON-lines file, or null for no file sink
   * @param console  whether to write to the audit logger
   * @param minLevel events below this level are dropped
   */
  public SecurityAuditor(Path logFile, boolean console, SecurityLevel minLevel) {
    this(logFile, console, minLevel, Clock.systemUTC());
  }

  /**
   * Creates an auditor.
   *
   * @param logFile  JSON-lines file, or null for no file sink
   * @param console  whether to write to the audit logger
   * @param minLevel events below this level are dropped
   * @param clock    source of event timestamps
   */
  public SecurityAuditor(Path logFile, boolean console, SecurityLevel minLevel, Clock clock) {
    this.logFile = logFile;
    this.console = console;
    this.minLevel = minLevel;
    this.clock = clock;
    this.objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    if (logFile != null && logFile.getParent() != null) {
      try {
        Files.createDirectories(logFile.getParent());
      } catch (IOException e) {
        log.warn("Could not create audit log directory {}: {}", logFile.getParent(), e.getMessage());
      }
    }
  }

  /**
   * Records an event if its level passes the threshold.
   *
   * @param level     severity
   * @param eventType event type
   * @param clientId  client identifier
   * @param message   human-readable message
   * @param endpoint  endpoint, may be null
   * @param details   extra fields, may be null or empty
   */
  public void logEvent(SecurityLevel level, String eventType, String clientId, String message,
                       String endpoint, Map<String, Object> details) {
    if (!level.isAtLeast(minLevel)) {
      return;
    }
    Map<String, Object> copy = (details == null || details.isEmpty())
        ? null : new LinkedHashMap<>(details);
    write(new SecurityEvent(clock.instant(), level, eventType, clientId, endpoint, message, copy));
  }

  private void write(SecurityEvent event) {
    String line;
    try {
      line = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize security event {}", event.eventType(), e);
      return;
    }
    if (logFile != null) {
      synchronized (fileLock) {
        try {
          Files.writeString(logFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
              StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
          log.error("Failed to write security log {}: {}", logFile, e.getMessage());
        }
      }
    }
    if (console) {
      String text = "[SECURITY:" + event.level() + "] " + event.message() + " | " + line;
      switch (event.level()) {
        case INFO -> audit.info(text);
        case WARNING -> audit.warn(text);
        default -> audit.error(text);
      }
    }
  }

  public void logAuthFailure(String clientId, String reason, String endpoint) {
    logAuthFailure(clientId, reason, endpoint, Map.of());
  }

  /**
   * Authentication failure. The reason is kept in the audit record only.
   *
   * @param clientId client identifier
   * @param reason   specific failure reason
   * @param endpoint endpoint, may be null
   * @param extra    additional details
   */
  public void logAuthFailure(String clientId, String reason, String endpoint, Map<String, Object> extra) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("reason", reason);
    details.putAll(extra);
    logEvent(SecurityLevel.WARNING, "auth_failure", clientId,
        "Authentication failed: " + reason, endpoint, details);
  }

  public void logAuthSuccess(String clientId, String user, String endpoint) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("user", user);
    logEvent(SecurityLevel.INFO, "auth_success", clientId,
        "Authentication successful for " + (user == null ? "unknown" : user), endpoint, details);
  }

  public void logRateLimit(String clientId, String endpoint, int limit, long windowSeconds) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("limit", limit);
    details.put("window", windowSeconds);
    logEvent(SecurityLevel.WARNING, "rate_limit_exceeded", clientId,
        "Rate limit exceeded: " + limit + " requests per " + windowSeconds + "s", endpoint, details);
  }

  public void logSanitizationFailure(String clientId, String inputType, String reason, String endpoint) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("input_type", inputType);
    details.put("reason", reason);
    logEvent(SecurityLevel.ERROR, "sanitization_failure", clientId,
        "Input sanitization failed for " + inputType + ": " + reason, endpoint, details);
  }

  public void logSuspiciousPattern(String clientId, String patternType, String description,
                                   String endpoint) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("pattern_type", patternType);
    details.put("description", description);
    logEvent(SecurityLevel.ERROR, "suspicious_pattern", clientId,
        "Suspicious " + patternType + " pattern detected: " + description, endpoint, details);
  }

  /**
   * Token revocation. Carries no endpoint.
   *
   * @param clientId client identifier
   * @param reason   why the token was revoked
   * @param tokenId  token id, may be null
   */
  public void logTokenRevoked(String clientId, String reason, String tokenId) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("reason", reason);
    details.put("token_id", tokenId);
    logEvent(SecurityLevel.INFO, "token_revoked", clientId, "Token revoked: " + reason, null, details);
  }

  public void logPermissionDenied(String clientId, String resource, String action, String endpoint) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("resource", resource);
    details.put("action", action);
    logEvent(SecurityLevel.WARNING, "permission_denied", clientId,
        "Permission denied: " + action + " on " + resource, endpoint, details);
  }

  public void logCriticalEvent(String clientId, String description, String endpoint) {
    logCriticalEvent(clientId, description, endpoint, Map.of());
  }

  public void logCriticalEvent(String clientId, String description, String endpoint,
                               Map<String, Object> extra) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("description", description);
    details.putAll(extra);
    logEvent(SecurityLevel.CRITICAL, "critical_security_event", clientId,
        "CRITICAL: " + description, endpoint, details);
  }

  public SecurityLevel getMinLevel() {
    return minLevel;
  }
}
