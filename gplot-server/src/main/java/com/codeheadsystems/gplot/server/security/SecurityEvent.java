package com.codeheadsystems.gplot.server.security;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Map;

/**
 * A single audit record, written once as one JSON line.
 *
 * @param timestamp when the event was emitted
 * @param level     severity
 * @param eventType machine-readable type such as {@code auth_failure}
 * @param clientId  client identifier (address, user or token id)
 * @param endpoint  endpoint involved, may be null
 * @param message   human-readable message
 * @param details   additional structured fields, may be null
 */
@JsonPropertyOrder({"timestamp", "level", "event_type", "client_id", "endpoint", "message", "details"})
public record SecurityEvent(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("level") SecurityLevel level,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("message") String message,
    @JsonProperty("details") Map<String, Object> details) {
}
