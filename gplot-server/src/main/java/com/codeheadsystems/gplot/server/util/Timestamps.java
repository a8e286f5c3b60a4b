package com.codeheadsystems.gplot.server.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient parsing of persisted timestamps.
 */
public final class Timestamps {

  private Timestamps() {
  }

  /**
   * Parses an ISO-8601 instant, or a zone-less ISO local date-time read as UTC.
   *
   * @param value the text, may be null
   * @return the instant, or empty if absent or unparseable
   */
  public static Optional<Instant> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(value));
    } catch (DateTimeParseException e) {
      try {
        return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
      } catch (DateTimeParseException ignored) {
        return Optional.empty();
      }
    }
  }
}
