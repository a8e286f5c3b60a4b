package com.codeheadsystems.gplot.server.storage;

import com.codeheadsystems.gplot.server.exceptions.InvalidIdentifierException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Image identifier helpers.
 */
public final class Guids {

  private static final Pattern CANONICAL = Pattern.compile(
      "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private Guids() {
  }

  /**
   * A fresh random identifier in canonical lower-case form.
   *
   * @return the guid
   */
  public static String newGuid() {
    return UUID.randomUUID().toString();
  }

  /**
   * Whether the value is a canonical 8-4-4-4-12 hex GUID.
   *
   * @param value candidate, may be null
   * @return true if well formed
   */
  public static boolean isValid(String value) {
    return value != null && CANONICAL.matcher(value).matches();
  }

  /**
   * Validates and lower-cases an identifier.
   *
   * @param value candidate
   * @return the normalized guid
   * @throws InvalidIdentifierException if the value is not a GUID
   */
  public static String require(String value) {
    if (!isValid(value)) {
      throw new InvalidIdentifierException(value);
    }
    return value.toLowerCase(Locale.ROOT);
  }
}
