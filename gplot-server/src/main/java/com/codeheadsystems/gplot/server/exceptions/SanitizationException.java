package com.codeheadsystems.gplot.server.exceptions;

/**
 * Raised when boundary input fails sanitization.
 */
public class SanitizationException extends ValidationException {

  /**
   * Instantiates a new Sanitization exception.
   *
   * @param message the message
   */
  public SanitizationException(final String message) {
    super(message);
  }
}
