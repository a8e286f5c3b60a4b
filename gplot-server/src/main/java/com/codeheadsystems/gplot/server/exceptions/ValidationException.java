package com.codeheadsystems.gplot.server.exceptions;

/**
 * Raised for malformed caller input. Callers map this to HTTP 400.
 */
public class ValidationException extends IllegalArgumentException {

  /**
   * Instantiates a new Validation exception.
   *
   * @param message the message
   */
  public ValidationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Validation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
