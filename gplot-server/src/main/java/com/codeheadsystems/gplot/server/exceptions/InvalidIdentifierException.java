package com.codeheadsystems.gplot.server.exceptions;

/**
 * Raised when an image identifier is not a canonical GUID. Rejected before storage is touched.
 */
public class InvalidIdentifierException extends ValidationException {

  private final String identifier;

  /**
   * Instantiates a new Invalid identifier exception.
   *
   * @param identifier the rejected identifier
   */
  public InvalidIdentifierException(final String identifier) {
    super("Invalid GUID format: " + identifier);
    this.identifier = identifier;
  }

  /**
   * The rejected identifier.
   *
   * @return the identifier
   */
  public String identifier() {
    return identifier;
  }
}
