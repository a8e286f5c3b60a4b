package com.codeheadsystems.gplot.server.exceptions;

/**
 * Raised when durable storage fails (disk full, OS permission problems, write failures).
 * Fatal to the single operation, never to the process.
 */
public class StorageException extends RuntimeException {

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
