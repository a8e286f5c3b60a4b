package com.codeheadsystems.gplot.server.exceptions;

/**
 * Raised when the requesting group does not own the stored artifact.
 * <p>
 * Distinct from a missing artifact (404) and from a malformed identifier (400) so that
 * callers can answer HTTP 403.
 */
public class PermissionDeniedException extends SecurityException {

  private final String guid;
  private final String requestedGroup;

  /**
   * Instantiates a new Permission denied exception.
   *
   * @param guid           the artifact identifier
   * @param requestedGroup the group that asked for it
   */
  public PermissionDeniedException(final String guid, final String requestedGroup) {
    super("Access denied to image " + guid + " for group " + requestedGroup);
    this.guid = guid;
    this.requestedGroup = requestedGroup;
  }

  /**
   * Artifact identifier.
   *
   * @return the guid
   */
  public String guid() {
    return guid;
  }

  /**
   * Group that was refused.
   *
   * @return the requested group
   */
  public String requestedGroup() {
    return requestedGroup;
  }
}
