package com.codeheadsystems.tokenvault.server.exception;

/**
 * The authorization code was already exchanged. Carries the request id so the caller can revoke
 * every token issued from the same grant.
 */
public class InvalidatedArtifactException extends StorageException {

  private final String requestId;

  /**
   * Instantiates a new Invalidated artifact exception.
   *
   * @param message   the message
   * @param requestId the request id of the invalidated artifact
   */
  public InvalidatedArtifactException(final String message, final String requestId) {
    super(Reason.INVALIDATED, message);
    this.requestId = requestId;
  }

  public String requestId() {
    return requestId;
  }
}
