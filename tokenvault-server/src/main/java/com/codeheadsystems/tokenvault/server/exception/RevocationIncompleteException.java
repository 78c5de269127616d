package com.codeheadsystems.tokenvault.server.exception;

import com.codeheadsystems.tokenvault.server.manager.RevocationResult;

/**
 * A cascading revocation did not complete. The artifacts of the request id are not guaranteed
 * to be revoked; treat as a high-severity event rather than a transient failure.
 */
public class RevocationIncompleteException extends StorageException {

  private final RevocationResult result;

  /**
   * Instantiates a new Revocation incomplete exception.
   *
   * @param message the message
   * @param result  what was and was not removed
   * @param cause   the first failure, or null when the cascade was interrupted
   */
  public RevocationIncompleteException(final String message,
                                       final RevocationResult result,
                                       final Throwable cause) {
    super(Reason.INCOMPLETE_REVOCATION, message, cause);
    this.result = result;
  }

  public RevocationResult result() {
    return result;
  }
}
