package com.codeheadsystems.tokenvault.server.exception;

/**
 * A stored session payload could not be decoded. Indicates data corruption or a schema mismatch.
 */
public class MalformedSessionException extends StorageException {

  /**
   * Instantiates a new Malformed session exception.
   *
   * @param message the message
   */
  public MalformedSessionException(final String message) {
    super(Reason.MALFORMED, message);
  }

  /**
   * Instantiates a new Malformed session exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedSessionException(final String message, final Throwable cause) {
    super(Reason.MALFORMED, message, cause);
  }
}
