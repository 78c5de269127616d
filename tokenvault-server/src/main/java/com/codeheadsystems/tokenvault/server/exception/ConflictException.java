package com.codeheadsystems.tokenvault.server.exception;

/**
 * Raised on a duplicate create, or when a record changed between read and write.
 */
public class ConflictException extends StorageException {

  /**
   * Instantiates a new Conflict exception.
   *
   * @param message the message
   */
  public ConflictException(final String message) {
    super(Reason.CONFLICT, message);
  }
}
