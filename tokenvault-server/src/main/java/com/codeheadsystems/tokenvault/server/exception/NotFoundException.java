package com.codeheadsystems.tokenvault.server.exception;

/**
 * The type Not found exception.
 */
public class NotFoundException extends StorageException {

  /**
   * Instantiates a new Not found exception.
   *
   * @param message the message
   */
  public NotFoundException(final String message) {
    super(Reason.NOT_FOUND, message);
  }
}
