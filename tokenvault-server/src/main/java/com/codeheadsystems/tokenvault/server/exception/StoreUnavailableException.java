package com.codeheadsystems.tokenvault.server.exception;

/**
 * The backing store could not be reached. Never retried inside this library; retry policy
 * belongs to the caller.
 */
public class StoreUnavailableException extends StorageException {

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StoreUnavailableException(final String message, final Throwable cause) {
    super(Reason.UNAVAILABLE, message, cause);
  }
}
