package com.codeheadsystems.tokenvault.server.exception;

/**
 * Base type of every failure raised by the client registry, the artifact store and the
 * revocation coordinator.
 * <p>
 * Callers branch on {@link #reason()}; for example the protocol layer maps {@link Reason#NOT_FOUND},
 * {@link Reason#EXPIRED} and {@link Reason#INVALIDATED} to {@code invalid_grant}, and
 * {@link Reason#UNAVAILABLE} to a 5xx.
 */
public abstract class StorageException extends RuntimeException {

  /**
   * Failure categories.
   */
  public enum Reason {
    NOT_FOUND,
    CONFLICT,
    EXPIRED,
    INVALIDATED,
    MALFORMED,
    UNAVAILABLE,
    INCOMPLETE_REVOCATION
  }

  private final Reason reason;

  protected StorageException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  protected StorageException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
