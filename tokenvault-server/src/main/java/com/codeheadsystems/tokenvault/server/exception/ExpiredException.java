package com.codeheadsystems.tokenvault.server.exception;

import java.time.Instant;

/**
 * The artifact exists but is past its validity. Equivalent to not-found for the protocol, kept
 * distinct for diagnostics.
 */
public class ExpiredException extends StorageException {

  private final Instant expiredAt;

  /**
   * Instantiates a new Expired exception.
   *
   * @param message   the message
   * @param expiredAt when the artifact expired
   */
  public ExpiredException(final String message, final Instant expiredAt) {
    super(Reason.EXPIRED, message);
    this.expiredAt = expiredAt;
  }

  public Instant expiredAt() {
    return expiredAt;
  }
}
