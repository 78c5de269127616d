package com.codeheadsystems.tokenvault.server.manager;

/**
 * What deleting an artifact that does not exist does.
 */
public enum MissingArtifactPolicy {

  /**
   * Succeed and report that nothing was deleted.
   */
  IGNORE,

  /**
   * Raise {@link com.codeheadsystems.tokenvault.server.exception.NotFoundException}.
   */
  FAIL
}
