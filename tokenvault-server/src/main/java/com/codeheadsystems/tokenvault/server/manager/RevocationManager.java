package com.codeheadsystems.tokenvault.server.manager;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.server.exception.RevocationIncompleteException;
import com.codeheadsystems.tokenvault.server.store.ArtifactStore;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cascading revocation of every artifact issued from one grant, identified by its request id.
 * <p>
 * The target kind is always deleted first. Every following step is attempted even when an earlier
 * one failed, so a failure never leaves more live artifacts than necessary. If any step fails, or
 * the calling thread is interrupted between steps, a {@link RevocationIncompleteException} is raised
 * and logged at error level; the grant must then be treated as not fully revoked. Nothing is retried.
 */
public class RevocationManager {

  private static final Logger log = LoggerFactory.getLogger(RevocationManager.class);

  // Refresh token first, then the access tokens minted from it, then the rest of the grant.
  private static final List<ArtifactKind> REFRESH_TOKEN_CASCADE = List.of(
      ArtifactKind.REFRESH_TOKEN,
      ArtifactKind.ACCESS_TOKEN,
      ArtifactKind.AUTHORIZE_CODE,
      ArtifactKind.PKCE,
      ArtifactKind.OIDC_SESSION);

  private static final List<ArtifactKind> ACCESS_TOKEN_CASCADE = List.of(ArtifactKind.ACCESS_TOKEN);

  private final ArtifactStore artifactStore;

  public RevocationManager(ArtifactStore artifactStore) {
    this.artifactStore = artifactStore;
  }

  /**
   * Revokes every refresh token of the request id, and with it every other artifact of the grant.
   *
   * @param requestId the request id
   * @return what was removed
   * @throws RevocationIncompleteException if any step failed
   */
  public RevocationResult revokeRefreshToken(String requestId) {
    log.debug("revokeRefreshToken(requestId={})", requestId);
    return revoke(requestId, REFRESH_TOKEN_CASCADE);
  }

  /**
   * Revokes every access token of the request id.
   *
   * @param requestId the request id
   * @return what was removed
   * @throws RevocationIncompleteException if the deletion failed
   */
  public RevocationResult revokeAccessToken(String requestId) {
    log.debug("revokeAccessToken(requestId={})", requestId);
    return revoke(requestId, ACCESS_TOKEN_CASCADE);
  }

  private RevocationResult revoke(String requestId, List<ArtifactKind> cascade) {
    if (requestId == null || requestId.isBlank()) {
      throw new IllegalArgumentException("Request id must not be blank");
    }
    Map<ArtifactKind, Integer> removed = new EnumMap<>(ArtifactKind.class);
    Set<ArtifactKind> failed = EnumSet.noneOf(ArtifactKind.class);
    RuntimeException firstFailure = null;
    boolean interrupted = false;

    for (ArtifactKind kind : cascade) {
      // The target kind always runs; an interrupt only cuts the cascade short.
      if (!removed.isEmpty() || !failed.isEmpty()) {
        interrupted |= Thread.currentThread().isInterrupted();
      }
      if (interrupted) {
        failed.add(kind);
        continue;
      }
      try {
        removed.put(kind, artifactStore.deleteByRequestId(kind, requestId));
      } catch (RuntimeException e) {
        failed.add(kind);
        if (firstFailure == null) {
          firstFailure = e;
        } else {
          firstFailure.addSuppressed(e);
        }
      }
    }

    RevocationResult result = new RevocationResult(requestId, removed, failed);
    if (!result.isComplete()) {
      String reason = interrupted && firstFailure == null ? "interrupted" : "failed";
      log.error("Revocation {} for requestId={}: removed={}, not revoked={}. "
          + "Artifacts of this grant may still be valid.", reason, requestId, removed, failed, firstFailure);
      throw new RevocationIncompleteException("Revocation " + reason + " for request " + requestId
          + "; not revoked: " + failed, result, firstFailure);
    }
    log.debug("Revoked {} artifact(s) for requestId={}", result.totalRemoved(), requestId);
    return result;
  }
}
