package com.codeheadsystems.tokenvault.server.store;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.model.StoredArtifact;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for signature-keyed artifacts (tokens, codes, PKCE requests, OIDC sessions).
 * <p>
 * Implementations must be thread-safe. Each kind is a separate namespace. Every single-artifact
 * operation must be atomic: a cancelled or failed call leaves the artifact either fully written or
 * not written at all.
 * <p>
 * <strong>Revocation contract:</strong> {@link #deleteByRequestId} must remove every artifact of the
 * kind that carries the request id, and only those. Implementations must maintain whatever index is
 * necessary to do this without scanning the whole namespace.
 * <p>
 * Implementations that cannot reach their backing store raise
 * {@link com.codeheadsystems.tokenvault.server.exception.StoreUnavailableException}.
 */
public interface ArtifactStore {

  /**
   * Stores a new artifact.
   *
   * @param artifact the artifact
   * @return false if an artifact with the same kind and signature exists; it is left untouched
   */
  boolean create(StoredArtifact artifact);

  /**
   * Loads an artifact by exact signature. Expiry is not evaluated here.
   *
   * @param kind      the kind
   * @param signature the signature
   * @return the artifact, or empty if absent
   */
  Optional<StoredArtifact> load(ArtifactKind kind, String signature);

  /**
   * Removes a single artifact.
   *
   * @param kind      the kind
   * @param signature the signature
   * @return false if it did not exist
   */
  boolean delete(ArtifactKind kind, String signature);

  /**
   * Marks an artifact inactive while keeping it readable.
   *
   * @param kind      the kind
   * @param signature the signature
   * @return false if it did not exist
   */
  boolean deactivate(ArtifactKind kind, String signature);

  /**
   * Removes every artifact of the kind issued for the request id.
   * Must not throw when none exist.
   *
   * @param kind      the kind
   * @param requestId the request id
   * @return the number of artifacts removed
   */
  int deleteByRequestId(ArtifactKind kind, String requestId);

  /**
   * Physically removes every artifact, of any kind, that expired at or before {@code cutoff}.
   *
   * @param cutoff the cutoff
   * @return the number of artifacts removed
   */
  int deleteExpired(Instant cutoff);

  /**
   * Number of artifacts currently stored for the kind, expired ones included.
   *
   * @param kind the kind
   * @return the count
   */
  int count(ArtifactKind kind);
}
