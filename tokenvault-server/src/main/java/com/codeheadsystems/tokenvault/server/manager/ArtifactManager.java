package com.codeheadsystems.tokenvault.server.manager;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.model.ArtifactRequest;
import com.codeheadsystems.tokenvault.model.Client;
import com.codeheadsystems.tokenvault.model.EncodedSession;
import com.codeheadsystems.tokenvault.model.StoredArtifact;
import com.codeheadsystems.tokenvault.server.codec.SessionCodec;
import com.codeheadsystems.tokenvault.server.exception.ConflictException;
import com.codeheadsystems.tokenvault.server.exception.ExpiredException;
import com.codeheadsystems.tokenvault.server.exception.InvalidatedArtifactException;
import com.codeheadsystems.tokenvault.server.exception.MalformedSessionException;
import com.codeheadsystems.tokenvault.server.exception.NotFoundException;
import com.codeheadsystems.tokenvault.server.store.ArtifactStore;
import com.codeheadsystems.tokenvault.server.store.ClientStore;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create, read and delete of signature-keyed artifacts, written once for every {@link ArtifactKind}.
 * <p>
 * Sessions are encoded with the {@link SessionCodec} on the way in and decoded into the caller's
 * type on the way out; the store only ever sees the encoded form. Expiry is enforced lazily on
 * read; nothing runs in the background.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException}     blank signature or missing request data</li>
 *   <li>{@link ConflictException}            duplicate {@code (kind, signature)} on create</li>
 *   <li>{@link NotFoundException}            absent artifact, or owning client not registered</li>
 *   <li>{@link ExpiredException}             artifact past its expiry</li>
 *   <li>{@link InvalidatedArtifactException} authorization code already used</li>
 *   <li>{@link MalformedSessionException}    stored session cannot be decoded</li>
 *   <li>{@link SecurityException}            owning client is disabled</li>
 * </ul>
 */
public class ArtifactManager {

  private static final Logger log = LoggerFactory.getLogger(ArtifactManager.class);

  private final ArtifactStore artifactStore;
  private final ClientStore clientStore;
  private final SessionCodec sessionCodec;
  private final MissingArtifactPolicy missingArtifactPolicy;
  private final Clock clock;

  public ArtifactManager(ArtifactStore artifactStore,
                         ClientStore clientStore,
                         SessionCodec sessionCodec,
                         MissingArtifactPolicy missingArtifactPolicy,
                         Clock clock) {
    this.artifactStore = artifactStore;
    this.clientStore = clientStore;
    this.sessionCodec = sessionCodec;
    this.missingArtifactPolicy = missingArtifactPolicy;
    this.clock = clock;
  }

  public ArtifactManager(ArtifactStore artifactStore, ClientStore clientStore, SessionCodec sessionCodec) {
    this(artifactStore, clientStore, sessionCodec, MissingArtifactPolicy.IGNORE, Clock.systemUTC());
  }

  /**
   * Typed view over one kind.
   *
   * @param kind        the kind
   * @param sessionType the session type used when reading
   * @param <S>         the session type
   * @return the view
   */
  public <S> ArtifactSessions<S> forKind(ArtifactKind kind, Class<S> sessionType) {
    return new ArtifactSessions<>(this, kind, sessionType);
  }

  /**
   * Persists a newly issued artifact.
   *
   * @param kind      the kind
   * @param signature the signature of the token or code
   * @param request   the request data and session
   * @param <S>       the session type
   */
  public <S> void createSession(ArtifactKind kind, String signature, ArtifactRequest<S> request) {
    requireSignature(signature);
    Objects.requireNonNull(request, "request");
    if (request.session() == null) {
      throw new IllegalArgumentException("Artifact request has no session");
    }
    log.debug("createSession(kind={}, requestId={})", kind, request.requestId());
    requireEnabledClient(request.clientId());

    EncodedSession session = sessionCodec.encode(request.session());
    StoredArtifact artifact = new StoredArtifact(kind, signature, request.requestId(), request.clientId(),
        request.requestedAt(), request.requestedScopes(), request.grantedScopes(),
        request.requestedAudience(), request.grantedAudience(), request.form(), request.expiresAt(),
        true, session);
    if (!artifactStore.create(artifact)) {
      throw new ConflictException(kind + " already exists for signature");
    }
  }

  /**
   * Reads an artifact by exact signature.
   *
   * @param kind        the kind
   * @param signature   the signature
   * @param sessionType the type to decode the session into
   * @param <S>         the session type
   * @return the request data with its decoded session
   */
  public <S> ArtifactRequest<S> getSession(ArtifactKind kind, String signature, Class<S> sessionType) {
    requireSignature(signature);
    StoredArtifact artifact = artifactStore.load(kind, signature)
        .orElseThrow(() -> new NotFoundException(kind + " not found"));
    if (artifact.isExpiredAt(clock.instant())) {
      throw new ExpiredException(kind + " expired", artifact.expiresAt());
    }
    if (!artifact.active()) {
      throw new InvalidatedArtifactException(kind + " has already been used", artifact.requestId());
    }
    requireEnabledClient(artifact.clientId());

    S session;
    try {
      session = sessionCodec.decode(artifact.session(), sessionType);
    } catch (MalformedSessionException e) {
      log.error("Malformed {} session for requestId={} (stored as {}): {}",
          kind, artifact.requestId(), artifact.session(), e.getMessage(), e);
      throw e;
    }
    return new ArtifactRequest<>(artifact.requestId(), artifact.clientId(), artifact.requestedAt(),
        artifact.requestedScopes(), artifact.grantedScopes(), artifact.requestedAudience(),
        artifact.grantedAudience(), artifact.form(), artifact.expiresAt(), session);
  }

  /**
   * Deletes a single artifact by signature. Works the same for every kind, refresh tokens included.
   *
   * @param kind      the kind
   * @param signature the signature
   * @return true if an artifact was deleted; false if it was absent and the policy is
   *     {@link MissingArtifactPolicy#IGNORE}
   */
  public boolean deleteSession(ArtifactKind kind, String signature) {
    requireSignature(signature);
    boolean deleted = artifactStore.delete(kind, signature);
    if (!deleted && missingArtifactPolicy == MissingArtifactPolicy.FAIL) {
      throw new NotFoundException(kind + " not found");
    }
    return deleted;
  }

  /**
   * Marks an authorization code as used. Later reads fail with {@link InvalidatedArtifactException}
   * so that a replayed code can be detected and its grant revoked.
   *
   * @param signature the authorization code signature
   */
  public void invalidateAuthorizeCode(String signature) {
    requireSignature(signature);
    if (!artifactStore.deactivate(ArtifactKind.AUTHORIZE_CODE, signature)) {
      throw new NotFoundException(ArtifactKind.AUTHORIZE_CODE + " not found");
    }
    log.debug("Invalidated authorization code");
  }

  /**
   * Physically removes every expired artifact. Intended for an external janitor.
   *
   * @return the number removed
   */
  public int purgeExpired() {
    int removed = artifactStore.deleteExpired(clock.instant());
    log.info("Purged {} expired artifact(s)", removed);
    return removed;
  }

  private void requireEnabledClient(String clientId) {
    Client client = clientStore.load(clientId)
        .orElseThrow(() -> new NotFoundException("Client not found: " + clientId));
    if (client.isDisabled()) {
      throw new SecurityException("Client is disabled: " + clientId);
    }
  }

  private static void requireSignature(String signature) {
    if (signature == null || signature.isBlank()) {
      throw new IllegalArgumentException("Signature must not be blank");
    }
  }
}
