package com.codeheadsystems.tokenvault.server.manager;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.model.ArtifactRequest;

/**
 * The storage capability set for one artifact kind and session type, as consumed by the protocol
 * layer. Obtained from {@link ArtifactManager#forKind}.
 *
 * @param <S> the session type
 */
public final class ArtifactSessions<S> {

  private final ArtifactManager manager;
  private final ArtifactKind kind;
  private final Class<S> sessionType;

  ArtifactSessions(ArtifactManager manager, ArtifactKind kind, Class<S> sessionType) {
    this.manager = manager;
    this.kind = kind;
    this.sessionType = sessionType;
  }

  public ArtifactKind kind() {
    return kind;
  }

  public void create(String signature, ArtifactRequest<S> request) {
    manager.createSession(kind, signature, request);
  }

  public ArtifactRequest<S> get(String signature) {
    return manager.getSession(kind, signature, sessionType);
  }

  public boolean delete(String signature) {
    return manager.deleteSession(kind, signature);
  }
}
