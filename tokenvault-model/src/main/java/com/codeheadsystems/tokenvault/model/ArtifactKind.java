package com.codeheadsystems.tokenvault.model;

/**
 * The closed set of artifact kinds produced by OAuth2/OIDC grant flows. Each kind is stored in
 * its own namespace, so the same signature may exist once per kind.
 */
public enum ArtifactKind {

  ACCESS_TOKEN("access_tokens"),
  REFRESH_TOKEN("refresh_tokens"),
  AUTHORIZE_CODE("authorize_codes"),
  PKCE("pkce_requests"),
  OIDC_SESSION("oidc_sessions");

  private final String namespace;

  ArtifactKind(final String namespace) {
    this.namespace = namespace;
  }

  /**
   * Name of the backing collection/table for this kind.
   *
   * @return the namespace
   */
  public String namespace() {
    return namespace;
  }
}
