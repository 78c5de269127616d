package com.codeheadsystems.tokenvault.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted shape of an artifact. Keyed by {@code (kind, signature)}; the signature is a digest of
 * the token or code, never the raw value.
 *
 * @param kind              the artifact kind
 * @param signature         the storage key
 * @param requestId         correlation id used for cascading revocation
 * @param clientId          the owning client
 * @param requestedAt       when the originating request was made
 * @param requestedScopes   scopes asked for
 * @param grantedScopes     scopes granted
 * @param requestedAudience audiences asked for
 * @param grantedAudience   audiences granted
 * @param form              request parameters
 * @param expiresAt         expiry, or null when the artifact never expires
 * @param active            false once an authorization code has been used
 * @param session           the encoded session payload
 */
public record StoredArtifact(
    @JsonProperty("kind") ArtifactKind kind,
    @JsonProperty("signature") String signature,
    @JsonProperty("requestId") String requestId,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("requestedAt") Instant requestedAt,
    @JsonProperty("requestedScopes") List<String> requestedScopes,
    @JsonProperty("grantedScopes") List<String> grantedScopes,
    @JsonProperty("requestedAudience") List<String> requestedAudience,
    @JsonProperty("grantedAudience") List<String> grantedAudience,
    @JsonProperty("form") Map<String, List<String>> form,
    @JsonProperty("expiresAt") Instant expiresAt,
    @JsonProperty("active") boolean active,
    @JsonProperty("session") EncodedSession session) {

  public StoredArtifact {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(session, "session");
    requestedScopes = requestedScopes == null ? List.of() : List.copyOf(requestedScopes);
    grantedScopes = grantedScopes == null ? List.of() : List.copyOf(grantedScopes);
    requestedAudience = requestedAudience == null ? List.of() : List.copyOf(requestedAudience);
    grantedAudience = grantedAudience == null ? List.of() : List.copyOf(grantedAudience);
    form = ArtifactRequest.copyForm(form);
  }

  /**
   * An artifact is expired once {@code now} reaches its expiry.
   *
   * @param now the current instant
   * @return true if expired
   */
  @JsonIgnore
  public boolean isExpiredAt(final Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  /**
   * Copy of this artifact marked inactive.
   *
   * @return the deactivated copy
   */
  public StoredArtifact deactivated() {
    return new StoredArtifact(kind, signature, requestId, clientId, requestedAt, requestedScopes,
        grantedScopes, requestedAudience, grantedAudience, form, expiresAt, false, session);
  }
}
