package com.codeheadsystems.tokenvault.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The request data the protocol layer persists alongside an artifact, with its typed session.
 *
 * @param requestId         correlation id shared by every artifact issued from one grant
 * @param clientId          the client the artifact was issued to
 * @param requestedAt       when the originating request was made
 * @param requestedScopes   scopes the client asked for
 * @param grantedScopes     scopes actually granted
 * @param requestedAudience audiences the client asked for
 * @param grantedAudience   audiences actually granted
 * @param form              request parameters, multi-valued
 * @param expiresAt         when the artifact stops being valid; null for no expiry
 * @param session           the session payload
 * @param <S>               the session type
 */
public record ArtifactRequest<S>(
    String requestId,
    String clientId,
    Instant requestedAt,
    List<String> requestedScopes,
    List<String> grantedScopes,
    List<String> requestedAudience,
    List<String> grantedAudience,
    Map<String, List<String>> form,
    Instant expiresAt,
    S session) {

  public ArtifactRequest {
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(requestedAt, "requestedAt");
    requestedScopes = requestedScopes == null ? List.of() : List.copyOf(requestedScopes);
    grantedScopes = grantedScopes == null ? List.of() : List.copyOf(grantedScopes);
    requestedAudience = requestedAudience == null ? List.of() : List.copyOf(requestedAudience);
    grantedAudience = grantedAudience == null ? List.of() : List.copyOf(grantedAudience);
    form = copyForm(form);
  }

  /**
   * Immutable copy of a form, values included.
   *
   * @param form the form, may be null
   * @return the copy
   */
  static Map<String, List<String>> copyForm(final Map<String, List<String>> form) {
    if (form == null) {
      return Map.of();
    }
    return form.entrySet().stream()
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey,
            e -> e.getValue() == null ? List.<String>of() : List.copyOf(e.getValue())));
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  /**
   * Builder for {@link ArtifactRequest}; {@code requestedAt} defaults to now.
   *
   * @param <S> the session type
   */
  public static final class Builder<S> {

    private String requestId;
    private String clientId;
    private Instant requestedAt = Instant.now();
    private List<String> requestedScopes;
    private List<String> grantedScopes;
    private List<String> requestedAudience;
    private List<String> grantedAudience;
    private Map<String, List<String>> form;
    private Instant expiresAt;
    private S session;

    private Builder() {
    }

    public Builder<S> requestId(final String requestId) {
      this.requestId = requestId;
      return this;
    }

    public Builder<S> clientId(final String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder<S> requestedAt(final Instant requestedAt) {
      this.requestedAt = requestedAt;
      return this;
    }

    public Builder<S> requestedScopes(final List<String> requestedScopes) {
      this.requestedScopes = requestedScopes;
      return this;
    }

    public Builder<S> grantedScopes(final List<String> grantedScopes) {
      this.grantedScopes = grantedScopes;
      return this;
    }

    public Builder<S> requestedAudience(final List<String> requestedAudience) {
      this.requestedAudience = requestedAudience;
      return this;
    }

    public Builder<S> grantedAudience(final List<String> grantedAudience) {
      this.grantedAudience = grantedAudience;
      return this;
    }

    public Builder<S> form(final Map<String, List<String>> form) {
      this.form = form;
      return this;
    }

    public Builder<S> expiresAt(final Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public Builder<S> session(final S session) {
      this.session = session;
      return this;
    }

    public ArtifactRequest<S> build() {
      return new ArtifactRequest<>(requestId, clientId, requestedAt, requestedScopes, grantedScopes,
          requestedAudience, grantedAudience, form, expiresAt, session);
    }
  }
}
