package com.codeheadsystems.tokenvault.model;

/**
 * Criteria for listing clients. Null criteria are ignored; every set criterion must match.
 * Grant and response types are matched against the defaulted values a client reports.
 *
 * @param owner        exact owner
 * @param tenantId     a tenant the client may access
 * @param scope        a scope the client may request
 * @param grantType    a grant type the client may use
 * @param responseType a response type the client may use
 * @param redirectUri  a registered redirect URI
 * @param contact      a registered contact
 * @param publicClient the public flag
 * @param disabled     the disabled flag
 */
public record ClientFilter(
    String owner,
    String tenantId,
    String scope,
    String grantType,
    String responseType,
    String redirectUri,
    String contact,
    Boolean publicClient,
    Boolean disabled) {

  private static final ClientFilter ALL = builder().build();

  /**
   * A filter matching every client.
   *
   * @return the client filter
   */
  public static ClientFilter all() {
    return ALL;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Whether the client satisfies every criterion set on this filter.
   *
   * @param client the client
   * @return true if it matches
   */
  public boolean matches(final Client client) {
    return (owner == null || owner.equals(client.getOwner()))
        && (tenantId == null || client.getAllowedTenantAccess().contains(tenantId))
        && (scope == null || client.getScopes().contains(scope))
        && (grantType == null || client.getGrantTypes().contains(grantType))
        && (responseType == null || client.getResponseTypes().contains(responseType))
        && (redirectUri == null || client.getRedirectUris().contains(redirectUri))
        && (contact == null || client.getContacts().contains(contact))
        && (publicClient == null || publicClient == client.isPublic())
        && (disabled == null || disabled == client.isDisabled());
  }

  /**
   * The type Builder.
   */
  public static final class Builder {

    private String owner;
    private String tenantId;
    private String scope;
    private String grantType;
    private String responseType;
    private String redirectUri;
    private String contact;
    private Boolean publicClient;
    private Boolean disabled;

    private Builder() {
    }

    public Builder owner(final String owner) {
      this.owner = owner;
      return this;
    }

    public Builder tenantId(final String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder scope(final String scope) {
      this.scope = scope;
      return this;
    }

    public Builder grantType(final String grantType) {
      this.grantType = grantType;
      return this;
    }

    public Builder responseType(final String responseType) {
      this.responseType = responseType;
      return this;
    }

    public Builder redirectUri(final String redirectUri) {
      this.redirectUri = redirectUri;
      return this;
    }

    public Builder contact(final String contact) {
      this.contact = contact;
      return this;
    }

    public Builder publicClient(final Boolean publicClient) {
      this.publicClient = publicClient;
      return this;
    }

    public Builder disabled(final Boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public ClientFilter build() {
      return new ClientFilter(owner, tenantId, scope, grantType, responseType, redirectUri, contact,
          publicClient, disabled);
    }
  }
}
