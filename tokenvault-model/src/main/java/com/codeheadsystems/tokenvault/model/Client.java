package com.codeheadsystems.tokenvault.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * An OAuth 2.0 client registration.
 * <p>
 * The secret is included in the create request as cleartext exactly once. The registry replaces
 * it with a bcrypt hash before persisting, so it can never be recovered; afterwards it is only
 * ever checked through the one-way verification of the hasher, never compared to cleartext.
 * <p>
 * Grant and response types may be stored empty. The defaults ({@value #DEFAULT_GRANT_TYPE},
 * {@value #DEFAULT_RESPONSE_TYPE}) are substituted by {@link #getGrantTypes()} and
 * {@link #getResponseTypes()} at read time only.
 * <p>
 * Scopes and tenant access are mutable ordered sets; every other field is changed through
 * {@link #toBuilder()}. Instances are not thread-safe.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonDeserialize(builder = Client.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Client implements OAuth2Client {

  private static final byte[] NO_SECRET = new byte[0];

  @JsonProperty("id")
  private final String id;

  @JsonProperty("allowedTenantAccess")
  private final OrderedStringSet allowedTenantAccess;

  @JsonProperty("clientName")
  private final String name;

  @JsonProperty("clientSecret")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  private final byte[] secret;

  @JsonProperty("redirectUris")
  private final List<String> redirectUris;

  @JsonProperty("grantTypes")
  private final List<String> grantTypes;

  @JsonProperty("responseTypes")
  private final List<String> responseTypes;

  @JsonProperty("scopes")
  private final OrderedStringSet scopes;

  @JsonProperty("owner")
  private final String owner;

  @JsonProperty("policyUri")
  private final String policyUri;

  @JsonProperty("termsOfServiceUri")
  private final String termsOfServiceUri;

  @JsonProperty("clientUri")
  private final String clientUri;

  @JsonProperty("logoUri")
  private final String logoUri;

  @JsonProperty("contacts")
  private final List<String> contacts;

  @JsonProperty("public")
  private final boolean publicClient;

  @JsonProperty("disabled")
  private final boolean disabled;

  private Client(final Builder builder) {
    this.id = builder.id;
    this.allowedTenantAccess = builder.allowedTenantAccess.copy();
    this.name = builder.name;
    this.secret = builder.secret.clone();
    this.redirectUris = builder.redirectUris;
    this.grantTypes = builder.grantTypes;
    this.responseTypes = builder.responseTypes;
    this.scopes = builder.scopes.copy();
    this.owner = builder.owner;
    this.policyUri = builder.policyUri;
    this.termsOfServiceUri = builder.termsOfServiceUri;
    this.clientUri = builder.clientUri;
    this.logoUri = builder.logoUri;
    this.contacts = builder.contacts;
    this.publicClient = builder.publicClient;
    this.disabled = builder.disabled;
  }

  /**
   * Builder with every field at its zero value.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder pre-populated with this client's values. Mutating the builder never affects this client.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .allowedTenantAccess(allowedTenantAccess.asList())
        .name(name)
        .secret(secret)
        .redirectUris(redirectUris)
        .grantTypes(grantTypes)
        .responseTypes(responseTypes)
        .scopes(scopes.asList())
        .owner(owner)
        .policyUri(policyUri)
        .termsOfServiceUri(termsOfServiceUri)
        .clientUri(clientUri)
        .logoUri(logoUri)
        .contacts(contacts)
        .publicClient(publicClient)
        .disabled(disabled);
  }

  /**
   * Deep copy.
   *
   * @return the client
   */
  public Client copy() {
    return toBuilder().build();
  }

  @Override
  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override
  public List<String> getRedirectUris() {
    return redirectUris;
  }

  @Override
  public byte[] getHashedSecret() {
    return secret.clone();
  }

  public boolean hasSecret() {
    return secret.length > 0;
  }

  @Override
  public List<String> getScopes() {
    return scopes.asList();
  }

  public List<String> getAllowedTenantAccess() {
    return allowedTenantAccess.asList();
  }

  @Override
  public List<String> getGrantTypes() {
    // https://openid.net/specs/openid-connect-registration-1_0.html#ClientMetadata
    if (grantTypes.isEmpty()) {
      return List.of(DEFAULT_GRANT_TYPE);
    }
    return grantTypes;
  }

  /**
   * Grant types exactly as stored, possibly empty.
   *
   * @return the stored grant types
   */
  public List<String> getStoredGrantTypes() {
    return grantTypes;
  }

  @Override
  public List<String> getResponseTypes() {
    if (responseTypes.isEmpty()) {
      return List.of(DEFAULT_RESPONSE_TYPE);
    }
    return responseTypes;
  }

  /**
   * Response types exactly as stored, possibly empty.
   *
   * @return the stored response types
   */
  public List<String> getStoredResponseTypes() {
    return responseTypes;
  }

  @Override
  public String getOwner() {
    return owner;
  }

  public String getPolicyUri() {
    return policyUri;
  }

  public String getTermsOfServiceUri() {
    return termsOfServiceUri;
  }

  public String getClientUri() {
    return clientUri;
  }

  public String getLogoUri() {
    return logoUri;
  }

  public List<String> getContacts() {
    return contacts;
  }

  @Override
  public boolean isPublic() {
    return publicClient;
  }

  @Override
  public boolean isDisabled() {
    return disabled;
  }

  /**
   * Grants access to the given scopes. Scopes already granted are left where they are.
   *
   * @param toEnable the scopes
   */
  public void enableScopeAccess(final String... toEnable) {
    scopes.add(toEnable);
  }

  /**
   * Revokes access to the given scopes. Scopes that were never granted are ignored.
   *
   * @param toDisable the scopes
   */
  public void disableScopeAccess(final String... toDisable) {
    scopes.remove(toDisable);
  }

  /**
   * Adds a single or multiple tenant ids to the tenants this client may access.
   *
   * @param tenantIds the tenant ids
   */
  public void enableTenantAccess(final String... tenantIds) {
    allowedTenantAccess.add(tenantIds);
  }

  /**
   * Removes a single or multiple tenant ids from the tenants this client may access.
   *
   * @param tenantIds the tenant ids
   */
  public void disableTenantAccess(final String... tenantIds) {
    allowedTenantAccess.remove(tenantIds);
  }

  /**
   * True only for a client whose every field holds its zero value.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return equals(builder().build());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Client other)) {
      return false;
    }
    return publicClient == other.publicClient
        && disabled == other.disabled
        && id.equals(other.id)
        && allowedTenantAccess.equals(other.allowedTenantAccess)
        && name.equals(other.name)
        && Arrays.equals(secret, other.secret)
        && redirectUris.equals(other.redirectUris)
        && grantTypes.equals(other.grantTypes)
        && responseTypes.equals(other.responseTypes)
        && scopes.equals(other.scopes)
        && owner.equals(other.owner)
        && policyUri.equals(other.policyUri)
        && termsOfServiceUri.equals(other.termsOfServiceUri)
        && clientUri.equals(other.clientUri)
        && logoUri.equals(other.logoUri)
        && contacts.equals(other.contacts);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, allowedTenantAccess, name, redirectUris, grantTypes, responseTypes,
        scopes, owner, policyUri, termsOfServiceUri, clientUri, logoUri, contacts, publicClient, disabled);
    return 31 * result + Arrays.hashCode(secret);
  }

  // Never includes the secret.
  @Override
  public String toString() {
    return "Client{id=" + id
        + ", name=" + name
        + ", owner=" + owner
        + ", scopes=" + scopes
        + ", allowedTenantAccess=" + allowedTenantAccess
        + ", grantTypes=" + grantTypes
        + ", responseTypes=" + responseTypes
        + ", public=" + publicClient
        + ", disabled=" + disabled
        + "}";
  }

  /**
   * Builder for {@link Client}. Null values are normalized to empty strings and empty lists.
   */
  @JsonPOJOBuilder(withPrefix = "")
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Builder {

    private String id = "";
    private OrderedStringSet allowedTenantAccess = new OrderedStringSet();
    private String name = "";
    private byte[] secret = NO_SECRET;
    private List<String> redirectUris = List.of();
    private List<String> grantTypes = List.of();
    private List<String> responseTypes = List.of();
    private OrderedStringSet scopes = new OrderedStringSet();
    private String owner = "";
    private String policyUri = "";
    private String termsOfServiceUri = "";
    private String clientUri = "";
    private String logoUri = "";
    private List<String> contacts = List.of();
    private boolean publicClient;
    private boolean disabled;

    private Builder() {
    }

    @JsonProperty("id")
    public Builder id(final String id) {
      this.id = text(id);
      return this;
    }

    @JsonProperty("allowedTenantAccess")
    public Builder allowedTenantAccess(final Collection<String> allowedTenantAccess) {
      this.allowedTenantAccess = OrderedStringSet.of(allowedTenantAccess);
      return this;
    }

    @JsonProperty("clientName")
    public Builder name(final String name) {
      this.name = text(name);
      return this;
    }

    /**
     * Secret bytes: cleartext when registering, the stored hash otherwise.
     *
     * @param secret the secret
     * @return the builder
     */
    @JsonProperty("clientSecret")
    public Builder secret(final byte[] secret) {
      this.secret = secret == null ? NO_SECRET : secret.clone();
      return this;
    }

    @JsonProperty("redirectUris")
    public Builder redirectUris(final List<String> redirectUris) {
      this.redirectUris = list(redirectUris);
      return this;
    }

    @JsonProperty("grantTypes")
    public Builder grantTypes(final List<String> grantTypes) {
      this.grantTypes = list(grantTypes);
      return this;
    }

    @JsonProperty("responseTypes")
    public Builder responseTypes(final List<String> responseTypes) {
      this.responseTypes = list(responseTypes);
      return this;
    }

    @JsonProperty("scopes")
    public Builder scopes(final Collection<String> scopes) {
      this.scopes = OrderedStringSet.of(scopes);
      return this;
    }

    @JsonProperty("owner")
    public Builder owner(final String owner) {
      this.owner = text(owner);
      return this;
    }

    @JsonProperty("policyUri")
    public Builder policyUri(final String policyUri) {
      this.policyUri = text(policyUri);
      return this;
    }

    @JsonProperty("termsOfServiceUri")
    public Builder termsOfServiceUri(final String termsOfServiceUri) {
      this.termsOfServiceUri = text(termsOfServiceUri);
      return this;
    }

    @JsonProperty("clientUri")
    public Builder clientUri(final String clientUri) {
      this.clientUri = text(clientUri);
      return this;
    }

    @JsonProperty("logoUri")
    public Builder logoUri(final String logoUri) {
      this.logoUri = text(logoUri);
      return this;
    }

    @JsonProperty("contacts")
    public Builder contacts(final List<String> contacts) {
      this.contacts = list(contacts);
      return this;
    }

    @JsonProperty("public")
    public Builder publicClient(final boolean publicClient) {
      this.publicClient = publicClient;
      return this;
    }

    @JsonProperty("disabled")
    public Builder disabled(final boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public Client build() {
      return new Client(this);
    }

    private static String text(final String value) {
      return value == null ? "" : value;
    }

    // Nulls are dropped, as in OrderedStringSet.
    private static List<String> list(final List<String> values) {
      return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }
  }
}
