package com.codeheadsystems.tokenvault.model;

import java.util.List;

/**
 * The client capability set consumed by the OAuth2 protocol engine during client
 * authentication and grant validation.
 */
public interface OAuth2Client {

  /**
   * Grant type assumed when a client declares none (OpenID Connect Registration 1.0, client metadata).
   */
  String DEFAULT_GRANT_TYPE = "authorization_code";

  /**
   * Response type assumed when a client declares none (OpenID Connect Registration 1.0, client metadata).
   */
  String DEFAULT_RESPONSE_TYPE = "code";

  /**
   * Grant type that public clients may never use.
   */
  String CLIENT_CREDENTIALS_GRANT = "client_credentials";

  String getId();

  List<String> getRedirectUris();

  /**
   * The bcrypt hash of the client secret, or an empty array for public clients.
   *
   * @return the hashed secret
   */
  byte[] getHashedSecret();

  List<String> getScopes();

  /**
   * Grant types the client restricted itself to, defaulting to {@value #DEFAULT_GRANT_TYPE}.
   *
   * @return the grant types, never empty
   */
  List<String> getGrantTypes();

  /**
   * Response types the client restricted itself to, defaulting to {@value #DEFAULT_RESPONSE_TYPE}.
   *
   * @return the response types, never empty
   */
  List<String> getResponseTypes();

  String getOwner();

  /**
   * Public clients have no secret and cannot use the {@value #CLIENT_CREDENTIALS_GRANT} grant.
   *
   * @return true if public
   */
  boolean isPublic();

  /**
   * Disabled clients fail every grant and token operation.
   *
   * @return true if disabled
   */
  boolean isDisabled();
}
