package com.codeheadsystems.tokenvault.server.manager;

import com.codeheadsystems.tokenvault.model.Client;
import com.codeheadsystems.tokenvault.model.ClientFilter;
import com.codeheadsystems.tokenvault.model.OAuth2Client;
import com.codeheadsystems.tokenvault.server.crypto.SecretHasher;
import com.codeheadsystems.tokenvault.server.exception.ConflictException;
import com.codeheadsystems.tokenvault.server.exception.NotFoundException;
import com.codeheadsystems.tokenvault.server.store.ClientStore;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client registry: registration, lookup, update and removal of OAuth2 clients, plus secret
 * verification for client authentication.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException} for invalid client data (blank id, public client with a secret)</li>
 *   <li>{@link NotFoundException} when the client is not registered</li>
 *   <li>{@link ConflictException} on a duplicate id or a concurrent update</li>
 *   <li>{@link SecurityException} when authentication or a grant check fails</li>
 * </ul>
 */
public class ClientManager {

  private static final Logger log = LoggerFactory.getLogger(ClientManager.class);

  private final ClientStore clientStore;
  private final SecretHasher secretHasher;
  // Compared against when the client id is unknown, so lookups of unknown ids cost the same.
  private final byte[] dummyHash;

  public ClientManager(ClientStore clientStore, SecretHasher secretHasher) {
    this.clientStore = clientStore;
    this.secretHasher = secretHasher;
    this.dummyHash = secretHasher.hash("tokenvault-unknown-client".getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Registers a client. A non-empty secret is treated as cleartext and replaced by its hash.
   *
   * @param client the client
   * @return the stored client, secret hashed
   */
  public Client createClient(Client client) {
    log.debug("createClient(id={})", client.getId());
    validate(client);
    Client toStore = client.hasSecret()
        ? client.toBuilder().secret(secretHasher.hash(client.getHashedSecret())).build()
        : client.copy();
    if (!clientStore.insert(toStore)) {
      throw new ConflictException("Client already exists: " + client.getId());
    }
    return toStore;
  }

  /**
   * Loads a client.
   *
   * @param id the client id
   * @return the client
   */
  public Client getClient(String id) {
    return clientStore.load(id)
        .orElseThrow(() -> new NotFoundException("Client not found: " + id));
  }

  /**
   * Replaces a client's registration. An empty secret keeps the stored hash; a non-empty one is
   * treated as a new cleartext secret. Nothing is written when the result equals the stored client.
   *
   * @param client the updated client
   * @return the stored client
   */
  public Client updateClient(Client client) {
    log.debug("updateClient(id={})", client.getId());
    validate(client);
    Client current = getClient(client.getId());

    Client.Builder merged = client.toBuilder();
    if (client.isPublic()) {
      merged.secret(null);
    } else if (client.hasSecret()) {
      merged.secret(secretHasher.hash(client.getHashedSecret()));
    } else {
      merged.secret(current.getHashedSecret());
    }
    Client updated = merged.build();

    if (updated.equals(current)) {
      log.debug("updateClient(id={}) is a no-op", client.getId());
      return current;
    }
    if (!clientStore.replace(current, updated)) {
      throw new ConflictException("Client was modified or removed concurrently: " + client.getId());
    }
    return updated;
  }

  /**
   * Enables or disables a client without removing it.
   *
   * @param id       the client id
   * @param disabled the new state
   * @return the stored client
   */
  public Client setDisabled(String id, boolean disabled) {
    Client current = getClient(id);
    if (current.isDisabled() == disabled) {
      return current;
    }
    Client updated = current.toBuilder().disabled(disabled).build();
    if (!clientStore.replace(current, updated)) {
      throw new ConflictException("Client was modified or removed concurrently: " + id);
    }
    log.info("Client id={} disabled={}", id, disabled);
    return updated;
  }

  /**
   * Removes a client.
   *
   * @param id the client id
   */
  public void deleteClient(String id) {
    log.debug("deleteClient(id={})", id);
    if (!clientStore.delete(id)) {
      throw new NotFoundException("Client not found: " + id);
    }
  }

  /**
   * Lists clients.
   *
   * @param filter the filter, {@link ClientFilter#all()} for everything
   * @return the clients ordered by id
   */
  public List<Client> listClients(ClientFilter filter) {
    return clientStore.list(filter);
  }

  /**
   * Authenticates a client. Public clients are returned without a secret check.
   *
   * @param id     the client id
   * @param secret the cleartext secret presented by the client
   * @return the authenticated client
   * @throws SecurityException if the client is unknown, disabled, or the secret does not match
   */
  public Client authenticate(String id, byte[] secret) {
    Optional<Client> found = clientStore.load(id);
    if (found.isEmpty()) {
      secretHasher.matches(dummyHash, secret);
      throw new SecurityException("Authentication failed");
    }
    Client client = found.get();
    if (client.isDisabled()) {
      throw new SecurityException("Client is disabled");
    }
    if (client.isPublic()) {
      return client;
    }
    if (!secretHasher.matches(client.getHashedSecret(), secret)) {
      log.debug("Secret mismatch for client id={}", id);
      throw new SecurityException("Authentication failed");
    }
    return client;
  }

  /**
   * Checks that a client may use a grant type.
   *
   * @param id        the client id
   * @param grantType the grant type
   * @return the client
   * @throws SecurityException if the client is disabled, is public and asks for client credentials,
   *                           or did not register the grant type
   */
  public Client requireGrantAllowed(String id, String grantType) {
    Client client = getClient(id);
    if (client.isDisabled()) {
      throw new SecurityException("Client is disabled");
    }
    if (client.isPublic() && OAuth2Client.CLIENT_CREDENTIALS_GRANT.equals(grantType)) {
      throw new SecurityException("Public clients may not use the client_credentials grant");
    }
    if (!client.getGrantTypes().contains(grantType)) {
      throw new SecurityException("Grant type not allowed for client: " + grantType);
    }
    return client;
  }

  private void validate(Client client) {
    if (client.getId().isBlank()) {
      throw new IllegalArgumentException("Client id must not be blank");
    }
    if (client.isPublic() && client.hasSecret()) {
      throw new IllegalArgumentException("Public clients must not have a secret");
    }
  }
}
