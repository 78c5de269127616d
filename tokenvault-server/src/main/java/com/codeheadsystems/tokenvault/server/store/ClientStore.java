package com.codeheadsystems.tokenvault.server.store;

import com.codeheadsystems.tokenvault.model.Client;
import com.codeheadsystems.tokenvault.model.ClientFilter;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for OAuth2 client registrations.
 * <p>
 * Implementations must be thread-safe and must never hand out an instance that a caller can use to
 * mutate stored state; return copies. Secrets arrive already hashed. Implementations that cannot
 * reach their backing store raise
 * {@link com.codeheadsystems.tokenvault.server.exception.StoreUnavailableException}.
 */
public interface ClientStore {

  /**
   * Inserts a new client.
   *
   * @param client the client
   * @return false if a client with the same id already exists; nothing is written in that case
   */
  boolean insert(Client client);

  /**
   * Loads a client by id.
   *
   * @param id the client id
   * @return the client, or empty if not registered
   */
  Optional<Client> load(String id);

  /**
   * Replaces a client only if the stored record still equals {@code expected}.
   *
   * @param expected    the record the caller read
   * @param replacement the new record, with the same id
   * @return false if the record is gone or was changed concurrently
   */
  boolean replace(Client expected, Client replacement);

  /**
   * Removes a client.
   *
   * @param id the client id
   * @return false if no such client existed
   */
  boolean delete(String id);

  /**
   * Lists the clients matching the filter, ordered by id.
   *
   * @param filter the filter
   * @return the matching clients
   */
  List<Client> list(ClientFilter filter);
}
