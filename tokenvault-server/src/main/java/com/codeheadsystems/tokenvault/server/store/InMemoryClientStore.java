package com.codeheadsystems.tokenvault.server.store;

import com.codeheadsystems.tokenvault.model.Client;
import com.codeheadsystems.tokenvault.model.ClientFilter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ClientStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All registrations are lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryClientStore implements ClientStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryClientStore.class);

  private final ConcurrentHashMap<String, Client> store = new ConcurrentHashMap<>();

  public InMemoryClientStore() {
    log.warn("Using InMemoryClientStore, clients will NOT survive restarts. "
        + "Replace with a persistent ClientStore for production.");
  }

  @Override
  public boolean insert(Client client) {
    boolean inserted = store.putIfAbsent(client.getId(), client.copy()) == null;
    log.debug("Insert client id={} inserted={}", client.getId(), inserted);
    return inserted;
  }

  @Override
  public Optional<Client> load(String id) {
    return Optional.ofNullable(store.get(id)).map(Client::copy);
  }

  @Override
  public boolean replace(Client expected, Client replacement) {
    // Client.equals is structural, so this compares against the value the caller read.
    boolean replaced = store.replace(expected.getId(), expected, replacement.copy());
    log.debug("Replace client id={} replaced={}", expected.getId(), replaced);
    return replaced;
  }

  @Override
  public boolean delete(String id) {
    boolean deleted = store.remove(id) != null;
    log.debug("Delete client id={} deleted={}", id, deleted);
    return deleted;
  }

  @Override
  public List<Client> list(ClientFilter filter) {
    return store.values().stream()
        .filter(filter::matches)
        .sorted(Comparator.comparing(Client::getId))
        .map(Client::copy)
        .toList();
  }
}
