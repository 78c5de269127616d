package com.codeheadsystems.tokenvault.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tokenvault.model.Client;
import com.codeheadsystems.tokenvault.model.ClientFilter;
import com.codeheadsystems.tokenvault.server.crypto.BCryptSecretHasher;
import com.codeheadsystems.tokenvault.server.crypto.SecretHasher;
import com.codeheadsystems.tokenvault.server.exception.ConflictException;
import com.codeheadsystems.tokenvault.server.exception.NotFoundException;
import com.codeheadsystems.tokenvault.server.store.ClientStore;
import com.codeheadsystems.tokenvault.server.store.InMemoryClientStore;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Client manager test.
 */
class ClientManagerTest {

  private static final byte[] SECRET = "s3cr3t".getBytes(StandardCharsets.UTF_8);
  private static final SecretHasher HASHER = new BCryptSecretHasher(4, new SecureRandom());

  private InMemoryClientStore clientStore;
  private ClientManager manager;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    clientStore = new InMemoryClientStore();
    manager = new ClientManager(clientStore, HASHER);
  }

  private static Client confidential(String id) {
    return Client.builder()
        .id(id)
        .name("Confidential " + id)
        .secret(SECRET)
        .grantTypes(List.of("authorization_code", "refresh_token", "client_credentials"))
        .scopes(List.of("openid"))
        .owner("acme")
        .build();
  }

  @Test
  void createClient_hashesSecret_andStoresIt() {
    Client stored = manager.createClient(confidential("c1"));

    assertThat(stored.getHashedSecret()).isNotEqualTo(SECRET);
    assertThat(HASHER.matches(stored.getHashedSecret(), SECRET)).isTrue();
    assertThat(manager.getClient("c1")).isEqualTo(stored);
  }

  @Test
  void createClient_duplicateId_throwsConflict_andKeepsOriginal() {
    Client first = manager.createClient(confidential("c1"));

    assertThatThrownBy(() -> manager.createClient(confidential("c1").toBuilder().name("Other").build()))
        .isInstanceOf(ConflictException.class);

    assertThat(manager.getClient("c1")).isEqualTo(first);
  }

  @Test
  void createClient_publicWithSecret_throwsIllegalArgument() {
    Client client = confidential("c1").toBuilder().publicClient(true).build();

    assertThatThrownBy(() -> manager.createClient(client)).isInstanceOf(IllegalArgumentException.class);
    assertThat(clientStore.load("c1")).isEmpty();
  }

  @Test
  void createClient_blankId_throwsIllegalArgument() {
    assertThatThrownBy(() -> manager.createClient(Client.builder().id(" ").build()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getClient_unknown_throwsNotFound() {
    assertThatThrownBy(() -> manager.getClient("nope")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void updateClient_emptySecret_keepsStoredHash() {
    Client stored = manager.createClient(confidential("c1"));

    Client updated = manager.updateClient(stored.toBuilder().name("Renamed").secret(null).build());

    assertThat(updated.getName()).isEqualTo("Renamed");
    assertThat(updated.getHashedSecret()).isEqualTo(stored.getHashedSecret());
    assertThat(manager.getClient("c1")).isEqualTo(updated);
  }

  @Test
  void updateClient_newSecret_isRehashed() {
    manager.createClient(confidential("c1"));
    byte[] newSecret = "n3w".getBytes(StandardCharsets.UTF_8);

    manager.updateClient(confidential("c1").toBuilder().secret(newSecret).build());

    assertThat(manager.authenticate("c1", newSecret).getId()).isEqualTo("c1");
    assertThatThrownBy(() -> manager.authenticate("c1", SECRET)).isInstanceOf(SecurityException.class);
  }

  @Test
  void updateClient_unknown_throwsNotFound() {
    assertThatThrownBy(() -> manager.updateClient(confidential("ghost")))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void setDisabled_togglesFlag() {
    manager.createClient(confidential("c1"));

    assertThat(manager.setDisabled("c1", true).isDisabled()).isTrue();
    assertThat(manager.getClient("c1").isDisabled()).isTrue();
    assertThat(manager.setDisabled("c1", false).isDisabled()).isFalse();
  }

  @Test
  void deleteClient_removesClient_thenNotFound() {
    manager.createClient(confidential("c1"));

    manager.deleteClient("c1");

    assertThatThrownBy(() -> manager.getClient("c1")).isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> manager.deleteClient("c1")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void listClients_appliesFilter() {
    manager.createClient(confidential("c1"));
    manager.createClient(confidential("c2").toBuilder().owner("globex").build());
    manager.createClient(Client.builder().id("spa").publicClient(true).owner("acme").build());

    assertThat(manager.listClients(ClientFilter.builder().owner("acme").build()))
        .extracting(Client::getId).containsExactly("c1", "spa");
    assertThat(manager.listClients(ClientFilter.builder().publicClient(true).build()))
        .extracting(Client::getId).containsExactly("spa");
  }

  @Test
  void authenticate_correctSecret_returnsClient() {
    manager.createClient(confidential("c1"));

    assertThat(manager.authenticate("c1", SECRET).getId()).isEqualTo("c1");
  }

  @Test
  void authenticate_wrongSecret_throwsSecurityException() {
    manager.createClient(confidential("c1"));

    assertThatThrownBy(() -> manager.authenticate("c1", "bad".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void authenticate_unknownClient_sameMessageAsWrongSecret() {
    manager.createClient(confidential("c1"));

    assertThatThrownBy(() -> manager.authenticate("ghost", SECRET))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Authentication failed");
    assertThatThrownBy(() -> manager.authenticate("c1", "bad".getBytes(StandardCharsets.UTF_8)))
        .hasMessage("Authentication failed");
  }

  @Test
  void authenticate_disabledClient_throwsSecurityException() {
    manager.createClient(confidential("c1"));
    manager.setDisabled("c1", true);

    assertThatThrownBy(() -> manager.authenticate("c1", SECRET)).isInstanceOf(SecurityException.class);
  }

  @Test
  void authenticate_publicClient_skipsSecretCheck() {
    manager.createClient(Client.builder().id("spa").publicClient(true).build());

    assertThat(manager.authenticate("spa", new byte[0]).isPublic()).isTrue();
  }

  @Test
  void requireGrantAllowed_registeredGrant_returnsClient() {
    manager.createClient(confidential("c1"));

    assertThat(manager.requireGrantAllowed("c1", "refresh_token").getId()).isEqualTo("c1");
  }

  @Test
  void requireGrantAllowed_defaultGrantOnly_rejectsOthers() {
    manager.createClient(Client.builder().id("c1").secret(SECRET).build());

    assertThat(manager.requireGrantAllowed("c1", "authorization_code").getId()).isEqualTo("c1");
    assertThatThrownBy(() -> manager.requireGrantAllowed("c1", "refresh_token"))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void requireGrantAllowed_publicClientCredentials_rejected() {
    manager.createClient(Client.builder().id("spa").publicClient(true)
        .grantTypes(List.of("authorization_code", "client_credentials")).build());

    assertThatThrownBy(() -> manager.requireGrantAllowed("spa", "client_credentials"))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void requireGrantAllowed_disabledClient_rejected() {
    manager.createClient(confidential("c1"));
    manager.setDisabled("c1", true);

    assertThatThrownBy(() -> manager.requireGrantAllowed("c1", "authorization_code"))
        .isInstanceOf(SecurityException.class);
  }

  /**
   * Store interactions that the in-memory store cannot provoke.
   */
  @Nested
  @ExtendWith(MockitoExtension.class)
  class WithMockStore {

    @Mock private ClientStore mockStore;

    @Test
    void updateClient_concurrentModification_throwsConflict() {
      Client current = confidential("c1").toBuilder().secret(HASHER.hash(SECRET)).build();
      when(mockStore.load("c1")).thenReturn(Optional.of(current));
      when(mockStore.replace(any(), any())).thenReturn(false);
      ClientManager mocked = new ClientManager(mockStore, HASHER);

      assertThatThrownBy(() -> mocked.updateClient(current.toBuilder().name("Renamed").secret(null).build()))
          .isInstanceOf(ConflictException.class);
    }

    @Test
    void updateClient_unchanged_doesNotWrite() {
      Client current = confidential("c1").toBuilder().secret(HASHER.hash(SECRET)).build();
      when(mockStore.load("c1")).thenReturn(Optional.of(current));
      ClientManager mocked = new ClientManager(mockStore, HASHER);

      Client result = mocked.updateClient(current.toBuilder().secret(null).build());

      assertThat(result).isEqualTo(current);
      verify(mockStore, never()).replace(any(), any());
    }
  }
}
