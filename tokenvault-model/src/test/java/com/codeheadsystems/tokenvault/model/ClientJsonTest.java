package com.codeheadsystems.tokenvault.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the persisted field names of a client record.
 */
class ClientJsonTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void serialize_usesPersistedFieldNames() throws Exception {
    Client client = Client.builder()
        .id("c1")
        .name("Client One")
        .secret("$2y$04$hash".getBytes(StandardCharsets.US_ASCII))
        .scopes(List.of("openid"))
        .allowedTenantAccess(List.of("t1"))
        .publicClient(false)
        .build();

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(client));

    assertThat(json.get("id").asText()).isEqualTo("c1");
    assertThat(json.get("clientName").asText()).isEqualTo("Client One");
    assertThat(json.has("clientSecret")).isTrue();
    assertThat(json.get("scopes").get(0).asText()).isEqualTo("openid");
    assertThat(json.get("allowedTenantAccess").get(0).asText()).isEqualTo("t1");
    assertThat(json.get("public").asBoolean()).isFalse();
    assertThat(json.has("disabled")).isTrue();
  }

  @Test
  void serialize_storesRawGrantTypesNotDefaults() throws Exception {
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(Client.builder().id("c1").build()));

    assertThat(json.get("grantTypes").isEmpty()).isTrue();
    assertThat(json.get("responseTypes").isEmpty()).isTrue();
  }

  @Test
  void serialize_emptySecret_isOmitted() throws Exception {
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
        Client.builder().id("public-app").publicClient(true).build()));

    assertThat(json.has("clientSecret")).isFalse();
  }

  @Test
  void deserialize_restoresEqualClient() throws Exception {
    Client client = Client.builder()
        .id("c1")
        .name("Client One")
        .secret("$2y$04$hash".getBytes(StandardCharsets.US_ASCII))
        .redirectUris(List.of("https://app.example.com/cb"))
        .grantTypes(List.of("client_credentials"))
        .scopes(List.of("read", "write"))
        .contacts(List.of("ops@example.com"))
        .disabled(true)
        .build();

    Client read = objectMapper.readValue(objectMapper.writeValueAsString(client), Client.class);

    assertThat(read).isEqualTo(client);
  }

  @Test
  void deserialize_missingAndUnknownFields_useZeroValues() throws Exception {
    Client read = objectMapper.readValue("{\"id\":\"c9\",\"legacyField\":42}", Client.class);

    assertThat(read.getId()).isEqualTo("c9");
    assertThat(read.getScopes()).isEmpty();
    assertThat(read.hasSecret()).isFalse();
    assertThat(read.getGrantTypes()).containsExactly("authorization_code");
  }

  @Test
  void deserialize_nullListEntries_areDropped() throws Exception {
    String json = "{\"id\":\"c1\",\"redirectUris\":[\"https://a\",null],\"grantTypes\":[null],"
        + "\"responseTypes\":[\"code\",null],\"contacts\":[null,\"ops@example.com\"],\"scopes\":[null,\"openid\"]}";

    Client read = objectMapper.readValue(json, Client.class);

    assertThat(read.getRedirectUris()).containsExactly("https://a");
    assertThat(read.getStoredGrantTypes()).isEmpty();
    assertThat(read.getGrantTypes()).containsExactly("authorization_code");
    assertThat(read.getStoredResponseTypes()).containsExactly("code");
    assertThat(read.getContacts()).containsExactly("ops@example.com");
    assertThat(read.getScopes()).containsExactly("openid");
  }
}
