package com.codeheadsystems.tokenvault.server.codec;

import com.codeheadsystems.tokenvault.model.EncodedSession;
import com.codeheadsystems.tokenvault.server.exception.MalformedSessionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionCodec} writing sessions as JSON.
 * <p>
 * Every payload is tagged with {@link #schemaVersion()}. When a payload from an older version is
 * read, the registered upgrade steps run in order ({@code v -> v + 1}) on the JSON tree before it is
 * bound to the target type. Unknown properties are ignored so fields removed from a session type do
 * not break old payloads. Payloads from a newer version are rejected.
 */
public class JacksonSessionCodec implements SessionCodec {

  private static final Logger log = LoggerFactory.getLogger(JacksonSessionCodec.class);

  /**
   * Schema version written when none is configured.
   */
  public static final int DEFAULT_SCHEMA_VERSION = 1;

  private final ObjectMapper objectMapper;
  private final int schemaVersion;
  private final Map<Integer, UnaryOperator<ObjectNode>> upgrades;

  /**
   * Codec at {@link #DEFAULT_SCHEMA_VERSION} with no upgrade steps.
   */
  public JacksonSessionCodec() {
    this(defaultObjectMapper(), DEFAULT_SCHEMA_VERSION, Map.of());
  }

  /**
   * Creates a new codec.
   *
   * @param objectMapper  the mapper; copied and configured to ignore unknown properties
   * @param schemaVersion the version written by {@link #encode}
   * @param upgrades      upgrade step per source version; step {@code v} turns a version {@code v}
   *                      payload into a version {@code v + 1} payload
   */
  public JacksonSessionCodec(final ObjectMapper objectMapper,
                             final int schemaVersion,
                             final Map<Integer, UnaryOperator<ObjectNode>> upgrades) {
    if (schemaVersion < 1) {
      throw new IllegalArgumentException("schemaVersion must be >= 1: " + schemaVersion);
    }
    this.objectMapper = objectMapper.copy()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.schemaVersion = schemaVersion;
    this.upgrades = new TreeMap<>(upgrades);
  }

  /**
   * Mapper with Java time support and ISO-8601 timestamps.
   *
   * @return the object mapper
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public int schemaVersion() {
    return schemaVersion;
  }

  @Override
  public EncodedSession encode(final Object session) {
    Objects.requireNonNull(session, "session");
    try {
      byte[] payload = objectMapper.writeValueAsBytes(session);
      return new EncodedSession(session.getClass().getName(), schemaVersion, payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Session of type " + session.getClass().getName()
          + " cannot be encoded", e);
    }
  }

  @Override
  public <S> S decode(final EncodedSession encoded, final Class<S> type) {
    int version = encoded.version();
    if (version > schemaVersion) {
      throw new MalformedSessionException("Session payload version " + version
          + " is newer than supported version " + schemaVersion);
    }
    if (version < 1) {
      throw new MalformedSessionException("Session payload has invalid version " + version);
    }
    try {
      JsonNode tree = objectMapper.readTree(encoded.payload());
      if (tree == null || tree.isMissingNode()) {
        throw new MalformedSessionException("Session payload is empty");
      }
      tree = upgrade(tree, version);
      return objectMapper.treeToValue(tree, type);
    } catch (IOException | IllegalArgumentException e) {
      throw new MalformedSessionException("Session payload cannot be decoded as "
          + type.getName() + " (written as " + encoded.type() + ", version " + version + ")", e);
    }
  }

  private JsonNode upgrade(final JsonNode tree, final int fromVersion) {
    JsonNode current = tree;
    for (int v = fromVersion; v < schemaVersion; v++) {
      UnaryOperator<ObjectNode> step = upgrades.get(v);
      if (step == null) {
        continue;
      }
      if (!(current instanceof ObjectNode objectNode)) {
        throw new MalformedSessionException("Session payload version " + v
            + " is not a JSON object and cannot be upgraded");
      }
      current = step.apply(objectNode);
      log.debug("Upgraded session payload from version {} to {}", v, v + 1);
    }
    return current;
  }
}
