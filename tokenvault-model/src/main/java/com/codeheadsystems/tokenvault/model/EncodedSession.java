package com.codeheadsystems.tokenvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Objects;

/**
 * A session payload after encoding. The store persists it as-is and never looks inside.
 *
 * @param type    diagnostic name of the encoded type; never used to pick a class when decoding
 * @param version schema version the payload was written with
 * @param payload the encoded bytes
 */
public record EncodedSession(
    @JsonProperty("type") String type,
    @JsonProperty("version") int version,
    @JsonProperty("payload") byte[] payload) {

  public EncodedSession {
    Objects.requireNonNull(payload, "payload");
    payload = payload.clone();
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof EncodedSession other
        && version == other.version
        && Objects.equals(type, other.type)
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(type, version) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "EncodedSession{type=" + type + ", version=" + version + ", bytes=" + payload.length + "}";
  }
}
