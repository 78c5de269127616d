package com.codeheadsystems.tokenvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Session payload for callers that do not bring their own session type.
 *
 * @param subject  the subject the artifact was issued for
 * @param username the end-user name, if any
 * @param extra    additional claims
 */
public record DefaultSession(
    @JsonProperty("subject") String subject,
    @JsonProperty("username") String username,
    @JsonProperty("extra") Map<String, Object> extra) {

  public DefaultSession {
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public DefaultSession(final String subject, final String username) {
    this(subject, username, Map.of());
  }
}
