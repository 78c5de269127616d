package com.codeheadsystems.tokenvault.server.codec;

import com.codeheadsystems.tokenvault.model.EncodedSession;

/**
 * Converts session payloads to and from the opaque form the artifact store persists.
 * <p>
 * {@code decode(encode(s), s.getClass())} must equal {@code s}. Payloads written by an older schema
 * version must still decode.
 */
public interface SessionCodec {

  /**
   * Encodes a session.
   *
   * @param session the session, not null
   * @return the encoded session tagged with the current schema version
   */
  EncodedSession encode(Object session);

  /**
   * Decodes a session into the caller's type.
   *
   * @param encoded the encoded session
   * @param type    the target type
   * @param <S>     the session type
   * @return the session
   * @throws com.codeheadsystems.tokenvault.server.exception.MalformedSessionException if the payload
   *                                                                                   cannot be decoded
   */
  <S> S decode(EncodedSession encoded, Class<S> type);
}
