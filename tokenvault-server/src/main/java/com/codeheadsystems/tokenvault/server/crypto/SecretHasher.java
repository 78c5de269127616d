package com.codeheadsystems.tokenvault.server.crypto;

/**
 * One-way hashing of client secrets. A stored hash is only ever checked through {@link #matches},
 * never compared to cleartext.
 */
public interface SecretHasher {

  /**
   * Hashes a cleartext secret.
   *
   * @param secret the cleartext secret, not empty
   * @return the hash
   */
  byte[] hash(byte[] secret);

  /**
   * Checks a cleartext secret against a stored hash.
   *
   * @param hashed the stored hash
   * @param secret the cleartext secret presented by the client
   * @return true if they match
   */
  boolean matches(byte[] hashed, byte[] secret);
}
