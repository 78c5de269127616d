package com.codeheadsystems.tokenvault.server.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecretHasher} producing OpenBSD-style bcrypt strings ({@code $2y$<cost>$...}) with
 * Bouncy Castle.
 * <p>
 * bcrypt only considers the first 72 bytes of a secret, so longer secrets are rejected.
 */
public class BCryptSecretHasher implements SecretHasher {

  private static final Logger log = LoggerFactory.getLogger(BCryptSecretHasher.class);

  /**
   * Default work factor.
   */
  public static final int DEFAULT_COST = 12;

  private static final int MIN_COST = 4;
  private static final int MAX_COST = 31;
  private static final int SALT_LENGTH = 16;
  private static final int MAX_SECRET_LENGTH = 72;

  private final int cost;
  private final SecureRandom random;

  /**
   * Hasher at {@link #DEFAULT_COST}.
   */
  public BCryptSecretHasher() {
    this(DEFAULT_COST, new SecureRandom());
  }

  /**
   * Creates a new hasher.
   *
   * @param cost   bcrypt work factor, 4 to 31
   * @param random salt source
   */
  public BCryptSecretHasher(final int cost, final SecureRandom random) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and "
          + MAX_COST + ": " + cost);
    }
    this.cost = cost;
    this.random = random;
    log.info("BCryptSecretHasher(cost={})", cost);
  }

  @Override
  public byte[] hash(final byte[] secret) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("Secret must not be empty");
    }
    if (secret.length > MAX_SECRET_LENGTH) {
      throw new IllegalArgumentException("Secret must be at most " + MAX_SECRET_LENGTH + " bytes");
    }
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    char[] password = toChars(secret);
    try {
      return OpenBSDBCrypt.generate(password, salt, cost).getBytes(StandardCharsets.US_ASCII);
    } finally {
      Arrays.fill(password, '\0');
    }
  }

  @Override
  public boolean matches(final byte[] hashed, final byte[] secret) {
    if (hashed == null || hashed.length == 0 || secret == null || secret.length == 0
        || secret.length > MAX_SECRET_LENGTH) {
      return false;
    }
    char[] password = toChars(secret);
    try {
      return OpenBSDBCrypt.checkPassword(new String(hashed, StandardCharsets.US_ASCII), password);
    } catch (IllegalArgumentException | DataLengthException e) {
      // Not a bcrypt string: treat as a mismatch, the stored value is unusable.
      log.warn("Stored secret hash is not a valid bcrypt string: {}", e.getMessage());
      return false;
    } finally {
      Arrays.fill(password, '\0');
    }
  }

  private static char[] toChars(final byte[] secret) {
    return new String(secret, StandardCharsets.UTF_8).toCharArray();
  }
}
