package com.codeheadsystems.relman.server.auth;

import java.util.Arrays;

/**
 * Process-wide HMAC-SHA256 key for session tokens.
 * <p>
 * Created once at startup and handed to {@link JwtManager}; there is no way to change it
 * afterwards. A new process generates a new secret, which invalidates every session token
 * issued before the restart.
 */
public final class SigningSecret {

  /**
   * Length of generated secrets in bytes.
   */
  public static final int LENGTH = 64;

  private final byte[] key;

  private SigningSecret(byte[] key) {
    this.key = key.clone();
  }

  /**
   * Generates a fresh random secret.
   *
   * @param randomProvider the source of randomness
   * @return the secret
   */
  public static SigningSecret generate(RandomProvider randomProvider) {
    return new SigningSecret(randomProvider.randomBytes(LENGTH));
  }

  /**
   * Wraps existing key material. Intended for tests that need two managers to share a key.
   *
   * @param key at least 32 bytes
   * @return the secret
   */
  public static SigningSecret of(byte[] key) {
    if (key == null || key.length < 32) {
      throw new IllegalArgumentException("Signing secret must be at least 32 bytes");
    }
    return new SigningSecret(key);
  }

  byte[] keyBytes() {
    return key.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SigningSecret other && Arrays.equals(key, other.key);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(key);
  }

  @Override
  public String toString() {
    return "SigningSecret[redacted]";
  }
}
