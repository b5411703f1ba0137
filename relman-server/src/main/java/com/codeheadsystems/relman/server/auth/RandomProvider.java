package com.codeheadsystems.relman.server.auth;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for signing secrets and personal access tokens.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates a URL-safe, unpadded base64 token from {@code len} random bytes.
   *
   * @param len the number of random bytes
   * @return the token text
   */
  public String urlSafeToken(int len) {
    return URL_SAFE.encodeToString(randomBytes(len));
  }
}
