package com.codeheadsystems.relman.server.keys;

import java.time.Instant;

/**
 * Reported alongside a key that was accepted although it has already expired.
 */
public class KeyExpiredException extends Exception {

  private final String fingerprint;
  private final Instant expiredAt;

  public KeyExpiredException(String fingerprint, Instant expiredAt) {
    super("Key " + fingerprint + " expired at " + expiredAt);
    this.fingerprint = fingerprint;
    this.expiredAt = expiredAt;
  }

  public String fingerprint() {
    return fingerprint;
  }

  public Instant expiredAt() {
    return expiredAt;
  }
}
