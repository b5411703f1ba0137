package com.codeheadsystems.relman.server.auth;

import java.time.Instant;

/**
 * A signed session token and the claims it carries.
 *
 * @param token     compact JWT serialization
 * @param jti       unique token id
 * @param subject   foundation user id
 * @param issuedAt  issuance time
 * @param expiresAt expiry time
 */
public record SessionToken(String token, String jti, String subject, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "SessionToken[jti=" + jti + ", subject=" + subject + ", expiresAt=" + expiresAt + "]";
  }
}
