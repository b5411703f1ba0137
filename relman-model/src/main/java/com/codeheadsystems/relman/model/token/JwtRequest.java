package com.codeheadsystems.relman.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for exchanging a personal access token (PAT) for a short-lived JWT.
 * <p>
 * This is the only path from a long-lived credential to a session token, so the endpoint
 * accepting it is reachable without a bearer token. The PAT travels in the body and never in
 * the URL.
 * <p>
 * Used by: {@code POST /api/jwt}
 *
 * @param asfuid foundation user id that owns the PAT
 * @param pat    plaintext personal access token
 */
public record JwtRequest(
    @JsonProperty("asfuid") String asfuid,
    @JsonProperty("pat") String pat) {

  /**
   * User id, validated.
   *
   * @return the user id
   * @throws IllegalArgumentException if the field is missing
   */
  public String uid() {
    return required(asfuid, "asfuid");
  }

  /**
   * Plaintext PAT, validated.
   *
   * @return the plaintext token
   * @throws IllegalArgumentException if the field is missing
   */
  public String plaintextPat() {
    return required(pat, "pat");
  }

  @Override
  public String toString() {
    return "JwtRequest[asfuid=" + asfuid + ", pat=<redacted>]";
  }

  private static String required(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }
}
