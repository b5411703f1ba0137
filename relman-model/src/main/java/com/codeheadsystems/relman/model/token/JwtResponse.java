package com.codeheadsystems.relman.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a freshly minted session token.
 * <p>
 * Used by: {@code POST /api/jwt} response
 *
 * @param asfuid the token subject
 * @param jwt    signed bearer token, valid for 90 minutes
 */
public record JwtResponse(
    @JsonProperty("asfuid") String asfuid,
    @JsonProperty("jwt") String jwt) {

  @Override
  public String toString() {
    return "JwtResponse[asfuid=" + asfuid + ", jwt=<redacted>]";
  }
}
