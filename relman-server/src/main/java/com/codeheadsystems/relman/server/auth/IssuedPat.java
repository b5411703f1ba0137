package com.codeheadsystems.relman.server.auth;

import com.codeheadsystems.relman.server.store.PersonalAccessToken;

/**
 * A freshly issued personal access token. The plaintext exists only here and is never stored.
 *
 * @param plaintext the secret to hand to the user once
 * @param token     the stored record
 */
public record IssuedPat(String plaintext, PersonalAccessToken token) {

  @Override
  public String toString() {
    return "IssuedPat[plaintext=<redacted>, token=" + token + "]";
  }
}
