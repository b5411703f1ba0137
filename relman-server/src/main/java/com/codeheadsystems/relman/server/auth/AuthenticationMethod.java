package com.codeheadsystems.relman.server.auth;

/**
 * How a {@link FoundationPrincipal} proved its identity.
 */
public enum AuthenticationMethod {

  /**
   * Signed in through the foundation's external identity provider (web login).
   */
  IDENTITY_PROVIDER,

  /**
   * Presented a session token (JWT) obtained by exchanging a personal access token.
   */
  SESSION_TOKEN
}
