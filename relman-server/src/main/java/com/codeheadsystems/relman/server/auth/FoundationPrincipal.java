package com.codeheadsystems.relman.server.auth;

import java.security.Principal;
import java.util.Objects;

/**
 * An authenticated foundation user.
 * <p>
 * Built when a credential is verified and discarded with the request; never persisted.
 *
 * @param uid    foundation user id
 * @param method how the identity was established
 * @param jti    JWT id when {@code method} is {@link AuthenticationMethod#SESSION_TOKEN}, otherwise null
 */
public record FoundationPrincipal(String uid, AuthenticationMethod method, String jti) implements Principal {

  public FoundationPrincipal {
    if (uid == null || uid.isBlank()) {
      throw new IllegalArgumentException("Principal requires a user id");
    }
    Objects.requireNonNull(method, "method");
  }

  /**
   * A user signed in through the identity provider.
   *
   * @param uid foundation user id
   * @return the principal
   */
  public static FoundationPrincipal signedIn(String uid) {
    return new FoundationPrincipal(uid, AuthenticationMethod.IDENTITY_PROVIDER, null);
  }

  @Override
  public String getName() {
    return uid;
  }
}
