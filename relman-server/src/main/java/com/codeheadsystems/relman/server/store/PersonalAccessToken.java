package com.codeheadsystems.relman.server.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored form of a personal access token. Holds the SHA3-256 hash of the plaintext, never the
 * plaintext itself.
 *
 * @param id        token id
 * @param uid       owner
 * @param tokenHash SHA3-256 of the plaintext, lower-case hex
 * @param label     user-facing description
 * @param created   issuance time
 * @param expires   expiry time
 * @param lastUsed  last successful exchange for a session token, null if never used
 * @param revoked   whether the owner or an administrator revoked it
 */
public record PersonalAccessToken(
    String id,
    String uid,
    String tokenHash,
    String label,
    Instant created,
    Instant expires,
    Instant lastUsed,
    boolean revoked) {

  public PersonalAccessToken {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(uid, "uid");
    Objects.requireNonNull(tokenHash, "tokenHash");
    Objects.requireNonNull(created, "created");
    Objects.requireNonNull(expires, "expires");
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expires);
  }

  public PersonalAccessToken withLastUsed(Instant when) {
    return new PersonalAccessToken(id, uid, tokenHash, label, created, expires, when, revoked);
  }

  public PersonalAccessToken asRevoked() {
    return new PersonalAccessToken(id, uid, tokenHash, label, created, expires, lastUsed, true);
  }

  @Override
  public String toString() {
    return "PersonalAccessToken[id=" + id + ", uid=" + uid + ", label=" + label
        + ", expires=" + expires + ", revoked=" + revoked + "]";
  }
}
