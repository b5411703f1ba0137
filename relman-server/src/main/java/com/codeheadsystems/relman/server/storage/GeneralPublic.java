package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Operations open to anyone, authenticated or not.
 * <p>
 * Capabilities are handed out only by {@link StorageSession} after an eligibility check and
 * stop working once their session is closed.
 */
public sealed interface GeneralPublic permits FoundationCommitter, GeneralPublicAccess {

  PrivilegeLevel level();

  /**
   * Looks up a key by fingerprint.
   *
   * @param fingerprint hex fingerprint, any case
   * @return the key
   */
  Optional<PublicSigningKey> key(String fingerprint);

  /**
   * Every stored key, ordered by fingerprint.
   *
   * @return the keys
   */
  List<PublicSigningKey> keys();

  /**
   * Keys linked to a committee, ordered by fingerprint.
   *
   * @param committee committee name
   * @return the keys
   */
  List<PublicSigningKey> committeeKeys(String committee);

  /**
   * Committees a key is linked to, sorted.
   *
   * @param fingerprint hex fingerprint, any case
   * @return the committee names
   */
  SortedSet<String> keyCommittees(String fingerprint);

  /**
   * Exchanges a personal access token for a session token.
   *
   * @param uid       the user the token claims to belong to
   * @param plaintext the personal access token
   * @return a fresh session token
   * @throws com.codeheadsystems.relman.server.auth.TokenException with reason INVALID_CREDENTIAL,
   *                                                               EXPIRED or REVOKED
   */
  SessionToken issueJwt(String uid, String plaintext);
}
