package com.codeheadsystems.relman.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * A unit of work against a {@link StorageBackend}.
 * <p>
 * Changes are visible to this transaction immediately and to everyone else only after
 * {@link #commit()}. A transaction is finished by exactly one of {@link #commit()} or
 * {@link #rollback()}; any call afterwards fails with {@link IllegalStateException}.
 */
public interface StorageTransaction {

  Optional<PublicSigningKey> loadKey(String fingerprint);

  /**
   * Every stored key, ordered by fingerprint.
   *
   * @return the keys
   */
  List<PublicSigningKey> allKeys();

  /**
   * Inserts or replaces a key.
   *
   * @param key the key
   */
  void storeKey(PublicSigningKey key);

  /**
   * Deletes a key and all of its committee links.
   *
   * @param fingerprint the key
   * @return true if the key existed
   */
  boolean deleteKey(String fingerprint);

  /**
   * Fingerprints linked to a committee, sorted.
   *
   * @param committee committee name
   * @return the fingerprints
   */
  SortedSet<String> committeeFingerprints(String committee);

  /**
   * Committees a key is linked to, sorted.
   *
   * @param fingerprint the key
   * @return the committee names
   */
  SortedSet<String> keyCommittees(String fingerprint);

  /**
   * Links a key to a committee.
   *
   * @return true if the link is new
   */
  boolean link(String committee, String fingerprint);

  /**
   * Removes a link.
   *
   * @return true if the link existed
   */
  boolean unlink(String committee, String fingerprint);

  void storePat(PersonalAccessToken pat);

  /**
   * Records a successful exchange on the committed token, leaving every other field as it is
   * at commit time.
   *
   * @param id   token id
   * @param when exchange time
   * @return true if the token exists
   */
  boolean markPatUsed(String id, Instant when);

  /**
   * Marks a token revoked. Applied to the committed token, so a concurrent
   * {@link #markPatUsed(String, Instant)} cannot restore it.
   *
   * @param id token id
   * @return true if the token exists
   */
  boolean revokePat(String id);

  Optional<PersonalAccessToken> loadPat(String id);

  Optional<PersonalAccessToken> findPatByHash(String tokenHash);

  /**
   * Tokens owned by a user, oldest first.
   *
   * @param uid owner
   * @return the tokens
   */
  List<PersonalAccessToken> patsFor(String uid);

  void commit();

  void rollback();
}
