package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.IssuedPat;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import java.util.List;

/**
 * Operations for any foundation committer, acting on their own behalf.
 */
public sealed interface FoundationCommitter extends GeneralPublic
    permits CommitteeParticipant, FoundationCommitterAccess {

  String uid();

  /**
   * Issues a personal access token. Only callers who signed in through the identity provider
   * may do this.
   *
   * @param label user-facing description
   * @return the plaintext, shown once, and the stored record
   * @throws com.codeheadsystems.relman.server.auth.TokenException UNAUTHENTICATED for session-token callers
   */
  IssuedPat issuePat(String label);

  /**
   * Revokes a personal access token. Revoking an already revoked token does nothing.
   *
   * @param ownerUid the token's owner
   * @param patId    the token id
   * @throws AccessDeniedException FORBIDDEN unless the caller is the owner or an administrator
   * @throws NotFoundException     when the owner has no such token
   */
  void revokePat(String ownerUid, String patId);

  /**
   * The caller's personal access tokens, oldest first.
   */
  List<PersonalAccessToken> pats();

  /**
   * Stores a key unless it is already stored. Keys without a foundation user id are recorded
   * as belonging to the caller.
   *
   * @param armoredKey ASCII-armored public key
   * @return INSERTED or PARSED; a warning when the key has expired; a failure when it cannot be read
   */
  Outcome<KeyImport> ensureStored(String armoredKey);

  /**
   * Deletes one of the caller's keys and regenerates the KEYS file of every committee it was
   * linked to. Administrators may delete any key.
   *
   * @param fingerprint the key
   * @return the deletion, or a failure when the key is missing or not the caller's
   */
  Outcome<KeyDeletion> deleteKey(String fingerprint);
}
