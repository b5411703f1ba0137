package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.outcome.Outcome;
import java.nio.file.Path;

/**
 * Operations reserved for committee members and administrators.
 */
public sealed interface CommitteeMember extends CommitteeParticipant permits CommitteeMemberAccess {

  /**
   * Unlinks a key from the committee and regenerates its KEYS file. The key itself stays stored.
   */
  Outcome<KeyLink> dissociateFingerprint(String fingerprint);

  /**
   * Rewrites the committee's KEYS file from the stored links.
   */
  Outcome<Path> autogenerateKeysFile();

  /**
   * Unlinks every key from the committee, deletes keys no other committee references, and
   * regenerates the KEYS file. Administrators only; for anyone else the outcome is a failure
   * with {@link AccessDeniedException} INSUFFICIENT_PRIVILEGE and nothing changes.
   */
  Outcome<CommitteeKeysRemoval> removeAllKeys();
}
