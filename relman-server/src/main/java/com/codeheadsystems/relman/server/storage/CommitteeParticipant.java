package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.outcome.Outcome;

/**
 * Operations for a member or committer of one committee.
 */
public sealed interface CommitteeParticipant extends FoundationCommitter
    permits CommitteeMember, CommitteeParticipantAccess {

  String committee();

  /**
   * Links a stored key to the committee and regenerates its KEYS file. Participants may link
   * only their own keys; members and administrators may link any key.
   *
   * @param fingerprint the key
   * @return the link; a failure when the key is missing or may not be linked by the caller
   */
  Outcome<KeyLink> associateFingerprint(String fingerprint);

  /**
   * Imports every key in a KEYS file and links them all to the committee. Each key block is
   * reported separately; a bad block never stops the others.
   *
   * @param keysFileText KEYS file content
   * @return per-key outcomes and the KEYS file regeneration
   */
  KeyImportBatch ensureAssociated(String keysFileText);
}
