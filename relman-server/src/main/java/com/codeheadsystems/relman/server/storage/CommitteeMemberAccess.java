package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.IssuedPat;
import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import com.codeheadsystems.relman.server.store.StorageTransaction;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

final class CommitteeMemberAccess implements CommitteeMember {

  private final CommitteeParticipantAccess participant;

  CommitteeMemberAccess(CommitteeParticipantAccess participant) {
    this.participant = participant;
  }

  @Override
  public PrivilegeLevel level() {
    return PrivilegeLevel.COMMITTEE_MEMBER;
  }

  @Override
  public Optional<PublicSigningKey> key(String fingerprint) {
    return participant.key(fingerprint);
  }

  @Override
  public List<PublicSigningKey> keys() {
    return participant.keys();
  }

  @Override
  public List<PublicSigningKey> committeeKeys(String committee) {
    return participant.committeeKeys(committee);
  }

  @Override
  public SortedSet<String> keyCommittees(String fingerprint) {
    return participant.keyCommittees(fingerprint);
  }

  @Override
  public SessionToken issueJwt(String uid, String plaintext) {
    return participant.issueJwt(uid, plaintext);
  }

  @Override
  public String uid() {
    return participant.uid();
  }

  @Override
  public IssuedPat issuePat(String label) {
    return participant.issuePat(label);
  }

  @Override
  public void revokePat(String ownerUid, String patId) {
    participant.revokePat(ownerUid, patId);
  }

  @Override
  public List<PersonalAccessToken> pats() {
    return participant.pats();
  }

  @Override
  public Outcome<KeyImport> ensureStored(String armoredKey) {
    return participant.ensureStored(armoredKey);
  }

  @Override
  public Outcome<KeyDeletion> deleteKey(String fingerprint) {
    return participant.deleteKey(fingerprint);
  }

  @Override
  public String committee() {
    return participant.committee();
  }

  @Override
  public Outcome<KeyLink> associateFingerprint(String fingerprint) {
    return participant.associateFingerprint(fingerprint);
  }

  @Override
  public KeyImportBatch ensureAssociated(String keysFileText) {
    return participant.ensureAssociated(keysFileText);
  }

  @Override
  public Outcome<KeyLink> dissociateFingerprint(String fingerprint) {
    StorageSession session = participant.session();
    session.checkOpen();
    String normalized = PublicSigningKey.normalize(Objects.requireNonNull(fingerprint, "fingerprint"));
    String committee = committee();
    boolean changed = false;
    if (session.records().committeeFingerprints(committee).contains(normalized)) {
      changed = session.mutate("unlink-key", committee + "/" + normalized,
          () -> session.records().unlink(committee, normalized));
    }
    return Outcome.success(new KeyLink(committee, normalized, changed, participant.keysFile(changed)));
  }

  @Override
  public Outcome<Path> autogenerateKeysFile() {
    participant.session().checkOpen();
    return participant.keysFile(true);
  }

  @Override
  public Outcome<CommitteeKeysRemoval> removeAllKeys() {
    StorageSession session = participant.session();
    session.checkOpen();
    String committee = committee();
    if (!participant.isAdministrator()) {
      return Outcome.failure(new AccessDeniedException(AccessDeniedException.Reason.INSUFFICIENT_PRIVILEGE,
          uid() + " is not an administrator"));
    }
    StorageTransaction records = session.records();
    List<String> unlinked = new ArrayList<>();
    List<String> deleted = new ArrayList<>();
    try {
      for (String fingerprint : records.committeeFingerprints(committee)) {
        session.mutate("unlink-key", committee + "/" + fingerprint, () -> records.unlink(committee, fingerprint));
        unlinked.add(fingerprint);
        if (records.keyCommittees(fingerprint).isEmpty()) {
          session.mutate("delete-key", fingerprint, () -> records.deleteKey(fingerprint));
          deleted.add(fingerprint);
        }
      }
    } catch (RuntimeException e) {
      return Outcome.failure(e, new CommitteeKeysRemoval(committee, unlinked, deleted, Outcome.failure(e)));
    }
    return Outcome.success(new CommitteeKeysRemoval(committee, unlinked, deleted, participant.keysFile(true)));
  }
}
