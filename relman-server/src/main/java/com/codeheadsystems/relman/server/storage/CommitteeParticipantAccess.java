package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.IssuedPat;
import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.keys.KeysFileRenderer;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.outcome.Outcomes;
import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

final class CommitteeParticipantAccess implements CommitteeParticipant {

  private final StorageSession session;
  private final String committee;
  private final FoundationCommitterAccess committer;

  CommitteeParticipantAccess(StorageSession session, String committee, FoundationCommitterAccess committer) {
    this.session = session;
    this.committee = committee;
    this.committer = committer;
  }

  @Override
  public PrivilegeLevel level() {
    return PrivilegeLevel.COMMITTEE_PARTICIPANT;
  }

  @Override
  public Optional<PublicSigningKey> key(String fingerprint) {
    return committer.key(fingerprint);
  }

  @Override
  public List<PublicSigningKey> keys() {
    return committer.keys();
  }

  @Override
  public List<PublicSigningKey> committeeKeys(String name) {
    return committer.committeeKeys(name);
  }

  @Override
  public SortedSet<String> keyCommittees(String fingerprint) {
    return committer.keyCommittees(fingerprint);
  }

  @Override
  public SessionToken issueJwt(String uid, String plaintext) {
    return committer.issueJwt(uid, plaintext);
  }

  @Override
  public String uid() {
    return committer.uid();
  }

  @Override
  public IssuedPat issuePat(String label) {
    return committer.issuePat(label);
  }

  @Override
  public void revokePat(String ownerUid, String patId) {
    committer.revokePat(ownerUid, patId);
  }

  @Override
  public List<PersonalAccessToken> pats() {
    return committer.pats();
  }

  @Override
  public Outcome<KeyImport> ensureStored(String armoredKey) {
    return committer.ensureStored(armoredKey);
  }

  @Override
  public Outcome<KeyDeletion> deleteKey(String fingerprint) {
    return committer.deleteKey(fingerprint);
  }

  @Override
  public String committee() {
    return committee;
  }

  @Override
  public Outcome<KeyLink> associateFingerprint(String fingerprint) {
    session.checkOpen();
    String normalized = PublicSigningKey.normalize(Objects.requireNonNull(fingerprint, "fingerprint"));
    Optional<PublicSigningKey> key = session.records().loadKey(normalized);
    if (key.isEmpty()) {
      return Outcome.failure(new NotFoundException("No key " + normalized));
    }
    try {
      checkMayLink(key.get());
    } catch (AccessDeniedException e) {
      return Outcome.failure(e);
    }
    boolean changed = KeyImports.link(session, committee, normalized);
    return Outcome.success(new KeyLink(committee, normalized, changed, keysFile(changed)));
  }

  @Override
  public KeyImportBatch ensureAssociated(String keysFileText) {
    session.checkOpen();
    List<String> blocks = session.manager().keyParser().splitBlocks(keysFileText);
    Outcomes<KeyImport> imports = new Outcomes<>();
    for (int i = 0; i < blocks.size(); i++) {
      imports.append("key-" + (i + 1),
          KeyImports.storeAndLink(session, committee, blocks.get(i), null, this::checkMayLink));
    }
    boolean changed = imports.resultPredicateCount(imported -> imported.status().changed()) > 0;
    return new KeyImportBatch(committee, imports, keysFile(changed));
  }

  /**
   * Regenerates the KEYS file when links changed; otherwise reports where it already is.
   */
  Outcome<Path> keysFile(boolean changed) {
    if (changed) {
      return CommitteeKeysFiles.regenerate(session, committee);
    }
    return Outcome.attempt(() -> session.manager().artifactStore().location(committee, KeysFileRenderer.FILE_NAME));
  }

  StorageSession session() {
    return session;
  }

  boolean isAdministrator() {
    return committer.isAdministrator();
  }

  /**
   * Committers who are not members link only keys they own.
   */
  private void checkMayLink(PublicSigningKey key) {
    if (uid().equals(key.apacheUid()) || isAdministrator() || session.directory().isMember(uid(), committee)) {
      return;
    }
    throw new AccessDeniedException(AccessDeniedException.Reason.FORBIDDEN,
        uid() + " may only link their own keys to " + committee);
  }
}
