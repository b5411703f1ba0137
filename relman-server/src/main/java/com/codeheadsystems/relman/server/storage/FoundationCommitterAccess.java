package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.AuthenticationMethod;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.IssuedPat;
import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.auth.TokenException;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.outcome.Outcomes;
import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

final class FoundationCommitterAccess implements FoundationCommitter {

  private final StorageSession session;
  private final FoundationPrincipal principal;
  private final GeneralPublicAccess general;

  FoundationCommitterAccess(StorageSession session, FoundationPrincipal principal, GeneralPublicAccess general) {
    this.session = session;
    this.principal = principal;
    this.general = general;
  }

  @Override
  public PrivilegeLevel level() {
    return PrivilegeLevel.FOUNDATION_COMMITTER;
  }

  @Override
  public Optional<PublicSigningKey> key(String fingerprint) {
    return general.key(fingerprint);
  }

  @Override
  public List<PublicSigningKey> keys() {
    return general.keys();
  }

  @Override
  public List<PublicSigningKey> committeeKeys(String committee) {
    return general.committeeKeys(committee);
  }

  @Override
  public SortedSet<String> keyCommittees(String fingerprint) {
    return general.keyCommittees(fingerprint);
  }

  @Override
  public SessionToken issueJwt(String uid, String plaintext) {
    return general.issueJwt(uid, plaintext);
  }

  @Override
  public String uid() {
    return principal.uid();
  }

  @Override
  public IssuedPat issuePat(String label) {
    session.checkOpen();
    if (principal.method() != AuthenticationMethod.IDENTITY_PROVIDER) {
      throw new TokenException(TokenException.Reason.UNAUTHENTICATED,
          "Personal access tokens can only be issued after signing in through the identity provider");
    }
    IssuedPat issued = session.manager().patGenerator().generate(uid(), label == null ? "" : label.strip());
    session.mutate("issue-pat", issued.token().id(), () -> {
      session.records().storePat(issued.token());
      return issued.token().id();
    });
    return issued;
  }

  @Override
  public void revokePat(String ownerUid, String patId) {
    session.checkOpen();
    if (!uid().equals(ownerUid) && !isAdministrator()) {
      throw new AccessDeniedException(AccessDeniedException.Reason.FORBIDDEN,
          uid() + " may not revoke tokens of " + ownerUid);
    }
    PersonalAccessToken pat = session.records().loadPat(patId)
        .filter(found -> found.uid().equals(ownerUid))
        .orElseThrow(() -> new NotFoundException("No personal access token " + patId + " for " + ownerUid));
    if (pat.revoked()) {
      return;
    }
    session.mutate("revoke-pat", pat.id(), () -> {
      session.records().revokePat(pat.id());
      return pat.id();
    });
  }

  @Override
  public List<PersonalAccessToken> pats() {
    session.checkOpen();
    return session.records().patsFor(uid());
  }

  @Override
  public Outcome<KeyImport> ensureStored(String armoredKey) {
    session.checkOpen();
    return KeyImports.store(session, armoredKey, uid());
  }

  @Override
  public Outcome<KeyDeletion> deleteKey(String fingerprint) {
    session.checkOpen();
    String normalized = PublicSigningKey.normalize(Objects.requireNonNull(fingerprint, "fingerprint"));
    Optional<PublicSigningKey> key = session.records().loadKey(normalized);
    if (key.isEmpty()) {
      return Outcome.failure(new NotFoundException("No key " + normalized));
    }
    if (!uid().equals(key.get().apacheUid()) && !isAdministrator()) {
      return Outcome.failure(new AccessDeniedException(AccessDeniedException.Reason.FORBIDDEN,
          uid() + " does not own key " + normalized));
    }
    SortedSet<String> committees = session.records().keyCommittees(normalized);
    session.mutate("delete-key", normalized, () -> session.records().deleteKey(normalized));
    Outcomes<Path> keysFiles = new Outcomes<>();
    committees.forEach(committee -> keysFiles.append(committee, CommitteeKeysFiles.regenerate(session, committee)));
    return Outcome.success(new KeyDeletion(normalized, keysFiles));
  }

  boolean isAdministrator() {
    return session.directory().isAdministrator(uid());
  }
}
