package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.PatGenerator;
import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.auth.TokenException;
import com.codeheadsystems.relman.server.store.PersonalAccessToken;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class GeneralPublicAccess implements GeneralPublic {

  private static final Logger log = LoggerFactory.getLogger(GeneralPublicAccess.class);

  private final StorageSession session;

  GeneralPublicAccess(StorageSession session) {
    this.session = session;
  }

  @Override
  public PrivilegeLevel level() {
    return PrivilegeLevel.GENERAL_PUBLIC;
  }

  @Override
  public Optional<PublicSigningKey> key(String fingerprint) {
    session.checkOpen();
    if (fingerprint == null || fingerprint.isBlank()) {
      return Optional.empty();
    }
    return session.records().loadKey(PublicSigningKey.normalize(fingerprint));
  }

  @Override
  public List<PublicSigningKey> keys() {
    session.checkOpen();
    return session.records().allKeys();
  }

  @Override
  public List<PublicSigningKey> committeeKeys(String committee) {
    session.checkOpen();
    return CommitteeKeysFiles.keys(session, committee);
  }

  @Override
  public SortedSet<String> keyCommittees(String fingerprint) {
    session.checkOpen();
    return session.records().keyCommittees(PublicSigningKey.normalize(fingerprint));
  }

  @Override
  public SessionToken issueJwt(String uid, String plaintext) {
    session.checkOpen();
    if (uid == null || uid.isBlank() || plaintext == null || plaintext.isBlank()) {
      throw new TokenException(TokenException.Reason.INVALID_CREDENTIAL, "Invalid personal access token");
    }
    PersonalAccessToken pat = session.records().findPatByHash(PatGenerator.hash(plaintext))
        .filter(found -> found.uid().equals(uid))
        .orElseThrow(() -> {
          log.debug("No matching personal access token for uid={}", uid);
          return new TokenException(TokenException.Reason.INVALID_CREDENTIAL, "Invalid personal access token");
        });
    if (pat.revoked()) {
      throw new TokenException(TokenException.Reason.REVOKED, "Personal access token has been revoked");
    }
    Instant now = session.manager().clock().instant();
    if (pat.isExpired(now)) {
      throw new TokenException(TokenException.Reason.EXPIRED, "Personal access token has expired");
    }
    session.mutate("use-pat", pat.id(), () -> {
      session.records().markPatUsed(pat.id(), now);
      return pat.id();
    });
    return session.manager().jwtManager().issue(uid);
  }
}
