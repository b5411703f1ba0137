package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.keys.KeyExpiredException;
import com.codeheadsystems.relman.server.keys.KeyParseException;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Key upserts shared by the committer and participant capabilities.
 */
final class KeyImports {

  private KeyImports() {
  }

  /**
   * Parses and stores one key.
   *
   * @param owner uid recorded when the key declares none, null to leave it unknown
   */
  static Outcome<KeyImport> store(StorageSession session, String armored, String owner) {
    return parse(session, armored, owner)
        .map(key -> upsert(session, key));
  }

  /**
   * Parses and stores one key, then links it to a committee.
   *
   * @param linkCheck throws {@link AccessDeniedException} when the caller may not link the key;
   *                  the key is then neither stored nor linked
   */
  static Outcome<KeyImport> storeAndLink(StorageSession session, String committee, String armored, String owner,
                                         Consumer<PublicSigningKey> linkCheck) {
    return parse(session, armored, owner)
        .map(key -> {
          linkCheck.accept(key);
          KeyImport stored = upsert(session, key);
          boolean linked = link(session, committee, key.fingerprint());
          return new KeyImport(status(stored.status() == KeyStatus.INSERTED, linked), stored.key());
        });
  }

  /**
   * Links a key to a committee unless already linked.
   *
   * @return true if the link is new
   */
  static boolean link(StorageSession session, String committee, String fingerprint) {
    if (session.records().committeeFingerprints(committee).contains(fingerprint)) {
      return false;
    }
    return session.mutate("link-key", committee + "/" + fingerprint,
        () -> session.records().link(committee, fingerprint));
  }

  static KeyStatus status(boolean inserted, boolean linked) {
    if (inserted) {
      return linked ? KeyStatus.INSERTED_AND_LINKED : KeyStatus.INSERTED;
    }
    return linked ? KeyStatus.LINKED : KeyStatus.PARSED;
  }

  private static KeyImport upsert(StorageSession session, PublicSigningKey key) {
    Optional<PublicSigningKey> existing = session.records().loadKey(key.fingerprint());
    if (existing.isPresent()) {
      return new KeyImport(KeyStatus.PARSED, existing.get());
    }
    session.mutate("store-key", key.fingerprint(), () -> {
      session.records().storeKey(key);
      return key;
    });
    return new KeyImport(KeyStatus.INSERTED, key);
  }

  private static Outcome<PublicSigningKey> parse(StorageSession session, String armored, String owner) {
    PublicSigningKey key;
    try {
      key = session.manager().keyParser().parse(armored);
    } catch (KeyParseException e) {
      return Outcome.failure(e);
    }
    if (key.apacheUid() == null && owner != null) {
      key = key.withApacheUid(owner);
    }
    Instant now = session.manager().clock().instant();
    if (key.expires() != null && !now.isBefore(key.expires())) {
      return Outcome.warning(key, new KeyExpiredException(key.fingerprint(), key.expires()));
    }
    return Outcome.success(key);
  }
}
