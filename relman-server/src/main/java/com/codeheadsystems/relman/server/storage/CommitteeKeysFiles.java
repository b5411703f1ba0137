package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.keys.KeysFileRenderer;
import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Regenerates a committee's KEYS file from the links visible in a session.
 */
final class CommitteeKeysFiles {

  private CommitteeKeysFiles() {
  }

  static List<PublicSigningKey> keys(StorageSession session, String committee) {
    return session.records().committeeFingerprints(committee).stream()
        .map(fingerprint -> session.records().loadKey(fingerprint))
        .flatMap(Optional::stream)
        .toList();
  }

  static Outcome<Path> regenerate(StorageSession session, String committee) {
    return Outcome.attempt(() -> {
      String content = session.manager().renderer()
          .render(committee, keys(session, committee), session.manager().clock().instant());
      return session.mutate("write-keys-file", committee, () -> {
        try {
          return session.artifacts().write(committee, KeysFileRenderer.FILE_NAME, content);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    });
  }
}
