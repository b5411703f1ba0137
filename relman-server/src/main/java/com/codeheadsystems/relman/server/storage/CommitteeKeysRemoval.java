package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.outcome.Outcome;
import java.nio.file.Path;
import java.util.List;

/**
 * Result of removing every key from a committee.
 *
 * @param committee   committee name
 * @param unlinked    fingerprints unlinked from the committee
 * @param deletedKeys fingerprints deleted because no committee referenced them any more
 * @param keysFile    regeneration of the committee's now empty KEYS file
 */
public record CommitteeKeysRemoval(String committee, List<String> unlinked, List<String> deletedKeys,
                                   Outcome<Path> keysFile) {

  public CommitteeKeysRemoval {
    unlinked = List.copyOf(unlinked);
    deletedKeys = List.copyOf(deletedKeys);
  }
}
