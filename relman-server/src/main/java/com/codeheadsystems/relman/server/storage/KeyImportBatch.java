package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.outcome.Outcome;
import com.codeheadsystems.relman.server.outcome.Outcomes;
import java.nio.file.Path;

/**
 * Result of importing a KEYS file into a committee.
 *
 * @param committee committee name
 * @param imports   one entry per key block, keyed {@code key-1}, {@code key-2}, ...
 * @param keysFile  regeneration of the committee's KEYS file
 */
public record KeyImportBatch(String committee, Outcomes<KeyImport> imports, Outcome<Path> keysFile) {
}
