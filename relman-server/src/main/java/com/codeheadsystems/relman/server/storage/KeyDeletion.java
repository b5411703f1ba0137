package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.outcome.Outcomes;
import java.nio.file.Path;

/**
 * Result of deleting a key.
 *
 * @param fingerprint the deleted key
 * @param keysFiles   regeneration of the KEYS file of each committee the key was linked to
 */
public record KeyDeletion(String fingerprint, Outcomes<Path> keysFiles) {
}
