package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.outcome.Outcome;
import java.nio.file.Path;

/**
 * Result of linking or unlinking a key and a committee.
 *
 * @param committee   committee name
 * @param fingerprint key fingerprint
 * @param changed     whether the link set changed
 * @param keysFile    regeneration of the committee's KEYS file
 */
public record KeyLink(String committee, String fingerprint, boolean changed, Outcome<Path> keysFile) {
}
