package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.store.PublicSigningKey;

/**
 * Result of importing one key.
 *
 * @param status what changed
 * @param key    the key as stored
 */
public record KeyImport(KeyStatus status, PublicSigningKey key) {
}
