package com.codeheadsystems.relman.server.storage;

/**
 * What importing a key changed.
 */
public enum KeyStatus {
  /** Already stored (and linked, for committee imports); nothing changed. */
  PARSED,
  /** Newly stored. */
  INSERTED,
  /** Already stored, newly linked to the committee. */
  LINKED,
  /** Newly stored and linked to the committee. */
  INSERTED_AND_LINKED;

  public boolean changed() {
    return this != PARSED;
  }
}
