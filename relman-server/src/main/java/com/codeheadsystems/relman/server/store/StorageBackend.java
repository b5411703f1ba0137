package com.codeheadsystems.relman.server.store;

/**
 * Transactional record store for signing keys, committee key links and personal access tokens.
 * <p>
 * Implementations must be thread-safe; transactions are not.
 */
public interface StorageBackend {

  /**
   * Begins a transaction.
   *
   * @return the transaction
   * @throws StorageUnavailableException when the store cannot be reached
   */
  StorageTransaction begin();
}
