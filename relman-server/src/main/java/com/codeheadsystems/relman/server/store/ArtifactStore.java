package com.codeheadsystems.relman.server.store;

import java.nio.file.Path;

/**
 * Filesystem artifacts derived from stored records, such as per-committee KEYS files.
 */
public interface ArtifactStore {

  /**
   * Begins staging artifacts.
   *
   * @return the transaction
   * @throws StorageUnavailableException when the artifact root cannot be used
   */
  ArtifactTransaction begin();

  /**
   * Where a committee's artifact lives once published.
   *
   * @param committee committee name
   * @param name      file name
   * @return the published path
   */
  Path location(String committee, String name);
}
