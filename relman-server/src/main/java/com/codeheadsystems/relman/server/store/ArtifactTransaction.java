package com.codeheadsystems.relman.server.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Artifacts staged during a storage session. Nothing is visible at the published location
 * until {@link #commit()}.
 */
public interface ArtifactTransaction {

  /**
   * Stages an artifact, replacing anything staged earlier under the same name.
   *
   * @param committee committee name
   * @param name      file name
   * @param content   file content
   * @return the path the artifact is published to on commit
   * @throws IOException when the staging area cannot be written
   */
  Path write(String committee, String name, String content) throws IOException;

  /**
   * Publishes every staged artifact.
   *
   * @throws StorageUnavailableException when an artifact cannot be moved into place
   */
  void commit();

  /**
   * Discards every staged artifact.
   */
  void rollback();
}
