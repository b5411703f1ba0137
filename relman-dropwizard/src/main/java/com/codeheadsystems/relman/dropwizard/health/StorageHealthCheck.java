package com.codeheadsystems.relman.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.relman.server.store.ArtifactStore;
import com.codeheadsystems.relman.server.store.ArtifactTransaction;
import com.codeheadsystems.relman.server.store.StorageBackend;
import com.codeheadsystems.relman.server.store.StorageTransaction;
import com.codeheadsystems.relman.server.store.StorageUnavailableException;

/**
 * Health check that opens and rolls back a transaction on each store.
 */
public class StorageHealthCheck extends HealthCheck {

  private final StorageBackend storageBackend;
  private final ArtifactStore artifactStore;

  /**
   * Instantiates a new Storage health check.
   *
   * @param storageBackend the record store
   * @param artifactStore  the artifact store
   */
  public StorageHealthCheck(StorageBackend storageBackend, ArtifactStore artifactStore) {
    this.storageBackend = storageBackend;
    this.artifactStore = artifactStore;
  }

  @Override
  protected Result check() {
    try {
      StorageTransaction records = storageBackend.begin();
      records.rollback();
      ArtifactTransaction artifacts = artifactStore.begin();
      artifacts.rollback();
    } catch (StorageUnavailableException e) {
      return Result.unhealthy(e.getMessage());
    }
    return Result.healthy("record and artifact stores reachable");
  }
}
