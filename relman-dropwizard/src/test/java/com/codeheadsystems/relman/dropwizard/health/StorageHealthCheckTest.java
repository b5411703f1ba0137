package com.codeheadsystems.relman.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.relman.server.store.ArtifactStore;
import com.codeheadsystems.relman.server.store.ArtifactTransaction;
import com.codeheadsystems.relman.server.store.StorageBackend;
import com.codeheadsystems.relman.server.store.StorageTransaction;
import com.codeheadsystems.relman.server.store.StorageUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StorageHealthCheckTest {

  @Mock private StorageBackend storageBackend;
  @Mock private ArtifactStore artifactStore;
  @Mock private StorageTransaction records;
  @Mock private ArtifactTransaction artifacts;

  @Test
  void bothStoresReachable_healthy() {
    when(storageBackend.begin()).thenReturn(records);
    when(artifactStore.begin()).thenReturn(artifacts);

    HealthCheck.Result result = new StorageHealthCheck(storageBackend, artifactStore).execute();

    assertThat(result.isHealthy()).isTrue();
    verify(records).rollback();
    verify(artifacts).rollback();
  }

  @Test
  void recordStoreDown_unhealthy() {
    when(storageBackend.begin()).thenThrow(new StorageUnavailableException("database down"));

    HealthCheck.Result result = new StorageHealthCheck(storageBackend, artifactStore).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).isEqualTo("database down");
  }

  @Test
  void artifactStoreDown_unhealthy() {
    when(storageBackend.begin()).thenReturn(records);
    when(artifactStore.begin()).thenThrow(new StorageUnavailableException("not writable"));

    HealthCheck.Result result = new StorageHealthCheck(storageBackend, artifactStore).execute();

    assertThat(result.isHealthy()).isFalse();
    verify(records).rollback();
  }
}
