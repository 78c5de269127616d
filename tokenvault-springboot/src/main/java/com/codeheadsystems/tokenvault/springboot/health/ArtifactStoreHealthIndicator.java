package com.codeheadsystems.tokenvault.springboot.health;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.server.exception.StoreUnavailableException;
import com.codeheadsystems.tokenvault.server.store.ArtifactStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class ArtifactStoreHealthIndicator implements HealthIndicator {

  private final ArtifactStore artifactStore;

  public ArtifactStoreHealthIndicator(ArtifactStore artifactStore) {
    this.artifactStore = artifactStore;
  }

  @Override
  public Health health() {
    Health.Builder builder = Health.up();
    try {
      for (ArtifactKind kind : ArtifactKind.values()) {
        builder.withDetail(kind.namespace(), artifactStore.count(kind));
      }
    } catch (StoreUnavailableException e) {
      return Health.down(e).withDetail("reason", "Artifact store is unreachable").build();
    }
    return builder.build();
  }
}
