package com.codeheadsystems.tokenvault.springboot.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.server.exception.StoreUnavailableException;
import com.codeheadsystems.tokenvault.server.store.ArtifactStore;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class ArtifactStoreHealthIndicatorTest {

  @Mock private ArtifactStore artifactStore;

  @Test
  void health_storeReachable_upWithCountPerNamespace() {
    when(artifactStore.count(any())).thenReturn(0);
    when(artifactStore.count(ArtifactKind.ACCESS_TOKEN)).thenReturn(7);

    Health health = new ArtifactStoreHealthIndicator(artifactStore).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("access_tokens", 7)
        .containsEntry("refresh_tokens", 0)
        .containsKeys("authorize_codes", "pkce_requests", "oidc_sessions");
  }

  @Test
  void health_storeUnavailable_down() {
    when(artifactStore.count(any())).thenThrow(
        new StoreUnavailableException("down", new IOException("connection refused")));

    Health health = new ArtifactStoreHealthIndicator(artifactStore).health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsKey("reason");
  }
}
