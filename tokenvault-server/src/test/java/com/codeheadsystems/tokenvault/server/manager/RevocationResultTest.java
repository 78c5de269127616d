package com.codeheadsystems.tokenvault.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RevocationResultTest {

  @Test
  void constructor_anyInputOrder_iteratesInKindOrder() {
    Map<ArtifactKind, Integer> removed = new HashMap<>();
    removed.put(ArtifactKind.OIDC_SESSION, 1);
    removed.put(ArtifactKind.ACCESS_TOKEN, 2);
    removed.put(ArtifactKind.REFRESH_TOKEN, 3);
    Set<ArtifactKind> failed = new HashSet<>(Set.of(ArtifactKind.PKCE, ArtifactKind.AUTHORIZE_CODE));

    RevocationResult result = new RevocationResult("req-1", removed, failed);

    assertThat(result.removed().keySet())
        .containsExactly(ArtifactKind.ACCESS_TOKEN, ArtifactKind.REFRESH_TOKEN, ArtifactKind.OIDC_SESSION);
    assertThat(result.failedKinds()).containsExactly(ArtifactKind.AUTHORIZE_CODE, ArtifactKind.PKCE);
    assertThat(result.removed().toString()).isEqualTo("{ACCESS_TOKEN=2, REFRESH_TOKEN=3, OIDC_SESSION=1}");
    assertThat(result.totalRemoved()).isEqualTo(6);
    assertThat(result.isComplete()).isFalse();
  }

  @Test
  void constructor_copiesInputs_andIsUnmodifiable() {
    Map<ArtifactKind, Integer> removed = new HashMap<>(Map.of(ArtifactKind.ACCESS_TOKEN, 1));
    RevocationResult result = new RevocationResult("req-1", removed, Set.of());

    removed.put(ArtifactKind.PKCE, 5);

    assertThat(result.removed()).containsOnlyKeys(ArtifactKind.ACCESS_TOKEN);
    assertThat(result.isComplete()).isTrue();
    assertThatThrownBy(() -> result.removed().put(ArtifactKind.PKCE, 1))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> result.failedKinds().add(ArtifactKind.PKCE))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void constructor_emptyInputs_allowed() {
    RevocationResult result = new RevocationResult("req-1", Map.of(), Set.of());

    assertThat(result.removed()).isEmpty();
    assertThat(result.failedKinds()).isEmpty();
  }
}
