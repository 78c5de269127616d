package com.codeheadsystems.tokenvault.server.manager;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a revocation by request id.
 *
 * @param requestId   the request id
 * @param removed     artifacts removed, per kind that was processed successfully
 * @param failedKinds kinds whose deletion failed or was never attempted
 */
public record RevocationResult(
    String requestId,
    Map<ArtifactKind, Integer> removed,
    Set<ArtifactKind> failedKinds) {

  public RevocationResult {
    // Enum collections keep cascade order in logs.
    removed = removed.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new EnumMap<>(removed));
    failedKinds = failedKinds.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(failedKinds));
  }

  /**
   * True when every kind was processed.
   *
   * @return true if complete
   */
  public boolean isComplete() {
    return failedKinds.isEmpty();
  }

  /**
   * Total artifacts removed across kinds.
   *
   * @return the total
   */
  public int totalRemoved() {
    return removed.values().stream().mapToInt(Integer::intValue).sum();
  }
}
