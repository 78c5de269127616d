package com.codeheadsystems.tokenvault.server.store;

import com.codeheadsystems.tokenvault.model.ArtifactKind;
import com.codeheadsystems.tokenvault.model.StoredArtifact;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ArtifactStore}, one {@link ConcurrentHashMap} per kind.
 * <p>
 * Expired artifacts are kept until {@link #deleteExpired} is called; callers evaluate expiry on read.
 * All artifacts are lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryArtifactStore implements ArtifactStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryArtifactStore.class);

  private final Map<ArtifactKind, Namespace> namespaces = new EnumMap<>(ArtifactKind.class);

  public InMemoryArtifactStore() {
    for (ArtifactKind kind : ArtifactKind.values()) {
      namespaces.put(kind, new Namespace());
    }
    log.warn("Using InMemoryArtifactStore, tokens will NOT survive restarts. "
        + "Replace with a persistent ArtifactStore for production.");
  }

  @Override
  public boolean create(StoredArtifact artifact) {
    Namespace ns = namespaces.get(artifact.kind());
    if (ns.artifacts.putIfAbsent(artifact.signature(), artifact) != null) {
      log.debug("Duplicate {} signature rejected", artifact.kind());
      return false;
    }
    ns.index(artifact);
    log.debug("Stored {} for requestId={}", artifact.kind(), artifact.requestId());
    return true;
  }

  @Override
  public Optional<StoredArtifact> load(ArtifactKind kind, String signature) {
    return Optional.ofNullable(namespaces.get(kind).artifacts.get(signature));
  }

  @Override
  public boolean delete(ArtifactKind kind, String signature) {
    Namespace ns = namespaces.get(kind);
    StoredArtifact removed = ns.artifacts.remove(signature);
    if (removed == null) {
      return false;
    }
    ns.unindex(removed);
    log.debug("Deleted {} for requestId={}", kind, removed.requestId());
    return true;
  }

  @Override
  public boolean deactivate(ArtifactKind kind, String signature) {
    return namespaces.get(kind).artifacts.computeIfPresent(signature, (k, v) -> v.deactivated()) != null;
  }

  @Override
  public int deleteByRequestId(ArtifactKind kind, String requestId) {
    Namespace ns = namespaces.get(kind);
    Set<String> signatures = ns.requestIndex.remove(requestId);
    if (signatures == null) {
      return 0;
    }
    AtomicInteger removed = new AtomicInteger();
    for (String signature : signatures) {
      // A stale index entry may point at a signature that was since re-issued for another request.
      ns.artifacts.computeIfPresent(signature, (k, v) -> {
        if (v.requestId().equals(requestId)) {
          removed.incrementAndGet();
          return null;
        }
        return v;
      });
    }
    log.debug("Deleted {} {} artifact(s) for requestId={}", removed.get(), kind, requestId);
    return removed.get();
  }

  @Override
  public int deleteExpired(Instant cutoff) {
    int removed = 0;
    for (Namespace ns : namespaces.values()) {
      for (StoredArtifact artifact : ns.artifacts.values()) {
        if (artifact.isExpiredAt(cutoff) && ns.artifacts.remove(artifact.signature(), artifact)) {
          ns.unindex(artifact);
          removed++;
        }
      }
    }
    log.debug("Purged {} expired artifact(s)", removed);
    return removed;
  }

  @Override
  public int count(ArtifactKind kind) {
    return namespaces.get(kind).artifacts.size();
  }

  private static final class Namespace {

    private final ConcurrentHashMap<String, StoredArtifact> artifacts = new ConcurrentHashMap<>();
    // Reverse index: requestId -> signatures, kept in sync with artifacts.
    private final ConcurrentHashMap<String, Set<String>> requestIndex = new ConcurrentHashMap<>();

    // The add must happen inside compute; unindex may drop an emptied set concurrently.
    private void index(StoredArtifact artifact) {
      requestIndex.compute(artifact.requestId(), (k, signatures) -> {
        Set<String> result = signatures == null ? ConcurrentHashMap.newKeySet() : signatures;
        result.add(artifact.signature());
        return result;
      });
    }

    private void unindex(StoredArtifact artifact) {
      requestIndex.computeIfPresent(artifact.requestId(), (k, signatures) -> {
        signatures.remove(artifact.signature());
        return signatures.isEmpty() ? null : signatures;
      });
    }
  }
}
