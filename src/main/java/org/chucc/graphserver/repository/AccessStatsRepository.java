package org.chucc.graphserver.repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory per-object access statistics (count and last access time).
 */
@Repository
public class AccessStatsRepository {

  private final Map<UUID, AccessStats> stats = new ConcurrentHashMap<>();

  /**
   * Records one access of an object.
   *
   * @param canonicalId object canonical id
   * @param at access time
   */
  public void recordAccess(UUID canonicalId, Instant at) {
    stats.merge(canonicalId, new AccessStats(1, at),
        (old, inc) -> new AccessStats(old.accessCount() + 1,
            old.lastAccessedAt().isAfter(at) ? old.lastAccessedAt() : at));
  }

  public Optional<AccessStats> find(UUID canonicalId) {
    return Optional.ofNullable(stats.get(canonicalId));
  }

  /**
   * Snapshot of all statistics.
   *
   * @return unmodifiable copy
   */
  public Map<UUID, AccessStats> findAll() {
    return Map.copyOf(stats);
  }

  /**
   * Access statistics of one object.
   *
   * @param accessCount number of recorded accesses
   * @param lastAccessedAt time of the latest access
   */
  public record AccessStats(long accessCount, Instant lastAccessedAt) {
  }
}
