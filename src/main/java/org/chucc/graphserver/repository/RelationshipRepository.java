package org.chucc.graphserver.repository;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.GraphRelationship;
import org.springframework.stereotype.Repository;

/**
 * Version store for relationships plus the edge identity and adjacency indexes.
 *
 * <p>The identity index maps (type, src, dst, branch) to a canonical id, which makes
 * relationship creation an upsert. The adjacency index maps every object canonical id to the
 * relationship canonical ids touching it on any branch; callers resolve those through a branch
 * lineage to decide what is visible.
 */
@Repository
public class RelationshipRepository extends VersionStore<GraphRelationship> {

  private final Map<EdgeKey, UUID> identityIndex = new ConcurrentHashMap<>();
  private final Map<UUID, Set<UUID>> adjacency = new ConcurrentHashMap<>();

  /**
   * Creates an empty relationship repository.
   */
  public RelationshipRepository() {
    super("relationship");
  }

  /**
   * Finds the relationship canonical id for (type, src, dst) on exactly this branch.
   *
   * @param type relationship type
   * @param srcId source object canonical id
   * @param dstId destination object canonical id
   * @param branchKey branch index key
   * @return the canonical id if registered
   */
  public Optional<UUID> findCanonicalIdByEndpoints(String type, UUID srcId, UUID dstId,
      UUID branchKey) {
    return Optional.ofNullable(identityIndex.get(new EdgeKey(type, srcId, dstId, branchKey)));
  }

  /**
   * Atomically registers (type, src, dst) on a branch.
   *
   * @param type relationship type
   * @param srcId source canonical id
   * @param dstId destination canonical id
   * @param branchKey branch index key
   * @param canonicalId candidate canonical id
   * @return the canonical id registered for the endpoints (the existing one if the race was lost)
   */
  public UUID registerEndpoints(String type, UUID srcId, UUID dstId, UUID branchKey,
      UUID canonicalId) {
    UUID existing = identityIndex.putIfAbsent(new EdgeKey(type, srcId, dstId, branchKey),
        canonicalId);
    return existing == null ? canonicalId : existing;
  }

  /**
   * Relationship canonical ids with the object as source or destination, on any branch.
   *
   * @param objectCanonicalId object canonical id
   * @return unmodifiable snapshot
   */
  public Set<UUID> findAdjacent(UUID objectCanonicalId) {
    Set<UUID> adjacent = adjacency.get(objectCanonicalId);
    return adjacent == null ? Set.of() : Set.copyOf(adjacent);
  }

  @Override
  protected void afterAppend(GraphRelationship stored) {
    adjacency.computeIfAbsent(stored.srcId(), k -> ConcurrentHashMap.newKeySet())
        .add(stored.canonicalId());
    adjacency.computeIfAbsent(stored.dstId(), k -> ConcurrentHashMap.newKeySet())
        .add(stored.canonicalId());
    identityIndex.putIfAbsent(new EdgeKey(stored.type(), stored.srcId(), stored.dstId(),
        Branch.key(stored.branchId())), stored.canonicalId());
  }

  private record EdgeKey(String type, UUID srcId, UUID dstId, UUID branchKey) {
  }
}
