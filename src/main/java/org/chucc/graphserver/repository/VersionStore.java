package org.chucc.graphserver.repository;

import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.HeadKey;
import org.chucc.graphserver.domain.VersionedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only in-memory store of entity versions with a maintained head index.
 *
 * <p>Versions are never mutated or removed; deletion is a tombstone version. The head index
 * maps (canonical id, branch) to the latest version written on that branch and is updated
 * inside the same critical section as the append, so readers never observe two heads.
 * Resolution through a branch lineage (branch, parent, ..., main) is a handful of map
 * lookups; no chain walk is needed on the read path.
 *
 * <p>Thread Safety: all maps are concurrent. Writes to one canonical id are serialized by a
 * per-canonical {@link ReentrantLock}; different canonical ids are written in parallel.
 *
 * @param <T> entity version type
 */
public class VersionStore<T extends VersionedEntity<T>> {

  private static final Logger logger = LoggerFactory.getLogger(VersionStore.class);

  private final String entityName;
  private final Map<UUID, T> versions = new ConcurrentHashMap<>();
  private final Map<UUID, List<T>> chains = new ConcurrentHashMap<>();
  private final Map<HeadKey, UUID> heads = new ConcurrentHashMap<>();
  private final Map<UUID, Set<UUID>> branchMembers = new ConcurrentHashMap<>();
  private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Creates a store.
   *
   * @param entityName entity name used in log messages ("object", "relationship")
   */
  protected VersionStore(String entityName) {
    this.entityName = entityName;
  }

  /**
   * Finds a version by version id.
   *
   * @param versionId the version id
   * @return the version if present
   */
  public Optional<T> findById(UUID versionId) {
    return versionId == null ? Optional.empty() : Optional.ofNullable(versions.get(versionId));
  }

  /**
   * Checks whether any version of the canonical id exists on any branch.
   *
   * @param canonicalId canonical id
   * @return true if known
   */
  public boolean containsCanonical(UUID canonicalId) {
    return chains.containsKey(canonicalId);
  }

  /**
   * Returns the head written on exactly this branch (no inheritance), tombstones included.
   *
   * @param canonicalId canonical id
   * @param branchKey branch index key
   * @return the own head if present
   */
  public Optional<T> findOwnHead(UUID canonicalId, UUID branchKey) {
    UUID headId = heads.get(new HeadKey(canonicalId, branchKey));
    return headId == null ? Optional.empty() : Optional.ofNullable(versions.get(headId));
  }

  /**
   * Resolves the head seen from the first branch of a lineage.
   * The first branch in the lineage with an own head wins, tombstones included, so a delete
   * on a branch hides the inherited version.
   *
   * @param canonicalId canonical id
   * @param lineage branch keys from the branch itself up to main
   * @return the head if any branch in the lineage has one
   */
  public Optional<T> resolveHead(UUID canonicalId, List<UUID> lineage) {
    for (UUID branchKey : lineage) {
      Optional<T> head = findOwnHead(canonicalId, branchKey);
      if (head.isPresent()) {
        return head;
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the head and drops it if it is a tombstone.
   *
   * @param canonicalId canonical id
   * @param lineage branch lineage
   * @return the live head if any
   */
  public Optional<T> resolveLiveHead(UUID canonicalId, List<UUID> lineage) {
    return resolveHead(canonicalId, lineage).filter(v -> !v.isDeleted());
  }

  /**
   * Canonical ids that have own versions on the branch.
   *
   * @param branchKey branch index key
   * @return unmodifiable snapshot
   */
  public Set<UUID> canonicalIdsOn(UUID branchKey) {
    Set<UUID> members = branchMembers.get(branchKey);
    return members == null ? Set.of() : Set.copyOf(members);
  }

  /**
   * Canonical ids visible from a lineage (own or inherited).
   *
   * @param lineage branch lineage
   * @return unmodifiable snapshot, in lineage order
   */
  public Set<UUID> visibleCanonicalIds(List<UUID> lineage) {
    Set<UUID> visible = new LinkedHashSet<>();
    for (UUID branchKey : lineage) {
      Set<UUID> members = branchMembers.get(branchKey);
      if (members != null) {
        visible.addAll(members);
      }
    }
    return Collections.unmodifiableSet(visible);
  }

  /**
   * All versions of a canonical id across branches, in append order.
   *
   * @param canonicalId canonical id
   * @return unmodifiable list
   */
  public List<T> allVersions(UUID canonicalId) {
    List<T> chain = chains.get(canonicalId);
    return chain == null ? List.of() : List.copyOf(chain);
  }

  /**
   * History as seen from a branch: the supersedes chain ending at the resolved head,
   * oldest first. The chain may cross into parent branches for versions written before the
   * branch diverged.
   *
   * @param canonicalId canonical id
   * @param lineage branch lineage
   * @return versions oldest first; empty if nothing is visible
   */
  public List<T> history(UUID canonicalId, List<UUID> lineage) {
    List<T> result = new ArrayList<>();
    Set<UUID> seen = new LinkedHashSet<>();
    T current = resolveHead(canonicalId, lineage).orElse(null);
    while (current != null && seen.add(current.id())) {
      result.add(current);
      current = current.supersedesId() == null ? null : versions.get(current.supersedesId());
    }
    Collections.reverse(result);
    return result;
  }

  /**
   * Appends a new version for a canonical id on the first branch of the lineage.
   *
   * <p>Under the canonical id's lock this re-resolves the prior head, checks the
   * {@link WriteCondition}, and hands the prior head (or null) to {@code mutation}. The
   * mutation returns the content template for the new version, or null for a no-op, in which
   * case the prior head is returned unchanged. The store assigns the version id, the version
   * number ({@code max + 1} over all versions of the canonical id, hence strictly greater than
   * the prior's), {@code supersedesId} and the timestamp, then updates the head index before
   * the lock is released.
   *
   * @param canonicalId canonical id
   * @param lineage branch lineage; the first entry receives the version
   * @param condition optimistic precondition on the prior head
   * @param mutation builds the new content from the prior head
   * @return the stored version, or the prior head for a no-op
   * @throws org.chucc.graphserver.exception.VersionConflictException if the condition fails
   */
  public T append(UUID canonicalId, List<UUID> lineage, WriteCondition condition,
      UnaryOperator<T> mutation) {
    Objects.requireNonNull(canonicalId, "canonicalId cannot be null");
    UUID branchKey = lineage.get(0);
    ReentrantLock lock = locks.computeIfAbsent(canonicalId, k -> new ReentrantLock());
    lock.lock();
    try {
      T prior = resolveHead(canonicalId, lineage).orElse(null);
      UUID priorId = prior == null ? null : prior.id();
      condition.check(canonicalId, priorId);

      T next = mutation.apply(prior);
      if (next == null) {
        return prior;
      }
      if (!canonicalId.equals(next.canonicalId())) {
        throw new IllegalStateException("Mutation changed canonical id of " + canonicalId);
      }

      T stored = next.onBranch(Branch.fromKey(branchKey))
          .withLineage(UuidCreator.getTimeOrderedEpoch(), nextVersionNumber(canonicalId),
              priorId, Instant.now());

      versions.put(stored.id(), stored);
      chains.computeIfAbsent(canonicalId, k -> new CopyOnWriteArrayList<>()).add(stored);
      heads.put(new HeadKey(canonicalId, branchKey), stored.id());
      branchMembers.computeIfAbsent(branchKey, k -> ConcurrentHashMap.newKeySet())
          .add(canonicalId);
      afterAppend(stored);

      logger.debug("Appended {} {} v{} on branch {} (supersedes {})", entityName,
          canonicalId, stored.version(), branchKey, priorId);
      return stored;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Hook for subclasses maintaining secondary indexes. Runs under the canonical id's lock.
   *
   * @param stored the version just appended
   */
  protected void afterAppend(T stored) {
    // no secondary indexes by default
  }

  private int nextVersionNumber(UUID canonicalId) {
    List<T> chain = chains.get(canonicalId);
    if (chain == null) {
      return 1;
    }
    int max = 0;
    for (T v : chain) {
      max = Math.max(max, v.version());
    }
    return max + 1;
  }

  /**
   * Recomputes the head index and branch membership from the stored versions alone.
   * The head on a branch is its version with the highest version number. Meant for recovery
   * while no writes are in flight.
   */
  public void rebuildHeadIndex() {
    Map<HeadKey, T> rebuilt = new ConcurrentHashMap<>();
    for (T v : versions.values()) {
      rebuilt.merge(new HeadKey(v.canonicalId(), Branch.key(v.branchId())), v,
          (a, b) -> a.version() >= b.version() ? a : b);
    }
    heads.clear();
    branchMembers.clear();
    rebuilt.forEach((key, v) -> {
      heads.put(key, v.id());
      branchMembers.computeIfAbsent(key.branchKey(), k -> ConcurrentHashMap.newKeySet())
          .add(key.canonicalId());
    });
    logger.info("Rebuilt {} head index: {} heads from {} versions", entityName,
        heads.size(), versions.size());
  }

  /**
   * Snapshot of the head index, for diagnostics and recovery checks.
   *
   * @return unmodifiable copy
   */
  public Map<HeadKey, UUID> headIndexSnapshot() {
    return Map.copyOf(heads);
  }

  public int versionCount() {
    return versions.size();
  }

  public int canonicalCount() {
    return chains.size();
  }
}
