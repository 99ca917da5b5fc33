package org.chucc.graphserver.util;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import org.chucc.graphserver.domain.VersionedEntity;
import org.chucc.graphserver.repository.VersionStore;

/**
 * Ancestry queries over the version graph of one entity kind.
 *
 * <p>A version's parents are the version it supersedes and, for merge writes, the source
 * version it was copied from. Both links are followed, so a version merged in from another
 * branch counts as an ancestor of the merge result.
 *
 * @param <T> entity type
 */
public final class VersionAncestry<T extends VersionedEntity<T>> {

  private final VersionStore<T> store;

  /**
   * Constructs a VersionAncestry.
   *
   * @param store the version store to walk
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP2",
      justification = "VersionStore is a Spring-managed bean, not a mutable data structure")
  public VersionAncestry(VersionStore<T> store) {
    this.store = store;
  }

  /**
   * Finds the first version reachable from both versions.
   *
   * <p>Uses bidirectional BFS, expanding one step from each side in turn.
   *
   * @param firstId first version id
   * @param secondId second version id
   * @return the common ancestor version id, or empty if the chains never meet
   */
  public Optional<UUID> findCommonAncestor(UUID firstId, UUID secondId) {
    if (firstId.equals(secondId)) {
      return Optional.of(firstId);
    }

    Set<UUID> visitedFirst = new HashSet<>();
    Set<UUID> visitedSecond = new HashSet<>();
    Queue<UUID> queueFirst = new ArrayDeque<>();
    Queue<UUID> queueSecond = new ArrayDeque<>();
    visitedFirst.add(firstId);
    visitedSecond.add(secondId);
    queueFirst.add(firstId);
    queueSecond.add(secondId);

    while (!queueFirst.isEmpty() || !queueSecond.isEmpty()) {
      Optional<UUID> met = step(queueFirst, visitedFirst, visitedSecond);
      if (met.isPresent()) {
        return met;
      }
      met = step(queueSecond, visitedSecond, visitedFirst);
      if (met.isPresent()) {
        return met;
      }
    }
    return Optional.empty();
  }

  /**
   * Checks whether one version is an ancestor of (or equal to) another.
   *
   * @param ancestorId potential ancestor version id
   * @param descendantId potential descendant version id
   * @return true if ancestorId is reachable from descendantId
   */
  public boolean isAncestor(UUID ancestorId, UUID descendantId) {
    if (ancestorId.equals(descendantId)) {
      return true;
    }
    Set<UUID> visited = new HashSet<>();
    Queue<UUID> queue = new ArrayDeque<>();
    visited.add(descendantId);
    queue.add(descendantId);

    while (!queue.isEmpty()) {
      for (UUID parentId : parents(queue.poll())) {
        if (parentId.equals(ancestorId)) {
          return true;
        }
        if (visited.add(parentId)) {
          queue.add(parentId);
        }
      }
    }
    return false;
  }

  /**
   * Resolves a version id to its record.
   *
   * @param versionId version id, may be null
   * @return the version if present
   */
  public Optional<T> find(UUID versionId) {
    return versionId == null ? Optional.empty() : store.findById(versionId);
  }

  private Optional<UUID> step(Queue<UUID> queue, Set<UUID> visited, Set<UUID> otherVisited) {
    if (queue.isEmpty()) {
      return Optional.empty();
    }
    UUID current = queue.poll();
    if (otherVisited.contains(current)) {
      return Optional.of(current);
    }
    for (UUID parentId : parents(current)) {
      if (otherVisited.contains(parentId)) {
        return Optional.of(parentId);
      }
      if (visited.add(parentId)) {
        queue.add(parentId);
      }
    }
    return Optional.empty();
  }

  private List<UUID> parents(UUID versionId) {
    Optional<T> version = store.findById(versionId);
    if (version.isEmpty()) {
      return List.of();
    }
    List<UUID> parents = new ArrayList<>(2);
    if (version.get().supersedesId() != null) {
      parents.add(version.get().supersedesId());
    }
    if (version.get().mergedFromId() != null) {
      parents.add(version.get().mergedFromId());
    }
    return parents;
  }
}
