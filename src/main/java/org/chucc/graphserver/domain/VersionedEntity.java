package org.chucc.graphserver.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of an immutable graph entity version (object or relationship).
 *
 * <p>A version is never mutated once stored. The version store stamps lineage fields
 * ({@code id}, {@code version}, {@code supersedesId}, {@code createdAt}) through
 * {@link #withLineage(UUID, int, UUID, Instant)} when it appends the version.
 *
 * @param <T> the concrete entity type
 */
public interface VersionedEntity<T extends VersionedEntity<T>> {

  /**
   * Version id; unique per mutation.
   *
   * @return the version id
   */
  UUID id();

  /**
   * Stable identity across all versions and branches.
   *
   * @return the canonical id
   */
  UUID canonicalId();

  UUID supersedesId();

  /**
   * Branch this version was written on, {@code null} for main.
   *
   * @return the branch id or null
   */
  UUID branchId();

  int version();

  Instant deletedAt();

  Instant createdAt();

  /**
   * Version on another branch this version was copied from by a merge.
   *
   * @return the merged-from version id or null
   */
  UUID mergedFromId();

  ChangeSummary changeSummary();

  /**
   * Hash of the content fields; equal hashes mean equal content.
   *
   * @return hex-encoded content hash
   */
  String contentHash();

  /**
   * Returns a copy with lineage fields assigned by the store.
   *
   * @param id new version id
   * @param version version number
   * @param supersedesId prior head id, or null
   * @param createdAt write timestamp
   * @return the stamped copy
   */
  T withLineage(UUID id, int version, UUID supersedesId, Instant createdAt);

  /**
   * Returns a copy placed on the given branch.
   *
   * @param branchId target branch id, null for main
   * @return the copy
   */
  T onBranch(UUID branchId);

  /**
   * Returns a copy with the given tombstone marker.
   *
   * @param deletedAt deletion timestamp, null to restore
   * @return the copy
   */
  T withDeletedAt(Instant deletedAt);

  T withMergedFrom(UUID mergedFromId);

  T withChangeSummary(ChangeSummary changeSummary);

  @JsonIgnore
  default boolean isDeleted() {
    return deletedAt() != null;
  }
}
