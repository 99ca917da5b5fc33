package org.chucc.graphserver.repository;

import java.util.Objects;
import java.util.UUID;
import org.chucc.graphserver.exception.VersionConflictException;

/**
 * Optimistic precondition on the head an append is based on.
 *
 * @param enforced whether the expected head is checked at all
 * @param expectedHeadId expected head version id; null with {@code enforced} means "no head"
 */
public record WriteCondition(boolean enforced, UUID expectedHeadId) {

  private static final WriteCondition ANY = new WriteCondition(false, null);

  /**
   * Accepts whatever the head is at lock time.
   *
   * @return the unconditional write condition
   */
  public static WriteCondition any() {
    return ANY;
  }

  /**
   * Requires the entity to have no head on the branch (nothing own, nothing inherited).
   *
   * @return the condition
   */
  public static WriteCondition noHead() {
    return new WriteCondition(true, null);
  }

  /**
   * Requires the head to be the given version.
   *
   * @param versionId expected head version id
   * @return the condition
   */
  public static WriteCondition headIs(UUID versionId) {
    return new WriteCondition(true, Objects.requireNonNull(versionId, "versionId"));
  }

  /**
   * Creates a condition from an optional If-Match value.
   *
   * @param ifMatch version id from the request, or null
   * @return {@link #headIs(UUID)} when given, otherwise {@link #any()}
   */
  public static WriteCondition fromIfMatch(UUID ifMatch) {
    return ifMatch == null ? ANY : headIs(ifMatch);
  }

  /**
   * Verifies the condition against the head found under the write lock.
   *
   * @param canonicalId entity being written
   * @param actualHeadId head version id at lock time, or null
   * @throws VersionConflictException if the condition does not hold
   */
  public void check(UUID canonicalId, UUID actualHeadId) {
    if (enforced && !Objects.equals(expectedHeadId, actualHeadId)) {
      throw new VersionConflictException(canonicalId, expectedHeadId, actualHeadId);
    }
  }
}
