package org.chucc.graphserver.domain;

import java.text.Normalizer;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Domain entity representing a named isolation scope for graph writes.
 *
 * <p>The default branch "main" is implicit and never stored; entity versions on main carry a
 * {@code null} branch id. Internally, indexes that cannot hold null keys use
 * {@link #MAIN_KEY} instead (see {@link #key(UUID)}).
 * Branch names must be in Unicode NFC normalization and match the pattern
 * {@code ^[A-Za-z0-9._\-/]+$}.
 */
public final class Branch {

  /** Name of the implicit default branch. */
  public static final String MAIN = "main";

  /** Index key standing in for the main branch (the nil UUID). */
  public static final UUID MAIN_KEY = new UUID(0L, 0L);

  private static final Pattern VALID_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9._\\-/]+$");

  private final UUID id;
  private final String name;
  private final UUID parentBranchId;
  private final Instant createdAt;

  /**
   * Creates a new Branch.
   *
   * @param id the branch id (non-null)
   * @param name the branch name (non-blank, NFC, matching the name pattern)
   * @param parentBranchId the base branch id, or null when branched from main
   * @param createdAt creation timestamp (non-null)
   * @throws IllegalArgumentException if validation fails
   */
  public Branch(UUID id, String name, UUID parentBranchId, Instant createdAt) {
    Objects.requireNonNull(id, "Branch id cannot be null");
    Objects.requireNonNull(name, "Branch name cannot be null");
    Objects.requireNonNull(createdAt, "createdAt cannot be null");
    validateName(name);
    if (MAIN_KEY.equals(id) || id.equals(parentBranchId)) {
      throw new IllegalArgumentException("Invalid branch id: " + id);
    }
    this.id = id;
    this.name = name;
    this.parentBranchId = MAIN_KEY.equals(parentBranchId) ? null : parentBranchId;
    this.createdAt = createdAt;
  }

  /**
   * Validates a branch name.
   *
   * @param name the candidate name
   * @throws IllegalArgumentException if the name is not acceptable
   */
  public static void validateName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Branch name cannot be blank");
    }
    if (name.length() > 128) {
      throw new IllegalArgumentException("Branch name cannot exceed 128 characters");
    }
    if (!Normalizer.normalize(name, Normalizer.Form.NFC).equals(name)) {
      throw new IllegalArgumentException(
          "Branch name must be in Unicode NFC normalization form: " + name);
    }
    if (!VALID_NAME_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException(
          "Branch name must match pattern ^[A-Za-z0-9._\\-/]+$: " + name);
    }
    if (name.startsWith("_") || name.startsWith(".")) {
      throw new IllegalArgumentException("Branch name cannot start with '_' or '.': " + name);
    }
    if (MAIN.equalsIgnoreCase(name)) {
      throw new IllegalArgumentException("Branch name '" + MAIN + "' is reserved");
    }
  }

  /**
   * Maps a nullable branch id to a non-null index key.
   *
   * @param branchId branch id, null for main
   * @return the branch id, or {@link #MAIN_KEY} for main
   */
  public static UUID key(UUID branchId) {
    return branchId == null ? MAIN_KEY : branchId;
  }

  /**
   * Maps an index key back to the wire representation.
   *
   * @param branchKey index key
   * @return the branch id, or null for main
   */
  public static UUID fromKey(UUID branchKey) {
    return MAIN_KEY.equals(branchKey) ? null : branchKey;
  }

  public static boolean isMain(UUID branchId) {
    return branchId == null || MAIN_KEY.equals(branchId);
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public UUID getParentBranchId() {
    return parentBranchId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /**
   * Returns a renamed copy of this branch.
   *
   * @param newName the new name
   * @return the renamed branch
   */
  public Branch withName(String newName) {
    return new Branch(id, newName, parentBranchId, createdAt);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Branch branch = (Branch) o;
    return id.equals(branch.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Branch{id=" + id + ", name='" + name + "', parentBranchId=" + parentBranchId + '}';
  }
}
