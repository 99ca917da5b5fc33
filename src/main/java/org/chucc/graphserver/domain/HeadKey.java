package org.chucc.graphserver.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Key of the maintained head index: one head per (canonical id, branch).
 *
 * @param canonicalId canonical entity id
 * @param branchKey branch index key ({@link Branch#MAIN_KEY} for main)
 */
public record HeadKey(UUID canonicalId, UUID branchKey) {

  /**
   * Compact constructor rejecting null parts.
   */
  public HeadKey {
    Objects.requireNonNull(canonicalId, "canonicalId cannot be null");
    Objects.requireNonNull(branchKey, "branchKey cannot be null");
  }
}
