package org.chucc.graphserver.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of one canonical entity in a branch merge.
 * Declaration order is the order summaries are reported in.
 */
public enum MergeStatus {
  CONFLICT("conflict"),
  DANGLING_REFERENCE("dangling_reference"),
  FAST_FORWARD("fast_forward"),
  ADDED("added"),
  UNCHANGED("unchanged");

  private final String wireName;

  MergeStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Whether apply mode writes a new version on the target for this status.
   *
   * @return true for added and fast-forward items
   */
  public boolean isApplicable() {
    return this == ADDED || this == FAST_FORWARD;
  }
}
