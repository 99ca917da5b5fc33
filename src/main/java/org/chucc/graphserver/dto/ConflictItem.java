package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A single conflicting entity in a merge.
 * Both heads are always present: a conflict means both sides moved since their common base.
 */
public class ConflictItem {

  @JsonProperty("kind")
  private String kind;
  @JsonProperty("canonical_id")
  private UUID canonicalId;
  @JsonProperty("source_head_id")
  private UUID sourceHeadId;
  @JsonProperty("target_head_id")
  private UUID targetHeadId;
  @JsonProperty("paths")
  private List<String> paths = new ArrayList<>();
  @JsonProperty("details")
  private String details;

  /**
   * Default constructor for JSON deserialization.
   */
  public ConflictItem() {
    // Required for JSON deserialization
  }

  /**
   * Constructor with all fields.
   *
   * @param kind "object" or "relationship"
   * @param canonicalId the conflicting canonical id
   * @param sourceHeadId head on the source branch
   * @param targetHeadId head on the target branch
   * @param paths differing paths between the heads
   * @param details human-readable description
   */
  public ConflictItem(String kind, UUID canonicalId, UUID sourceHeadId, UUID targetHeadId,
      List<String> paths, String details) {
    this.kind = kind;
    this.canonicalId = canonicalId;
    this.sourceHeadId = sourceHeadId;
    this.targetHeadId = targetHeadId;
    setPaths(paths);
    this.details = details;
  }

  public String getKind() {
    return kind;
  }

  public void setKind(String kind) {
    this.kind = kind;
  }

  public UUID getCanonicalId() {
    return canonicalId;
  }

  public void setCanonicalId(UUID canonicalId) {
    this.canonicalId = canonicalId;
  }

  public UUID getSourceHeadId() {
    return sourceHeadId;
  }

  public void setSourceHeadId(UUID sourceHeadId) {
    this.sourceHeadId = sourceHeadId;
  }

  public UUID getTargetHeadId() {
    return targetHeadId;
  }

  public void setTargetHeadId(UUID targetHeadId) {
    this.targetHeadId = targetHeadId;
  }

  public List<String> getPaths() {
    return List.copyOf(paths);
  }

  public void setPaths(List<String> paths) {
    this.paths = paths == null ? new ArrayList<>() : new ArrayList<>(paths);
  }

  public String getDetails() {
    return details;
  }

  public void setDetails(String details) {
    this.details = details;
  }
}
