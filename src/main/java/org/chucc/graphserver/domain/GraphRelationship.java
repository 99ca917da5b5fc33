package org.chucc.graphserver.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.util.ContentHasher;

/**
 * One immutable version of a typed directed edge between two objects.
 *
 * <p>{@code srcId} and {@code dstId} are always canonical ids of objects; a relationship's
 * identity per branch is (type, srcId, dstId).
 *
 * @param id version id
 * @param canonicalId stable entity id
 * @param supersedesId version replaced by this one, or null
 * @param branchId branch this version lives on, null for main
 * @param version version number
 * @param type relationship type
 * @param srcId source object canonical id
 * @param dstId destination object canonical id
 * @param properties open property map
 * @param weight optional weight
 * @param deletedAt tombstone marker
 * @param createdAt write timestamp
 * @param mergedFromId source version copied by a merge, or null
 * @param changeSummary diff against the superseded version
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphRelationship(
    @JsonProperty("id") UUID id,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("supersedes_id") UUID supersedesId,
    @JsonProperty("branch_id") UUID branchId,
    @JsonProperty("version") int version,
    @JsonProperty("type") String type,
    @JsonProperty("src_id") UUID srcId,
    @JsonProperty("dst_id") UUID dstId,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("weight") Double weight,
    @JsonProperty("deleted_at") Instant deletedAt,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("merged_from_id") UUID mergedFromId,
    @JsonProperty("change_summary") ChangeSummary changeSummary
) implements VersionedEntity<GraphRelationship> {

  /**
   * Compact constructor with a defensive copy of the property map.
   */
  public GraphRelationship {
    properties = properties == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  /**
   * Creates an unsaved relationship template.
   *
   * @param canonicalId canonical id
   * @param branchId branch id, null for main
   * @param type relationship type
   * @param srcId source canonical id
   * @param dstId destination canonical id
   * @param properties properties
   * @param weight weight, may be null
   * @return the template
   */
  public static GraphRelationship template(UUID canonicalId, UUID branchId, String type,
      UUID srcId, UUID dstId, Map<String, Object> properties, Double weight) {
    return new GraphRelationship(null, canonicalId, null, branchId, 0, type, srcId, dstId,
        properties, weight, null, null, null, null);
  }

  @Override
  public GraphRelationship withLineage(UUID newId, int newVersion, UUID newSupersedesId,
      Instant newCreatedAt) {
    return new GraphRelationship(newId, canonicalId, newSupersedesId, branchId, newVersion, type,
        srcId, dstId, properties, weight, deletedAt, newCreatedAt, mergedFromId, changeSummary);
  }

  @Override
  public GraphRelationship onBranch(UUID newBranchId) {
    return new GraphRelationship(id, canonicalId, supersedesId, newBranchId, version, type,
        srcId, dstId, properties, weight, deletedAt, createdAt, mergedFromId, changeSummary);
  }

  @Override
  public GraphRelationship withDeletedAt(Instant newDeletedAt) {
    return new GraphRelationship(id, canonicalId, supersedesId, branchId, version, type,
        srcId, dstId, properties, weight, newDeletedAt, createdAt, mergedFromId, changeSummary);
  }

  @Override
  public GraphRelationship withMergedFrom(UUID newMergedFromId) {
    return new GraphRelationship(id, canonicalId, supersedesId, branchId, version, type,
        srcId, dstId, properties, weight, deletedAt, createdAt, newMergedFromId, changeSummary);
  }

  @Override
  public GraphRelationship withChangeSummary(ChangeSummary newChangeSummary) {
    return new GraphRelationship(id, canonicalId, supersedesId, branchId, version, type,
        srcId, dstId, properties, weight, deletedAt, createdAt, mergedFromId, newChangeSummary);
  }

  /**
   * Returns a copy with new properties and weight.
   *
   * @param newProperties properties
   * @param newWeight weight
   * @return the copy
   */
  public GraphRelationship withContent(Map<String, Object> newProperties, Double newWeight) {
    return new GraphRelationship(id, canonicalId, supersedesId, branchId, version, type,
        srcId, dstId, newProperties, newWeight, deletedAt, createdAt, mergedFromId,
        changeSummary);
  }

  /**
   * Returns the endpoint on the other side of the given object.
   *
   * @param objectCanonicalId one endpoint
   * @return the opposite endpoint
   */
  public UUID otherEnd(UUID objectCanonicalId) {
    return srcId.equals(objectCanonicalId) ? dstId : srcId;
  }

  @Override
  @JsonIgnore
  public String contentHash() {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("type", type);
    content.put("src_id", srcId);
    content.put("dst_id", dstId);
    content.put("properties", properties);
    content.put("weight", weight);
    content.put("deleted", deletedAt != null);
    return ContentHasher.hash(content);
  }
}
