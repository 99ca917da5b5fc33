package org.chucc.graphserver.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.util.ContentHasher;

/**
 * One immutable version of a typed graph node.
 *
 * <p>Objects carry an optional business {@code key}, unique per (type, branch).
 * The record is serialized as-is on the wire, so component names map to the snake_case
 * field names clients depend on.
 *
 * @param id version id
 * @param canonicalId stable entity id
 * @param supersedesId version replaced by this one, or null
 * @param branchId branch this version lives on, null for main
 * @param version version number, strictly increasing along the supersedes chain
 * @param type object type
 * @param key optional business key
 * @param status optional status
 * @param properties open property map
 * @param labels label set (insertion ordered, no duplicates)
 * @param deletedAt tombstone marker
 * @param createdAt write timestamp
 * @param mergedFromId source version copied by a merge, or null
 * @param changeSummary diff against the superseded version
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphObject(
    @JsonProperty("id") UUID id,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("supersedes_id") UUID supersedesId,
    @JsonProperty("branch_id") UUID branchId,
    @JsonProperty("version") int version,
    @JsonProperty("type") String type,
    @JsonProperty("key") String key,
    @JsonProperty("status") String status,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("deleted_at") Instant deletedAt,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("merged_from_id") UUID mergedFromId,
    @JsonProperty("change_summary") ChangeSummary changeSummary
) implements VersionedEntity<GraphObject> {

  /**
   * Compact constructor with defensive copies of the mutable inputs.
   */
  public GraphObject {
    properties = properties == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    labels = labels == null ? List.of() : List.copyOf(new LinkedHashSet<>(labels));
  }

  /**
   * Creates an unsaved object template; lineage fields are assigned on append.
   *
   * @param canonicalId canonical id
   * @param branchId branch id, null for main
   * @param type object type
   * @param key business key, may be null
   * @param status status, may be null
   * @param properties properties
   * @param labels labels
   * @return the template
   */
  public static GraphObject template(UUID canonicalId, UUID branchId, String type, String key,
      String status, Map<String, Object> properties, List<String> labels) {
    return new GraphObject(null, canonicalId, null, branchId, 0, type, key, status,
        properties, labels, null, null, null, null);
  }

  @Override
  public GraphObject withLineage(UUID newId, int newVersion, UUID newSupersedesId,
      Instant newCreatedAt) {
    return new GraphObject(newId, canonicalId, newSupersedesId, branchId, newVersion, type, key,
        status, properties, labels, deletedAt, newCreatedAt, mergedFromId, changeSummary);
  }

  @Override
  public GraphObject onBranch(UUID newBranchId) {
    return new GraphObject(id, canonicalId, supersedesId, newBranchId, version, type, key,
        status, properties, labels, deletedAt, createdAt, mergedFromId, changeSummary);
  }

  @Override
  public GraphObject withDeletedAt(Instant newDeletedAt) {
    return new GraphObject(id, canonicalId, supersedesId, branchId, version, type, key,
        status, properties, labels, newDeletedAt, createdAt, mergedFromId, changeSummary);
  }

  @Override
  public GraphObject withMergedFrom(UUID newMergedFromId) {
    return new GraphObject(id, canonicalId, supersedesId, branchId, version, type, key,
        status, properties, labels, deletedAt, createdAt, newMergedFromId, changeSummary);
  }

  @Override
  public GraphObject withChangeSummary(ChangeSummary newChangeSummary) {
    return new GraphObject(id, canonicalId, supersedesId, branchId, version, type, key,
        status, properties, labels, deletedAt, createdAt, mergedFromId, newChangeSummary);
  }

  /**
   * Returns a copy with new content fields, keeping identity and lineage.
   *
   * @param newStatus status
   * @param newProperties properties
   * @param newLabels labels
   * @return the copy
   */
  public GraphObject withContent(String newStatus, Map<String, Object> newProperties,
      List<String> newLabels) {
    return new GraphObject(id, canonicalId, supersedesId, branchId, version, type, key,
        newStatus, newProperties, newLabels, deletedAt, createdAt, mergedFromId, changeSummary);
  }

  @Override
  @JsonIgnore
  public String contentHash() {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("type", type);
    content.put("key", key);
    content.put("status", status);
    content.put("properties", properties);
    content.put("labels", labels.stream().sorted().toList());
    content.put("deleted", deletedAt != null);
    return ContentHasher.hash(content);
  }
}
