package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a branch merge.
 *
 * <p>Counts always cover every classified entity; the {@code objects}, {@code relationships}
 * and {@code conflicts} arrays are capped at {@code hard_limit}. Apply fields are only present
 * when the merge was executed.
 */
@Schema(description = "Branch merge classification and apply result")
public record MergeResponse(
    @JsonProperty("targetBranchId") UUID targetBranchId,
    @JsonProperty("sourceBranchId") UUID sourceBranchId,
    @JsonProperty("dryRun") boolean dryRun,
    @JsonProperty("total_objects") int totalObjects,
    @JsonProperty("unchanged_count") int unchangedCount,
    @JsonProperty("added_count") int addedCount,
    @JsonProperty("fast_forward_count") int fastForwardCount,
    @JsonProperty("conflict_count") int conflictCount,
    @JsonProperty("objects") List<MergeItemSummary> objects,
    @JsonProperty("relationships_total") int relationshipsTotal,
    @JsonProperty("relationships_unchanged_count") int relationshipsUnchangedCount,
    @JsonProperty("relationships_added_count") int relationshipsAddedCount,
    @JsonProperty("relationships_fast_forward_count") int relationshipsFastForwardCount,
    @JsonProperty("relationships_conflict_count") int relationshipsConflictCount,
    @JsonProperty("relationships_dangling_count") int relationshipsDanglingCount,
    @JsonProperty("relationships") List<MergeItemSummary> relationships,
    @JsonProperty("conflicts") List<ConflictItem> conflicts,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("hard_limit") int hardLimit,
    @JsonProperty("applied") Boolean applied,
    @JsonProperty("applied_objects") Integer appliedObjects,
    @JsonProperty("skipped_items") List<SkippedItem> skippedItems
) {

  /**
   * Compact constructor with defensive copying.
   */
  public MergeResponse {
    objects = objects == null ? List.of() : List.copyOf(objects);
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
    conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    skippedItems = skippedItems == null ? null : List.copyOf(skippedItems);
  }
}
