package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.domain.MergeStatus;

/**
 * Merge classification of one canonical object or relationship.
 * The endpoint fields are only present for relationships.
 *
 * @param canonicalId canonical id
 * @param type entity type
 * @param status classification
 * @param sourceHeadId head on the source branch
 * @param targetHeadId head on the target branch
 * @param sourcePaths paths changed on the source since the common base
 * @param targetPaths paths changed on the target since the common base
 * @param conflicts paths that differ between the heads, for conflicting items
 * @param sourceSrcId source head's src_id
 * @param sourceDstId source head's dst_id
 * @param targetSrcId target head's src_id
 * @param targetDstId target head's dst_id
 */
public record MergeItemSummary(
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("type") String type,
    @JsonProperty("status") MergeStatus status,
    @JsonProperty("source_head_id") UUID sourceHeadId,
    @JsonProperty("target_head_id") UUID targetHeadId,
    @JsonProperty("source_paths") List<String> sourcePaths,
    @JsonProperty("target_paths") List<String> targetPaths,
    @JsonProperty("conflicts") List<String> conflicts,
    @JsonProperty("source_src_id") UUID sourceSrcId,
    @JsonProperty("source_dst_id") UUID sourceDstId,
    @JsonProperty("target_src_id") UUID targetSrcId,
    @JsonProperty("target_dst_id") UUID targetDstId
) {

  /**
   * Compact constructor with defensive copying. Empty path lists are omitted.
   */
  public MergeItemSummary {
    sourcePaths = emptyToNull(sourcePaths);
    targetPaths = emptyToNull(targetPaths);
    conflicts = emptyToNull(conflicts);
  }

  private static List<String> emptyToNull(List<String> paths) {
    return paths == null || paths.isEmpty() ? null : List.copyOf(paths);
  }
}
