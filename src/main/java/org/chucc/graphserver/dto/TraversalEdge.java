package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.UUID;

/**
 * An edge between two returned nodes.
 *
 * @param id head version id
 * @param canonicalId canonical id
 * @param type relationship type
 * @param srcId source object canonical id
 * @param dstId destination object canonical id
 * @param properties relationship properties, when requested
 */
public record TraversalEdge(
    @JsonProperty("id") UUID id,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("type") String type,
    @JsonProperty("src_id") UUID srcId,
    @JsonProperty("dst_id") UUID dstId,
    @JsonProperty("properties") Map<String, Object> properties
) {
}
