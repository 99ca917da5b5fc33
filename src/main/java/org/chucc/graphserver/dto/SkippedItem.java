package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;

/**
 * An applicable merge item that was not written.
 *
 * @param kind "object" or "relationship"
 * @param canonicalId canonical id
 * @param code error code of the failed write
 * @param reason error message
 */
public record SkippedItem(
    @JsonProperty("kind") String kind,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("code") String code,
    @JsonProperty("reason") String reason
) {
}
