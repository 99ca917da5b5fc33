package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Request DTO for a partial relationship update. Properties merge like object patches.
 *
 * @param properties properties to set, {@code null} values remove
 * @param weight new weight
 */
public record PatchRelationshipRequest(
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("weight") Double weight
) {
}
