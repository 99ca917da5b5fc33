package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;

/**
 * Result of one bulk item.
 *
 * @param index position of the item in the request
 * @param success whether the item was written
 * @param status "created", "updated", "conflict" or "error"
 * @param object the written object, for object items
 * @param relationship the written relationship, for relationship items
 * @param error error message for failed items
 * @param code machine-readable failure code (e.g. "key_exists")
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BulkItemResult(
    @JsonProperty("index") int index,
    @JsonProperty("success") boolean success,
    @JsonProperty("status") String status,
    @JsonProperty("object") GraphObject object,
    @JsonProperty("relationship") GraphRelationship relationship,
    @JsonProperty("error") String error,
    @JsonProperty("code") String code
) {
}
