package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import org.chucc.graphserver.domain.GraphRelationship;

/**
 * Relationship create response: the relationship plus the auto-created inverse, if any.
 *
 * @param relationship the created or updated relationship (fields are inlined)
 * @param inverseRelationship inverse edge written alongside, if configured
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipResponse(
    @JsonUnwrapped GraphRelationship relationship,
    @JsonProperty("inverse_relationship") GraphRelationship inverseRelationship
) {
}
