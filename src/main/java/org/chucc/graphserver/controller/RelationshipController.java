package org.chucc.graphserver.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.controller.util.GraphHeaders;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.BulkCreateRelationshipsRequest;
import org.chucc.graphserver.dto.BulkResponse;
import org.chucc.graphserver.dto.CreateRelationshipRequest;
import org.chucc.graphserver.dto.PatchRelationshipRequest;
import org.chucc.graphserver.dto.RelationshipResponse;
import org.chucc.graphserver.dto.RelationshipSearchCriteria;
import org.chucc.graphserver.dto.SearchResponse;
import org.chucc.graphserver.service.BulkMutationService;
import org.chucc.graphserver.service.RelationshipService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Relationship endpoints.
 */
@RestController
@RequestMapping("/api/graph/relationships")
@Tag(name = "Relationships", description = "Versioned graph edge operations")
@SuppressWarnings("CPD-START") // OpenAPI annotations mirror the object endpoints
public class RelationshipController {

  private static final String PROBLEM_JSON = "application/problem+json";

  private final RelationshipService relationshipService;
  private final BulkMutationService bulkMutationService;

  /**
   * Constructs a RelationshipController.
   *
   * @param relationshipService the relationship service
   * @param bulkMutationService the bulk mutation service
   */
  public RelationshipController(RelationshipService relationshipService,
      BulkMutationService bulkMutationService) {
    this.relationshipService = relationshipService;
    this.bulkMutationService = bulkMutationService;
  }

  /**
   * Create a relationship, or return the existing one for the same (type, src, dst).
   *
   * @param request the relationship
   * @return the head, with the inverse relationship when one is configured
   */
  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Create relationship",
      description = "Idempotent on (type, src_id, dst_id) per branch; changed properties or "
          + "weight write a new version"
  )
  @ApiResponse(responseCode = "201", description = "Relationship written")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request or self-loop",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "422",
      description = "An endpoint is not a live object on the branch",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<RelationshipResponse> create(
      @RequestBody CreateRelationshipRequest request) {
    RelationshipService.RelationshipWrite write = relationshipService.create(request);
    GraphRelationship head = write.relationship();
    return ResponseEntity.created(URI.create("/api/graph/relationships/" + head.canonicalId()))
        .headers(GraphHeaders.etag(head.id()))
        .body(new RelationshipResponse(head, write.inverse()));
  }

  /**
   * Create up to the batch limit of relationships.
   *
   * @param request the items
   * @return per-item results
   */
  @PostMapping(
      value = "/bulk",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Bulk create relationships", description = "Per-item results")
  @ApiResponse(responseCode = "200", description = "Per-item results")
  @ApiResponse(
      responseCode = "400",
      description = "Empty or oversized batch",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public BulkResponse bulkCreate(@RequestBody BulkCreateRelationshipsRequest request) {
    return bulkMutationService.createRelationships(request);
  }

  /**
   * Search relationship heads visible on a branch.
   *
   * @param type single type filter
   * @param types any-of type filter
   * @param srcId source object
   * @param dstId destination object
   * @param branchId branch id or "main"
   * @param includeDeleted whether tombstoned heads are included
   * @param limit page size
   * @param cursor cursor from a previous page
   * @param order asc or desc
   * @return one page of heads
   */
  @GetMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Search relationships", description = "Filters by type and endpoints")
  @ApiResponse(responseCode = "200", description = "One page of results")
  @SuppressWarnings("PMD.ExcessiveParameterList") // One parameter per documented query filter
  public SearchResponse<GraphRelationship> search(
      @RequestParam(required = false) String type,
      @RequestParam(required = false) List<String> types,
      @RequestParam(name = "src_id", required = false) UUID srcId,
      @RequestParam(name = "dst_id", required = false) UUID dstId,
      @Parameter(description = "Branch id, or main when absent")
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestParam(name = "include_deleted", defaultValue = "false") boolean includeDeleted,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String cursor,
      @RequestParam(required = false) String order) {
    return relationshipService.search(new RelationshipSearchCriteria(type, types, srcId, dstId,
        branchId, includeDeleted, limit, cursor, order));
  }

  /**
   * Get a relationship by version id or canonical id.
   *
   * @param id version id or canonical id
   * @param branchId branch to resolve the head on
   * @param resolveHead whether a version id resolves to the current head
   * @return the version
   */
  @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get relationship")
  @ApiResponse(responseCode = "200", description = "Relationship returned")
  @ApiResponse(
      responseCode = "404",
      description = "Relationship not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphRelationship> get(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestParam(name = "resolve_head", defaultValue = "false") boolean resolveHead) {
    GraphRelationship relationship = relationshipService.get(id, branchId, resolveHead);
    return ResponseEntity.ok().headers(GraphHeaders.etag(relationship.id())).body(relationship);
  }

  /**
   * Update properties or weight.
   *
   * @param id version id or canonical id
   * @param branchId branch to write on
   * @param ifMatch expected head version id
   * @param request the patch
   * @return the new head
   */
  @PatchMapping(
      value = "/{id}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Patch relationship")
  @ApiResponse(responseCode = "200", description = "New or unchanged head")
  @ApiResponse(
      responseCode = "409",
      description = "If-Match does not name the current head",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphRelationship> patch(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
      @RequestBody PatchRelationshipRequest request) {
    GraphRelationship head = relationshipService.patch(id, branchId, request,
        GraphHeaders.parseIfMatch(ifMatch));
    return ResponseEntity.ok().headers(GraphHeaders.etag(head.id())).body(head);
  }

  /**
   * Tombstone a relationship.
   *
   * @param id version id or canonical id
   * @param branchId branch to write on
   * @param ifMatch expected head version id
   * @return the tombstone
   */
  @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Delete relationship")
  @ApiResponse(responseCode = "200", description = "Tombstone written")
  public ResponseEntity<GraphRelationship> delete(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
    GraphRelationship tombstone = relationshipService.delete(id, branchId,
        GraphHeaders.parseIfMatch(ifMatch));
    return ResponseEntity.ok().headers(GraphHeaders.etag(tombstone.id())).body(tombstone);
  }

  /**
   * Restore a tombstoned relationship. Both endpoints must be live.
   *
   * @param id version id or canonical id
   * @param branchId branch to write on
   * @param ifMatch expected head version id
   * @return the restored version
   */
  @PostMapping(value = "/{id}/restore", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Restore relationship")
  @ApiResponse(responseCode = "200", description = "Relationship restored")
  @ApiResponse(
      responseCode = "422",
      description = "An endpoint is no longer live",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphRelationship> restore(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
    GraphRelationship restored = relationshipService.restore(id, branchId,
        GraphHeaders.parseIfMatch(ifMatch));
    return ResponseEntity.ok().headers(GraphHeaders.etag(restored.id())).body(restored);
  }

  /**
   * Version history of a relationship.
   *
   * @param id version id or canonical id
   * @param branchId branch whose lineage is followed
   * @return the versions
   */
  @GetMapping(value = "/{id}/history", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Relationship history")
  @ApiResponse(responseCode = "200", description = "Version list")
  public List<GraphRelationship> history(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId) {
    return relationshipService.history(id, branchId);
  }
}
