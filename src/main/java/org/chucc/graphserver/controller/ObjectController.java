package org.chucc.graphserver.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.controller.util.GraphHeaders;
import org.chucc.graphserver.domain.Direction;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.dto.BulkCreateObjectsRequest;
import org.chucc.graphserver.dto.BulkResponse;
import org.chucc.graphserver.dto.BulkUpdateStatusRequest;
import org.chucc.graphserver.dto.CreateObjectRequest;
import org.chucc.graphserver.dto.ObjectEdgesResponse;
import org.chucc.graphserver.dto.ObjectSearchCriteria;
import org.chucc.graphserver.dto.PatchObjectRequest;
import org.chucc.graphserver.dto.SearchResponse;
import org.chucc.graphserver.service.BulkMutationService;
import org.chucc.graphserver.service.ObjectService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
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
 * Object endpoints: single and bulk writes, reads, history and search.
 *
 * <p>Every write returns the new head with its version id as ETag.
 */
@RestController
@RequestMapping("/api/graph/objects")
@Tag(name = "Objects", description = "Versioned graph node operations")
public class ObjectController {

  private static final String PROBLEM_JSON = "application/problem+json";

  private final ObjectService objectService;
  private final BulkMutationService bulkMutationService;

  /**
   * Constructs an ObjectController.
   *
   * @param objectService the object service
   * @param bulkMutationService the bulk mutation service
   */
  public ObjectController(ObjectService objectService,
      BulkMutationService bulkMutationService) {
    this.objectService = objectService;
    this.bulkMutationService = bulkMutationService;
  }

  /**
   * Create an object.
   *
   * @param request the object to create
   * @return the first version
   */
  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Create object",
      description = "Creates a new object (version 1) on the given branch, main by default"
  )
  @ApiResponse(responseCode = "201", description = "Object created")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "409",
      description = "Key already used for this type on the branch",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphObject> create(@RequestBody CreateObjectRequest request) {
    GraphObject created = objectService.create(request);
    return ResponseEntity.created(URI.create("/api/graph/objects/" + created.canonicalId()))
        .headers(GraphHeaders.etag(created.id()))
        .body(created);
  }

  /**
   * Create or update an object by (type, key).
   *
   * @param request the object content, key required
   * @return the outcome with the resulting head
   */
  @PostMapping(
      value = "/upsert",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Upsert object",
      description = "Creates the object, or writes a new version of the object holding the key. "
          + "Identical content is a no-op."
  )
  @ApiResponse(responseCode = "201", description = "Object created")
  @ApiResponse(responseCode = "200", description = "Object updated or unchanged")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<ObjectService.UpsertOutcome> upsert(
      @RequestBody CreateObjectRequest request) {
    ObjectService.UpsertOutcome outcome = objectService.upsert(request);
    HttpStatus status = ObjectService.UpsertOutcome.CREATED.equals(outcome.outcome())
        ? HttpStatus.CREATED
        : HttpStatus.OK;
    return ResponseEntity.status(status)
        .headers(GraphHeaders.etag(outcome.object().id()))
        .body(outcome);
  }

  /**
   * Create up to the batch limit of objects.
   *
   * @param request the items
   * @return per-item results
   */
  @PostMapping(
      value = "/bulk",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Bulk create objects",
      description = "Creates objects concurrently; each item succeeds or fails on its own"
  )
  @ApiResponse(responseCode = "200", description = "Per-item results")
  @ApiResponse(
      responseCode = "400",
      description = "Empty or oversized batch",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public BulkResponse bulkCreate(@RequestBody BulkCreateObjectsRequest request) {
    return bulkMutationService.createObjects(request);
  }

  /**
   * Set the status of many objects.
   *
   * @param request ids and the new status
   * @return per-item results
   */
  @PostMapping(
      value = "/bulk-update-status",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Bulk update status", description = "Patches the status of each object")
  @ApiResponse(responseCode = "200", description = "Per-item results")
  public BulkResponse bulkUpdateStatus(@RequestBody BulkUpdateStatusRequest request) {
    return bulkMutationService.updateStatus(request);
  }

  /**
   * Search object heads visible on a branch.
   *
   * @param type single type filter
   * @param types any-of type filter
   * @param label single label filter
   * @param labels any-of label filter
   * @param status status filter
   * @param key business key filter
   * @param branchId branch id or "main"
   * @param includeDeleted whether tombstoned heads are included
   * @param limit page size
   * @param cursor cursor from a previous page
   * @param order asc or desc by creation time
   * @return one page of heads
   */
  @GetMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Search objects",
      description = "Filters resolved heads by type, labels, status and key with cursor paging"
  )
  @ApiResponse(responseCode = "200", description = "One page of results")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid filter, limit or cursor",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @SuppressWarnings("PMD.ExcessiveParameterList") // One parameter per documented query filter
  public SearchResponse<GraphObject> search(
      @RequestParam(required = false) String type,
      @RequestParam(required = false) List<String> types,
      @RequestParam(required = false) String label,
      @RequestParam(required = false) List<String> labels,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String key,
      @Parameter(description = "Branch id, or main when absent")
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestParam(name = "include_deleted", defaultValue = "false") boolean includeDeleted,
      @Parameter(description = "Page size (default 50, max 200)")
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String cursor,
      @Parameter(description = "asc or desc (default) by created_at")
      @RequestParam(required = false) String order) {
    return objectService.search(new ObjectSearchCriteria(type, types, label, labels, status, key,
        branchId, includeDeleted, limit, cursor, order));
  }

  /**
   * Get an object by version id or canonical id.
   *
   * @param id version id or canonical id
   * @param branchId branch to resolve the head on
   * @param resolveHead whether a version id resolves to the current head
   * @return the version
   */
  @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Get object",
      description = "A version id returns that version unless resolve_head or branch_id is set; "
          + "a canonical id returns the head"
  )
  @ApiResponse(responseCode = "200", description = "Object returned")
  @ApiResponse(
      responseCode = "404",
      description = "Object not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphObject> get(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestParam(name = "resolve_head", defaultValue = "false") boolean resolveHead) {
    GraphObject object = objectService.get(id, branchId, resolveHead);
    return ResponseEntity.ok().headers(GraphHeaders.etag(object.id())).body(object);
  }

  /**
   * Partially update an object.
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
  @Operation(
      summary = "Patch object",
      description = "Merges properties (null removes), labels and status into a new version"
  )
  @ApiResponse(responseCode = "200", description = "New or unchanged head")
  @ApiResponse(
      responseCode = "409",
      description = "If-Match does not name the current head",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphObject> patch(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @Parameter(description = "Expected head version id")
      @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
      @RequestBody PatchObjectRequest request) {
    GraphObject head = objectService.patch(id, branchId, request,
        GraphHeaders.parseIfMatch(ifMatch));
    return ResponseEntity.ok().headers(GraphHeaders.etag(head.id())).body(head);
  }

  /**
   * Tombstone an object.
   *
   * @param id version id or canonical id
   * @param branchId branch to write on
   * @param ifMatch expected head version id
   * @return the tombstone version
   */
  @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Delete object", description = "Writes a tombstone version")
  @ApiResponse(responseCode = "200", description = "Tombstone written")
  @ApiResponse(
      responseCode = "400",
      description = "Object already deleted",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphObject> delete(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
    GraphObject tombstone = objectService.delete(id, branchId, GraphHeaders.parseIfMatch(ifMatch));
    return ResponseEntity.ok().headers(GraphHeaders.etag(tombstone.id())).body(tombstone);
  }

  /**
   * Restore a tombstoned object.
   *
   * @param id version id or canonical id
   * @param branchId branch to write on
   * @param ifMatch expected head version id
   * @return the restored version
   */
  @PostMapping(value = "/{id}/restore", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Restore object", description = "Writes a live version after a tombstone")
  @ApiResponse(responseCode = "200", description = "Object restored")
  @ApiResponse(
      responseCode = "400",
      description = "Object is not deleted",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<GraphObject> restore(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
    GraphObject restored = objectService.restore(id, branchId,
        GraphHeaders.parseIfMatch(ifMatch));
    return ResponseEntity.ok().headers(GraphHeaders.etag(restored.id())).body(restored);
  }

  /**
   * Version history of an object, oldest first.
   *
   * @param id version id or canonical id
   * @param branchId branch whose lineage is followed
   * @return the versions
   */
  @GetMapping(value = "/{id}/history", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Object history", description = "Versions visible on the branch")
  @ApiResponse(responseCode = "200", description = "Version list")
  public List<GraphObject> history(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId) {
    return objectService.history(id, branchId);
  }

  /**
   * Live relationships touching an object.
   *
   * @param id version id or canonical id
   * @param branchId branch to read
   * @param type single relationship type
   * @param types any-of relationship types
   * @param direction out, in or both
   * @return outgoing and incoming relationships
   */
  @GetMapping(value = "/{id}/edges", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Object edges", description = "Outgoing and incoming live relationships")
  @ApiResponse(responseCode = "200", description = "Edges returned")
  public ObjectEdgesResponse edges(
      @PathVariable UUID id,
      @RequestParam(name = "branch_id", required = false) String branchId,
      @RequestParam(required = false) String type,
      @RequestParam(required = false) List<String> types,
      @RequestParam(required = false) String direction) {
    List<String> allTypes = new ArrayList<>();
    if (types != null) {
      allTypes.addAll(types);
    }
    if (type != null && !type.isBlank()) {
      allTypes.add(type);
    }
    return objectService.edges(id, branchId, allTypes, Direction.parse(direction, Direction.BOTH));
  }
}
