package org.chucc.graphserver.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.chucc.graphserver.dto.ExpandRequest;
import org.chucc.graphserver.dto.ExpandResponse;
import org.chucc.graphserver.dto.TraverseRequest;
import org.chucc.graphserver.dto.TraverseResponse;
import org.chucc.graphserver.service.TraversalService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bounded graph expansion and traversal endpoints.
 */
@RestController
@RequestMapping("/api/graph")
@Tag(name = "Traversal", description = "Bounded graph expansion and paginated traversal")
public class TraversalController {

  private final TraversalService traversalService;

  /**
   * Constructs a TraversalController.
   *
   * @param traversalService the traversal service
   */
  public TraversalController(TraversalService traversalService) {
    this.traversalService = traversalService;
  }

  /**
   * Expand breadth-first from root objects.
   *
   * @param request roots, bounds, filters and projection
   * @return reached nodes and edges
   */
  @PostMapping(
      value = "/expand",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Expand graph",
      description = "Breadth-first expansion bounded by max_depth, max_nodes and max_edges"
  )
  @ApiResponse(responseCode = "200", description = "Subgraph returned")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request or bound above the configured maximum",
      content = @Content(mediaType = "application/problem+json")
  )
  public ExpandResponse expand(@RequestBody ExpandRequest request) {
    return traversalService.expand(request);
  }

  /**
   * Multi-phase traversal with cursor pagination.
   *
   * @param request roots, phases, predicates and page position
   * @return one page of reached nodes
   */
  @PostMapping(
      value = "/traverse",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Traverse graph",
      description = "Runs edge phases in order from the roots, applies node and edge predicates "
          + "and returns one page of nodes with optional paths"
  )
  @ApiResponse(responseCode = "200", description = "Page returned")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request, phase or cursor",
      content = @Content(mediaType = "application/problem+json")
  )
  public TraverseResponse traverse(@RequestBody TraverseRequest request) {
    return traversalService.traverse(request);
  }
}
