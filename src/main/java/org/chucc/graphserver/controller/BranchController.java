package org.chucc.graphserver.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.dto.BranchListResponse;
import org.chucc.graphserver.dto.BranchResponse;
import org.chucc.graphserver.dto.CreateBranchRequest;
import org.chucc.graphserver.dto.MergeRequest;
import org.chucc.graphserver.dto.MergeResponse;
import org.chucc.graphserver.dto.UpdateBranchRequest;
import org.chucc.graphserver.service.BranchResolver;
import org.chucc.graphserver.service.BranchService;
import org.chucc.graphserver.service.MergeService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Branch management and merge endpoints.
 */
@RestController
@RequestMapping("/api/graph/branches")
@Tag(name = "Branches", description = "Branch management and merge operations")
public class BranchController {

  private static final String PROBLEM_JSON = "application/problem+json";

  private final BranchService branchService;
  private final MergeService mergeService;

  /**
   * Constructs a BranchController.
   *
   * @param branchService the branch service
   * @param mergeService the merge service
   */
  public BranchController(BranchService branchService, MergeService mergeService) {
    this.branchService = branchService;
    this.mergeService = mergeService;
  }

  /**
   * List all branches.
   *
   * @return the branches, main excluded
   */
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "List branches",
      description = "Returns all named branches; main is implicit and not listed"
  )
  @ApiResponse(responseCode = "200", description = "Branch list returned successfully")
  public BranchListResponse listBranches() {
    List<BranchResponse> branches = branchService.list().stream()
        .map(BranchResponse::from)
        .toList();
    return new BranchListResponse(branches, branches.size());
  }

  /**
   * Create a new branch.
   *
   * @param request name and optional parent
   * @return the created branch
   */
  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Create branch",
      description = "Creates a branch whose parent is main unless parent_branch_id is given"
  )
  @ApiResponse(responseCode = "201", description = "Branch created")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid branch name",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "404",
      description = "Parent branch not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "409",
      description = "Branch already exists",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<BranchResponse> createBranch(@RequestBody CreateBranchRequest request) {
    Branch branch = branchService.create(request);
    return ResponseEntity.created(URI.create("/api/graph/branches/" + branch.getId()))
        .body(BranchResponse.from(branch));
  }

  /**
   * Get a branch.
   *
   * @param id the branch id
   * @return the branch
   */
  @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get branch")
  @ApiResponse(responseCode = "200", description = "Branch returned")
  @ApiResponse(
      responseCode = "404",
      description = "Branch not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public BranchResponse getBranch(@PathVariable UUID id) {
    return BranchResponse.from(branchService.get(id));
  }

  /**
   * Rename a branch.
   *
   * @param id the branch id
   * @param request the new name
   * @return the renamed branch
   */
  @PatchMapping(
      value = "/{id}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Rename branch")
  @ApiResponse(responseCode = "200", description = "Branch renamed")
  @ApiResponse(
      responseCode = "409",
      description = "Name already in use",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public BranchResponse renameBranch(@PathVariable UUID id,
      @RequestBody UpdateBranchRequest request) {
    return BranchResponse.from(branchService.rename(id, request));
  }

  /**
   * Delete a branch.
   *
   * @param id the branch id
   * @return 204 No Content
   */
  @DeleteMapping("/{id}")
  @Operation(
      summary = "Delete branch",
      description = "Removes the branch name; versions written on it stay in the store"
  )
  @ApiResponse(responseCode = "204", description = "Branch deleted")
  @ApiResponse(
      responseCode = "409",
      description = "Branch has child branches",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public ResponseEntity<Void> deleteBranch(@PathVariable UUID id) {
    branchService.delete(id);
    return ResponseEntity.noContent().build();
  }

  /**
   * Merge a source branch into a target branch.
   *
   * @param targetBranchId target branch id, or "main"
   * @param request source branch, execute flag and result limit
   * @return the classification and, when executed, the apply outcome
   */
  @PostMapping(
      value = "/{targetBranchId}/merge",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Merge branches",
      description = "Classifies every object and relationship touched on either branch as "
          + "unchanged, added, fast_forward or conflict. With execute=true, applies the "
          + "non-conflicting changes to the target."
  )
  @ApiResponse(responseCode = "200", description = "Merge report")
  @ApiResponse(
      responseCode = "400",
      description = "Invalid request (e.g. source equals target)",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "403",
      description = "Merging is disabled",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  @ApiResponse(
      responseCode = "404",
      description = "Branch not found",
      content = @Content(mediaType = PROBLEM_JSON)
  )
  public MergeResponse merge(
      @Parameter(description = "Target branch id, or main", example = "main", required = true)
      @PathVariable String targetBranchId,
      @RequestBody MergeRequest request) {
    return mergeService.merge(BranchResolver.parseBranchRef(targetBranchId), request);
  }
}
