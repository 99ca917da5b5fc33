package org.chucc.graphserver.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.chucc.graphserver.dto.AnalyticsResponse;
import org.chucc.graphserver.service.AnalyticsService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Object access analytics.
 */
@RestController
@RequestMapping("/api/graph/analytics")
@Tag(name = "Analytics", description = "Object access statistics")
public class AnalyticsController {

  private final AnalyticsService analyticsService;

  /**
   * Constructs an AnalyticsController.
   *
   * @param analyticsService the analytics service
   */
  public AnalyticsController(AnalyticsService analyticsService) {
    this.analyticsService = analyticsService;
  }

  /**
   * Most frequently read objects.
   *
   * @param limit maximum number of items
   * @param minAccessCount minimum read count
   * @param branchId branch whose heads are reported
   * @return items ordered by read count, highest first
   */
  @GetMapping(value = "/most-accessed", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Most accessed objects")
  @ApiResponse(responseCode = "200", description = "Items returned")
  public AnalyticsResponse mostAccessed(
      @Parameter(description = "Maximum items (default 50, max 200)")
      @RequestParam(required = false) Integer limit,
      @RequestParam(name = "min_access_count", required = false) Integer minAccessCount,
      @RequestParam(name = "branch_id", required = false) String branchId) {
    return analyticsService.mostAccessed(limit, minAccessCount, branchId);
  }

  /**
   * Objects not read for a while.
   *
   * @param limit maximum number of items
   * @param daysThreshold days without a read
   * @param branchId branch whose heads are reported
   * @return never-read objects first, then the least recently read
   */
  @GetMapping(value = "/unused", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Unused objects")
  @ApiResponse(responseCode = "200", description = "Items returned")
  public AnalyticsResponse unused(
      @RequestParam(required = false) Integer limit,
      @Parameter(description = "Days without a read (default 30)")
      @RequestParam(name = "days_threshold", required = false) Integer daysThreshold,
      @RequestParam(name = "branch_id", required = false) String branchId) {
    return analyticsService.unused(limit, daysThreshold, branchId);
  }
}
