package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Response DTO for bulk endpoints.
 *
 * @param success number of items written
 * @param failed number of items not written
 * @param results per-item results in request order
 */
public record BulkResponse(
    @JsonProperty("success") int success,
    @JsonProperty("failed") int failed,
    @JsonProperty("results") List<BulkItemResult> results
) {

  /**
   * Compact constructor with defensive copying.
   */
  public BulkResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /**
   * Builds a response, counting successes and failures.
   *
   * @param results per-item results
   * @return the response
   */
  public static BulkResponse of(List<BulkItemResult> results) {
    int ok = (int) results.stream().filter(BulkItemResult::success).count();
    return new BulkResponse(ok, results.size() - ok, results);
  }
}
