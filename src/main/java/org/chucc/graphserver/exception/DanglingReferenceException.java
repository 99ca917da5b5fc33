package org.chucc.graphserver.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a relationship endpoint does not resolve to a live object on the
 * relationship's branch. Maps to HTTP 422 Unprocessable Entity with error code
 * "dangling_reference".
 */
public class DanglingReferenceException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "dangling_reference";

  @SuppressFBWarnings(value = "SE_TRANSIENT_FIELD_NOT_RESTORED",
      justification = "Missing ids are only used for the HTTP response")
  private final transient List<UUID> missingIds;

  /**
   * Creates a new DanglingReferenceException.
   *
   * @param missingIds the endpoint ids that could not be resolved
   */
  public DanglingReferenceException(List<UUID> missingIds) {
    super("Relationship endpoint(s) not found on branch: " + missingIds,
        ERROR_CODE, HttpStatus.UNPROCESSABLE_ENTITY);
    this.missingIds = List.copyOf(missingIds);
  }

  public List<UUID> getMissingIds() {
    return missingIds;
  }
}
