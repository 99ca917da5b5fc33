package org.chucc.graphserver.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the head of an entity changed between the caller's read and its write.
 *
 * <p>Returns HTTP 409 Conflict with error code "version_conflict". The caller recovers by
 * refetching the head and retrying.
 */
public class VersionConflictException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "version_conflict";

  private final UUID canonicalId;
  private final UUID expected;
  private final UUID actual;

  /**
   * Creates a new VersionConflictException.
   *
   * @param canonicalId the entity
   * @param expected the head version id the caller expected (null means "no head")
   * @param actual the head version id found (null means "no head")
   */
  public VersionConflictException(UUID canonicalId, UUID expected, UUID actual) {
    super("Version conflict on " + canonicalId + ": expected head " + expected
        + ", actual " + actual, ERROR_CODE, HttpStatus.CONFLICT);
    this.canonicalId = canonicalId;
    this.expected = expected;
    this.actual = actual;
  }

  public UUID getCanonicalId() {
    return canonicalId;
  }

  public UUID getExpected() {
    return expected;
  }

  public UUID getActual() {
    return actual;
  }
}
