package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a requested relationship does not exist on the branch.
 * Maps to HTTP 404 Not Found with error code "relationship_not_found".
 */
public class RelationshipNotFoundException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "relationship_not_found";

  /**
   * Constructor with the offending identifier.
   *
   * @param identifier the id or name that caused the error
   */
  public RelationshipNotFoundException(Object identifier) {
    super("Relationship not found: " + identifier, ERROR_CODE, HttpStatus.NOT_FOUND);
  }
}
