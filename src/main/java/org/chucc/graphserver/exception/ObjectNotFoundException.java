package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a requested object (by version id or canonical id) does not exist
 * on the branch.
 * Maps to HTTP 404 Not Found with error code "object_not_found".
 */
public class ObjectNotFoundException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "object_not_found";

  /**
   * Constructor with the offending identifier.
   *
   * @param identifier the id or name that caused the error
   */
  public ObjectNotFoundException(Object identifier) {
    super("Object not found: " + identifier, ERROR_CODE, HttpStatus.NOT_FOUND);
  }
}
