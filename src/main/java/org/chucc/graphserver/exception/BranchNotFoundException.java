package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a requested branch does not exist.
 * Maps to HTTP 404 Not Found with error code "branch_not_found".
 */
public class BranchNotFoundException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "branch_not_found";

  /**
   * Constructor with the offending identifier.
   *
   * @param identifier the id or name that caused the error
   */
  public BranchNotFoundException(Object identifier) {
    super("Branch not found: " + identifier, ERROR_CODE, HttpStatus.NOT_FOUND);
  }
}
