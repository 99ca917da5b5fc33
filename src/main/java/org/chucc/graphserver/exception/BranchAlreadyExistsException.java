package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a branch with the requested name already exists.
 * Maps to HTTP 409 Conflict with error code "branch_already_exists".
 */
public class BranchAlreadyExistsException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "branch_already_exists";

  /**
   * Constructor with the offending identifier.
   *
   * @param identifier the id or name that caused the error
   */
  public BranchAlreadyExistsException(Object identifier) {
    super("Branch already exists: " + identifier, ERROR_CODE, HttpStatus.CONFLICT);
  }
}
