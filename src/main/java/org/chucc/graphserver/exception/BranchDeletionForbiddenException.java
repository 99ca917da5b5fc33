package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a branch cannot be deleted because other branches are based on it.
 * Maps to HTTP 409 Conflict with error code "branch_has_children".
 */
public class BranchDeletionForbiddenException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "branch_has_children";

  /**
   * Constructor with branch name.
   *
   * @param branchName the branch that still has children
   */
  public BranchDeletionForbiddenException(String branchName) {
    super("Branch '" + branchName + "' cannot be deleted while other branches are based on it",
        ERROR_CODE, HttpStatus.CONFLICT);
  }
}
