package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a request exceeds a hard cap (bulk batch size, root count, page size).
 * Maps to HTTP 400 Bad Request with error code "limit_exceeded".
 */
public class LimitExceededException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "limit_exceeded";

  /**
   * Creates a new LimitExceededException.
   *
   * @param what the capped quantity
   * @param requested the requested amount
   * @param max the allowed maximum
   */
  public LimitExceededException(String what, int requested, int max) {
    super(what + " exceeds maximum of " + max + " (requested " + requested + ")",
        ERROR_CODE, HttpStatus.BAD_REQUEST);
  }
}
