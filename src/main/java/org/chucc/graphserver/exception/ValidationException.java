package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a payload or state transition is not acceptable.
 * Maps to HTTP 400 Bad Request with error code "validation_error".
 */
public class ValidationException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "validation_error";

  /**
   * Constructor with message.
   *
   * @param message what is wrong with the request
   */
  public ValidationException(String message) {
    super(message, ERROR_CODE, HttpStatus.BAD_REQUEST);
  }

  /**
   * Constructor with message and cause.
   *
   * @param message what is wrong with the request
   * @param cause the underlying validation failure
   */
  public ValidationException(String message, Throwable cause) {
    super(message, ERROR_CODE, HttpStatus.BAD_REQUEST, cause);
  }
}
