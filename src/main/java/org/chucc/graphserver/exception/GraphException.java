package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for graph server errors.
 * Carries a canonical error code and the HTTP status it maps to.
 */
public class GraphException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;
  private final int status;

  /**
   * Constructor with message, code, and status.
   *
   * @param message error message
   * @param code canonical error code
   * @param status HTTP status code
   */
  public GraphException(String message, String code, int status) {
    super(message);
    this.code = code;
    this.status = status;
  }

  /**
   * Constructor with message, code, and status.
   *
   * @param message error message
   * @param code canonical error code
   * @param status HTTP status
   */
  public GraphException(String message, String code, HttpStatus status) {
    this(message, code, status.value());
  }

  /**
   * Constructor with message, code, status, and cause.
   *
   * @param message error message
   * @param code canonical error code
   * @param status HTTP status
   * @param cause the cause
   */
  public GraphException(String message, String code, HttpStatus status, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.status = status.value();
  }

  public String getCode() {
    return code;
  }

  public int getStatus() {
    return status;
  }
}
