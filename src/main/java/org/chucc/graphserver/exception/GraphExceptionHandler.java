package org.chucc.graphserver.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import org.chucc.graphserver.dto.ProblemDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for the graph API.
 * Converts exceptions to RFC 7807 problem+json responses and counts them per error code.
 */
@ControllerAdvice
public class GraphExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(GraphExceptionHandler.class);

  private static final MediaType PROBLEM_JSON =
      MediaType.parseMediaType("application/problem+json");

  private final MeterRegistry meterRegistry;

  /**
   * Constructs a GraphExceptionHandler.
   *
   * @param meterRegistry the meter registry for error counters
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry is a Spring-managed bean, not a mutable data structure"
  )
  public GraphExceptionHandler(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * Handle optimistic precondition failures.
   *
   * @param ex the version conflict exception
   * @return RFC 7807 problem+json response with expected and actual head ids
   */
  @ExceptionHandler(VersionConflictException.class)
  public ResponseEntity<ProblemDetail> handleVersionConflict(VersionConflictException ex) {
    return respond(problemFor(ex)
        .withExtra("canonical_id", ex.getCanonicalId())
        .withExtra("expected", ex.getExpected())
        .withExtra("actual", ex.getActual()));
  }

  /**
   * Handle key uniqueness conflicts.
   *
   * @param ex the key conflict exception
   * @return RFC 7807 problem+json response naming the key holder
   */
  @ExceptionHandler(KeyConflictException.class)
  public ResponseEntity<ProblemDetail> handleKeyConflict(KeyConflictException ex) {
    return respond(problemFor(ex)
        .withExtra("object_type", ex.getType())
        .withExtra("key", ex.getKey())
        .withExtra("canonical_id", ex.getExistingCanonicalId()));
  }

  /**
   * Handle missing relationship endpoints.
   *
   * @param ex the dangling reference exception
   * @return RFC 7807 problem+json response listing the missing ids
   */
  @ExceptionHandler(DanglingReferenceException.class)
  public ResponseEntity<ProblemDetail> handleDanglingReference(DanglingReferenceException ex) {
    return respond(problemFor(ex).withExtra("missing_ids", ex.getMissingIds()));
  }

  /**
   * Handle all GraphException instances.
   *
   * @param ex the graph exception
   * @return RFC 7807 problem+json response
   */
  @ExceptionHandler(GraphException.class)
  public ResponseEntity<ProblemDetail> handleGraphException(GraphException ex) {
    return respond(problemFor(ex));
  }

  /**
   * Handle IllegalArgumentException (e.g. malformed ids, cursors or directions).
   *
   * @param ex the illegal argument exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    return respond(problem(ex.getMessage(), HttpStatus.BAD_REQUEST, "invalid_argument"));
  }

  /**
   * Handle unreadable request bodies.
   *
   * @param ex the conversion exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    logger.debug("Unreadable request body", ex);
    return respond(problem("Malformed request body", HttpStatus.BAD_REQUEST,
        "malformed_request"));
  }

  /**
   * Handle path or query parameters of the wrong type (e.g. a non-UUID id).
   *
   * @param ex the type mismatch exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return respond(problem("Invalid value for parameter '" + ex.getName() + "'",
        HttpStatus.BAD_REQUEST, "invalid_argument"));
  }

  /**
   * Handle missing required query parameters.
   *
   * @param ex the missing parameter exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ProblemDetail> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return respond(problem(ex.getMessage(), HttpStatus.BAD_REQUEST, "validation_error"));
  }

  private static ProblemDetail problemFor(GraphException ex) {
    return new ProblemDetail(typeUri(ex.getCode()), ex.getMessage(), ex.getStatus(),
        ex.getCode());
  }

  private static ProblemDetail problem(String title, HttpStatus status, String code) {
    return new ProblemDetail(typeUri(code), title, status.value(), code);
  }

  private static String typeUri(String code) {
    return "/problems/" + code.replace('_', '-');
  }

  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  private ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
    meterRegistry.counter("graph.errors", "code", problem.getCode()).increment();
    if (problem.getStatus() >= HttpStatus.INTERNAL_SERVER_ERROR.value()) {
      logger.error("Request failed with {}: {}", problem.getCode(), problem.getTitle());
    } else {
      logger.debug("Request rejected with {}: {}", problem.getCode(), problem.getTitle());
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(PROBLEM_JSON);

    return new ResponseEntity<>(problem, headers, HttpStatus.valueOf(problem.getStatus()));
  }
}
