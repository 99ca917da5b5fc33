package org.chucc.graphserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when an operation is disabled by server configuration.
 * Maps to HTTP 403 Forbidden with error code "{feature}_disabled".
 */
public class FeatureDisabledException extends GraphException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with feature name.
   *
   * @param feature the disabled feature (e.g. "merge")
   */
  public FeatureDisabledException(String feature) {
    super("Operation '" + feature + "' is disabled by server configuration",
        feature + "_disabled", HttpStatus.FORBIDDEN);
  }
}
