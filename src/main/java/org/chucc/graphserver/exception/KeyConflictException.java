package org.chucc.graphserver.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a business key is already used by another entity of the same type
 * on the same branch. Maps to HTTP 409 Conflict with error code "key_conflict".
 *
 * <p>The caller recovers by looking the key up and working with the existing entity.
 */
public class KeyConflictException extends GraphException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "key_conflict";

  private final String type;
  private final String key;
  private final UUID existingCanonicalId;

  /**
   * Creates a new KeyConflictException.
   *
   * @param type the entity type
   * @param key the conflicting key
   * @param existingCanonicalId canonical id currently holding the key, may be null
   */
  public KeyConflictException(String type, String key, UUID existingCanonicalId) {
    super("Object with type '" + type + "' and key '" + key + "' already exists",
        ERROR_CODE, HttpStatus.CONFLICT);
    this.type = type;
    this.key = key;
    this.existingCanonicalId = existingCanonicalId;
  }

  public String getType() {
    return type;
  }

  public String getKey() {
    return key;
  }

  public UUID getExistingCanonicalId() {
    return existingCanonicalId;
  }
}
