package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RFC 7807 Problem Details for HTTP APIs.
 * Used for every error response of the graph API; extras are serialized as top-level fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProblemDetail {

  private String type = "about:blank";
  private String title;
  private int status;
  private String detail;
  private String instance;
  private String code;
  private final Map<String, Object> extras = new LinkedHashMap<>();

  /**
   * Default constructor for JSON deserialization.
   */
  public ProblemDetail() {
    // Required for JSON deserialization
  }

  /**
   * Constructor with type, title, status, and code.
   *
   * @param type URI reference for the problem type
   * @param title human-readable summary
   * @param status HTTP status code
   * @param code canonical error code
   */
  public ProblemDetail(String type, String title, int status, String code) {
    this.type = type;
    this.title = title;
    this.status = status;
    this.code = code;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public int getStatus() {
    return status;
  }

  public void setStatus(int status) {
    this.status = status;
  }

  public String getDetail() {
    return detail;
  }

  public void setDetail(String detail) {
    this.detail = detail;
  }

  public String getInstance() {
    return instance;
  }

  public void setInstance(String instance) {
    this.instance = instance;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  /**
   * Adds a top-level field. Null values are skipped.
   *
   * @param name field name
   * @param value field value
   * @return this problem
   */
  public ProblemDetail withExtra(String name, Object value) {
    if (value != null) {
      extras.put(name, value);
    }
    return this;
  }

  /**
   * Gets additional properties for serialization as top-level fields.
   *
   * @return map of additional properties
   */
  @JsonAnyGetter
  public Map<String, Object> getExtras() {
    return new LinkedHashMap<>(extras);
  }
}
