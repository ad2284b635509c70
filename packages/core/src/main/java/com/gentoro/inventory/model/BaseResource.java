package com.gentoro.inventory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.inventory.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/**
 * Common state for every resource type: identifier, type tag and labels. Subclasses add their own
 * fields and extend {@link #collectViolations(List)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class BaseResource implements Resource {
  @JsonProperty("id")
  private String id;

  @JsonProperty("type")
  private String type;

  @JsonProperty("labels")
  private Map<String, String> labels = new LinkedHashMap<>();

  protected BaseResource(String type) {
    this.type = type;
  }

  @Override
  public String getId() {
    return id;
  }

  public BaseResource setId(String id) {
    this.id = id;
    return this;
  }

  @Override
  public String getType() {
    return type;
  }

  public BaseResource setType(String type) {
    this.type = type;
    return this;
  }

  @Override
  public Map<String, String> getLabels() {
    return Collections.unmodifiableMap(labels);
  }

  public BaseResource setLabels(Map<String, String> labels) {
    this.labels = new LinkedHashMap<>(Objects.requireNonNullElse(labels, Map.of()));
    return this;
  }

  public BaseResource label(String key, String value) {
    this.labels.put(key, value);
    return this;
  }

  @Override
  public final void validate() {
    List<String> violations = new ArrayList<>();
    collectViolations(violations);
    if (!violations.isEmpty()) {
      ValidationException ex =
          new ValidationException(
              "Invalid " + type + " resource '" + id + "': " + String.join("; ", violations));
      ex.withContext("id", id).withContext("type", type);
      throw ex;
    }
  }

  /** Add a human readable message for each violated invariant. */
  protected void collectViolations(List<String> violations) {
    if (StringUtils.isBlank(id)) violations.add("id is required");
    if (StringUtils.isBlank(type)) violations.add("type is required");
    for (Map.Entry<String, String> e : labels.entrySet()) {
      if (StringUtils.isBlank(e.getKey())) {
        violations.add("label keys must not be blank");
      } else if (e.getValue() == null) {
        violations.add("label '" + e.getKey() + "' has no value");
      }
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", type=" + type + ", labels=" + labels + "}";
  }
}
