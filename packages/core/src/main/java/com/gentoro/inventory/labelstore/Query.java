package com.gentoro.inventory.labelstore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.inventory.exception.InvalidQueryException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/** Immutable label-match query: an operator, a label key and the candidate values. */
public final class Query {
  private final Operator op;
  private final String key;
  private final List<String> values;

  @JsonCreator
  public Query(
      @JsonProperty("op") Operator op,
      @JsonProperty("key") String key,
      @JsonProperty("values") List<String> values) {
    this.op = op;
    this.key = key;
    this.values =
        Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNullElse(values, Collections.emptyList())));
  }

  public static Query equal(String key, String value) {
    return new Query(Operator.MATCH_EQUAL, key, Collections.singletonList(value));
  }

  public static Query notEqual(String key, String value) {
    return new Query(Operator.MATCH_NOT_EQUAL, key, Collections.singletonList(value));
  }

  public static Query in(String key, String... values) {
    return new Query(Operator.MATCH_IN, key, Arrays.asList(values));
  }

  public static Query notIn(String key, String... values) {
    return new Query(Operator.MATCH_NOT_IN, key, Arrays.asList(values));
  }

  @JsonProperty("op")
  public Operator getOp() {
    return op;
  }

  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("values")
  public List<String> getValues() {
    return values;
  }

  /**
   * Reject malformed queries: missing operator, blank key, null candidate values, Equal/NotEqual
   * without exactly one value. In/NotIn accept an empty candidate set; In then matches nothing and
   * NotIn matches every resource carrying the key.
   */
  public void validate() {
    String problem = problem();
    if (problem != null) {
      InvalidQueryException ex =
          new InvalidQueryException("Invalid label query " + this + ": " + problem);
      ex.withContext("key", key);
      throw ex;
    }
  }

  @JsonIgnore
  public boolean isValid() {
    return problem() == null;
  }

  private String problem() {
    if (op == null) return "operator is required";
    if (StringUtils.isBlank(key)) return "key is required";
    if (values.contains(null)) return "values must not contain null";
    if (op.isSingleValue() && values.size() != 1) {
      return op + " takes exactly one value, got " + values.size();
    }
    return null;
  }

  /**
   * Evaluate against a label map directly. Negative operators only match labels that carry the
   * key, mirroring what the label index can see. Invalid queries match nothing.
   */
  public boolean matches(Map<String, String> labels) {
    if (!isValid() || labels == null) return false;
    String value = labels.get(key);
    if (value == null) return false;
    return values.contains(value) == op.isInclusive();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Query other)) return false;
    return op == other.op && Objects.equals(key, other.key) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, key, values);
  }

  @Override
  public String toString() {
    return "Query{" + op + " " + key + " " + values + "}";
  }
}
