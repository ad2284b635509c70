package com.gentoro.inventory.labelstore;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Label-match operators understood by {@link LabelStore#query(Query)}. */
public enum Operator {
  /** Label equals the single candidate value. */
  @JsonProperty("MatchEqual")
  MATCH_EQUAL(true, true),
  /** Label is present and differs from the single candidate value. */
  @JsonProperty("MatchNotEqual")
  MATCH_NOT_EQUAL(true, false),
  /** Label equals one of the candidate values. */
  @JsonProperty("MatchIn")
  MATCH_IN(false, true),
  /** Label is present and equals none of the candidate values. */
  @JsonProperty("MatchNotIn")
  MATCH_NOT_IN(false, false);

  private final boolean singleValue;
  private final boolean inclusive;

  Operator(boolean singleValue, boolean inclusive) {
    this.singleValue = singleValue;
    this.inclusive = inclusive;
  }

  /** Whether the operator takes exactly one candidate value. */
  public boolean isSingleValue() {
    return singleValue;
  }

  /** Whether matches are drawn from the candidate values (In) or from everything else (NotIn). */
  public boolean isInclusive() {
    return inclusive;
  }
}
