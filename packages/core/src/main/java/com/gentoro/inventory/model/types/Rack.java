package com.gentoro.inventory.model.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.inventory.model.BaseResource;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/** Datacenter rack, addressed by row and position within the row. */
public class Rack extends BaseResource {
  public static final String TYPE = "rack";

  @JsonProperty("row")
  private String row;

  @JsonProperty("position")
  private int position;

  public Rack() {
    super(TYPE);
  }

  public String getRow() {
    return row;
  }

  public Rack setRow(String row) {
    this.row = row;
    return this;
  }

  public int getPosition() {
    return position;
  }

  public Rack setPosition(int position) {
    this.position = position;
    return this;
  }

  @Override
  protected void collectViolations(List<String> violations) {
    super.collectViolations(violations);
    if (StringUtils.isBlank(row)) violations.add("row is required");
    if (position < 0) violations.add("position must not be negative");
  }
}
