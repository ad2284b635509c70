package com.gentoro.inventory.model.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.inventory.model.BaseResource;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/** Physical compute host. */
public class Server extends BaseResource {
  public static final String TYPE = "server";

  @JsonProperty("serialNumber")
  private String serialNumber;

  @JsonProperty("model")
  private String model;

  public Server() {
    super(TYPE);
  }

  public String getSerialNumber() {
    return serialNumber;
  }

  public Server setSerialNumber(String serialNumber) {
    this.serialNumber = serialNumber;
    return this;
  }

  public String getModel() {
    return model;
  }

  public Server setModel(String model) {
    this.model = model;
    return this;
  }

  @Override
  protected void collectViolations(List<String> violations) {
    super.collectViolations(violations);
    if (StringUtils.isBlank(serialNumber)) violations.add("serialNumber is required");
  }
}
