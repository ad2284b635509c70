package com.gentoro.inventory.model.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.inventory.model.BaseResource;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/** Managed network switch. */
public class NetworkSwitch extends BaseResource {
  public static final String TYPE = "switch";

  private static final Pattern IPV4 =
      Pattern.compile("^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
  // Character-set check only; compressed forms such as "fe80::1" pass.
  private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:]{2,39}$");

  @JsonProperty("managementIp")
  private String managementIp;

  @JsonProperty("portCount")
  private int portCount;

  public NetworkSwitch() {
    super(TYPE);
  }

  public String getManagementIp() {
    return managementIp;
  }

  public NetworkSwitch setManagementIp(String managementIp) {
    this.managementIp = managementIp;
    return this;
  }

  public int getPortCount() {
    return portCount;
  }

  public NetworkSwitch setPortCount(int portCount) {
    this.portCount = portCount;
    return this;
  }

  @Override
  protected void collectViolations(List<String> violations) {
    super.collectViolations(violations);
    if (StringUtils.isBlank(managementIp)) {
      violations.add("managementIp is required");
    } else if (!isIpAddress(managementIp.trim())) {
      violations.add("managementIp '" + managementIp + "' is not an IP address");
    }
    if (portCount < 0) violations.add("portCount must not be negative");
  }

  static boolean isIpAddress(String value) {
    if (IPV4.matcher(value).matches()) return true;
    return value.contains(":") && IPV6.matcher(value).matches();
  }
}
