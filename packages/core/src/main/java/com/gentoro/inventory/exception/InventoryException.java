package com.gentoro.inventory.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the inventory exception hierarchy. Every failure carries an {@link InventoryErrorCode}
 * and an optional context map (resource id, label key, ...) that callers can render without
 * parsing the message.
 */
public class InventoryException extends RuntimeException {
  private final InventoryErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public InventoryException(InventoryErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public InventoryException(InventoryErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public InventoryErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for chaining at the throw site. */
  public InventoryException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
