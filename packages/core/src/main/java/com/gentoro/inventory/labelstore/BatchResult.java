package com.gentoro.inventory.labelstore;

import com.gentoro.inventory.exception.ErrorDetails;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Per-resource outcome of a bulk operation. */
public final class BatchResult {
  private final List<String> succeeded = new ArrayList<>();
  private final Map<String, ErrorDetails> failures = new LinkedHashMap<>();

  void succeeded(String id) {
    succeeded.add(id);
  }

  void failed(String id, ErrorDetails details) {
    failures.put(id, details);
  }

  /** Identifiers applied successfully, in input order. */
  public List<String> succeeded() {
    return Collections.unmodifiableList(succeeded);
  }

  /**
   * Failures keyed by resource identifier; entries without a usable identifier are keyed by their
   * position, as {@code #<index>}.
   */
  public Map<String, ErrorDetails> failures() {
    return Collections.unmodifiableMap(failures);
  }

  public boolean isSuccess() {
    return failures.isEmpty();
  }

  @Override
  public String toString() {
    return "BatchResult{succeeded=" + succeeded.size() + ", failed=" + failures.keySet() + "}";
  }
}
