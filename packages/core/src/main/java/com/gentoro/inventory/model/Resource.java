package com.gentoro.inventory.model;

import com.gentoro.inventory.exception.ValidationException;
import java.util.Map;

/**
 * A typed, identity-bearing inventory entity carrying free-form labels.
 *
 * <p>Resources are shared by reference between callers and the label store. Callers must not
 * change a resource's labels after handing it to the store except through {@code update}, or the
 * label index will no longer reflect the resource.
 */
public interface Resource {
  /** Globally unique, stable identifier. */
  String getId();

  /** Type tag, as understood by {@link ResourceFactory#create(String)}. */
  String getType();

  /** Label key to label value. Keys are unique; the returned map is read-only. */
  Map<String, String> getLabels();

  /**
   * Check the resource's own invariants.
   *
   * @throws ValidationException describing the first set of violations found
   */
  void validate();
}
