package com.gentoro.inventory.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Two-level container: a string key (resource type, label value, or "key = value" in exports)
 * mapped to the list of resources filed under it.
 *
 * <p>Used both as the result type handed to callers and as the per-label-value bucket inside the
 * label store. Not thread-safe; the label store guards its own instances.
 */
public class ResourceMap {
  private final ResourceFactory factory;
  private final Map<String, List<Resource>> resources = new LinkedHashMap<>();

  public ResourceMap(ResourceFactory factory) {
    this.factory = factory;
  }

  /** Factory the contained resources were built with; may be null for ad-hoc maps. */
  public ResourceFactory getFactory() {
    return factory;
  }

  public void add(Resource resource, String key) {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(key, "key");
    resources.computeIfAbsent(key, k -> new ArrayList<>()).add(resource);
  }

  /**
   * Remove the resource with the same identifier from the list under {@code key}. The list itself
   * stays in place even when it becomes empty.
   *
   * @return whether an entry was removed
   */
  public boolean delete(Resource resource, String key) {
    List<Resource> list = resources.get(key);
    if (list == null || resource == null) return false;
    String id = resource.getId();
    return list.removeIf(r -> Objects.equals(r.getId(), id));
  }

  /** Replace the list stored under {@code key} with a copy of {@code list}. */
  public void put(String key, List<? extends Resource> list) {
    Objects.requireNonNull(key, "key");
    resources.put(key, new ArrayList<>(Objects.requireNonNullElse(list, List.of())));
  }

  /** Read-only view of the list under {@code key}; empty for an unknown key. */
  public List<Resource> get(String key) {
    List<Resource> list = resources.get(key);
    return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
  }

  public boolean containsKey(String key) {
    return resources.containsKey(key);
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(resources.keySet());
  }

  /** Number of keys, including keys whose list is empty. */
  public int size() {
    return resources.size();
  }

  /** Total number of list entries across all keys. */
  public int resourceCount() {
    int count = 0;
    for (List<Resource> list : resources.values()) count += list.size();
    return count;
  }

  public boolean isEmpty() {
    return resources.isEmpty();
  }

  /** New map with copied lists. Resource references are shared, not cloned. */
  public ResourceMap copy() {
    ResourceMap copy = new ResourceMap(factory);
    resources.forEach(copy::put);
    return copy;
  }

  @JsonValue
  public Map<String, List<Resource>> asMap() {
    Map<String, List<Resource>> view = new LinkedHashMap<>();
    resources.forEach((k, v) -> view.put(k, Collections.unmodifiableList(v)));
    return Collections.unmodifiableMap(view);
  }

  @Override
  public String toString() {
    return "ResourceMap" + resources;
  }
}
