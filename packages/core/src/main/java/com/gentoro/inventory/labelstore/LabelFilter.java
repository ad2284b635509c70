package com.gentoro.inventory.labelstore;

import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceMap;

/**
 * Narrows an existing result map by a further label query, without touching the label index. Used
 * to chain several label queries: the first goes through {@link LabelStore#query(Query)}, the rest
 * through here.
 */
public final class LabelFilter {
  private LabelFilter() {}

  /**
   * @return a new map with the same keys as {@code resources}, holding only matching resources;
   *     keys left without matches are dropped
   * @throws com.gentoro.inventory.exception.InvalidQueryException if the query is malformed
   */
  public static ResourceMap filter(Query query, ResourceMap resources) {
    query.validate();
    ResourceMap result = new ResourceMap(resources.getFactory());
    for (String key : resources.keys()) {
      for (Resource resource : resources.get(key)) {
        if (query.matches(resource.getLabels())) {
          result.add(resource, key);
        }
      }
    }
    return result;
  }
}
