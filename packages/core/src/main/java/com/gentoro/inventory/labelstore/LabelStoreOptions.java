package com.gentoro.inventory.labelstore;

import org.apache.commons.configuration2.Configuration;

/**
 * Tunables for {@link LabelStore}.
 *
 * @param fairLock use a fair read/write lock, so waiting writers are not starved by a stream of
 *     readers
 * @param strictQueries throw on malformed queries instead of answering with an empty result
 */
public record LabelStoreOptions(boolean fairLock, boolean strictQueries) {
  public static final String FAIR_LOCK_KEY = "labelstore.lock.fair";
  public static final String STRICT_QUERIES_KEY = "labelstore.query.strict";

  public static LabelStoreOptions defaults() {
    return new LabelStoreOptions(false, false);
  }

  public static LabelStoreOptions fromConfiguration(Configuration configuration) {
    if (configuration == null) return defaults();
    return new LabelStoreOptions(
        configuration.getBoolean(FAIR_LOCK_KEY, false),
        configuration.getBoolean(STRICT_QUERIES_KEY, false));
  }
}
