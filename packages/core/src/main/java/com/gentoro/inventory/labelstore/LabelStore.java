package com.gentoro.inventory.labelstore;

import com.gentoro.inventory.exception.AlreadyExistsException;
import com.gentoro.inventory.exception.ExceptionUtil;
import com.gentoro.inventory.exception.InventoryErrorCode;
import com.gentoro.inventory.exception.InventoryException;
import com.gentoro.inventory.exception.NotFoundException;
import com.gentoro.inventory.exception.StateException;
import com.gentoro.inventory.exception.ValidationException;
import com.gentoro.inventory.logging.LoggingService;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceFactory;
import com.gentoro.inventory.model.ResourceMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;

/**
 * In-memory label index over inventory resources.
 *
 * <p>Keeps two structures in lock-step: a primary index (resource id to resource) and a secondary
 * index (label key to a {@link ResourceMap} keyed by label value). Both are guarded by a single
 * read/write lock: {@link #create}, {@link #update}, {@link #delete}, {@link #clear} and {@link
 * #wipe} take it exclusively, {@link #query}, {@link #load}, {@link #find} and {@link #size} share
 * it. Every operation holds the lock for its whole index walk, so readers always observe a state
 * produced by some serial order of the preceding writes.
 *
 * <p>Resources are held by reference, never copied. The labels a resource had when it was indexed
 * are remembered alongside it, and removal always works from those, so a caller changing a
 * resource's labels in place before calling {@link #update} still leaves no stale bucket entries.
 *
 * <p>Lifecycle: a store built from a {@link ResourceFactory} starts {@link State#UNINITIALIZED};
 * {@link #initialize()} or {@link #clear()} make it {@link State#READY}; {@link #wipe()} drops the
 * indices and leaves it {@link State#WIPED}. Every other operation on a store that is not ready
 * fails with {@link StateException}.
 */
public class LabelStore {
  private static final Logger log = LoggingService.getLogger(LabelStore.class);

  /** Observable lifecycle states. */
  public enum State {
    UNINITIALIZED,
    READY,
    WIPED
  }

  /** Primary index entry: the resource and the labels it was filed under. */
  private record Indexed(Resource resource, Map<String, String> labels) {}

  private final ReentrantReadWriteLock lock;
  private final ResourceFactory factory;
  private final LabelStoreOptions options;

  // Guarded by lock. Both null unless READY.
  private Map<String, Indexed> uuids;
  private Map<String, ResourceMap> labels;
  private State state = State.UNINITIALIZED;

  public LabelStore(ResourceFactory factory) {
    this(factory, LabelStoreOptions.defaults());
  }

  public LabelStore(ResourceFactory factory, LabelStoreOptions options) {
    this.factory = factory;
    this.options = Objects.requireNonNullElse(options, LabelStoreOptions.defaults());
    this.lock = new ReentrantReadWriteLock(this.options.fairLock());
  }

  public LabelStore(ResourceMap snapshot) {
    this(snapshot, LabelStoreOptions.defaults());
  }

  /**
   * Build a ready store seeded from a snapshot. Every resource in every list is indexed once; a
   * resource instance listed under several keys is indexed a single time.
   *
   * @throws AlreadyExistsException if two different instances share an identifier
   */
  public LabelStore(ResourceMap snapshot, LabelStoreOptions options) {
    this(Objects.requireNonNull(snapshot, "snapshot").getFactory(), options);
    allocate();
    for (String key : snapshot.keys()) {
      for (Resource resource : snapshot.get(key)) {
        Indexed existing = uuids.get(resource.getId());
        if (existing != null && existing.resource() == resource) continue;
        insert(resource);
      }
    }
    state = State.READY;
    log.info(
        "Label store seeded with {} resource(s) over {} label key(s)",
        uuids.size(),
        labels.size());
  }

  /** Make the store ready. A no-op when the indices already exist. */
  public void initialize() {
    Lock w = lock.writeLock();
    w.lock();
    try {
      if (uuids != null && labels != null) return;
      allocate();
      log.info("Label store initialized (was {})", state);
      state = State.READY;
    } finally {
      w.unlock();
    }
  }

  /** Drop both indices. The store is unusable until {@link #initialize()} or {@link #clear()}. */
  public void wipe() {
    Lock w = lock.writeLock();
    w.lock();
    try {
      uuids = null;
      labels = null;
      state = State.WIPED;
      log.info("Label store wiped");
    } finally {
      w.unlock();
    }
  }

  /** Reset both indices to empty. Always succeeds, whatever the current state. */
  public void clear() {
    Lock w = lock.writeLock();
    w.lock();
    try {
      allocate();
      state = State.READY;
      log.info("Label store cleared");
    } finally {
      w.unlock();
    }
  }

  public State state() {
    Lock r = lock.readLock();
    r.lock();
    try {
      return state;
    } finally {
      r.unlock();
    }
  }

  /**
   * Export the secondary index. Each non-empty (key, value) bucket becomes one entry keyed {@code
   * "<key> = <value>"} holding a copy of the bucket's list; resources themselves are shared.
   */
  public ResourceMap load() {
    Lock r = lock.readLock();
    r.lock();
    try {
      ensureReady("load");
      ResourceMap export = new ResourceMap(factory);
      for (Map.Entry<String, ResourceMap> byKey : labels.entrySet()) {
        ResourceMap byValue = byKey.getValue();
        for (String value : byValue.keys()) {
          List<Resource> bucket = byValue.get(value);
          if (!bucket.isEmpty()) {
            export.put(byKey.getKey() + " = " + value, bucket);
          }
        }
      }
      return export;
    } finally {
      r.unlock();
    }
  }

  /**
   * Index a new resource.
   *
   * @throws ValidationException if the resource fails validation
   * @throws AlreadyExistsException if the identifier is already indexed
   * @throws InventoryException with {@link InventoryErrorCode#INDEX_UPDATE_FAILED} if indexing
   *     fails part way; nothing of the resource is left behind
   */
  public void create(Resource resource) {
    Objects.requireNonNull(resource, "resource");
    resource.validate();

    Lock w = lock.writeLock();
    w.lock();
    try {
      ensureReady("create");
      insert(resource);
      log.debug(
          "Indexed {} '{}' with labels {}",
          resource.getType(),
          resource.getId(),
          resource.getLabels());
    } finally {
      w.unlock();
    }
  }

  /**
   * Replace the resource stored under the same identifier. Removal of the old label entries and
   * insertion of the new ones happen under one write lock acquisition.
   *
   * @throws ValidationException if the resource fails validation
   * @throws NotFoundException if nothing is indexed under the identifier
   * @throws InventoryException with {@link InventoryErrorCode#INDEX_UPDATE_FAILED} if the new
   *     resource could not be installed; the previous resource is restored first
   */
  public void update(Resource resource) {
    Objects.requireNonNull(resource, "resource");
    resource.validate();

    Lock w = lock.writeLock();
    w.lock();
    try {
      ensureReady("update");
      Indexed previous = uuids.get(resource.getId());
      if (previous == null) {
        NotFoundException ex =
            new NotFoundException("Cannot update missing resource '" + resource.getId() + "'");
        ex.withContext("id", resource.getId());
        throw ex;
      }
      replace(previous, resource);
      log.debug(
          "Updated {} '{}': labels {} -> {}",
          resource.getType(),
          resource.getId(),
          previous.labels(),
          resource.getLabels());
    } finally {
      w.unlock();
    }
  }

  /**
   * Remove every index entry for the resource's identifier. Deleting an identifier that is not
   * indexed succeeds and changes nothing.
   *
   * @throws ValidationException if the resource fails validation
   */
  public void delete(Resource resource) {
    Objects.requireNonNull(resource, "resource");
    resource.validate();

    Lock w = lock.writeLock();
    w.lock();
    try {
      ensureReady("delete");
      Indexed removed = uuids.remove(resource.getId());
      if (removed == null) {
        log.debug("Delete of unknown resource '{}' ignored", resource.getId());
        return;
      }
      unindex(removed);
      log.debug("Removed {} '{}'", removed.resource().getType(), resource.getId());
    } finally {
      w.unlock();
    }
  }

  /**
   * Evaluate a label-match query. The result is a fresh map keyed by resource type; the resources
   * in it are the instances held by the store.
   *
   * <p>A key that was never indexed matches nothing. A malformed query (see {@link
   * Query#validate()}) also matches nothing, unless the store runs with strict queries, in which
   * case it raises {@link com.gentoro.inventory.exception.InvalidQueryException}.
   */
  public ResourceMap query(Query query) {
    Objects.requireNonNull(query, "query");
    Lock r = lock.readLock();
    r.lock();
    try {
      ensureReady("query");
      ResourceMap results = new ResourceMap(factory);
      if (!query.isValid()) {
        if (options.strictQueries()) {
          query.validate();
        }
        log.debug("Malformed label query {} answered with no matches", query);
        return results;
      }

      ResourceMap byValue = labels.get(query.getKey());
      if (byValue == null) {
        return results;
      }

      Set<String> candidates = new LinkedHashSet<>(query.getValues());
      Set<String> seen = new HashSet<>();
      if (query.getOp().isInclusive()) {
        for (String value : candidates) {
          collect(byValue.get(value), results, seen);
        }
      } else {
        for (String value : byValue.keys()) {
          if (!candidates.contains(value)) {
            collect(byValue.get(value), results, seen);
          }
        }
      }
      return results;
    } finally {
      r.unlock();
    }
  }

  /**
   * Every indexed resource keyed by its type, in no particular order. This is the shape {@link
   * #LabelStore(ResourceMap)} seeds from, so it can be persisted and fed back later.
   */
  public ResourceMap snapshot() {
    Lock r = lock.readLock();
    r.lock();
    try {
      ensureReady("snapshot");
      ResourceMap all = new ResourceMap(factory);
      for (Indexed indexed : uuids.values()) {
        all.add(indexed.resource(), indexed.resource().getType());
      }
      return all;
    } finally {
      r.unlock();
    }
  }

  /** Primary-index lookup. */
  public Optional<Resource> find(String id) {
    Lock r = lock.readLock();
    r.lock();
    try {
      ensureReady("find");
      Indexed indexed = id == null ? null : uuids.get(id);
      return indexed == null ? Optional.empty() : Optional.of(indexed.resource());
    } finally {
      r.unlock();
    }
  }

  /** Number of indexed resources. */
  public int size() {
    Lock r = lock.readLock();
    r.lock();
    try {
      ensureReady("size");
      return uuids.size();
    } finally {
      r.unlock();
    }
  }

  /**
   * {@link #create} each resource in turn, recording failures instead of stopping at the first
   * one. Resources that were created stay created when a later one fails.
   *
   * @throws StateException if the store is not ready
   */
  public BatchResult createAll(Iterable<? extends Resource> resources) {
    Objects.requireNonNull(resources, "resources");
    ensureReadyShared("createAll");

    BatchResult result = new BatchResult();
    int index = 0;
    for (Resource resource : resources) {
      int position = index++;
      String id = resource == null ? null : resource.getId();
      String reportKey = id == null ? "#" + position : id;
      if (resource == null) {
        ValidationException ex = new ValidationException("Resource #" + position + " is null");
        result.failed(reportKey, ExceptionUtil.toErrorDetails(ex));
        continue;
      }
      try {
        create(resource);
        result.succeeded(id);
      } catch (StateException e) {
        throw e;
      } catch (InventoryException e) {
        result.failed(reportKey, ExceptionUtil.toErrorDetails(e));
      }
    }
    if (!result.isSuccess()) {
      log.warn(
          "Bulk create finished with {} failure(s): {}",
          result.failures().size(),
          result.failures().keySet());
    }
    return result;
  }

  private void allocate() {
    uuids = new HashMap<>();
    labels = new HashMap<>();
  }

  private void ensureReady(String operation) {
    if (state != State.READY) {
      StateException ex = new StateException("Cannot " + operation + ": label store is " + state);
      ex.withContext("state", state);
      throw ex;
    }
  }

  private void ensureReadyShared(String operation) {
    Lock r = lock.readLock();
    r.lock();
    try {
      ensureReady(operation);
    } finally {
      r.unlock();
    }
  }

  // The methods below must only be called with the write lock held.

  private void insert(Resource resource) {
    String id = resource.getId();
    if (uuids.containsKey(id)) {
      AlreadyExistsException ex =
          new AlreadyExistsException("Resource '" + id + "' already exists");
      ex.withContext("id", id);
      throw ex;
    }
    Map<String, String> indexedLabels;
    try {
      indexedLabels = indexLabels(resource);
    } catch (RuntimeException e) {
      log.error(
          "Rolled back create of '{}': {} [{}]",
          id,
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e, 5));
      InventoryException ex =
          new InventoryException(
              InventoryErrorCode.INDEX_UPDATE_FAILED,
              "Could not index new resource '" + id + "'",
              e);
      ex.withContext("id", id);
      throw ex;
    }
    uuids.put(id, new Indexed(resource, indexedLabels));
  }

  private void replace(Indexed previous, Resource next) {
    String id = next.getId();
    unindex(previous);
    try {
      Map<String, String> indexedLabels = indexLabels(next);
      uuids.put(id, new Indexed(next, indexedLabels));
    } catch (RuntimeException e) {
      addToBuckets(previous.resource(), previous.labels());
      log.error(
          "Rolled back update of '{}': {} [{}]",
          id,
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e, 5));
      InventoryException ex =
          new InventoryException(
              InventoryErrorCode.INDEX_UPDATE_FAILED,
              "Could not install new version of resource '" + id + "'",
              e);
      ex.withContext("id", id);
      throw ex;
    }
  }

  /**
   * File the resource under each of its labels. All or nothing: if reading the labels fails
   * midway, entries already added are removed before the failure propagates.
   *
   * @return the labels the resource was filed under
   */
  private Map<String, String> indexLabels(Resource resource) {
    Map<String, String> snapshot = new LinkedHashMap<>(resource.getLabels());
    List<Map.Entry<String, String>> added = new ArrayList<>(snapshot.size());
    try {
      for (Map.Entry<String, String> label : snapshot.entrySet()) {
        bucket(label.getKey()).add(resource, label.getValue());
        added.add(label);
      }
    } catch (RuntimeException e) {
      for (Map.Entry<String, String> label : added) {
        labels.get(label.getKey()).delete(resource, label.getValue());
      }
      throw e;
    }
    return snapshot;
  }

  private void addToBuckets(Resource resource, Map<String, String> labelSet) {
    for (Map.Entry<String, String> label : labelSet.entrySet()) {
      bucket(label.getKey()).add(resource, label.getValue());
    }
  }

  private ResourceMap bucket(String labelKey) {
    return labels.computeIfAbsent(labelKey, k -> new ResourceMap(factory));
  }

  // Empty buckets are left in place; they simply match nothing.
  private void unindex(Indexed indexed) {
    for (Map.Entry<String, String> label : indexed.labels().entrySet()) {
      ResourceMap byValue = labels.get(label.getKey());
      if (byValue != null) {
        byValue.delete(indexed.resource(), label.getValue());
      }
    }
  }

  private static void collect(List<Resource> bucket, ResourceMap results, Set<String> seen) {
    for (Resource resource : bucket) {
      if (seen.add(resource.getId())) {
        results.add(resource, resource.getType());
      }
    }
  }
}
