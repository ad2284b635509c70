package com.gentoro.inventory.labelstore;

import static com.gentoro.inventory.TestResources.server;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.inventory.exception.AlreadyExistsException;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceMap;
import com.gentoro.inventory.registry.ResourceTypeRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LabelStoreConcurrencyTest {

  private static final int WRITERS = 4;
  private static final int READERS = 4;
  private static final int PER_WRITER = 200;

  @Test
  @DisplayName("Concurrent writers and readers: readers never see a resource in two rack buckets")
  void readersSeeConsistentState() throws Exception {
    LabelStore store =
        new LabelStore(ResourceTypeRegistry.discover(), new LabelStoreOptions(true, false));
    store.initialize();

    ExecutorService pool = Executors.newFixedThreadPool(WRITERS + READERS);
    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch writersDone = new CountDownLatch(WRITERS);
    ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
    List<Future<?>> futures = new ArrayList<>();

    try {
      for (int w = 0; w < WRITERS; w++) {
        final int writer = w;
        futures.add(
            pool.submit(
                () -> {
                  await(start);
                  try {
                    for (int i = 0; i < PER_WRITER; i++) {
                      String id = "w" + writer + "-" + i;
                      store.create(server(id, "rack", "A", "writer", "w" + writer));
                      // Readers must see it in rack A or rack B, never both.
                      store.update(server(id, "rack", "B", "writer", "w" + writer));
                      if (i % 3 == 0) {
                        store.delete(server(id));
                      }
                    }
                  } finally {
                    writersDone.countDown();
                  }
                  return null;
                }));
      }
      for (int r = 0; r < READERS; r++) {
        futures.add(
            pool.submit(
                () -> {
                  await(start);
                  while (writersDone.getCount() > 0) {
                    // One export is one read-lock acquisition, so it must be self-consistent.
                    ResourceMap export = store.load();
                    Set<String> inA = ids(export.get("rack = A"));
                    Set<String> inB = ids(export.get("rack = B"));
                    Set<String> racked = new HashSet<>(inA);
                    racked.addAll(inB);
                    if (racked.size() != inA.size() + inB.size()) {
                      violations.add("resource in both racks: " + inA + " / " + inB);
                    }
                    Set<String> byWriter = new HashSet<>();
                    for (int w = 0; w < WRITERS; w++) {
                      byWriter.addAll(ids(export.get("writer = w" + w)));
                    }
                    if (!racked.equals(byWriter)) {
                      violations.add("labels indexed partially");
                    }
                    store.query(Query.in("rack", "A", "B"));
                  }
                  return null;
                }));
      }

      start.countDown();
      for (Future<?> f : futures) {
        f.get(60, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertTrue(violations.isEmpty(), violations.toString());

    int deletedPerWriter = (PER_WRITER + 2) / 3;
    int expected = WRITERS * (PER_WRITER - deletedPerWriter);
    assertEquals(expected, store.size());
    assertTrue(store.query(Query.equal("rack", "A")).isEmpty());
    assertEquals(expected, store.query(Query.equal("rack", "B")).resourceCount());
    for (int w = 0; w < WRITERS; w++) {
      assertEquals(
          PER_WRITER - deletedPerWriter,
          store.query(Query.equal("writer", "w" + w)).resourceCount());
    }
  }

  @Test
  @DisplayName("Racing creates of the same id: exactly one wins")
  void racingCreates() throws Exception {
    LabelStore store = new LabelStore(ResourceTypeRegistry.discover());
    store.initialize();

    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        final int n = t;
        results.add(
            pool.submit(
                () -> {
                  await(start);
                  try {
                    store.create(server("shared", "rack", String.valueOf(n)));
                    return true;
                  } catch (AlreadyExistsException e) {
                    return false;
                  }
                }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> f : results) {
        if (f.get(30, TimeUnit.SECONDS)) winners++;
      }
      assertEquals(1, winners);
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, store.size());
    assertEquals(1, store.load().size());
  }

  private static Set<String> ids(List<Resource> resources) {
    Set<String> ids = new HashSet<>();
    for (Resource resource : resources) ids.add(resource.getId());
    return ids;
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
