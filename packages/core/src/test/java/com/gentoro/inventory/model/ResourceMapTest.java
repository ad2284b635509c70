package com.gentoro.inventory.model;

import static com.gentoro.inventory.TestResources.server;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.inventory.model.types.Server;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResourceMapTest {

  @Test
  @DisplayName("add groups resources by key and get of an unknown key is empty")
  void addAndGet() {
    ResourceMap map = new ResourceMap(null);
    Server a = server("a");
    Server b = server("b");
    map.add(a, "server");
    map.add(b, "server");

    assertEquals(List.of(a, b), map.get("server"));
    assertTrue(map.get("rack").isEmpty());
    assertEquals(1, map.size());
    assertEquals(2, map.resourceCount());
    assertThrows(UnsupportedOperationException.class, () -> map.get("server").add(a));
  }

  @Test
  @DisplayName("delete matches by identifier and leaves the emptied list in place")
  void deleteById() {
    ResourceMap map = new ResourceMap(null);
    map.add(server("a", "rack", "7"), "7");

    assertTrue(map.delete(server("a"), "7"), "different instance, same id");
    assertFalse(map.delete(server("a"), "7"));
    assertFalse(map.delete(server("a"), "unknown"));
    assertTrue(map.containsKey("7"));
    assertTrue(map.get("7").isEmpty());
  }

  @Test
  @DisplayName("copy and put detach lists but share resource instances")
  void copySemantics() {
    ResourceMap map = new ResourceMap(null);
    Server a = server("a");
    map.add(a, "server");

    ResourceMap copy = map.copy();
    copy.add(server("b"), "server");
    assertEquals(1, map.get("server").size());
    assertSame(a, copy.get("server").get(0));

    List<Resource> source = new ArrayList<>(List.of(a));
    map.put("other", source);
    source.clear();
    assertEquals(1, map.get("other").size());
  }
}
