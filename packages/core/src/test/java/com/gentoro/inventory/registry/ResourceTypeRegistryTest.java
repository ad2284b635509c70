package com.gentoro.inventory.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.inventory.exception.AlreadyExistsException;
import com.gentoro.inventory.exception.NotFoundException;
import com.gentoro.inventory.exception.StateException;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.types.NetworkSwitch;
import com.gentoro.inventory.model.types.Rack;
import com.gentoro.inventory.model.types.Server;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResourceTypeRegistryTest {

  @Test
  @DisplayName("discover picks up the bundled datacenter types through ServiceLoader")
  void discoverBundledTypes() {
    ResourceTypeRegistry registry = ResourceTypeRegistry.discover();
    assertTrue(registry.types().containsAll(Set.of("server", "switch", "rack")));

    Resource server = registry.create("server");
    assertInstanceOf(Server.class, server);
    assertNull(server.getId(), "zero-value instance");
    assertInstanceOf(NetworkSwitch.class, registry.create("switch"));
    assertInstanceOf(Rack.class, registry.create("rack"));
    assertNotSame(registry.create("server"), registry.create("server"));
  }

  @Test
  @DisplayName("Duplicate and unknown type tags are rejected")
  void duplicateAndUnknown() {
    ResourceTypeRegistry registry = new ResourceTypeRegistry().register("server", Server::new);
    assertThrows(AlreadyExistsException.class, () -> registry.register("server", Server::new));
    assertThrows(IllegalArgumentException.class, () -> registry.register(" ", Server::new));
    assertThrows(NotFoundException.class, () -> registry.create("router"));
    assertThrows(NotFoundException.class, () -> registry.create(null));
    assertFalse(registry.isRegistered("router"));
  }

  @Test
  @DisplayName("A constructor producing a different type tag is reported")
  void mismatchedConstructor() {
    ResourceTypeRegistry registry = new ResourceTypeRegistry().register("router", Server::new);
    assertThrows(StateException.class, () -> registry.create("router"));
  }
}
