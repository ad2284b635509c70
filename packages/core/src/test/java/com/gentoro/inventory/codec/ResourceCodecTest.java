package com.gentoro.inventory.codec;

import static com.gentoro.inventory.TestResources.networkSwitch;
import static com.gentoro.inventory.TestResources.server;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.inventory.exception.InventoryErrorCode;
import com.gentoro.inventory.exception.InventoryException;
import com.gentoro.inventory.exception.ValidationException;
import com.gentoro.inventory.labelstore.LabelStore;
import com.gentoro.inventory.labelstore.Query;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceMap;
import com.gentoro.inventory.model.types.NetworkSwitch;
import com.gentoro.inventory.model.types.Server;
import com.gentoro.inventory.registry.ResourceTypeRegistry;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResourceCodecTest {

  private ResourceCodec codec;

  @BeforeEach
  void setUp() {
    codec = new ResourceCodec(ResourceTypeRegistry.discover());
  }

  @Test
  @DisplayName("decode instantiates the class named by the type field")
  void decodeByType() {
    Resource res =
        codec.decode(
            "{\"type\":\"switch\",\"id\":\"sw1\",\"managementIp\":\"10.0.0.5\","
                + "\"portCount\":24,\"labels\":{\"rack\":\"7\"},\"unknown\":true}");

    NetworkSwitch sw = assertInstanceOf(NetworkSwitch.class, res);
    assertEquals("sw1", sw.getId());
    assertEquals("10.0.0.5", sw.getManagementIp());
    assertEquals(24, sw.getPortCount());
    assertEquals(Map.of("rack", "7"), sw.getLabels());
    sw.validate();
  }

  @Test
  @DisplayName("Missing or unknown types and non-object payloads are validation failures")
  void rejectsBadPayloads() {
    assertThrows(ValidationException.class, () -> codec.decode("{\"id\":\"x\"}"));
    ValidationException ex =
        assertThrows(ValidationException.class, () -> codec.decode("{\"type\":\"router\"}"));
    assertEquals("router", ex.getContext().get("type"));
    assertThrows(ValidationException.class, () -> codec.decode("[1,2]"));
    assertThrows(ValidationException.class, () -> codec.decode("{\"type\":42}"));

    InventoryException malformed =
        assertThrows(InventoryException.class, () -> codec.decode("{not json"));
    assertEquals(InventoryErrorCode.CODEC_ERROR, malformed.getCode());
  }

  @Test
  @DisplayName("A store snapshot written to JSON seeds an equivalent store")
  void snapshotRoundTrip() {
    LabelStore store = new LabelStore(codec.factory());
    store.initialize();
    store.create(server("a", "rack", "7", "env", "prod"));
    store.create(networkSwitch("b", "rack", "8"));

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.writeSnapshot(store.snapshot(), out);
    String json = out.toString(StandardCharsets.UTF_8);
    assertTrue(json.contains("\"serialNumber\""), json);

    ResourceMap read =
        codec.readSnapshot(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    assertEquals(2, read.resourceCount());
    Server a = assertInstanceOf(Server.class, read.get("server").get(0));
    assertEquals("SN-a", a.getSerialNumber());

    LabelStore restored = new LabelStore(read);
    assertEquals(2, restored.size());
    assertEquals("b", restored.query(Query.equal("rack", "8")).get("switch").get(0).getId());
    assertEquals(1, restored.query(Query.equal("env", "prod")).resourceCount());
  }

  @Test
  @DisplayName("Snapshot shape errors are reported; an empty document is an empty map")
  void snapshotShape() {
    assertTrue(codec.readSnapshot("").isEmpty());
    assertThrows(ValidationException.class, () -> codec.readSnapshot("[]"));
    assertThrows(ValidationException.class, () -> codec.readSnapshot("{\"server\": {}}"));
    ResourceMap empty = codec.readSnapshot("{\"server\": []}");
    assertTrue(empty.containsKey("server"));
    assertEquals(0, empty.resourceCount());
  }

  @Test
  @DisplayName("encode writes the type tag so decode can read the resource back")
  void encodeDecode() {
    String json = codec.encode(server("a", "rack", "7"));
    Server back = assertInstanceOf(Server.class, codec.decode(json));
    assertEquals(Map.of("rack", "7"), back.getLabels());
  }
}
