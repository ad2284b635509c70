package com.gentoro.inventory.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.inventory.exception.InventoryErrorCode;
import com.gentoro.inventory.exception.InventoryException;
import com.gentoro.inventory.exception.ValidationException;
import com.gentoro.inventory.logging.LoggingService;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceFactory;
import com.gentoro.inventory.model.ResourceMap;
import com.gentoro.inventory.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * JSON mapping for resources and resource maps.
 *
 * <p>A resource payload names its concrete type in a {@code type} field; the codec asks the {@link
 * ResourceFactory} for a zero-value instance of that type and lets Jackson populate it. A snapshot
 * is a {@link ResourceMap} rendered as {@code {"<key>": [resource, ...], ...}}.
 */
public class ResourceCodec {
  private static final Logger log = LoggingService.getLogger(ResourceCodec.class);

  private final ResourceFactory factory;
  private final ObjectMapper mapper;

  public ResourceCodec(ResourceFactory factory) {
    this(factory, JacksonUtility.getJsonMapper());
  }

  public ResourceCodec(ResourceFactory factory, ObjectMapper mapper) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public ResourceFactory factory() {
    return factory;
  }

  /**
   * Decode a single resource payload. The result is not validated; callers hand it to the label
   * store, which does.
   *
   * @throws ValidationException if the payload is not an object or names no known type
   * @throws InventoryException with {@link InventoryErrorCode#CODEC_ERROR} for malformed JSON
   */
  public Resource decode(String json) {
    return decode(readTree(json));
  }

  public Resource decode(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new ValidationException("Resource payload must be a JSON object");
    }
    JsonNode typeNode = node.get("type");
    String type = typeNode == null || !typeNode.isTextual() ? null : typeNode.asText();
    if (type == null || type.isBlank()) {
      throw new ValidationException("Resource payload has no type");
    }
    if (!factory.types().contains(type)) {
      ValidationException ex = new ValidationException("Unknown resource type '" + type + "'");
      ex.withContext("type", type);
      throw ex;
    }

    Resource resource = factory.create(type);
    try {
      return mapper.readerForUpdating(resource).readValue(node);
    } catch (IOException e) {
      throw new InventoryException(
          InventoryErrorCode.CODEC_ERROR, "Cannot map payload onto type '" + type + "'", e);
    }
  }

  public String encode(Resource resource) {
    try {
      return mapper.writeValueAsString(resource);
    } catch (IOException e) {
      throw new InventoryException(
          InventoryErrorCode.CODEC_ERROR, "Cannot encode resource '" + resource.getId() + "'", e);
    }
  }

  public String writeSnapshot(ResourceMap resources) {
    try {
      return mapper.writeValueAsString(resources);
    } catch (IOException e) {
      throw new InventoryException(InventoryErrorCode.CODEC_ERROR, "Cannot encode snapshot", e);
    }
  }

  public void writeSnapshot(ResourceMap resources, OutputStream out) {
    try {
      mapper.writeValue(out, resources);
    } catch (IOException e) {
      throw new InventoryException(InventoryErrorCode.CODEC_ERROR, "Cannot write snapshot", e);
    }
  }

  public ResourceMap readSnapshot(String json) {
    return readSnapshot(readTree(json));
  }

  public ResourceMap readSnapshot(InputStream in) {
    try {
      return readSnapshot(mapper.readTree(in));
    } catch (IOException e) {
      throw new InventoryException(InventoryErrorCode.CODEC_ERROR, "Cannot read snapshot", e);
    }
  }

  private ResourceMap readSnapshot(JsonNode root) {
    ResourceMap resources = new ResourceMap(factory);
    if (root == null || root.isNull() || root.isMissingNode()) {
      return resources;
    }
    if (!root.isObject()) {
      throw new ValidationException("Snapshot must be a JSON object of resource lists");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode list = field.getValue();
      if (!list.isArray()) {
        ValidationException ex =
            new ValidationException("Snapshot entry '" + field.getKey() + "' is not a list");
        ex.withContext("key", field.getKey());
        throw ex;
      }
      resources.put(field.getKey(), List.of());
      for (JsonNode item : list) {
        resources.add(decode(item), field.getKey());
      }
    }
    log.debug(
        "Read snapshot with {} key(s), {} resource(s)",
        resources.size(),
        resources.resourceCount());
    return resources;
  }

  private JsonNode readTree(String json) {
    try {
      return mapper.readTree(json);
    } catch (IOException e) {
      throw new InventoryException(InventoryErrorCode.CODEC_ERROR, "Malformed JSON", e);
    }
  }
}
