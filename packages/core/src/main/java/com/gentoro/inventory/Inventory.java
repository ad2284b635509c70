package com.gentoro.inventory;

import com.gentoro.inventory.codec.ResourceCodec;
import com.gentoro.inventory.exception.InventoryErrorCode;
import com.gentoro.inventory.exception.InventoryException;
import com.gentoro.inventory.exception.StateException;
import com.gentoro.inventory.labelstore.LabelStore;
import com.gentoro.inventory.labelstore.LabelStoreOptions;
import com.gentoro.inventory.logging.LoggingService;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceFactory;
import com.gentoro.inventory.model.ResourceMap;
import com.gentoro.inventory.registry.ResourceTypeRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Wires the inventory core together: configuration, logging levels, resource types discovered on
 * the classpath, the JSON codec and the label store, optionally seeded from a snapshot file named
 * by {@code labelstore.snapshot.location}.
 */
public class Inventory implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(Inventory.class);

  public static final String SNAPSHOT_LOCATION_KEY = "labelstore.snapshot.location";

  private final Configuration configuration;
  private ResourceTypeRegistry registry;
  private ResourceCodec codec;
  private LabelStore labelStore;

  public Inventory(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Load configuration from {@code configFile}, or the classpath default when null. */
  public static Inventory fromConfigFile(String configFile) {
    return new Inventory(new ConfigurationProvider(configFile).config());
  }

  public Inventory initialize() {
    LoggingService.applyConfiguration(configuration);
    this.registry = ResourceTypeRegistry.discover();
    this.codec = new ResourceCodec(registry);

    LabelStoreOptions options = LabelStoreOptions.fromConfiguration(configuration);
    String snapshotLocation = configuration.getString(SNAPSHOT_LOCATION_KEY, null);
    if (StringUtils.isBlank(snapshotLocation)) {
      this.labelStore = new LabelStore(registry, options);
      this.labelStore.initialize();
    } else {
      this.labelStore = new LabelStore(readSnapshot(Path.of(snapshotLocation)), options);
    }
    log.info("Inventory ready: {} resource(s), options {}", labelStore.size(), options);
    return this;
  }

  public Configuration configuration() {
    return configuration;
  }

  public ResourceFactory resourceFactory() {
    return requireInitialized(registry);
  }

  public ResourceCodec codec() {
    return requireInitialized(codec);
  }

  public LabelStore labelStore() {
    return requireInitialized(labelStore);
  }

  /** Persist every indexed resource, keyed by type, in the format {@link #initialize()} reads. */
  public void saveSnapshot(Path target) {
    ResourceMap all = labelStore().snapshot();
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      try (OutputStream out = Files.newOutputStream(target)) {
        codec().writeSnapshot(all, out);
      }
      log.info("Wrote snapshot of {} resource(s) to {}", all.resourceCount(), target);
    } catch (IOException e) {
      throw new InventoryException(
          InventoryErrorCode.CODEC_ERROR, "Cannot write snapshot to " + target, e);
    }
  }

  public void shutdown() {
    if (labelStore != null) {
      labelStore.wipe();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private ResourceMap readSnapshot(Path location) {
    if (!Files.isRegularFile(location)) {
      throw new InventoryException(
          InventoryErrorCode.CONFIGURATION_ERROR, "Snapshot not found: " + location);
    }
    ResourceMap snapshot;
    try (InputStream in = Files.newInputStream(location)) {
      snapshot = codec.readSnapshot(in);
    } catch (IOException e) {
      throw new InventoryException(
          InventoryErrorCode.CONFIGURATION_ERROR, "Cannot read snapshot " + location, e);
    }
    for (String key : snapshot.keys()) {
      for (Resource resource : snapshot.get(key)) {
        resource.validate();
      }
    }
    log.info("Seeding label store from {} ({} resource(s))", location, snapshot.resourceCount());
    return snapshot;
  }

  private static <T> T requireInitialized(T component) {
    if (component == null) {
      throw new StateException("Inventory has not been initialized");
    }
    return component;
  }
}
