package com.gentoro.inventory.registry;

import com.gentoro.inventory.exception.AlreadyExistsException;
import com.gentoro.inventory.exception.NotFoundException;
import com.gentoro.inventory.exception.StateException;
import com.gentoro.inventory.logging.LoggingService;
import com.gentoro.inventory.model.Resource;
import com.gentoro.inventory.model.ResourceFactory;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * {@link ResourceFactory} backed by a map of type tag to zero-value constructor. Types are added
 * directly through {@link #register} or contributed by {@link ResourceTypeProvider}s found on the
 * classpath.
 */
public class ResourceTypeRegistry implements ResourceFactory {
  private static final Logger log = LoggingService.getLogger(ResourceTypeRegistry.class);

  private final Map<String, Supplier<? extends Resource>> constructors = new ConcurrentHashMap<>();

  /** Build a registry populated by every {@link ResourceTypeProvider} visible to ServiceLoader. */
  public static ResourceTypeRegistry discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static ResourceTypeRegistry discover(ClassLoader classLoader) {
    ResourceTypeRegistry registry = new ResourceTypeRegistry();
    for (ResourceTypeProvider provider :
        ServiceLoader.load(ResourceTypeProvider.class, classLoader)) {
      int before = registry.constructors.size();
      provider.registerTypes(registry);
      log.debug(
          "Resource type provider '{}' registered {} type(s)",
          provider.id(),
          registry.constructors.size() - before);
    }
    log.info("Resource types available: {}", registry.types());
    return registry;
  }

  public ResourceTypeRegistry register(String type, Supplier<? extends Resource> constructor) {
    if (StringUtils.isBlank(type)) {
      throw new IllegalArgumentException("type must not be blank");
    }
    Objects.requireNonNull(constructor, "constructor");
    if (constructors.putIfAbsent(type, constructor) != null) {
      throw new AlreadyExistsException("Resource type already registered: " + type);
    }
    return this;
  }

  public boolean isRegistered(String type) {
    return type != null && constructors.containsKey(type);
  }

  @Override
  public Resource create(String type) {
    Supplier<? extends Resource> constructor = type == null ? null : constructors.get(type);
    if (constructor == null) {
      throw new NotFoundException("Unknown resource type: " + type);
    }
    Resource resource = constructor.get();
    if (resource == null || !type.equals(resource.getType())) {
      throw new StateException(
          "Constructor for type '"
              + type
              + "' produced "
              + (resource == null ? "null" : "type '" + resource.getType() + "'"));
    }
    return resource;
  }

  @Override
  public Set<String> types() {
    return Collections.unmodifiableSet(new TreeSet<>(constructors.keySet()));
  }
}
