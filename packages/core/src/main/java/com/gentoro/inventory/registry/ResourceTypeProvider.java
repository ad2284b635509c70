package com.gentoro.inventory.registry;

/**
 * Service Provider Interface for pluggable resource types.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.inventory.registry.ResourceTypeProvider
 */
public interface ResourceTypeProvider {
  /** Unique provider id, used in log output. */
  String id();

  /** Register every type this provider contributes. */
  void registerTypes(ResourceTypeRegistry registry);
}
