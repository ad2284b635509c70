package com.gentoro.inventory.registry;

import com.gentoro.inventory.model.types.NetworkSwitch;
import com.gentoro.inventory.model.types.Rack;
import com.gentoro.inventory.model.types.Server;

/** Bundled datacenter asset types. */
public class DatacenterResourceTypes implements ResourceTypeProvider {
  @Override
  public String id() {
    return "datacenter";
  }

  @Override
  public void registerTypes(ResourceTypeRegistry registry) {
    registry.register(Server.TYPE, Server::new);
    registry.register(NetworkSwitch.TYPE, NetworkSwitch::new);
    registry.register(Rack.TYPE, Rack::new);
  }
}
