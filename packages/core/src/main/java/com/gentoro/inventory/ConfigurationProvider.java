package com.gentoro.inventory;

import com.gentoro.inventory.exception.InventoryErrorCode;
import com.gentoro.inventory.exception.InventoryException;
import com.gentoro.inventory.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration, either from an explicit file or from {@code application.yaml} on
 * the classpath.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String configFile) {
    this.configuration = load(configFile);
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration load(String configFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = open(configFile)) {
      if (in == null) {
        log.warn("No {} found on the classpath, using defaults", DEFAULT_RESOURCE);
        return yaml;
      }
      yaml.read(in);
      return yaml;
    } catch (IOException | ConfigurationException e) {
      String source = configFile == null ? DEFAULT_RESOURCE : configFile;
      throw new InventoryException(
          InventoryErrorCode.CONFIGURATION_ERROR, "Failed to load configuration from " + source, e);
    }
  }

  private static InputStream open(String configFile) throws IOException {
    if (configFile != null && !configFile.isBlank()) {
      Path path = Path.of(configFile);
      if (!Files.isRegularFile(path)) {
        throw new InventoryException(
            InventoryErrorCode.CONFIGURATION_ERROR, "Configuration file not found: " + path);
      }
      log.info("Loading configuration from {}", path.toAbsolutePath());
      return Files.newInputStream(path);
    }
    return ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
  }
}
