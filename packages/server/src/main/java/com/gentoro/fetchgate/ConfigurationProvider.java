package com.gentoro.fetchgate;

import com.gentoro.fetchgate.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/** Loads the YAML application configuration from the file system or the classpath. */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.fetchgate.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final Configuration config;

  public ConfigurationProvider(String location) {
    this.config = load(location);
  }

  public Configuration config() {
    return config;
  }

  private static Configuration load(String location) {
    if (location == null || location.isBlank()) {
      throw new ConfigException("Configuration location must not be blank");
    }
    YAMLConfiguration yaml = new YAMLConfiguration();
    FileHandler handler = new FileHandler(yaml);
    try (InputStream in = open(location.trim())) {
      handler.load(in);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to load configuration from " + location, e);
    }
    log.debug("Loaded configuration from {}", location);
    return yaml;
  }

  private static InputStream open(String location) throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      if (resource.startsWith("/")) resource = resource.substring(1);
      InputStream in =
          ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      return in;
    }
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newInputStream(path);
  }
}
