package com.gentoro.fedquery.config;

import com.gentoro.fedquery.exception.ConfigurationException;
import com.gentoro.fedquery.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Loads the application configuration from YAML.
 *
 * <p>Resolution order: an explicit file (from {@code --config}) replaces the bundled {@code
 * application.yaml}; afterwards every key can be overridden by an environment variable named
 * {@code FEDQUERY_} followed by the key upper-cased with dots and dashes replaced by underscores
 * ({@code engine.retry.max-attempts} becomes {@code FEDQUERY_ENGINE_RETRY_MAX_ATTEMPTS}). The keys
 * the engine reads are always overridable, including those the loaded file leaves out.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";
  static final String ENV_PREFIX = "FEDQUERY_";

  /** Every key read by the engine and the bundled data source providers. */
  static final List<String> KNOWN_KEYS =
      List.of(
          "engine.worker-threads",
          "engine.max-concurrent-queries",
          "engine.plan-deadline-ms",
          "engine.step-timeout-ms",
          "engine.retry.max-attempts",
          "engine.retry.base-delay-ms",
          "engine.retry.max-delay-ms",
          "engine.retry.jitter",
          "telemetry.sink",
          "telemetry.memory.capacity",
          "sources.mongodb.enabled",
          "sources.mongodb.uri",
          "sources.mongodb.database",
          "sources.mongodb.server-selection-timeout-ms",
          "sources.mongodb.allowed-operations",
          "sources.mongodb.default-find-limit",
          "sources.mongodb.max-query-size",
          "sources.clickhouse.enabled",
          "sources.clickhouse.url",
          "sources.clickhouse.user",
          "sources.clickhouse.password",
          "sources.clickhouse.max-query-size");

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this(configFile, System.getenv());
  }

  ConfigurationProvider(String configFile, Map<String, String> environment) {
    this.config =
        StringUtils.isBlank(configFile) ? loadResource(DEFAULT_RESOURCE) : loadFile(configFile);
    applyEnvironmentOverrides(config, environment);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadFile(String configFile) {
    Path path = Path.of(configFile);
    if (!Files.isRegularFile(path)) {
      throw new ConfigurationException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read configuration file " + path, e);
    }
  }

  private static YAMLConfiguration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("No {} on the classpath, using built-in defaults", resource);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read classpath resource " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) throws IOException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Invalid YAML configuration: " + e.getMessage(), e);
    }
    return yaml;
  }

  static void applyEnvironmentOverrides(Configuration config, Map<String, String> environment) {
    if (environment == null || environment.isEmpty()) {
      return;
    }
    Set<String> keys = new LinkedHashSet<>();
    for (Iterator<String> it = config.getKeys(); it.hasNext(); ) {
      keys.add(it.next());
    }
    keys.addAll(KNOWN_KEYS);
    for (String key : keys) {
      String value = environment.get(toEnvironmentName(key));
      if (value != null) {
        log.debug("Configuration key '{}' overridden from environment", key);
        config.setProperty(key, value);
      }
    }
  }

  static String toEnvironmentName(String key) {
    return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }
}
