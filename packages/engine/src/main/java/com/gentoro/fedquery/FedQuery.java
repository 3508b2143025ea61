package com.gentoro.fedquery;

import com.gentoro.fedquery.config.ConfigurationProvider;
import com.gentoro.fedquery.config.EngineSettings;
import com.gentoro.fedquery.engine.FederatedExecutor;
import com.gentoro.fedquery.exception.ConfigurationException;
import com.gentoro.fedquery.exception.StateException;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.source.AdapterRegistry;
import com.gentoro.fedquery.source.spi.DataSourceProvider;
import com.gentoro.fedquery.telemetry.InMemoryTelemetrySink;
import com.gentoro.fedquery.telemetry.LoggingTelemetrySink;
import com.gentoro.fedquery.telemetry.TelemetrySink;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Application context: configuration, registered adapters, telemetry sink and the executor.
 *
 * <p>Create it, call {@link #initialize()}, then hand plans to {@link #executor()}. Resources are
 * released by {@link #shutdown()}, which also runs from a JVM shutdown hook.
 */
public class FedQuery implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(FedQuery.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private AdapterRegistry adapters;
  private TelemetrySink telemetrySink;
  private FederatedExecutor executor;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private volatile Thread shutdownHook;

  public FedQuery(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs));
  }

  public FedQuery(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  public void initialize() {
    initialize(new ConfigurationProvider(startupParameters.configFile()));
  }

  void initialize(ConfigurationProvider provider) {
    this.configurationProvider = provider;
    LoggingService.applyConfiguration(configuration());

    EngineSettings settings = EngineSettings.from(configuration());
    this.adapters = new AdapterRegistry();
    try {
      for (DataSourceProvider source : ServiceLoader.load(DataSourceProvider.class)) {
        if (!source.isAvailable(configuration())) {
          log.debug("Data source '{}' is disabled", source.id());
          continue;
        }
        adapters.register(source.create(configuration()));
        log.info("Registered data source '{}' ({})", source.id(), source.kind().wireName());
      }
    } catch (RuntimeException e) {
      adapters.close();
      throw e;
    }
    if (adapters.registeredKinds().isEmpty()) {
      log.warn("No data source is enabled; plans with query steps will be rejected");
    }

    this.telemetrySink = createTelemetrySink(configuration());
    this.executor = new FederatedExecutor(adapters, settings, telemetrySink);
    registerShutdownHook();
    log.info(
        "FedQuery initialized (workers={}, max concurrent queries={})",
        settings.workerThreads(),
        settings.maxConcurrentQueries());
  }

  static TelemetrySink createTelemetrySink(Configuration configuration) {
    String sink = configuration.getString("telemetry.sink", "logging").toLowerCase(Locale.ROOT);
    return switch (sink) {
      case "logging" -> new LoggingTelemetrySink();
      case "memory" ->
          new InMemoryTelemetrySink(configuration.getInt("telemetry.memory.capacity", 1000));
      default -> throw new ConfigurationException("Unknown telemetry.sink: " + sink);
    };
  }

  private void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "fedquery-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down FedQuery");
    try {
      if (executor != null) {
        executor.close();
      }
    } finally {
      if (adapters != null) {
        adapters.close();
      }
    }
  }

  @Override
  public void close() {
    shutdown();
    Thread hook = shutdownHook;
    if (hook != null && Thread.currentThread() != hook) {
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException e) {
        log.debug("JVM already shutting down, hook stays registered");
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("FedQuery not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public AdapterRegistry adapters() {
    return adapters;
  }

  public TelemetrySink telemetrySink() {
    return telemetrySink;
  }

  public FederatedExecutor executor() {
    if (executor == null) {
      throw new StateException("FedQuery not initialized. Call initialize() first.");
    }
    return executor;
  }
}
