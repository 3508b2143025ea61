package com.gentoro.fedquery.source;

import com.gentoro.fedquery.exception.ExceptionUtil;
import com.gentoro.fedquery.exception.StateException;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.plan.DataSourceKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/** The adapters available to the executor, one per backend family. */
public class AdapterRegistry implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(AdapterRegistry.class);

  private final Map<DataSourceKind, DataSourceAdapter> adapters =
      Collections.synchronizedMap(new EnumMap<>(DataSourceKind.class));

  public AdapterRegistry() {}

  public AdapterRegistry(DataSourceAdapter... adapters) {
    for (DataSourceAdapter adapter : adapters) {
      register(adapter);
    }
  }

  public void register(DataSourceAdapter adapter) {
    DataSourceKind kind = adapter.kind();
    if (kind == null || !kind.isBackend()) {
      throw new IllegalArgumentException("Adapters can only be registered for backend sources");
    }
    if (adapters.putIfAbsent(kind, adapter) != null) {
      throw new StateException("An adapter for '" + kind.wireName() + "' is already registered");
    }
    log.debug(
        "Registered adapter {} for data source '{}'",
        adapter.getClass().getSimpleName(),
        kind.wireName());
  }

  public Optional<DataSourceAdapter> find(DataSourceKind kind) {
    return Optional.ofNullable(adapters.get(kind));
  }

  public DataSourceAdapter get(DataSourceKind kind) {
    return find(kind)
        .orElseThrow(
            () ->
                new StateException(
                    "No adapter registered for data source '" + kind.wireName() + "'"));
  }

  public Set<DataSourceKind> registeredKinds() {
    synchronized (adapters) {
      return adapters.isEmpty() ? Set.of() : Set.copyOf(adapters.keySet());
    }
  }

  /** Close every adapter; failures are logged and do not stop the others from closing. */
  @Override
  public void close() {
    synchronized (adapters) {
      for (DataSourceAdapter adapter : adapters.values()) {
        try {
          adapter.close();
        } catch (RuntimeException e) {
          log.warn(
              "Failed to close adapter for '{}': {}",
              adapter.kind().wireName(),
              ExceptionUtil.extractErrorMessage(e));
        }
      }
      adapters.clear();
    }
  }
}
