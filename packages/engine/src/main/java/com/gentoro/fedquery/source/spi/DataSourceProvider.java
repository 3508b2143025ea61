package com.gentoro.fedquery.source.spi;

import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.DataSourceAdapter;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable data-source adapters.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.fedquery.source.spi.DataSourceProvider
 */
public interface DataSourceProvider {
  /** Provider id, also the configuration section name under {@code sources.}. */
  String id();

  /** Backend family served by the adapters this provider creates. */
  DataSourceKind kind();

  /** Whether the source is enabled in the configuration and usable in the current runtime. */
  default boolean isAvailable(Configuration configuration) {
    return configuration.getBoolean("sources." + id() + ".enabled", false);
  }

  /** Create the adapter, opening its connection pool. */
  DataSourceAdapter create(Configuration configuration);
}
