package com.gentoro.fedquery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.plan.DataSourceKind;
import java.time.Instant;

/**
 * Capability to run one backend-native query and return its rows.
 *
 * <p>Implementations are shared by all concurrently running steps, so they must be thread-safe.
 * They hold a process-wide connection pool which is released by {@link #close()}. Adapters never
 * retry: a failed call surfaces as an {@link AdapterException} and the executor decides whether
 * to try again.
 */
public interface DataSourceAdapter extends AutoCloseable {

  DataSourceKind kind();

  /**
   * Run {@code query} and return the resulting rows.
   *
   * @param query backend-native payload taken verbatim from the step
   * @param deadline instant after which the call must give up with {@link
   *     AdapterException.Kind#TIMEOUT}
   * @throws AdapterException on any failure
   */
  RowSet execute(JsonNode query, Instant deadline);

  /** Release the connection pool. In-flight calls may fail with CONNECTION_LOST. */
  @Override
  void close();
}
