package com.gentoro.fedquery.telemetry;

import java.util.List;

/** Receives the telemetry of a plan once its execution has finished. */
public interface TelemetrySink {

  /**
   * Called exactly once per executed plan, successful or not.
   *
   * @param records one record per started step, in completion order
   */
  void flush(String planId, List<TelemetryRecord> records);
}
