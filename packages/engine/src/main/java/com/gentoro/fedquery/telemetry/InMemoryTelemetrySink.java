package com.gentoro.fedquery.telemetry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent records in memory so an in-process consumer can inspect past executions.
 * The oldest records are evicted once {@code capacity} is reached.
 */
public class InMemoryTelemetrySink implements TelemetrySink {
  private final int capacity;
  private final Deque<TelemetryRecord> records = new ArrayDeque<>();

  public InMemoryTelemetrySink(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void flush(String planId, List<TelemetryRecord> batch) {
    for (TelemetryRecord record : batch) {
      if (records.size() == capacity) {
        records.removeFirst();
      }
      records.addLast(record);
    }
  }

  /** All retained records, oldest first. */
  public synchronized List<TelemetryRecord> records() {
    return List.copyOf(records);
  }

  public synchronized List<TelemetryRecord> recordsFor(String planId) {
    List<TelemetryRecord> out = new ArrayList<>();
    for (TelemetryRecord record : records) {
      if (record.planId().equals(planId)) {
        out.add(record);
      }
    }
    return out;
  }

  public synchronized void clear() {
    records.clear();
  }
}
