package com.gentoro.fedquery.telemetry;

import java.util.ArrayList;
import java.util.List;

/** Append-only collector of the records of one plan execution. Safe for concurrent appends. */
public class PlanTelemetry {
  private final String planId;
  private final List<TelemetryRecord> records = new ArrayList<>();

  public PlanTelemetry(String planId) {
    this.planId = planId;
  }

  public String getPlanId() {
    return planId;
  }

  public synchronized void append(TelemetryRecord record) {
    records.add(record);
  }

  public synchronized List<TelemetryRecord> snapshot() {
    return List.copyOf(records);
  }

  /** Hand the collected records to {@code sink}. */
  public void flushTo(TelemetrySink sink) {
    sink.flush(planId, snapshot());
  }
}
