package com.gentoro.fedquery.telemetry;

/** How a step that was started ended. */
public enum TelemetryOutcome {
  /** Succeeded on the first attempt. */
  SUCCEEDED,
  /** Succeeded after at least one retry. */
  RETRIED,
  FAILED,
  /** Was in flight when the plan aborted. */
  CANCELLED
}
