package com.gentoro.fedquery.telemetry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.plan.StepKind;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.time.Duration;
import java.time.Instant;

/**
 * Execution facts about one started step.
 *
 * @param errorKind adapter error kind or engine error code of the last failure; {@code null} on
 *     success
 */
public record TelemetryRecord(
    String planId,
    String stepId,
    StepKind kind,
    DataSourceKind dataSource,
    Instant start,
    Duration duration,
    long rowsProduced,
    int attempts,
    TelemetryOutcome outcome,
    String errorKind) {

  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("plan_id", planId);
    node.put("step_id", stepId);
    node.put("kind", kind == null ? null : kind.wireName());
    node.put("data_source", dataSource == null ? null : dataSource.wireName());
    node.put("start", start == null ? null : start.toString());
    node.put("duration_ms", duration == null ? 0 : duration.toMillis());
    node.put("rows", rowsProduced);
    node.put("attempts", attempts);
    node.put("outcome", outcome.name());
    if (errorKind != null) {
      node.put("error_kind", errorKind);
    }
    return node;
  }
}
