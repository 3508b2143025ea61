package com.gentoro.fedquery.engine;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.telemetry.TelemetryRecord;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Outcome of one plan execution: the final rows, or a {@link FailureReport}. Never both. */
public final class PlanResult {
  private final String planId;
  private final RowSet rows;
  private final FailureReport failure;
  private final Map<String, StepState> stepStates;
  private final List<TelemetryRecord> telemetry;
  private final Duration elapsed;

  private PlanResult(
      String planId,
      RowSet rows,
      FailureReport failure,
      Map<String, StepState> stepStates,
      List<TelemetryRecord> telemetry,
      Duration elapsed) {
    this.planId = planId;
    this.rows = rows;
    this.failure = failure;
    this.stepStates = Collections.unmodifiableMap(new LinkedHashMap<>(stepStates));
    this.telemetry = List.copyOf(telemetry);
    this.elapsed = elapsed;
  }

  public static PlanResult success(
      String planId,
      RowSet rows,
      Map<String, StepState> stepStates,
      List<TelemetryRecord> telemetry,
      Duration elapsed) {
    return new PlanResult(planId, rows, null, stepStates, telemetry, elapsed);
  }

  public static PlanResult failure(
      String planId,
      FailureReport failure,
      Map<String, StepState> stepStates,
      List<TelemetryRecord> telemetry,
      Duration elapsed) {
    return new PlanResult(planId, null, failure, stepStates, telemetry, elapsed);
  }

  public String getPlanId() {
    return planId;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /** Final rows; empty when the plan failed. */
  public Optional<RowSet> getRows() {
    return Optional.ofNullable(rows);
  }

  public Optional<FailureReport> getFailure() {
    return Optional.ofNullable(failure);
  }

  /** State of every step, in declaration order. */
  public Map<String, StepState> getStepStates() {
    return stepStates;
  }

  public StepState stateOf(String stepId) {
    return stepStates.get(stepId);
  }

  public List<TelemetryRecord> getTelemetry() {
    return telemetry;
  }

  public Duration getElapsed() {
    return elapsed;
  }

  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("plan_id", planId);
    node.put("success", isSuccess());
    node.put("elapsed_ms", elapsed.toMillis());
    if (rows != null) {
      node.put("count", rows.size());
      node.set("data", rows.toArrayNode());
    }
    if (failure != null) {
      node.set("failure", failure.toJson());
    }
    ObjectNode states = node.putObject("steps");
    stepStates.forEach((id, state) -> states.put(id, state.name()));
    ArrayNode records = node.putArray("telemetry");
    telemetry.forEach(r -> records.add(r.toJson()));
    return node;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "PlanResult{plan=%s, rows=%d}".formatted(planId, rows.size())
        : "PlanResult{plan=%s, failure=%s}".formatted(planId, failure.kind());
  }
}
