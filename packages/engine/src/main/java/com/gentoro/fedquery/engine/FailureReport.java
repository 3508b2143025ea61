package com.gentoro.fedquery.engine;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.util.List;

/**
 * Why a plan did not produce a result.
 *
 * @param kind failure category
 * @param rootStepId step whose failure aborted the plan, or {@code null} when no single step
 *     is to blame
 * @param dataSource wire name of the failing step's data source, if any
 * @param errorKind adapter error kind, validation reason or engine error code
 * @param message human-readable description
 * @param succeeded steps that completed before the abort
 * @param skipped steps that never started
 * @param cancelled steps in flight when the plan aborted
 * @param pending steps not finished when the deadline passed (pending or running)
 */
public record FailureReport(
    Kind kind,
    String rootStepId,
    String dataSource,
    String errorKind,
    String message,
    List<String> succeeded,
    List<String> skipped,
    List<String> cancelled,
    List<String> pending) {

  public enum Kind {
    PLAN_INVALID,
    STEP_FAILED,
    DEADLINE_EXCEEDED,
    INTERNAL_ERROR
  }

  public FailureReport {
    succeeded = succeeded == null ? List.of() : List.copyOf(succeeded);
    skipped = skipped == null ? List.of() : List.copyOf(skipped);
    cancelled = cancelled == null ? List.of() : List.copyOf(cancelled);
    pending = pending == null ? List.of() : List.copyOf(pending);
  }

  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("kind", kind.name());
    if (rootStepId != null) {
      node.put("root_step_id", rootStepId);
    }
    if (dataSource != null) {
      node.put("data_source", dataSource);
    }
    if (errorKind != null) {
      node.put("error_kind", errorKind);
    }
    node.put("message", message);
    node.set("succeeded", array(succeeded));
    node.set("skipped", array(skipped));
    node.set("cancelled", array(cancelled));
    node.set("pending", array(pending));
    return node;
  }

  private static ArrayNode array(List<String> values) {
    ArrayNode array = JacksonUtility.getJsonMapper().createArrayNode();
    values.forEach(array::add);
    return array;
  }
}
