package com.gentoro.fedquery.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.plan.PlanValidationException.Reason;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the upstream plan contract into a {@link Plan}.
 *
 * <p>Accepted shape:
 *
 * <pre>{@code
 * {
 *   "plan_id": "optional",
 *   "deadline_ms": 5000,
 *   "steps": [
 *     {"id": "viewed", "step_type": "query", "data_source": "mongodb",
 *      "mongodb_query": {"collection": "events", "filter": {"type": "view"}},
 *      "output_var": "viewed_users"},
 *     {"id": "both", "step_type": "filter", "data_source": "memory",
 *      "inputs": ["viewed_users", "purchased_users"],
 *      "parameters": {"field": "user_id", "operator": "in", "source": "purchased_users"},
 *      "output_var": "result"},
 *     {"step_type": "final", "inputs": ["result"]}
 *   ]
 * }
 * }</pre>
 *
 * <p>Only the syntax is checked here. Structural rules are enforced by {@link PlanValidator}.
 */
public final class PlanParser {

  private PlanParser() {}

  public static Plan parse(String json) {
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(json);
    } catch (JsonProcessingException e) {
      throw new PlanValidationException(
          Reason.MALFORMED_PLAN, "Plan is not valid JSON: " + e.getOriginalMessage(), e);
    }
    return parse(root);
  }

  public static Plan parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new PlanValidationException(Reason.MALFORMED_PLAN, "Plan must be a JSON object");
    }
    JsonNode stepsNode = root.get("steps");
    if (stepsNode == null || !stepsNode.isArray()) {
      throw new PlanValidationException(Reason.MALFORMED_PLAN, "Plan is missing 'steps' array");
    }

    String planId = text(root, "plan_id");
    if (planId == null) {
      planId = text(root, "id");
    }

    Duration deadline = null;
    JsonNode deadlineNode = root.get("deadline_ms");
    if (deadlineNode != null && !deadlineNode.isNull()) {
      if (!deadlineNode.canConvertToLong() || !deadlineNode.isIntegralNumber()) {
        throw new PlanValidationException(
            Reason.MALFORMED_PLAN, "'deadline_ms' must be an integer number of milliseconds");
      }
      long ms = deadlineNode.asLong();
      if (ms <= 0) {
        throw new PlanValidationException(Reason.MALFORMED_PLAN, "'deadline_ms' must be positive");
      }
      deadline = Duration.ofMillis(ms);
    }

    List<Step> steps = new ArrayList<>();
    int index = 0;
    for (JsonNode stepNode : stepsNode) {
      steps.add(parseStep(stepNode, index++));
    }
    return new Plan(planId, steps, deadline);
  }

  static Step parseStep(JsonNode node, int index) {
    if (node == null || !node.isObject()) {
      throw new PlanValidationException(
          Reason.MALFORMED_STEP, "Step " + index + " must be a JSON object");
    }
    String id = text(node, "id");
    if (id == null) {
      id = text(node, "step_id");
    }
    if (id == null) {
      id = "step_" + index;
    }

    String kindName = text(node, "step_type");
    if (kindName == null) {
      kindName = text(node, "kind");
    }
    if (kindName == null) {
      throw new PlanValidationException(
          Reason.MALFORMED_STEP, "Step '" + id + "' is missing 'step_type'", List.of(id));
    }
    MemoryOperation defaultOperation = null;
    StepKind kind;
    if ("union".equalsIgnoreCase(kindName.trim())) {
      // Older plans declare union as a step type of its own.
      kind = StepKind.TRANSFORM;
      defaultOperation = MemoryOperation.UNION;
    } else {
      kind = StepKind.fromWire(kindName);
    }
    if (kind == null) {
      throw new PlanValidationException(
          Reason.MALFORMED_STEP,
          "Step '" + id + "' has unsupported step_type '" + kindName + "'",
          List.of(id));
    }

    DataSourceKind dataSource;
    String sourceName = text(node, "data_source");
    if (sourceName == null) {
      if (kind == StepKind.QUERY) {
        throw new PlanValidationException(
            Reason.MALFORMED_STEP,
            "Query step '" + id + "' is missing 'data_source'",
            List.of(id));
      }
      dataSource = DataSourceKind.MEMORY;
    } else {
      dataSource = DataSourceKind.fromWire(sourceName);
      if (dataSource == null) {
        throw new PlanValidationException(
            Reason.UNSUPPORTED_DATA_SOURCE,
            "Step '" + id + "' targets unknown data source '" + sourceName + "'",
            List.of(id));
      }
    }

    JsonNode query = null;
    if (dataSource.isBackend()) {
      query = firstPresent(node, "query", dataSource.wireName() + "_query");
    }

    List<String> inputs = new ArrayList<>();
    JsonNode inputsNode = node.get("inputs");
    if (inputsNode != null && !inputsNode.isNull()) {
      if (inputsNode.isTextual()) {
        inputs.add(inputsNode.asText());
      } else if (inputsNode.isArray()) {
        for (JsonNode in : inputsNode) {
          if (!in.isTextual() || in.asText().isBlank()) {
            throw new PlanValidationException(
                Reason.MALFORMED_STEP,
                "Step '" + id + "' has a non-textual entry in 'inputs'",
                List.of(id));
          }
          inputs.add(in.asText());
        }
      } else {
        throw new PlanValidationException(
            Reason.MALFORMED_STEP, "Step '" + id + "' 'inputs' must be an array", List.of(id));
      }
    }

    MemoryOperation operation = null;
    if (!dataSource.isBackend()) {
      String opName = text(node, "operation");
      if (opName != null) {
        operation = MemoryOperation.fromWire(opName);
        if (operation == null) {
          throw new PlanValidationException(
              Reason.UNKNOWN_OPERATION,
              "Step '" + id + "' requests unknown operation '" + opName + "'",
              List.of(id));
        }
      } else if (defaultOperation != null) {
        operation = defaultOperation;
      } else {
        operation =
            switch (kind) {
              case FILTER -> MemoryOperation.FILTER;
              case JOIN -> MemoryOperation.JOIN;
              case FINAL -> MemoryOperation.FINAL;
              default -> null;
            };
      }
    }

    ObjectNode parameters = null;
    JsonNode paramsNode = node.get("parameters");
    if (paramsNode != null && !paramsNode.isNull()) {
      if (!paramsNode.isObject()) {
        throw new PlanValidationException(
            Reason.MALFORMED_STEP,
            "Step '" + id + "' 'parameters' must be an object",
            List.of(id));
      }
      parameters = (ObjectNode) paramsNode;
    }

    String outputVar = text(node, "output_var");
    if (outputVar == null) {
      outputVar = "step_" + index + "_output";
    }

    return new Step(id, index, kind, dataSource, query, inputs, operation, parameters, outputVar);
  }

  private static JsonNode firstPresent(JsonNode node, String... fields) {
    for (String f : fields) {
      JsonNode v = node.get(f);
      if (v != null && !v.isNull()) {
        return v;
      }
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    if (v == null || v.isNull() || !v.isValueNode()) {
      return null;
    }
    String s = v.asText();
    return s.isBlank() ? null : s.trim();
  }
}
