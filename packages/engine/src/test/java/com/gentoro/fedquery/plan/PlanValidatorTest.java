package com.gentoro.fedquery.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.plan.PlanValidationException.Reason;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlanValidatorTest {

  private static final Set<DataSourceKind> ALL =
      EnumSet.of(DataSourceKind.DOCUMENT_STORE, DataSourceKind.COLUMNAR_STORE);

  private final List<Step> steps = new ArrayList<>();

  private Step query(String id, DataSourceKind source, String out) {
    ObjectNode q = JacksonUtility.getJsonMapper().createObjectNode().put("collection", "c");
    Step s =
        new Step(id, steps.size(), StepKind.QUERY, source, q, List.of(), null, null, out);
    steps.add(s);
    return s;
  }

  private Step memory(
      String id, StepKind kind, MemoryOperation op, List<String> inputs, String out) {
    Step s =
        new Step(
            id, steps.size(), kind, DataSourceKind.MEMORY, null, inputs, op, null, out);
    steps.add(s);
    return s;
  }

  private PlanValidationException rejected(Set<DataSourceKind> registered) {
    return assertThrows(
        PlanValidationException.class,
        () -> PlanValidator.validate(new Plan(steps), registered));
  }

  @Test
  @DisplayName("valid diamond plan yields a topological order and final step")
  void validDiamond() {
    query("a", DataSourceKind.DOCUMENT_STORE, "a_out");
    query("b", DataSourceKind.COLUMNAR_STORE, "b_out");
    memory("j", StepKind.JOIN, MemoryOperation.JOIN, List.of("a_out", "b_out"), "j_out");
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("j_out"), "result");

    PlanGraph graph = PlanValidator.validate(new Plan(steps), ALL);

    assertEquals(
        List.of("a", "b", "j", "f"),
        graph.getTopologicalOrder().stream().map(Step::getId).toList());
    assertEquals("f", graph.getFinalStep().getId());
    assertEquals(2, graph.dependencyCount("j"));
    assertEquals("a", graph.producerOf("a_out").getId());
    assertEquals(
        List.of("j"), graph.dependentsOf("a").stream().map(Step::getId).toList());
    assertEquals(
        List.of("j", "f"),
        graph.transitiveDependentsOf("b").stream().map(Step::getId).toList());
  }

  @Test
  @DisplayName("empty plan is rejected")
  void emptyPlan() {
    assertEquals(Reason.MALFORMED_PLAN, rejected(ALL).getReason());
  }

  @Test
  @DisplayName("cycle is rejected and names the steps involved")
  void cycle() {
    query("q", DataSourceKind.DOCUMENT_STORE, "q_out");
    memory("x", StepKind.FILTER, MemoryOperation.FILTER, List.of("q_out", "y_out"), "x_out");
    memory("y", StepKind.FILTER, MemoryOperation.FILTER, List.of("x_out"), "y_out");
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("y_out"), "result");

    PlanValidationException e = rejected(ALL);
    assertEquals(Reason.CYCLE, e.getReason());
    assertTrue(e.getStepIds().containsAll(List.of("x", "y")));
  }

  @Test
  @DisplayName("input with no producer is dangling")
  void danglingInput() {
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("nowhere"), "result");
    PlanValidationException e = rejected(ALL);
    assertEquals(Reason.DANGLING_INPUT, e.getReason());
    assertEquals(List.of("f"), e.getStepIds());
  }

  @Test
  @DisplayName("duplicate step id and duplicate output are rejected")
  void duplicates() {
    query("a", DataSourceKind.DOCUMENT_STORE, "out1");
    query("a", DataSourceKind.DOCUMENT_STORE, "out2");
    assertEquals(Reason.DUPLICATE_STEP_ID, rejected(ALL).getReason());

    steps.clear();
    query("a", DataSourceKind.DOCUMENT_STORE, "same");
    query("b", DataSourceKind.DOCUMENT_STORE, "same");
    PlanValidationException e = rejected(ALL);
    assertEquals(Reason.DUPLICATE_OUTPUT, e.getReason());
    assertEquals(List.of("a", "b"), e.getStepIds());
  }

  @Test
  @DisplayName("exactly one final step is required")
  void finalCount() {
    query("a", DataSourceKind.DOCUMENT_STORE, "a_out");
    assertEquals(Reason.MISSING_FINAL, rejected(ALL).getReason());

    memory("f1", StepKind.FINAL, MemoryOperation.FINAL, List.of("a_out"), "r1");
    memory("f2", StepKind.FINAL, MemoryOperation.FINAL, List.of("a_out"), "r2");
    assertEquals(Reason.DUPLICATE_FINAL, rejected(ALL).getReason());
  }

  @Test
  @DisplayName("steps that do not reach the final step are orphans")
  void orphan() {
    query("a", DataSourceKind.DOCUMENT_STORE, "a_out");
    query("unused", DataSourceKind.COLUMNAR_STORE, "u_out");
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("a_out"), "result");
    PlanValidationException e = rejected(ALL);
    assertEquals(Reason.ORPHAN_STEP, e.getReason());
    assertEquals(List.of("unused"), e.getStepIds());
  }

  @Test
  @DisplayName("backend without a registered adapter is unsupported")
  void unregisteredBackend() {
    query("a", DataSourceKind.COLUMNAR_STORE, "a_out");
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("a_out"), "result");
    assertEquals(
        Reason.UNSUPPORTED_DATA_SOURCE,
        rejected(EnumSet.of(DataSourceKind.DOCUMENT_STORE)).getReason());
  }

  @Test
  @DisplayName("query step must carry an object query and no inputs")
  void malformedQueryStep() {
    steps.add(
        new Step(
            "q", 0, StepKind.QUERY, DataSourceKind.DOCUMENT_STORE, null, List.of(), null, null,
            "q_out"));
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("q_out"), "result");
    assertEquals(Reason.MALFORMED_STEP, rejected(ALL).getReason());
  }

  @Test
  @DisplayName("operation must match the step kind and its arity")
  void operationMismatch() {
    query("a", DataSourceKind.DOCUMENT_STORE, "a_out");
    memory("t", StepKind.TRANSFORM, MemoryOperation.JOIN, List.of("a_out"), "t_out");
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("t_out"), "result");
    assertEquals(Reason.MALFORMED_STEP, rejected(ALL).getReason());

    steps.clear();
    query("a", DataSourceKind.DOCUMENT_STORE, "a_out");
    memory("j", StepKind.JOIN, MemoryOperation.JOIN, List.of("a_out"), "j_out");
    memory("f", StepKind.FINAL, MemoryOperation.FINAL, List.of("j_out"), "result");
    PlanValidationException e = rejected(ALL);
    assertEquals(Reason.MALFORMED_STEP, e.getReason());
    assertEquals(List.of("j"), e.getStepIds());
  }

  @Test
  @DisplayName("final step may itself be a backend query")
  void backendFinal() {
    ObjectNode q = JacksonUtility.getJsonMapper().createObjectNode().put("query", "SELECT 1");
    steps.add(
        new Step(
            "f", 0, StepKind.FINAL, DataSourceKind.COLUMNAR_STORE, q, List.of(), null, null,
            "result"));
    PlanGraph graph = PlanValidator.validate(new Plan(steps), ALL);
    assertTrue(graph.getFinalStep().isBackendQuery());
  }
}
