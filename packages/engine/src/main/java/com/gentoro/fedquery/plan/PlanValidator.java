package com.gentoro.fedquery.plan;

import com.gentoro.fedquery.plan.PlanValidationException.Reason;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Structural and topological validation of a {@link Plan}.
 *
 * <p>Checks run in a fixed order and the first violation is reported:
 *
 * <ol>
 *   <li>the plan has steps and every step is well-formed for its kind
 *   <li>step ids and output variables are unique
 *   <li>every input names a produced variable
 *   <li>exactly one final step
 *   <li>an adapter is registered for each backend in use
 *   <li>the dependency graph is acyclic
 *   <li>every step contributes to the final step
 * </ol>
 *
 * <p>Validation never touches a data source.
 */
public final class PlanValidator {

  private PlanValidator() {}

  public static PlanGraph validate(Plan plan, Set<DataSourceKind> registeredSources) {
    if (plan == null || plan.getSteps().isEmpty()) {
      throw new PlanValidationException(Reason.MALFORMED_PLAN, "Plan has no steps");
    }
    List<Step> steps = plan.getSteps();
    for (Step step : steps) {
      validateStep(step);
    }

    Map<String, Step> stepsById = new LinkedHashMap<>();
    Map<String, Step> producers = new LinkedHashMap<>();
    for (Step step : steps) {
      if (stepsById.putIfAbsent(step.getId(), step) != null) {
        throw new PlanValidationException(
            Reason.DUPLICATE_STEP_ID,
            "Step id '" + step.getId() + "' is declared more than once",
            List.of(step.getId()));
      }
      Step previous = producers.putIfAbsent(step.getOutputVar(), step);
      if (previous != null) {
        throw new PlanValidationException(
            Reason.DUPLICATE_OUTPUT,
            "Output variable '"
                + step.getOutputVar()
                + "' is produced by both '"
                + previous.getId()
                + "' and '"
                + step.getId()
                + "'",
            List.of(previous.getId(), step.getId()));
      }
    }

    Map<String, List<Step>> dependents = new HashMap<>();
    Map<String, Integer> dependencyCounts = new HashMap<>();
    for (Step step : steps) {
      for (String input : step.getInputs()) {
        Step producer = producers.get(input);
        if (producer == null) {
          throw new PlanValidationException(
              Reason.DANGLING_INPUT,
              "Step '" + step.getId() + "' reads '" + input + "' which no step produces",
              List.of(step.getId()));
        }
        dependents.computeIfAbsent(producer.getId(), k -> new ArrayList<>()).add(step);
      }
      dependencyCounts.put(step.getId(), step.getInputs().size());
    }

    List<Step> finals = steps.stream().filter(Step::isFinal).toList();
    if (finals.isEmpty()) {
      throw new PlanValidationException(Reason.MISSING_FINAL, "Plan has no final step");
    }
    if (finals.size() > 1) {
      throw new PlanValidationException(
          Reason.DUPLICATE_FINAL,
          "Plan declares " + finals.size() + " final steps",
          finals.stream().map(Step::getId).toList());
    }
    Step finalStep = finals.get(0);

    for (Step step : steps) {
      if (step.isBackendQuery()
          && (registeredSources == null || !registeredSources.contains(step.getDataSource()))) {
        throw new PlanValidationException(
            Reason.UNSUPPORTED_DATA_SOURCE,
            "No adapter is registered for data source '"
                + step.getDataSource().wireName()
                + "' used by step '"
                + step.getId()
                + "'",
            List.of(step.getId()));
      }
    }

    List<Step> order = topologicalOrder(steps, dependents, dependencyCounts);
    if (order.size() < steps.size()) {
      Set<String> ordered = new HashSet<>();
      order.forEach(s -> ordered.add(s.getId()));
      List<String> cyclic =
          steps.stream().map(Step::getId).filter(id -> !ordered.contains(id)).toList();
      throw new PlanValidationException(
          Reason.CYCLE, "Plan contains a dependency cycle involving " + cyclic, cyclic);
    }

    Set<String> contributing = new HashSet<>();
    Deque<Step> queue = new ArrayDeque<>();
    queue.add(finalStep);
    while (!queue.isEmpty()) {
      Step s = queue.poll();
      if (contributing.add(s.getId())) {
        for (String input : s.getInputs()) {
          queue.add(producers.get(input));
        }
      }
    }
    List<String> orphans =
        steps.stream().map(Step::getId).filter(id -> !contributing.contains(id)).toList();
    if (!orphans.isEmpty()) {
      throw new PlanValidationException(
          Reason.ORPHAN_STEP, "Steps do not contribute to the final result: " + orphans, orphans);
    }

    Map<String, List<Step>> frozenDependents = new HashMap<>();
    dependents.forEach((k, v) -> frozenDependents.put(k, List.copyOf(v)));
    return new PlanGraph(
        plan, stepsById, producers, frozenDependents, dependencyCounts, order, finalStep);
  }

  private static void validateStep(Step step) {
    String id = step.getId();
    if (step.getOutputVar() == null || step.getOutputVar().isBlank()) {
      throw malformed(step, "Step '" + id + "' has no output variable");
    }
    if (step.getKind() == null || step.getDataSource() == null) {
      throw malformed(step, "Step '" + id + "' must declare a kind and a data source");
    }
    if (new HashSet<>(step.getInputs()).size() != step.getInputs().size()) {
      throw malformed(step, "Step '" + id + "' lists the same input more than once");
    }

    if (step.getKind() == StepKind.QUERY || (step.isFinal() && step.isBackendQuery())) {
      if (!step.isBackendQuery()) {
        throw malformed(step, "Query step '" + id + "' must target a backend data source");
      }
      var query = step.getQuery();
      if (query == null || !query.isObject()) {
        throw malformed(step, "Query step '" + id + "' is missing its query object");
      }
      if (!step.getInputs().isEmpty()) {
        throw malformed(step, "Query step '" + id + "' cannot declare inputs");
      }
      return;
    }

    if (step.getDataSource() != DataSourceKind.MEMORY) {
      throw malformed(
          step,
          "Step '"
              + id
              + "' of kind "
              + step.getKind().wireName()
              + " must use data source memory");
    }
    MemoryOperation op = step.getOperation();
    if (op == null) {
      throw malformed(step, "Step '" + id + "' does not name an operation");
    }
    boolean matches =
        switch (step.getKind()) {
          case FILTER -> op == MemoryOperation.FILTER;
          case JOIN -> op == MemoryOperation.JOIN;
          case TRANSFORM -> op.isTransform();
          case FINAL -> true;
          case QUERY -> false;
        };
    if (!matches) {
      throw malformed(
          step,
          "Operation '"
              + op.wireName()
              + "' is not allowed for a "
              + step.getKind().wireName()
              + " step ('"
              + id
              + "')");
    }
    if (!op.acceptsInputCount(step.getInputs().size())) {
      throw malformed(
          step,
          "Operation '"
              + op.wireName()
              + "' of step '"
              + id
              + "' cannot take "
              + step.getInputs().size()
              + " input(s)");
    }
  }

  private static List<Step> topologicalOrder(
      List<Step> steps, Map<String, List<Step>> dependents, Map<String, Integer> counts) {
    Map<String, Integer> remaining = new HashMap<>(counts);
    PriorityQueue<Step> ready = new PriorityQueue<>(Comparator.comparingInt(Step::getIndex));
    for (Step s : steps) {
      if (remaining.get(s.getId()) == 0) {
        ready.add(s);
      }
    }
    List<Step> order = new ArrayList<>();
    while (!ready.isEmpty()) {
      Step s = ready.poll();
      order.add(s);
      for (Step d : dependents.getOrDefault(s.getId(), List.of())) {
        if (remaining.merge(d.getId(), -1, Integer::sum) == 0) {
          ready.add(d);
        }
      }
    }
    return order;
  }

  private static PlanValidationException malformed(Step step, String message) {
    return new PlanValidationException(Reason.MALFORMED_STEP, message, List.of(step.getId()));
  }
}
