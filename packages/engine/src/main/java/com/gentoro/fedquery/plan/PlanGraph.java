package com.gentoro.fedquery.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated dependency structure of a {@link Plan}.
 *
 * <p>Instances are only produced by {@link PlanValidator}, so the graph is guaranteed to be
 * acyclic, fully resolved and to converge on a single final step.
 */
public final class PlanGraph {
  private final Plan plan;
  private final Map<String, Step> stepsById;
  private final Map<String, Step> producersByVar;
  private final Map<String, List<Step>> dependents;
  private final Map<String, Integer> dependencyCounts;
  private final List<Step> topologicalOrder;
  private final Step finalStep;

  PlanGraph(
      Plan plan,
      Map<String, Step> stepsById,
      Map<String, Step> producersByVar,
      Map<String, List<Step>> dependents,
      Map<String, Integer> dependencyCounts,
      List<Step> topologicalOrder,
      Step finalStep) {
    this.plan = plan;
    this.stepsById = Map.copyOf(stepsById);
    this.producersByVar = Map.copyOf(producersByVar);
    this.dependents = Map.copyOf(dependents);
    this.dependencyCounts = Map.copyOf(dependencyCounts);
    this.topologicalOrder = List.copyOf(topologicalOrder);
    this.finalStep = finalStep;
  }

  public Plan getPlan() {
    return plan;
  }

  /** Steps in declaration order. */
  public List<Step> getSteps() {
    return plan.getSteps();
  }

  public Step getStep(String stepId) {
    return stepsById.get(stepId);
  }

  public Step producerOf(String outputVar) {
    return producersByVar.get(outputVar);
  }

  /** Steps consuming the output of {@code stepId}, in declaration order. */
  public List<Step> dependentsOf(String stepId) {
    return dependents.getOrDefault(stepId, List.of());
  }

  /** Number of distinct upstream steps {@code stepId} waits for. */
  public int dependencyCount(String stepId) {
    return dependencyCounts.getOrDefault(stepId, 0);
  }

  /** One valid execution order; ties broken by declaration order. */
  public List<Step> getTopologicalOrder() {
    return topologicalOrder;
  }

  public Step getFinalStep() {
    return finalStep;
  }

  /** Every step that depends directly or transitively on {@code stepId}, in declaration order. */
  public List<Step> transitiveDependentsOf(String stepId) {
    Set<String> seen = new HashSet<>();
    Deque<Step> queue = new ArrayDeque<>(dependentsOf(stepId));
    Set<Step> result = new LinkedHashSet<>();
    while (!queue.isEmpty()) {
      Step s = queue.poll();
      if (seen.add(s.getId())) {
        result.add(s);
        queue.addAll(dependentsOf(s.getId()));
      }
    }
    List<Step> ordered = new ArrayList<>(result);
    ordered.sort(Comparator.comparingInt(Step::getIndex));
    return ordered;
  }
}
