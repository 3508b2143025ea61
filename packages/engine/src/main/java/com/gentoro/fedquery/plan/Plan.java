package com.gentoro.fedquery.plan;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered collection of {@link Step}s as received from the plan producer.
 *
 * <p>A plan is not trusted as-is: its dependency structure is only derived by {@link
 * PlanValidator}, which returns a {@link PlanGraph} the executor works from.
 */
public final class Plan {
  private final String id;
  private final List<Step> steps;
  private final Duration deadline;

  public Plan(String id, List<Step> steps, Duration deadline) {
    this.id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
    this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    this.deadline = deadline;
  }

  public Plan(List<Step> steps) {
    this(null, steps, null);
  }

  public String getId() {
    return id;
  }

  public List<Step> getSteps() {
    return steps;
  }

  /** Plan-specific overall deadline, overriding the engine default when present. */
  public Optional<Duration> getDeadline() {
    return Optional.ofNullable(deadline);
  }

  public int size() {
    return steps.size();
  }
}
