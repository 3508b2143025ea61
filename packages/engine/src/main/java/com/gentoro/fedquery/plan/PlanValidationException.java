package com.gentoro.fedquery.plan;

import com.gentoro.fedquery.exception.FedQueryErrorCode;
import com.gentoro.fedquery.exception.FedQueryException;
import java.util.List;

/**
 * A plan was rejected before execution. No adapter has been invoked when this is raised.
 *
 * <p>The {@link Reason} identifies the broken rule and {@link #getStepIds()} lists the steps
 * involved (for a cycle: every step that could not be ordered).
 */
public class PlanValidationException extends FedQueryException {

  public enum Reason {
    MALFORMED_PLAN,
    MALFORMED_STEP,
    DUPLICATE_STEP_ID,
    DUPLICATE_OUTPUT,
    DANGLING_INPUT,
    CYCLE,
    MISSING_FINAL,
    DUPLICATE_FINAL,
    ORPHAN_STEP,
    UNSUPPORTED_DATA_SOURCE,
    UNKNOWN_OPERATION
  }

  private final Reason reason;
  private final List<String> stepIds;

  public PlanValidationException(Reason reason, String message, List<String> stepIds) {
    super(FedQueryErrorCode.PLAN_VALIDATION_ERROR, message);
    this.reason = reason;
    this.stepIds = stepIds == null ? List.of() : List.copyOf(stepIds);
    withContext("reason", reason.name());
    if (!this.stepIds.isEmpty()) {
      withContext("steps", this.stepIds);
    }
  }

  public PlanValidationException(Reason reason, String message) {
    this(reason, message, List.of());
  }

  public PlanValidationException(Reason reason, String message, Throwable cause) {
    super(FedQueryErrorCode.PLAN_VALIDATION_ERROR, message, cause);
    this.reason = reason;
    this.stepIds = List.of();
    withContext("reason", reason.name());
  }

  public Reason getReason() {
    return reason;
  }

  public List<String> getStepIds() {
    return stepIds;
  }
}
