package com.gentoro.fedquery.engine;

/** Lifecycle of a step within one plan execution. */
public enum StepState {
  PENDING,
  READY,
  RUNNING,
  SUCCEEDED,
  FAILED,
  /** Never started: an upstream step failed or the plan was aborted. */
  SKIPPED,
  /** Was running when the plan was aborted; its result, if any, is discarded. */
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
  }
}
