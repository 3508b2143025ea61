package com.gentoro.fedquery.exception;

/** Stable error codes attached to every {@link FedQueryException}. */
public enum FedQueryErrorCode {
  CONFIGURATION_ERROR,
  PLAN_VALIDATION_ERROR,
  ADAPTER_ERROR,
  EXECUTION_ERROR,
  INTERNAL_CONSISTENCY_ERROR,
  STATE_ERROR,
  UNKNOWN
}
