package com.gentoro.fedquery.plan;

import java.util.Locale;

/** Execution strategy of a step, read from the plan's {@code step_type}. */
public enum StepKind {
  QUERY,
  FILTER,
  JOIN,
  TRANSFORM,
  FINAL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns {@code null} for unknown values. */
  public static StepKind fromWire(String value) {
    if (value == null) {
      return null;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
