package com.gentoro.fedquery.plan;

import java.util.Locale;

/**
 * In-memory operations a {@code memory} step can request, with the number of inputs each one
 * accepts.
 */
public enum MemoryOperation {
  /** Row filter over the first input; a second input may serve as membership source. */
  FILTER("filter", 1, 2),
  /** Key-based equi-join of exactly two inputs. */
  JOIN("join", 2, 2),
  /** Identity pass-through marking plan completion. */
  FINAL("final", 1, 1),
  UNION("union", 1, Integer.MAX_VALUE),
  SORT("sort", 1, 1),
  LIMIT("limit", 1, 1),
  PROJECT("project", 1, 1),
  GROUP("group", 1, 1);

  private final String wireName;
  private final int minInputs;
  private final int maxInputs;

  MemoryOperation(String wireName, int minInputs, int maxInputs) {
    this.wireName = wireName;
    this.minInputs = minInputs;
    this.maxInputs = maxInputs;
  }

  public String wireName() {
    return wireName;
  }

  public int minInputs() {
    return minInputs;
  }

  public int maxInputs() {
    return maxInputs;
  }

  public boolean acceptsInputCount(int count) {
    return count >= minInputs && count <= maxInputs;
  }

  /** Operations a {@code transform} step may use. */
  public boolean isTransform() {
    return this == UNION || this == SORT || this == LIMIT || this == PROJECT || this == GROUP;
  }

  /** Returns {@code null} for unknown values. {@code concat} is accepted as alias of union. */
  public static MemoryOperation fromWire(String value) {
    if (value == null) {
      return null;
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    if ("concat".equals(v)) {
      return UNION;
    }
    if ("select".equals(v)) {
      return PROJECT;
    }
    for (MemoryOperation op : values()) {
      if (op.wireName.equals(v)) {
        return op;
      }
    }
    return null;
  }
}
