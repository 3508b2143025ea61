package com.gentoro.fedquery.data;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Field access and value semantics shared by every in-memory operation.
 *
 * <ul>
 *   <li>Fields are addressed by name or dotted path ({@code customer.id}).
 *   <li>A missing field and an explicit JSON {@code null} are both <em>absent</em>. Absent values
 *       never match anything, not even each other.
 *   <li>Numbers compare by numeric value, so {@code 1} equals {@code 1.0}.
 *   <li>There is no coercion between types: {@code "1"} does not equal {@code 1}.
 *   <li>Objects and arrays compare element-wise under the same rules, so {@code {"a": 1}} equals
 *       {@code {"a": 1.0}}. Field order is ignored, array order is not. Inside a nested value a
 *       {@code null} equals {@code null}.
 * </ul>
 */
public final class RowValues {

  /** Orders present values before absent ones; numbers, then strings, then booleans. */
  public static final Comparator<JsonNode> SORT_ORDER = RowValues::sortCompare;

  private RowValues() {}

  /** Value at {@code path}, or {@code null} when absent. */
  public static JsonNode resolve(JsonNode row, String path) {
    if (row == null || path == null || path.isEmpty()) {
      return null;
    }
    JsonNode direct = row.get(path);
    if (direct != null) {
      return isAbsent(direct) ? null : direct;
    }
    JsonNode current = row;
    for (String part : path.split("\\.")) {
      if (current == null || !current.isObject()) {
        return null;
      }
      current = current.get(part);
    }
    return isAbsent(current) ? null : current;
  }

  public static boolean isAbsent(JsonNode value) {
    return value == null || value.isNull() || value.isMissingNode();
  }

  /**
   * Hash key with the equality semantics above, or {@code null} for an absent value. Keys of equal
   * values are {@link Object#equals equal}; keys of values of different types never are.
   */
  public static Object key(JsonNode value) {
    return isAbsent(value) ? null : nestedKey(value);
  }

  private static Object nestedKey(JsonNode value) {
    if (isAbsent(value)) {
      return NullKey.INSTANCE;
    }
    if (value.isNumber()) {
      return new NumberKey(normalize(value.decimalValue()));
    }
    if (value.isTextual()) {
      return value.textValue();
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isArray()) {
      List<Object> items = new ArrayList<>(value.size());
      value.forEach(item -> items.add(nestedKey(item)));
      return new ArrayKey(items);
    }
    if (value.isObject()) {
      Map<String, Object> fields = new HashMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        fields.put(e.getKey(), nestedKey(e.getValue()));
      }
      return new ObjectKey(fields);
    }
    return value;
  }

  /** Equality under the rules above; false when either side is absent. */
  public static boolean matches(JsonNode a, JsonNode b) {
    Object ka = key(a);
    return ka != null && ka.equals(key(b));
  }

  /**
   * Ordering of two present values of the same comparable type (number, string, boolean). Returns
   * {@code null} when either side is absent or the types differ.
   */
  public static Integer compare(JsonNode a, JsonNode b) {
    if (isAbsent(a) || isAbsent(b)) {
      return null;
    }
    if (a.isNumber() && b.isNumber()) {
      return a.decimalValue().compareTo(b.decimalValue());
    }
    if (a.isTextual() && b.isTextual()) {
      return a.textValue().compareTo(b.textValue());
    }
    if (a.isBoolean() && b.isBoolean()) {
      return Boolean.compare(a.booleanValue(), b.booleanValue());
    }
    return null;
  }

  private static int sortCompare(JsonNode a, JsonNode b) {
    boolean absentA = isAbsent(a);
    boolean absentB = isAbsent(b);
    if (absentA || absentB) {
      return Boolean.compare(absentA, absentB);
    }
    Integer cmp = compare(a, b);
    if (cmp != null) {
      return cmp;
    }
    int rank = Integer.compare(rank(a), rank(b));
    return rank != 0 ? rank : a.toString().compareTo(b.toString());
  }

  private static int rank(JsonNode v) {
    if (v.isNumber()) return 0;
    if (v.isTextual()) return 1;
    if (v.isBoolean()) return 2;
    return 3;
  }

  private static BigDecimal normalize(BigDecimal d) {
    return d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
  }

  private record NumberKey(BigDecimal value) {}

  private record ArrayKey(List<Object> items) {}

  private record ObjectKey(Map<String, Object> fields) {}

  private enum NullKey {
    INSTANCE
  }
}
