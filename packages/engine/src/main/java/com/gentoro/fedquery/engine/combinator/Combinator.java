package com.gentoro.fedquery.engine.combinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.data.RowValues;
import com.gentoro.fedquery.plan.MemoryOperation;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure in-memory operations over published row sets.
 *
 * <p>Every operation is deterministic: the same inputs and parameters always give the same rows
 * in the same order. Inputs are passed in the order the step declares them, keyed by their
 * output-variable name. Invalid parameters raise {@link CombinatorException}.
 */
public final class Combinator {

  private Combinator() {}

  public static RowSet apply(
      MemoryOperation operation, Map<String, RowSet> inputs, ObjectNode parameters) {
    if (operation == null) {
      throw new CombinatorException("No operation given");
    }
    if (!operation.acceptsInputCount(inputs.size())) {
      throw new CombinatorException(
          "Operation '" + operation.wireName() + "' cannot take " + inputs.size() + " input(s)");
    }
    ObjectNode params =
        parameters == null ? JacksonUtility.getJsonMapper().createObjectNode() : parameters;
    List<RowSet> ordered = new ArrayList<>(inputs.values());
    return switch (operation) {
      case FILTER -> filter(inputs, params);
      case JOIN -> join(ordered.get(0), ordered.get(1), params);
      case FINAL -> ordered.get(0);
      case UNION -> union(ordered);
      case SORT -> sort(ordered.get(0), params);
      case LIMIT -> limit(ordered.get(0), params);
      case PROJECT -> project(ordered.get(0), params);
      case GROUP -> group(ordered.get(0), params);
    };
  }

  // ---------------- filter ----------------

  /**
   * Three forms, all optional but at least one required, combined with AND:
   *
   * <ul>
   *   <li>membership: {@code {"field": "user_id", "operator": "in", "source": "other_var",
   *       "source_field": "id"}}; {@code "exclude": "other_var"} is short for {@code not_in}
   *   <li>comparisons: {@code {"conditions": [{"field": "amount", "operator": ">", "value": 10}]}}
   *   <li>expression: {@code {"condition": "@.amount > 10 && @.status == 'PAID'"}}
   * </ul>
   *
   * <p>Rows whose filtered field is absent are dropped by every form.
   */
  static RowSet filter(Map<String, RowSet> inputs, ObjectNode params) {
    Iterator<Map.Entry<String, RowSet>> it = inputs.entrySet().iterator();
    Map.Entry<String, RowSet> primary = it.next();
    RowSet secondary = it.hasNext() ? it.next().getValue() : null;

    List<RowPredicate> predicates = new ArrayList<>();
    RowPredicate membership = membership(primary.getKey(), inputs, secondary, params);
    if (membership != null) {
      predicates.add(membership);
    }
    JsonNode conditions = params.get("conditions");
    if (conditions != null && !conditions.isNull()) {
      if (!conditions.isArray()) {
        throw new CombinatorException("'conditions' must be an array");
      }
      for (JsonNode c : conditions) {
        predicates.add(comparison(c));
      }
    }
    String expression = text(params, "condition");
    if (expression != null) {
      predicates.add(row -> FilterPredicateEvaluator.evaluate(expression, row));
    }
    if (predicates.isEmpty()) {
      if (params.has("field") || params.has("key")) {
        predicates.add(comparison(params));
      } else {
        throw new CombinatorException("Filter declares no membership, conditions or condition");
      }
    }

    List<ObjectNode> out = new ArrayList<>();
    for (ObjectNode row : primary.getValue().rows()) {
      boolean keep = true;
      for (RowPredicate p : predicates) {
        if (!p.test(row)) {
          keep = false;
          break;
        }
      }
      if (keep) {
        out.add(row);
      }
    }
    return RowSet.of(out);
  }

  private static RowPredicate membership(
      String primaryName, Map<String, RowSet> inputs, RowSet secondary, ObjectNode params) {
    String operator = normalizeOperator(text(params, "operator"));
    String sourceName = text(params, "source");
    String excludeName = text(params, "exclude");
    boolean negate;
    if (excludeName != null) {
      sourceName = excludeName;
      negate = true;
    } else if (sourceName != null) {
      negate = "not_in".equals(operator);
      if (operator != null && !"in".equals(operator) && !"not_in".equals(operator)) {
        throw new CombinatorException("Membership filter supports only 'in' and 'not_in'");
      }
    } else if (secondary != null
        && ("in".equals(operator) || "not_in".equals(operator))
        && !params.has("value")) {
      negate = "not_in".equals(operator);
    } else {
      return null;
    }

    RowSet source;
    if (sourceName == null) {
      source = secondary;
    } else {
      if (sourceName.equals(primaryName) || !inputs.containsKey(sourceName)) {
        throw new CombinatorException(
            "Membership source '" + sourceName + "' is not a secondary input of this step");
      }
      source = inputs.get(sourceName);
    }
    String field = text(params, "field");
    if (field == null) {
      field = text(params, "key");
    }
    if (field == null) {
      throw new CombinatorException("Membership filter needs 'field'");
    }
    String sourceField = text(params, "source_field");
    if (sourceField == null) {
      sourceField = field;
    }

    Set<Object> keys = new HashSet<>();
    for (ObjectNode row : source.rows()) {
      Object key = RowValues.key(RowValues.resolve(row, sourceField));
      if (key != null) {
        keys.add(key);
      }
    }
    String f = field;
    return row -> {
      Object key = RowValues.key(RowValues.resolve(row, f));
      if (key == null) {
        return false;
      }
      return negate != keys.contains(key);
    };
  }

  private static RowPredicate comparison(JsonNode condition) {
    if (condition == null || !condition.isObject()) {
      throw new CombinatorException("Each condition must be an object");
    }
    String field = text(condition, "field");
    if (field == null) {
      field = text(condition, "key");
    }
    if (field == null) {
      throw new CombinatorException("Condition is missing 'field'");
    }
    String operator = normalizeOperator(text(condition, "operator"));
    if (operator == null) {
      operator = "==";
    }
    JsonNode value = condition.get("value");
    String f = field;
    return switch (operator) {
      case "==" -> row -> RowValues.matches(RowValues.resolve(row, f), value);
      case "!=" -> row -> {
        JsonNode v = RowValues.resolve(row, f);
        return v != null && !RowValues.isAbsent(value) && !RowValues.matches(v, value);
      };
      case "<", "<=", ">", ">=" -> {
        String op = operator;
        yield row -> {
          Integer cmp = RowValues.compare(RowValues.resolve(row, f), value);
          if (cmp == null) {
            return false;
          }
          return switch (op) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            default -> cmp >= 0;
          };
        };
      }
      case "in", "not_in" -> {
        if (value == null || !value.isArray()) {
          throw new CombinatorException("Operator '" + operator + "' needs an array 'value'");
        }
        Set<Object> keys = new HashSet<>();
        value.forEach(v -> {
          Object k = RowValues.key(v);
          if (k != null) {
            keys.add(k);
          }
        });
        boolean negate = "not_in".equals(operator);
        yield row -> {
          Object k = RowValues.key(RowValues.resolve(row, f));
          return k != null && negate != keys.contains(k);
        };
      }
      case "exists" -> {
        boolean expected = value == null || value.isNull() || value.asBoolean(true);
        yield row -> (RowValues.resolve(row, f) != null) == expected;
      }
      default -> throw new CombinatorException("Unsupported filter operator '" + operator + "'");
    };
  }

  private static String normalizeOperator(String operator) {
    if (operator == null) {
      return null;
    }
    return switch (operator.trim().toLowerCase(Locale.ROOT)) {
      case "=", "==", "eq", "$eq" -> "==";
      case "!=", "<>", "ne", "$ne" -> "!=";
      case "<", "lt", "$lt" -> "<";
      case "<=", "lte", "$lte" -> "<=";
      case ">", "gt", "$gt" -> ">";
      case ">=", "gte", "$gte" -> ">=";
      case "in", "$in" -> "in";
      case "not_in", "not in", "nin", "$nin" -> "not_in";
      case "exists", "$exists" -> "exists";
      default -> operator;
    };
  }

  // ---------------- join ----------------

  /**
   * Equi-join of the first (left) and second (right) input.
   *
   * <p>Parameters: {@code left_on} and {@code right_on} (or {@code on} / {@code join_key} for
   * both), {@code how} ({@code inner} by default, or {@code left}) and {@code suffixes} applied to
   * non-key fields present on both sides (default {@code ["_x", "_y"]}). When both sides join on
   * the same field name it appears once in the output. Rows with an absent key never match.
   */
  static RowSet join(RowSet left, RowSet right, ObjectNode params) {
    String shared = text(params, "on");
    if (shared == null) {
      shared = text(params, "join_key");
    }
    String leftOn = text(params, "left_on");
    if (leftOn == null) {
      leftOn = shared;
    }
    String rightOn = text(params, "right_on");
    if (rightOn == null) {
      rightOn = shared != null ? shared : leftOn;
    }
    if (leftOn == null || rightOn == null) {
      throw new CombinatorException("Join columns not specified");
    }
    String how = text(params, "how");
    how = how == null ? "inner" : how.toLowerCase(Locale.ROOT);
    if (!how.equals("inner") && !how.equals("left")) {
      throw new CombinatorException("Unsupported join type '" + how + "'");
    }
    String leftSuffix = "_x";
    String rightSuffix = "_y";
    JsonNode suffixes = params.get("suffixes");
    if (suffixes != null && !suffixes.isNull()) {
      if (!suffixes.isArray() || suffixes.size() != 2) {
        throw new CombinatorException("'suffixes' must be an array of two strings");
      }
      leftSuffix = suffixes.get(0).asText();
      rightSuffix = suffixes.get(1).asText();
      if (leftSuffix.equals(rightSuffix)) {
        throw new CombinatorException("Join suffixes must differ");
      }
    }

    List<ObjectNode> leftRows = left.rows();
    List<ObjectNode> rightRows = right.rows();
    boolean sameKey = leftOn.equals(rightOn);
    Set<String> collisions = fieldNames(leftRows);
    collisions.retainAll(fieldNames(rightRows));
    if (sameKey) {
      collisions.remove(leftOn);
    }

    Map<Object, List<ObjectNode>> rightIndex = new HashMap<>();
    for (ObjectNode row : rightRows) {
      Object key = RowValues.key(RowValues.resolve(row, rightOn));
      if (key != null) {
        rightIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }

    List<ObjectNode> out = new ArrayList<>();
    for (ObjectNode l : leftRows) {
      Object key = RowValues.key(RowValues.resolve(l, leftOn));
      List<ObjectNode> matches =
          key == null ? Collections.emptyList() : rightIndex.getOrDefault(key, List.of());
      if (matches.isEmpty()) {
        if (how.equals("left")) {
          ObjectNode joined = JacksonUtility.getJsonMapper().createObjectNode();
          copyFields(l, joined, collisions, leftSuffix, null);
          out.add(joined);
        }
        continue;
      }
      for (ObjectNode r : matches) {
        ObjectNode joined = JacksonUtility.getJsonMapper().createObjectNode();
        copyFields(l, joined, collisions, leftSuffix, null);
        copyFields(r, joined, collisions, rightSuffix, sameKey ? rightOn : null);
        out.add(joined);
      }
    }
    return RowSet.of(out);
  }

  private static void copyFields(
      ObjectNode from, ObjectNode to, Set<String> collisions, String suffix, String skip) {
    from.fields()
        .forEachRemaining(
            e -> {
              String name = e.getKey();
              if (name.equals(skip)) {
                return;
              }
              to.set(collisions.contains(name) ? name + suffix : name, e.getValue());
            });
  }

  private static Set<String> fieldNames(List<ObjectNode> rows) {
    Set<String> names = new LinkedHashSet<>();
    for (ObjectNode row : rows) {
      row.fieldNames().forEachRemaining(names::add);
    }
    return names;
  }

  // ---------------- transforms ----------------

  static RowSet union(List<RowSet> inputs) {
    List<ObjectNode> out = new ArrayList<>();
    for (RowSet input : inputs) {
      out.addAll(input.rows());
    }
    return RowSet.of(out);
  }

  /**
   * Stable sort by one or more fields ({@code by}: string or array). {@code ascending} is a
   * boolean or an array matching {@code by}. Rows with an absent sort value go last in either
   * direction.
   */
  static RowSet sort(RowSet input, ObjectNode params) {
    List<String> by = stringList(params.get("by"));
    if (by.isEmpty()) {
      throw new CombinatorException("No sort columns specified");
    }
    JsonNode asc = params.get("ascending");
    List<Boolean> ascending = new ArrayList<>();
    for (int k = 0; k < by.size(); k++) {
      if (asc == null || asc.isNull()) {
        ascending.add(true);
      } else if (asc.isBoolean()) {
        ascending.add(asc.booleanValue());
      } else if (asc.isArray() && asc.size() == by.size() && asc.get(k).isBoolean()) {
        ascending.add(asc.get(k).booleanValue());
      } else {
        throw new CombinatorException("'ascending' must be a boolean or one boolean per column");
      }
    }

    Comparator<ObjectNode> comparator = (a, b) -> 0;
    for (int k = 0; k < by.size(); k++) {
      String field = by.get(k);
      boolean up = ascending.get(k);
      comparator =
          comparator.thenComparing(
              (a, b) -> {
                JsonNode va = RowValues.resolve(a, field);
                JsonNode vb = RowValues.resolve(b, field);
                if (va == null || vb == null) {
                  return Boolean.compare(va == null, vb == null);
                }
                int cmp = RowValues.SORT_ORDER.compare(va, vb);
                return up ? cmp : -cmp;
              });
    }
    List<ObjectNode> rows = input.rows();
    rows.sort(comparator);
    return RowSet.of(rows);
  }

  /** {@code count} rows (alias {@code limit}) after skipping {@code offset}. */
  static RowSet limit(RowSet input, ObjectNode params) {
    JsonNode countNode = params.has("count") ? params.get("count") : params.get("limit");
    if (countNode == null || !countNode.canConvertToInt() || countNode.asInt() < 0) {
      throw new CombinatorException("Limit needs a non-negative 'count'");
    }
    JsonNode offsetNode = params.get("offset");
    int offset = 0;
    if (offsetNode != null && !offsetNode.isNull()) {
      if (!offsetNode.canConvertToInt() || offsetNode.asInt() < 0) {
        throw new CombinatorException("'offset' must be a non-negative integer");
      }
      offset = offsetNode.asInt();
    }
    List<ObjectNode> rows = input.rows();
    int from = Math.min(offset, rows.size());
    int to = (int) Math.min(rows.size(), (long) from + countNode.asInt());
    return RowSet.of(rows.subList(from, to));
  }

  /** Keep {@code columns} (all when absent) and apply {@code rename} ({@code {"old": "new"}}). */
  static RowSet project(RowSet input, ObjectNode params) {
    JsonNode columnsNode = params.get("columns");
    JsonNode rename = params.get("rename");
    if (rename == null) {
      rename = params.get("rename_map");
    }
    if ((columnsNode == null || columnsNode.isNull()) && (rename == null || rename.isNull())) {
      throw new CombinatorException("Project needs 'columns' or 'rename'");
    }
    if (rename != null && !rename.isNull() && !rename.isObject()) {
      throw new CombinatorException("'rename' must be an object");
    }
    List<String> columns = columnsNode == null ? null : stringList(columnsNode);

    List<ObjectNode> out = new ArrayList<>();
    for (ObjectNode row : input.rows()) {
      ObjectNode projected = JacksonUtility.getJsonMapper().createObjectNode();
      if (columns == null) {
        projected.setAll(row);
      } else {
        for (String column : columns) {
          JsonNode v = row.has(column) ? row.get(column) : RowValues.resolve(row, column);
          if (v != null) {
            projected.set(column, v);
          }
        }
      }
      if (rename != null && rename.isObject()) {
        ObjectNode renamed = JacksonUtility.getJsonMapper().createObjectNode();
        JsonNode map = rename;
        projected
            .fields()
            .forEachRemaining(
                e -> {
                  JsonNode target = map.get(e.getKey());
                  renamed.set(
                      target != null && target.isTextual() ? target.asText() : e.getKey(),
                      e.getValue());
                });
        projected = renamed;
      }
      out.add(projected);
    }
    return RowSet.of(out);
  }

  /**
   * Group rows by {@code by} fields and compute {@code aggregations}, e.g. {@code {"total":
   * {"op": "sum", "field": "amount"}, "orders": {"op": "count"}}}. Rows with an absent group value
   * are dropped. Groups keep the order of their first row.
   */
  static RowSet group(RowSet input, ObjectNode params) {
    List<String> by = stringList(params.get("by"));
    JsonNode aggregations = params.get("aggregations");
    if (aggregations != null && !aggregations.isNull() && !aggregations.isObject()) {
      throw new CombinatorException("'aggregations' must be an object");
    }
    if (by.isEmpty() && (aggregations == null || aggregations.isEmpty())) {
      throw new CombinatorException("Group needs 'by' or 'aggregations'");
    }

    Map<List<Object>, List<ObjectNode>> groups = new LinkedHashMap<>();
    for (ObjectNode row : input.rows()) {
      List<Object> key = new ArrayList<>(by.size());
      boolean absent = false;
      for (String field : by) {
        Object k = RowValues.key(RowValues.resolve(row, field));
        if (k == null) {
          absent = true;
          break;
        }
        key.add(k);
      }
      if (!absent) {
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }

    List<ObjectNode> out = new ArrayList<>();
    for (List<ObjectNode> members : groups.values()) {
      ObjectNode result = JacksonUtility.getJsonMapper().createObjectNode();
      ObjectNode first = members.get(0);
      for (String field : by) {
        result.set(field, RowValues.resolve(first, field));
      }
      if (aggregations != null && aggregations.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> it = aggregations.fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          result.set(e.getKey(), aggregate(e.getKey(), e.getValue(), members));
        }
      }
      out.add(result);
    }
    return RowSet.of(out);
  }

  private static JsonNode aggregate(String name, JsonNode spec, List<ObjectNode> rows) {
    if (spec == null || !spec.isObject()) {
      throw new CombinatorException("Aggregation '" + name + "' must be an object");
    }
    String op = text(spec, "op");
    if (op == null) {
      op = text(spec, "function");
    }
    String field = text(spec, "field");
    if (op == null) {
      throw new CombinatorException("Aggregation '" + name + "' is missing 'op'");
    }
    op = op.toLowerCase(Locale.ROOT);
    if (!op.equals("count") && field == null) {
      throw new CombinatorException("Aggregation '" + name + "' needs 'field'");
    }

    List<JsonNode> values = new ArrayList<>();
    if (field != null) {
      for (ObjectNode row : rows) {
        JsonNode v = RowValues.resolve(row, field);
        if (v != null) {
          values.add(v);
        }
      }
    }
    var nodes = JacksonUtility.getJsonMapper().getNodeFactory();
    return switch (op) {
      case "count" -> nodes.numberNode(field == null ? rows.size() : values.size());
      case "sum" -> nodes.numberNode(sum(name, values));
      case "avg", "mean" -> values.isEmpty()
          ? nodes.nullNode()
          : nodes.numberNode(
              sum(name, values).divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL64));
      case "min" -> values.isEmpty()
          ? nodes.nullNode()
          : Collections.min(values, RowValues.SORT_ORDER);
      case "max" -> values.isEmpty()
          ? nodes.nullNode()
          : Collections.max(values, RowValues.SORT_ORDER);
      default -> throw new CombinatorException(
          "Unsupported aggregation '" + op + "' in '" + name + "'");
    };
  }

  private static BigDecimal sum(String name, List<JsonNode> values) {
    BigDecimal total = BigDecimal.ZERO;
    for (JsonNode v : values) {
      if (!v.isNumber()) {
        throw new CombinatorException(
            "Aggregation '" + name + "' found non-numeric value " + v);
      }
      total = total.add(v.decimalValue());
    }
    return total;
  }

  // ---------------- helpers ----------------

  private static List<String> stringList(JsonNode node) {
    List<String> out = new ArrayList<>();
    if (node == null || node.isNull()) {
      return out;
    }
    if (node.isTextual()) {
      out.add(node.asText());
      return out;
    }
    if (node.isArray()) {
      for (JsonNode item : (ArrayNode) node) {
        if (!item.isTextual()) {
          throw new CombinatorException("Expected a list of field names but found " + item);
        }
        out.add(item.asText());
      }
      return out;
    }
    throw new CombinatorException("Expected a field name or a list of field names");
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    return v != null && v.isTextual() && !v.asText().isBlank() ? v.asText() : null;
  }

  @FunctionalInterface
  private interface RowPredicate {
    boolean test(ObjectNode row);
  }
}
