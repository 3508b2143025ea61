package com.gentoro.fedquery.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable sequence of rows. Each row is a JSON object mapping field names to scalar or
 * nested values.
 *
 * <p>Rows are copied when the set is built and again whenever they are read, so a published row
 * set can be shared by any number of consumers without one of them affecting another.
 */
public final class RowSet {
  private static final RowSet EMPTY = new RowSet(List.of());

  private final List<ObjectNode> rows;

  private RowSet(List<ObjectNode> rows) {
    this.rows = rows;
  }

  public static RowSet empty() {
    return EMPTY;
  }

  public static RowSet of(ObjectNode... rows) {
    return of(Arrays.asList(rows));
  }

  /**
   * Build a row set from JSON objects.
   *
   * @throws IllegalArgumentException when an element is not a JSON object
   */
  public static RowSet of(List<? extends JsonNode> rows) {
    if (rows == null || rows.isEmpty()) {
      return EMPTY;
    }
    List<ObjectNode> copy = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      if (row == null || !row.isObject()) {
        throw new IllegalArgumentException(
            "Row must be a JSON object but was " + (row == null ? "null" : row.getNodeType()));
      }
      copy.add(((ObjectNode) row).deepCopy());
    }
    return new RowSet(Collections.unmodifiableList(copy));
  }

  /** Build a row set from a JSON array of objects. */
  public static RowSet fromArray(JsonNode array) {
    if (array == null || array.isNull() || array.isMissingNode()) {
      return EMPTY;
    }
    if (!array.isArray()) {
      throw new IllegalArgumentException("Expected a JSON array of rows");
    }
    List<JsonNode> rows = new ArrayList<>(array.size());
    array.forEach(rows::add);
    return of(rows);
  }

  /** Copies of all rows, in order. */
  public List<ObjectNode> rows() {
    List<ObjectNode> out = new ArrayList<>(rows.size());
    for (ObjectNode row : rows) {
      out.add(row.deepCopy());
    }
    return out;
  }

  /** Copy of the row at {@code index}. */
  public ObjectNode row(int index) {
    return rows.get(index).deepCopy();
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public ArrayNode toArrayNode() {
    ArrayNode array = JacksonUtility.getJsonMapper().createArrayNode();
    for (ObjectNode row : rows) {
      array.add(row.deepCopy());
    }
    return array;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RowSet other)) return false;
    return rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return rows.hashCode();
  }

  @Override
  public String toString() {
    return "RowSet" + rows;
  }
}
