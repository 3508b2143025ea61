package com.gentoro.fedquery.source.columnar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Converts a JDBC result set into rows keyed by column label. */
final class JdbcRowMapper {
  private static final JsonNodeFactory NODES = JacksonUtility.getJsonMapper().getNodeFactory();

  private JdbcRowMapper() {}

  static RowSet toRowSet(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int columns = meta.getColumnCount();
    String[] labels = new String[columns];
    for (int i = 0; i < columns; i++) {
      String label = meta.getColumnLabel(i + 1);
      labels[i] = label == null || label.isEmpty() ? meta.getColumnName(i + 1) : label;
    }
    List<ObjectNode> rows = new ArrayList<>();
    while (rs.next()) {
      ObjectNode row = NODES.objectNode();
      for (int i = 0; i < columns; i++) {
        row.set(labels[i], toNode(rs.getObject(i + 1)));
      }
      rows.add(row);
    }
    return RowSet.of(rows);
  }

  static JsonNode toNode(Object value) throws SQLException {
    if (value == null) {
      return NODES.nullNode();
    }
    if (value instanceof String s) {
      return NODES.textNode(s);
    }
    if (value instanceof Boolean b) {
      return NODES.booleanNode(b);
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return NODES.numberNode(((Number) value).intValue());
    }
    if (value instanceof Long l) {
      return NODES.numberNode(l);
    }
    if (value instanceof BigInteger i) {
      return NODES.numberNode(i);
    }
    if (value instanceof BigDecimal d) {
      return NODES.numberNode(d);
    }
    if (value instanceof Float f) {
      return f.isNaN() || f.isInfinite()
          ? NODES.textNode(f.toString())
          : NODES.numberNode(new BigDecimal(f.toString()));
    }
    if (value instanceof Double d) {
      return d.isNaN() || d.isInfinite() ? NODES.textNode(d.toString()) : NODES.numberNode(d);
    }
    if (value instanceof Timestamp ts) {
      return NODES.textNode(ts.toLocalDateTime().toString());
    }
    if (value instanceof java.sql.Date date) {
      return NODES.textNode(date.toLocalDate().toString());
    }
    if (value instanceof Time time) {
      return NODES.textNode(time.toLocalTime().toString());
    }
    if (value instanceof TemporalAccessor temporal) {
      return NODES.textNode(temporal.toString());
    }
    if (value instanceof java.sql.Array sqlArray) {
      try {
        return toNode(sqlArray.getArray());
      } finally {
        sqlArray.free();
      }
    }
    if (value instanceof byte[] bytes) {
      return NODES.textNode(Base64.getEncoder().encodeToString(bytes));
    }
    if (value.getClass().isArray()) {
      ArrayNode array = NODES.arrayNode();
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        array.add(toNode(Array.get(value, i)));
      }
      return array;
    }
    if (value instanceof Collection<?> items) {
      ArrayNode array = NODES.arrayNode();
      for (Object item : items) {
        array.add(toNode(item));
      }
      return array;
    }
    if (value instanceof Map<?, ?> map) {
      ObjectNode node = NODES.objectNode();
      for (Map.Entry<?, ?> e : map.entrySet()) {
        node.set(String.valueOf(e.getKey()), toNode(e.getValue()));
      }
      return node;
    }
    if (value instanceof Number n) {
      return NODES.numberNode(new BigDecimal(n.toString()));
    }
    return NODES.textNode(value.toString());
  }
}
