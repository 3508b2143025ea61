package com.gentoro.fedquery.source.columnar;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterException.Kind;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Columnar-store payload: {@code {"query": "...", "params": [..] | {..}, "settings": {..}}}.
 *
 * @param sql statement text as supplied
 * @param positional values bound to {@code ?} markers, in order
 * @param named values bound to {@code :name} placeholders
 * @param settings query-level settings rendered as a trailing {@code SETTINGS} clause
 */
record ColumnarQuery(
    String sql,
    List<JsonNode> positional,
    Map<String, JsonNode> named,
    Map<String, JsonNode> settings) {

  private static final Pattern SETTING_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  static ColumnarQuery from(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      throw invalid("Columnar-store query must be a JSON object");
    }
    JsonNode sqlNode = payload.get("query");
    if (sqlNode == null || !sqlNode.isTextual()) {
      throw invalid("Query not specified");
    }

    List<JsonNode> positional = new ArrayList<>();
    Map<String, JsonNode> named = new LinkedHashMap<>();
    JsonNode params = payload.get("params");
    if (params != null && !params.isNull()) {
      if (params.isArray()) {
        params.forEach(positional::add);
      } else if (params.isObject()) {
        params.fields().forEachRemaining(e -> named.put(e.getKey(), e.getValue()));
      } else {
        throw invalid("'params' must be an array or an object");
      }
    }

    Map<String, JsonNode> settings = new LinkedHashMap<>();
    JsonNode settingsNode = payload.get("settings");
    if (settingsNode != null && !settingsNode.isNull()) {
      if (!settingsNode.isObject()) {
        throw invalid("'settings' must be an object");
      }
      Iterator<Map.Entry<String, JsonNode>> it = settingsNode.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        if (!SETTING_NAME.matcher(e.getKey()).matches()) {
          throw invalid("Invalid setting name '" + e.getKey() + "'");
        }
        if (!e.getValue().isValueNode() || e.getValue().isNull()) {
          throw invalid("Setting '" + e.getKey() + "' must be a scalar value");
        }
        settings.put(e.getKey(), e.getValue());
      }
    }
    return new ColumnarQuery(sqlNode.asText(), positional, named, settings);
  }

  /** {@code SETTINGS a=1, b='x'} or an empty string. */
  String settingsClause() {
    if (settings.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(" SETTINGS ");
    boolean first = true;
    for (Map.Entry<String, JsonNode> e : settings.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      JsonNode v = e.getValue();
      sb.append(e.getKey()).append('=');
      if (v.isNumber()) {
        sb.append(v.decimalValue().toPlainString());
      } else if (v.isBoolean()) {
        sb.append(v.booleanValue() ? 1 : 0);
      } else {
        sb.append('\'').append(v.asText().replace("\\", "\\\\").replace("'", "\\'")).append('\'');
      }
    }
    return sb.toString();
  }

  private static AdapterException invalid(String message) {
    return new AdapterException(Kind.INVALID_QUERY, DataSourceKind.COLUMNAR_STORE, message);
  }
}
