package com.gentoro.fedquery.source.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterException.Kind;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a document-store payload before it reaches the driver.
 *
 * <p>Only read operations are accepted. Server-side JavaScript, stages that write ({@code $out},
 * {@code $merge}) and references to system namespaces are rejected, and collection names must be
 * plain identifiers. Every rejection is an {@link Kind#INVALID_QUERY}.
 */
public class DocumentQueryValidator {
  public static final Set<String> DEFAULT_ALLOWED_OPERATIONS = Set.of("find", "aggregate", "count");
  public static final int DEFAULT_FIND_LIMIT = 100;
  public static final int DEFAULT_MAX_QUERY_SIZE = 10_000;

  static final Set<String> FORBIDDEN_KEYS =
      Set.of("$where", "$function", "$accumulator", "$eval", "mapreduce", "$out", "$merge");
  private static final Set<String> RESERVED_PREFIXES =
      Set.of("system.", "admin.", "config.", "local.");
  private static final Pattern COLLECTION_NAME = Pattern.compile("[A-Za-z0-9_]+");

  private final Set<String> allowedOperations;
  private final int defaultFindLimit;
  private final int maxQuerySize;

  public DocumentQueryValidator() {
    this(DEFAULT_ALLOWED_OPERATIONS, DEFAULT_FIND_LIMIT, DEFAULT_MAX_QUERY_SIZE);
  }

  public DocumentQueryValidator(
      Set<String> allowedOperations, int defaultFindLimit, int maxQuerySize) {
    Set<String> ops = Set.copyOf(allowedOperations);
    for (String op : ops) {
      if (!DEFAULT_ALLOWED_OPERATIONS.contains(op)) {
        throw new IllegalArgumentException("Unsupported document-store operation '" + op + "'");
      }
    }
    this.allowedOperations = ops;
    this.defaultFindLimit = defaultFindLimit;
    this.maxQuerySize = maxQuerySize;
  }

  public DocumentQuery validate(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      throw invalid("Document-store query must be a JSON object");
    }
    int size = payload.toString().length();
    if (size > maxQuerySize) {
      throw invalid("Query is too large (" + size + " > " + maxQuerySize + " characters)");
    }

    String collection = text(payload, "collection");
    if (collection == null) {
      throw invalid("Collection not specified");
    }
    checkCollectionName(collection);

    String operation = text(payload, "operation");
    operation = operation == null ? "find" : operation.toLowerCase(Locale.ROOT);
    if (!allowedOperations.contains(operation)) {
      throw invalid("Operation '" + operation + "' is not allowed");
    }
    checkForbiddenKeys(payload);

    ObjectNode options = object(payload, "options");
    ObjectNode filter = object(payload, "filter");
    if (filter == null) {
      filter = JacksonUtility.getJsonMapper().createObjectNode();
    }

    List<ObjectNode> pipeline = new ArrayList<>();
    if ("aggregate".equals(operation)) {
      JsonNode stages = payload.get("pipeline");
      if (stages == null || !stages.isArray()) {
        throw invalid("Pipeline not specified");
      }
      for (JsonNode stage : stages) {
        if (!stage.isObject() || stage.size() != 1) {
          throw invalid("Each pipeline stage must be an object with a single operator");
        }
        checkStageNamespaces((ObjectNode) stage);
        pipeline.add((ObjectNode) stage);
      }
    }

    ObjectNode projection = options == null ? null : object(options, "projection");
    if (projection == null) {
      projection = object(payload, "projection");
    }
    ObjectNode sort = options == null ? null : object(options, "sort");
    int skip = options == null ? 0 : nonNegative(options, "skip", 0);
    int limit =
        options == null ? defaultFindLimit : nonNegative(options, "limit", defaultFindLimit);

    return new DocumentQuery(
        collection, operation, filter, pipeline, projection, sort, skip, limit);
  }

  void checkCollectionName(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    for (String prefix : RESERVED_PREFIXES) {
      if (lower.startsWith(prefix)) {
        throw invalid("Access to system namespace '" + name + "' is not allowed");
      }
    }
    if (!COLLECTION_NAME.matcher(name).matches()) {
      throw invalid("Invalid collection name '" + name + "'");
    }
  }

  private void checkStageNamespaces(ObjectNode stage) {
    Map.Entry<String, JsonNode> entry = stage.fields().next();
    JsonNode body = entry.getValue();
    String target =
        switch (entry.getKey()) {
          case "$lookup", "$graphLookup" -> body.isObject() ? text(body, "from") : null;
          case "$unionWith" -> body.isTextual() ? body.asText() : text(body, "coll");
          default -> null;
        };
    if (target != null) {
      checkCollectionName(target);
    }
  }

  private void checkForbiddenKeys(JsonNode node) {
    if (node.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        if (FORBIDDEN_KEYS.contains(e.getKey().toLowerCase(Locale.ROOT))) {
          throw invalid("Operator '" + e.getKey() + "' is not allowed");
        }
        checkForbiddenKeys(e.getValue());
      }
    } else if (node.isArray()) {
      for (JsonNode child : node) {
        checkForbiddenKeys(child);
      }
    }
  }

  private int nonNegative(JsonNode node, String field, int fallback) {
    JsonNode v = node.get(field);
    if (v == null || v.isNull()) {
      return fallback;
    }
    if (!v.isIntegralNumber() || !v.canConvertToInt() || v.intValue() < 0) {
      throw invalid("Option '" + field + "' must be a non-negative integer");
    }
    return v.intValue();
  }

  private ObjectNode object(JsonNode node, String field) {
    JsonNode v = node.get(field);
    if (v == null || v.isNull()) {
      return null;
    }
    if (!v.isObject()) {
      throw invalid("'" + field + "' must be an object");
    }
    return (ObjectNode) v;
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    return v != null && v.isTextual() && !v.asText().isBlank() ? v.asText() : null;
  }

  private static AdapterException invalid(String message) {
    return new AdapterException(Kind.INVALID_QUERY, DataSourceKind.DOCUMENT_STORE, message);
  }
}
