package com.gentoro.fedquery.source.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

/** Converts driver documents into plain JSON rows. */
final class DocumentNormalizer {
  private static final JsonNodeFactory NODES = JacksonUtility.getJsonMapper().getNodeFactory();

  private DocumentNormalizer() {}

  static ObjectNode toRow(Document document) {
    return toObject(document);
  }

  private static ObjectNode toObject(Map<?, ?> map) {
    ObjectNode node = NODES.objectNode();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      node.set(String.valueOf(e.getKey()), toNode(e.getValue()));
    }
    return node;
  }

  static JsonNode toNode(Object value) {
    if (value == null) {
      return NODES.nullNode();
    }
    if (value instanceof Map<?, ?> map) {
      return toObject(map);
    }
    if (value instanceof Collection<?> items) {
      ArrayNode array = NODES.arrayNode();
      items.forEach(item -> array.add(toNode(item)));
      return array;
    }
    if (value instanceof String s) {
      return NODES.textNode(s);
    }
    if (value instanceof Boolean b) {
      return NODES.booleanNode(b);
    }
    if (value instanceof Integer i) {
      return NODES.numberNode(i);
    }
    if (value instanceof Long l) {
      return NODES.numberNode(l);
    }
    if (value instanceof Double d) {
      return d.isNaN() || d.isInfinite() ? NODES.textNode(d.toString()) : NODES.numberNode(d);
    }
    if (value instanceof BigDecimal d) {
      return NODES.numberNode(d);
    }
    if (value instanceof BigInteger i) {
      return NODES.numberNode(i);
    }
    if (value instanceof Decimal128 d) {
      return d.isNaN() || d.isInfinite()
          ? NODES.textNode(d.toString())
          : NODES.numberNode(d.bigDecimalValue());
    }
    if (value instanceof ObjectId id) {
      return NODES.textNode(id.toHexString());
    }
    if (value instanceof Date date) {
      return NODES.textNode(date.toInstant().toString());
    }
    if (value instanceof BsonTimestamp ts) {
      return NODES.numberNode(ts.getTime());
    }
    if (value instanceof Binary binary) {
      return NODES.textNode(Base64.getEncoder().encodeToString(binary.getData()));
    }
    if (value instanceof byte[] bytes) {
      return NODES.textNode(Base64.getEncoder().encodeToString(bytes));
    }
    if (value instanceof UUID uuid) {
      return NODES.textNode(uuid.toString());
    }
    if (value instanceof Number n) {
      return NODES.numberNode(new BigDecimal(n.toString()));
    }
    return NODES.textNode(value.toString());
  }
}
