package com.gentoro.fedquery.source.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DocumentQueryValidatorTest {

  private final DocumentQueryValidator validator = new DocumentQueryValidator();

  private static JsonNode json(String text) {
    try {
      return JacksonUtility.getJsonMapper().readTree(text);
    } catch (Exception e) {
      throw new IllegalArgumentException(e);
    }
  }

  private void assertInvalid(DocumentQueryValidator v, String payload) {
    AdapterException e = assertThrows(AdapterException.class, () -> v.validate(json(payload)));
    assertEquals(AdapterException.Kind.INVALID_QUERY, e.getKind());
  }

  @Test
  @DisplayName("find is the default operation with the default limit")
  void findDefaults() {
    DocumentQuery query = validator.validate(json("{\"collection\": \"events\"}"));
    assertEquals("events", query.collection());
    assertEquals("find", query.operation());
    assertTrue(query.filter().isEmpty());
    assertEquals(0, query.skip());
    assertEquals(DocumentQueryValidator.DEFAULT_FIND_LIMIT, query.limit());
    assertNull(query.projection());
  }

  @Test
  @DisplayName("options carry projection, sort, skip and limit")
  void findOptions() {
    DocumentQuery query =
        validator.validate(
            json(
                """
                {"collection": "events", "filter": {"type": "view"},
                 "options": {"projection": {"user_id": 1}, "sort": {"ts": -1},
                             "skip": 5, "limit": 20}}
                """));
    assertEquals("view", query.filter().get("type").asText());
    assertEquals(1, query.projection().get("user_id").asInt());
    assertEquals(-1, query.sort().get("ts").asInt());
    assertEquals(5, query.skip());
    assertEquals(20, query.limit());
  }

  @Test
  @DisplayName("aggregate needs a pipeline of single-operator stages")
  void aggregate() {
    DocumentQuery query =
        validator.validate(
            json(
                """
                {"collection": "orders", "operation": "aggregate",
                 "pipeline": [{"$match": {"status": "PAID"}}, {"$group": {"_id": "$user_id"}}]}
                """));
    assertEquals(2, query.pipeline().size());

    assertInvalid(validator, "{\"collection\": \"orders\", \"operation\": \"aggregate\"}");
    assertInvalid(
        validator,
        "{\"collection\": \"o\", \"operation\": \"aggregate\","
            + " \"pipeline\": [{\"$match\": {}, \"$limit\": 1}]}");
  }

  @Test
  @DisplayName("server-side code and write stages are rejected at any depth")
  void forbiddenOperators() {
    assertInvalid(
        validator,
        "{\"collection\": \"e\", \"filter\": {\"$and\": [{\"$where\": \"this.a > 1\"}]}}");
    assertInvalid(
        validator,
        "{\"collection\": \"e\", \"operation\": \"aggregate\","
            + " \"pipeline\": [{\"$match\": {}}, {\"$out\": \"copy\"}]}");
    assertInvalid(
        validator,
        "{\"collection\": \"e\", \"operation\": \"aggregate\","
            + " \"pipeline\": [{\"$merge\": {\"into\": \"copy\"}}]}");
  }

  @Test
  @DisplayName("system namespaces and odd collection names are rejected")
  void collectionNames() {
    assertInvalid(validator, "{\"collection\": \"system.users\"}");
    assertInvalid(validator, "{\"collection\": \"bad-name\"}");
    assertInvalid(validator, "{\"filter\": {}}");
    assertInvalid(
        validator,
        "{\"collection\": \"e\", \"operation\": \"aggregate\","
            + " \"pipeline\": [{\"$lookup\": {\"from\": \"admin.x\", \"as\": \"y\"}}]}");
    assertInvalid(
        validator,
        "{\"collection\": \"e\", \"operation\": \"aggregate\","
            + " \"pipeline\": [{\"$unionWith\": \"config.settings\"}]}");
  }

  @Test
  @DisplayName("operations outside the configured allow-list are rejected")
  void allowList() {
    DocumentQueryValidator findOnly = new DocumentQueryValidator(Set.of("find"), 10, 1000);
    assertInvalid(findOnly, "{\"collection\": \"e\", \"operation\": \"count\"}");
    assertInvalid(findOnly, "{\"collection\": \"e\", \"operation\": \"insert\"}");
    assertThrows(
        IllegalArgumentException.class,
        () -> new DocumentQueryValidator(Set.of("find", "delete"), 10, 1000));
  }

  @Test
  @DisplayName("oversized payloads and bad options are rejected")
  void limits() {
    DocumentQueryValidator tiny = new DocumentQueryValidator(Set.of("find"), 10, 30);
    assertInvalid(tiny, "{\"collection\": \"events\", \"filter\": {\"type\": \"view\"}}");
    assertInvalid(validator, "{\"collection\": \"e\", \"options\": {\"limit\": -1}}");
    assertInvalid(validator, "{\"collection\": \"e\", \"filter\": [1]}");
  }
}
