package com.gentoro.fedquery.engine.combinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.plan.MemoryOperation;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CombinatorTest {

  private static RowSet rows(String json) {
    try {
      return RowSet.fromArray(JacksonUtility.getJsonMapper().readTree(json));
    } catch (Exception e) {
      throw new IllegalArgumentException(e);
    }
  }

  private static ObjectNode params(String json) {
    try {
      return (ObjectNode) JacksonUtility.getJsonMapper().readTree(json);
    } catch (Exception e) {
      throw new IllegalArgumentException(e);
    }
  }

  private static Map<String, RowSet> inputs(Object... pairs) {
    Map<String, RowSet> map = new LinkedHashMap<>();
    for (int k = 0; k < pairs.length; k += 2) {
      map.put((String) pairs[k], (RowSet) pairs[k + 1]);
    }
    return map;
  }

  private static RowSet apply(MemoryOperation op, Map<String, RowSet> in, String params) {
    return Combinator.apply(op, in, params(params));
  }

  // ---------------- filter ----------------

  @Test
  @DisplayName("membership filter keeps rows whose key appears in the source input")
  void membershipIn() {
    RowSet viewed = rows("[{\"user_id\": 1}, {\"user_id\": 2}, {\"user_id\": null}]");
    RowSet purchased = rows("[{\"user_id\": 1}, {\"user_id\": 3}]");

    RowSet out =
        apply(
            MemoryOperation.FILTER,
            inputs("viewed", viewed, "purchased", purchased),
            "{\"field\": \"user_id\", \"operator\": \"in\", \"source\": \"purchased\"}");

    assertEquals(rows("[{\"user_id\": 1}]"), out);
  }

  @Test
  @DisplayName("not_in and exclude drop matches but also drop rows with an absent key")
  void membershipNotIn() {
    RowSet all = rows("[{\"id\": 1}, {\"id\": 2}, {\"other\": true}]");
    RowSet banned = rows("[{\"banned_id\": 2}]");
    Map<String, RowSet> in = inputs("all", all, "banned", banned);

    RowSet viaOperator =
        apply(
            MemoryOperation.FILTER,
            in,
            "{\"field\": \"id\", \"operator\": \"not_in\", \"source\": \"banned\","
                + " \"source_field\": \"banned_id\"}");
    RowSet viaExclude =
        apply(
            MemoryOperation.FILTER,
            in,
            "{\"field\": \"id\", \"exclude\": \"banned\", \"source_field\": \"banned_id\"}");
    RowSet viaSecondInput =
        apply(
            MemoryOperation.FILTER,
            inputs("all", all, "ids", rows("[{\"id\": 2}]")),
            "{\"field\": \"id\", \"operator\": \"nin\"}");

    assertEquals(rows("[{\"id\": 1}]"), viaOperator);
    assertEquals(viaOperator, viaExclude);
    assertEquals(viaOperator, viaSecondInput);
  }

  @Test
  @DisplayName("membership source must be one of the step inputs")
  void membershipUnknownSource() {
    assertThrows(
        CombinatorException.class,
        () ->
            apply(
                MemoryOperation.FILTER,
                inputs("a", rows("[{\"id\": 1}]")),
                "{\"field\": \"id\", \"operator\": \"in\", \"source\": \"elsewhere\"}"));
  }

  @Test
  @DisplayName("conditions list is combined with AND")
  void conditions() {
    RowSet orders =
        rows(
            "[{\"id\": 1, \"amount\": 50, \"status\": \"PAID\"},"
                + " {\"id\": 2, \"amount\": 150, \"status\": \"PAID\"},"
                + " {\"id\": 3, \"amount\": 250, \"status\": \"OPEN\"},"
                + " {\"id\": 4, \"status\": \"PAID\"}]");

    RowSet out =
        apply(
            MemoryOperation.FILTER,
            inputs("orders", orders),
            "{\"conditions\": ["
                + "{\"field\": \"amount\", \"operator\": \">=\", \"value\": 100},"
                + "{\"field\": \"status\", \"operator\": \"in\", \"value\": [\"PAID\", \"X\"]}"
                + "]}");

    assertEquals(1, out.size());
    assertEquals(2, out.row(0).get("id").asInt());
  }

  @Test
  @DisplayName("single field condition, exists and != with absent values")
  void singleConditions() {
    RowSet data = rows("[{\"a\": 1}, {\"a\": 2}, {\"b\": 1}, {\"a\": null}]");

    assertEquals(
        rows("[{\"a\": 2}]"),
        apply(MemoryOperation.FILTER, inputs("d", data), "{\"field\": \"a\", \"value\": 2}"));
    assertEquals(
        rows("[{\"a\": 1}]"),
        apply(
            MemoryOperation.FILTER,
            inputs("d", data),
            "{\"field\": \"a\", \"operator\": \"!=\", \"value\": 2}"));
    assertEquals(
        rows("[{\"b\": 1}, {\"a\": null}]"),
        apply(
            MemoryOperation.FILTER,
            inputs("d", data),
            "{\"field\": \"a\", \"operator\": \"exists\", \"value\": false}"));
  }

  @Test
  @DisplayName("expression condition is evaluated per row")
  void expressionCondition() {
    RowSet data = rows("[{\"x\": 1, \"y\": \"a\"}, {\"x\": 5, \"y\": \"b\"}]");
    RowSet out =
        apply(
            MemoryOperation.FILTER,
            inputs("d", data),
            "{\"condition\": \"@.x > 2 || @.y == 'a'\"}");
    assertEquals(data, out);
  }

  @Test
  @DisplayName("filter without any criterion is rejected")
  void emptyFilter() {
    assertThrows(
        CombinatorException.class,
        () -> apply(MemoryOperation.FILTER, inputs("d", rows("[]")), "{}"));
    assertThrows(
        CombinatorException.class,
        () ->
            apply(
                MemoryOperation.FILTER,
                inputs("d", rows("[{\"a\": 1}]")),
                "{\"field\": \"a\", \"operator\": \"~\", \"value\": 1}"));
  }

  // ---------------- join ----------------

  @Test
  @DisplayName("inner join on a shared key keeps the key once and suffixes collisions")
  void innerJoin() {
    RowSet users = rows("[{\"id\": 1, \"name\": \"ann\"}, {\"id\": 2, \"name\": \"bob\"}]");
    RowSet orders =
        rows(
            "[{\"id\": 1, \"name\": \"book\", \"total\": 10},"
                + " {\"id\": 1, \"name\": \"pen\", \"total\": 2},"
                + " {\"id\": 3, \"name\": \"cup\", \"total\": 5}]");

    RowSet out =
        apply(MemoryOperation.JOIN, inputs("users", users, "orders", orders), "{\"on\": \"id\"}");

    assertEquals(
        rows(
            "[{\"id\": 1, \"name_x\": \"ann\", \"name_y\": \"book\", \"total\": 10},"
                + " {\"id\": 1, \"name_x\": \"ann\", \"name_y\": \"pen\", \"total\": 2}]"),
        out);
  }

  @Test
  @DisplayName("left join keeps unmatched left rows and matches numbers by value")
  void leftJoin() {
    RowSet left = rows("[{\"uid\": 1}, {\"uid\": 2}, {\"uid\": null}]");
    RowSet right = rows("[{\"user\": 1.0, \"score\": 9}]");

    RowSet out =
        apply(
            MemoryOperation.JOIN,
            inputs("l", left, "r", right),
            "{\"left_on\": \"uid\", \"right_on\": \"user\", \"how\": \"left\"}");

    assertEquals(3, out.size());
    assertEquals(9, out.row(0).get("score").asInt());
    assertEquals(1, out.row(0).get("uid").asInt());
    assertTrue(out.row(0).has("user"));
    assertFalse(out.row(1).has("score"));
    assertFalse(out.row(2).has("score"));
  }

  @Test
  @DisplayName("join parameters are validated")
  void joinValidation() {
    Map<String, RowSet> in = inputs("l", rows("[]"), "r", rows("[]"));
    assertThrows(CombinatorException.class, () -> apply(MemoryOperation.JOIN, in, "{}"));
    assertThrows(
        CombinatorException.class,
        () -> apply(MemoryOperation.JOIN, in, "{\"on\": \"id\", \"how\": \"outer\"}"));
    assertThrows(
        CombinatorException.class,
        () -> apply(MemoryOperation.JOIN, in, "{\"on\": \"id\", \"suffixes\": [\"_a\", \"_a\"]}"));
  }

  // ---------------- transforms ----------------

  @Test
  @DisplayName("union concatenates in input order and final passes rows through")
  void unionAndFinal() {
    RowSet a = rows("[{\"v\": 1}]");
    RowSet b = rows("[{\"v\": 2}, {\"v\": 3}]");
    assertEquals(
        rows("[{\"v\": 1}, {\"v\": 2}, {\"v\": 3}]"),
        apply(MemoryOperation.UNION, inputs("a", a, "b", b), "{}"));
    assertSame(b, apply(MemoryOperation.FINAL, inputs("b", b), "{}"));
  }

  @Test
  @DisplayName("sort is stable, supports per-column direction and puts absent values last")
  void sort() {
    RowSet data =
        rows(
            "[{\"k\": 2, \"n\": \"a\"}, {\"n\": \"b\"}, {\"k\": 1, \"n\": \"c\"},"
                + " {\"k\": 2, \"n\": \"d\"}]");

    RowSet ascending =
        apply(MemoryOperation.SORT, inputs("d", data), "{\"by\": \"k\"}");
    assertEquals(
        List.of("c", "a", "d", "b"),
        ascending.rows().stream().map(r -> r.get("n").asText()).toList());

    RowSet descending =
        apply(
            MemoryOperation.SORT,
            inputs("d", data),
            "{\"by\": [\"k\", \"n\"], \"ascending\": [false, false]}");
    assertEquals(
        List.of("d", "a", "c", "b"),
        descending.rows().stream().map(r -> r.get("n").asText()).toList());
  }

  @Test
  @DisplayName("limit applies offset and count")
  void limit() {
    RowSet data = rows("[{\"v\": 1}, {\"v\": 2}, {\"v\": 3}, {\"v\": 4}]");
    assertEquals(
        rows("[{\"v\": 2}, {\"v\": 3}]"),
        apply(MemoryOperation.LIMIT, inputs("d", data), "{\"count\": 2, \"offset\": 1}"));
    assertEquals(
        rows("[]"),
        apply(MemoryOperation.LIMIT, inputs("d", data), "{\"limit\": 5, \"offset\": 9}"));
    assertThrows(
        CombinatorException.class,
        () -> apply(MemoryOperation.LIMIT, inputs("d", data), "{\"count\": -1}"));
  }

  @Test
  @DisplayName("project keeps selected columns and renames")
  void project() {
    RowSet data = rows("[{\"a\": 1, \"b\": 2, \"c\": {\"d\": 3}}]");
    RowSet out =
        apply(
            MemoryOperation.PROJECT,
            inputs("d", data),
            "{\"columns\": [\"a\", \"c.d\", \"missing\"], \"rename\": {\"a\": \"alpha\"}}");
    assertEquals(rows("[{\"alpha\": 1, \"c.d\": 3}]"), out);
  }

  @Test
  @DisplayName("group computes aggregations per key in first-seen order")
  void group() {
    RowSet sales =
        rows(
            "[{\"region\": \"eu\", \"amount\": 10},"
                + " {\"region\": \"us\", \"amount\": 5},"
                + " {\"region\": \"eu\", \"amount\": 20},"
                + " {\"amount\": 100},"
                + " {\"region\": \"us\"}]");

    RowSet out =
        apply(
            MemoryOperation.GROUP,
            inputs("s", sales),
            "{\"by\": \"region\", \"aggregations\": {"
                + "\"rows\": {\"op\": \"count\"},"
                + "\"total\": {\"op\": \"sum\", \"field\": \"amount\"},"
                + "\"avg\": {\"function\": \"avg\", \"field\": \"amount\"},"
                + "\"top\": {\"op\": \"max\", \"field\": \"amount\"}}}");

    assertEquals(2, out.size());
    ObjectNode eu = out.row(0);
    assertEquals("eu", eu.get("region").asText());
    assertEquals(2, eu.get("rows").asInt());
    assertEquals(0, new BigDecimal("30").compareTo(eu.get("total").decimalValue()));
    assertEquals(0, new BigDecimal("15").compareTo(eu.get("avg").decimalValue()));
    assertEquals(20, eu.get("top").asInt());

    ObjectNode us = out.row(1);
    assertEquals(2, us.get("rows").asInt());
    assertEquals(0, new BigDecimal("5").compareTo(us.get("total").decimalValue()));
  }

  @Test
  @DisplayName("sum over non-numeric values and unknown aggregations are rejected")
  void groupValidation() {
    RowSet data = rows("[{\"k\": 1, \"v\": \"x\"}]");
    assertThrows(
        CombinatorException.class,
        () ->
            apply(
                MemoryOperation.GROUP,
                inputs("d", data),
                "{\"by\": \"k\", \"aggregations\": {\"s\": {\"op\": \"sum\", \"field\": \"v\"}}}"));
    assertThrows(
        CombinatorException.class,
        () ->
            apply(
                MemoryOperation.GROUP,
                inputs("d", data),
                "{\"by\": \"k\","
                    + " \"aggregations\": {\"s\": {\"op\": \"median\", \"field\": \"v\"}}}"));
  }

  @Test
  @DisplayName("input count outside the operation's arity is rejected")
  void arity() {
    assertThrows(
        CombinatorException.class,
        () -> apply(MemoryOperation.JOIN, inputs("a", rows("[]")), "{\"on\": \"id\"}"));
  }
}
