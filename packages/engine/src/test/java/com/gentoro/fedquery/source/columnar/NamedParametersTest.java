package com.gentoro.fedquery.source.columnar;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NamedParametersTest {

  @Test
  @DisplayName("named placeholders become positional markers in order")
  void rewritesPlaceholders() {
    NamedParameters.Rewritten r =
        NamedParameters.rewrite("SELECT * FROM t WHERE a = :a AND b = :b_2 OR c = :a");
    assertEquals("SELECT * FROM t WHERE a = ? AND b = ? OR c = ?", r.sql());
    assertEquals(List.of("a", "b_2", "a"), r.names());
  }

  @Test
  @DisplayName("literals and casts are left untouched")
  void ignoresLiteralsAndCasts() {
    NamedParameters.Rewritten r =
        NamedParameters.rewrite("SELECT ':x', x::String, `:y` FROM t WHERE y = :y");
    assertEquals("SELECT ':x', x::String, `:y` FROM t WHERE y = ?", r.sql());
    assertEquals(List.of("y"), r.names());
  }

  @Test
  @DisplayName("a statement without placeholders is unchanged")
  void noPlaceholders() {
    NamedParameters.Rewritten r = NamedParameters.rewrite("SELECT 1");
    assertEquals("SELECT 1", r.sql());
    assertEquals(List.of(), r.names());
  }
}
