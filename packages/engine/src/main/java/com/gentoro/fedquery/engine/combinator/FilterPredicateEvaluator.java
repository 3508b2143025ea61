package com.gentoro.fedquery.engine.combinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.fedquery.data.RowValues;
import java.math.BigDecimal;

/**
 * Minimal boolean predicate parser/evaluator for row filter expressions.
 *
 * <p>Supported features:
 *
 * <ul>
 *   <li>Logical operators: {@code &&}, {@code ||} with standard precedence (AND binds tighter).
 *   <li>Parentheses for grouping.
 *   <li>Comparisons: {@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >}, {@code >=}.
 *   <li>Literals: numbers, strings (double or single quotes), booleans, {@code null}.
 *   <li>Paths: {@code @.field} or {@code @.nested.field}, resolved against the current row. A
 *       bare field name is accepted as well.
 *   <li>Truthiness for non-comparison values used as boolean (empty string/zero/absent → false).
 * </ul>
 *
 * <p>Comparisons follow {@link RowValues}: no coercion between types, and any comparison with an
 * absent value (missing field or {@code null}) is false, {@code !=} included.
 *
 * <pre>{@code
 * @.amount >= 100 && @.status == "PAID"
 * (@.country == "DE" || @.country == "AT") && @.active
 * }</pre>
 */
final class FilterPredicateEvaluator {
  private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

  private final String s;
  private final int n;
  private int i;
  private final JsonNode row;

  private FilterPredicateEvaluator(String expr, JsonNode row) {
    this.s = expr;
    this.n = expr.length();
    this.i = 0;
    this.row = row;
  }

  /**
   * Evaluate {@code expr} against {@code row}.
   *
   * @throws CombinatorException when the expression cannot be parsed
   */
  static boolean evaluate(String expr, JsonNode row) {
    if (expr == null || expr.isBlank()) {
      throw new CombinatorException("Filter condition is empty");
    }
    FilterPredicateEvaluator p = new FilterPredicateEvaluator(expr.trim(), row);
    boolean val = p.parseOr();
    p.skipWs();
    if (p.i < p.n) {
      throw new CombinatorException(
          "Unexpected '" + p.s.substring(p.i) + "' in filter condition '" + expr + "'");
    }
    return val;
  }

  // Grammar: or := and ('||' and)*
  private boolean parseOr() {
    boolean left = parseAnd();
    skipWs();
    while (match("||")) {
      boolean right = parseAnd();
      left = left || right;
      skipWs();
    }
    return left;
  }

  // Grammar: and := cmp ('&&' cmp)*
  private boolean parseAnd() {
    boolean left = parseComparisonOrPrimary();
    skipWs();
    while (match("&&")) {
      boolean right = parseComparisonOrPrimary();
      left = left && right;
      skipWs();
    }
    return left;
  }

  // Grammar: cmp := value (op value)? | '(' or ')'
  private boolean parseComparisonOrPrimary() {
    JsonNode a = parseValueOrGroup();
    skipWs();
    String op = readAny("==", "!=", "<=", ">=", "<", ">");
    if (op != null) {
      JsonNode b = parseValueOrGroup();
      return compare(op, a, b);
    }
    return truthy(a);
  }

  /** Parse a value: group, string, number, keyword, or path. Absent values are {@code null}. */
  private JsonNode parseValueOrGroup() {
    skipWs();
    if (match("(")) {
      boolean inner = parseOr();
      expect(")");
      return NODES.booleanNode(inner);
    }
    char c = peek();
    if (c == '"' || c == '\'') {
      return NODES.textNode(readString(c));
    }
    if (isNumStart(c)) {
      String num = readNumber();
      try {
        return NODES.numberNode(new BigDecimal(num));
      } catch (NumberFormatException ex) {
        throw new CombinatorException("Invalid number '" + num + "' in filter condition");
      }
    }
    if (c == '@' || c == '$') {
      return RowValues.resolve(row, toFieldPath(readPath()));
    }
    String word = readWord();
    if (word == null) {
      throw new CombinatorException(
          "Expected a value at position " + i + " of filter condition '" + s + "'");
    }
    return switch (word) {
      case "true" -> NODES.booleanNode(true);
      case "false" -> NODES.booleanNode(false);
      case "null" -> null;
      default -> RowValues.resolve(row, word);
    };
  }

  private boolean compare(String op, JsonNode a, JsonNode b) {
    if (op.equals("==")) {
      return RowValues.matches(a, b);
    }
    if (op.equals("!=")) {
      return !RowValues.isAbsent(a) && !RowValues.isAbsent(b) && !RowValues.matches(a, b);
    }
    Integer cmp = RowValues.compare(a, b);
    if (cmp == null) {
      return false;
    }
    return switch (op) {
      case "<" -> cmp < 0;
      case "<=" -> cmp <= 0;
      case ">" -> cmp > 0;
      case ">=" -> cmp >= 0;
      default -> false;
    };
  }

  private boolean truthy(JsonNode v) {
    if (RowValues.isAbsent(v)) return false;
    if (v.isBoolean()) return v.booleanValue();
    if (v.isNumber()) return v.decimalValue().signum() != 0;
    if (v.isTextual()) return !v.textValue().isEmpty();
    if (v.isArray() || v.isObject()) return v.size() > 0;
    return true;
  }

  /** {@code @.a.b} and {@code $.a.b} become {@code a.b}; bracket notation is accepted too. */
  private static String toFieldPath(String path) {
    String p = path.substring(1);
    if (p.startsWith(".")) {
      p = p.substring(1);
    }
    return p.replaceAll("\\[['\"]?([^'\"\\]]+)['\"]?]", ".$1").replaceAll("^\\.", "");
  }

  // Lexer helpers
  private void skipWs() {
    while (i < n && Character.isWhitespace(s.charAt(i))) i++;
  }

  private boolean match(String token) {
    skipWs();
    if (s.startsWith(token, i)) {
      i += token.length();
      return true;
    }
    return false;
  }

  private void expect(String token) {
    if (!match(token)) {
      throw new CombinatorException("Expected '" + token + "' in filter condition '" + s + "'");
    }
  }

  private char peek() {
    skipWs();
    return i < n ? s.charAt(i) : '\0';
  }

  private String readAny(String... ops) {
    skipWs();
    for (String op : ops) {
      if (s.startsWith(op, i)) {
        i += op.length();
        return op;
      }
    }
    return null;
  }

  private boolean isNumStart(char c) {
    return c == '-' || Character.isDigit(c);
  }

  private String readNumber() {
    skipWs();
    int start = i;
    if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
    while (i < n && Character.isDigit(s.charAt(i))) i++;
    if (i < n && s.charAt(i) == '.') {
      i++;
      while (i < n && Character.isDigit(s.charAt(i))) i++;
    }
    if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      i++;
      if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
      while (i < n && Character.isDigit(s.charAt(i))) i++;
    }
    return s.substring(start, i);
  }

  private String readString(char quote) {
    skipWs();
    i++; // opening quote
    StringBuilder sb = new StringBuilder();
    while (i < n) {
      char c = s.charAt(i++);
      if (c == quote) {
        return sb.toString();
      }
      if (c == '\\' && i < n) {
        char e = s.charAt(i++);
        switch (e) {
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            sb.append(unicodeEscape());
            i += 4;
          }
          default -> sb.append(e);
        }
      } else {
        sb.append(c);
      }
    }
    throw new CombinatorException("Unterminated string literal in filter condition '" + s + "'");
  }

  private char unicodeEscape() {
    if (i + 4 > n) {
      throw new CombinatorException("Incomplete \\u escape in filter condition '" + s + "'");
    }
    int code = 0;
    for (int k = i; k < i + 4; k++) {
      int digit = Character.digit(s.charAt(k), 16);
      if (digit < 0) {
        throw new CombinatorException(
            "Invalid \\u escape '" + s.substring(i - 2, i + 4) + "' in filter condition");
      }
      code = code * 16 + digit;
    }
    return (char) code;
  }

  private String readWord() {
    skipWs();
    int start = i;
    while (i < n) {
      char c = s.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_' && c != '.') break;
      i++;
    }
    if (start == i) return null;
    return s.substring(start, i);
  }

  private String readPath() {
    skipWs();
    int start = i;
    i++; // '@' or '$'
    while (i < n) {
      char c = s.charAt(i);
      if (Character.isLetterOrDigit(c)
          || c == '_'
          || c == '.'
          || c == '['
          || c == ']'
          || c == '"'
          || c == '\''
          || c == '-') {
        i++;
      } else {
        break;
      }
    }
    return s.substring(start, i);
  }
}
