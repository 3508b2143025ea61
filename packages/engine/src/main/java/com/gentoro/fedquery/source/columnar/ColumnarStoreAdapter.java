package com.gentoro.fedquery.source.columnar;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.exception.ExceptionUtil;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterException.Kind;
import com.gentoro.fedquery.source.DataSourceAdapter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;

/**
 * Columnar-store adapter over JDBC. Written for ClickHouse, usable with any JDBC data source
 * that understands the statements it is given.
 *
 * <p>Payload:
 *
 * <pre>{@code
 * {"query": "SELECT user_id FROM purchases WHERE ts >= :since",
 *  "params": {"since": "2024-01-01"},
 *  "settings": {"max_threads": 4}}
 * }</pre>
 */
public class ColumnarStoreAdapter implements DataSourceAdapter {
  private static final Logger log = LoggingService.getLogger(ColumnarStoreAdapter.class);

  /** ClickHouse server error codes. */
  private static final Set<Integer> SYNTAX_ERROR_CODES = Set.of(46, 47, 60, 62, 81);

  private static final Set<Integer> TIMEOUT_CODES = Set.of(159, 160, 209);
  private static final Set<Integer> NETWORK_ERROR_CODES = Set.of(210, 394);

  private final DataSource dataSource;
  private final SqlQueryValidator validator;
  private final Clock clock;

  public ColumnarStoreAdapter(DataSource dataSource, SqlQueryValidator validator) {
    this(dataSource, validator, Clock.systemUTC());
  }

  ColumnarStoreAdapter(DataSource dataSource, SqlQueryValidator validator, Clock clock) {
    this.dataSource = dataSource;
    this.validator = validator;
    this.clock = clock;
  }

  @Override
  public DataSourceKind kind() {
    return DataSourceKind.COLUMNAR_STORE;
  }

  @Override
  public RowSet execute(JsonNode payload, Instant deadline) {
    ColumnarQuery query = ColumnarQuery.from(payload);
    String sql = validator.validate(query.sql());

    List<JsonNode> values;
    if (query.named().isEmpty()) {
      values = query.positional();
    } else {
      NamedParameters.Rewritten rewritten = NamedParameters.rewrite(sql);
      sql = rewritten.sql();
      values = new ArrayList<>(rewritten.names().size());
      for (String name : rewritten.names()) {
        JsonNode value = query.named().get(name);
        if (value == null) {
          throw new AdapterException(
              Kind.INVALID_QUERY, kind(), "No value supplied for parameter ':" + name + "'");
        }
        values.add(value);
      }
    }
    sql = sql + query.settingsClause();

    int timeoutSeconds = timeoutSeconds(deadline);
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setQueryTimeout(timeoutSeconds);
      for (int i = 0; i < values.size(); i++) {
        bind(statement, i + 1, values.get(i));
      }
      try (ResultSet rs = statement.executeQuery()) {
        RowSet rows = JdbcRowMapper.toRowSet(rs);
        log.debug("Columnar query returned {} row(s)", rows.size());
        return rows;
      }
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  private int timeoutSeconds(Instant deadline) {
    long remaining = Duration.between(clock.instant(), deadline).toMillis();
    if (remaining <= 0) {
      throw new AdapterException(Kind.TIMEOUT, kind(), "Deadline passed before the query started");
    }
    return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (remaining + 999) / 1000));
  }

  private static void bind(PreparedStatement statement, int index, JsonNode value)
      throws SQLException {
    if (value == null || value.isNull()) {
      statement.setNull(index, Types.NULL);
    } else if (value.isTextual()) {
      statement.setString(index, value.asText());
    } else if (value.isBoolean()) {
      statement.setBoolean(index, value.booleanValue());
    } else if (value.isIntegralNumber() && value.canConvertToLong()) {
      statement.setLong(index, value.longValue());
    } else if (value.isNumber()) {
      statement.setBigDecimal(index, value.decimalValue());
    } else if (value.isArray()) {
      Object[] items = new Object[value.size()];
      for (int i = 0; i < items.length; i++) {
        items[i] = toJdbcValue(value.get(i));
      }
      statement.setObject(index, items);
    } else {
      statement.setString(index, value.toString());
    }
  }

  private static Object toJdbcValue(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isTextual()) {
      return node.asText();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return node.longValue();
    }
    return node.isNumber() ? node.decimalValue() : node.toString();
  }

  AdapterException translate(SQLException e) {
    Kind errorKind;
    String state = e.getSQLState() == null ? "" : e.getSQLState();
    if (e instanceof SQLTimeoutException || TIMEOUT_CODES.contains(e.getErrorCode())) {
      errorKind = Kind.TIMEOUT;
    } else if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException
        || e instanceof SQLRecoverableException
        || state.startsWith("08")
        || NETWORK_ERROR_CODES.contains(e.getErrorCode())) {
      errorKind = Kind.CONNECTION_LOST;
    } else if (e instanceof SQLSyntaxErrorException
        || state.startsWith("42")
        || SYNTAX_ERROR_CODES.contains(e.getErrorCode())) {
      errorKind = Kind.INVALID_QUERY;
    } else {
      errorKind = Kind.BACKEND_REJECTED;
    }
    return new AdapterException(
        errorKind, kind(), "Columnar query failed: " + ExceptionUtil.extractErrorMessage(e), e);
  }

  @Override
  public void close() {
    if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close columnar data source: {}", ExceptionUtil.extractErrorMessage(e));
      }
    }
  }
}
