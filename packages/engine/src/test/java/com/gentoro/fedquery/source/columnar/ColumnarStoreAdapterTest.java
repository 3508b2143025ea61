package com.gentoro.fedquery.source.columnar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterException.Kind;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ColumnarStoreAdapterTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private DataSource dataSource;
  private Connection connection;
  private PreparedStatement statement;
  private ResultSet resultSet;
  private ColumnarStoreAdapter adapter;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = mock(DataSource.class);
    connection = mock(Connection.class);
    statement = mock(PreparedStatement.class);
    resultSet = mock(ResultSet.class);
    ResultSetMetaData meta = mock(ResultSetMetaData.class);
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.getMetaData()).thenReturn(meta);
    when(meta.getColumnCount()).thenReturn(2);
    when(meta.getColumnLabel(1)).thenReturn("user_id");
    when(meta.getColumnLabel(2)).thenReturn("total");
    when(resultSet.next()).thenReturn(true, true, false);
    when(resultSet.getObject(1)).thenReturn(1L, 2L);
    when(resultSet.getObject(2)).thenReturn(new BigDecimal("9.50"), (Object) null);
    adapter =
        new ColumnarStoreAdapter(
            dataSource, new SqlQueryValidator(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static JsonNode json(String text) {
    try {
      return JacksonUtility.getJsonMapper().readTree(text);
    } catch (Exception e) {
      throw new IllegalArgumentException(e);
    }
  }

  @Test
  @DisplayName("named parameters are bound positionally and settings are appended")
  void namedParametersAndSettings() throws SQLException {
    RowSet rows =
        adapter.execute(
            json(
                """
                {"query": "SELECT user_id, total FROM s WHERE ts >= :since AND region = :region",
                 "params": {"region": "eu", "since": "2024-01-01"},
                 "settings": {"max_threads": 4, "use_cache": true, "mode": "it's"}}
                """),
            NOW.plusMillis(2500));

    verify(connection)
        .prepareStatement(
            "SELECT user_id, total FROM s WHERE ts >= ? AND region = ?"
                + " SETTINGS max_threads=4, use_cache=1, mode='it\\'s'");
    verify(statement).setString(1, "2024-01-01");
    verify(statement).setString(2, "eu");
    verify(statement).setQueryTimeout(3);

    assertEquals(2, rows.size());
    assertEquals(1L, rows.row(0).get("user_id").asLong());
    assertEquals(new BigDecimal("9.50"), rows.row(0).get("total").decimalValue());
    assertTrue(rows.row(1).get("total").isNull());

    verify(resultSet).close();
    verify(statement).close();
    verify(connection).close();
  }

  @Test
  @DisplayName("positional parameters are bound by JSON type")
  void positionalParameters() throws SQLException {
    adapter.execute(
        json(
            """
            {"query": "SELECT * FROM t WHERE a = ? AND b = ? AND c = ? AND d = ? AND has(?, e)",
             "params": [null, true, 7, 1.5, ["x", 2]]}
            """),
        NOW.plusSeconds(10));

    verify(statement).setNull(1, Types.NULL);
    verify(statement).setBoolean(2, true);
    verify(statement).setLong(3, 7L);
    verify(statement).setBigDecimal(4, new BigDecimal("1.5"));
    verify(statement).setObject(5, new Object[] {"x", 2L});
    verify(statement).setQueryTimeout(10);
  }

  @Test
  @DisplayName("a named placeholder without a value is an invalid query")
  void missingNamedParameter() throws SQLException {
    AdapterException e =
        assertThrows(
            AdapterException.class,
            () ->
                adapter.execute(
                    json(
                        "{\"query\": \"SELECT * FROM t WHERE a = :a AND b = :b\","
                            + " \"params\": {\"a\": 1}}"),
                    NOW.plusSeconds(1)));
    assertEquals(Kind.INVALID_QUERY, e.getKind());
    assertTrue(e.getMessage().contains(":b"));
    verify(dataSource, never()).getConnection();
  }

  @Test
  @DisplayName("rejected statements and malformed payloads never open a connection")
  void rejectedBeforeConnecting() throws SQLException {
    assertEquals(
        Kind.INVALID_QUERY,
        assertThrows(
                AdapterException.class,
                () -> adapter.execute(json("{\"query\": \"DELETE FROM t\"}"), NOW.plusSeconds(1)))
            .getKind());
    assertEquals(
        Kind.INVALID_QUERY,
        assertThrows(
                AdapterException.class,
                () -> adapter.execute(json("{\"sql\": \"SELECT 1\"}"), NOW.plusSeconds(1)))
            .getKind());
    verify(dataSource, never()).getConnection();
  }

  @Test
  @DisplayName("an expired deadline is a timeout before any call")
  void expiredDeadline() throws SQLException {
    AdapterException e =
        assertThrows(
            AdapterException.class,
            () -> adapter.execute(json("{\"query\": \"SELECT 1\"}"), NOW));
    assertEquals(Kind.TIMEOUT, e.getKind());
    verify(dataSource, never()).getConnection();
  }

  @Test
  @DisplayName("driver failures are translated and resources still closed")
  void driverFailure() throws SQLException {
    when(statement.executeQuery()).thenThrow(new SQLTimeoutException("query timed out"));

    AdapterException e =
        assertThrows(
            AdapterException.class,
            () -> adapter.execute(json("{\"query\": \"SELECT 1\"}"), NOW.plusSeconds(1)));

    assertEquals(Kind.TIMEOUT, e.getKind());
    assertTrue(e.isRetryable());
    verify(statement).close();
    verify(connection).close();
  }

  @Test
  @DisplayName("SQL states and server codes map onto error kinds")
  void translate() {
    assertEquals(
        Kind.CONNECTION_LOST, adapter.translate(new SQLException("reset", "08006")).getKind());
    assertEquals(
        Kind.INVALID_QUERY, adapter.translate(new SQLSyntaxErrorException("bad")).getKind());
    assertEquals(
        Kind.INVALID_QUERY,
        adapter.translate(new SQLException("Code: 62. Syntax error", "HY000", 62)).getKind());
    assertEquals(
        Kind.TIMEOUT, adapter.translate(new SQLException("Code: 159", "HY000", 159)).getKind());
    assertEquals(
        Kind.CONNECTION_LOST,
        adapter.translate(new SQLException("Code: 210", "HY000", 210)).getKind());
    assertEquals(
        Kind.BACKEND_REJECTED,
        adapter.translate(new SQLException("Code: 497. Not enough privileges", "HY000", 497))
            .getKind());
  }

  @Test
  @DisplayName("closing the adapter closes a closeable data source")
  void close() throws Exception {
    DataSource pooled = mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
    new ColumnarStoreAdapter(pooled, new SqlQueryValidator()).close();
    verify((AutoCloseable) pooled).close();
  }
}
