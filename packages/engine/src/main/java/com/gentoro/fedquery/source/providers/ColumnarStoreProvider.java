package com.gentoro.fedquery.source.providers;

import com.clickhouse.jdbc.ClickHouseDataSource;
import com.gentoro.fedquery.exception.ConfigurationException;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.DataSourceAdapter;
import com.gentoro.fedquery.source.columnar.ColumnarStoreAdapter;
import com.gentoro.fedquery.source.columnar.SqlQueryValidator;
import com.gentoro.fedquery.source.spi.DataSourceProvider;
import java.sql.SQLException;
import java.util.Properties;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Service provider for the ClickHouse columnar-store adapter (JDBC). */
public class ColumnarStoreProvider implements DataSourceProvider {
  private static final Logger log = LoggingService.getLogger(ColumnarStoreProvider.class);

  @Override
  public String id() {
    return "clickhouse";
  }

  @Override
  public DataSourceKind kind() {
    return DataSourceKind.COLUMNAR_STORE;
  }

  @Override
  public DataSourceAdapter create(Configuration configuration) {
    String url =
        configuration.getString(
            "sources.clickhouse.url", "jdbc:clickhouse://localhost:8123/default");
    Properties properties = new Properties();
    String user = configuration.getString("sources.clickhouse.user", null);
    if (user != null && !user.isBlank()) {
      properties.setProperty("user", user);
    }
    String password = configuration.getString("sources.clickhouse.password", null);
    if (password != null) {
      properties.setProperty("password", password);
    }
    ClickHouseDataSource dataSource;
    try {
      dataSource = new ClickHouseDataSource(url, properties);
    } catch (SQLException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid sources.clickhouse.url: " + e.getMessage(), e);
    }
    log.info("Columnar store data source created for {}", url);
    return new ColumnarStoreAdapter(
        dataSource,
        new SqlQueryValidator(
            configuration.getInt(
                "sources.clickhouse.max-query-size", SqlQueryValidator.DEFAULT_MAX_QUERY_SIZE)));
  }
}
