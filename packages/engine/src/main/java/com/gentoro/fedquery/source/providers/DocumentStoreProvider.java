package com.gentoro.fedquery.source.providers;

import com.gentoro.fedquery.exception.ConfigurationException;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.DataSourceAdapter;
import com.gentoro.fedquery.source.document.DocumentQueryValidator;
import com.gentoro.fedquery.source.document.DocumentStoreAdapter;
import com.gentoro.fedquery.source.spi.DataSourceProvider;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Service provider for the MongoDB document-store adapter. */
public class DocumentStoreProvider implements DataSourceProvider {
  private static final Logger log = LoggingService.getLogger(DocumentStoreProvider.class);

  @Override
  public String id() {
    return "mongodb";
  }

  @Override
  public DataSourceKind kind() {
    return DataSourceKind.DOCUMENT_STORE;
  }

  @Override
  public DataSourceAdapter create(Configuration configuration) {
    String uri = configuration.getString("sources.mongodb.uri", "mongodb://localhost:27017");
    ConnectionString connectionString;
    try {
      connectionString = new ConnectionString(uri);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid sources.mongodb.uri: " + e.getMessage(), e);
    }
    String database = configuration.getString("sources.mongodb.database", null);
    if (database == null || database.isBlank()) {
      database = connectionString.getDatabase();
    }
    if (database == null || database.isBlank()) {
      throw new ConfigurationException(
          "sources.mongodb.database is required when the URI does not name a database");
    }
    long selectionTimeoutMs =
        configuration.getLong("sources.mongodb.server-selection-timeout-ms", 5000L);

    DocumentQueryValidator validator;
    try {
      validator =
          new DocumentQueryValidator(
              allowedOperations(configuration),
              configuration.getInt(
                  "sources.mongodb.default-find-limit", DocumentQueryValidator.DEFAULT_FIND_LIMIT),
              configuration.getInt(
                  "sources.mongodb.max-query-size",
                  DocumentQueryValidator.DEFAULT_MAX_QUERY_SIZE));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("sources.mongodb.allowed-operations: " + e.getMessage(), e);
    }

    MongoClientSettings settings =
        MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .applyToClusterSettings(
                b -> b.serverSelectionTimeout(selectionTimeoutMs, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(
                b -> b.connectTimeout((int) selectionTimeoutMs, TimeUnit.MILLISECONDS))
            .build();
    MongoClient client = MongoClients.create(settings);
    log.info(
        "Document store client created for {} (database '{}')",
        connectionString.getHosts(),
        database);
    return new DocumentStoreAdapter(client, database, validator);
  }

  static Set<String> allowedOperations(Configuration configuration) {
    List<String> configured =
        configuration.getList(
            String.class,
            "sources.mongodb.allowed-operations",
            List.copyOf(DocumentQueryValidator.DEFAULT_ALLOWED_OPERATIONS));
    Set<String> ops = new LinkedHashSet<>();
    for (String entry : configured) {
      for (String op : entry.split(",")) {
        if (!op.isBlank()) {
          ops.add(op.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    return ops;
  }
}
