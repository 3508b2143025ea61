package com.gentoro.fedquery.source.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterException.Kind;
import com.gentoro.fedquery.source.DataSourceAdapter;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CountOptions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.slf4j.Logger;

/**
 * Document-store adapter backed by the MongoDB synchronous driver.
 *
 * <p>Payload:
 *
 * <pre>{@code
 * {"collection": "events", "operation": "find",
 *  "filter": {"type": "view"},
 *  "options": {"projection": {"user_id": 1}, "sort": {"ts": -1}, "skip": 0, "limit": 50}}
 * }</pre>
 *
 * <p>The time left until the deadline is sent to the server as {@code maxTimeMS}; the driver's
 * connection pool is shared by all calls.
 */
public class DocumentStoreAdapter implements DataSourceAdapter {
  private static final Logger log = LoggingService.getLogger(DocumentStoreAdapter.class);

  /** Server error codes meaning the request itself is malformed. */
  private static final Set<Integer> INVALID_QUERY_CODES = Set.of(2, 9, 14, 15, 40324);

  private final MongoClient client;
  private final MongoDatabase database;
  private final DocumentQueryValidator validator;
  private final Clock clock;

  public DocumentStoreAdapter(
      MongoClient client, String databaseName, DocumentQueryValidator validator) {
    this(client, databaseName, validator, Clock.systemUTC());
  }

  DocumentStoreAdapter(
      MongoClient client, String databaseName, DocumentQueryValidator validator, Clock clock) {
    this.client = client;
    this.database = client.getDatabase(databaseName);
    this.validator = validator;
    this.clock = clock;
  }

  @Override
  public DataSourceKind kind() {
    return DataSourceKind.DOCUMENT_STORE;
  }

  @Override
  public RowSet execute(JsonNode payload, Instant deadline) {
    DocumentQuery query = validator.validate(payload);
    long maxTimeMs = remainingMillis(deadline);
    try {
      MongoCollection<Document> collection = database.getCollection(query.collection());
      RowSet rows =
          switch (query.operation()) {
            case "find" -> find(collection, query, maxTimeMs);
            case "aggregate" -> aggregate(collection, query, maxTimeMs);
            case "count" -> count(collection, query, maxTimeMs);
            default -> throw new AdapterException(
                Kind.INVALID_QUERY, kind(), "Operation '" + query.operation() + "' is not allowed");
          };
      log.debug(
          "{} on '{}' returned {} row(s)", query.operation(), query.collection(), rows.size());
      return rows;
    } catch (JsonParseException | IllegalArgumentException e) {
      throw new AdapterException(
          Kind.INVALID_QUERY, kind(), "Invalid document-store query: " + e.getMessage(), e);
    } catch (MongoException e) {
      throw translate(e);
    }
  }

  private RowSet find(MongoCollection<Document> collection, DocumentQuery query, long maxTimeMs) {
    FindIterable<Document> iterable =
        collection.find(toDocument(query.filter())).maxTime(maxTimeMs, TimeUnit.MILLISECONDS);
    if (query.projection() != null) {
      iterable = iterable.projection(toDocument(query.projection()));
    }
    if (query.sort() != null) {
      iterable = iterable.sort(toDocument(query.sort()));
    }
    if (query.skip() > 0) {
      iterable = iterable.skip(query.skip());
    }
    if (query.limit() > 0) {
      iterable = iterable.limit(query.limit());
    }
    try (MongoCursor<Document> cursor = iterable.iterator()) {
      return drain(cursor);
    }
  }

  private RowSet aggregate(
      MongoCollection<Document> collection, DocumentQuery query, long maxTimeMs) {
    List<Document> pipeline = new ArrayList<>(query.pipeline().size());
    for (ObjectNode stage : query.pipeline()) {
      pipeline.add(toDocument(stage));
    }
    AggregateIterable<Document> iterable =
        collection.aggregate(pipeline).maxTime(maxTimeMs, TimeUnit.MILLISECONDS);
    try (MongoCursor<Document> cursor = iterable.iterator()) {
      return drain(cursor);
    }
  }

  private RowSet count(MongoCollection<Document> collection, DocumentQuery query, long maxTimeMs) {
    long count =
        collection.countDocuments(
            toDocument(query.filter()),
            new CountOptions().maxTime(maxTimeMs, TimeUnit.MILLISECONDS));
    ObjectNode row = DocumentNormalizer.toRow(new Document("count", count));
    return RowSet.of(row);
  }

  private RowSet drain(MongoCursor<Document> cursor) {
    List<ObjectNode> rows = new ArrayList<>();
    while (cursor.hasNext()) {
      if (Thread.currentThread().isInterrupted()) {
        throw new AdapterException(Kind.TIMEOUT, kind(), "Query interrupted while reading results");
      }
      rows.add(DocumentNormalizer.toRow(cursor.next()));
    }
    return RowSet.of(rows);
  }

  private long remainingMillis(Instant deadline) {
    long remaining = Duration.between(clock.instant(), deadline).toMillis();
    if (remaining <= 0) {
      throw new AdapterException(Kind.TIMEOUT, kind(), "Deadline passed before the query started");
    }
    return remaining;
  }

  /** Extended JSON is accepted, so {@code {"$oid": ...}} and {@code {"$date": ...}} work. */
  private static Document toDocument(JsonNode node) {
    return Document.parse(node.toString());
  }

  AdapterException translate(MongoException e) {
    Kind errorKind;
    if (e instanceof MongoExecutionTimeoutException
        || e instanceof MongoTimeoutException
        || e instanceof MongoSocketReadTimeoutException
        || e instanceof MongoInterruptedException) {
      errorKind = Kind.TIMEOUT;
    } else if (e instanceof MongoSocketException) {
      errorKind = Kind.CONNECTION_LOST;
    } else if (e instanceof MongoCommandException cmd
        && INVALID_QUERY_CODES.contains(cmd.getErrorCode())) {
      errorKind = Kind.INVALID_QUERY;
    } else {
      errorKind = Kind.BACKEND_REJECTED;
    }
    return new AdapterException(errorKind, kind(), "MongoDB query failed: " + e.getMessage(), e);
  }

  @Override
  public void close() {
    log.info("Closing document-store client");
    client.close();
  }
}
