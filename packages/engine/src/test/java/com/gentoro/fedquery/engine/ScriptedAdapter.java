package com.gentoro.fedquery.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.DataSourceAdapter;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Test adapter that dispatches on the {@code name} field of the query object. */
final class ScriptedAdapter implements DataSourceAdapter {

  @FunctionalInterface
  interface Script {
    RowSet run(JsonNode query, Instant deadline) throws Exception;
  }

  private final DataSourceKind kind;
  private final Map<String, Script> scripts = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();
  private volatile boolean closed;

  ScriptedAdapter(DataSourceKind kind) {
    this.kind = kind;
  }

  ScriptedAdapter on(String name, Script script) {
    scripts.put(name, script);
    return this;
  }

  ScriptedAdapter returning(String name, RowSet rows) {
    return on(name, (q, d) -> rows);
  }

  ScriptedAdapter failing(String name, AdapterException.Kind errorKind) {
    return on(
        name,
        (q, d) -> {
          throw new AdapterException(errorKind, kind, name + " failed");
        });
  }

  static RowSet rows(String field, int... values) {
    List<ObjectNode> out = new ArrayList<>();
    for (int v : values) {
      out.add(JacksonUtility.getJsonMapper().createObjectNode().put(field, v));
    }
    return RowSet.of(out);
  }

  @Override
  public DataSourceKind kind() {
    return kind;
  }

  @Override
  public RowSet execute(JsonNode query, Instant deadline) {
    String name = query.path("name").asText();
    calls.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
    try {
      Script script = scripts.get(name);
      if (script == null) {
        throw new AdapterException(
            AdapterException.Kind.INVALID_QUERY, kind, "No script for '" + name + "'");
      }
      return script.run(query, deadline);
    } catch (AdapterException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AdapterException(AdapterException.Kind.TIMEOUT, kind, "Interrupted", e);
    } catch (Exception e) {
      throw new AdapterException(
          AdapterException.Kind.BACKEND_REJECTED, kind, String.valueOf(e.getMessage()), e);
    } finally {
      inFlight.decrementAndGet();
    }
  }

  int calls(String name) {
    AtomicInteger n = calls.get(name);
    return n == null ? 0 : n.get();
  }

  int totalCalls() {
    return calls.values().stream().mapToInt(AtomicInteger::get).sum();
  }

  int maxInFlight() {
    return maxInFlight.get();
  }

  boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
