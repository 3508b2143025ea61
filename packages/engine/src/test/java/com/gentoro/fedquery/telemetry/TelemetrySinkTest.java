package com.gentoro.fedquery.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.plan.StepKind;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class TelemetrySinkTest {

  private static TelemetryRecord record(String planId, String stepId, TelemetryOutcome outcome) {
    return new TelemetryRecord(
        planId,
        stepId,
        StepKind.QUERY,
        DataSourceKind.COLUMNAR_STORE,
        Instant.parse("2024-05-01T12:00:00Z"),
        Duration.ofMillis(42),
        7,
        outcome == TelemetryOutcome.RETRIED ? 2 : 1,
        outcome,
        outcome == TelemetryOutcome.FAILED ? "TIMEOUT" : null);
  }

  @Test
  @DisplayName("records serialize with snake_case fields")
  void recordJson() {
    ObjectNode json = record("p1", "b", TelemetryOutcome.FAILED).toJson();
    assertEquals("p1", json.get("plan_id").asText());
    assertEquals("clickhouse", json.get("data_source").asText());
    assertEquals("2024-05-01T12:00:00Z", json.get("start").asText());
    assertEquals(42, json.get("duration_ms").asLong());
    assertEquals(7, json.get("rows").asLong());
    assertEquals("FAILED", json.get("outcome").asText());
    assertEquals("TIMEOUT", json.get("error_kind").asText());
    assertFalse(record("p1", "a", TelemetryOutcome.SUCCEEDED).toJson().has("error_kind"));
  }

  @Test
  @DisplayName("the in-memory sink evicts the oldest records beyond its capacity")
  void inMemoryCapacity() {
    InMemoryTelemetrySink sink = new InMemoryTelemetrySink(3);
    sink.flush(
        "p1",
        List.of(
            record("p1", "a", TelemetryOutcome.SUCCEEDED),
            record("p1", "b", TelemetryOutcome.RETRIED)));
    sink.flush(
        "p2",
        List.of(
            record("p2", "a", TelemetryOutcome.SUCCEEDED),
            record("p2", "b", TelemetryOutcome.CANCELLED)));

    assertEquals(3, sink.records().size());
    assertEquals("b", sink.records().get(0).stepId());
    assertEquals(1, sink.recordsFor("p1").size());
    assertEquals(2, sink.recordsFor("p2").size());

    sink.clear();
    assertTrue(sink.records().isEmpty());
    assertThrows(IllegalArgumentException.class, () -> new InMemoryTelemetrySink(0));
  }

  @Test
  @DisplayName("the logging sink writes one line per record")
  void loggingSink() {
    Logger logger = mock(Logger.class);
    when(logger.isInfoEnabled()).thenReturn(true);
    LoggingTelemetrySink sink = new LoggingTelemetrySink(logger);

    sink.flush(
        "p1",
        List.of(
            record("p1", "a", TelemetryOutcome.SUCCEEDED),
            record("p1", "b", TelemetryOutcome.FAILED)));

    verify(logger, times(2)).info(eq("{}"), any(Object.class));
  }

  @Test
  @DisplayName("the logging sink does nothing when info is disabled")
  void loggingSinkDisabled() {
    Logger logger = mock(Logger.class);
    LoggingTelemetrySink sink = new LoggingTelemetrySink(logger);

    sink.flush("p1", List.of(record("p1", "a", TelemetryOutcome.SUCCEEDED)));

    verify(logger, never()).info(eq("{}"), any(Object.class));
  }

  @Test
  @DisplayName("plan telemetry hands its snapshot to the sink once")
  void planTelemetry() {
    PlanTelemetry telemetry = new PlanTelemetry("p9");
    telemetry.append(record("p9", "a", TelemetryOutcome.SUCCEEDED));
    TelemetrySink sink = mock(TelemetrySink.class);

    telemetry.flushTo(sink);

    verify(sink).flush(eq("p9"), eq(List.of(record("p9", "a", TelemetryOutcome.SUCCEEDED))));
  }
}
