package com.gentoro.fedquery.telemetry;

import com.gentoro.fedquery.logging.LoggingService;
import java.util.List;
import org.slf4j.Logger;

/** Writes one JSON line per record to the {@code fedquery.telemetry} logger. */
public class LoggingTelemetrySink implements TelemetrySink {
  public static final String LOGGER_NAME = "fedquery.telemetry";

  private final Logger log;

  public LoggingTelemetrySink() {
    this(LoggingService.getLogger(LOGGER_NAME));
  }

  LoggingTelemetrySink(Logger log) {
    this.log = log;
  }

  @Override
  public void flush(String planId, List<TelemetryRecord> records) {
    if (!log.isInfoEnabled()) {
      return;
    }
    for (TelemetryRecord record : records) {
      log.info("{}", record.toJson());
    }
  }
}
