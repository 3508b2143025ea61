package com.gentoro.fedquery.plan;

import java.util.Locale;

/** Where a step's work happens: one of the backend families, or the in-memory combinator. */
public enum DataSourceKind {
  DOCUMENT_STORE("mongodb"),
  COLUMNAR_STORE("clickhouse"),
  MEMORY("memory");

  private final String wireName;

  DataSourceKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public boolean isBackend() {
    return this != MEMORY;
  }

  /**
   * Resolve the value of a plan's {@code data_source} field. Accepts the wire names and the
   * generic aliases {@code document} and {@code columnar}; returns {@code null} when unknown.
   */
  public static DataSourceKind fromWire(String value) {
    if (value == null) {
      return null;
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (DataSourceKind kind : values()) {
      if (kind.wireName.equals(v)) {
        return kind;
      }
    }
    return switch (v) {
      case "document", "document_store", "mongo" -> DOCUMENT_STORE;
      case "columnar", "columnar_store" -> COLUMNAR_STORE;
      default -> null;
    };
  }
}
