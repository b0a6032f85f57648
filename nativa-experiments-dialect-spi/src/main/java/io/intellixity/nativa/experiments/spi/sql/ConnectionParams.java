package io.intellixity.nativa.experiments.spi.sql;

import java.util.Map;

/**
 * Immutable per-datasource connection parameters (project id, database, schema, driver, ...).
 * Dialects only read name-resolution values from it; credentials are never rendered into SQL.
 */
public record ConnectionParams(Map<String, String> values) {
  public static final ConnectionParams EMPTY = new ConnectionParams(Map.of());

  public ConnectionParams {
    values = values == null ? Map.of() : Map.copyOf(values);
  }

  public static ConnectionParams of(Map<String, String> values) {
    return new ConnectionParams(values);
  }

  public String get(String key) {
    return values.get(key);
  }

  public String get(String key, String defaultValue) {
    String v = values.get(key);
    return v == null || v.isBlank() ? defaultValue : v;
  }

  @Override
  public String toString() {
    return "ConnectionParams" + values.keySet();
  }
}
