package io.intellixity.nativa.experiments.model;

import io.intellixity.nativa.experiments.error.InvalidMetricException;

import java.util.Map;

/**
 * Where a legacy metric reads its rows from: either a warehouse table with explicit
 * columns, or a raw SQL sub-select exposing {@code <idType>}, {@code timestamp} and {@code value}.
 */
public record MetricSource(String table,
                           String column,
                           String timestampColumn,
                           Map<String, String> userIdColumns,
                           String sql) {
  public MetricSource {
    userIdColumns = userIdColumns == null ? Map.of() : Map.copyOf(userIdColumns);
  }

  public static MetricSource ofTable(String table, String column, String timestampColumn, Map<String, String> userIdColumns) {
    return new MetricSource(table, column, timestampColumn, userIdColumns, null);
  }

  public static MetricSource ofSql(String sql) {
    return new MetricSource(null, null, null, Map.of(), sql);
  }

  public boolean isSql() {
    return sql != null && !sql.isBlank();
  }

  public boolean isTable() {
    return table != null && !table.isBlank();
  }

  /** Column holding the given id type; defaults to a column named after the id type. */
  public String userIdColumn(String idType) {
    return userIdColumns.getOrDefault(idType, idType);
  }

  void validate(String metricId) {
    if (isSql() == isTable()) {
      throw new InvalidMetricException(isSql()
          ? "Metric " + metricId + " defines both a table and a SQL source"
          : "Metric " + metricId + " has neither a SQL source nor a table source");
    }
  }
}
