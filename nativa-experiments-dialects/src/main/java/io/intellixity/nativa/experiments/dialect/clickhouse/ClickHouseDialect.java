package io.intellixity.nativa.experiments.dialect.clickhouse;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.time.Instant;

/**
 * ClickHouse.
 *
 * ClickHouse has no schemas: tables resolve as {@code database.table}. Timestamps are pinned to
 * UTC explicitly since the server time zone is arbitrary.
 */
public final class ClickHouseDialect extends AbstractSqlDialect {
  public ClickHouseDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "clickhouse"; }

  @Override protected boolean requiresSchema() { return false; }

  @Override
  public String toTimestamp(Instant instant) {
    return "toDateTime(" + super.toTimestamp(instant) + ", 'UTC')";
  }

  @Override
  public String toTimestampWithMs(Instant instant) {
    return "toDateTime64(" + super.toTimestampWithMs(instant) + ", 3, 'UTC')";
  }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return "date" + (sign == '+' ? "Add" : "Sub") + "(" + unit.sqlName() + ", " + amount + ", " + col + ")";
  }

  @Override public String dateTrunc(String col) { return "dateTrunc('day', " + col + ")"; }

  @Override public String dateDiff(String startCol, String endCol) { return "dateDiff('day', " + startCol + ", " + endCol + ")"; }

  @Override public String formatDate(String col) { return "formatDateTime(" + col + ", '%F')"; }

  @Override public String formatDateTimeString(String col) { return "formatDateTime(" + col + ", '%Y-%m-%d %H:%i:%S.%f')"; }

  @Override public String currentTimestamp() { return "now()"; }

  @Override public String castToString(String col) { return "toString(" + col + ")"; }

  @Override public String castToDate(String col) { return "toDate(" + col + ")"; }

  @Override public String castToTimestamp(String col) { return "toDateTime(" + col + ")"; }

  @Override public String castUserDateCol(String col) { return "toDateTime(" + col + ")"; }

  @Override public String ensureFloat(String col) { return "toFloat64(" + col + ")"; }

  @Override
  public String escapeStringLiteral(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  @Override
  public String ifElse(String condition, String ifTrue, String ifFalse) {
    return "if(" + condition + ", " + ifTrue + ", " + ifFalse + ")";
  }

  @Override public String stddev(String col) { return "stddevSamp(" + col + ")"; }

  @Override
  public String evalBoolean(String col, boolean value) {
    return col + " = " + (value ? "true" : "false");
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    StringBuilder keys = new StringBuilder();
    for (String key : path.split("\\.")) keys.append(", '").append(escapeStringLiteral(key)).append('\'');
    return (numeric ? "JSONExtractFloat(" : "JSONExtractString(") + jsonCol + keys + ")";
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "String";
      case INTEGER -> "Int64";
      case FLOAT -> "Float64";
      case BOOLEAN -> "Bool";
      case DATE -> "Date";
      case TIMESTAMP -> "DateTime";
      case HLL -> "AggregateFunction(uniq, String)";
    };
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "quantile(" + quantile + ")(" + col + ")";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "clickhouse"; }
    @Override public SqlDialect create(ConnectionParams params) { return new ClickHouseDialect(params); }
  }
}
