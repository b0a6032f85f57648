package io.intellixity.nativa.experiments.dialect.bigquery;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.List;

/**
 * Google BigQuery (GoogleSQL).
 *
 * Table paths are {@code `project.dataset.table`}; the project comes from {@code projectId} and the
 * dataset from {@code defaultDataset}.
 */
public final class BigQueryDialect extends AbstractSqlDialect {
  public BigQueryDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "bigquery"; }

  @Override public String formatDialect() { return "bigquery"; }

  @Override public String defaultDatabase() { return params.get("projectId", ""); }

  @Override public String schema() { return params.get("defaultDataset", ""); }

  @Override public List<String> sensitiveParamKeys() { return List.of("privateKey", "clientEmail"); }

  @Override protected String escapePathCharacter() { return "`"; }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return "DATETIME_" + (sign == '+' ? "ADD" : "SUB") + "(" + col + ", INTERVAL " + amount + " "
        + unit.name() + ")";
  }

  @Override public String dateTrunc(String col) { return "date_trunc(" + col + ", DAY)"; }

  @Override public String dateDiff(String startCol, String endCol) { return "date_diff(" + endCol + ", " + startCol + ", DAY)"; }

  @Override public String formatDate(String col) { return "format_date(\"%F\", " + col + ")"; }

  @Override public String formatDateTimeString(String col) { return "format_datetime(\"%F %T\", " + col + ")"; }

  @Override public String currentTimestamp() { return "CURRENT_TIMESTAMP()"; }

  @Override public String castToString(String col) { return "cast(" + col + " as string)"; }

  @Override public String castUserDateCol(String col) { return "CAST(" + col + " as DATETIME)"; }

  @Override public String ensureFloat(String col) { return "CAST(" + col + " AS FLOAT64)"; }

  @Override
  public String escapeStringLiteral(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = "JSON_VALUE(" + jsonCol + ", '$." + path + "')";
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "STRING";
      case INTEGER -> "INT64";
      case FLOAT -> "FLOAT64";
      case BOOLEAN -> "BOOL";
      case DATE -> "DATE";
      case TIMESTAMP -> "TIMESTAMP";
      case HLL -> "BYTES";
    };
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override public boolean hasCountDistinctHLL() { return true; }

  @Override public String hllAggregate(String col) { return "HLL_COUNT.INIT(" + col + ")"; }

  @Override public String hllReaggregate(String col) { return "HLL_COUNT.MERGE_PARTIAL(" + col + ")"; }

  @Override public String hllCardinality(String col) { return "HLL_COUNT.EXTRACT(" + col + ")"; }

  /** Quantiles come from a 10000-bucket approximation indexed by offset. */
  @Override
  public String approxQuantile(String col, double quantile) {
    long offset = (long) Math.floor(10000 * quantile);
    return "APPROX_QUANTILES(" + col + ", 10000 IGNORE NULLS)[OFFSET(CAST(" + offset + " AS INT64))]";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "bigquery"; }
    @Override public SqlDialect create(ConnectionParams params) { return new BigQueryDialect(params); }
  }
}
