package io.intellixity.nativa.experiments.dialect.databricks;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.List;

/** Databricks SQL on Unity Catalog: tables resolve as {@code catalog.schema.table}. */
public final class DatabricksDialect extends AbstractSqlDialect {
  public DatabricksDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "databricks"; }

  @Override public String formatDialect() { return "sparksql"; }

  @Override public String defaultDatabase() { return params.get("catalog", ""); }

  @Override public List<String> sensitiveParamKeys() { return List.of("token"); }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return "timestampadd(" + unit.name() + ", " + (sign == '-' ? "-" : "") + amount + ", " + col + ")";
  }

  @Override public String dateDiff(String startCol, String endCol) { return "datediff(" + endCol + ", " + startCol + ")"; }

  @Override public String formatDate(String col) { return "date_format(" + col + ", 'y-MM-dd')"; }

  @Override public String formatDateTimeString(String col) { return "date_format(" + col + ", 'y-MM-dd HH:mm:ss.SSS')"; }

  @Override public String castToString(String col) { return "cast(" + col + " as string)"; }

  @Override public String ensureFloat(String col) { return "cast(" + col + " as double)"; }

  @Override
  public String escapeStringLiteral(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = jsonCol + ":" + path;
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "STRING";
      case INTEGER -> "BIGINT";
      case HLL -> "BINARY";
      default -> super.dataType(type);
    };
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override public boolean hasCountDistinctHLL() { return true; }

  @Override public String hllAggregate(String col) { return "HLL_SKETCH_AGG(" + col + ")"; }

  @Override public String hllReaggregate(String col) { return "HLL_UNION_AGG(" + col + ")"; }

  @Override public String hllCardinality(String col) { return "HLL_SKETCH_ESTIMATE(" + col + ")"; }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "approx_percentile(" + col + ", " + quantile + ")";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "databricks"; }
    @Override public SqlDialect create(ConnectionParams params) { return new DatabricksDialect(params); }
  }
}
