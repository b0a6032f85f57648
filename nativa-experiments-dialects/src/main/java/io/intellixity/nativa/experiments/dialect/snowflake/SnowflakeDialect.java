package io.intellixity.nativa.experiments.dialect.snowflake;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.List;

/** Snowflake. */
public final class SnowflakeDialect extends AbstractSqlDialect {
  public SnowflakeDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "snowflake"; }

  @Override public String schema() { return params.get("schema", "PUBLIC"); }

  @Override public List<String> sensitiveParamKeys() { return List.of("password", "privateKey", "privateKeyPassword"); }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return "DATEADD(" + unit.sqlName() + ", " + (sign == '-' ? "-" : "") + amount + ", " + col + ")";
  }

  @Override public String formatDate(String col) { return "TO_VARCHAR(" + col + ", 'YYYY-MM-DD')"; }

  @Override public String formatDateTimeString(String col) { return "TO_VARCHAR(" + col + ", 'YYYY-MM-DD HH24:MI:SS.MS')"; }

  @Override public String castToString(String col) { return "TO_VARCHAR(" + col + ")"; }

  @Override public String ensureFloat(String col) { return "CAST(" + col + " AS DOUBLE)"; }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    return jsonCol + ":" + path + "::" + (numeric ? "float" : "string");
  }

  @Override
  public String dataType(DataType type) {
    return type == DataType.HLL ? "OBJECT" : super.dataType(type);
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override public boolean hasCountDistinctHLL() { return true; }

  @Override public String hllAggregate(String col) { return "HLL_ACCUMULATE(" + col + ")"; }

  @Override public String hllReaggregate(String col) { return "HLL_COMBINE(" + col + ")"; }

  @Override public String hllCardinality(String col) { return "HLL_ESTIMATE(" + col + ")"; }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "snowflake"; }
    @Override public SqlDialect create(ConnectionParams params) { return new SnowflakeDialect(params); }
  }
}
