package io.intellixity.nativa.experiments.dialect.mssql;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

/** Microsoft SQL Server (T-SQL). Tables resolve as {@code database.schema.table}, schema defaulting to {@code dbo}. */
public final class MsSqlDialect extends AbstractSqlDialect {
  public MsSqlDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "mssql"; }

  @Override public String formatDialect() { return "tsql"; }

  @Override public String schema() { return params.get("schema", "dbo"); }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return "DATEADD(" + unit.sqlName() + ", " + (sign == '-' ? "-" : "") + amount + ", " + col + ")";
  }

  @Override public String dateTrunc(String col) { return "cast(" + col + " as DATE)"; }

  @Override public String dateDiff(String startCol, String endCol) { return "DATEDIFF(day, " + startCol + ", " + endCol + ")"; }

  @Override public String formatDate(String col) { return "FORMAT(" + col + ", 'yyyy-MM-dd')"; }

  @Override public String formatDateTimeString(String col) { return "FORMAT(" + col + ", 'yyyy-MM-dd HH:mm:ss.fff')"; }

  @Override public String currentTimestamp() { return "GETUTCDATE()"; }

  @Override public String castToString(String col) { return "cast(" + col + " as varchar(256))"; }

  @Override public String castToTimestamp(String col) { return "CAST(" + col + " AS DATETIME2)"; }

  @Override public String ensureFloat(String col) { return "CAST(" + col + " AS FLOAT)"; }

  @Override public String stddev(String col) { return "STDEV(" + col + ")"; }

  @Override
  public String evalBoolean(String col, boolean value) {
    return col + " = " + (value ? "1" : "0");
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = "JSON_VALUE(" + jsonCol + ", '$." + path + "')";
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "VARCHAR(MAX)";
      case FLOAT -> "FLOAT";
      case BOOLEAN -> "BIT";
      case TIMESTAMP -> "DATETIME2";
      case HLL -> "VARBINARY(MAX)";
      default -> super.dataType(type);
    };
  }

  @Override
  public String selectStarLimit(String table, int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
    return "SELECT TOP " + limit + " * FROM " + table;
  }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "APPROX_PERCENTILE_CONT(" + quantile + ") WITHIN GROUP (ORDER BY " + col + ")";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "mssql"; }
    @Override public SqlDialect create(ConnectionParams params) { return new MsSqlDialect(params); }
  }
}
