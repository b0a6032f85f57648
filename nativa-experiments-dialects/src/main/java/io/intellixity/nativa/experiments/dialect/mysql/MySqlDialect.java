package io.intellixity.nativa.experiments.dialect.mysql;

import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.PercentileCapSpec;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.List;

/**
 * MySQL 8 and MariaDB.
 *
 * There is no percentile aggregate, so percentile caps are computed with {@code PERCENT_RANK()} over
 * the non-null values of the table, one capped metric at a time. Quantile metrics are not available.
 * Tables resolve as {@code database.table}.
 */
public final class MySqlDialect extends AbstractSqlDialect {
  public MySqlDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "mysql"; }

  @Override public String formatDialect() { return "mysql"; }

  @Override protected boolean requiresSchema() { return false; }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return "DATE_" + (sign == '+' ? "ADD" : "SUB") + "(" + col + ", INTERVAL " + amount + " " + unit.name() + ")";
  }

  @Override public String dateTrunc(String col) { return "DATE(" + col + ")"; }

  @Override public String dateDiff(String startCol, String endCol) { return "DATEDIFF(" + endCol + ", " + startCol + ")"; }

  @Override public String formatDate(String col) { return "DATE_FORMAT(" + col + ", '%Y-%m-%d')"; }

  @Override public String formatDateTimeString(String col) { return "DATE_FORMAT(" + col + ", '%Y-%m-%d %H:%i:%S.%f')"; }

  @Override public String currentTimestamp() { return "NOW()"; }

  @Override public String castToString(String col) { return "cast(" + col + " as char)"; }

  @Override public String castToTimestamp(String col) { return "CAST(" + col + " AS DATETIME)"; }

  @Override public String ensureFloat(String col) { return "CAST(" + col + " AS DOUBLE)"; }

  @Override
  public String escapeStringLiteral(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  @Override
  public String evalBoolean(String col, boolean value) {
    return col + " = " + (value ? "true" : "false");
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = "JSON_EXTRACT(" + jsonCol + ", '$." + path + "')";
    return numeric ? ensureFloat(raw) : "JSON_UNQUOTE(" + raw + ")";
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "CHAR";
      case INTEGER -> "SIGNED";
      case BOOLEAN -> "UNSIGNED";
      case TIMESTAMP -> "DATETIME";
      case HLL -> "BLOB";
      default -> super.dataType(type);
    };
  }

  @Override public boolean hasQuantileTesting() { return false; }

  @Override
  public String approxQuantile(String col, double quantile) {
    throw UnsupportedCapabilityException.of(id(), "Quantile aggregation");
  }

  @Override
  public String percentileCapSelectClause(List<PercentileCapSpec> specs, String table, String where) {
    if (specs.size() != 1) {
      throw new UnsupportedCapabilityException("MySQL only supports one percentile capped metric at a time");
    }
    PercentileCapSpec s = specs.get(0);
    String value = s.ignoreZeros() ? ifElse(s.valueCol() + " = 0", "NULL", s.valueCol()) : s.valueCol();
    return "SELECT DISTINCT FIRST_VALUE(cap_source) OVER (\n"
        + "  ORDER BY CASE WHEN cap_rank <= " + s.percentile() + " THEN cap_rank END DESC\n"
        + ") AS " + s.outputCol() + "\n"
        + "FROM (\n"
        + "  SELECT\n"
        + "    cap_source,\n"
        + "    PERCENT_RANK() OVER (ORDER BY cap_source) AS cap_rank\n"
        + "  FROM (\n"
        + "    SELECT " + value + " AS cap_source\n"
        + "    FROM " + table
        + (where == null || where.isBlank() ? "" : "\n    " + where)
        + "\n  ) s\n"
        + "  WHERE cap_source IS NOT NULL\n"
        + ") t";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "mysql"; }
    @Override public SqlDialect create(ConnectionParams params) { return new MySqlDialect(params); }
  }
}
