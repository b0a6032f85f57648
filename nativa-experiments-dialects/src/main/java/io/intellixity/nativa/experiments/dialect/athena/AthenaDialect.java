package io.intellixity.nativa.experiments.dialect.athena;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Amazon Athena (Trino engine).
 *
 * Tables resolve as {@code catalog.database.table}; the Glue catalog is used unless {@code catalog} is set.
 */
public final class AthenaDialect extends AbstractSqlDialect {
  public AthenaDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "athena"; }

  @Override public String defaultDatabase() { return params.get("catalog", "AwsDataCatalog"); }

  @Override public String schema() { return params.get("database", ""); }

  @Override public List<String> sensitiveParamKeys() { return List.of("secretAccessKey"); }

  @Override
  public String toTimestamp(Instant instant) {
    return "from_iso8601_timestamp('" + DateTimeFormatter.ISO_INSTANT.format(instant) + "')";
  }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return col + " " + sign + " INTERVAL '" + amount + "' " + unit.sqlName();
  }

  @Override public String dateDiff(String startCol, String endCol) { return "date_diff('day', " + startCol + ", " + endCol + ")"; }

  @Override public String formatDate(String col) { return "substr(to_iso8601(" + col + "),1,10)"; }

  @Override public String formatDateTimeString(String col) { return "date_format(" + col + ", '%Y-%m-%d %H:%i:%S.%f')"; }

  @Override public String ensureFloat(String col) { return "CAST(" + col + " AS DOUBLE)"; }

  @Override
  public String dataType(DataType type) {
    return type == DataType.HLL ? "HyperLogLog" : super.dataType(type);
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override public boolean hasCountDistinctHLL() { return true; }

  @Override public String hllAggregate(String col) { return "APPROX_SET(" + col + ")"; }

  @Override public String hllReaggregate(String col) { return "MERGE(" + col + ")"; }

  @Override public String hllCardinality(String col) { return "CARDINALITY(" + col + ")"; }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "athena"; }
    @Override public SqlDialect create(ConnectionParams params) { return new AthenaDialect(params); }
  }
}
