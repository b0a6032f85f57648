package io.intellixity.nativa.experiments.dialect.redshift;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Amazon Redshift. HLL sketches and approximate percentiles are native. */
public final class RedshiftDialect extends AbstractSqlDialect {
  public RedshiftDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "redshift"; }

  @Override public String formatDialect() { return "redshift"; }

  @Override public String schema() { return params.get("schema", "public"); }

  @Override protected boolean requiresDatabase() { return false; }

  @Override public String formatDate(String col) { return "to_char(" + col + ", 'YYYY-MM-DD')"; }

  @Override public String formatDateTimeString(String col) { return "to_char(" + col + ", 'YYYY-MM-DD HH24:MI:SS.MS')"; }

  @Override public String ensureFloat(String col) { return col + "::float"; }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String keys = Arrays.stream(path.split("\\."))
        .map(k -> "'" + escapeStringLiteral(k) + "'")
        .collect(Collectors.joining(", "));
    String raw = "JSON_EXTRACT_PATH_TEXT(" + jsonCol + ", " + keys + ", TRUE)";
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String dataType(DataType type) {
    return type == DataType.HLL ? "HLLSKETCH" : super.dataType(type);
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override public boolean hasCountDistinctHLL() { return true; }

  @Override public String hllAggregate(String col) { return "HLL_CREATE_SKETCH(" + col + ")"; }

  @Override public String hllReaggregate(String col) { return "HLL_COMBINE(" + col + ")"; }

  @Override public String hllCardinality(String col) { return "HLL_CARDINALITY(" + col + ")"; }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "APPROXIMATE PERCENTILE_DISC(" + quantile + ") WITHIN GROUP (ORDER BY " + col + ")";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "redshift"; }
    @Override public SqlDialect create(ConnectionParams params) { return new RedshiftDialect(params); }
  }
}
