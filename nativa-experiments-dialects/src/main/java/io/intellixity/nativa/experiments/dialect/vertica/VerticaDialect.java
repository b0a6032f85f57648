package io.intellixity.nativa.experiments.dialect.vertica;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

public final class VerticaDialect extends AbstractSqlDialect {
  public VerticaDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "vertica"; }

  @Override public String schema() { return params.get("schema", "public"); }

  @Override protected boolean requiresDatabase() { return false; }

  @Override public String formatDate(String col) { return "to_char(" + col + ", 'YYYY-MM-DD')"; }

  @Override public String formatDateTimeString(String col) { return "to_char(" + col + ", 'YYYY-MM-DD HH24:MI:SS.MS')"; }

  @Override public String ensureFloat(String col) { return col + "::float"; }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = "MAPLOOKUP(MapJSONExtractor(" + jsonCol + "), '" + escapeStringLiteral(path) + "')";
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override public boolean hasEfficientPercentile() { return true; }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "APPROXIMATE_PERCENTILE(" + col + " USING PARAMETERS percentiles='" + quantile + "')";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "vertica"; }
    @Override public SqlDialect create(ConnectionParams params) { return new VerticaDialect(params); }
  }
}
