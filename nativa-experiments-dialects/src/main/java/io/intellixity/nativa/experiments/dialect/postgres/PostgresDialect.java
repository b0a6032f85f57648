package io.intellixity.nativa.experiments.dialect.postgres;

import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides; ANSI rendering lives in {@link AbstractSqlDialect}.
 * Tables resolve as {@code schema.table} within the connected database.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public PostgresDialect(ConnectionParams params) {
    super(params);
  }

  @Override public String id() { return "postgres"; }

  @Override public String formatDialect() { return "postgresql"; }

  @Override public String schema() { return params.get("schema", "public"); }

  @Override public List<String> sensitiveParamKeys() { return List.of("password", "caCert", "clientCert", "clientKey"); }

  @Override protected boolean requiresDatabase() { return false; }

  @Override
  public String dateDiff(String startCol, String endCol) {
    return endCol + "::DATE - " + startCol + "::DATE";
  }

  @Override public String formatDate(String col) { return "to_char(" + col + ", 'YYYY-MM-DD')"; }

  @Override public String formatDateTimeString(String col) { return "to_char(" + col + ", 'YYYY-MM-DD HH24:MI:SS.MS')"; }

  @Override public String ensureFloat(String col) { return col + "::float"; }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String keys = Arrays.stream(path.split("\\."))
        .map(k -> "'" + escapeStringLiteral(k) + "'")
        .collect(Collectors.joining(", "));
    String raw = "JSON_EXTRACT_PATH_TEXT(" + jsonCol + "::json, " + keys + ")";
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "PERCENTILE_DISC(" + quantile + ") WITHIN GROUP (ORDER BY " + col + ")";
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "TEXT";
      case FLOAT -> "DOUBLE PRECISION";
      case HLL -> "BYTEA";
      default -> super.dataType(type);
    };
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "postgres"; }
    @Override public SqlDialect create(ConnectionParams params) { return new PostgresDialect(params); }
  }
}
