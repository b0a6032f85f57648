package io.intellixity.nativa.experiments.sql.dialect;

import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.IdentityJoin;
import io.intellixity.nativa.experiments.model.QuantileSettings;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.PercentileCapSpec;
import io.intellixity.nativa.experiments.spi.sql.QuantileBounds;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import io.intellixity.nativa.experiments.template.SqlTemplateVars;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ANSI-flavoured base for warehouse dialects.
 *
 * Concrete dialects extend this class directly and override only the syntax their engine
 * spells differently. Name resolution is driven by {@link #requiresDatabase()},
 * {@link #requiresSchema()} and {@link #escapePathCharacter()}.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);
  protected static final DateTimeFormatter TIMESTAMP_MS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.ROOT).withZone(ZoneOffset.UTC);

  private static final String USER_ID = "user_id";
  private static final String ANONYMOUS_ID = "anonymous_id";

  protected final ConnectionParams params;

  protected AbstractSqlDialect(ConnectionParams params) {
    this.params = params == null ? ConnectionParams.EMPTY : params;
  }

  public ConnectionParams params() { return params; }

  @Override public String formatDialect() { return ""; }

  @Override public String schema() { return params.get("schema", ""); }

  @Override public String defaultDatabase() { return params.get("database", ""); }

  @Override public List<String> sensitiveParamKeys() { return List.of("password"); }

  protected boolean requiresDatabase() { return true; }

  protected boolean requiresSchema() { return true; }

  /** Character wrapped around a whole table path; {@code null} leaves paths bare. */
  protected String escapePathCharacter() { return null; }

  // dates

  @Override
  public String toTimestamp(Instant instant) {
    return "'" + TIMESTAMP.format(instant) + "'";
  }

  @Override
  public String toTimestampWithMs(Instant instant) {
    return "'" + TIMESTAMP_MS.format(instant) + "'";
  }

  @Override
  public final String addHours(String col, double hours) {
    if (hours == 0) return col;
    char sign = hours > 0 ? '+' : '-';
    double abs = Math.abs(hours);
    long minutes = Math.round(abs * 60);
    if (minutes % 60 != 0) {
      return addTime(col, IntervalUnit.MINUTE, sign, minutes);
    }
    long wholeHours = minutes / 60;
    if (wholeHours == 0) return col;
    return addTime(col, IntervalUnit.HOUR, sign, wholeHours);
  }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return col + " " + sign + " INTERVAL '" + amount + " " + unit.sqlName() + "s'";
  }

  @Override public String dateTrunc(String col) { return "date_trunc('day', " + col + ")"; }

  @Override public String dateDiff(String startCol, String endCol) { return "datediff(day, " + startCol + ", " + endCol + ")"; }

  @Override public String formatDate(String col) { return col; }

  @Override public String formatDateTimeString(String col) { return castToString(col); }

  @Override public String currentTimestamp() { return "CURRENT_TIMESTAMP"; }

  // casts and expressions

  @Override public String castToString(String col) { return "cast(" + col + " as varchar)"; }

  @Override public String castToDate(String col) { return "CAST(" + col + " AS DATE)"; }

  @Override public String castToTimestamp(String col) { return "CAST(" + col + " AS TIMESTAMP)"; }

  @Override public String castUserDateCol(String col) { return col; }

  @Override public String ensureFloat(String col) { return col; }

  @Override
  public String escapeStringLiteral(String value) {
    return value.replace("'", "''");
  }

  @Override
  public String ifElse(String condition, String ifTrue, String ifFalse) {
    return "(CASE WHEN " + condition + " THEN " + ifTrue + " ELSE " + ifFalse + " END)";
  }

  @Override public String avg(String col) { return "AVG(" + col + ")"; }

  @Override public String stddev(String col) { return "STDDEV(" + col + ")"; }

  @Override
  public String evalBoolean(String col, boolean value) {
    return col + " IS " + (value ? "TRUE" : "FALSE");
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = "json_extract_scalar(" + jsonCol + ", '$." + path + "')";
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String dataType(DataType type) {
    return switch (type) {
      case STRING -> "VARCHAR";
      case INTEGER -> "INTEGER";
      case FLOAT -> "DOUBLE";
      case BOOLEAN -> "BOOLEAN";
      case DATE -> "DATE";
      case TIMESTAMP -> "TIMESTAMP";
      case HLL -> "VARBINARY";
    };
  }

  @Override
  public String selectStarLimit(String table, int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
    return "SELECT * FROM " + table + " LIMIT " + limit;
  }

  // optional capabilities

  @Override public boolean hasQuantileTesting() { return true; }

  @Override public boolean hasEfficientPercentile() { return false; }

  @Override public boolean hasCountDistinctHLL() { return false; }

  @Override
  public String hllAggregate(String col) {
    throw UnsupportedCapabilityException.of(id(), "COUNT DISTINCT (HyperLogLog)");
  }

  @Override
  public String hllReaggregate(String col) {
    throw UnsupportedCapabilityException.of(id(), "COUNT DISTINCT (HyperLogLog)");
  }

  @Override
  public String hllCardinality(String col) {
    throw UnsupportedCapabilityException.of(id(), "COUNT DISTINCT (HyperLogLog)");
  }

  @Override
  public String approxQuantile(String col, double quantile) {
    return "APPROX_PERCENTILE(" + col + ", " + quantile + ")";
  }

  @Override
  public String quantileColumn(String valueCol, String outputCol, double quantile) {
    return approxQuantile(valueCol, quantile) + " AS " + outputCol;
  }

  @Override
  public String percentileCapSelectClause(List<PercentileCapSpec> specs, String table, String where) {
    if (specs.isEmpty()) throw new IllegalArgumentException("no percentile caps requested for " + table);
    List<String> cols = new ArrayList<>();
    for (PercentileCapSpec s : specs) {
      String value = s.ignoreZeros() ? ifElse(s.valueCol() + " = 0", "NULL", s.valueCol()) : s.valueCol();
      cols.add(quantileColumn(value, s.outputCol(), s.percentile()));
    }
    return "SELECT\n  " + String.join(",\n  ", cols) + "\nFROM " + table
        + (where == null || where.isBlank() ? "" : "\n" + where);
  }

  @Override
  public String quantileGridColumns(QuantileSettings settings, String prefix) {
    String value = "m." + prefix + "value";
    StringBuilder sb = new StringBuilder();
    sb.append("\n, ").append(quantileColumn(value, prefix + "quantile", settings.quantile()));
    for (int nstar : QuantileBounds.N_STAR_VALUES) {
      QuantileBounds b = QuantileBounds.of(settings.quantile(), QuantileBounds.DEFAULT_ALPHA, nstar);
      sb.append("\n, ").append(quantileColumn(value, prefix + "quantile_lower_" + nstar, b.lower()));
      sb.append("\n, ").append(quantileColumn(value, prefix + "quantile_upper_" + nstar, b.upper()));
    }
    return sb.toString();
  }

  // name resolution

  @Override
  public String generateTablePath(String table, String schema, String database) {
    Objects.requireNonNull(table, "table");
    StringBuilder path = new StringBuilder();
    if (requiresDatabase()) {
      String db = isBlank(database) ? defaultDatabase() : database;
      if (isBlank(db)) {
        throw new MissingConfigurationException("No database provided. Please edit the connection settings and try again.");
      }
      path.append(db).append('.');
    }
    if (requiresSchema()) {
      String s = isBlank(schema) ? schema() : schema;
      if (isBlank(s)) {
        throw new MissingConfigurationException("No schema provided. Please edit the connection settings and try again.");
      }
      path.append(s).append('.');
    }
    path.append(table);
    String esc = escapePathCharacter();
    return esc == null ? path.toString() : esc + path + esc;
  }

  @Override
  public String identitiesQuery(DatasourceSettings settings, String id1, String id2, Instant from, Instant to,
                                String experimentId, SqlTemplateCompiler templates) {
    SqlTemplateVars vars = SqlTemplateVars.of(from, to).withExperimentId(experimentId);
    for (IdentityJoin join : settings.identityJoins()) {
      if (join.query() == null || join.query().length() <= 6) continue;
      if (join.joins(id1, id2)) {
        return "SELECT " + id1 + ", " + id2 + "\nFROM (\n" + templates.compile(join.query(), vars) + "\n) i\n"
            + "GROUP BY " + id1 + ", " + id2;
      }
    }
    boolean userAnonymousPair = (USER_ID.equals(id1) && ANONYMOUS_ID.equals(id2))
        || (ANONYMOUS_ID.equals(id1) && USER_ID.equals(id2));
    if (userAnonymousPair && !isBlank(settings.pageviewsQuery())) {
      return "SELECT user_id, anonymous_id\nFROM (\n" + templates.compile(settings.pageviewsQuery(), vars) + "\n) i\n"
          + "WHERE i.timestamp >= " + toTimestamp(from)
          + (to == null ? "" : " AND i.timestamp <= " + toTimestamp(to))
          + "\nGROUP BY user_id, anonymous_id";
    }
    throw new MissingConfigurationException("Missing identifier join table for '" + id1 + "' and '" + id2 + "'.");
  }

  protected static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
