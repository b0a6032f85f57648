package io.intellixity.nativa.experiments.spi.sql;

import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.QuantileSettings;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;

import java.time.Instant;
import java.util.List;

/**
 * Warehouse capability contract: every engine-specific piece of SQL syntax the experiment query
 * compiler emits goes through one of these operations. All methods are pure string producers.
 *
 * Optional capabilities ({@link #hasCountDistinctHLL()}, {@link #hasEfficientPercentile()}, ...) are
 * advertised by flags; asking a dialect for something it cannot express throws
 * {@link io.intellixity.nativa.experiments.error.UnsupportedCapabilityException}, never returns blank SQL.
 */
public interface SqlDialect {
  String id();

  /** Language id understood by the SQL pretty-printer; empty when output is left unformatted. */
  String formatDialect();

  String schema();

  String defaultDatabase();

  /** Connection fields that must never be sent to a client unencrypted. */
  List<String> sensitiveParamKeys();

  // dates

  String toTimestamp(Instant instant);

  String toTimestampWithMs(Instant instant);

  /** {@code col} shifted by {@code hours}; switches to minutes when the offset is not whole hours. 0 returns {@code col}. */
  String addHours(String col, double hours);

  /** @param sign {@code '+'} or {@code '-'} */
  String addTime(String col, IntervalUnit unit, char sign, long amount);

  String dateTrunc(String col);

  String dateDiff(String startCol, String endCol);

  String formatDate(String col);

  String formatDateTimeString(String col);

  String currentTimestamp();

  // casts and expressions

  String castToString(String col);

  String castToDate(String col);

  String castToTimestamp(String col);

  String castUserDateCol(String col);

  String ensureFloat(String col);

  String escapeStringLiteral(String value);

  String ifElse(String condition, String ifTrue, String ifFalse);

  String avg(String col);

  String stddev(String col);

  String evalBoolean(String col, boolean value);

  String extractJsonField(String jsonCol, String path, boolean numeric);

  String dataType(DataType type);

  String selectStarLimit(String table, int limit);

  // optional capabilities

  boolean hasQuantileTesting();

  boolean hasEfficientPercentile();

  boolean hasCountDistinctHLL();

  String hllAggregate(String col);

  String hllReaggregate(String col);

  String hllCardinality(String col);

  String approxQuantile(String col, double quantile);

  String quantileColumn(String valueCol, String outputCol, double quantile);

  /** SELECT computing every cap in {@code specs} over {@code table}; {@code where} may be empty. */
  String percentileCapSelectClause(List<PercentileCapSpec> specs, String table, String where);

  /**
   * Comma-prefixed quantile grid for a quantile metric: {@code <prefix>quantile} plus lower/upper bounds
   * for every {@link QuantileBounds#N_STAR_VALUES} sample size.
   */
  String quantileGridColumns(QuantileSettings settings, String prefix);

  // name resolution

  String generateTablePath(String table, String schema, String database);

  /**
   * Two-column query mapping {@code id1} to {@code id2}, from the first matching identity join or
   * the pageviews fallback; throws {@code MissingConfigurationException} when neither applies.
   */
  String identitiesQuery(DatasourceSettings settings, String id1, String id2, Instant from, Instant to,
                         String experimentId, SqlTemplateCompiler templates);
}
