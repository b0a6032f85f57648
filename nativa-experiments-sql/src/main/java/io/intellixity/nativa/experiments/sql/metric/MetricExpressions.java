package io.intellixity.nativa.experiments.sql.metric;

import io.intellixity.nativa.experiments.model.CappingSettings;
import io.intellixity.nativa.experiments.model.ColumnRef;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSource;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.MetricType;
import io.intellixity.nativa.experiments.model.QuantileType;
import io.intellixity.nativa.experiments.model.WindowSettings;
import io.intellixity.nativa.experiments.model.WindowType;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Per-metric SQL fragments: conversion windows, capping, value columns and aggregations.
 * Every method renders through the bound {@link SqlDialect} and returns plain text.
 */
public final class MetricExpressions {
  private static final Pattern COUNT_STAR = Pattern.compile("count\\(\\s*\\*\\s*\\)", Pattern.CASE_INSENSITIVE);

  private final SqlDialect dialect;

  public MetricExpressions(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public SqlDialect dialect() { return dialect; }

  /** Aggregates a per-row value column; {@code quantileCol} is only read by event quantile metrics. */
  @FunctionalInterface
  public interface Aggregation {
    String apply(String column, String quantileCol);

    default String apply(String column) {
      return apply(column, null);
    }
  }

  // windows

  public String conversionWindowClause(String baseCol, String metricCol, MetricSpec metric,
                                       Instant endDate, boolean overrideConversionWindows) {
    WindowSettings w = metric.windowSettings();
    double windowHours = w.windowHours();
    double delayHours = w.delayHours();

    String clause = metricCol + " >= " + dialect.addHours(baseCol, delayHours);
    if (w.type() == WindowType.CONVERSION && !overrideConversionWindows) {
      clause += "\n  AND " + metricCol + " <= " + dialect.addHours(baseCol, delayHours + windowHours);
    } else {
      clause += "\n  AND " + metricCol + " <= " + dialect.toTimestamp(endDate);
    }
    if (w.type() == WindowType.LOOKBACK) {
      clause += "\n  AND " + dialect.addHours(metricCol, Math.abs(windowHours)) + " >= " + dialect.toTimestamp(endDate);
    }
    return clause;
  }

  /** {@code col} when its row falls inside the metric window, otherwise {@code NULL}. */
  public String caseWhenTimeFilter(String col, MetricSpec metric, boolean overrideConversionWindows, Instant endDate,
                                   String metricTimestampCol, String exposureTimestampCol) {
    String condition = conversionWindowClause(exposureTimestampCol, metricTimestampCol, metric, endDate,
        overrideConversionWindows);
    if (metric.quantileType() == QuantileType.EVENT && metric.quantileSettings().ignoreZeros()) {
      condition += " AND " + col + " != 0";
    }
    return dialect.ifElse(condition, col, "NULL");
  }

  // capping

  public String capCoalesce(String valueCol, MetricSpec metric) {
    return capCoalesce(valueCol, metric, "c", "value_cap");
  }

  public String capCoalesce(String valueCol, MetricSpec metric, String capTablePrefix, String capValueCol) {
    CappingSettings cap = metric.cappingSettings();
    if (metric.isCappable() && cap.isAbsolute()) {
      return "LEAST(" + dialect.ensureFloat("COALESCE(" + valueCol + ", 0)") + ", " + number(cap.value()) + ")";
    }
    if (metric.isCappable() && cap.isPercentile()) {
      return "LEAST(" + dialect.ensureFloat("COALESCE(" + valueCol + ", 0)") + ", " + capTablePrefix + "." + capValueCol + ")";
    }
    return "COALESCE(" + valueCol + ", 0)";
  }

  // legacy metrics

  /** Columns of a metric read through alias {@code m}; {@code factTable} is only read for fact metrics. */
  public MetricColumns metricColumns(MetricSpec metric, FactTableSpec factTable, boolean useDenominator) {
    Map<String, String> ids = new LinkedHashMap<>();
    if (metric.isFact()) {
      ColumnRef ref = useDenominator ? metric.denominator() : metric.numerator();
      if (factTable != null) {
        for (String t : factTable.userIdTypes()) ids.put(t, "m." + t);
      }
      return new MetricColumns(ids, "m.timestamp", factColumnValue(metric, ref, "m"));
    }
    MetricSource src = metric.source();
    if (src.isSql()) {
      for (String t : metric.userIdTypes()) ids.put(t, "m." + t);
      return new MetricColumns(ids, "m.timestamp", metric.type() == MetricType.BINOMIAL ? "1" : "m.value");
    }
    boolean hasColumn = src.column() != null && !src.column().isBlank();
    String value = metric.type() != MetricType.BINOMIAL && hasColumn ? "m." + src.column() : "1";
    for (String t : metric.userIdTypes()) ids.put(t, "m." + src.userIdColumn(t));
    String ts = src.timestampColumn() == null || src.timestampColumn().isBlank() ? "received_at" : src.timestampColumn();
    return new MetricColumns(ids, "m." + ts, value);
  }

  public String legacyAggregation(MetricSpec metric) {
    if (metric.type() == MetricType.BINOMIAL) {
      return "MAX(COALESCE(value, 0))";
    }
    if (metric.isFact()) {
      return factAggregation(metric, false).apply("value");
    }
    String agg = metric.aggregation();
    if (metric.source() != null && metric.source().isSql()) {
      if (isNonZeroNumber(agg)) {
        return dialect.ifElse("value IS NOT NULL", agg.trim(), "0");
      }
      if (agg != null && !agg.isBlank()) {
        return COUNT_STAR.matcher(agg).replaceAll("COUNT(value)");
      }
      return "SUM(COALESCE(value, 0))";
    }
    boolean hasColumn = metric.source() != null && metric.source().column() != null && !metric.source().column().isBlank();
    if (metric.type() == MetricType.COUNT && hasColumn) return "COUNT(DISTINCT (value))";
    if (metric.type() == MetricType.COUNT) return "COUNT(value)";
    return "MAX(COALESCE(value, 0))";
  }

  // fact metrics

  public String factColumnValue(MetricSpec metric, ColumnRef ref, String alias) {
    if (ref == null || metric.type().binomial()) return "1";
    String column = ref.column();
    if (column == null || ColumnRef.COUNT.equals(column) || ColumnRef.DISTINCT_USERS.equals(column)) return "1";
    if (ColumnRef.DISTINCT_DATES.equals(column)) return dialect.dateTrunc(alias + ".timestamp");
    return alias + "." + column;
  }

  /** Filter conditions of {@code ref} resolved against the fact table; unknown filter ids are skipped. */
  public static List<String> factFilters(FactTableSpec table, ColumnRef ref) {
    if (ref == null) return List.of();
    List<String> out = new ArrayList<>();
    for (String id : ref.filters()) {
      String condition = table.filters().get(id);
      if (condition != null && !condition.isBlank()) out.add(condition);
    }
    return out;
  }

  public Aggregation factAggregation(MetricSpec metric, boolean useDenominator) {
    ColumnRef ref = useDenominator ? metric.denominator() : metric.numerator();
    String column = ref == null ? null : ref.column();
    boolean nullIfZero = metric.quantileType() == QuantileType.UNIT && metric.quantileSettings().ignoreZeros();

    if (metric.type().binomial() || ColumnRef.DISTINCT_USERS.equals(column)) {
      return (c, q) -> "COALESCE(MAX(" + c + "), 0)";
    }
    if (ColumnRef.COUNT.equals(column)) {
      return nullIfZero ? (c, q) -> "NULLIF(COUNT(" + c + "), 0)" : (c, q) -> "COUNT(" + c + ")";
    }
    if (ColumnRef.DISTINCT_DATES.equals(column)) {
      return nullIfZero
          ? (c, q) -> "NULLIF(COUNT(DISTINCT " + c + "), 0)"
          : (c, q) -> "COUNT(DISTINCT " + c + ")";
    }
    if (ref != null && !ref.isSpecial() && ColumnRef.COUNT_DISTINCT.equalsIgnoreCase(ref.aggregation())) {
      return nullIfZero
          ? (c, q) -> "NULLIF(" + dialect.hllCardinality(dialect.hllAggregate(c)) + ", 0)"
          : (c, q) -> dialect.hllCardinality(dialect.hllAggregate(c));
    }
    if (ref != null && !ref.isSpecial() && ColumnRef.MAX.equalsIgnoreCase(ref.aggregation())) {
      return (c, q) -> "COALESCE(MAX(" + c + "), 0)";
    }
    if (metric.quantileType() == QuantileType.EVENT) {
      return (c, q) -> "SUM(" + dialect.ifElse(c + " <= " + q, "1", "0") + ")";
    }
    return nullIfZero
        ? (c, q) -> "NULLIF(SUM(COALESCE(" + c + ", 0)), 0)"
        : (c, q) -> "SUM(COALESCE(" + c + ", 0))";
  }

  static String number(double v) {
    if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
    return Double.toString(v);
  }

  private static boolean isNonZeroNumber(String s) {
    if (s == null || s.isBlank()) return false;
    try {
      double d = Double.parseDouble(s.trim());
      return d != 0 && !Double.isNaN(d);
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
