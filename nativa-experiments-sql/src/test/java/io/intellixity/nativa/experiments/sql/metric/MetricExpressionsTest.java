package io.intellixity.nativa.experiments.sql.metric;

import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.model.CappingSettings;
import io.intellixity.nativa.experiments.model.ColumnRef;
import io.intellixity.nativa.experiments.model.MetricSource;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.MetricType;
import io.intellixity.nativa.experiments.model.QuantileSettings;
import io.intellixity.nativa.experiments.model.WindowSettings;
import io.intellixity.nativa.experiments.sql.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.nativa.experiments.sql.Fixtures.END;
import static org.junit.jupiter.api.Assertions.*;

final class MetricExpressionsTest {
  private final MetricExpressions expr = new MetricExpressions(new Fixtures.AnsiDialect());

  private static MetricSpec sqlMetric(MetricType type, WindowSettings window) {
    return MetricSpec.builder("revenue", type).sql("SELECT * FROM purchases").windowSettings(window).build();
  }

  @Test
  void conversionWindowBoundsMetricAfterExposure() {
    String clause = expr.conversionWindowClause("d.timestamp", "m.timestamp",
        sqlMetric(MetricType.REVENUE, WindowSettings.conversion(72, 0)), END, false);
    assertEquals("m.timestamp >= d.timestamp\n  AND m.timestamp <= d.timestamp + INTERVAL '72 hours'", clause);
  }

  @Test
  void conversionWindowHonoursDelay() {
    String clause = expr.conversionWindowClause("d.timestamp", "m.timestamp",
        sqlMetric(MetricType.REVENUE, WindowSettings.conversion(24, 2)), END, false);
    assertEquals("m.timestamp >= d.timestamp + INTERVAL '2 hours'\n"
        + "  AND m.timestamp <= d.timestamp + INTERVAL '26 hours'", clause);
  }

  @Test
  void overriddenWindowRunsToAnalysisEnd() {
    String clause = expr.conversionWindowClause("d.timestamp", "m.timestamp",
        sqlMetric(MetricType.REVENUE, WindowSettings.conversion(72, 0)), END, true);
    assertEquals("m.timestamp >= d.timestamp\n  AND m.timestamp <= '2024-01-31 00:00:00'", clause);
  }

  @Test
  void lookbackWindowOnlyCountsRecentRows() {
    String clause = expr.conversionWindowClause("d.timestamp", "m.timestamp",
        sqlMetric(MetricType.COUNT, WindowSettings.lookback(48)), END, false);
    assertTrue(clause.endsWith("\n  AND m.timestamp + INTERVAL '48 hours' >= '2024-01-31 00:00:00'"));
  }

  @Test
  void fractionalHoursRenderAsMinutes() {
    assertEquals("t + INTERVAL '90 minutes'", expr.dialect().addHours("t", 1.5));
    assertEquals("t - INTERVAL '3 hours'", expr.dialect().addHours("t", -3));
    assertEquals("t", expr.dialect().addHours("t", 0));
  }

  @Test
  void capCoalesceFollowsCappingSettings() {
    MetricSpec absolute = MetricSpec.builder("r", MetricType.REVENUE).sql("x").cappingSettings(CappingSettings.absolute(10)).build();
    MetricSpec percentile = MetricSpec.builder("r", MetricType.REVENUE).sql("x").cappingSettings(CappingSettings.percentile(0.95, false)).build();
    MetricSpec binomial = MetricSpec.builder("b", MetricType.BINOMIAL).sql("x").cappingSettings(CappingSettings.absolute(10)).build();

    assertEquals("LEAST(COALESCE(m.value, 0), 10)", expr.capCoalesce("m.value", absolute));
    assertEquals("LEAST(COALESCE(m.value, 0), cap.value_cap)", expr.capCoalesce("m.value", percentile, "cap", "value_cap"));
    assertEquals("COALESCE(m.value, 0)", expr.capCoalesce("m.value", binomial));
  }

  @Test
  void eventQuantileIgnoringZerosFiltersZeroRows() {
    MetricSpec q = MetricSpec.builder("q", MetricType.FACT_QUANTILE)
        .numerator(ColumnRef.of("orders", "amount"))
        .quantileSettings(QuantileSettings.event(0.9, true))
        .build();
    String filtered = expr.caseWhenTimeFilter("m.m0_value", q, false, END, "m.timestamp", "d.timestamp");
    assertTrue(filtered.startsWith("(CASE WHEN m.timestamp >= d.timestamp"));
    assertTrue(filtered.contains(" AND m.m0_value != 0 THEN m.m0_value ELSE NULL END)"));
  }

  @Test
  void legacyAggregations() {
    assertEquals("MAX(COALESCE(value, 0))", expr.legacyAggregation(sqlMetric(MetricType.BINOMIAL, null)));
    assertEquals("SUM(COALESCE(value, 0))", expr.legacyAggregation(sqlMetric(MetricType.REVENUE, null)));

    MetricSpec custom = MetricSpec.builder("c", MetricType.COUNT).sql("x").aggregation("count(*) + 1").build();
    assertEquals("COUNT(value) + 1", expr.legacyAggregation(custom));

    MetricSpec constant = MetricSpec.builder("c", MetricType.COUNT).sql("x").aggregation("5").build();
    assertEquals("(CASE WHEN value IS NOT NULL THEN 5 ELSE 0 END)", expr.legacyAggregation(constant));

    MetricSpec table = MetricSpec.builder("t", MetricType.COUNT)
        .source(MetricSource.ofTable("events", "session_id", null, Map.of())).build();
    assertEquals("COUNT(DISTINCT (value))", expr.legacyAggregation(table));
  }

  @Test
  void tableMetricColumnsUseConfiguredNames() {
    MetricSpec table = MetricSpec.builder("t", MetricType.DURATION)
        .userIdTypes(List.of("user_id"))
        .source(MetricSource.ofTable("sessions", "length", null, Map.of("user_id", "uid")))
        .build();
    MetricColumns cols = expr.metricColumns(table, null, false);
    assertEquals(Map.of("user_id", "m.uid"), cols.userIds());
    assertEquals("m.received_at", cols.timestamp());
    assertEquals("m.length", cols.value());
  }

  @Test
  void factAggregationBySpecialColumn() {
    MetricSpec count = MetricSpec.builder("n", MetricType.FACT_MEAN).numerator(ColumnRef.of("orders", ColumnRef.COUNT)).build();
    MetricSpec users = MetricSpec.builder("u", MetricType.FACT_MEAN).numerator(ColumnRef.of("orders", ColumnRef.DISTINCT_USERS)).build();
    MetricSpec dates = MetricSpec.builder("d", MetricType.FACT_MEAN).numerator(ColumnRef.of("orders", ColumnRef.DISTINCT_DATES)).build();
    MetricSpec sum = MetricSpec.builder("s", MetricType.FACT_MEAN).numerator(ColumnRef.of("orders", "amount")).build();

    assertEquals("COUNT(x)", expr.factAggregation(count, false).apply("x"));
    assertEquals("COALESCE(MAX(x), 0)", expr.factAggregation(users, false).apply("x"));
    assertEquals("COUNT(DISTINCT x)", expr.factAggregation(dates, false).apply("x"));
    assertEquals("SUM(COALESCE(x, 0))", expr.factAggregation(sum, false).apply("x"));
    assertEquals("date_trunc('day', m.timestamp)", expr.factColumnValue(dates, dates.numerator(), "m"));
  }

  @Test
  void countDistinctNeedsHyperLogLog() {
    MetricSpec distinct = MetricSpec.builder("d", MetricType.FACT_MEAN)
        .numerator(ColumnRef.of("orders", "session_id").withAggregation(ColumnRef.COUNT_DISTINCT))
        .build();
    MetricExpressions.Aggregation agg = expr.factAggregation(distinct, false);
    assertThrows(UnsupportedCapabilityException.class, () -> agg.apply("x"));
  }

  @Test
  void unknownFilterIdsAreSkipped() {
    ColumnRef ref = ColumnRef.of("orders", "amount").withFilters(List.of("mobile", "nope"));
    assertEquals(List.of("device = 'mobile'"), MetricExpressions.factFilters(Fixtures.orders(), ref));
  }
}
