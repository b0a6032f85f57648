package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.error.InvalidMetricException;
import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.CappingSettings;
import io.intellixity.nativa.experiments.model.ColumnRef;
import io.intellixity.nativa.experiments.model.DateDimension;
import io.intellixity.nativa.experiments.model.ExperimentDimension;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.MetricType;
import io.intellixity.nativa.experiments.model.QuantileSettings;
import io.intellixity.nativa.experiments.model.SegmentSpec;
import io.intellixity.nativa.experiments.model.WindowSettings;
import io.intellixity.nativa.experiments.sql.Fixtures;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.nativa.experiments.sql.Fixtures.END;
import static io.intellixity.nativa.experiments.sql.Fixtures.START;
import static org.junit.jupiter.api.Assertions.*;

final class ExperimentQueryCompilerTest {
  private final ExperimentQueryCompiler compiler = new ExperimentQueryCompiler(new Fixtures.AnsiDialect(),
      Fixtures.datasource(), new SqlTemplateCompiler(Fixtures.CLOCK), Fixtures.CLOCK, CompilerOptions.DEFAULTS);

  private static MetricSpec purchased() {
    return MetricSpec.builder("purchased", MetricType.BINOMIAL).name("Purchased")
        .userIdTypes("user_id")
        .sql("SELECT user_id, timestamp FROM purchases")
        .windowSettings(WindowSettings.conversion(72, 0))
        .build();
  }

  private static MetricSpec revenue() {
    return MetricSpec.builder("revenue", MetricType.REVENUE).name("Revenue")
        .userIdTypes("user_id")
        .sql("SELECT user_id, timestamp, amount AS value FROM purchases")
        .build();
  }

  private static MetricSpec orderTotal(String id) {
    return MetricSpec.builder(id, MetricType.FACT_MEAN).name(id)
        .numerator(ColumnRef.of("orders", "amount"))
        .build();
  }

  private static Map<String, FactTableSpec> factTables() {
    return Map.of("orders", Fixtures.orders(), "sessions", Fixtures.sessions());
  }

  private static ExperimentUnitsRequest units(AnalysisSettings settings) {
    return ExperimentUnitsRequest.of(settings).withFactTables(factTables());
  }

  private static void assertInOrder(String sql, String... parts) {
    int last = -1;
    for (String p : parts) {
      int at = sql.indexOf(p);
      assertTrue(at > last, () -> "expected '" + p + "' after position " + sql.indexOf(p) + " in:\n" + sql);
      last = at;
    }
  }

  // units

  @Test
  void unitsQuerySelectsExperimentUnits() {
    String sql = compiler.experimentUnitsQuery(units(Fixtures.settings().build()));
    assertTrue(sql.startsWith("-- Experiment units (exp-checkout)\nWITH\n__rawExperiment AS (\n" + Fixtures.EXPOSURE_SQL));
    assertTrue(sql.contains("  e.experiment_id = 'exp-checkout'\n"));
    assertTrue(sql.contains("  AND e.timestamp >= '2024-01-01 00:00:00'\n"));
    assertTrue(sql.contains("GROUP BY\n  e.user_id, e.variation"));
    assertTrue(sql.endsWith("SELECT * FROM __experimentUnits"));
  }

  @Test
  void multipleExposuresCollapseIntoMarkerVariation() {
    String sql = compiler.experimentUnitsQuery(units(Fixtures.settings().removeMultipleExposures(true).build()));
    assertTrue(sql.contains("(CASE WHEN count(distinct e.variation) > 1 THEN '__multiple__' ELSE max(e.variation) END) AS variation"));
    assertFalse(sql.contains("e.user_id, e.variation\n"));
  }

  @Test
  void unknownExposureQueryFails() {
    AnalysisSettings settings = Fixtures.settings().exposureQueryId("missing").build();
    assertThrows(MissingConfigurationException.class, () -> compiler.experimentUnitsQuery(units(settings)));
  }

  @Test
  void segmentAndDimensionsJoinUnits() {
    ExperimentUnitsRequest req = units(Fixtures.settings().build())
        .withSegment(SegmentSpec.sql("vip", "user_id", "SELECT user_id, date FROM vip"))
        .withDimensions(List.of(ExperimentDimension.of("browser")));
    String sql = compiler.experimentUnitsQuery(req);
    assertInOrder(sql, "__experiment AS (", "__segment AS (", "__experimentUnits AS (");
    assertTrue(sql.contains("  JOIN __segment s ON (s.user_id = e.user_id)\n"));
    assertTrue(sql.contains("WHERE s.date <= e.timestamp\n"));
    assertTrue(sql.contains(" AS dim_exp_browser\n"));
  }

  // legacy metrics

  @Test
  void binomialMetricQueryStructure() {
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()),
        purchased(), List.of()));
    assertTrue(sql.startsWith("-- Purchased (binomial)\nWITH\n"));
    assertInOrder(sql, "__experimentUnits AS (", "__distinctUsers AS (", "__metric AS (", "__userMetricJoin AS (",
        "__userMetric AS (", "__stats AS (", "__overallUsers AS (", "u.users AS exposed_users");
    assertTrue(sql.contains("MAX(COALESCE(value, 0)) as value"));
    assertTrue(sql.contains("m.timestamp <= d.timestamp + INTERVAL '72 hours'"));
    assertFalse(sql.contains("__identities_"));
  }

  @Test
  void metricOnOtherIdTypeJoinsIdentities() {
    MetricSpec anon = revenue().toBuilder().userIdTypes("anonymous_id")
        .sql("SELECT anonymous_id, timestamp, amount AS value FROM purchases").build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()), anon, List.of()));
    assertInOrder(sql, "__identities_anonymous_id as (", "__rawExperiment AS (");
    assertTrue(sql.contains("JOIN __identities_anonymous_id i ON (i.anonymous_id = m.anonymous_id)"));
  }

  @Test
  void ratioMetricAddsDenominatorAggregates() {
    MetricSpec orders = MetricSpec.builder("orders", MetricType.COUNT).userIdTypes("user_id")
        .sql("SELECT user_id, timestamp, 1 AS value FROM orders").build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()),
        revenue(), List.of(orders)));
    assertInOrder(sql, "__denominator0 AS (", "__userDenominatorAgg AS (", "__stats AS (");
    assertTrue(sql.contains("AS denominator_sum_squares"));
    assertTrue(sql.contains("AS main_denominator_sum_product"));
    assertTrue(sql.contains("LEFT JOIN __userDenominatorAgg d ON (d.user_id = m.user_id)"));
  }

  @Test
  void funnelMetricReadsFunnelUsers() {
    MetricSpec viewedCart = purchased().toBuilder().sql("SELECT user_id, timestamp FROM carts").name("Viewed cart").build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()),
        purchased(), List.of(viewedCart)));
    assertTrue(sql.contains("__denominatorUsers AS ("));
    assertTrue(sql.contains("FROM\n  __denominatorUsers d\n"));
    assertFalse(sql.contains("__userDenominatorAgg"));
  }

  @Test
  void regressionAdjustmentAddsCovariate() {
    MetricSpec adjusted = revenue().toBuilder().regressionAdjustment(true, 14).build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(
        units(Fixtures.settings().regressionAdjustmentEnabled(true).build()), adjusted, List.of()));
    assertTrue(sql.contains("first_exposure_timestamp - INTERVAL '336 hours' AS preexposure_start"));
    assertTrue(sql.contains("__userCovariateMetric AS ("));
    assertTrue(sql.contains("AS main_covariate_sum_product"));
    assertTrue(sql.contains("m.timestamp >= '2023-12-18 00:00:00'"));
  }

  @Test
  void regressionAdjustmentNeedsAnalysisSetting() {
    MetricSpec adjusted = revenue().toBuilder().regressionAdjustment(true, 14).build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()),
        adjusted, List.of()));
    assertFalse(sql.contains("__userCovariateMetric"));
  }

  @Test
  void percentileCappedMetricAddsCapValue() {
    MetricSpec capped = revenue().toBuilder().cappingSettings(CappingSettings.percentile(0.99, false)).build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()),
        capped, List.of()));
    assertTrue(sql.contains("__capValue AS (\nSELECT\n  APPROX_PERCENTILE(value, 0.99) AS value_cap\nFROM __userMetric\nWHERE value IS NOT NULL"));
    assertTrue(sql.contains("CROSS JOIN __capValue cap"));
    assertTrue(sql.contains("LEAST(COALESCE(m.value, 0), cap.value_cap)"));
  }

  @Test
  void activationAndSkipPartialDataRestrictUnits() {
    MetricSpec activation = purchased().toBuilder().name("Activated").build();
    ExperimentUnitsRequest req = units(Fixtures.settings().skipPartialData(true).build()).withActivationMetric(activation);
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(req, revenue(), List.of()));
    assertTrue(sql.contains("__activationMetric AS ("));
    assertTrue(sql.contains("WHERE first_activation_timestamp IS NOT NULL AND first_activation_timestamp <= "));
  }

  @Test
  void dimensionsFlowIntoStats() {
    ExperimentUnitsRequest req = units(Fixtures.settings().build())
        .withDimensions(List.of(ExperimentDimension.of("browser"), new DateDimension()));
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(req, revenue(), List.of()));
    assertTrue(sql.contains("  , dim_exp_browser AS dim_exp_browser\n"));
    assertTrue(sql.contains(" AS dim_pre_date\n"));
    assertTrue(sql.contains("GROUP BY\n  m.variation, m.dim_exp_browser, m.dim_pre_date\n"));
    assertTrue(sql.contains("u.dim_pre_date = s.dim_pre_date"));
  }

  @Test
  void ignoreNullsDropsZeroUnits() {
    MetricSpec m = revenue().toBuilder().ignoreNulls(true).build();
    String sql = compiler.experimentMetricQuery(new ExperimentMetricRequest(units(Fixtures.settings().build()), m, List.of()));
    assertTrue(sql.contains("WHERE m.value != 0\n"));
  }

  // fact metrics

  @Test
  void factMetricsShareOneFactTableScan() {
    MetricSpec filtered = orderTotal("mobile_total").toBuilder()
        .numerator(ColumnRef.of("orders", "amount").withFilters(List.of("mobile"))).build();
    String sql = compiler.experimentFactMetricsQuery(new FactMetricsRequest(units(Fixtures.settings().build()),
        List.of(orderTotal("total"), filtered)));
    assertTrue(sql.startsWith("-- Fact Table: Orders\nWITH\n"));
    assertInOrder(sql, "__distinctUsers AS (", "__factTable AS (", "__userMetricJoin AS (", "__userMetric AS (",
        "__stats AS (", "__overallUsers AS (");
    assertTrue(sql.contains("m.amount as m0_value"));
    assertTrue(sql.contains("CASE WHEN (device = 'mobile') THEN m.amount ELSE NULL END as m1_value"));
    assertTrue(sql.contains("cast('total' as varchar) as m0_id"));
    assertTrue(sql.contains("cast('mobile_total' as varchar) as m1_id"));
    assertFalse(sql.contains("__factTable1"));
  }

  @Test
  void crossTableRatioJoinsSecondTable() {
    MetricSpec perSession = MetricSpec.builder("per_session", MetricType.FACT_RATIO).name("Per session")
        .numerator(ColumnRef.of("orders", "amount"))
        .denominator(ColumnRef.of("sessions", ColumnRef.COUNT))
        .build();
    String sql = compiler.experimentFactMetricsQuery(new FactMetricsRequest(units(Fixtures.settings().build()),
        List.of(perSession)));
    assertTrue(sql.startsWith("-- Cross-Fact Table Metrics: Orders & Sessions\n"));
    assertInOrder(sql, "__factTable AS (", "__userMetric AS (", "__factTable1 AS (", "__userMetric1 AS (", "__stats AS (");
    assertTrue(sql.contains("LEFT JOIN __userMetric1 m1 ON (m1.user_id = m.user_id)"));
    assertTrue(sql.contains("COUNT(umj.m0_denominator) AS m0_denominator"));
    assertTrue(sql.contains("AS m0_denominator_sum"));
  }

  @Test
  void percentileCappedFactMetricComputesCapPerTable() {
    MetricSpec capped = orderTotal("total").toBuilder().cappingSettings(CappingSettings.percentile(0.95, true)).build();
    String sql = compiler.experimentFactMetricsQuery(new FactMetricsRequest(units(Fixtures.settings().build()), List.of(capped)));
    assertTrue(sql.contains("__capValue AS (\nSELECT\n  APPROX_PERCENTILE((CASE WHEN m0_value = 0 THEN NULL ELSE m0_value END), 0.95) AS m0_value_cap"));
    assertTrue(sql.contains("CROSS JOIN __capValue cap"));
    assertTrue(sql.contains("MAX(COALESCE(cap.m0_value_cap, 0)) as m0_main_cap_value"));
  }

  @Test
  void eventQuantileBuildsQuantileCte() {
    MetricSpec p90 = MetricSpec.builder("p90", MetricType.FACT_QUANTILE).name("P90 order")
        .numerator(ColumnRef.of("orders", "amount"))
        .quantileSettings(QuantileSettings.event(0.9, false))
        .build();
    String sql = compiler.experimentFactMetricsQuery(new FactMetricsRequest(units(Fixtures.settings().build()), List.of(p90)));
    assertInOrder(sql, "__userMetricJoin AS (", "__eventQuantileMetric AS (", "__userMetric AS (");
    assertTrue(sql.contains("COUNT(umj.m0_value) AS m0_n_events"));
    assertTrue(sql.contains("LEFT JOIN __eventQuantileMetric qm ON (qm.variation = umj.variation)"));
    assertTrue(sql.contains("LEFT JOIN __eventQuantileMetric qm ON (qm.variation = m.variation)"));
  }

  @Test
  void eventQuantileOnSecondTableJoinsItsOwnQuantileCte() {
    MetricSpec p90 = MetricSpec.builder("p90", MetricType.FACT_QUANTILE).name("P90 session")
        .numerator(ColumnRef.of("sessions", "duration"))
        .quantileSettings(QuantileSettings.event(0.9, false))
        .build();
    String sql = compiler.experimentFactMetricsQuery(new FactMetricsRequest(units(Fixtures.settings().build()),
        List.of(orderTotal("a"), p90)));
    assertInOrder(sql, "__userMetricJoin1 AS (", "__eventQuantileMetric1 AS (", "__userMetric1 AS (", "__stats AS (");
    assertTrue(sql.contains("LEFT JOIN __eventQuantileMetric1 qm ON (qm.variation = umj.variation)"));
    assertTrue(sql.contains("LEFT JOIN __eventQuantileMetric1 qm ON (qm.variation = m.variation)"));
    assertFalse(sql.contains("__eventQuantileMetric qm"));
    assertTrue(sql.contains("SUM(COALESCE(m1.m1_n_events, 0)) AS m1_quantile_n"));
  }

  @Test
  void eventQuantilesFromTwoTablesRejected() {
    MetricSpec orderP90 = MetricSpec.builder("order_p90", MetricType.FACT_QUANTILE)
        .numerator(ColumnRef.of("orders", "amount"))
        .quantileSettings(QuantileSettings.event(0.9, false))
        .build();
    MetricSpec sessionP90 = MetricSpec.builder("session_p90", MetricType.FACT_QUANTILE)
        .numerator(ColumnRef.of("sessions", "duration"))
        .quantileSettings(QuantileSettings.event(0.9, false))
        .build();
    InvalidMetricException e = assertThrows(InvalidMetricException.class, () -> compiler.experimentFactMetricsQuery(
        new FactMetricsRequest(units(Fixtures.settings().build()), List.of(orderP90, sessionP90))));
    assertEquals("Event quantile metrics must all come from the same fact table", e.getMessage());
  }

  @Test
  void regressionAdjustedFactMetricReadsPreExposureWindow() {
    MetricSpec adjusted = orderTotal("total").toBuilder().regressionAdjustment(true, 7).build();
    String sql = compiler.experimentFactMetricsQuery(new FactMetricsRequest(
        units(Fixtures.settings().regressionAdjustmentEnabled(true).build()), List.of(adjusted)));
    assertTrue(sql.contains("first_exposure_timestamp - INTERVAL '168 hours' as min_preexposure_start"));
    assertTrue(sql.contains("first_exposure_timestamp AS m0_preexposure_end"));
    assertTrue(sql.contains("__userCovariateMetric AS ("));
    assertTrue(sql.contains("LEFT JOIN __userCovariateMetric c ON (c.user_id = m.user_id)"));
    assertTrue(sql.contains("AS m0_main_covariate_sum_product"));
  }

  @Test
  void factMetricsRejectInvalidInput() {
    ExperimentUnitsRequest u = units(Fixtures.settings().build());
    assertThrows(InvalidMetricException.class,
        () -> compiler.experimentFactMetricsQuery(new FactMetricsRequest(u, List.of(revenue()))));
    assertThrows(InvalidMetricException.class,
        () -> compiler.experimentFactMetricsQuery(new FactMetricsRequest(u, List.of())));

    MetricSpec unknown = MetricSpec.builder("x", MetricType.FACT_MEAN).numerator(ColumnRef.of("nope", "amount")).build();
    MissingConfigurationException missing = assertThrows(MissingConfigurationException.class,
        () -> compiler.experimentFactMetricsQuery(new FactMetricsRequest(u, List.of(unknown))));
    assertEquals("Unknown fact table: nope", missing.getMessage());
  }

  @Test
  void atMostTwoFactTables() {
    FactTableSpec third = new FactTableSpec("pages", "Pages", "SELECT user_id, timestamp FROM pages", List.of("user_id"), Map.of());
    ExperimentUnitsRequest u = ExperimentUnitsRequest.of(Fixtures.settings().build())
        .withFactTables(Map.of("orders", Fixtures.orders(), "sessions", Fixtures.sessions(), "pages", third));
    List<MetricSpec> metrics = List.of(
        orderTotal("a"),
        MetricSpec.builder("b", MetricType.FACT_MEAN).numerator(ColumnRef.of("sessions", "duration")).build(),
        MetricSpec.builder("c", MetricType.FACT_MEAN).numerator(ColumnRef.of("pages", ColumnRef.COUNT)).build());
    assertThrows(UnsupportedCapabilityException.class,
        () -> compiler.experimentFactMetricsQuery(new FactMetricsRequest(u, metrics)));
  }

  @Test
  void quantileMetricsAllowAtMostOneDimension() {
    MetricSpec p50 = MetricSpec.builder("p50", MetricType.FACT_QUANTILE)
        .numerator(ColumnRef.of("orders", "amount"))
        .quantileSettings(QuantileSettings.unit(0.5))
        .build();
    ExperimentUnitsRequest u = units(Fixtures.settings().build())
        .withDimensions(List.of(ExperimentDimension.of("browser"), new DateDimension()));
    assertThrows(InvalidMetricException.class,
        () -> compiler.experimentFactMetricsQuery(new FactMetricsRequest(u, List.of(p50))));
  }

  // metric value

  @Test
  void metricValueQueryOverall() {
    String sql = compiler.metricValueQuery(new MetricValueRequest("Weekly", revenue(), START, END, null, false));
    assertTrue(sql.startsWith("-- Weekly - Revenue Metric\nWITH\n__metric AS (\n"));
    assertTrue(sql.contains("SUM(COALESCE(value, 0)) as value"));
    assertTrue(sql.endsWith("SELECT\n  o.*\nFROM\n  __overall o"));
  }

  @Test
  void metricValueQueryByDateWithSegment() {
    String sql = compiler.metricValueQuery(new MetricValueRequest("Weekly", revenue(), START, END,
        SegmentSpec.sql("vip", "user_id", "SELECT user_id, date FROM vip"), true));
    assertInOrder(sql, "__segment AS (", "__metric AS (", "__userMetricDates AS (", "__byDateOverall AS (", "__union AS (");
    assertTrue(sql.contains("JOIN __segment s ON (s.user_id = m.user_id)"));
    assertTrue(sql.endsWith("ORDER BY\n  date ASC"));
  }

  @Test
  void unformattedWhenFormattingDisabled() {
    ExperimentQueryCompiler plain = new ExperimentQueryCompiler(new Fixtures.AnsiDialect(), Fixtures.datasource(),
        new SqlTemplateCompiler(Fixtures.CLOCK), Fixtures.CLOCK, new CompilerOptions(false, 0));
    String a = plain.experimentUnitsQuery(units(Fixtures.settings().build()));
    String b = compiler.experimentUnitsQuery(units(Fixtures.settings().build()));
    assertEquals(a, b);
  }
}
