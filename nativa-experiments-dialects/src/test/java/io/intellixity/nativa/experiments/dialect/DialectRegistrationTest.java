package io.intellixity.nativa.experiments.dialect;

import io.intellixity.nativa.experiments.dialect.odbc.OdbcDialect;
import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.CappingSettings;
import io.intellixity.nativa.experiments.model.ColumnRef;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.ExposureQuery;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.MetricType;
import io.intellixity.nativa.experiments.model.QuantileSettings;
import io.intellixity.nativa.experiments.model.UserIdType;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DialectFactories;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.sql.query.CompilerOptions;
import io.intellixity.nativa.experiments.sql.query.ExperimentMetricRequest;
import io.intellixity.nativa.experiments.sql.query.ExperimentQueryCompiler;
import io.intellixity.nativa.experiments.sql.query.ExperimentUnitsRequest;
import io.intellixity.nativa.experiments.sql.query.FactMetricsRequest;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DialectRegistrationTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-15T00:00:00Z"), ZoneOffset.UTC);
  private static final ConnectionParams PARAMS = ConnectionParams.of(Map.of(
      "driver", "impala", "database", "warehouse", "schema", "events", "projectId", "acme", "defaultDataset", "events",
      "catalog", "hive"));

  private static final DatasourceSettings DATASOURCE = new DatasourceSettings(List.of(), null, List.of(
      new ExposureQuery("user_id", "Users", "user_id",
          "SELECT user_id, timestamp, experiment_id, variation_id FROM viewed_experiment", List.of())));

  private static ExperimentUnitsRequest units() {
    AnalysisSettings settings = AnalysisSettings.builder("exp-1",
        Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-31T00:00:00Z"))
        .userIdType(UserIdType.USER).build();
    FactTableSpec orders = new FactTableSpec("orders", "Orders", "SELECT user_id, timestamp, amount FROM orders",
        List.of("user_id"), Map.of());
    return ExperimentUnitsRequest.of(settings).withFactTables(Map.of("orders", orders));
  }

  private static MetricSpec revenue() {
    return MetricSpec.builder("revenue", MetricType.REVENUE).name("Revenue")
        .userIdTypes("user_id")
        .sql("SELECT user_id, timestamp, amount AS value FROM purchases")
        .build();
  }

  private static MetricSpec cappedTotal(String id) {
    return MetricSpec.builder(id, MetricType.FACT_MEAN).name(id)
        .numerator(ColumnRef.of("orders", "amount"))
        .cappingSettings(CappingSettings.percentile(0.95, false))
        .build();
  }

  private static ExperimentQueryCompiler compiler(SqlDialect d) {
    return new ExperimentQueryCompiler(d, DATASOURCE, new SqlTemplateCompiler(CLOCK), CLOCK, CompilerOptions.DEFAULTS);
  }

  @Test
  void everyEngineIsRegistered() {
    DialectFactories factories = DialectFactories.load();
    assertTrue(factories.ids().containsAll(List.of("postgres", "redshift", "snowflake", "bigquery", "clickhouse",
        "databricks", "presto", "athena", "mysql", "mssql", "vertica", "odbc")));
    assertEquals(12, factories.ids().size());
    for (String id : factories.ids()) {
      assertEquals(id, factories.create(id, PARAMS).id());
    }
    assertInstanceOf(OdbcDialect.class, factories.create("ODBC", PARAMS));
  }

  @Test
  void everyEngineCompilesAMetricQuery() {
    DialectFactories factories = DialectFactories.load();
    for (String id : factories.ids()) {
      String sql = compiler(factories.create(id, PARAMS))
          .experimentMetricQuery(new ExperimentMetricRequest(units(), revenue(), List.of()));
      assertTrue(sql.contains("__stats"), id);
      assertTrue(sql.contains("exposed_users"), id);
      assertFalse(sql.isBlank(), id);
    }
  }

  @Test
  void mysqlRejectsTwoPercentileCapsInOneTable() {
    SqlDialect mysql = DialectFactories.load().create("mysql", PARAMS);
    ExperimentQueryCompiler c = compiler(mysql);
    assertDoesNotThrow(() -> c.experimentFactMetricsQuery(new FactMetricsRequest(units(), List.of(cappedTotal("a")))));
    assertThrows(UnsupportedCapabilityException.class, () -> c.experimentFactMetricsQuery(
        new FactMetricsRequest(units(), List.of(cappedTotal("a"), cappedTotal("b")))));
  }

  @Test
  void mysqlFactCapRanksOnlyNonZeroValues() {
    MetricSpec capped = MetricSpec.builder("a", MetricType.FACT_MEAN).name("a")
        .numerator(ColumnRef.of("orders", "amount"))
        .cappingSettings(CappingSettings.percentile(0.5, true))
        .build();
    String sql = compiler(DialectFactories.load().create("mysql", PARAMS))
        .experimentFactMetricsQuery(new FactMetricsRequest(units(), List.of(capped)));
    assertTrue(sql.contains("SELECT (CASE WHEN m0_value = 0 THEN NULL ELSE m0_value END) AS cap_source"), sql);
    assertTrue(sql.contains("WHERE cap_source IS NOT NULL"), sql);
  }

  @Test
  void quantileMetricsNeedQuantileSupport() {
    MetricSpec p90 = MetricSpec.builder("p90", MetricType.FACT_QUANTILE).name("P90")
        .numerator(ColumnRef.of("orders", "amount"))
        .quantileSettings(QuantileSettings.unit(0.9))
        .build();
    DialectFactories factories = DialectFactories.load();
    for (String id : List.of("mysql", "odbc")) {
      ExperimentQueryCompiler c = compiler(factories.create(id, PARAMS));
      UnsupportedCapabilityException e = assertThrows(UnsupportedCapabilityException.class,
          () -> c.experimentFactMetricsQuery(new FactMetricsRequest(units(), List.of(p90))));
      assertTrue(e.getMessage().endsWith("dialect: " + id), e.getMessage());
    }
    String sql = compiler(factories.create("snowflake", PARAMS))
        .experimentFactMetricsQuery(new FactMetricsRequest(units(), List.of(p90)));
    assertTrue(sql.contains("m0_quantile"));
  }
}
