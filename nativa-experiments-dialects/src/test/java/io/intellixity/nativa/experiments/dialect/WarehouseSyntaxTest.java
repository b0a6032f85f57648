package io.intellixity.nativa.experiments.dialect;

import io.intellixity.nativa.experiments.dialect.athena.AthenaDialect;
import io.intellixity.nativa.experiments.dialect.clickhouse.ClickHouseDialect;
import io.intellixity.nativa.experiments.dialect.databricks.DatabricksDialect;
import io.intellixity.nativa.experiments.dialect.mssql.MsSqlDialect;
import io.intellixity.nativa.experiments.dialect.postgres.PostgresDialect;
import io.intellixity.nativa.experiments.dialect.presto.PrestoDialect;
import io.intellixity.nativa.experiments.dialect.redshift.RedshiftDialect;
import io.intellixity.nativa.experiments.dialect.snowflake.SnowflakeDialect;
import io.intellixity.nativa.experiments.dialect.vertica.VerticaDialect;
import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.PercentileCapSpec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class WarehouseSyntaxTest {
  private static final Instant T = Instant.parse("2024-03-01T08:00:00Z");

  @Test
  void postgres() {
    PostgresDialect d = new PostgresDialect(ConnectionParams.EMPTY);
    assertEquals("public.orders", d.generateTablePath("orders", null, null));
    assertEquals("e::DATE - s::DATE", d.dateDiff("s", "e"));
    assertEquals("JSON_EXTRACT_PATH_TEXT(j::json, 'a', 'b')::float", d.extractJsonField("j", "a.b", true));
    assertEquals("PERCENTILE_DISC(0.5) WITHIN GROUP (ORDER BY v)", d.approxQuantile("v", 0.5));
    assertEquals("ts + INTERVAL '2 hours'", d.addHours("ts", 2));
    assertEquals("postgresql", d.formatDialect());
  }

  @Test
  void redshiftAndSnowflakeHaveHll() {
    RedshiftDialect r = new RedshiftDialect(ConnectionParams.EMPTY);
    assertEquals("HLL_CARDINALITY(HLL_COMBINE(x))", r.hllCardinality(r.hllReaggregate("x")));
    assertEquals("APPROXIMATE PERCENTILE_DISC(0.9) WITHIN GROUP (ORDER BY v)", r.approxQuantile("v", 0.9));

    SnowflakeDialect s = new SnowflakeDialect(ConnectionParams.of(Map.of("database", "DB")));
    assertEquals("HLL_ACCUMULATE(user_id)", s.hllAggregate("user_id"));
    assertEquals("DATEADD(hour, -3, ts)", s.addHours("ts", -3));
    assertEquals("DB.PUBLIC.orders", s.generateTablePath("orders", null, null));
    assertEquals("j:a.b::string", s.extractJsonField("j", "a.b", false));
  }

  @Test
  void clickHouse() {
    ClickHouseDialect d = new ClickHouseDialect(ConnectionParams.of(Map.of("database", "analytics")));
    assertEquals("toDateTime('2024-03-01 08:00:00', 'UTC')", d.toTimestamp(T));
    assertEquals("dateAdd(minute, 90, ts)", d.addHours("ts", 1.5));
    assertEquals("if(a, b, c)", d.ifElse("a", "b", "c"));
    assertEquals("quantile(0.5)(v)", d.approxQuantile("v", 0.5));
    assertEquals("analytics.orders", d.generateTablePath("orders", null, null));
    assertEquals("JSONExtractFloat(j, 'a', 'b')", d.extractJsonField("j", "a.b", true));
  }

  @Test
  void prestoFamily() {
    PrestoDialect p = new PrestoDialect(ConnectionParams.of(Map.of("catalog", "hive", "schema", "web")));
    assertEquals("from_iso8601_timestamp('2024-03-01T08:00:00Z')", p.toTimestamp(T));
    assertEquals("ts - INTERVAL '4' hour", p.addHours("ts", -4));
    assertEquals("hive.web.orders", p.generateTablePath("orders", null, null));
    assertEquals("CARDINALITY(MERGE(APPROX_SET(x)))", p.hllCardinality(p.hllReaggregate(p.hllAggregate("x"))));

    AthenaDialect a = new AthenaDialect(ConnectionParams.of(Map.of("database", "web")));
    assertEquals("AwsDataCatalog.web.orders", a.generateTablePath("orders", null, null));
    assertEquals("date_diff('day', s, e)", a.dateDiff("s", "e"));
  }

  @Test
  void databricksAndSqlServer() {
    DatabricksDialect db = new DatabricksDialect(ConnectionParams.of(Map.of("catalog", "main", "schema", "web")));
    assertEquals("main.web.orders", db.generateTablePath("orders", null, null));
    assertEquals("timestampadd(HOUR, -2, ts)", db.addHours("ts", -2));
    assertEquals("sparksql", db.formatDialect());

    MsSqlDialect ms = new MsSqlDialect(ConnectionParams.of(Map.of("database", "shop")));
    assertEquals("shop.dbo.orders", ms.generateTablePath("orders", null, null));
    assertEquals("SELECT TOP 5 * FROM t", ms.selectStarLimit("t", 5));
    assertEquals("DATEADD(hour, 6, ts)", ms.addHours("ts", 6));
    assertEquals("flag = 1", ms.evalBoolean("flag", true));
  }

  @Test
  void verticaCapsWithApproximatePercentile() {
    VerticaDialect v = new VerticaDialect(ConnectionParams.EMPTY);
    String sql = v.percentileCapSelectClause(List.of(new PercentileCapSpec("value", "value_cap", 0.99, false, 0)),
        "__userMetric", "");
    assertEquals("SELECT\n  APPROXIMATE_PERCENTILE(value USING PARAMETERS percentiles='0.99') AS value_cap\n"
        + "FROM __userMetric", sql);
    assertFalse(v.hasCountDistinctHLL());
    UnsupportedCapabilityException e = assertThrows(UnsupportedCapabilityException.class, () -> v.hllAggregate("x"));
    assertEquals("COUNT DISTINCT (HyperLogLog) is not supported by dialect: vertica", e.getMessage());
  }
}
