package io.intellixity.nativa.experiments.dialect.bigquery;

import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BigQueryDialectTest {
  private final BigQueryDialect d = new BigQueryDialect(
      ConnectionParams.of(Map.of("projectId", "acme-prod", "defaultDataset", "analytics")));

  @Test
  void timestampsUseAnsiLiterals() {
    Instant t = Instant.parse("2023-01-15T12:30:45.123Z");
    assertEquals("'2023-01-15 12:30:45'", d.toTimestamp(t));
    assertEquals("'2023-01-15 12:30:45.123'", d.toTimestampWithMs(t));
  }

  @Test
  void dateArithmetic() {
    assertEquals("DATETIME_ADD(col, INTERVAL 5 HOUR)", d.addTime("col", IntervalUnit.HOUR, '+', 5));
    assertEquals("DATETIME_SUB(col, INTERVAL 30 MINUTE)", d.addTime("col", IntervalUnit.MINUTE, '-', 30));
    assertEquals("DATETIME_SUB(col, INTERVAL 90 MINUTE)", d.addHours("col", -1.5));
    assertEquals("DATETIME_ADD(col, INTERVAL 72 HOUR)", d.addHours("col", 72));
    assertEquals("date_trunc(timestamp, DAY)", d.dateTrunc("timestamp"));
    assertEquals("date_diff(end, start, DAY)", d.dateDiff("start", "end"));
    assertEquals("format_date(\"%F\", date_col)", d.formatDate("date_col"));
    assertEquals("format_datetime(\"%F %T\", datetime_col)", d.formatDateTimeString("datetime_col"));
  }

  @Test
  void castsAndLiterals() {
    assertEquals("cast(col as string)", d.castToString("col"));
    assertEquals("CAST(user_date as DATETIME)", d.castUserDateCol("user_date"));
    assertEquals("CAST(col AS DATE)", d.castToDate("col"));
    assertEquals("CAST(col AS TIMESTAMP)", d.castToTimestamp("col"));
    assertEquals("it\\'s", d.escapeStringLiteral("it's"));
    assertEquals("path\\\\to", d.escapeStringLiteral("path\\to"));
    assertEquals("(CASE WHEN x > 0 THEN 1 ELSE 0 END)", d.ifElse("x > 0", "1", "0"));
    assertEquals("active IS TRUE", d.evalBoolean("active", true));
    assertEquals("SELECT * FROM users LIMIT 10", d.selectStarLimit("users", 10));
  }

  @Test
  void jsonFields() {
    assertEquals("JSON_VALUE(json_col, '$.user.name')", d.extractJsonField("json_col", "user.name", false));
    assertEquals("CAST(JSON_VALUE(json_col, '$.user.age') AS FLOAT64)", d.extractJsonField("json_col", "user.age", true));
  }

  @Test
  void dataTypes() {
    assertEquals("STRING", d.dataType(DataType.STRING));
    assertEquals("INT64", d.dataType(DataType.INTEGER));
    assertEquals("FLOAT64", d.dataType(DataType.FLOAT));
    assertEquals("BOOL", d.dataType(DataType.BOOLEAN));
    assertEquals("BYTES", d.dataType(DataType.HLL));
  }

  @Test
  void hyperLogLog() {
    assertTrue(d.hasCountDistinctHLL());
    assertEquals("HLL_COUNT.INIT(user_id)", d.hllAggregate("user_id"));
    assertEquals("HLL_COUNT.MERGE_PARTIAL(hll_col)", d.hllReaggregate("hll_col"));
    assertEquals("HLL_COUNT.EXTRACT(hll_col)", d.hllCardinality("hll_col"));
  }

  @Test
  void quantilesIndexTenThousandBuckets() {
    assertEquals("APPROX_QUANTILES(value, 10000 IGNORE NULLS)[OFFSET(CAST(5000 AS INT64))]", d.approxQuantile("value", 0.5));
    assertEquals("APPROX_QUANTILES(value, 10000 IGNORE NULLS)[OFFSET(CAST(2500 AS INT64))]", d.approxQuantile("value", 0.25));
  }

  @Test
  void tablePathsAreBacktickQuoted() {
    assertEquals("`acme-prod.analytics.events`", d.generateTablePath("events", null, null));
    assertEquals("`other.raw.events`", d.generateTablePath("events", "raw", "other"));
    assertThrows(MissingConfigurationException.class,
        () -> new BigQueryDialect(ConnectionParams.EMPTY).generateTablePath("events", "raw", null));
  }

  @Test
  void credentialsAreSensitive() {
    assertTrue(d.sensitiveParamKeys().contains("privateKey"));
    assertEquals("bigquery", d.formatDialect());
  }
}
