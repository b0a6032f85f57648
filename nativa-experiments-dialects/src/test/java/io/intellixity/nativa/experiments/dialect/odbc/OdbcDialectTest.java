package io.intellixity.nativa.experiments.dialect.odbc;

import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class OdbcDialectTest {
  private static OdbcDialect impala() {
    return new OdbcDialect(ConnectionParams.of(Map.of("driver", "Impala", "schema", "default")));
  }

  @Test
  void unknownDriverFailsAtConstruction() {
    UnsupportedCapabilityException e = assertThrows(UnsupportedCapabilityException.class,
        () -> new OdbcDialect(ConnectionParams.of(Map.of("driver", "hive"))));
    assertEquals("ODBC driver 'hive' is not supported by dialect: odbc", e.getMessage());
  }

  @Test
  void missingDriverFailsAtConstruction() {
    assertThrows(UnsupportedCapabilityException.class, () -> new OdbcDialect(ConnectionParams.EMPTY));
  }

  @Test
  void impalaSyntax() {
    OdbcDialect d = impala();
    assertEquals(OdbcDialect.Driver.IMPALA, d.driver());
    assertEquals("ts + INTERVAL 2 hours", d.addTime("ts", IntervalUnit.HOUR, '+', 2));
    assertEquals("ts - INTERVAL 30 minutes", d.addHours("ts", -0.5));
    assertEquals("trunc(ts, 'DD')", d.dateTrunc("ts"));
    assertEquals("datediff(e, s)", d.dateDiff("s", "e"));
    assertEquals("cast(x as double)", d.ensureFloat("x"));
    assertEquals("default.orders", d.generateTablePath("orders", null, null));
  }

  @Test
  void impalaOnlyHasMedian() {
    OdbcDialect d = impala();
    assertEquals("APPX_MEDIAN(v)", d.approxQuantile("v", 0.5));
    UnsupportedCapabilityException e = assertThrows(UnsupportedCapabilityException.class,
        () -> d.approxQuantile("v", 0.9));
    assertTrue(e.getMessage().contains("0.9"));
    assertFalse(d.hasQuantileTesting());
  }

  @Test
  void hllUnsupported() {
    assertThrows(UnsupportedCapabilityException.class, () -> impala().hllAggregate("x"));
  }
}
