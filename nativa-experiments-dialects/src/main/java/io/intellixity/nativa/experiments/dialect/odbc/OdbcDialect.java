package io.intellixity.nativa.experiments.dialect.odbc;

import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DataType;
import io.intellixity.nativa.experiments.spi.sql.IntervalUnit;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.util.List;
import java.util.Locale;

/**
 * Generic ODBC datasource. Syntax depends on the {@code driver} connection parameter; a driver
 * without a mapping is rejected when the dialect is created, never at render time.
 */
public final class OdbcDialect extends AbstractSqlDialect {
  /** Engines reachable through ODBC with a known SQL flavour. */
  public enum Driver {
    IMPALA;

    static Driver parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw UnsupportedCapabilityException.of("odbc", "ODBC without a driver");
      }
      for (Driver d : values()) {
        if (d.name().equalsIgnoreCase(raw.trim())) return d;
      }
      throw UnsupportedCapabilityException.of("odbc", "ODBC driver '" + raw + "'");
    }
  }

  private final Driver driver;

  public OdbcDialect(ConnectionParams params) {
    super(params);
    this.driver = Driver.parse(this.params.get("driver"));
  }

  public Driver driver() { return driver; }

  @Override public String id() { return "odbc"; }

  @Override public List<String> sensitiveParamKeys() { return List.of("password", "dsn"); }

  @Override protected boolean requiresDatabase() { return false; }

  @Override
  public String addTime(String col, IntervalUnit unit, char sign, long amount) {
    return switch (driver) {
      case IMPALA -> col + " " + sign + " INTERVAL " + amount + " " + unit.sqlName() + "s";
    };
  }

  @Override
  public String dateTrunc(String col) {
    return switch (driver) {
      case IMPALA -> "trunc(" + col + ", 'DD')";
    };
  }

  @Override
  public String dateDiff(String startCol, String endCol) {
    return switch (driver) {
      case IMPALA -> "datediff(" + endCol + ", " + startCol + ")";
    };
  }

  @Override
  public String formatDate(String col) {
    return switch (driver) {
      case IMPALA -> "from_timestamp(" + col + ", 'yyyy-MM-dd')";
    };
  }

  @Override
  public String formatDateTimeString(String col) {
    return switch (driver) {
      case IMPALA -> "from_timestamp(" + col + ", 'yyyy-MM-dd HH:mm:ss.SSS')";
    };
  }

  @Override
  public String castToString(String col) {
    return switch (driver) {
      case IMPALA -> "cast(" + col + " as string)";
    };
  }

  @Override
  public String ensureFloat(String col) {
    return switch (driver) {
      case IMPALA -> "cast(" + col + " as double)";
    };
  }

  @Override
  public String escapeStringLiteral(String value) {
    return switch (driver) {
      case IMPALA -> value.replace("\\", "\\\\").replace("'", "\\'");
    };
  }

  @Override
  public String extractJsonField(String jsonCol, String path, boolean numeric) {
    String raw = switch (driver) {
      case IMPALA -> "get_json_object(" + jsonCol + ", '$." + path + "')";
    };
    return numeric ? ensureFloat(raw) : raw;
  }

  @Override
  public String dataType(DataType type) {
    return switch (driver) {
      case IMPALA -> switch (type) {
        case STRING -> "STRING";
        case INTEGER -> "BIGINT";
        case HLL -> "BINARY";
        default -> super.dataType(type);
      };
    };
  }

  @Override
  public boolean hasQuantileTesting() {
    return false;
  }

  @Override
  public String approxQuantile(String col, double quantile) {
    return switch (driver) {
      case IMPALA -> {
        if (quantile != 0.5) {
          throw new UnsupportedCapabilityException(
              "Impala only supports the median (0.5) quantile, requested " + quantile);
        }
        yield "APPX_MEDIAN(" + col + ")";
      }
    };
  }

  @Override
  public String toString() {
    return "OdbcDialect[" + driver.name().toLowerCase(Locale.ROOT) + "]";
  }

  public static final class Factory implements SqlDialectFactory {
    @Override public String id() { return "odbc"; }
    @Override public SqlDialect create(ConnectionParams params) { return new OdbcDialect(params); }
  }
}
