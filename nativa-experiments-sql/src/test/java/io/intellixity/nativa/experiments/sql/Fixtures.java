package io.intellixity.nativa.experiments.sql;

import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.ExposureQuery;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.IdentityJoin;
import io.intellixity.nativa.experiments.model.UserIdType;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.sql.dialect.AbstractSqlDialect;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/** Shared inputs for the compiler tests; the dialect renders plain ANSI and never pretty-prints. */
public final class Fixtures {
  public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  public static final Instant END = Instant.parse("2024-01-31T00:00:00Z");
  public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-15T00:00:00Z"), ZoneOffset.UTC);

  public static final String EXPOSURE_SQL = "SELECT user_id, timestamp, experiment_id, variation_id FROM viewed_experiment";
  public static final String IDENTITY_SQL = "SELECT user_id, anonymous_id FROM identifies";

  private Fixtures() {}

  public static final class AnsiDialect extends AbstractSqlDialect {
    public AnsiDialect() {
      super(ConnectionParams.EMPTY);
    }

    public AnsiDialect(ConnectionParams params) {
      super(params);
    }

    @Override public String id() { return "ansi"; }
  }

  public static DatasourceSettings datasource() {
    return new DatasourceSettings(
        List.of(new IdentityJoin(List.of("user_id", "anonymous_id"), IDENTITY_SQL)),
        null,
        List.of(new ExposureQuery("user_id", "Users", "user_id", EXPOSURE_SQL, List.of("browser"))));
  }

  public static AnalysisSettings.Builder settings() {
    return AnalysisSettings.builder("exp-checkout", START, END).userIdType(UserIdType.USER);
  }

  public static FactTableSpec orders() {
    return new FactTableSpec("orders", "Orders",
        "SELECT user_id, anonymous_id, timestamp, amount, qty FROM orders",
        List.of("user_id", "anonymous_id"),
        Map.of("mobile", "device = 'mobile'", "big", "amount > 100"));
  }

  public static FactTableSpec sessions() {
    return new FactTableSpec("sessions", "Sessions",
        "SELECT user_id, timestamp, duration FROM sessions",
        List.of("user_id"),
        Map.of());
  }
}
