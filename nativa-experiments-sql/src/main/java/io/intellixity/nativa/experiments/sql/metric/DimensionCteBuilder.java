package io.intellixity.nativa.experiments.sql.metric;

import io.intellixity.nativa.experiments.model.ActivationDimension;
import io.intellixity.nativa.experiments.model.DateDimension;
import io.intellixity.nativa.experiments.model.DimensionSpec;
import io.intellixity.nativa.experiments.model.ExperimentDimension;
import io.intellixity.nativa.experiments.model.UserDimension;
import io.intellixity.nativa.experiments.sql.identity.IdentityPlan;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * User dimension CTE bodies and the per-unit dimension expressions of {@code __experimentUnits}
 * and {@code __distinctUsers}.
 */
public final class DimensionCteBuilder {
  public static final String NULL_DIMENSION = "__NULL_DIMENSION";

  private final SqlDialect dialect;

  public DimensionCteBuilder(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /** {@code dimension.sql()} must already be template-compiled. */
  public String dimensionCte(UserDimension dimension, IdentityPlan ids) {
    String base = ids.baseIdType();
    String idType = dimension.userIdType();
    String header = "-- Dimension (" + dimension.name() + ")\n";
    if (!idType.equals(base)) {
      return header
          + "SELECT\n  i." + base + ",\n  d.value\n"
          + "FROM\n  (\n" + dimension.sql() + "\n  ) d\n"
          + "  JOIN " + SegmentCteBuilder.joinTable(ids, idType) + " i ON ( i." + idType + " = d." + idType + " )";
    }
    return header + dimension.sql();
  }

  public DimensionColumn dimensionColumn(DimensionSpec dimension) {
    if (dimension instanceof ExperimentDimension d) {
      return new DimensionColumn("dim_exp_" + d.id(), "dim_exp_" + d.id());
    }
    if (dimension instanceof UserDimension d) {
      return new DimensionColumn("dim_unit_" + d.id(), "dim_unit_" + d.id());
    }
    if (dimension instanceof DateDimension) {
      return new DimensionColumn(dialect.formatDate(dialect.dateTrunc("first_exposure_timestamp")), "dim_pre_date");
    }
    if (dimension instanceof ActivationDimension) {
      return new DimensionColumn(
          dialect.ifElse("first_activation_timestamp IS NULL", "'Not Activated'", "'Activated'"), "dim_activation");
    }
    throw new IllegalArgumentException("Unknown dimension type: " + dimension.type());
  }

  /** Unit-level value of a user dimension read from the CTE joined as {@code table}. */
  public String userDimensionValue(String table) {
    return "COALESCE(MAX(" + dialect.castToString(table + ".value") + "),'" + NULL_DIMENSION + "')";
  }

  /** Value of an exposure column at the unit's earliest exposure. */
  public String experimentDimensionValue(ExperimentDimension dimension) {
    return "SUBSTRING(\n  MIN(\n    CONCAT(SUBSTRING(" + dialect.formatDateTimeString("e.timestamp") + ", 1, 19),\n"
        + "      coalesce(" + dialect.castToString("e.dim_" + dimension.id()) + ", "
        + dialect.castToString("'" + NULL_DIMENSION + "'") + ")\n    )\n  ),\n  20,\n  99999\n)";
  }

  /** Exposure column bucketed to the requested slices; any other value becomes {@link ExperimentDimension#OTHER}. */
  public String specifiedSlices(String column, List<String> slices) {
    String values = slices.stream()
        .map(v -> "'" + dialect.escapeStringLiteral(v) + "'")
        .collect(Collectors.joining(","));
    return dialect.ifElse(dialect.castToString(column) + " IN (" + values + ")",
        dialect.castToString(column),
        dialect.castToString("'" + ExperimentDimension.OTHER + "'"));
  }
}
