package io.intellixity.nativa.experiments.sql.stats;

import io.intellixity.nativa.experiments.model.QuantileType;
import io.intellixity.nativa.experiments.spi.sql.QuantileBounds;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.sql.metric.DimensionColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the grouped statistics SELECT over per-unit metric aggregates: one row per
 * variation and dimension combination with {@code users} and the sufficient statistics
 * of every metric.
 *
 * Column lists are built per metric and concatenated in metric order.
 */
public final class StatisticsCteBuilder {
  private final SqlDialect dialect;

  public StatisticsCteBuilder(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public String build(StatisticsRequest req) {
    StringBuilder sb = new StringBuilder("SELECT\n  m.variation AS variation\n");
    for (DimensionColumn c : req.dimensionCols()) {
      sb.append("  , m.").append(c.alias()).append(" AS ").append(c.alias()).append('\n');
    }
    sb.append("  , COUNT(*) AS users\n");
    for (FactMetricData data : req.metricData()) {
      for (String col : metricColumns(data, req.hasEventQuantiles())) {
        sb.append("  , ").append(col).append('\n');
      }
    }
    sb.append("FROM\n  ").append(req.joinedMetricTable()).append(" m\n");
    for (String join : joins(req)) {
      sb.append("  ").append(join).append('\n');
    }
    sb.append("GROUP BY\n  m.variation");
    for (DimensionColumn c : req.dimensionCols()) {
      sb.append(", m.").append(c.alias());
    }
    return sb.toString();
  }

  /**
   * Aggregate columns of one metric, without leading commas. Event quantile columns read from the
   * {@code qm} join and are left out unless {@code eventQuantilesJoined}.
   */
  public List<String> metricColumns(FactMetricData data, boolean eventQuantilesJoined) {
    String a = data.alias();
    String main = data.capCoalesceMetric();
    List<String> cols = new ArrayList<>();
    cols.add(dialect.castToString("'" + data.id() + "'") + " as " + a + "_id");
    if (data.percentileCapped()) {
      cols.add("MAX(COALESCE(cap" + FactMetricData.suffix(data.numeratorSourceIndex()) + "." + a
          + "_value_cap, 0)) as " + a + "_main_cap_value");
    }
    cols.add("SUM(" + main + ") AS " + a + "_main_sum");
    cols.add("SUM(POWER(" + main + ", 2)) AS " + a + "_main_sum_squares");

    if (data.quantileMetric() == QuantileType.EVENT) {
      String n = "COALESCE(m" + FactMetricData.suffix(data.numeratorSourceIndex()) + "." + a + "_n_events, 0)";
      cols.add("SUM(" + n + ") AS " + a + "_denominator_sum");
      cols.add("SUM(POWER(" + n + ", 2)) AS " + a + "_denominator_sum_squares");
      cols.add("SUM(" + n + " * " + main + ") AS " + a + "_main_denominator_sum_product");
      cols.add("SUM(" + n + ") AS " + a + "_quantile_n");
      if (eventQuantilesJoined) {
        cols.add("MAX(qm." + a + "_quantile) AS " + a + "_quantile");
        for (int nstar : QuantileBounds.N_STAR_VALUES) {
          cols.add("MAX(qm." + a + "_quantile_lower_" + nstar + ") AS " + a + "_quantile_lower_" + nstar);
          cols.add("MAX(qm." + a + "_quantile_upper_" + nstar + ") AS " + a + "_quantile_upper_" + nstar);
        }
      }
    }
    if (data.quantileMetric() == QuantileType.UNIT) {
      String grid = dialect.quantileGridColumns(data.quantileSettings(), a + "_");
      for (String g : grid.split("\n, ")) {
        if (!g.isBlank()) cols.add(g.trim());
      }
      cols.add("COUNT(m." + a + "_value) AS " + a + "_quantile_n");
    }

    if (data.ratioMetric()) {
      String den = data.capCoalesceDenominator();
      if (data.percentileCapped()) {
        cols.add("MAX(COALESCE(cap" + FactMetricData.suffix(data.denominatorSourceIndex()) + "." + a
            + "_denominator_cap, 0)) as " + a + "_denominator_cap_value");
      }
      cols.add("SUM(" + den + ") AS " + a + "_denominator_sum");
      cols.add("SUM(POWER(" + den + ", 2)) AS " + a + "_denominator_sum_squares");
      if (data.regressionAdjusted()) {
        String cov = data.capCoalesceCovariate();
        String denCov = data.capCoalesceDenominatorCovariate();
        cols.add("SUM(" + cov + ") AS " + a + "_covariate_sum");
        cols.add("SUM(POWER(" + cov + ", 2)) AS " + a + "_covariate_sum_squares");
        cols.add("SUM(" + denCov + ") AS " + a + "_denominator_pre_sum");
        cols.add("SUM(POWER(" + denCov + ", 2)) AS " + a + "_denominator_pre_sum_squares");
        cols.add("SUM(" + main + " * " + den + ") AS " + a + "_main_denominator_sum_product");
        cols.add("SUM(" + main + " * " + cov + ") AS " + a + "_main_covariate_sum_product");
        cols.add("SUM(" + main + " * " + denCov + ") AS " + a + "_main_post_denominator_pre_sum_product");
        cols.add("SUM(" + cov + " * " + den + ") AS " + a + "_main_pre_denominator_post_sum_product");
        cols.add("SUM(" + cov + " * " + denCov + ") AS " + a + "_main_pre_denominator_pre_sum_product");
        cols.add("SUM(" + den + " * " + denCov + ") AS " + a + "_denominator_post_denominator_pre_sum_product");
      } else {
        cols.add("SUM(" + den + " * " + main + ") AS " + a + "_main_denominator_sum_product");
      }
    } else if (data.regressionAdjusted()) {
      String cov = data.capCoalesceCovariate();
      cols.add("SUM(" + cov + ") AS " + a + "_covariate_sum");
      cols.add("SUM(POWER(" + cov + ", 2)) AS " + a + "_covariate_sum_squares");
      cols.add("SUM(" + main + " * " + cov + ") AS " + a + "_main_covariate_sum_product");
    }
    return List.copyOf(cols);
  }

  List<String> joins(StatisticsRequest req) {
    List<String> joins = new ArrayList<>();
    String base = req.baseIdType();
    if (req.hasEventQuantiles()) {
      StringBuilder on = new StringBuilder("qm.variation = m.variation");
      for (DimensionColumn c : req.dimensionCols()) {
        on.append(" AND qm.").append(c.alias()).append(" = m.").append(c.alias());
      }
      joins.add("LEFT JOIN " + req.eventQuantileTable() + " qm ON (" + on + ")");
    }
    for (int index : req.tableIndices()) {
      String s = FactMetricData.suffix(index);
      if (index != 0) {
        joins.add("LEFT JOIN " + req.joinedMetricTable() + s + " m" + s + " ON (m" + s + "." + base + " = m." + base + ")");
      }
      if (req.regressionAdjustedTableIndices().contains(index)) {
        joins.add("LEFT JOIN " + req.cupedMetricTable() + s + " c" + s + " ON (c" + s + "." + base + " = m" + s + "." + base + ")");
      }
      if (req.percentileTableIndices().contains(index)) {
        joins.add("CROSS JOIN " + req.capValueTable() + s + " cap" + s);
      }
    }
    return joins;
  }
}
