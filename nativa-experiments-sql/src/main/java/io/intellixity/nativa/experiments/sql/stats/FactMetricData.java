package io.intellixity.nativa.experiments.sql.stats;

import io.intellixity.nativa.experiments.model.QuantileSettings;
import io.intellixity.nativa.experiments.model.QuantileType;

import java.util.Objects;

/**
 * Per-metric input of {@link StatisticsCteBuilder}. The four {@code capCoalesce*} expressions are
 * already rendered for the target dialect and reference the joined aliases ({@code m}, {@code c},
 * {@code cap} plus the source index suffix).
 *
 * @param numeratorSourceIndex   index of the fact table supplying the numerator
 * @param denominatorSourceIndex index of the fact table supplying the denominator, equal to the
 *                               numerator's for non-ratio metrics
 */
public record FactMetricData(String id,
                             String alias,
                             int numeratorSourceIndex,
                             int denominatorSourceIndex,
                             boolean ratioMetric,
                             boolean regressionAdjusted,
                             QuantileType quantileMetric,
                             QuantileSettings quantileSettings,
                             boolean percentileCapped,
                             String capCoalesceMetric,
                             String capCoalesceCovariate,
                             String capCoalesceDenominator,
                             String capCoalesceDenominatorCovariate) {
  public FactMetricData {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(capCoalesceMetric, "capCoalesceMetric");
    quantileMetric = quantileMetric == null ? QuantileType.NONE : quantileMetric;
    quantileSettings = quantileSettings == null ? QuantileSettings.NONE : quantileSettings;
  }

  static String suffix(int sourceIndex) {
    return sourceIndex == 0 ? "" : String.valueOf(sourceIndex);
  }
}
