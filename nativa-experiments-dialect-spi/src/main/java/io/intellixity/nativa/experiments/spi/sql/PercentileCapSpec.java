package io.intellixity.nativa.experiments.spi.sql;

import java.util.Objects;

/**
 * One percentile cap to compute in a {@code __capValue} CTE: the {@code percentile} of {@code valueCol},
 * exposed as {@code outputCol}.
 */
public record PercentileCapSpec(String valueCol, String outputCol, double percentile, boolean ignoreZeros, int sourceIndex) {
  public PercentileCapSpec {
    Objects.requireNonNull(valueCol, "valueCol");
    Objects.requireNonNull(outputCol, "outputCol");
    if (!(percentile > 0 && percentile < 1)) {
      throw new IllegalArgumentException("percentile must be in (0, 1): " + percentile);
    }
  }
}
