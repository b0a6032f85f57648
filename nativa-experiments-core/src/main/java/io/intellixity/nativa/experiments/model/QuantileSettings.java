package io.intellixity.nativa.experiments.model;

public record QuantileSettings(QuantileType type, double quantile, boolean ignoreZeros) {
  public static final QuantileSettings NONE = new QuantileSettings(QuantileType.NONE, 0.5, false);

  public QuantileSettings {
    type = type == null ? QuantileType.NONE : type;
    if (type != QuantileType.NONE && (quantile <= 0 || quantile >= 1)) {
      throw new IllegalArgumentException("quantile must be in (0, 1): " + quantile);
    }
  }

  public static QuantileSettings unit(double quantile) {
    return new QuantileSettings(QuantileType.UNIT, quantile, false);
  }

  public static QuantileSettings event(double quantile, boolean ignoreZeros) {
    return new QuantileSettings(QuantileType.EVENT, quantile, ignoreZeros);
  }
}
