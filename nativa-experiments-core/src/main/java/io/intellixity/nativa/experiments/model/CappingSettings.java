package io.intellixity.nativa.experiments.model;

/** Per-unit value cap: an absolute ceiling or a percentile computed over all units. */
public record CappingSettings(CappingType type, double value, boolean ignoreZeros) {
  public static final CappingSettings NONE = new CappingSettings(CappingType.NONE, 0, false);

  public CappingSettings {
    type = type == null ? CappingType.NONE : type;
  }

  public static CappingSettings absolute(double value) {
    return new CappingSettings(CappingType.ABSOLUTE, value, false);
  }

  public static CappingSettings percentile(double value, boolean ignoreZeros) {
    return new CappingSettings(CappingType.PERCENTILE, value, ignoreZeros);
  }

  public boolean isAbsolute() {
    return type == CappingType.ABSOLUTE && value != 0;
  }

  /** Percentile caps only apply strictly below the 100th percentile. */
  public boolean isPercentile() {
    return type == CappingType.PERCENTILE && value > 0 && value < 1;
  }
}
