package io.intellixity.nativa.experiments.model;

import io.intellixity.nativa.experiments.error.InvalidMetricException;

import java.util.List;
import java.util.Objects;

/**
 * A metric definition. Legacy metrics (binomial, count, duration, revenue) read from a
 * {@link MetricSource}; fact metrics reference fact table columns through {@link ColumnRef}s.
 */
public record MetricSpec(String id,
                         String name,
                         MetricType type,
                         List<String> userIdTypes,
                         MetricSource source,
                         String aggregation,
                         ColumnRef numerator,
                         ColumnRef denominator,
                         WindowSettings windowSettings,
                         CappingSettings cappingSettings,
                         QuantileSettings quantileSettings,
                         boolean regressionAdjustmentEnabled,
                         double regressionAdjustmentDays,
                         boolean ignoreNulls) {
  public MetricSpec {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    name = name == null ? id : name;
    userIdTypes = userIdTypes == null ? List.of() : List.copyOf(userIdTypes);
    windowSettings = windowSettings == null ? WindowSettings.NONE : windowSettings;
    cappingSettings = cappingSettings == null ? CappingSettings.NONE : cappingSettings;
    quantileSettings = quantileSettings == null ? QuantileSettings.NONE : quantileSettings;
  }

  public static Builder builder(String id, MetricType type) {
    return new Builder(id, type);
  }

  public Builder toBuilder() {
    return new Builder(id, type)
        .name(name)
        .userIdTypes(userIdTypes)
        .source(source)
        .aggregation(aggregation)
        .numerator(numerator)
        .denominator(denominator)
        .windowSettings(windowSettings)
        .cappingSettings(cappingSettings)
        .quantileSettings(quantileSettings)
        .regressionAdjustment(regressionAdjustmentEnabled, regressionAdjustmentDays)
        .ignoreNulls(ignoreNulls);
  }

  public boolean isFact() {
    return type.fact();
  }

  public boolean isRatio() {
    return type == MetricType.FACT_RATIO && denominator != null;
  }

  public QuantileType quantileType() {
    return type == MetricType.FACT_QUANTILE ? quantileSettings.type() : QuantileType.NONE;
  }

  /** Binomial metrics and quantile metrics are never capped. */
  public boolean isCappable() {
    return !type.binomial() && quantileType() == QuantileType.NONE;
  }

  public boolean isPercentileCapped() {
    return isCappable() && cappingSettings.isPercentile();
  }

  public double regressionAdjustmentHours() {
    return regressionAdjustmentEnabled ? regressionAdjustmentDays * 24 : 0;
  }

  /** Fails fast when the definition cannot produce SQL. */
  public MetricSpec validate() {
    if (isFact()) {
      if (numerator == null || numerator.factTableId() == null) {
        throw new InvalidMetricException("Fact metric " + id + " has no numerator column reference");
      }
      if (type == MetricType.FACT_RATIO && denominator == null) {
        throw new InvalidMetricException("Ratio metric " + id + " has no denominator column reference");
      }
      return this;
    }
    if (source == null) {
      throw new InvalidMetricException("Metric " + id + " has neither a SQL source nor a table source");
    }
    source.validate(id);
    return this;
  }

  public static final class Builder {
    private final String id;
    private final MetricType type;
    private String name;
    private List<String> userIdTypes = List.of();
    private MetricSource source;
    private String aggregation;
    private ColumnRef numerator;
    private ColumnRef denominator;
    private WindowSettings windowSettings;
    private CappingSettings cappingSettings;
    private QuantileSettings quantileSettings;
    private boolean regressionAdjustmentEnabled;
    private double regressionAdjustmentDays;
    private boolean ignoreNulls;

    private Builder(String id, MetricType type) {
      this.id = id;
      this.type = type;
    }

    public Builder name(String name) { this.name = name; return this; }
    public Builder userIdTypes(List<String> userIdTypes) { this.userIdTypes = userIdTypes; return this; }
    public Builder userIdTypes(String... userIdTypes) { this.userIdTypes = List.of(userIdTypes); return this; }
    public Builder source(MetricSource source) { this.source = source; return this; }
    public Builder sql(String sql) { this.source = MetricSource.ofSql(sql); return this; }
    public Builder aggregation(String aggregation) { this.aggregation = aggregation; return this; }
    public Builder numerator(ColumnRef numerator) { this.numerator = numerator; return this; }
    public Builder denominator(ColumnRef denominator) { this.denominator = denominator; return this; }
    public Builder windowSettings(WindowSettings windowSettings) { this.windowSettings = windowSettings; return this; }
    public Builder cappingSettings(CappingSettings cappingSettings) { this.cappingSettings = cappingSettings; return this; }
    public Builder quantileSettings(QuantileSettings quantileSettings) { this.quantileSettings = quantileSettings; return this; }
    public Builder ignoreNulls(boolean ignoreNulls) { this.ignoreNulls = ignoreNulls; return this; }

    public Builder regressionAdjustment(boolean enabled, double days) {
      this.regressionAdjustmentEnabled = enabled;
      this.regressionAdjustmentDays = days;
      return this;
    }

    public MetricSpec build() {
      return new MetricSpec(id, name, type, userIdTypes, source, aggregation, numerator, denominator,
          windowSettings, cappingSettings, quantileSettings, regressionAdjustmentEnabled,
          regressionAdjustmentDays, ignoreNulls);
    }
  }
}
