package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MetricType {
  BINOMIAL("binomial", false),
  COUNT("count", false),
  DURATION("duration", false),
  REVENUE("revenue", false),
  FACT_MEAN("fact-mean", true),
  FACT_RATIO("fact-ratio", true),
  FACT_QUANTILE("fact-quantile", true),
  FACT_PROPORTION("fact-proportion", true);

  private final String wire;
  private final boolean fact;

  MetricType(String wire, boolean fact) {
    this.wire = wire;
    this.fact = fact;
  }

  public boolean fact() { return fact; }

  /** Binomial metrics only record whether a unit converted. */
  public boolean binomial() { return this == BINOMIAL || this == FACT_PROPORTION; }

  @JsonValue
  public String wire() { return wire; }

  @JsonCreator
  public static MetricType fromWire(String value) {
    if (value == null) throw new IllegalArgumentException("metric type is required");
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (MetricType t : values()) {
      if (t.wire.equals(v)) return t;
    }
    throw new IllegalArgumentException("Unknown metric type: " + value);
  }
}
