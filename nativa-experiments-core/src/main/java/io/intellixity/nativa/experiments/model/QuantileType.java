package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Whether a quantile metric is computed over per-unit aggregates or over raw events. */
public enum QuantileType {
  NONE(""),
  UNIT("unit"),
  EVENT("event");

  private final String wire;

  QuantileType(String wire) { this.wire = wire; }

  @JsonValue
  public String wire() { return wire; }

  @JsonCreator
  public static QuantileType fromWire(String value) {
    if (value == null || value.isBlank() || "none".equalsIgnoreCase(value)) return NONE;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (QuantileType t : values()) {
      if (t.wire.equals(v)) return t;
    }
    throw new IllegalArgumentException("Unknown quantile type: " + value);
  }
}
