package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a metric's timestamps are bounded relative to a unit's exposure. */
public enum WindowType {
  NONE(""),
  CONVERSION("conversion"),
  LOOKBACK("lookback");

  private final String wire;

  WindowType(String wire) { this.wire = wire; }

  @JsonValue
  public String wire() { return wire; }

  @JsonCreator
  public static WindowType fromWire(String value) {
    if (value == null || value.isBlank() || "none".equalsIgnoreCase(value)) return NONE;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (WindowType t : values()) {
      if (t.wire.equals(v)) return t;
    }
    throw new IllegalArgumentException("Unknown window type: " + value);
  }
}
