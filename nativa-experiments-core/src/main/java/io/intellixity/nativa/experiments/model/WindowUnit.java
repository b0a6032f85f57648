package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WindowUnit {
  MINUTES("minutes", 1.0 / 60),
  HOURS("hours", 1),
  DAYS("days", 24),
  WEEKS("weeks", 24 * 7);

  private final String wire;
  private final double hours;

  WindowUnit(String wire, double hours) {
    this.wire = wire;
    this.hours = hours;
  }

  public double toHours(double value) {
    return value * hours;
  }

  @JsonValue
  public String wire() { return wire; }

  @JsonCreator
  public static WindowUnit fromWire(String value) {
    if (value == null || value.isBlank()) return HOURS;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (WindowUnit u : values()) {
      if (u.wire.equals(v)) return u;
    }
    throw new IllegalArgumentException("Unknown window unit: " + value);
  }
}
