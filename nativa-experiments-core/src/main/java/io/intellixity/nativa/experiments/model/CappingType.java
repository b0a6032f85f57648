package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CappingType {
  NONE(""),
  ABSOLUTE("absolute"),
  PERCENTILE("percentile");

  private final String wire;

  CappingType(String wire) { this.wire = wire; }

  @JsonValue
  public String wire() { return wire; }

  @JsonCreator
  public static CappingType fromWire(String value) {
    if (value == null || value.isBlank() || "none".equalsIgnoreCase(value)) return NONE;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (CappingType t : values()) {
      if (t.wire.equals(v)) return t;
    }
    throw new IllegalArgumentException("Unknown capping type: " + value);
  }
}
