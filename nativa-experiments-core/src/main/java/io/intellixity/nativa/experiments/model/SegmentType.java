package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SegmentType {
  SQL("sql"),
  FACT("fact");

  private final String wire;

  SegmentType(String wire) { this.wire = wire; }

  @JsonValue
  public String wire() { return wire; }

  @JsonCreator
  public static SegmentType fromWire(String value) {
    if (value == null || value.isBlank()) return SQL;
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
