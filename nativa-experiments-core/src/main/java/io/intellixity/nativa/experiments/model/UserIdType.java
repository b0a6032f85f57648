package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UserIdType {
  USER,
  ANONYMOUS;

  @JsonValue
  public String wire() { return name().toLowerCase(Locale.ROOT); }

  @JsonCreator
  public static UserIdType fromWire(String value) {
    if (value == null || value.isBlank()) return ANONYMOUS;
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
