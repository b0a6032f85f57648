package io.intellixity.nativa.experiments.model;

/** Breaks results down by the day of each unit's first exposure. */
public record DateDimension() implements DimensionSpec {
  @Override public String type() { return "date"; }
}
