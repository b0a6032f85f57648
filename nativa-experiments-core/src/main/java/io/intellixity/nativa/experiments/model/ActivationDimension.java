package io.intellixity.nativa.experiments.model;

/** Splits units into activated and not activated by the activation metric. */
public record ActivationDimension() implements DimensionSpec {
  @Override public String type() { return "activation"; }
}
