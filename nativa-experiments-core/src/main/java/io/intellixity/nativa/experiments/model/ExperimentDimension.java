package io.intellixity.nativa.experiments.model;

import java.util.List;
import java.util.Objects;

/**
 * Dimension read from an inline column of the exposure query. When slices are
 * specified, other values are bucketed into {@link #OTHER}.
 */
public record ExperimentDimension(String id, List<String> specifiedSlices) implements DimensionSpec {
  public static final String OTHER = "__Other__";

  public ExperimentDimension {
    Objects.requireNonNull(id, "id");
    specifiedSlices = specifiedSlices == null ? List.of() : List.copyOf(specifiedSlices);
  }

  public static ExperimentDimension of(String id) {
    return new ExperimentDimension(id, List.of());
  }

  @Override public String type() { return "experiment"; }
}
