package io.intellixity.nativa.experiments.model;

/**
 * A breakdown of experiment results. Implementations: {@link UserDimension},
 * {@link ExperimentDimension}, {@link DateDimension}, {@link ActivationDimension}.
 */
public interface DimensionSpec {
  String type();
}
