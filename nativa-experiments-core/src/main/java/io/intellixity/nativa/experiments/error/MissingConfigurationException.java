package io.intellixity.nativa.experiments.error;

/**
 * Raised when datasource configuration needed to build a query is absent
 * (identity joins, exposure queries, fact tables, database or schema names).
 */
public final class MissingConfigurationException extends QueryBuildException {
  public MissingConfigurationException(String message) {
    super(message);
  }

  public MissingConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
