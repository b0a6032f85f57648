package io.intellixity.nativa.experiments.error;

public final class SqlTemplateException extends QueryBuildException {
  public SqlTemplateException(String message) {
    super(message);
  }

  public SqlTemplateException(String message, Throwable cause) {
    super(message, cause);
  }
}
