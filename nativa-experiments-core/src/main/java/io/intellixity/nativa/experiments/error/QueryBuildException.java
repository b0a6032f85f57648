package io.intellixity.nativa.experiments.error;

/**
 * Base type for every build-time failure raised while compiling experiment SQL.
 * <p>
 * Build errors are never retried by the compiler; they surface verbatim to the caller.
 */
public abstract class QueryBuildException extends RuntimeException {
  protected QueryBuildException(String message) {
    super(message);
  }

  protected QueryBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
