package io.intellixity.nativa.experiments.error;

/** Raised when a warehouse dialect is asked for SQL it cannot express. */
public final class UnsupportedCapabilityException extends QueryBuildException {
  public UnsupportedCapabilityException(String message) {
    super(message);
  }

  public UnsupportedCapabilityException(String message, Throwable cause) {
    super(message, cause);
  }

  public static UnsupportedCapabilityException of(String dialectId, String capability) {
    return new UnsupportedCapabilityException(capability + " is not supported by dialect: " + dialectId);
  }
}
