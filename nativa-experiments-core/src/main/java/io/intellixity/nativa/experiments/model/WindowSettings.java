package io.intellixity.nativa.experiments.model;

/**
 * Conversion delay and window of a metric.
 *
 * Missing values fall back to a 72 hour window with no delay.
 */
public record WindowSettings(WindowType type,
                             Double delayValue,
                             WindowUnit delayUnit,
                             Double windowValue,
                             WindowUnit windowUnit) {
  public static final double DEFAULT_WINDOW_HOURS = 72;

  public static final WindowSettings NONE = new WindowSettings(WindowType.NONE, 0.0, WindowUnit.HOURS, DEFAULT_WINDOW_HOURS, WindowUnit.HOURS);

  public WindowSettings {
    type = type == null ? WindowType.NONE : type;
    delayValue = delayValue == null ? 0.0 : delayValue;
    delayUnit = delayUnit == null ? WindowUnit.HOURS : delayUnit;
    windowValue = windowValue == null ? DEFAULT_WINDOW_HOURS : windowValue;
    windowUnit = windowUnit == null ? WindowUnit.HOURS : windowUnit;
  }

  public static WindowSettings conversion(double windowHours, double delayHours) {
    return new WindowSettings(WindowType.CONVERSION, delayHours, WindowUnit.HOURS, windowHours, WindowUnit.HOURS);
  }

  public static WindowSettings lookback(double windowHours) {
    return new WindowSettings(WindowType.LOOKBACK, 0.0, WindowUnit.HOURS, windowHours, WindowUnit.HOURS);
  }

  public static WindowSettings delayOnly(double delayHours) {
    return new WindowSettings(WindowType.NONE, delayHours, WindowUnit.HOURS, DEFAULT_WINDOW_HOURS, WindowUnit.HOURS);
  }

  public double delayHours() {
    return delayUnit.toHours(delayValue);
  }

  public double windowHours() {
    return windowUnit.toHours(windowValue);
  }

  public boolean isConversion() {
    return type == WindowType.CONVERSION;
  }
}
