package io.intellixity.nativa.experiments.spi.sql;

import java.util.List;

/**
 * Lower/upper quantile levels bracketing {@code q} for a sample of {@code nstar} units, used to derive
 * confidence intervals for quantile metrics from a fixed grid of approximate percentiles.
 */
public record QuantileBounds(double lower, double upper) {
  /** Sample sizes at which bracketing quantiles are pre-computed. */
  public static final List<Integer> N_STAR_VALUES = List.of(100, 500, 1000, 5000, 10000);

  public static final double DEFAULT_ALPHA = 0.05;

  private static final double MIN = 0.00000001;
  private static final double MAX = 0.99999999;

  public static QuantileBounds of(double q, double alpha, int nstar) {
    double multiplier = normalQuantile(1 - alpha / 2);
    double se = Math.sqrt(q * (1 - q) / nstar);
    return new QuantileBounds(Math.max(q - multiplier * se, MIN), Math.min(q + multiplier * se, MAX));
  }

  /** Inverse standard normal CDF (Acklam's rational approximation). */
  static double normalQuantile(double p) {
    if (p <= 0 || p >= 1) throw new IllegalArgumentException("p must be in (0, 1): " + p);
    final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
        1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
    final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
        6.680131188771972e+01, -1.328068155288572e+01};
    final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
        -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
    final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
        3.754408661907416e+00};
    final double low = 0.02425;

    if (p < low) {
      double q = Math.sqrt(-2 * Math.log(p));
      return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
          / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
    }
    if (p > 1 - low) {
      double q = Math.sqrt(-2 * Math.log(1 - p));
      return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
          / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
    }
    double q = p - 0.5;
    double r = q * q;
    return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
        / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1);
  }
}
