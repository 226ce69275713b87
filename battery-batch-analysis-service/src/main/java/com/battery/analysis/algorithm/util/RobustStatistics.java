package com.battery.analysis.algorithm.util;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Order statistics shared by the outlier detectors and the selection strategies.
 *
 * <p>Quantiles use linear interpolation between order statistics (estimation type R-7), the
 * definition most spreadsheet and dataframe tools apply by default.
 */
public final class RobustStatistics {

  private RobustStatistics() {}

  public static double median(double[] values) {
    requireValues(values);
    return new Median().evaluate(values);
  }

  /**
   * Quantile of the values.
   *
   * @param values sample, not modified
   * @param percentile percentile in (0, 100]
   * @return interpolated quantile
   */
  public static double quantile(double[] values, double percentile) {
    requireValues(values);
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percentile);
  }

  /** Median absolute deviation around the given center. */
  public static double medianAbsoluteDeviation(double[] values, double center) {
    requireValues(values);
    double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - center);
    }
    return median(deviations);
  }

  /** Median of the absolute values. */
  public static double medianAbsolute(double[] values) {
    requireValues(values);
    return median(Arrays.stream(values).map(Math::abs).toArray());
  }

  public static double mean(double[] values) {
    requireValues(values);
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  private static void requireValues(double[] values) {
    if (values == null || values.length == 0) {
      throw new IllegalArgumentException("Statistics require at least one value");
    }
  }
}
