package com.battery.analysis.algorithm.retention;

import java.util.Arrays;

import com.battery.analysis.config.properties.CapacityRetentionProperties.WeightMethod;

/**
 * Per-cycle weights for the retention MSE.
 *
 * <p>With {@code t} running from 0 at the first grid point to 1 at the last, the base weight is 1
 * (constant), {@code 1 + factor·t} (linear) or {@code exp(factor·t)} (exponential). The last 30%
 * of the grid is multiplied by the late-cycle emphasis, and the weights are scaled to sum to the
 * number of grid points so that the MSE stays comparable to the unweighted one.
 */
public final class CycleWeightCalculator {

  /** Fraction of the grid after which the late-cycle emphasis applies. */
  public static final double LATE_SEGMENT_START = 0.7;

  private CycleWeightCalculator() {}

  /**
   * Calculates weights for a grid.
   *
   * @param points number of grid points
   * @param method growth of the weight toward later cycles
   * @param weightFactor growth rate for linear and exponential weights
   * @param lateCyclesEmphasis multiplier applied to the late segment
   * @return one weight per grid point
   */
  public static double[] weights(
      int points, WeightMethod method, double weightFactor, double lateCyclesEmphasis) {
    if (points <= 0) {
      return new double[0];
    }
    if (points == 1) {
      return new double[] {1.0};
    }

    double[] weights = new double[points];
    for (int j = 0; j < points; j++) {
      double t = (double) j / (points - 1);
      switch (method) {
        case LINEAR:
          weights[j] = 1.0 + weightFactor * t;
          break;
        case EXPONENTIAL:
          weights[j] = Math.exp(weightFactor * t);
          break;
        default:
          weights[j] = 1.0;
          break;
      }
    }

    for (int j = lateSegmentStart(points); j < points; j++) {
      weights[j] *= lateCyclesEmphasis;
    }

    double sum = 0.0;
    for (double weight : weights) {
      sum += weight;
    }
    double scale = points / sum;
    for (int j = 0; j < points; j++) {
      weights[j] *= scale;
    }
    return weights;
  }

  /** Index of the first grid point in the late segment. */
  public static int lateSegmentStart(int points) {
    return Math.min((int) Math.floor(LATE_SEGMENT_START * points), points - 1);
  }

  /** Uniform weights for unweighted MSE. */
  public static double[] uniform(int points) {
    double[] weights = new double[points];
    Arrays.fill(weights, 1.0);
    return weights;
  }
}
