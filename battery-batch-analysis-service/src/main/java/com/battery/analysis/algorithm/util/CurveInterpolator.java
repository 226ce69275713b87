package com.battery.analysis.algorithm.util;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import com.battery.analysis.config.properties.CapacityRetentionProperties.InterpolationMethod;

/**
 * Resamples a sampled curve onto a grid. Grid points outside the sampled range take the value of
 * the nearest sample.
 */
public final class CurveInterpolator {

  /** A natural cubic spline needs at least this many knots. */
  private static final int MIN_CUBIC_POINTS = 3;

  private CurveInterpolator() {}

  /**
   * Resamples the curve.
   *
   * @param x strictly increasing sample positions, at least 2
   * @param y sample values
   * @param grid positions to evaluate
   * @param method interpolation method; cubic degrades to linear below three samples
   * @return values at the grid positions
   */
  public static double[] resample(double[] x, double[] y, double[] grid, InterpolationMethod method) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("Sample positions and values differ in length");
    }
    if (x.length < 2) {
      throw new IllegalArgumentException("Resampling requires at least 2 samples, got " + x.length);
    }
    if (method == InterpolationMethod.NEAREST) {
      return nearest(x, y, grid);
    }

    UnivariateInterpolator interpolator =
        method == InterpolationMethod.CUBIC && x.length >= MIN_CUBIC_POINTS
            ? new SplineInterpolator()
            : new LinearInterpolator();
    PolynomialSplineFunction function = (PolynomialSplineFunction) interpolator.interpolate(x, y);

    double first = x[0];
    double last = x[x.length - 1];
    double[] result = new double[grid.length];
    for (int i = 0; i < grid.length; i++) {
      double position = grid[i];
      if (position <= first) {
        result[i] = y[0];
      } else if (position >= last) {
        result[i] = y[y.length - 1];
      } else {
        result[i] = function.value(position);
      }
    }
    return result;
  }

  private static double[] nearest(double[] x, double[] y, double[] grid) {
    double[] result = new double[grid.length];
    int cursor = 0;
    for (int i = 0; i < grid.length; i++) {
      double position = grid[i];
      while (cursor + 1 < x.length && x[cursor + 1] <= position) {
        cursor++;
      }
      int chosen = cursor;
      if (cursor + 1 < x.length
          && Math.abs(x[cursor + 1] - position) < Math.abs(position - x[cursor])) {
        chosen = cursor + 1;
      }
      result[i] = y[chosen];
    }
    return result;
  }
}
