package com.battery.analysis.algorithm.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an evenly spaced series into trend, seasonal and residual components.
 *
 * <p>The trend is a LOESS fit whose robustness weights come from the remainder of the previous
 * pass, seeded by a Theil-Sen line so that an isolated spike never pulls the first fit. The
 * seasonal component is the centered median of each phase of the configured period and is zero
 * when the period is below 2 or the series holds fewer than two full periods.
 */
public final class SeasonalTrendDecomposition {

  private static final Logger logger = LoggerFactory.getLogger(SeasonalTrendDecomposition.class);

  private static final int OUTER_PASSES = 2;

  /** Remainders within this multiple of the median remainder keep part of their weight. */
  private static final double BISQUARE_SCALE = 6.0;

  /** Minimum number of points a LOESS window must span. */
  private static final double MIN_WINDOW_POINTS = 3.0;

  private SeasonalTrendDecomposition() {}

  /** Components of a decomposed series; {@code trend + seasonal + residual} restores it. */
  public record Decomposition(double[] trend, double[] seasonal, double[] residual) {}

  /**
   * Decomposes the series.
   *
   * @param series values at positions 0..n-1, n at least 3
   * @param period seasonal period, below 2 for no seasonal component
   * @param bandwidth LOESS bandwidth as a fraction of the series length
   * @return the decomposition
   * @throws IllegalStateException if the trend fit is not finite
   * @throws org.apache.commons.math3.exception.MathIllegalArgumentException if LOESS rejects the
   *     input
   */
  public static Decomposition decompose(double[] series, int period, double bandwidth) {
    int n = series.length;
    if (n < 3) {
      throw new IllegalArgumentException("Decomposition requires at least 3 points, got " + n);
    }
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = i;
    }
    double effectiveBandwidth = Math.min(1.0, Math.max(bandwidth, MIN_WINDOW_POINTS / n));
    LoessInterpolator loess = new LoessInterpolator(effectiveBandwidth, 0);

    double[] seasonal = new double[n];
    double[] trend = theilSenLine(series);
    double[] weights = robustnessWeights(series, trend, seasonal);

    for (int pass = 0; pass < OUTER_PASSES; pass++) {
      double[] deseasonalized = new double[n];
      for (int i = 0; i < n; i++) {
        deseasonalized[i] = series[i] - seasonal[i];
      }
      trend = loess.smooth(x, deseasonalized, weights);
      for (double value : trend) {
        if (!Double.isFinite(value)) {
          throw new IllegalStateException("LOESS trend is not finite");
        }
      }
      seasonal = seasonalComponent(series, trend, period);
      weights = robustnessWeights(series, trend, seasonal);
    }

    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      residual[i] = series[i] - trend[i] - seasonal[i];
    }
    logger.debug(
        "Decomposed {} points with period {} and bandwidth {}", n, period, effectiveBandwidth);
    return new Decomposition(trend, seasonal, residual);
  }

  /** Robust line through the series: median pairwise slope and median intercept. */
  static double[] theilSenLine(double[] series) {
    int n = series.length;
    List<Double> slopes = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        slopes.add((series[j] - series[i]) / (j - i));
      }
    }
    double slope = RobustStatistics.median(slopes.stream().mapToDouble(Double::doubleValue).toArray());
    double[] intercepts = new double[n];
    for (int i = 0; i < n; i++) {
      intercepts[i] = series[i] - slope * i;
    }
    double intercept = RobustStatistics.median(intercepts);
    double[] line = new double[n];
    for (int i = 0; i < n; i++) {
      line[i] = intercept + slope * i;
    }
    return line;
  }

  private static double[] robustnessWeights(double[] series, double[] trend, double[] seasonal) {
    int n = series.length;
    double[] remainder = new double[n];
    for (int i = 0; i < n; i++) {
      remainder[i] = Math.abs(series[i] - trend[i] - seasonal[i]);
    }
    double h = BISQUARE_SCALE * RobustStatistics.median(remainder);
    double tolerance = 1e-9 * Math.max(1.0, RobustStatistics.medianAbsolute(series));
    double[] weights = new double[n];
    for (int i = 0; i < n; i++) {
      if (h <= tolerance) {
        // More than half the points sit on the fit; anything off it gets no say
        weights[i] = remainder[i] <= tolerance ? 1.0 : 0.0;
      } else {
        double u = remainder[i] / h;
        weights[i] = u >= 1.0 ? 0.0 : (1 - u * u) * (1 - u * u);
      }
    }
    return weights;
  }

  private static double[] seasonalComponent(double[] series, double[] trend, int period) {
    int n = series.length;
    double[] seasonal = new double[n];
    if (period < 2 || n < 2 * period) {
      return seasonal;
    }
    double[] phaseMedians = new double[period];
    for (int phase = 0; phase < period; phase++) {
      List<Double> detrended = new ArrayList<>();
      for (int i = phase; i < n; i += period) {
        detrended.add(series[i] - trend[i]);
      }
      phaseMedians[phase] =
          RobustStatistics.median(detrended.stream().mapToDouble(Double::doubleValue).toArray());
    }
    double center = RobustStatistics.mean(phaseMedians);
    for (int i = 0; i < n; i++) {
      seasonal[i] = phaseMedians[i % period] - center;
    }
    return seasonal;
  }
}
