package com.battery.analysis.algorithm.impl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.algorithm.DetectionResult;
import com.battery.analysis.algorithm.OutlierDetector;
import com.battery.analysis.algorithm.OutlierMethod;
import com.battery.analysis.algorithm.util.RobustStatistics;
import com.battery.analysis.algorithm.util.SeasonalTrendDecomposition;
import com.battery.analysis.config.OutlierDetectionSettings;
import com.battery.analysis.config.OutlierDetectionSettings.ZScoreMadParameters;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.exception.ConfigurationConflictException;

/**
 * Median/MAD modified z-score detector.
 *
 * <p>Scores are {@code madConstant × (x - median) / MAD}, with MAD floored at {@code minMadRatio ×
 * median(|x|)} so a batch whose values nearly coincide cannot blow every score up. A value is
 * flagged when its absolute score exceeds the metric's threshold.
 *
 * <p>When time-series treatment is enabled and the vector is long enough, the values in batch
 * channel order are decomposed first and the residual is scored instead, so systematic drift
 * across the batch is not mistaken for anomalies. The MAD floor still comes from the raw values.
 */
@Component
public class ZScoreMadOutlierDetector implements OutlierDetector {

  private static final Logger logger = LoggerFactory.getLogger(ZScoreMadOutlierDetector.class);

  private static final int MIN_VALUES = 3;

  @Override
  public DetectionResult detect(
      MetricName metric, double[] values, OutlierDetectionSettings settings) {
    ZScoreMadParameters parameters =
        settings
            .zScoreMadParameters()
            .orElseThrow(
                () ->
                    new ConfigurationConflictException(
                        "Z-score/MAD detection requested but " + settings.method() + " is active"));
    double threshold =
        settings
            .thresholdFor(metric)
            .orElseThrow(
                () -> new IllegalArgumentException("Metric not tracked by z-score/MAD: " + metric));

    int n = values.length;
    if (n < MIN_VALUES) {
      return DetectionResult.none(n);
    }

    double[] scored = values;
    if (parameters.useTimeSeries() && n >= parameters.minSamplesForStl()) {
      scored = residualOrRaw(metric, values, parameters);
    }

    double median = RobustStatistics.median(scored);
    double mad = RobustStatistics.medianAbsoluteDeviation(scored, median);
    double floor = parameters.minMadRatio() * RobustStatistics.medianAbsolute(values);
    double effectiveMad = Math.max(mad, floor);
    if (effectiveMad <= 0.0) {
      logger.debug("{}: zero spread, nothing to flag", metric);
      return DetectionResult.none(n);
    }
    if (mad < floor) {
      logger.debug("{}: MAD {} raised to floor {}", metric, mad, floor);
    }

    Map<Integer, Double> scores = new HashMap<>();
    for (int i = 0; i < n; i++) {
      double z = parameters.madConstant() * (scored[i] - median) / effectiveMad;
      if (Math.abs(z) > threshold) {
        scores.put(i, z);
      }
    }
    logger.debug(
        "{}: median={}, MAD={}, threshold={}, flagged {}",
        metric, median, effectiveMad, threshold, scores.size());
    return new DetectionResult(scores, 1, List.of(n, n - scores.size()));
  }

  private double[] residualOrRaw(MetricName metric, double[] values, ZScoreMadParameters parameters) {
    try {
      return SeasonalTrendDecomposition.decompose(
              values, parameters.seasonalPeriod(), parameters.trendBandwidth())
          .residual();
    } catch (MathIllegalArgumentException | IllegalStateException e) {
      logger.warn("{}: decomposition failed ({}), scoring raw values", metric, e.getMessage());
      return values;
    }
  }

  @Override
  public OutlierMethod getMethod() {
    return OutlierMethod.ZSCORE_MAD;
  }
}
