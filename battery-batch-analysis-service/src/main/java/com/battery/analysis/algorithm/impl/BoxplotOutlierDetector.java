package com.battery.analysis.algorithm.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.algorithm.DetectionResult;
import com.battery.analysis.algorithm.OutlierDetector;
import com.battery.analysis.algorithm.OutlierMethod;
import com.battery.analysis.algorithm.util.RobustStatistics;
import com.battery.analysis.config.OutlierDetectionSettings;
import com.battery.analysis.config.OutlierDetectionSettings.BoxplotParameters;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.exception.ConfigurationConflictException;

/**
 * Iterative interquartile-range outlier detector.
 *
 * <p>Each pass computes Q1 and Q3 over the surviving values and a fence of {@code IQR ×
 * shrink^pass}, so the test grows stricter with every pass. A value is flagged only when it lies
 * outside {@code [Q1 - fence, Q3 + fence]} and its distance to the nearer quartile also exceeds the
 * metric's absolute range threshold; tightly clustered batches therefore never lose channels to
 * noise. Flagged values are removed and the pass repeats until nothing new is flagged or the
 * iteration cap is reached.
 *
 * <p>Guarantees:
 *
 * <ul>
 *   <li>the surviving set never grows from one pass to the next
 *   <li>at most {@code maxIterations} passes run
 *   <li>with two or fewer surviving values nothing further is flagged
 * </ul>
 */
@Component
public class BoxplotOutlierDetector implements OutlierDetector {

  private static final Logger logger = LoggerFactory.getLogger(BoxplotOutlierDetector.class);

  /** Quartiles need at least this many values to mean anything. */
  private static final int MIN_VALUES_FOR_QUARTILES = 3;

  private static final double LOWER_QUARTILE = 25.0;
  private static final double UPPER_QUARTILE = 75.0;

  @Override
  public DetectionResult detect(
      MetricName metric, double[] values, OutlierDetectionSettings settings) {
    BoxplotParameters parameters =
        settings
            .boxplotParameters()
            .orElseThrow(
                () ->
                    new ConfigurationConflictException(
                        "Boxplot detection requested but " + settings.method() + " is active"));
    double rangeThreshold =
        settings
            .thresholdFor(metric)
            .orElseThrow(
                () -> new IllegalArgumentException("Metric not tracked by boxplot: " + metric));

    List<Integer> surviving = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      surviving.add(i);
    }
    List<Integer> survivorTrace = new ArrayList<>();
    survivorTrace.add(surviving.size());
    Map<Integer, Double> scores = new HashMap<>();
    int pass = 0;

    while (pass < settings.maxIterations()) {
      if (surviving.size() < MIN_VALUES_FOR_QUARTILES) {
        logger.debug("{}: {} surviving values, too few for quartiles", metric, surviving.size());
        break;
      }
      double[] current = surviving.stream().mapToDouble(i -> values[i]).toArray();
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (double value : current) {
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
      if (max - min <= rangeThreshold) {
        logger.debug(
            "{}: range {} within threshold {}, stopping", metric, max - min, rangeThreshold);
        break;
      }

      pass++;
      double q1 = RobustStatistics.quantile(current, LOWER_QUARTILE);
      double q3 = RobustStatistics.quantile(current, UPPER_QUARTILE);
      double fence = (q3 - q1) * Math.pow(parameters.shrinkFactor(), pass);
      double lowerBound = q1 - fence;
      double upperBound = q3 + fence;

      List<Integer> flagged = new ArrayList<>();
      for (int index : surviving) {
        double value = values[index];
        if (value < lowerBound && q1 - value > rangeThreshold) {
          flagged.add(index);
          scores.put(index, q1 - value);
        } else if (value > upperBound && value - q3 > rangeThreshold) {
          flagged.add(index);
          scores.put(index, value - q3);
        }
      }
      logger.debug(
          "{} pass {}: Q1={}, Q3={}, bounds=[{}, {}], flagged {}",
          metric, pass, q1, q3, lowerBound, upperBound, flagged.size());

      surviving.removeAll(flagged);
      survivorTrace.add(surviving.size());
      if (flagged.isEmpty()) {
        break;
      }
    }

    return new DetectionResult(scores, pass, survivorTrace);
  }

  @Override
  public OutlierMethod getMethod() {
    return OutlierMethod.BOXPLOT;
  }
}
