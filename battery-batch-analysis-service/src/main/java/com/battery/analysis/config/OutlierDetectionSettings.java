package com.battery.analysis.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.battery.analysis.algorithm.OutlierMethod;
import com.battery.analysis.config.properties.OutlierDetectionProperties;
import com.battery.analysis.config.properties.OutlierDetectionProperties.BoxplotProperties;
import com.battery.analysis.config.properties.OutlierDetectionProperties.ZScoreMadProperties;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.exception.ConfigurationConflictException;

/**
 * Immutable outlier detection configuration holding the parameters of exactly one method.
 *
 * <p>Instances are created through {@link #boxplot}, {@link #zScoreMad} or {@link #from}; the
 * parameters of the inactive method never exist, so a run cannot mix the two detectors.
 */
public final class OutlierDetectionSettings {

  private final OutlierMethod method;
  private final int maxIterations;
  private final double problemBatchRatio;
  private final BoxplotParameters boxplot;
  private final ZScoreMadParameters zScoreMad;

  private OutlierDetectionSettings(
      OutlierMethod method,
      int maxIterations,
      double problemBatchRatio,
      BoxplotParameters boxplot,
      ZScoreMadParameters zScoreMad) {
    if (maxIterations < 1) {
      throw new ConfigurationConflictException("Max iterations must be at least 1");
    }
    this.method = method;
    this.maxIterations = maxIterations;
    this.problemBatchRatio = problemBatchRatio;
    this.boxplot = boxplot;
    this.zScoreMad = zScoreMad;
  }

  public static OutlierDetectionSettings boxplot(
      int maxIterations, double problemBatchRatio, BoxplotParameters parameters) {
    if (parameters == null) {
      throw new ConfigurationConflictException("Boxplot parameters are required");
    }
    return new OutlierDetectionSettings(
        OutlierMethod.BOXPLOT, maxIterations, problemBatchRatio, parameters, null);
  }

  public static OutlierDetectionSettings zScoreMad(
      int maxIterations, double problemBatchRatio, ZScoreMadParameters parameters) {
    if (parameters == null) {
      throw new ConfigurationConflictException("Z-score/MAD parameters are required");
    }
    return new OutlierDetectionSettings(
        OutlierMethod.ZSCORE_MAD, maxIterations, problemBatchRatio, null, parameters);
  }

  /**
   * Builds settings from bound properties, rejecting conflicting or incomplete combinations.
   *
   * @param properties bound outlier detection properties
   * @return settings for the selected method
   * @throws ConfigurationConflictException if both methods are requested or the selected method
   *     lacks required parameters
   */
  public static OutlierDetectionSettings from(OutlierDetectionProperties properties) {
    if (properties == null || properties.method() == null) {
      throw new ConfigurationConflictException("An outlier detection method must be selected");
    }
    BoxplotProperties boxplotProps = properties.boxplot();
    ZScoreMadProperties zscoreProps = properties.zscoreMad();
    boolean boxplotRequested = boxplotProps != null && Boolean.TRUE.equals(boxplotProps.useMethod());
    boolean zscoreRequested = zscoreProps != null && Boolean.TRUE.equals(zscoreProps.enabled());

    switch (properties.method()) {
      case BOXPLOT:
        if (zscoreRequested) {
          throw new ConfigurationConflictException(
              "Outlier method is boxplot but zscore-mad.enabled is also set");
        }
        return boxplot(
            properties.maxIterations(), properties.problemBatchRatio(), toBoxplot(boxplotProps));
      case ZSCORE_MAD:
        if (boxplotRequested) {
          throw new ConfigurationConflictException(
              "Outlier method is zscore-mad but boxplot.use-method is also set");
        }
        return zScoreMad(
            properties.maxIterations(), properties.problemBatchRatio(), toZScoreMad(zscoreProps));
      default:
        throw new ConfigurationConflictException("Unsupported outlier method " + properties.method());
    }
  }

  private static BoxplotParameters toBoxplot(BoxplotProperties props) {
    if (props == null) {
      throw new ConfigurationConflictException("Boxplot method selected without boxplot section");
    }
    requireValue(props.shrinkFactor(), "boxplot.shrink-factor");
    requireValue(props.dischargeRangeThreshold(), "boxplot.discharge-range-threshold");
    requireValue(props.efficiencyRangeThreshold(), "boxplot.efficiency-range-threshold");
    return new BoxplotParameters(
        props.shrinkFactor(), props.dischargeRangeThreshold(), props.efficiencyRangeThreshold());
  }

  private static ZScoreMadParameters toZScoreMad(ZScoreMadProperties props) {
    if (props == null) {
      throw new ConfigurationConflictException("Z-score/MAD method selected without zscore-mad section");
    }
    requireValue(props.madConstant(), "zscore-mad.mad-constant");
    requireValue(props.minMadRatio(), "zscore-mad.min-mad-ratio");
    requireValue(props.dischargeThreshold(), "zscore-mad.discharge-threshold");
    requireValue(props.efficiencyThreshold(), "zscore-mad.efficiency-threshold");
    requireValue(props.voltageThreshold(), "zscore-mad.voltage-threshold");
    requireValue(props.energyThreshold(), "zscore-mad.energy-threshold");
    boolean useTimeSeries = Boolean.TRUE.equals(props.useTimeSeries());
    if (useTimeSeries) {
      requireValue(props.minSamplesForStl(), "zscore-mad.min-samples-for-stl");
      requireValue(props.trendBandwidth(), "zscore-mad.trend-bandwidth");
    }
    return new ZScoreMadParameters(
        props.madConstant(),
        props.minMadRatio(),
        props.dischargeThreshold(),
        props.efficiencyThreshold(),
        props.voltageThreshold(),
        props.energyThreshold(),
        useTimeSeries,
        props.minSamplesForStl() == null ? Integer.MAX_VALUE : props.minSamplesForStl(),
        props.seasonalPeriod() == null ? 0 : props.seasonalPeriod(),
        props.trendBandwidth() == null ? 0.5 : props.trendBandwidth());
  }

  private static void requireValue(Object value, String property) {
    if (value == null) {
      throw new ConfigurationConflictException("Missing required property analysis.outlier." + property);
    }
  }

  public OutlierMethod method() {
    return method;
  }

  public int maxIterations() {
    return maxIterations;
  }

  public double problemBatchRatio() {
    return problemBatchRatio;
  }

  public Optional<BoxplotParameters> boxplotParameters() {
    return Optional.ofNullable(boxplot);
  }

  public Optional<ZScoreMadParameters> zScoreMadParameters() {
    return Optional.ofNullable(zScoreMad);
  }

  /**
   * Metrics checked by the active method with their threshold: the absolute range threshold for
   * boxplot, the z threshold for z-score/MAD.
   */
  public Map<MetricName, Double> trackedMetrics() {
    Map<MetricName, Double> tracked = new LinkedHashMap<>();
    if (method == OutlierMethod.BOXPLOT) {
      tracked.put(MetricName.FIRST_DISCHARGE, boxplot.dischargeRangeThreshold());
      tracked.put(MetricName.FIRST_EFFICIENCY, boxplot.efficiencyRangeThreshold());
    } else {
      tracked.put(MetricName.FIRST_DISCHARGE, zScoreMad.dischargeThreshold());
      tracked.put(MetricName.FIRST_EFFICIENCY, zScoreMad.efficiencyThreshold());
      tracked.put(MetricName.FIRST_VOLTAGE, zScoreMad.voltageThreshold());
      tracked.put(MetricName.FIRST_ENERGY, zScoreMad.energyThreshold());
    }
    return Collections.unmodifiableMap(tracked);
  }

  /** Threshold of the active method for a metric, if the metric is tracked. */
  public Optional<Double> thresholdFor(MetricName metric) {
    return Optional.ofNullable(trackedMetrics().get(metric));
  }

  @Override
  public String toString() {
    return "OutlierDetectionSettings{method=" + method + ", maxIterations=" + maxIterations
        + ", boxplot=" + boxplot + ", zScoreMad=" + zScoreMad + "}";
  }

  /**
   * Parameters of the iterative boxplot detector.
   *
   * @param shrinkFactor per-pass contraction of the fence, in (0, 1]
   * @param dischargeRangeThreshold absolute range threshold for first discharge
   * @param efficiencyRangeThreshold absolute range threshold for first efficiency
   */
  public record BoxplotParameters(
      double shrinkFactor, double dischargeRangeThreshold, double efficiencyRangeThreshold) {

    public BoxplotParameters {
      if (shrinkFactor <= 0 || shrinkFactor > 1) {
        throw new ConfigurationConflictException("Shrink factor must be in (0, 1], got " + shrinkFactor);
      }
    }
  }

  /**
   * Parameters of the median/MAD z-score detector.
   *
   * @param madConstant scale constant of the modified z-score
   * @param minMadRatio MAD floor as a fraction of the median absolute value
   * @param dischargeThreshold z threshold for first discharge
   * @param efficiencyThreshold z threshold for first efficiency
   * @param voltageThreshold z threshold for first voltage
   * @param energyThreshold z threshold for first energy
   * @param useTimeSeries whether long vectors are scored on their decomposition residual
   * @param minSamplesForStl minimum vector length for decomposition
   * @param seasonalPeriod period of the seasonal component, below 2 for none
   * @param trendBandwidth LOESS bandwidth of the trend component
   */
  public record ZScoreMadParameters(
      double madConstant,
      double minMadRatio,
      double dischargeThreshold,
      double efficiencyThreshold,
      double voltageThreshold,
      double energyThreshold,
      boolean useTimeSeries,
      int minSamplesForStl,
      int seasonalPeriod,
      double trendBandwidth) {}
}
