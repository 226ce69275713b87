package com.battery.analysis.algorithm.selection;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.algorithm.retention.CycleWeightCalculator;
import com.battery.analysis.algorithm.retention.RetentionCurve;
import com.battery.analysis.algorithm.retention.RetentionCurveBuilder;
import com.battery.analysis.algorithm.retention.RetentionCurveSet;
import com.battery.analysis.config.properties.CapacityRetentionProperties;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.ReferenceSelection;

/**
 * Selects the channel whose retention curves are closest to the batch-mean curves.
 *
 * <p>For every candidate the weighted MSE against the mean curve is computed per component and
 * the components are combined as {@code capacityWeight·capacity + voltageWeight·voltage +
 * energyWeight·energy}, with the weights applied as configured. Voltage and energy only contribute
 * when enabled and available for every curve. The lowest combined score wins; ties go to the
 * earlier channel.
 *
 * <p>Preconditions: retention selection enabled, at least {@code minChannels} candidates and a
 * curve set of at least {@code minChannels} curves on a grid of at least {@code minCycles} points.
 */
@Component
public class RetentionCurveMseStrategy implements ReferenceChannelStrategy {

  private static final Logger logger = LoggerFactory.getLogger(RetentionCurveMseStrategy.class);

  private final RetentionCurveBuilder curveBuilder;

  public RetentionCurveMseStrategy(RetentionCurveBuilder curveBuilder) {
    this.curveBuilder = curveBuilder;
  }

  @Override
  public Optional<ReferenceSelection> select(ReferenceSelectionContext context) {
    CapacityRetentionProperties properties = context.settings().capacityRetention();
    if (!properties.enabled()) {
      context.report(DiagnosticKind.STRATEGY_SKIPPED, "Retention curve selection disabled");
      return Optional.empty();
    }
    if (context.size() < properties.minChannels()) {
      context.report(
          DiagnosticKind.STRATEGY_SKIPPED,
          "Retention curve selection needs %d channels, %d available",
          properties.minChannels(),
          context.size());
      return Optional.empty();
    }

    RetentionCurveSet curves =
        curveBuilder.build(context.channels(), baselineCycles(context), properties);
    if (curves.size() < properties.minChannels()) {
      context.report(
          DiagnosticKind.STRATEGY_SKIPPED,
          "Retention curve selection lacks usable curves (%d built)",
          curves.size());
      return Optional.empty();
    }

    Map<String, Double> scores = score(curves, properties);
    String bestId = null;
    double bestScore = Double.POSITIVE_INFINITY;
    for (Map.Entry<String, Double> entry : scores.entrySet()) {
      if (entry.getValue() < bestScore) {
        bestScore = entry.getValue();
        bestId = entry.getKey();
      }
    }
    logger.debug("Retention MSE scores for batch {}: {}", context.candidates().batchKey(), scores);

    String rationale =
        String.format(
            "Weighted retention MSE %.4f against batch mean over %d grid points "
                + "(%s weights, late emphasis %.2f)",
            bestScore,
            curves.gridSize(),
            properties.useWeightedMse() ? properties.weightMethod() : "uniform",
            properties.useWeightedMse() ? properties.lateCyclesEmphasis() : 1.0);
    return Optional.of(new ReferenceSelection(bestId, getMethod(), bestScore, rationale));
  }

  /**
   * Combined weighted MSE of every curve against the mean curve.
   *
   * @param curves curve set with at least one curve
   * @param properties weighting settings
   * @return score per channel id in curve order
   */
  public Map<String, Double> score(RetentionCurveSet curves, CapacityRetentionProperties properties) {
    int points = curves.gridSize();
    double[] weights =
        properties.useWeightedMse()
            ? CycleWeightCalculator.weights(
                points,
                properties.weightMethod(),
                properties.weightFactor(),
                properties.lateCyclesEmphasis())
            : CycleWeightCalculator.uniform(points);

    List<RetentionCurve> list = curves.curves();
    boolean useVoltage = properties.includeVoltage() && curves.allHaveVoltage();
    boolean useEnergy = properties.includeEnergy() && curves.allHaveEnergy();
    double[] meanCapacity = meanCurve(list, RetentionCurve::capacity, points);
    double[] meanVoltage = useVoltage ? meanCurve(list, RetentionCurve::voltage, points) : null;
    double[] meanEnergy = useEnergy ? meanCurve(list, RetentionCurve::energy, points) : null;

    Map<String, Double> scores = new LinkedHashMap<>();
    for (RetentionCurve curve : list) {
      double combined =
          properties.capacityWeight() * weightedMse(curve.capacity(), meanCapacity, weights);
      if (useVoltage) {
        combined += properties.voltageWeight() * weightedMse(curve.voltage(), meanVoltage, weights);
      }
      if (useEnergy) {
        combined += properties.energyWeight() * weightedMse(curve.energy(), meanEnergy, weights);
      }
      scores.put(curve.channelId(), combined);
    }
    return scores;
  }

  /** Weighted mean squared error, normalised by the weight sum. */
  public static double weightedMse(double[] values, double[] reference, double[] weights) {
    double weighted = 0.0;
    double weightSum = 0.0;
    for (int j = 0; j < values.length; j++) {
      double diff = values[j] - reference[j];
      weighted += weights[j] * diff * diff;
      weightSum += weights[j];
    }
    return weightSum == 0.0 ? 0.0 : weighted / weightSum;
  }

  private static double[] meanCurve(
      List<RetentionCurve> curves, Function<RetentionCurve, double[]> component, int points) {
    double[] mean = new double[points];
    for (RetentionCurve curve : curves) {
      double[] values = component.apply(curve);
      for (int j = 0; j < points; j++) {
        mean[j] += values[j];
      }
    }
    for (int j = 0; j < points; j++) {
      mean[j] /= curves.size();
    }
    return mean;
  }

  private static Map<String, Integer> baselineCycles(ReferenceSelectionContext context) {
    Map<String, Integer> baselines = new HashMap<>();
    for (ChannelSeries series : context.channels()) {
      OptionalDouble oneC = context.metricsOf(series.channelId()).value(MetricName.ONE_C_CYCLE);
      if (oneC.isPresent()) {
        baselines.put(series.channelId(), (int) oneC.getAsDouble());
      } else {
        series.first().ifPresent(first -> baselines.put(series.channelId(), first.cycleIndex()));
      }
    }
    return baselines;
  }

  @Override
  public ReferenceMethod getMethod() {
    return ReferenceMethod.RETENTION_CURVE_MSE;
  }
}
