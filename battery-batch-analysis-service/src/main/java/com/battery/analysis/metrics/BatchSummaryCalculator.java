package com.battery.analysis.metrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.config.properties.RiskThresholdProperties;
import com.battery.analysis.dto.BatchSummary;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.OneCStatus;
import com.battery.analysis.risk.RiskClassifier;

/**
 * Aggregates the metric vectors of a batch into a {@link BatchSummary}.
 *
 * <p>Callers pass the non-outlier channels only. Each mean skips channels missing the metric, and
 * a metric no channel reports has no mean. The most common 1C status breaks ties by channel order.
 */
@Component
public class BatchSummaryCalculator {

  private static final Logger logger = LoggerFactory.getLogger(BatchSummaryCalculator.class);

  private static final Set<MetricName> FIRST_CYCLE_METRICS =
      EnumSet.of(
          MetricName.FIRST_CHARGE,
          MetricName.FIRST_DISCHARGE,
          MetricName.FIRST_EFFICIENCY,
          MetricName.FIRST_VOLTAGE,
          MetricName.FIRST_ENERGY,
          MetricName.CYCLE4_DISCHARGE);

  private static final Set<MetricName> ONE_C_METRICS =
      EnumSet.of(
          MetricName.ONE_C_CYCLE,
          MetricName.ONE_C_CHARGE,
          MetricName.ONE_C_DISCHARGE,
          MetricName.ONE_C_EFFICIENCY,
          MetricName.ONE_C_RATE_RATIO);

  private static final Set<MetricName> CURRENT_METRICS =
      EnumSet.of(
          MetricName.CYCLE_COUNT,
          MetricName.CURRENT_RETENTION,
          MetricName.CURRENT_VOLTAGE_RETENTION,
          MetricName.CURRENT_ENERGY_RETENTION,
          MetricName.VOLTAGE_DECAY_RATE);

  private final RiskClassifier riskClassifier;

  public BatchSummaryCalculator(RiskClassifier riskClassifier) {
    this.riskClassifier = riskClassifier;
  }

  public BatchSummary summarize(
      Collection<MetricVector> vectors, RiskThresholdProperties thresholds) {
    List<MetricVector> oneCValid = new ArrayList<>();
    Map<OneCStatus, Integer> statusCounts = new LinkedHashMap<>();
    int validFirstCycle = 0;
    for (MetricVector vector : vectors) {
      if (hasValidFirstCycle(vector)) {
        validFirstCycle++;
      }
      Optional<OneCStatus> status = riskClassifier.oneCStatus(vector, thresholds);
      if (status.isPresent()) {
        oneCValid.add(vector);
        statusCounts.merge(status.get(), 1, Integer::sum);
      }
    }

    Map<MetricName, Double> means = new EnumMap<>(MetricName.class);
    putMeans(means, FIRST_CYCLE_METRICS, vectors);
    putMeans(means, ONE_C_METRICS, oneCValid);
    putMeans(means, CURRENT_METRICS, vectors);

    OneCStatus mostCommon = null;
    int best = 0;
    for (Map.Entry<OneCStatus, Integer> entry : statusCounts.entrySet()) {
      if (entry.getValue() > best) {
        best = entry.getValue();
        mostCommon = entry.getKey();
      }
    }

    logger.debug(
        "Summarised {} channels: {} valid first cycles, {} with 1C status {}",
        vectors.size(), validFirstCycle, oneCValid.size(), mostCommon);
    return new BatchSummary(vectors.size(), validFirstCycle, oneCValid.size(), means, mostCommon);
  }

  private static boolean hasValidFirstCycle(MetricVector vector) {
    return isPositive(vector.value(MetricName.FIRST_CHARGE))
        && isPositive(vector.value(MetricName.FIRST_DISCHARGE))
        && isPositive(vector.value(MetricName.FIRST_EFFICIENCY));
  }

  private static boolean isPositive(OptionalDouble value) {
    return value.isPresent() && value.getAsDouble() > 0;
  }

  private static void putMeans(
      Map<MetricName, Double> means, Set<MetricName> names, Collection<MetricVector> vectors) {
    for (MetricName name : names) {
      double[] values =
          vectors.stream()
              .map(vector -> vector.value(name))
              .filter(OptionalDouble::isPresent)
              .mapToDouble(OptionalDouble::getAsDouble)
              .toArray();
      if (values.length > 0) {
        means.put(name, new Mean().evaluate(values));
      }
    }
  }
}
