package com.battery.analysis.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Batch-level statistics over the channels that survived outlier detection.
 *
 * @param channelCount number of summarised channels
 * @param validFirstCycleCount channels with positive first charge, discharge and efficiency
 * @param validOneCCount channels with a determinable 1C status
 * @param means mean of each metric over the channels reporting it; 1C metrics are averaged over
 *     the channels counted in {@code validOneCCount} only
 * @param mostCommonOneCStatus most frequent 1C status, null when no channel has one
 */
public record BatchSummary(
    int channelCount,
    int validFirstCycleCount,
    int validOneCCount,
    Map<MetricName, Double> means,
    OneCStatus mostCommonOneCStatus) {

  public BatchSummary {
    EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
    if (means != null) {
      copy.putAll(means);
    }
    means = Collections.unmodifiableMap(copy);
  }

  public static BatchSummary empty() {
    return new BatchSummary(0, 0, 0, Map.of(), null);
  }

  public OptionalDouble mean(MetricName name) {
    Double value = means.get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public Optional<OneCStatus> oneCStatus() {
    return Optional.ofNullable(mostCommonOneCStatus);
  }
}
