package com.battery.analysis.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.battery.analysis.algorithm.OutlierMethod;

/**
 * Outcome of outlier detection for one channel.
 *
 * @param channelId channel the verdict belongs to
 * @param outlier whether the channel is excluded from summary reporting
 * @param triggeringMetrics metrics that flagged the channel, in detection order
 * @param method detection method that produced the verdict
 * @param scores decisive score per triggering metric
 */
public record OutlierVerdict(
    String channelId,
    boolean outlier,
    List<MetricName> triggeringMetrics,
    OutlierMethod method,
    Map<MetricName, Double> scores) {

  public OutlierVerdict {
    triggeringMetrics = List.copyOf(triggeringMetrics);
    EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
    copy.putAll(scores);
    scores = Collections.unmodifiableMap(copy);
  }

  public static OutlierVerdict clean(String channelId, OutlierMethod method) {
    return new OutlierVerdict(channelId, false, List.of(), method, Map.of());
  }
}
