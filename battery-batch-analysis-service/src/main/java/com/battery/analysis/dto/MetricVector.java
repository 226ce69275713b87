package com.battery.analysis.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Summary metrics of one channel. Metrics that could not be derived are absent rather than stored
 * as NaN.
 *
 * @param channelId channel the metrics belong to
 * @param values metric values keyed by name
 */
public record MetricVector(String channelId, Map<MetricName, Double> values) {

  public MetricVector {
    if (channelId == null) {
      throw new IllegalArgumentException("Channel id cannot be null");
    }
    EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
    if (values != null) {
      values.forEach(
          (name, value) -> {
            if (value != null && Double.isFinite(value)) {
              copy.put(name, value);
            }
          });
    }
    values = Collections.unmodifiableMap(copy);
  }

  public OptionalDouble value(MetricName name) {
    Double value = values.get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public boolean has(MetricName name) {
    return values.containsKey(name);
  }
}
