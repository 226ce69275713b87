package com.battery.analysis.algorithm.selection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.ReferenceSelection;

/**
 * Final fallback: the channel whose first-cycle discharge capacity is closest to the candidates'
 * mean. Always decides when there is at least one candidate.
 */
@Component
public class TraditionalReferenceStrategy implements ReferenceChannelStrategy {

  @Override
  public Optional<ReferenceSelection> select(ReferenceSelectionContext context) {
    List<String> ids = context.channelIds();
    if (ids.isEmpty()) {
      return Optional.empty();
    }

    List<String> withDischarge = new ArrayList<>();
    List<Double> discharges = new ArrayList<>();
    for (String id : ids) {
      OptionalDouble discharge = context.metricsOf(id).value(MetricName.FIRST_DISCHARGE);
      if (discharge.isPresent()) {
        withDischarge.add(id);
        discharges.add(discharge.getAsDouble());
      }
    }
    if (withDischarge.isEmpty()) {
      return Optional.of(
          new ReferenceSelection(
              ids.get(0), getMethod(), 0.0, "No first discharge available; first channel used"));
    }

    double mean = discharges.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    int best = 0;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < discharges.size(); i++) {
      double distance = Math.abs(discharges.get(i) - mean);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = i;
      }
    }
    String rationale =
        String.format(
            "First discharge %.2f closest to batch mean %.2f", discharges.get(best), mean);
    return Optional.of(
        new ReferenceSelection(withDischarge.get(best), getMethod(), bestDistance, rationale));
  }

  @Override
  public ReferenceMethod getMethod() {
    return ReferenceMethod.TRADITIONAL;
  }
}
