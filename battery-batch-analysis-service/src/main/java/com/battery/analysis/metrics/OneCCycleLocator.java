package com.battery.analysis.metrics;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.config.properties.MetricExtractionProperties;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.CycleRecord;
import com.battery.analysis.metrics.OneCCycle.LocationMethod;

/**
 * Locates the first cycle run at the 1C rate.
 *
 * <p>Channels whose test mode is a low-rate mode use their first cycle. Otherwise the first cycle
 * whose mode label contains a 1C pattern wins. Without an explicit marker, the early cycles are
 * scanned for the discharge drop that accompanies the switch to 1C: the cycle's discharge must be
 * below {@code ratioThreshold} of the first discharge and more than {@code dischargeDiffThreshold}
 * below it. When nothing matches the configured default cycle is used, clamped to the last cycle
 * available.
 */
@Component
public class OneCCycleLocator {

  private static final Logger logger = LoggerFactory.getLogger(OneCCycleLocator.class);

  public OneCCycle locate(ChannelSeries series, MetricExtractionProperties properties) {
    List<CycleRecord> cycles = series.cycles();
    if (cycles.isEmpty()) {
      throw new IllegalArgumentException("Channel " + series.channelId() + " has no cycles");
    }
    CycleRecord first = cycles.get(0);

    if (matchesAny(series.testMode(), properties.firstCycleModePatterns())) {
      return new OneCCycle(first.cycleIndex(), LocationMethod.FIRST_CYCLE);
    }

    for (CycleRecord cycle : cycles) {
      if (matchesAny(cycle.modeLabel(), properties.oneCModePatterns())) {
        return new OneCCycle(cycle.cycleIndex(), LocationMethod.MODE_PATTERN);
      }
    }

    Double firstDischarge = first.dischargeCapacity();
    if (firstDischarge != null && firstDischarge > 0) {
      int scanEnd = Math.min(properties.heuristicScanLimit(), cycles.size());
      for (int position = 1; position < scanEnd; position++) {
        Double discharge = cycles.get(position).dischargeCapacity();
        if (discharge == null) {
          continue;
        }
        double ratio = discharge / firstDischarge;
        double drop = firstDischarge - discharge;
        if (ratio < properties.ratioThreshold() && drop > properties.dischargeDiffThreshold()) {
          logger.debug(
              "Channel {}: 1C switch detected at cycle {} (ratio {}, drop {})",
              series.channelId(), cycles.get(position).cycleIndex(), ratio, drop);
          return new OneCCycle(cycles.get(position).cycleIndex(), LocationMethod.HEURISTIC);
        }
      }
    }

    int position = Math.min(properties.defaultOneCCycle(), cycles.size()) - 1;
    return new OneCCycle(cycles.get(position).cycleIndex(), LocationMethod.DEFAULT);
  }

  private static boolean matchesAny(String label, List<String> patterns) {
    if (label == null || patterns == null) {
      return false;
    }
    for (String pattern : patterns) {
      if (pattern != null && !pattern.isEmpty() && label.contains(pattern)) {
        return true;
      }
    }
    return false;
  }
}
