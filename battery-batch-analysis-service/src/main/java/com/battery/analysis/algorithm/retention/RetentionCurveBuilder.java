package com.battery.analysis.algorithm.retention;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.algorithm.util.CurveInterpolator;
import com.battery.analysis.config.properties.CapacityRetentionProperties;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.CycleRecord;

/**
 * Builds retention curves of several channels on a common grid.
 *
 * <p>Each channel contributes points {@code (cycle - baseline, value / baselineValue × 100)} for
 * every cycle from its baseline on. The grid runs from offset 0 in steps of {@code cycleStep} up
 * to {@code maxCycles - 1}; in dynamic range mode it stops at the shortest channel's last offset
 * so no channel is extrapolated. Channels with fewer than two capacity points are left out.
 */
@Component
public class RetentionCurveBuilder {

  private static final Logger logger = LoggerFactory.getLogger(RetentionCurveBuilder.class);

  private static final double PERCENT = 100.0;
  private static final int MIN_POINTS_PER_CURVE = 2;

  /** Raw retention samples of one channel before resampling. */
  private record ChannelSamples(
      String channelId, Samples capacity, Samples voltage, Samples energy) {}

  private record Samples(double[] offsets, double[] ratios) {

    int size() {
      return offsets.length;
    }

    double lastOffset() {
      return offsets[offsets.length - 1];
    }
  }

  /**
   * Builds the curve set.
   *
   * @param channels candidate channels in batch order
   * @param baselineCycles baseline cycle index per channel id
   * @param properties retention settings
   * @return curves on a shared grid, or an empty set when too few channels or grid points remain
   */
  public RetentionCurveSet build(
      List<ChannelSeries> channels,
      Map<String, Integer> baselineCycles,
      CapacityRetentionProperties properties) {
    int maxOffset = properties.maxCycles() - 1;
    List<ChannelSamples> samples = new ArrayList<>();

    for (ChannelSeries series : channels) {
      Integer baseline = baselineCycles.get(series.channelId());
      if (baseline == null) {
        logger.debug("Channel {} has no baseline cycle, skipping curve", series.channelId());
        continue;
      }
      CycleRecord baselineRecord = series.cycle(baseline).orElse(null);
      if (baselineRecord == null) {
        logger.debug("Channel {} lacks baseline cycle {}", series.channelId(), baseline);
        continue;
      }
      Samples capacity =
          collect(series, baseline, maxOffset, baselineRecord.dischargeCapacity(), Quantity.CAPACITY);
      if (capacity.size() < MIN_POINTS_PER_CURVE) {
        logger.debug("Channel {} has too few capacity points for a curve", series.channelId());
        continue;
      }
      Samples voltage =
          properties.includeVoltage()
              ? collect(series, baseline, maxOffset, baselineRecord.voltage(), Quantity.VOLTAGE)
              : null;
      Samples energy =
          properties.includeEnergy()
              ? collect(series, baseline, maxOffset, baselineRecord.energy(), Quantity.ENERGY)
              : null;
      samples.add(new ChannelSamples(series.channelId(), capacity, voltage, energy));
    }

    if (samples.size() < properties.minChannels()) {
      logger.debug(
          "Only {} channels have retention curves, {} required",
          samples.size(), properties.minChannels());
      return RetentionCurveSet.empty();
    }

    double lastOffset = maxOffset;
    if (properties.dynamicRange()) {
      for (ChannelSamples channel : samples) {
        lastOffset = Math.min(lastOffset, channel.capacity().lastOffset());
      }
    }
    double[] grid = grid(lastOffset, properties.cycleStep());
    if (grid.length < properties.minCycles()) {
      logger.debug(
          "Retention grid has {} points, {} required", grid.length, properties.minCycles());
      return RetentionCurveSet.empty();
    }

    List<RetentionCurve> curves = new ArrayList<>();
    for (ChannelSamples channel : samples) {
      curves.add(
          new RetentionCurve(
              channel.channelId(),
              resample(channel.capacity(), grid, properties),
              resample(channel.voltage(), grid, properties),
              resample(channel.energy(), grid, properties)));
    }
    logger.debug("Built {} retention curves over {} grid points", curves.size(), grid.length);
    return new RetentionCurveSet(grid, curves);
  }

  private enum Quantity {
    CAPACITY,
    VOLTAGE,
    ENERGY
  }

  private static Samples collect(
      ChannelSeries series, int baseline, int maxOffset, Double baselineValue, Quantity quantity) {
    if (baselineValue == null || baselineValue <= 0) {
      return new Samples(new double[0], new double[0]);
    }
    List<double[]> points = new ArrayList<>();
    for (CycleRecord record : series.cycles()) {
      int offset = record.cycleIndex() - baseline;
      if (offset < 0) {
        continue;
      }
      if (offset > maxOffset) {
        break;
      }
      Double value = valueOf(record, quantity);
      if (value != null && Double.isFinite(value)) {
        points.add(new double[] {offset, value / baselineValue * PERCENT});
      }
    }
    double[] offsets = new double[points.size()];
    double[] ratios = new double[points.size()];
    for (int i = 0; i < points.size(); i++) {
      offsets[i] = points.get(i)[0];
      ratios[i] = points.get(i)[1];
    }
    return new Samples(offsets, ratios);
  }

  private static Double valueOf(CycleRecord record, Quantity quantity) {
    switch (quantity) {
      case VOLTAGE:
        return record.voltage();
      case ENERGY:
        return record.energy();
      default:
        return record.dischargeCapacity();
    }
  }

  private static double[] grid(double lastOffset, int step) {
    if (lastOffset < 0) {
      return new double[0];
    }
    int points = (int) Math.floor(lastOffset / step) + 1;
    double[] grid = new double[points];
    for (int i = 0; i < points; i++) {
      grid[i] = (double) i * step;
    }
    return grid;
  }

  private static double[] resample(
      Samples samples, double[] grid, CapacityRetentionProperties properties) {
    if (samples == null || samples.size() < MIN_POINTS_PER_CURVE) {
      return null;
    }
    return CurveInterpolator.resample(
        samples.offsets(), samples.ratios(), grid, properties.interpolation());
  }
}
