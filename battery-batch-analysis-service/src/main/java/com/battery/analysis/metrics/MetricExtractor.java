package com.battery.analysis.metrics;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.config.properties.MetricExtractionProperties;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.CycleRecord;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;

/**
 * Reduces a channel's cycle series to its summary metrics.
 *
 * <p>First-cycle metrics come straight from the first record. Retention metrics are measured
 * against the channel's 1C cycle as located by {@link OneCCycleLocator}; the target retention
 * counts the 1C cycle as cycle 1. Metrics whose inputs are missing are left out of the vector.
 */
@Component
public class MetricExtractor {

  private static final Logger logger = LoggerFactory.getLogger(MetricExtractor.class);

  private static final int CYCLE_4 = 4;
  private static final double PERCENT = 100.0;
  private static final double MILLIVOLTS_PER_VOLT = 1000.0;

  private final OneCCycleLocator oneCCycleLocator;

  public MetricExtractor(OneCCycleLocator oneCCycleLocator) {
    this.oneCCycleLocator = oneCCycleLocator;
  }

  /** Whether the channel has enough cycles to take part in the analysis. */
  public boolean isEligible(ChannelSeries series, MetricExtractionProperties properties) {
    return series.cycleCount() >= properties.minCyclesRequired();
  }

  /**
   * Extracts the metric vector of a channel.
   *
   * @param series channel series with at least one cycle
   * @param properties extraction settings
   * @return the channel's metrics
   */
  public MetricVector extract(ChannelSeries series, MetricExtractionProperties properties) {
    CycleRecord first =
        series
            .first()
            .orElseThrow(
                () -> new IllegalArgumentException("Channel " + series.channelId() + " has no cycles"));
    Map<MetricName, Double> values = new EnumMap<>(MetricName.class);

    values.put(MetricName.FIRST_CHARGE, first.chargeCapacity());
    values.put(MetricName.FIRST_DISCHARGE, first.dischargeCapacity());
    values.put(MetricName.FIRST_EFFICIENCY, first.resolvedEfficiency());
    values.put(MetricName.FIRST_VOLTAGE, first.voltage());
    values.put(MetricName.FIRST_ENERGY, first.energy());
    values.put(MetricName.FIRST_CHARGE_END_VOLTAGE, first.chargeEndVoltage());
    values.put(MetricName.CYCLE_COUNT, (double) series.cycleCount());

    series
        .cycle(CYCLE_4)
        .ifPresent(
            cycle4 -> {
              values.put(MetricName.CYCLE4_DISCHARGE, cycle4.dischargeCapacity());
              values.put(
                  MetricName.CYCLE4_RETENTION,
                  percent(cycle4.dischargeCapacity(), first.dischargeCapacity()));
              values.put(
                  MetricName.CYCLE4_DISCHARGE_DROP,
                  difference(first.dischargeCapacity(), cycle4.dischargeCapacity()));
            });

    OneCCycle oneC = oneCCycleLocator.locate(series, properties);
    CycleRecord baseline = series.cycle(oneC.cycleIndex()).orElseThrow();
    values.put(MetricName.ONE_C_CYCLE, (double) oneC.cycleIndex());
    values.put(MetricName.ONE_C_CHARGE, baseline.chargeCapacity());
    values.put(MetricName.ONE_C_DISCHARGE, baseline.dischargeCapacity());
    values.put(MetricName.ONE_C_EFFICIENCY, baseline.resolvedEfficiency());
    values.put(
        MetricName.ONE_C_RATE_RATIO,
        percent(baseline.dischargeCapacity(), first.dischargeCapacity()));

    int targetIndex = oneC.cycleIndex() + properties.targetCycle() - 1;
    series
        .cycle(targetIndex)
        .ifPresent(
            target ->
                values.put(
                    MetricName.TARGET_RETENTION,
                    percent(target.dischargeCapacity(), baseline.dischargeCapacity())));

    CycleRecord last = series.last().orElseThrow();
    values.put(
        MetricName.CURRENT_RETENTION,
        percent(last.dischargeCapacity(), baseline.dischargeCapacity()));
    values.put(MetricName.CURRENT_VOLTAGE_RETENTION, percent(last.voltage(), baseline.voltage()));
    values.put(MetricName.CURRENT_ENERGY_RETENTION, percent(last.energy(), baseline.energy()));
    values.put(MetricName.VOLTAGE_DECAY_RATE, voltageDecayRate(baseline, last));

    logger.debug(
        "Channel {}: baseline cycle {} located by {}, {} cycles",
        series.channelId(), oneC.cycleIndex(), oneC.method(), series.cycleCount());
    return new MetricVector(series.channelId(), values);
  }

  /** Voltage lost per cycle between the baseline and the last cycle, in mV/cycle. */
  private static Double voltageDecayRate(CycleRecord baseline, CycleRecord last) {
    int span = last.cycleIndex() - baseline.cycleIndex();
    if (span <= 0 || baseline.voltage() == null || last.voltage() == null) {
      return null;
    }
    return (baseline.voltage() - last.voltage()) * MILLIVOLTS_PER_VOLT / span;
  }

  private static Double percent(Double numerator, Double denominator) {
    if (numerator == null || denominator == null || denominator <= 0) {
      return null;
    }
    return numerator / denominator * PERCENT;
  }

  private static Double difference(Double minuend, Double subtrahend) {
    if (minuend == null || subtrahend == null) {
      return null;
    }
    return minuend - subtrahend;
  }
}
