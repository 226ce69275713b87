package com.battery.analysis.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.battery.analysis.AnalysisTestFixtures;
import com.battery.analysis.config.properties.MetricExtractionProperties;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.CycleRecord;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.metrics.OneCCycle.LocationMethod;

/**
 * Tests for metric extraction. The reference channel runs 10 cycles: 220 and 218 at low rate, then
 * 180 at the switch to 1C on cycle 3, losing 1 per cycle afterwards; its last cycle ends at 3.6 V.
 */
@DisplayName("Metric Extractor Tests")
class MetricExtractorTest {

  private static final double DELTA = 1e-9;

  private MetricExtractor extractor;
  private MetricExtractionProperties properties;

  @BeforeEach
  void setUp() {
    extractor = new MetricExtractor(new OneCCycleLocator());
    properties = AnalysisTestFixtures.metricProperties();
  }

  private static ChannelSeries referenceChannel() {
    List<CycleRecord> cycles = new ArrayList<>();
    for (int index = 1; index <= 10; index++) {
      double discharge = index == 1 ? 220.0 : index == 2 ? 218.0 : 180.0 - (index - 3);
      CycleRecord record = AnalysisTestFixtures.cycle(index, discharge);
      if (index == 10) {
        record = record.toBuilder().voltage(3.6).build();
      }
      cycles.add(record);
    }
    return ChannelSeries.of("CH1", cycles);
  }

  @Nested
  @DisplayName("First Cycle Metrics")
  class FirstCycleMetrics {

    @Test
    @DisplayName("should take first cycle values from the first record")
    void shouldExtractFirstCycle() {
      MetricVector metrics = extractor.extract(referenceChannel(), properties);

      assertThat(metrics.channelId()).isEqualTo("CH1");
      assertThat(metrics.value(MetricName.FIRST_DISCHARGE)).hasValue(220.0);
      assertThat(metrics.value(MetricName.FIRST_CHARGE).getAsDouble())
          .isCloseTo(220.0 / 0.9, within(DELTA));
      assertThat(metrics.value(MetricName.FIRST_EFFICIENCY)).hasValue(90.0);
      assertThat(metrics.value(MetricName.FIRST_VOLTAGE)).hasValue(3.7);
      assertThat(metrics.value(MetricName.FIRST_CHARGE_END_VOLTAGE)).hasValue(4.5);
      assertThat(metrics.value(MetricName.CYCLE_COUNT)).hasValue(10.0);
    }

    @Test
    @DisplayName("should derive the efficiency from the capacities when it is not reported")
    void shouldDeriveEfficiency() {
      CycleRecord first =
          CycleRecord.builder().cycleIndex(1).chargeCapacity(250.0).dischargeCapacity(200.0).build();
      ChannelSeries series =
          ChannelSeries.of("CH1", List.of(first, AnalysisTestFixtures.cycle(2, 199.0)));

      MetricVector metrics = extractor.extract(series, properties);

      assertThat(metrics.value(MetricName.FIRST_EFFICIENCY).getAsDouble())
          .isCloseTo(80.0, within(DELTA));
      assertThat(metrics.has(MetricName.FIRST_VOLTAGE)).isFalse();
    }

    @Test
    @DisplayName("should compute cycle 4 retention and drop against the first cycle")
    void shouldExtractCycle4Metrics() {
      MetricVector metrics = extractor.extract(referenceChannel(), properties);

      assertThat(metrics.value(MetricName.CYCLE4_DISCHARGE)).hasValue(179.0);
      assertThat(metrics.value(MetricName.CYCLE4_RETENTION).getAsDouble())
          .isCloseTo(179.0 / 220.0 * 100.0, within(DELTA));
      assertThat(metrics.value(MetricName.CYCLE4_DISCHARGE_DROP)).hasValue(41.0);
    }

    @Test
    @DisplayName("should leave cycle 4 metrics out when the channel is shorter")
    void shouldOmitMissingCycle4() {
      MetricVector metrics =
          extractor.extract(AnalysisTestFixtures.channel("CH1", 210, 209, 208), properties);

      assertThat(metrics.has(MetricName.CYCLE4_DISCHARGE)).isFalse();
      assertThat(metrics.has(MetricName.CYCLE4_RETENTION)).isFalse();
    }
  }

  @Nested
  @DisplayName("1C Metrics")
  class OneCMetrics {

    @Test
    @DisplayName("should measure 1C metrics on the located cycle")
    void shouldExtractOneCMetrics() {
      MetricVector metrics = extractor.extract(referenceChannel(), properties);

      assertThat(metrics.value(MetricName.ONE_C_CYCLE)).hasValue(3.0);
      assertThat(metrics.value(MetricName.ONE_C_DISCHARGE)).hasValue(180.0);
      assertThat(metrics.value(MetricName.ONE_C_CHARGE).getAsDouble())
          .isCloseTo(200.0, within(DELTA));
      assertThat(metrics.value(MetricName.ONE_C_RATE_RATIO).getAsDouble())
          .isCloseTo(180.0 / 220.0 * 100.0, within(DELTA));
    }

    @Test
    @DisplayName("should measure current retention from the 1C cycle to the last cycle")
    void shouldExtractCurrentRetention() {
      MetricVector metrics = extractor.extract(referenceChannel(), properties);

      assertThat(metrics.value(MetricName.CURRENT_RETENTION).getAsDouble())
          .isCloseTo(173.0 / 180.0 * 100.0, within(DELTA));
      assertThat(metrics.value(MetricName.CURRENT_VOLTAGE_RETENTION).getAsDouble())
          .isCloseTo(3.6 / 3.7 * 100.0, within(DELTA));
      assertThat(metrics.value(MetricName.VOLTAGE_DECAY_RATE).getAsDouble())
          .isCloseTo(100.0 / 7.0, within(1e-6));
    }

    @Test
    @DisplayName("should count the 1C cycle as cycle 1 of the target retention")
    void shouldExtractTargetRetention() {
      MetricExtractionProperties shortTarget = properties.toBuilder().targetCycle(5).build();

      MetricVector metrics = extractor.extract(referenceChannel(), shortTarget);

      // 1C is cycle 3, so the fifth 1C cycle is cycle 7 with discharge 176
      assertThat(metrics.value(MetricName.TARGET_RETENTION).getAsDouble())
          .isCloseTo(176.0 / 180.0 * 100.0, within(DELTA));
    }

    @Test
    @DisplayName("should leave target retention out when the channel has not reached it")
    void shouldOmitUnreachedTarget() {
      MetricVector metrics = extractor.extract(referenceChannel(), properties);

      assertThat(metrics.has(MetricName.TARGET_RETENTION)).isFalse();
    }

    @Test
    @DisplayName("should use the cycle the locator returns")
    void shouldDelegateToLocator() {
      // Given
      OneCCycleLocator locator = mock(OneCCycleLocator.class);
      when(locator.locate(any(), any())).thenReturn(new OneCCycle(5, LocationMethod.DEFAULT));
      MetricExtractor delegating = new MetricExtractor(locator);

      // When
      MetricVector metrics = delegating.extract(referenceChannel(), properties);

      // Then
      assertThat(metrics.value(MetricName.ONE_C_CYCLE)).hasValue(5.0);
      assertThat(metrics.value(MetricName.ONE_C_DISCHARGE)).hasValue(178.0);
    }
  }

  @Test
  @DisplayName("should require the configured minimum number of cycles")
  void shouldCheckEligibility() {
    assertThat(extractor.isEligible(AnalysisTestFixtures.channel("CH1", 210), properties)).isFalse();
    assertThat(extractor.isEligible(AnalysisTestFixtures.channel("CH1", 210, 209), properties))
        .isTrue();
  }
}
