package com.battery.analysis.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.battery.analysis.AnalysisTestFixtures;
import com.battery.analysis.config.properties.RiskThresholdProperties;
import com.battery.analysis.dto.BatchSummary;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.OneCStatus;
import com.battery.analysis.risk.RiskClassifier;

@DisplayName("Batch Summary Calculator Tests")
class BatchSummaryCalculatorTest {

  private BatchSummaryCalculator calculator;
  private RiskThresholdProperties thresholds;

  @BeforeEach
  void setUp() {
    calculator = new BatchSummaryCalculator(new RiskClassifier());
    thresholds = AnalysisTestFixtures.riskProperties();
  }

  private static MetricVector vector(String channelId, Object... metricValuePairs) {
    Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
    for (int i = 0; i < metricValuePairs.length; i += 2) {
      values.put((MetricName) metricValuePairs[i], (Double) metricValuePairs[i + 1]);
    }
    return new MetricVector(channelId, values);
  }

  @Test
  @DisplayName("should average each metric over the channels reporting it")
  void shouldSkipMissingValues() {
    // Given
    List<MetricVector> vectors =
        List.of(
            vector("CH1", MetricName.FIRST_DISCHARGE, 200.0, MetricName.FIRST_VOLTAGE, 3.6),
            vector("CH2", MetricName.FIRST_DISCHARGE, 210.0));

    // When
    BatchSummary summary = calculator.summarize(vectors, thresholds);

    // Then
    assertThat(summary.channelCount()).isEqualTo(2);
    assertThat(summary.mean(MetricName.FIRST_DISCHARGE).getAsDouble())
        .isCloseTo(205.0, within(1e-9));
    assertThat(summary.mean(MetricName.FIRST_VOLTAGE).getAsDouble()).isCloseTo(3.6, within(1e-9));
    assertThat(summary.mean(MetricName.CURRENT_RETENTION)).isEmpty();
  }

  @Test
  @DisplayName("should count only positive first charge, discharge and efficiency as valid")
  void shouldCountValidFirstCycles() {
    List<MetricVector> vectors =
        List.of(
            vector(
                "CH1",
                MetricName.FIRST_CHARGE, 230.0,
                MetricName.FIRST_DISCHARGE, 207.0,
                MetricName.FIRST_EFFICIENCY, 90.0),
            vector(
                "CH2",
                MetricName.FIRST_CHARGE, 0.0,
                MetricName.FIRST_DISCHARGE, 207.0,
                MetricName.FIRST_EFFICIENCY, 90.0),
            vector("CH3", MetricName.FIRST_DISCHARGE, 207.0));

    assertThat(calculator.summarize(vectors, thresholds).validFirstCycleCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should average 1C metrics over channels with a 1C status only")
  void shouldRestrictOneCMeans() {
    // Given: CH2 has a 1C discharge but neither 1C charge nor 1C efficiency
    List<MetricVector> vectors =
        List.of(
            vector(
                "CH1",
                MetricName.ONE_C_DISCHARGE, 200.0,
                MetricName.ONE_C_EFFICIENCY, 90.0),
            vector("CH2", MetricName.ONE_C_DISCHARGE, 100.0));

    // When
    BatchSummary summary = calculator.summarize(vectors, thresholds);

    // Then
    assertThat(summary.validOneCCount()).isEqualTo(1);
    assertThat(summary.mean(MetricName.ONE_C_DISCHARGE)).hasValue(200.0);
  }

  @Test
  @DisplayName("should pick the most common 1C status and break ties by channel order")
  void shouldPickMostCommonStatus() {
    List<MetricVector> tied =
        List.of(
            vector("CH1", MetricName.ONE_C_EFFICIENCY, 83.0),
            vector("CH2", MetricName.ONE_C_EFFICIENCY, 90.0));
    List<MetricVector> majority =
        List.of(
            vector("CH1", MetricName.ONE_C_EFFICIENCY, 83.0),
            vector("CH2", MetricName.ONE_C_EFFICIENCY, 90.0),
            vector("CH3", MetricName.ONE_C_EFFICIENCY, 91.0));

    assertThat(calculator.summarize(tied, thresholds).oneCStatus())
        .contains(OneCStatus.LOW_EFFICIENCY);
    assertThat(calculator.summarize(majority, thresholds).oneCStatus())
        .contains(OneCStatus.NORMAL);
  }

  @Test
  @DisplayName("should produce an empty summary for no channels")
  void shouldSummariseNothing() {
    BatchSummary summary = calculator.summarize(List.of(), thresholds);

    assertThat(summary).isEqualTo(BatchSummary.empty());
    assertThat(summary.oneCStatus()).isEmpty();
  }
}
