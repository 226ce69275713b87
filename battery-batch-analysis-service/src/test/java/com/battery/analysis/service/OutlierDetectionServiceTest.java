package com.battery.analysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.battery.analysis.AnalysisTestFixtures;
import com.battery.analysis.algorithm.DetectionResult;
import com.battery.analysis.algorithm.OutlierDetector;
import com.battery.analysis.algorithm.OutlierMethod;
import com.battery.analysis.algorithm.impl.BoxplotOutlierDetector;
import com.battery.analysis.algorithm.impl.ZScoreMadOutlierDetector;
import com.battery.analysis.config.OutlierDetectionSettings;
import com.battery.analysis.config.OutlierDetectionSettings.BoxplotParameters;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.OutlierVerdict;
import com.battery.analysis.service.OutlierDetectionService.OutlierReport;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for merging per-metric detection into channel verdicts. The reference batch has first
 * discharges 205, 212, 400, 208 and 218 with a uniform first efficiency, so only CH3 stands out.
 */
@DisplayName("Outlier Detection Service Tests")
class OutlierDetectionServiceTest {

  private static final double[] REFERENCE_DISCHARGES = {205, 212, 400, 208, 218};

  private static List<MetricVector> vectors(double... discharges) {
    List<MetricVector> vectors = new ArrayList<>();
    for (int i = 0; i < discharges.length; i++) {
      Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
      values.put(MetricName.FIRST_DISCHARGE, discharges[i]);
      values.put(MetricName.FIRST_EFFICIENCY, AnalysisTestFixtures.NOMINAL_EFFICIENCY);
      vectors.add(new MetricVector("CH" + (i + 1), values));
    }
    return vectors;
  }

  @Nested
  @DisplayName("Real Detectors")
  class RealDetectors {

    private SimpleMeterRegistry meterRegistry;
    private OutlierDetectionService service;

    @BeforeEach
    void setUp() {
      meterRegistry = new SimpleMeterRegistry();
      service =
          new OutlierDetectionService(
              List.of(new BoxplotOutlierDetector(), new ZScoreMadOutlierDetector()), meterRegistry);
    }

    @Test
    @DisplayName("should flag the high first discharge with the boxplot method")
    void shouldFlagWithBoxplot() {
      // When
      OutlierReport report =
          service.detect(
              "BATCH-1", vectors(REFERENCE_DISCHARGES), AnalysisTestFixtures.boxplotSettings());

      // Then
      assertThat(report.outlierIds()).containsExactly("CH3");
      OutlierVerdict verdict = report.verdicts().get("CH3");
      assertThat(verdict.triggeringMetrics()).containsExactly(MetricName.FIRST_DISCHARGE);
      assertThat(verdict.method()).isEqualTo(OutlierMethod.BOXPLOT);
      assertThat(verdict.scores()).containsKey(MetricName.FIRST_DISCHARGE);
      assertThat(report.verdicts()).containsOnlyKeys("CH1", "CH2", "CH3", "CH4", "CH5");
      assertThat(report.verdicts().get("CH1"))
          .isEqualTo(OutlierVerdict.clean("CH1", OutlierMethod.BOXPLOT));
      assertThat(report.diagnostics()).isEmpty();
      assertThat(
              meterRegistry
                  .get("battery.analysis.outliers")
                  .tag("metric", "first_discharge")
                  .counter()
                  .count())
          .isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("should flag the high first discharge with the z-score method")
    void shouldFlagWithZScore() {
      OutlierReport report =
          service.detect(
              "BATCH-1", vectors(REFERENCE_DISCHARGES), AnalysisTestFixtures.zScoreSettings(false));

      assertThat(report.outlierIds()).containsExactly("CH3");
      assertThat(report.verdicts().get("CH3").method()).isEqualTo(OutlierMethod.ZSCORE_MAD);
      assertThat(report.verdicts().get("CH1").method()).isEqualTo(OutlierMethod.ZSCORE_MAD);
    }

    @Test
    @DisplayName("should map positions back to channels when some channels lack the metric")
    void shouldSkipChannelsWithoutMetric() {
      // Given: CH0 reports no first discharge
      List<MetricVector> vectors = new ArrayList<>();
      vectors.add(
          new MetricVector(
              "CH0", Map.of(MetricName.FIRST_EFFICIENCY, AnalysisTestFixtures.NOMINAL_EFFICIENCY)));
      vectors.addAll(vectors(REFERENCE_DISCHARGES));

      // When
      OutlierReport report =
          service.detect("BATCH-1", vectors, AnalysisTestFixtures.boxplotSettings());

      // Then
      assertThat(report.outlierIds()).containsExactly("CH3");
      assertThat(report.verdicts().get("CH0").outlier()).isFalse();
    }

    @Test
    @DisplayName("should give a single channel a clean verdict")
    void shouldNotCompareSingleChannel() {
      OutlierReport report =
          service.detect("BATCH-1", vectors(400), AnalysisTestFixtures.boxplotSettings());

      assertThat(report.verdicts()).hasSize(1);
      assertThat(report.outlierIds()).isEmpty();
      assertThat(report.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("should report nothing for an empty batch")
    void shouldHandleEmptyBatch() {
      OutlierReport report =
          service.detect("BATCH-1", List.of(), AnalysisTestFixtures.boxplotSettings());

      assertThat(report.verdicts()).isEmpty();
      assertThat(report.diagnostics()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Batch Diagnostics")
  class BatchDiagnostics {

    private OutlierDetector detector;
    private OutlierDetectionService service;

    @BeforeEach
    void setUp() {
      detector = mock(OutlierDetector.class);
      when(detector.getMethod()).thenReturn(OutlierMethod.BOXPLOT);
      when(detector.detect(eq(MetricName.FIRST_EFFICIENCY), any(), any()))
          .thenReturn(DetectionResult.none(5));
      service = new OutlierDetectionService(List.of(detector), new SimpleMeterRegistry());
    }

    private OutlierDetectionSettings settingsWithRatio(double ratio) {
      return OutlierDetectionSettings.boxplot(10, ratio, new BoxplotParameters(0.95, 10.0, 3.0));
    }

    private void flagDischargePositions(int... positions) {
      Map<Integer, Double> scores = new HashMap<>();
      for (int position : positions) {
        scores.put(position, 50.0);
      }
      when(detector.detect(eq(MetricName.FIRST_DISCHARGE), any(), any()))
          .thenReturn(new DetectionResult(scores, 1, List.of(5, 5 - positions.length)));
    }

    @Test
    @DisplayName("should run the detector once per tracked metric")
    void shouldRunEveryTrackedMetric() {
      flagDischargePositions();

      service.detect("BATCH-1", vectors(REFERENCE_DISCHARGES), settingsWithRatio(0.5));

      verify(detector, times(1)).detect(eq(MetricName.FIRST_DISCHARGE), any(), any());
      verify(detector, times(1)).detect(eq(MetricName.FIRST_EFFICIENCY), any(), any());
    }

    @Test
    @DisplayName("should report a problem batch above the flagged ratio")
    void shouldReportProblemBatch() {
      flagDischargePositions(0, 4);

      OutlierReport report =
          service.detect("BATCH-1", vectors(REFERENCE_DISCHARGES), settingsWithRatio(0.3));

      assertThat(report.outlierIds()).containsExactly("CH1", "CH5");
      assertThat(report.diagnostics()).hasSize(1);
      assertThat(report.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.PROBLEM_BATCH);
      assertThat(report.diagnostics().get(0).subject()).isEqualTo("BATCH-1");
    }

    @Test
    @DisplayName("should not report a problem batch at or below the flagged ratio")
    void shouldNotReportBelowRatio() {
      flagDischargePositions(0, 4);

      OutlierReport report =
          service.detect("BATCH-1", vectors(REFERENCE_DISCHARGES), settingsWithRatio(0.5));

      assertThat(report.outlierIds()).hasSize(2);
      assertThat(report.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("should report a batch in which every channel is flagged")
    void shouldReportAllChannelsFlagged() {
      flagDischargePositions(0, 1, 2, 3, 4);

      OutlierReport report =
          service.detect("BATCH-1", vectors(REFERENCE_DISCHARGES), settingsWithRatio(0.5));

      assertThat(report.diagnostics()).hasSize(1);
      assertThat(report.diagnostics().get(0).kind())
          .isEqualTo(DiagnosticKind.ALL_CHANNELS_FLAGGED);
    }

    @Test
    @DisplayName("should fail when no detector implements the active method")
    void shouldRejectUnregisteredMethod() {
      assertThatThrownBy(
              () ->
                  service.detect(
                      "BATCH-1",
                      vectors(REFERENCE_DISCHARGES),
                      AnalysisTestFixtures.zScoreSettings(false)))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  @DisplayName("should require at least one detector")
  void shouldRequireDetectors() {
    assertThatThrownBy(() -> new OutlierDetectionService(List.of(), new SimpleMeterRegistry()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
