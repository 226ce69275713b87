package com.battery.analysis.algorithm.selection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.battery.analysis.AnalysisTestFixtures;
import com.battery.analysis.config.AnalysisSettings;
import com.battery.analysis.dto.AnalysisDiagnostic;
import com.battery.analysis.dto.BatchGroup;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.ReferenceSelection;

@DisplayName("PCA Reference Strategy Tests")
class PcaReferenceStrategyTest {

  private static final double DELTA = 1e-6;

  private PcaReferenceStrategy strategy;
  private List<AnalysisDiagnostic> diagnostics;
  private AnalysisSettings settings;

  @BeforeEach
  void setUp() {
    strategy = new PcaReferenceStrategy();
    diagnostics = new ArrayList<>();
    settings = AnalysisTestFixtures.defaultSettings();
  }

  /** Builds a context whose channels carry the given first discharge, first voltage and cycle 4 discharge. */
  private ReferenceSelectionContext context(double[][] features) {
    List<ChannelSeries> channels = new ArrayList<>();
    Map<String, MetricVector> metrics = new LinkedHashMap<>();
    for (int i = 0; i < features.length; i++) {
      String id = "CH" + (i + 1);
      channels.add(AnalysisTestFixtures.channel(id, 200, 199));
      Map<MetricName, Double> values = new LinkedHashMap<>();
      values.put(MetricName.FIRST_DISCHARGE, features[i][0]);
      values.put(MetricName.FIRST_VOLTAGE, features[i][1]);
      values.put(MetricName.CYCLE4_DISCHARGE, features[i][2]);
      metrics.put(id, new MetricVector(id, values));
    }
    return new ReferenceSelectionContext(
        new BatchGroup("BATCH-1", channels), metrics, settings, diagnostics);
  }

  @Test
  @DisplayName("should identify itself as pca")
  void shouldReturnPcaMethod() {
    assertThat(strategy.getMethod()).isEqualTo(ReferenceMethod.PCA);
  }

  @Nested
  @DisplayName("Selection")
  class Selection {

    @Test
    @DisplayName("should select the channel at the centroid")
    void shouldSelectCentralChannel() {
      // Given
      double[][] features = {
        {200, 3.60, 190},
        {205, 3.65, 195},
        {210, 3.70, 200},
        {215, 3.75, 205},
        {220, 3.80, 210}
      };

      // When
      Optional<ReferenceSelection> selection = strategy.select(context(features));

      // Then
      assertThat(selection).isPresent();
      assertThat(selection.get().channelId()).isEqualTo("CH3");
      assertThat(selection.get().method()).isEqualTo(ReferenceMethod.PCA);
      assertThat(selection.get().score()).isCloseTo(0.0, within(DELTA));
      assertThat(selection.get().rationale()).contains("explained variance");
    }

    @Test
    @DisplayName("should fill a missing feature value with the feature median")
    void shouldFillMissingValues() {
      // Given: CH2 reports no voltage
      double[][] features = {
        {200, 3.60, 190},
        {205, Double.NaN, 195},
        {210, 3.70, 200},
        {215, 3.75, 205},
        {220, 3.80, 210}
      };

      // When
      Optional<ReferenceSelection> selection = strategy.select(context(features));

      // Then
      assertThat(selection).isPresent();
      assertThat(diagnostics).isEmpty();
    }

    @Test
    @DisplayName("should name distant channels in the rationale without excluding them")
    void shouldNameDistantChannels() {
      // Given: CH6 sits far from the rest and outside one standard deviation
      settings =
          settings.withPca(AnalysisTestFixtures.pcaProperties().toBuilder().outlierSigma(1.0).build());
      double[][] features = {
        {210, 3.70, 200},
        {211, 3.71, 201},
        {209, 3.69, 199},
        {210, 3.71, 200},
        {210, 3.69, 201},
        {260, 3.20, 150}
      };

      // When
      Optional<ReferenceSelection> selection = strategy.select(context(features));

      // Then
      assertThat(selection).isPresent();
      assertThat(selection.get().channelId()).isNotEqualTo("CH6");
      assertThat(selection.get().rationale()).contains("distant channels [CH6]");
    }
  }

  @Nested
  @DisplayName("Preconditions")
  class Preconditions {

    @Test
    @DisplayName("should decline with fewer channels than the minimum")
    void shouldDeclineWithTooFewChannels() {
      Optional<ReferenceSelection> selection =
          strategy.select(context(new double[][] {{200, 3.6, 190}, {210, 3.7, 200}}));

      assertThat(selection).isEmpty();
      assertThat(diagnostics)
          .extracting(AnalysisDiagnostic::kind)
          .containsExactly(DiagnosticKind.STRATEGY_SKIPPED);
    }

    @Test
    @DisplayName("should decline when disabled")
    void shouldDeclineWhenDisabled() {
      settings = settings.withPca(AnalysisTestFixtures.pcaProperties().toBuilder().enabled(false).build());

      Optional<ReferenceSelection> selection =
          strategy.select(
              context(new double[][] {{200, 3.6, 190}, {205, 3.65, 195}, {210, 3.7, 200}}));

      assertThat(selection).isEmpty();
      assertThat(diagnostics.get(0).message()).contains("disabled");
    }

    @Test
    @DisplayName("should decline when fewer than two features are reported")
    void shouldDeclineWithOneFeature() {
      double nan = Double.NaN;

      Optional<ReferenceSelection> selection =
          strategy.select(context(new double[][] {{200, nan, nan}, {205, nan, nan}, {210, nan, nan}}));

      assertThat(selection).isEmpty();
      assertThat(diagnostics.get(0).kind()).isEqualTo(DiagnosticKind.STRATEGY_SKIPPED);
    }

    @Test
    @DisplayName("should report a numerical failure when no feature varies")
    void shouldReportDegenerateFeatures() {
      Optional<ReferenceSelection> selection =
          strategy.select(
              context(new double[][] {{210, 3.7, 200}, {210, 3.7, 200}, {210, 3.7, 200}}));

      assertThat(selection).isEmpty();
      assertThat(diagnostics)
          .extracting(AnalysisDiagnostic::kind)
          .containsExactly(DiagnosticKind.NUMERICAL_FAILURE);
    }
  }

  @Test
  @DisplayName("should reject standardisation of constant columns")
  void shouldRejectConstantColumns() {
    List<double[]> columns = List.of(new double[] {1, 1, 1}, new double[] {2, 2, 2});

    assertThatThrownBy(() -> PcaReferenceStrategy.standardise(columns, 3))
        .isInstanceOf(MathIllegalStateException.class);
  }
}
