package com.battery.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.context.SpringBootTest;

import com.battery.analysis.algorithm.OutlierMethod;
import com.battery.analysis.config.AnalysisSettings;
import com.battery.analysis.config.properties.CapacityRetentionProperties.InterpolationMethod;
import com.battery.analysis.config.properties.RuntimeProperties;
import com.battery.analysis.dto.BatchAnalysisResult;
import com.battery.analysis.dto.BatchGroup;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.exception.ConfigurationConflictException;
import com.battery.analysis.service.BatchAnalysisService;

/**
 * Context tests: binding of application.yml and rejection of conflicting outlier settings at
 * startup.
 */
@SpringBootTest
@DisplayName("Battery Batch Analysis Application Tests")
class BatteryBatchAnalysisApplicationTest {

  @Autowired private AnalysisSettings analysisSettings;

  @Autowired private RuntimeProperties runtimeProperties;

  @Autowired private BatchAnalysisService batchAnalysisService;

  @Test
  @DisplayName("should bind the default analysis settings")
  void shouldBindDefaultSettings() {
    assertThat(analysisSettings.outlierDetection().method()).isEqualTo(OutlierMethod.BOXPLOT);
    assertThat(analysisSettings.outlierDetection().maxIterations()).isEqualTo(10);
    assertThat(analysisSettings.metrics().oneCModePatterns()).containsExactly("-1C-");
    assertThat(analysisSettings.capacityRetention().interpolation())
        .isEqualTo(InterpolationMethod.LINEAR);
    assertThat(analysisSettings.pca().features())
        .containsExactly(
            MetricName.FIRST_DISCHARGE, MetricName.FIRST_VOLTAGE, MetricName.CYCLE4_DISCHARGE);
    assertThat(analysisSettings.risk().overchargeVoltageDanger()).isEqualTo(4.7);
    assertThat(runtimeProperties.batchTimeout()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  @DisplayName("should analyse a batch with the configured settings")
  void shouldAnalyseBatch() {
    BatchGroup batch =
        BatchGroup.of(
            "BATCH-1",
            AnalysisTestFixtures.channel("CH1", 205, 204, 203, 202, 201, 200, 199, 198),
            AnalysisTestFixtures.channel("CH2", 212, 211, 210, 209, 208, 207, 206, 205),
            AnalysisTestFixtures.channel("CH3", 208, 207, 206, 205, 204, 203, 202, 201));

    BatchAnalysisResult result = batchAnalysisService.analyzeBatch(batch);

    assertThat(result.outlierChannels()).isEmpty();
    assertThat(result.reference()).isPresent();
    assertThat(result.risks()).hasSize(3);
  }

  @Test
  @DisplayName("should refuse to start when both outlier methods are requested")
  void shouldRejectConflictingOutlierMethods() {
    SpringApplicationBuilder builder =
        new SpringApplicationBuilder(BatteryBatchAnalysisApplication.class)
            .web(WebApplicationType.NONE)
            .properties("analysis.outlier.method=zscore-mad");

    assertThatThrownBy(() -> builder.run())
        .hasRootCauseInstanceOf(ConfigurationConflictException.class);
  }
}
