package com.battery.analysis.config;

import com.battery.analysis.config.properties.CapacityRetentionProperties;
import com.battery.analysis.config.properties.MetricExtractionProperties;
import com.battery.analysis.config.properties.PcaProperties;
import com.battery.analysis.config.properties.RiskThresholdProperties;

/**
 * Immutable configuration of one analysis run, passed explicitly into every component call.
 *
 * @param metrics metric extraction and 1C location settings
 * @param outlierDetection active outlier detection method with its parameters
 * @param capacityRetention retention-curve selection settings
 * @param pca PCA selection settings
 * @param risk risk rule thresholds
 */
public record AnalysisSettings(
    MetricExtractionProperties metrics,
    OutlierDetectionSettings outlierDetection,
    CapacityRetentionProperties capacityRetention,
    PcaProperties pca,
    RiskThresholdProperties risk) {

  public AnalysisSettings {
    if (metrics == null
        || outlierDetection == null
        || capacityRetention == null
        || pca == null
        || risk == null) {
      throw new IllegalArgumentException("All analysis setting sections are required");
    }
  }

  public AnalysisSettings withOutlierDetection(OutlierDetectionSettings replacement) {
    return new AnalysisSettings(metrics, replacement, capacityRetention, pca, risk);
  }

  public AnalysisSettings withCapacityRetention(CapacityRetentionProperties replacement) {
    return new AnalysisSettings(metrics, outlierDetection, replacement, pca, risk);
  }

  public AnalysisSettings withPca(PcaProperties replacement) {
    return new AnalysisSettings(metrics, outlierDetection, capacityRetention, replacement, risk);
  }
}
