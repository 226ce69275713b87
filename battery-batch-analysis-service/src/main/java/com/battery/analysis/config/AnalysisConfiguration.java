package com.battery.analysis.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.battery.analysis.config.properties.CapacityRetentionProperties;
import com.battery.analysis.config.properties.MetricExtractionProperties;
import com.battery.analysis.config.properties.OutlierDetectionProperties;
import com.battery.analysis.config.properties.PcaProperties;
import com.battery.analysis.config.properties.RiskThresholdProperties;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Assembles the immutable run settings from the bound properties. Building the outlier detection
 * settings here makes a conflicting configuration fail the context start, before any batch runs.
 */
@Configuration
public class AnalysisConfiguration {

  private static final Logger logger = LoggerFactory.getLogger(AnalysisConfiguration.class);

  @Bean
  public OutlierDetectionSettings outlierDetectionSettings(OutlierDetectionProperties properties) {
    OutlierDetectionSettings settings = OutlierDetectionSettings.from(properties);
    logger.info("Outlier detection configured: {}", settings);
    return settings;
  }

  @Bean
  public AnalysisSettings analysisSettings(
      MetricExtractionProperties metrics,
      OutlierDetectionSettings outlierDetection,
      CapacityRetentionProperties capacityRetention,
      PcaProperties pca,
      RiskThresholdProperties risk) {
    return new AnalysisSettings(metrics, outlierDetection, capacityRetention, pca, risk);
  }

  @Bean
  @ConditionalOnMissingBean(MeterRegistry.class)
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }
}
