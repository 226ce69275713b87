package com.battery.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Battery Batch Analysis Service.
 *
 * <p>The service hosts the analysis core of the battery cycling data pipeline. Ingestion
 * collaborators hand it per-channel cycle records grouped by sample batch; it returns, per batch,
 * which channels are statistical outliers, which channel best represents the batch and the risk
 * tiers of every channel. Reporting collaborators consume those results.
 *
 * <p><strong>Key Responsibilities:</strong>
 *
 * <ul>
 *   <li>Extracts first-cycle, 1C and retention metrics from each channel
 *   <li>Flags outlier channels with the iterative boxplot or the median/MAD z-score method
 *   <li>Selects the reference channel by retention-curve MSE, PCA or the nearest-to-mean rule
 *   <li>Classifies overcharge, efficiency and capacity-decay risks per channel
 * </ul>
 *
 * @author Battery Analysis Team
 * @version 1.0
 * @since 2024
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.battery.analysis.config.properties")
public class BatteryBatchAnalysisApplication {

  public static void main(String[] args) {
    SpringApplication.run(BatteryBatchAnalysisApplication.class, args);
  }
}
