package com.battery.analysis.algorithm;

import com.battery.analysis.config.OutlierDetectionSettings;
import com.battery.analysis.dto.MetricName;

/**
 * Interface for detectors that flag outlying values of one metric across the channels of a batch.
 * Implementations are stateless; all tuning arrives through the settings argument.
 */
public interface OutlierDetector {

  /**
   * Flags outlying entries of a metric vector.
   *
   * @param metric metric the values belong to, used to pick per-metric thresholds
   * @param values one value per channel, in batch channel order, without missing entries
   * @param settings active detection settings
   * @return flagged positions of {@code values} with their scores
   */
  DetectionResult detect(MetricName metric, double[] values, OutlierDetectionSettings settings);

  /**
   * Returns the method this detector implements.
   *
   * @return detection method
   */
  OutlierMethod getMethod();
}
