package com.battery.analysis.service;

import java.util.Map;

import com.battery.analysis.config.AnalysisSettings;
import com.battery.analysis.dto.BatchAnalysisResult;
import com.battery.analysis.dto.BatchGroup;

/**
 * Analyses battery cycling batches: extracts channel metrics, flags outlier channels, selects a
 * reference channel and classifies per-channel risks.
 */
public interface BatchAnalysisService {

  /**
   * Analyses one batch with the configured settings.
   *
   * @param batch channels of one sample batch
   * @return the batch result
   */
  BatchAnalysisResult analyzeBatch(BatchGroup batch);

  /**
   * Analyses one batch with explicit settings.
   *
   * @param batch channels of one sample batch
   * @param settings settings of this run
   * @return the batch result
   */
  BatchAnalysisResult analyzeBatch(BatchGroup batch, AnalysisSettings settings);

  /**
   * Analyses batches in parallel with the configured settings. A batch that fails or exceeds the
   * per-batch timeout yields a result carrying a failure diagnostic; the other batches are not
   * affected.
   *
   * @param batches batches keyed by batch key
   * @return results keyed by batch key, in input order
   */
  Map<String, BatchAnalysisResult> analyzeAll(Map<String, BatchGroup> batches);

  /**
   * Analyses batches in parallel with explicit settings.
   *
   * @param batches batches keyed by batch key
   * @param settings settings of this run
   * @return results keyed by batch key, in input order
   */
  Map<String, BatchAnalysisResult> analyzeAll(
      Map<String, BatchGroup> batches, AnalysisSettings settings);
}
