package com.battery.analysis.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.battery.analysis.algorithm.DetectionResult;
import com.battery.analysis.algorithm.OutlierDetector;
import com.battery.analysis.algorithm.OutlierMethod;
import com.battery.analysis.config.OutlierDetectionSettings;
import com.battery.analysis.dto.AnalysisDiagnostic;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.OutlierVerdict;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Runs the configured outlier detector over every tracked metric of a batch and merges the
 * per-metric flags into one verdict per channel.
 *
 * <p>A channel is an outlier when any tracked metric flags it. Each metric is tested
 * independently over the channels that report it. Degenerate inputs never fail: detectors floor or
 * guard zero spread and report nothing.
 */
@Service
public class OutlierDetectionService {

  private static final Logger logger = LoggerFactory.getLogger(OutlierDetectionService.class);

  private static final int MIN_CHANNELS_FOR_COMPARISON = 2;

  private final Map<OutlierMethod, OutlierDetector> detectors;
  private final MeterRegistry meterRegistry;

  /** Verdicts of one batch with the batch-level conditions detection ran into. */
  public record OutlierReport(
      Map<String, OutlierVerdict> verdicts, List<AnalysisDiagnostic> diagnostics) {

    public List<String> outlierIds() {
      List<String> ids = new ArrayList<>();
      verdicts.values().forEach(v -> {
        if (v.outlier()) {
          ids.add(v.channelId());
        }
      });
      return ids;
    }
  }

  public OutlierDetectionService(List<OutlierDetector> detectors, MeterRegistry meterRegistry) {
    if (detectors == null || detectors.isEmpty()) {
      throw new IllegalArgumentException("At least one outlier detector is required");
    }
    if (meterRegistry == null) {
      throw new IllegalArgumentException("MeterRegistry cannot be null");
    }
    this.detectors = new EnumMap<>(OutlierMethod.class);
    for (OutlierDetector detector : detectors) {
      this.detectors.put(detector.getMethod(), detector);
    }
    this.meterRegistry = meterRegistry;
  }

  /**
   * Detects outlier channels of a batch.
   *
   * @param batchKey batch the vectors belong to, used for diagnostics
   * @param vectors metric vectors in batch channel order
   * @param settings active detection settings
   * @return one verdict per vector plus batch-level diagnostics
   */
  public OutlierReport detect(
      String batchKey, List<MetricVector> vectors, OutlierDetectionSettings settings) {
    OutlierMethod method = settings.method();
    OutlierDetector detector = detectors.get(method);
    if (detector == null) {
      throw new IllegalStateException("No detector registered for " + method);
    }

    Map<String, List<MetricName>> triggers = new LinkedHashMap<>();
    Map<String, Map<MetricName, Double>> scores = new HashMap<>();
    for (MetricVector vector : vectors) {
      triggers.put(vector.channelId(), new ArrayList<>());
      scores.put(vector.channelId(), new EnumMap<>(MetricName.class));
    }

    if (vectors.size() >= MIN_CHANNELS_FOR_COMPARISON) {
      for (MetricName metric : settings.trackedMetrics().keySet()) {
        runMetric(batchKey, metric, vectors, settings, detector, triggers, scores);
      }
    }

    Map<String, OutlierVerdict> verdicts = new LinkedHashMap<>();
    int flagged = 0;
    for (Map.Entry<String, List<MetricName>> entry : triggers.entrySet()) {
      String channelId = entry.getKey();
      if (entry.getValue().isEmpty()) {
        verdicts.put(channelId, OutlierVerdict.clean(channelId, method));
        continue;
      }
      flagged++;
      verdicts.put(
          channelId,
          new OutlierVerdict(channelId, true, entry.getValue(), method, scores.get(channelId)));
    }

    List<AnalysisDiagnostic> diagnostics = new ArrayList<>();
    if (!vectors.isEmpty() && flagged == vectors.size()) {
      diagnostics.add(
          AnalysisDiagnostic.of(
              DiagnosticKind.ALL_CHANNELS_FLAGGED, batchKey,
              "All %d channels flagged as outliers; batch needs retesting", flagged));
    } else if (!vectors.isEmpty()
        && (double) flagged / vectors.size() > settings.problemBatchRatio()) {
      diagnostics.add(
          AnalysisDiagnostic.of(
              DiagnosticKind.PROBLEM_BATCH, batchKey,
              "%d of %d channels flagged as outliers", flagged, vectors.size()));
    }
    if (flagged > 0) {
      logger.info(
          "Batch {}: {} of {} channels flagged by {}", batchKey, flagged, vectors.size(), method.getLabel());
    }
    return new OutlierReport(verdicts, diagnostics);
  }

  private void runMetric(
      String batchKey,
      MetricName metric,
      List<MetricVector> vectors,
      OutlierDetectionSettings settings,
      OutlierDetector detector,
      Map<String, List<MetricName>> triggers,
      Map<String, Map<MetricName, Double>> scores) {
    List<String> ids = new ArrayList<>();
    List<Double> values = new ArrayList<>();
    for (MetricVector vector : vectors) {
      OptionalDouble value = vector.value(metric);
      if (value.isPresent()) {
        ids.add(vector.channelId());
        values.add(value.getAsDouble());
      }
    }
    if (ids.size() < MIN_CHANNELS_FOR_COMPARISON) {
      logger.debug("Batch {}: {} reported by {} channels, skipped", batchKey, metric, ids.size());
      return;
    }

    DetectionResult result =
        detector.detect(metric, values.stream().mapToDouble(Double::doubleValue).toArray(), settings);
    result
        .scores()
        .forEach(
            (position, score) -> {
              String channelId = ids.get(position);
              triggers.get(channelId).add(metric);
              scores.get(channelId).put(metric, score);
              logger.info(
                  "Batch {}: channel {} flagged on {} (value {}, score {})",
                  batchKey, channelId, metric.getKey(), values.get(position), score);
              Counter.builder("battery.analysis.outliers")
                  .description("Channels flagged as outliers per metric")
                  .tag("metric", metric.getKey())
                  .register(meterRegistry)
                  .increment();
            });
  }
}
