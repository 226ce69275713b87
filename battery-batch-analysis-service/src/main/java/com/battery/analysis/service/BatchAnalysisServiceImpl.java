package com.battery.analysis.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.battery.analysis.algorithm.selection.ReferenceChannelSelector;
import com.battery.analysis.config.AnalysisSettings;
import com.battery.analysis.config.properties.RuntimeProperties;
import com.battery.analysis.dto.AnalysisDiagnostic;
import com.battery.analysis.dto.BatchAnalysisResult;
import com.battery.analysis.dto.BatchGroup;
import com.battery.analysis.dto.BatchSummary;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.ReferenceSelection;
import com.battery.analysis.dto.RiskAssessment;
import com.battery.analysis.exception.BatchAnalysisException;
import com.battery.analysis.exception.ConfigurationConflictException;
import com.battery.analysis.metrics.BatchSummaryCalculator;
import com.battery.analysis.metrics.MetricExtractor;
import com.battery.analysis.risk.RiskClassifier;
import com.battery.analysis.service.OutlierDetectionService.OutlierReport;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;

/**
 * Default batch analysis pipeline.
 *
 * <p>Within a batch the steps run in strict order: metric extraction, outlier detection,
 * reference selection over the non-outlier channels, risk classification of every analysed
 * channel and the batch summary over the non-outlier channels. Channels below the cycle minimum are dropped before anything else and reported.
 *
 * <p>Thread Safety: batches share no mutable state, so {@link #analyzeAll} runs them on a fixed
 * worker pool and bounds each with the configured per-batch timeout, counted from the moment the
 * batch starts running. A batch that overruns is cancelled and its worker interrupted. Both pools
 * are shut down when the application context closes.
 *
 * @author Battery Analysis Team
 * @version 1.0
 * @since 2024
 */
@Service
public class BatchAnalysisServiceImpl implements BatchAnalysisService {

  private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisServiceImpl.class);

  private static final int MIN_CHANNELS_FOR_COMPARISON = 2;

  /** Seconds to wait for running batches when the pool shuts down. */
  private static final long EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final MetricExtractor metricExtractor;
  private final OutlierDetectionService outlierDetectionService;
  private final ReferenceChannelSelector referenceChannelSelector;
  private final RiskClassifier riskClassifier;
  private final BatchSummaryCalculator batchSummaryCalculator;
  private final AnalysisSettings defaultSettings;
  private final RuntimeProperties runtimeProperties;
  private final MeterRegistry meterRegistry;
  private final ExecutorService executorService;
  private final ScheduledExecutorService timeoutScheduler;

  public BatchAnalysisServiceImpl(
      MetricExtractor metricExtractor,
      OutlierDetectionService outlierDetectionService,
      ReferenceChannelSelector referenceChannelSelector,
      RiskClassifier riskClassifier,
      BatchSummaryCalculator batchSummaryCalculator,
      AnalysisSettings defaultSettings,
      RuntimeProperties runtimeProperties,
      MeterRegistry meterRegistry) {
    this.metricExtractor = metricExtractor;
    this.outlierDetectionService = outlierDetectionService;
    this.referenceChannelSelector = referenceChannelSelector;
    this.riskClassifier = riskClassifier;
    this.batchSummaryCalculator = batchSummaryCalculator;
    this.defaultSettings = defaultSettings;
    this.runtimeProperties = runtimeProperties;
    this.meterRegistry = meterRegistry;
    this.executorService = Executors.newFixedThreadPool(runtimeProperties.effectiveWorkerThreads());
    this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @Override
  public BatchAnalysisResult analyzeBatch(BatchGroup batch) {
    return analyzeBatch(batch, defaultSettings);
  }

  @Override
  public BatchAnalysisResult analyzeBatch(BatchGroup batch, AnalysisSettings settings) {
    if (batch == null) {
      throw new IllegalArgumentException("Batch cannot be null");
    }
    if (settings == null) {
      throw new IllegalArgumentException("Analysis settings cannot be null");
    }
    try {
      BatchAnalysisResult result = runPipeline(batch, settings);
      countBatch("completed");
      return result;
    } catch (ConfigurationConflictException e) {
      throw e;
    } catch (RuntimeException e) {
      countBatch("failed");
      throw new BatchAnalysisException(
          batch.batchKey(), "Analysis of batch " + batch.batchKey() + " failed: " + e.getMessage(), e);
    }
  }

  // ============================================================================
  // PIPELINE
  // ============================================================================

  private BatchAnalysisResult runPipeline(BatchGroup batch, AnalysisSettings settings) {
    List<AnalysisDiagnostic> diagnostics = new ArrayList<>();

    // Extraction
    List<ChannelSeries> eligible = new ArrayList<>();
    Map<String, MetricVector> metrics = new LinkedHashMap<>();
    for (ChannelSeries series : batch.channels()) {
      if (!metricExtractor.isEligible(series, settings.metrics())) {
        logger.info(
            "Batch {}: channel {} omitted with {} cycles ({} required)",
            batch.batchKey(), series.channelId(), series.cycleCount(),
            settings.metrics().minCyclesRequired());
        diagnostics.add(
            AnalysisDiagnostic.of(
                DiagnosticKind.INSUFFICIENT_CYCLES, series.channelId(),
                "%d cycles, %d required", series.cycleCount(),
                settings.metrics().minCyclesRequired()));
        continue;
      }
      eligible.add(series);
      metrics.put(series.channelId(), metricExtractor.extract(series, settings.metrics()));
    }
    if (eligible.size() < MIN_CHANNELS_FOR_COMPARISON) {
      diagnostics.add(
          AnalysisDiagnostic.of(
              DiagnosticKind.INSUFFICIENT_CHANNELS, batch.batchKey(),
              "%d analysable channels, comparison needs %d", eligible.size(),
              MIN_CHANNELS_FOR_COMPARISON));
    }

    // Detection
    OutlierReport report =
        outlierDetectionService.detect(
            batch.batchKey(), new ArrayList<>(metrics.values()), settings.outlierDetection());
    diagnostics.addAll(report.diagnostics());

    // Selection over non-outlier channels
    List<String> outliers = report.outlierIds();
    List<ChannelSeries> survivors = new ArrayList<>();
    for (ChannelSeries series : eligible) {
      if (!outliers.contains(series.channelId())) {
        survivors.add(series);
      }
    }
    Optional<ReferenceSelection> reference =
        referenceChannelSelector.select(batch.withChannels(survivors), metrics, settings, diagnostics);
    reference.ifPresent(
        selection ->
            Counter.builder("battery.analysis.reference.selections")
                .description("Reference channel selections per strategy")
                .tag("method", selection.method().getLabel())
                .register(meterRegistry)
                .increment());

    // Risk classification
    Map<String, RiskAssessment> risks = new LinkedHashMap<>();
    for (MetricVector vector : metrics.values()) {
      risks.put(vector.channelId(), riskClassifier.classify(vector, settings.risk()));
    }

    // Summary over non-outlier channels
    List<MetricVector> retained = new ArrayList<>();
    for (MetricVector vector : metrics.values()) {
      if (!outliers.contains(vector.channelId())) {
        retained.add(vector);
      }
    }
    BatchSummary summary = batchSummaryCalculator.summarize(retained, settings.risk());

    logger.info(
        "Batch {} analysed: {} channels, {} outliers, reference {}",
        batch.batchKey(), eligible.size(), outliers.size(),
        reference.map(ReferenceSelection::channelId).orElse("none"));
    return new BatchAnalysisResult(
        batch.batchKey(),
        metrics,
        report.verdicts(),
        reference.orElse(null),
        risks,
        summary,
        diagnostics);
  }

  // ============================================================================
  // PARALLEL EXECUTION
  // ============================================================================

  @Override
  public Map<String, BatchAnalysisResult> analyzeAll(Map<String, BatchGroup> batches) {
    return analyzeAll(batches, defaultSettings);
  }

  @Override
  public Map<String, BatchAnalysisResult> analyzeAll(
      Map<String, BatchGroup> batches, AnalysisSettings settings) {
    if (batches == null) {
      throw new IllegalArgumentException("Batches cannot be null");
    }
    if (settings == null) {
      throw new IllegalArgumentException("Analysis settings cannot be null");
    }

    Map<String, FutureTask<BatchAnalysisResult>> tasks = new LinkedHashMap<>();
    batches.forEach(
        (key, batch) -> {
          FutureTask<BatchAnalysisResult> task =
              new FutureTask<>(() -> analyzeBatch(batch, settings));
          tasks.put(key, task);
          executorService.execute(() -> runWithTimeout(task));
        });

    Map<String, BatchAnalysisResult> results = new LinkedHashMap<>();
    tasks.forEach((key, task) -> results.put(key, retrieve(key, task)));
    return results;
  }

  /** Runs the task on the current worker, cancelling it with interruption once it overruns. */
  private void runWithTimeout(FutureTask<BatchAnalysisResult> task) {
    ScheduledFuture<?> timeout =
        timeoutScheduler.schedule(
            () -> task.cancel(true),
            runtimeProperties.batchTimeout().toMillis(),
            TimeUnit.MILLISECONDS);
    try {
      task.run();
    } finally {
      timeout.cancel(false);
    }
  }

  /**
   * Waits for one batch, converting timeouts and failures into a failed result. Configuration
   * conflicts are rethrown since they affect every batch.
   */
  private BatchAnalysisResult retrieve(String batchKey, FutureTask<BatchAnalysisResult> task) {
    long timeoutMillis = runtimeProperties.batchTimeout().toMillis();
    try {
      return task.get();
    } catch (CancellationException e) {
      logger.warn("Batch {} timed out after {} ms", batchKey, timeoutMillis);
      countBatch("timeout");
      return failed(batchKey, "Timed out after " + timeoutMillis + " ms");
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for batch {}", batchKey);
      Thread.currentThread().interrupt();
      return failed(batchKey, "Interrupted");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ConfigurationConflictException) {
        throw (ConfigurationConflictException) cause;
      }
      logger.error(
          "Batch {} failed: {}", batchKey, cause != null ? cause.getMessage() : e.getMessage());
      return failed(batchKey, cause != null ? cause.getMessage() : e.getMessage());
    }
  }

  private static BatchAnalysisResult failed(String batchKey, String message) {
    return BatchAnalysisResult.failed(
        batchKey, new AnalysisDiagnostic(DiagnosticKind.BATCH_FAILED, batchKey, message));
  }

  private void countBatch(String outcome) {
    Counter.builder("battery.analysis.batches")
        .description("Analysed batches by outcome")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  /** Shuts the worker pool down, forcing it after the grace period. */
  @PreDestroy
  public void cleanup() {
    logger.info("Shutting down batch analysis executor service");
    timeoutScheduler.shutdownNow();
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("Executor did not terminate gracefully, forcing shutdown");
        executorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for executor shutdown");
      executorService.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
