package com.battery.analysis.algorithm.selection;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.battery.analysis.config.AnalysisSettings;
import com.battery.analysis.dto.AnalysisDiagnostic;
import com.battery.analysis.dto.BatchGroup;
import com.battery.analysis.dto.ChannelSeries;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricVector;

/**
 * Inputs of one reference selection. Candidates are the non-outlier channels of a batch.
 *
 * @param candidates batch restricted to the non-outlier channels
 * @param metrics extracted metrics keyed by channel id
 * @param settings run settings
 * @param diagnostics sink for skipped strategies and numerical failures of this batch
 */
public record ReferenceSelectionContext(
    BatchGroup candidates,
    Map<String, MetricVector> metrics,
    AnalysisSettings settings,
    List<AnalysisDiagnostic> diagnostics) {

  public List<ChannelSeries> channels() {
    return candidates.channels();
  }

  public List<String> channelIds() {
    return candidates.channels().stream().map(ChannelSeries::channelId).collect(Collectors.toList());
  }

  public int size() {
    return candidates.size();
  }

  public MetricVector metricsOf(String channelId) {
    return metrics.get(channelId);
  }

  public void report(DiagnosticKind kind, String format, Object... args) {
    diagnostics.add(AnalysisDiagnostic.of(kind, candidates.batchKey(), format, args));
  }
}
