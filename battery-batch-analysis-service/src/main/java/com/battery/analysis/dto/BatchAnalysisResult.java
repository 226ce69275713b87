package com.battery.analysis.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything the analysis produced for one batch. Maps keep the batch's channel order.
 *
 * @param batchKey batch the result belongs to
 * @param metrics extracted metrics of every channel that met the cycle minimum
 * @param verdicts outlier verdict per analysed channel
 * @param referenceSelection selected reference channel, null when no channel qualified
 * @param risks risk assessment per analysed channel
 * @param summary statistics over the non-outlier channels
 * @param diagnostics skipped or degraded steps
 */
public record BatchAnalysisResult(
    String batchKey,
    Map<String, MetricVector> metrics,
    Map<String, OutlierVerdict> verdicts,
    ReferenceSelection referenceSelection,
    Map<String, RiskAssessment> risks,
    BatchSummary summary,
    List<AnalysisDiagnostic> diagnostics) {

  public BatchAnalysisResult {
    metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    verdicts = Collections.unmodifiableMap(new LinkedHashMap<>(verdicts));
    risks = Collections.unmodifiableMap(new LinkedHashMap<>(risks));
    summary = summary == null ? BatchSummary.empty() : summary;
    diagnostics = List.copyOf(diagnostics);
  }

  /** Result for a batch whose analysis could not complete. */
  public static BatchAnalysisResult failed(String batchKey, AnalysisDiagnostic diagnostic) {
    return new BatchAnalysisResult(
        batchKey, Map.of(), Map.of(), null, Map.of(), BatchSummary.empty(), List.of(diagnostic));
  }

  public Optional<ReferenceSelection> reference() {
    return Optional.ofNullable(referenceSelection);
  }

  public List<String> outlierChannels() {
    return verdicts.values().stream()
        .filter(OutlierVerdict::outlier)
        .map(OutlierVerdict::channelId)
        .collect(Collectors.toList());
  }

  public boolean hasDiagnostic(DiagnosticKind kind) {
    return diagnostics.stream().anyMatch(d -> d.kind() == kind);
  }
}
