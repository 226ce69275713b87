package com.battery.analysis.algorithm.selection;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.config.AnalysisSettings;
import com.battery.analysis.dto.AnalysisDiagnostic;
import com.battery.analysis.dto.BatchGroup;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.ReferenceSelection;

/**
 * Picks the reference channel of a batch by trying the selection strategies in fixed priority
 * order: retention-curve MSE, then PCA, then the traditional nearest-to-mean rule. A strategy is
 * skipped only when its preconditions are unmet; the first one that decides wins.
 *
 * <p>Only non-outlier channels are candidates. A single candidate is selected directly by the
 * traditional rule with score 0.
 */
@Component
public class ReferenceChannelSelector {

  private static final Logger logger = LoggerFactory.getLogger(ReferenceChannelSelector.class);

  private static final String SINGLE_CHANNEL = "Single channel batch";

  private final List<ReferenceChannelStrategy> strategies;
  private final TraditionalReferenceStrategy traditionalStrategy;

  public ReferenceChannelSelector(
      RetentionCurveMseStrategy retentionCurveMseStrategy,
      PcaReferenceStrategy pcaReferenceStrategy,
      TraditionalReferenceStrategy traditionalStrategy) {
    this.strategies =
        List.of(retentionCurveMseStrategy, pcaReferenceStrategy, traditionalStrategy);
    this.traditionalStrategy = traditionalStrategy;
  }

  /**
   * Selects the reference channel.
   *
   * @param candidates batch restricted to non-outlier channels
   * @param metrics extracted metrics keyed by channel id, covering every candidate
   * @param settings run settings
   * @param diagnostics sink for skipped strategies and numerical failures
   * @return the selection, or empty when there is no candidate
   */
  public Optional<ReferenceSelection> select(
      BatchGroup candidates,
      Map<String, MetricVector> metrics,
      AnalysisSettings settings,
      List<AnalysisDiagnostic> diagnostics) {
    if (candidates.size() == 0) {
      logger.warn("Batch {} has no candidate channels for reference selection", candidates.batchKey());
      return Optional.empty();
    }
    if (candidates.size() == 1) {
      String channelId = candidates.channels().get(0).channelId();
      return Optional.of(
          new ReferenceSelection(channelId, traditionalStrategy.getMethod(), 0.0, SINGLE_CHANNEL));
    }

    ReferenceSelectionContext context =
        new ReferenceSelectionContext(candidates, metrics, settings, diagnostics);
    for (ReferenceChannelStrategy strategy : strategies) {
      Optional<ReferenceSelection> selection = strategy.select(context);
      if (selection.isPresent()) {
        logger.info(
            "Batch {}: reference channel {} selected by {} (score {})",
            candidates.batchKey(),
            selection.get().channelId(),
            strategy.getMethod().getLabel(),
            selection.get().score());
        return selection;
      }
      logger.debug(
          "Batch {}: {} preconditions unmet, falling through",
          candidates.batchKey(),
          strategy.getMethod().getLabel());
    }
    return Optional.empty();
  }
}
