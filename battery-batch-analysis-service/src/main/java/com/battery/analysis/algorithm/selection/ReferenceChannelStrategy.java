package com.battery.analysis.algorithm.selection;

import java.util.Optional;

import com.battery.analysis.dto.ReferenceSelection;

/**
 * A way of picking the channel that best represents a batch. A strategy returns empty only when
 * its preconditions are unmet, never because its answer looks weak.
 */
public interface ReferenceChannelStrategy {

  /**
   * Selects a reference channel among the context's candidates.
   *
   * @param context candidates, their metrics and the run settings
   * @return the selection, or empty if the strategy cannot decide for this batch
   */
  Optional<ReferenceSelection> select(ReferenceSelectionContext context);

  /**
   * Returns the method this strategy implements.
   *
   * @return selection method
   */
  ReferenceMethod getMethod();
}
