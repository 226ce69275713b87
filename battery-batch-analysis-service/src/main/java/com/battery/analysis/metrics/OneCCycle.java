package com.battery.analysis.metrics;

/**
 * The cycle used as the capacity-retention baseline of a channel.
 *
 * @param cycleIndex cycle index of the baseline
 * @param method how the cycle was located
 */
public record OneCCycle(int cycleIndex, LocationMethod method) {

  /** How a baseline cycle was located, in the order the locator tries them. */
  public enum LocationMethod {
    /** Channel runs a low-rate test whose retention is measured from its first cycle. */
    FIRST_CYCLE,
    /** A cycle mode label carried an explicit 1C marker. */
    MODE_PATTERN,
    /** Discharge dropped enough against the first cycle to indicate the switch to 1C. */
    HEURISTIC,
    /** Nothing matched; the configured default cycle was used. */
    DEFAULT
  }
}
