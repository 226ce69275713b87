package com.battery.analysis.dto;

/** Severity produced by a risk rule, ordered from least to most severe. */
public enum RiskTier {
  NONE,
  WARNING,
  DANGER;

  public boolean isMoreSevereThan(RiskTier other) {
    return compareTo(other) > 0;
  }

  public static RiskTier max(RiskTier a, RiskTier b) {
    return a.isMoreSevereThan(b) ? a : b;
  }
}
