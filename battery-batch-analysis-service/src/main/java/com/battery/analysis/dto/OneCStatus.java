package com.battery.analysis.dto;

/** Condition of a channel at its 1C first cycle, with the risk tier it maps to. */
public enum OneCStatus {
  NORMAL(RiskTier.NONE),
  LOW_EFFICIENCY(RiskTier.WARNING),
  VERY_LOW_EFFICIENCY(RiskTier.DANGER),
  OVERCHARGE(RiskTier.DANGER);

  private final RiskTier tier;

  OneCStatus(RiskTier tier) {
    this.tier = tier;
  }

  public RiskTier getTier() {
    return tier;
  }
}
