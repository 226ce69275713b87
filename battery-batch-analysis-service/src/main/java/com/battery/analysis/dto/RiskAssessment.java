package com.battery.analysis.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Risk tiers of one channel, one per evaluated rule.
 *
 * @param channelId channel the assessment belongs to
 * @param tiers tier per rule
 */
public record RiskAssessment(String channelId, Map<RiskRule, RiskTier> tiers) {

  public RiskAssessment {
    EnumMap<RiskRule, RiskTier> copy = new EnumMap<>(RiskRule.class);
    copy.putAll(tiers);
    tiers = Collections.unmodifiableMap(copy);
  }

  public RiskTier tier(RiskRule rule) {
    return tiers.getOrDefault(rule, RiskTier.NONE);
  }

  public RiskTier highestTier() {
    RiskTier highest = RiskTier.NONE;
    for (RiskTier tier : tiers.values()) {
      highest = RiskTier.max(highest, tier);
    }
    return highest;
  }
}
