package com.battery.analysis.risk;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import com.battery.analysis.config.properties.RiskThresholdProperties;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.MetricVector;
import com.battery.analysis.dto.OneCStatus;
import com.battery.analysis.dto.RiskAssessment;
import com.battery.analysis.dto.RiskRule;
import com.battery.analysis.dto.RiskTier;

/**
 * Evaluates the threshold rules of one channel. Rules are independent of each other and of the
 * rest of the batch; a rule whose inputs are missing yields {@link RiskTier#NONE}.
 */
@Component
public class RiskClassifier {

  public RiskAssessment classify(MetricVector metrics, RiskThresholdProperties thresholds) {
    Map<RiskRule, RiskTier> tiers = new EnumMap<>(RiskRule.class);
    tiers.put(RiskRule.OVERCHARGE_VOLTAGE, overchargeVoltage(metrics, thresholds));
    tiers.put(RiskRule.FIRST_EFFICIENCY, firstEfficiency(metrics, thresholds));
    tiers.put(RiskRule.CYCLE4_CAPACITY_DECAY, cycle4CapacityDecay(metrics, thresholds));
    tiers.put(RiskRule.ABNORMAL_FIRST_CYCLE, abnormalFirstCycle(metrics, thresholds));
    tiers.put(
        RiskRule.ONE_C_STATUS,
        oneCStatus(metrics, thresholds).map(OneCStatus::getTier).orElse(RiskTier.NONE));
    return new RiskAssessment(metrics.channelId(), tiers);
  }

  private static RiskTier overchargeVoltage(MetricVector metrics, RiskThresholdProperties t) {
    OptionalDouble voltage = metrics.value(MetricName.FIRST_CHARGE_END_VOLTAGE);
    if (voltage.isEmpty()) {
      return RiskTier.NONE;
    }
    if (voltage.getAsDouble() >= t.overchargeVoltageDanger()) {
      return RiskTier.DANGER;
    }
    return voltage.getAsDouble() >= t.overchargeVoltageWarning() ? RiskTier.WARNING : RiskTier.NONE;
  }

  private static RiskTier firstEfficiency(MetricVector metrics, RiskThresholdProperties t) {
    OptionalDouble efficiency = metrics.value(MetricName.FIRST_EFFICIENCY);
    if (efficiency.isEmpty()) {
      return RiskTier.NONE;
    }
    if (efficiency.getAsDouble() < t.efficiencyWarning()) {
      return RiskTier.DANGER;
    }
    return efficiency.getAsDouble() < t.efficiencyLow() ? RiskTier.WARNING : RiskTier.NONE;
  }

  private static RiskTier cycle4CapacityDecay(MetricVector metrics, RiskThresholdProperties t) {
    RiskTier tier = RiskTier.NONE;
    OptionalDouble retention = metrics.value(MetricName.CYCLE4_RETENTION);
    if (retention.isPresent()) {
      if (retention.getAsDouble() < t.cycle4RetentionDanger()) {
        tier = RiskTier.DANGER;
      } else if (retention.getAsDouble() < t.cycle4RetentionWarning()) {
        tier = RiskTier.WARNING;
      }
    }
    OptionalDouble drop = metrics.value(MetricName.CYCLE4_DISCHARGE_DROP);
    if (drop.isPresent() && drop.getAsDouble() > t.cycle4DischargeDrop()) {
      tier = RiskTier.max(tier, RiskTier.WARNING);
    }
    return tier;
  }

  private static RiskTier abnormalFirstCycle(MetricVector metrics, RiskThresholdProperties t) {
    OptionalDouble charge = metrics.value(MetricName.FIRST_CHARGE);
    OptionalDouble discharge = metrics.value(MetricName.FIRST_DISCHARGE);
    boolean abnormalCharge =
        charge.isPresent()
            && (charge.getAsDouble() > t.abnormalHighCharge()
                || charge.getAsDouble() < t.abnormalLowCharge());
    boolean abnormalDischarge =
        discharge.isPresent() && discharge.getAsDouble() < t.abnormalLowDischarge();
    return abnormalCharge || abnormalDischarge ? RiskTier.DANGER : RiskTier.NONE;
  }

  /**
   * Status of the 1C first cycle: an over-threshold charge capacity wins, then the efficiency
   * bands. Empty when the channel reports neither 1C charge nor 1C efficiency.
   */
  public Optional<OneCStatus> oneCStatus(MetricVector metrics, RiskThresholdProperties t) {
    OptionalDouble charge = metrics.value(MetricName.ONE_C_CHARGE);
    OptionalDouble efficiency = metrics.value(MetricName.ONE_C_EFFICIENCY);
    if (charge.isEmpty() && efficiency.isEmpty()) {
      return Optional.empty();
    }
    if (charge.isPresent() && charge.getAsDouble() > t.oneCOverchargeCapacity()) {
      return Optional.of(OneCStatus.OVERCHARGE);
    }
    if (efficiency.isPresent()) {
      if (efficiency.getAsDouble() < t.oneCVeryLowEfficiency()) {
        return Optional.of(OneCStatus.VERY_LOW_EFFICIENCY);
      }
      if (efficiency.getAsDouble() < t.oneCLowEfficiency()) {
        return Optional.of(OneCStatus.LOW_EFFICIENCY);
      }
    }
    return Optional.of(OneCStatus.NORMAL);
  }
}
