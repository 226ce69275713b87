package com.battery.analysis.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Thresholds of the per-channel risk rules. Capacities are in mAh/g, voltages in volts and
 * efficiencies and retentions in percent.
 */
@ConfigurationProperties(prefix = "analysis.risk")
@Validated
@Builder(toBuilder = true)
public record RiskThresholdProperties(
    @NotNull(message = "Overcharge voltage warning is required") Double overchargeVoltageWarning,
    @NotNull(message = "Overcharge voltage danger is required") Double overchargeVoltageDanger,

    // First efficiency below efficiencyLow warns, below efficiencyWarning is dangerous
    @NotNull(message = "Efficiency low is required") Double efficiencyLow,
    @NotNull(message = "Efficiency warning is required") Double efficiencyWarning,
    @NotNull(message = "Cycle 4 retention warning is required") Double cycle4RetentionWarning,
    @NotNull(message = "Cycle 4 retention danger is required") Double cycle4RetentionDanger,
    @NotNull(message = "Cycle 4 discharge drop is required") Double cycle4DischargeDrop,
    @NotNull(message = "Abnormal high charge is required") Double abnormalHighCharge,
    @NotNull(message = "Abnormal low charge is required") Double abnormalLowCharge,
    @NotNull(message = "Abnormal low discharge is required") Double abnormalLowDischarge,
    @NotNull(message = "1C overcharge capacity is required") Double oneCOverchargeCapacity,
    @NotNull(message = "1C low efficiency is required") Double oneCLowEfficiency,
    @NotNull(message = "1C very low efficiency is required") Double oneCVeryLowEfficiency) {

  // No default constructor - all properties must be explicitly configured
}
