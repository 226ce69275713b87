package com.battery.analysis.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Configuration properties for retention-curve based reference channel selection.
 *
 * <p>Curves are expressed as offsets from each channel's 1C cycle. {@code minCycles} is the
 * minimum number of grid points a comparison needs and {@code maxCycles} bounds the grid length.
 */
@ConfigurationProperties(prefix = "analysis.reference.capacity-retention")
@Validated
@Builder(toBuilder = true)
public record CapacityRetentionProperties(
    @NotNull(message = "Capacity retention enabled flag is required") Boolean enabled,
    @Min(value = 2, message = "Min cycles must be at least 2")
        @NotNull(message = "Min cycles is required")
        Integer minCycles,
    @Min(value = 2, message = "Max cycles must be at least 2")
        @NotNull(message = "Max cycles is required")
        Integer maxCycles,
    @Min(value = 1, message = "Cycle step must be at least 1")
        @NotNull(message = "Cycle step is required")
        Integer cycleStep,
    @NotNull(message = "Dynamic range flag is required") Boolean dynamicRange,
    @Min(value = 1, message = "Min channels must be at least 1")
        @NotNull(message = "Min channels is required")
        Integer minChannels,
    @NotNull(message = "Interpolation method is required") InterpolationMethod interpolation,
    @NotNull(message = "Include voltage flag is required") Boolean includeVoltage,
    @NotNull(message = "Include energy flag is required") Boolean includeEnergy,
    @DecimalMin(value = "0.0", message = "Capacity weight cannot be negative")
        @NotNull(message = "Capacity weight is required")
        Double capacityWeight,
    @DecimalMin(value = "0.0", message = "Voltage weight cannot be negative")
        @NotNull(message = "Voltage weight is required")
        Double voltageWeight,
    @DecimalMin(value = "0.0", message = "Energy weight cannot be negative")
        @NotNull(message = "Energy weight is required")
        Double energyWeight,
    @NotNull(message = "Weighted MSE flag is required") Boolean useWeightedMse,
    @NotNull(message = "Weight method is required") WeightMethod weightMethod,
    @DecimalMin(value = "0.0", message = "Weight factor cannot be negative")
        @NotNull(message = "Weight factor is required")
        Double weightFactor,
    @DecimalMin(value = "0.0", inclusive = false, message = "Late cycles emphasis must be positive")
        @NotNull(message = "Late cycles emphasis is required")
        Double lateCyclesEmphasis) {

  /** How channel curves are resampled onto the common grid. */
  public enum InterpolationMethod {
    LINEAR,
    CUBIC,
    NEAREST
  }

  /** Growth of the per-cycle MSE weight toward later cycles. */
  public enum WeightMethod {
    CONSTANT,
    LINEAR,
    EXPONENTIAL
  }

  // No default constructor - all properties must be explicitly configured
}
