package com.battery.analysis.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import com.battery.analysis.algorithm.OutlierMethod;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Configuration properties for outlier detection.
 *
 * <p>Exactly one method is active per run. Parameters of the method-specific sections are only
 * range-checked here; whether the selected method has everything it needs is decided when the
 * properties are turned into {@link com.battery.analysis.config.OutlierDetectionSettings}.
 */
@ConfigurationProperties(prefix = "analysis.outlier")
@Validated
@Builder(toBuilder = true)
public record OutlierDetectionProperties(
    @NotNull(message = "Outlier detection method is required") OutlierMethod method,
    @Min(value = 1, message = "Max iterations must be at least 1")
        @Max(value = 100, message = "Max iterations cannot exceed 100")
        @NotNull(message = "Max iterations is required")
        Integer maxIterations,
    @DecimalMin(value = "0.0", message = "Problem batch ratio cannot be negative")
        @DecimalMax(value = "1.0", message = "Problem batch ratio cannot exceed 1.0")
        @NotNull(message = "Problem batch ratio is required")
        Double problemBatchRatio,
    @NestedConfigurationProperty @Valid BoxplotProperties boxplot,
    @NestedConfigurationProperty @Valid ZScoreMadProperties zscoreMad) {

  /** Parameters of the iterative boxplot detector. */
  @Builder(toBuilder = true)
  public record BoxplotProperties(
      Boolean useMethod,
      @DecimalMin(value = "0.0", inclusive = false, message = "Shrink factor must be positive")
          @DecimalMax(value = "1.0", message = "Shrink factor cannot exceed 1.0")
          Double shrinkFactor,
      @DecimalMin(value = "0.0", message = "Discharge range threshold cannot be negative")
          Double dischargeRangeThreshold,
      @DecimalMin(value = "0.0", message = "Efficiency range threshold cannot be negative")
          Double efficiencyRangeThreshold) {

    // No default constructor - all properties must be explicitly configured
  }

  /** Parameters of the median/MAD z-score detector. */
  @Builder(toBuilder = true)
  public record ZScoreMadProperties(
      Boolean enabled,
      @DecimalMin(value = "0.0", inclusive = false, message = "MAD constant must be positive")
          Double madConstant,
      @DecimalMin(value = "0.0", message = "Min MAD ratio cannot be negative")
          @DecimalMax(value = "1.0", message = "Min MAD ratio cannot exceed 1.0")
          Double minMadRatio,
      @DecimalMin(value = "0.0", inclusive = false, message = "Discharge threshold must be positive")
          Double dischargeThreshold,
      @DecimalMin(value = "0.0", inclusive = false, message = "Efficiency threshold must be positive")
          Double efficiencyThreshold,
      @DecimalMin(value = "0.0", inclusive = false, message = "Voltage threshold must be positive")
          Double voltageThreshold,
      @DecimalMin(value = "0.0", inclusive = false, message = "Energy threshold must be positive")
          Double energyThreshold,
      Boolean useTimeSeries,
      @Min(value = 3, message = "Min samples for decomposition must be at least 3")
          Integer minSamplesForStl,
      @Min(value = 0, message = "Seasonal period cannot be negative") Integer seasonalPeriod,
      @DecimalMin(value = "0.0", inclusive = false, message = "Trend bandwidth must be positive")
          @DecimalMax(value = "1.0", message = "Trend bandwidth cannot exceed 1.0")
          Double trendBandwidth) {

    // No default constructor - all properties must be explicitly configured
  }

  // No default constructor - all properties must be explicitly configured
}
