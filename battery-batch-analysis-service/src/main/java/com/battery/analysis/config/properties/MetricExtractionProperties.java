package com.battery.analysis.config.properties;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Configuration properties for metric extraction and 1C cycle location.
 *
 * <p>The 1C cycle is located by mode label first, then by the discharge ratio/difference
 * heuristic over the early cycles, and finally falls back to the default cycle.
 */
@ConfigurationProperties(prefix = "analysis.metrics")
@Validated
@Builder(toBuilder = true)
public record MetricExtractionProperties(
    @Min(value = 1, message = "Min cycles required must be at least 1")
        @NotNull(message = "Min cycles required is required")
        Integer minCyclesRequired,
    @Min(value = 1, message = "Target cycle must be at least 1")
        @NotNull(message = "Target cycle is required")
        Integer targetCycle,
    @Min(value = 1, message = "Default 1C cycle must be at least 1")
        @NotNull(message = "Default 1C cycle is required")
        Integer defaultOneCCycle,
    @DecimalMin(value = "0.0", inclusive = false, message = "Ratio threshold must be positive")
        @DecimalMax(value = "1.0", message = "Ratio threshold cannot exceed 1.0")
        @NotNull(message = "Ratio threshold is required")
        Double ratioThreshold,
    @DecimalMin(value = "0.0", message = "Discharge difference threshold cannot be negative")
        @NotNull(message = "Discharge difference threshold is required")
        Double dischargeDiffThreshold,
    @Min(value = 2, message = "Heuristic scan limit must be at least 2")
        @NotNull(message = "Heuristic scan limit is required")
        Integer heuristicScanLimit,

    /** Substrings of a cycle mode label that mark the 1C cycle, e.g. "-1C-". */
    @NotNull(message = "1C mode patterns are required") List<String> oneCModePatterns,

    /**
     * Substrings of a channel test mode whose retention baseline is the first cycle instead of a
     * 1C cycle, e.g. "-0.1C-".
     */
    @NotNull(message = "First cycle mode patterns are required")
        List<String> firstCycleModePatterns) {

  // No default constructor - all properties must be explicitly configured
}
