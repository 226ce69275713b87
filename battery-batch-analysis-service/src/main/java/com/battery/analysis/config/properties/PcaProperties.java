package com.battery.analysis.config.properties;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.battery.analysis.dto.MetricName;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/** Configuration properties for PCA based reference channel selection. */
@ConfigurationProperties(prefix = "analysis.reference.pca")
@Validated
@Builder(toBuilder = true)
public record PcaProperties(
    @NotNull(message = "PCA enabled flag is required") Boolean enabled,
    @Min(value = 1, message = "Number of components must be at least 1")
        @NotNull(message = "Number of components is required")
        Integer nComponents,
    @Min(value = 2, message = "PCA min channels must be at least 2")
        @NotNull(message = "PCA min channels is required")
        Integer minChannels,
    @NotEmpty(message = "PCA features are required") List<MetricName> features,
    @DecimalMin(value = "0.0", inclusive = false, message = "Outlier sigma must be positive")
        @NotNull(message = "Outlier sigma is required")
        Double outlierSigma) {

  // No default constructor - all properties must be explicitly configured
}
