package com.battery.analysis.config.properties;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for running batches in parallel.
 *
 * @param workerThreads size of the worker pool, 0 to use the number of available processors
 * @param batchTimeout upper bound on the analysis of a single batch
 */
@ConfigurationProperties(prefix = "analysis.runtime")
@Validated
public record RuntimeProperties(
    @Min(value = 0, message = "Worker threads cannot be negative")
        @NotNull(message = "Worker threads is required")
        Integer workerThreads,
    @NotNull(message = "Batch timeout is required") Duration batchTimeout) {

  public int effectiveWorkerThreads() {
    return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
  }
}
