package com.battery.analysis.exception;

/**
 * Exception thrown when the analysis configuration requests mutually exclusive options or omits
 * parameters the selected options require. Raised before any batch is processed.
 */
public class ConfigurationConflictException extends RuntimeException {

  public ConfigurationConflictException(String message) {
    super(message);
  }
}
