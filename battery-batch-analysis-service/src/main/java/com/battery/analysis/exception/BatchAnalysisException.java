package com.battery.analysis.exception;

/** Exception thrown when the analysis of a single batch cannot complete. */
public class BatchAnalysisException extends RuntimeException {

  private final String batchKey;

  public BatchAnalysisException(String batchKey, String message) {
    super(message);
    this.batchKey = batchKey;
  }

  public BatchAnalysisException(String batchKey, String message, Throwable cause) {
    super(message, cause);
    this.batchKey = batchKey;
  }

  public String getBatchKey() {
    return batchKey;
  }
}
