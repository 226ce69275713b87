package com.battery.analysis.dto;

/** Categories of non-fatal conditions reported alongside analysis results. */
public enum DiagnosticKind {
  INSUFFICIENT_CYCLES,
  INSUFFICIENT_CHANNELS,
  STRATEGY_SKIPPED,
  NUMERICAL_FAILURE,
  ALL_CHANNELS_FLAGGED,
  PROBLEM_BATCH,
  BATCH_FAILED
}
