package com.battery.analysis.dto;

/** Threshold rules evaluated independently for every channel. */
public enum RiskRule {
  OVERCHARGE_VOLTAGE,
  FIRST_EFFICIENCY,
  CYCLE4_CAPACITY_DECAY,
  ABNORMAL_FIRST_CYCLE,
  ONE_C_STATUS
}
