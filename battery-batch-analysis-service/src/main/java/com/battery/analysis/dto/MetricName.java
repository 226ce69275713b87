package com.battery.analysis.dto;

/** Scalar summary metrics extracted from a channel's cycle series. */
public enum MetricName {
  FIRST_CHARGE("first_charge"),
  FIRST_DISCHARGE("first_discharge"),
  FIRST_EFFICIENCY("first_efficiency"),
  FIRST_VOLTAGE("first_voltage"),
  FIRST_ENERGY("first_energy"),
  FIRST_CHARGE_END_VOLTAGE("first_charge_end_voltage"),
  CYCLE4_DISCHARGE("cycle4_discharge"),
  CYCLE4_RETENTION("cycle4_retention"),
  CYCLE4_DISCHARGE_DROP("cycle4_discharge_drop"),
  ONE_C_CYCLE("one_c_cycle"),
  ONE_C_CHARGE("one_c_charge"),
  ONE_C_DISCHARGE("one_c_discharge"),
  ONE_C_EFFICIENCY("one_c_efficiency"),
  ONE_C_RATE_RATIO("one_c_rate_ratio"),
  TARGET_RETENTION("target_retention"),
  CURRENT_RETENTION("current_retention"),
  CURRENT_VOLTAGE_RETENTION("current_voltage_retention"),
  CURRENT_ENERGY_RETENTION("current_energy_retention"),
  VOLTAGE_DECAY_RATE("voltage_decay_rate"),
  CYCLE_COUNT("cycle_count");

  private final String key;

  MetricName(String key) {
    this.key = key;
  }

  /** Snake-case key used in reports handed to the export collaborator. */
  public String getKey() {
    return key;
  }
}
