package com.battery.analysis.dto;

import lombok.Builder;

/**
 * One cycle of a channel's cycling test as supplied by the ingestion collaborator. Every measured
 * field may be missing, in which case it is {@code null}.
 *
 * @param cycleIndex 1-based cycle number
 * @param chargeCapacity charge capacity (mAh/g)
 * @param dischargeCapacity discharge capacity (mAh/g)
 * @param efficiency coulombic efficiency in percent
 * @param voltage representative (median) discharge voltage
 * @param energy discharge energy
 * @param chargeEndVoltage voltage at the end of the charge step, when the cycler reports it
 * @param modeLabel step/mode label attached to the cycle, e.g. {@code -1C-}
 */
@Builder(toBuilder = true)
public record CycleRecord(
    int cycleIndex,
    Double chargeCapacity,
    Double dischargeCapacity,
    Double efficiency,
    Double voltage,
    Double energy,
    Double chargeEndVoltage,
    String modeLabel) {

  public CycleRecord {
    if (cycleIndex < 1) {
      throw new IllegalArgumentException("Cycle index must be at least 1, got " + cycleIndex);
    }
  }

  /**
   * Returns the reported efficiency, or derives it from the capacities when it was not reported.
   *
   * @return efficiency in percent, or {@code null} if it cannot be determined
   */
  public Double resolvedEfficiency() {
    if (efficiency != null) {
      return efficiency;
    }
    if (chargeCapacity == null || dischargeCapacity == null || chargeCapacity <= 0) {
      return null;
    }
    return dischargeCapacity / chargeCapacity * 100.0;
  }
}
