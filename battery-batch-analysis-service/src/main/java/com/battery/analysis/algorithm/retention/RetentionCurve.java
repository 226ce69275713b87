package com.battery.analysis.algorithm.retention;

/**
 * Retention ratios of one channel on the grid of its {@link RetentionCurveSet}, in percent of the
 * baseline cycle value. Arrays are copied on the way in and out.
 *
 * @param channelId channel the curve belongs to
 * @param capacity discharge capacity retention per grid point
 * @param voltage voltage retention per grid point, null when not available
 * @param energy energy retention per grid point, null when not available
 */
public record RetentionCurve(String channelId, double[] capacity, double[] voltage, double[] energy) {

  public RetentionCurve {
    capacity = capacity.clone();
    voltage = copyOf(voltage);
    energy = copyOf(energy);
  }

  @Override
  public double[] capacity() {
    return capacity.clone();
  }

  @Override
  public double[] voltage() {
    return copyOf(voltage);
  }

  @Override
  public double[] energy() {
    return copyOf(energy);
  }

  public boolean hasVoltage() {
    return voltage != null;
  }

  public boolean hasEnergy() {
    return energy != null;
  }

  private static double[] copyOf(double[] values) {
    return values == null ? null : values.clone();
  }
}
