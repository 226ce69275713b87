package com.battery.analysis.algorithm.retention;

import java.util.List;

/**
 * Retention curves of a batch resampled onto one grid of cycle offsets from each channel's
 * baseline cycle. The grid is copied on the way in and out.
 *
 * @param grid cycle offsets, ascending and starting at 0
 * @param curves one curve per channel, in batch channel order
 */
public record RetentionCurveSet(double[] grid, List<RetentionCurve> curves) {

  public RetentionCurveSet {
    grid = grid.clone();
    curves = List.copyOf(curves);
  }

  @Override
  public double[] grid() {
    return grid.clone();
  }

  public int gridSize() {
    return grid.length;
  }

  public static RetentionCurveSet empty() {
    return new RetentionCurveSet(new double[0], List.of());
  }

  public boolean isEmpty() {
    return curves.isEmpty();
  }

  public int size() {
    return curves.size();
  }

  public boolean allHaveVoltage() {
    return !curves.isEmpty() && curves.stream().allMatch(RetentionCurve::hasVoltage);
  }

  public boolean allHaveEnergy() {
    return !curves.isEmpty() && curves.stream().allMatch(RetentionCurve::hasEnergy);
  }
}
