package com.battery.analysis.algorithm.selection;

/** Enum representing the reference channel selection strategies, in priority order. */
public enum ReferenceMethod {
  RETENTION_CURVE_MSE("retention_curve_mse"),
  PCA("pca"),
  TRADITIONAL("traditional");

  private final String label;

  ReferenceMethod(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
