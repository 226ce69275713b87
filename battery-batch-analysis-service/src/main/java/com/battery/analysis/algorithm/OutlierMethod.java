package com.battery.analysis.algorithm;

/** Enum representing the implemented outlier detection methods. */
public enum OutlierMethod {
  BOXPLOT("boxplot"),
  ZSCORE_MAD("zscore_mad");

  private final String label;

  OutlierMethod(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
