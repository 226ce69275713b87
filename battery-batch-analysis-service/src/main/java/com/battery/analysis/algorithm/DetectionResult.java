package com.battery.analysis.algorithm;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of running a detector over one metric vector.
 *
 * @param scores decisive score per flagged position, ordered by position
 * @param iterations number of passes the detector ran
 * @param survivorTrace surviving value count at the start of each pass followed by the final count
 */
public record DetectionResult(Map<Integer, Double> scores, int iterations, List<Integer> survivorTrace) {

  public DetectionResult {
    scores = Collections.unmodifiableMap(new TreeMap<>(scores));
    survivorTrace = List.copyOf(survivorTrace);
  }

  /** Result for a vector in which nothing was flagged. */
  public static DetectionResult none(int size) {
    return new DetectionResult(Map.of(), 0, List.of(size));
  }

  public boolean isFlagged(int position) {
    return scores.containsKey(position);
  }

  public int flaggedCount() {
    return scores.size();
  }
}
