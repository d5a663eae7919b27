package com.fieldops.dispatch.scoring;

import java.util.Map;

/**
 * Score in 0..100 with the weighted contribution of every factor. Ineligible results carry a rejection code and score 0.
 */
public record ScoreResult(double value, Map<String, Double> breakdown, boolean eligible, String rejection) {
  public static ScoreResult rejected(String rejection, Map<String, Double> breakdown) {
    return new ScoreResult(0.0, breakdown, false, rejection);
  }
}
