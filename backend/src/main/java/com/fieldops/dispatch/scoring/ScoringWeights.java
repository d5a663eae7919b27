package com.fieldops.dispatch.scoring;

/**
 * Factor weights of the assignment score. They are expected to sum to 1 so that scores stay in 0..100.
 */
public record ScoringWeights(double skill, double travel, double workload, double continuity, double locationRecency) {
  public static final ScoringWeights DEFAULT = new ScoringWeights(0.40, 0.25, 0.20, 0.10, 0.05);

  public ScoringWeights {
    if (skill < 0 || travel < 0 || workload < 0 || continuity < 0 || locationRecency < 0) {
      throw new IllegalArgumentException("Scoring weights must not be negative");
    }
  }

  public double total() {
    return skill + travel + workload + continuity + locationRecency;
  }
}
