package com.fieldops.dispatch.scoring;

import java.time.Duration;

public record ScoringPolicy(
    ScoringWeights weights,
    double travelCeilingMinutes,
    double approximateTravelDiscount,
    double workloadPenaltyPerJob,
    Duration freshLocationWithin,
    Duration locationStaleAfter
) {
  public static final ScoringPolicy DEFAULT = new ScoringPolicy(
      ScoringWeights.DEFAULT, 60.0, 0.8, 20.0, Duration.ofMinutes(15), Duration.ofHours(4));

  public ScoringPolicy withWeights(ScoringWeights w) {
    return new ScoringPolicy(w, travelCeilingMinutes, approximateTravelDiscount, workloadPenaltyPerJob, freshLocationWithin, locationStaleAfter);
  }
}
