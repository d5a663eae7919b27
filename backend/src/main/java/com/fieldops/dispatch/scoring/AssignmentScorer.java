package com.fieldops.dispatch.scoring;

import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.ServiceCategory;
import com.fieldops.dispatch.domain.TechnicianProfile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Suitability of a technician for a job. Has no side effects: identical inputs give identical results.
 */
@Component
public class AssignmentScorer {
  public static final String SKILL = "skill";
  public static final String TRAVEL = "travel";
  public static final String WORKLOAD = "workload";
  public static final String CONTINUITY = "continuity";
  public static final String LOCATION_RECENCY = "locationRecency";

  public static final String MISSING_SKILL = "MISSING_SKILL";
  public static final String TRAVEL_CEILING = "TRAVEL_CEILING";
  public static final String NO_TRAVEL_ESTIMATE = "NO_TRAVEL_ESTIMATE";

  public ScoreResult score(DispatchJob job, TechnicianProfile technician, ScoringContext context) {
    ScoringPolicy policy = context.policy();
    ScoringWeights w = policy.weights();
    Map<String, Double> breakdown = new LinkedHashMap<>();

    double skill = skillValue(job.category(), technician);
    breakdown.put(SKILL, w.skill() * skill);
    if (skill == 0.0) {
      return ScoreResult.rejected(MISSING_SKILL, Collections.unmodifiableMap(breakdown));
    }

    if (context.travel() == null) {
      return ScoreResult.rejected(NO_TRAVEL_ESTIMATE, Collections.unmodifiableMap(breakdown));
    }
    double minutes = context.travel().minutes();
    if (minutes > policy.travelCeilingMinutes()) {
      breakdown.put(TRAVEL, 0.0);
      return ScoreResult.rejected(TRAVEL_CEILING, Collections.unmodifiableMap(breakdown));
    }
    double travel = 100.0 * (1.0 - minutes / policy.travelCeilingMinutes());
    if (context.travel().approximate()) {
      travel *= policy.approximateTravelDiscount();
    }
    breakdown.put(TRAVEL, w.travel() * travel);

    double workload = Math.max(0.0, 100.0 - policy.workloadPenaltyPerJob() * context.jobsThatDay());
    breakdown.put(WORKLOAD, w.workload() * workload);

    double continuity = context.servedBefore() ? 100.0 : 0.0;
    breakdown.put(CONTINUITY, w.continuity() * continuity);

    double recency = recencyValue(technician, context);
    breakdown.put(LOCATION_RECENCY, w.locationRecency() * recency);

    double total = 0.0;
    for (double part : breakdown.values()) {
      total += part;
    }
    return new ScoreResult(Math.max(0.0, Math.min(100.0, total)), Collections.unmodifiableMap(breakdown), true, null);
  }

  static double skillValue(ServiceCategory category, TechnicianProfile technician) {
    if (technician.skills().contains(category)) {
      return 100.0;
    }
    if (technician.skills().contains(ServiceCategory.GENERAL)) {
      return 80.0;
    }
    return 0.0;
  }

  private double recencyValue(TechnicianProfile technician, ScoringContext context) {
    if (technician.lastFixAt() == null || context.now() == null) {
      return 0.0;
    }
    Duration age = Duration.between(technician.lastFixAt(), context.now());
    ScoringPolicy policy = context.policy();
    if (age.compareTo(policy.freshLocationWithin()) <= 0) {
      return 100.0;
    }
    if (age.compareTo(policy.locationStaleAfter()) >= 0) {
      return 0.0;
    }
    double span = policy.locationStaleAfter().minus(policy.freshLocationWithin()).toMillis();
    double past = age.minus(policy.freshLocationWithin()).toMillis();
    return 100.0 * (1.0 - past / span);
  }
}
