package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.scoring.ScoreResult;
import com.fieldops.dispatch.travel.TravelEstimate;

import java.util.Comparator;

/**
 * Result of evaluating one technician for one job. {@code rejection} is null for eligible candidates.
 */
public record CandidateEvaluation(Long technicianId, ScoreResult score, TravelEstimate travel, String rejection, String detail) {
  public static final String CANCELLED = "CANCELLED";
  public static final String UNKNOWN_TECHNICIAN = "UNKNOWN_TECHNICIAN";
  public static final String INACTIVE = "INACTIVE";
  public static final String AT_CAPACITY = "AT_CAPACITY";
  public static final String BUSY_WITH_EMERGENCY = "BUSY_WITH_EMERGENCY";
  public static final String OUTSIDE_WORKING_HOURS = "OUTSIDE_WORKING_HOURS";
  public static final String ROUTE_UNAVAILABLE = "ROUTE_UNAVAILABLE";
  public static final String TRAVEL_FAILED = "TRAVEL_FAILED";
  public static final String TIMEOUT = "TIMEOUT";

  /** Highest score first, lowest technician id on ties. */
  public static final Comparator<CandidateEvaluation> RANKING = Comparator
      .comparingDouble((CandidateEvaluation e) -> e.score().value()).reversed()
      .thenComparing(CandidateEvaluation::technicianId);

  public static CandidateEvaluation rejected(Long technicianId, String rejection, String detail) {
    return new CandidateEvaluation(technicianId, null, null, rejection, detail);
  }

  public static CandidateEvaluation scored(Long technicianId, ScoreResult score, TravelEstimate travel) {
    return new CandidateEvaluation(technicianId, score, travel, score.eligible() ? null : score.rejection(), null);
  }

  public boolean eligible() {
    return rejection == null && score != null && score.eligible();
  }
}
