package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.route.EtaUpdate;

import java.util.List;
import java.util.Map;

public record AssignmentOutcome(
    Long workOrderId,
    Kind kind,
    Long technicianId,
    Double score,
    Map<String, Double> breakdown,
    String reasoning,
    boolean escalated,
    List<CandidateEvaluation> evaluations,
    List<EtaUpdate> etaUpdates
) {
  public enum Kind { ASSIGNED, NO_ELIGIBLE_TECHNICIAN, ABORTED }

  public AssignmentOutcome {
    evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
    etaUpdates = etaUpdates == null ? List.of() : List.copyOf(etaUpdates);
  }

  public static AssignmentOutcome aborted(Long workOrderId, List<CandidateEvaluation> evaluations) {
    return new AssignmentOutcome(workOrderId, Kind.ABORTED, null, null, null, "search aborted", false, evaluations, List.of());
  }

  public static AssignmentOutcome noEligible(Long workOrderId, String reasoning, boolean escalated, List<CandidateEvaluation> evaluations) {
    return new AssignmentOutcome(workOrderId, Kind.NO_ELIGIBLE_TECHNICIAN, null, null, null, reasoning, escalated, evaluations, List.of());
  }

  public boolean assigned() {
    return kind == Kind.ASSIGNED;
  }
}
