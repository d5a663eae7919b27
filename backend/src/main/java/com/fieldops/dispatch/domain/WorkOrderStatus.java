package com.fieldops.dispatch.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Work order lifecycle.
 *
 * <p>{@code ASSIGNED -> QUALIFIED} is the release edge used when a job is handed back for reassignment.
 * {@code ON_HOLD} resumes to whichever state it was entered from.
 */
public enum WorkOrderStatus {
  CREATED,
  QUALIFIED,
  ASSIGNED,
  EN_ROUTE,
  IN_PROGRESS,
  ON_HOLD,
  COMPLETED,
  CANCELLED;

  public static final Set<WorkOrderStatus> ON_TECHNICIAN_SCHEDULE = EnumSet.of(ASSIGNED, EN_ROUTE, IN_PROGRESS, ON_HOLD);
  public static final Set<WorkOrderStatus> ROUTABLE = EnumSet.of(ASSIGNED, EN_ROUTE);

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  public boolean requiresTechnician() {
    return ON_TECHNICIAN_SCHEDULE.contains(this) || this == COMPLETED;
  }

  public Set<WorkOrderStatus> allowedTargets() {
    return switch (this) {
      case CREATED -> EnumSet.of(QUALIFIED, CANCELLED);
      case QUALIFIED -> EnumSet.of(ASSIGNED, CANCELLED);
      case ASSIGNED -> EnumSet.of(QUALIFIED, EN_ROUTE, IN_PROGRESS, ON_HOLD, CANCELLED);
      case EN_ROUTE -> EnumSet.of(IN_PROGRESS, CANCELLED);
      case IN_PROGRESS -> EnumSet.of(COMPLETED, ON_HOLD, CANCELLED);
      case ON_HOLD -> EnumSet.of(ASSIGNED, IN_PROGRESS, CANCELLED);
      case COMPLETED, CANCELLED -> EnumSet.noneOf(WorkOrderStatus.class);
    };
  }

  public boolean canTransitionTo(WorkOrderStatus target) {
    return target != null && allowedTargets().contains(target);
  }
}
