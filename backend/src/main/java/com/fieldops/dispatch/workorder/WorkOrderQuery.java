package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.domain.WorkOrderStatus;

import java.time.LocalDate;

/** Filter for work order listings; null fields match everything. */
public record WorkOrderQuery(LocalDate serviceDate, WorkOrderStatus status, Long technicianId) {
  public static WorkOrderQuery onDate(LocalDate date) {
    return new WorkOrderQuery(date, null, null);
  }

  public static WorkOrderQuery scheduleOf(Long technicianId, LocalDate date) {
    return new WorkOrderQuery(date, null, technicianId);
  }
}
