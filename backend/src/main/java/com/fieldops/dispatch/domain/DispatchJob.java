package com.fieldops.dispatch.domain;

import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Read-only view of a work order as seen by scoring, the availability index and the route optimizer.
 */
public record DispatchJob(
    Long id,
    Long customerId,
    Long propertyId,
    ServiceCategory category,
    Priority priority,
    WorkOrderStatus status,
    LocalDate serviceDate,
    OffsetDateTime windowStart,
    OffsetDateTime windowEnd,
    Long technicianId,
    int estimatedMinutes,
    GeoPoint location,
    Integer routeSequence,
    OffsetDateTime createdAt
) {
  public static DispatchJob from(WorkOrderEntity w) {
    return new DispatchJob(
        w.id, w.customerId, w.propertyId, w.category, w.priority, w.status, w.serviceDate,
        w.windowStart, w.windowEnd, w.technicianId, w.estimatedMinutes,
        GeoPoint.ofNullable(w.latitude, w.longitude), w.routeSequence, w.createdAt);
  }

  public boolean isEmergency() {
    return priority == Priority.EMERGENCY;
  }

  public boolean hasWindow() {
    return windowStart != null && windowEnd != null;
  }
}
