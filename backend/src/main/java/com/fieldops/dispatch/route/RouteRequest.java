package com.fieldops.dispatch.route;

import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.GeoPoint;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * @param startAt  when the technician leaves {@code start}; the later of the workday start and now
 * @param dayStart workday bounds, used to tell time-constrained windows from full-day ones
 */
public record RouteRequest(
    Long technicianId,
    LocalDate date,
    GeoPoint start,
    OffsetDateTime startAt,
    OffsetDateTime dayStart,
    OffsetDateTime dayEnd,
    List<DispatchJob> jobs
) {
  public RouteRequest {
    jobs = List.copyOf(jobs);
  }
}
