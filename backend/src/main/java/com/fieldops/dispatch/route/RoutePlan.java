package com.fieldops.dispatch.route;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Ordered visit sequence. An infeasible plan still lists every job; {@code violatingWorkOrderId} names the first
 * job whose window cannot be met.
 */
public record RoutePlan(
    Long technicianId,
    LocalDate date,
    List<RouteStop> stops,
    boolean feasible,
    Long violatingWorkOrderId,
    String violation,
    Duration totalTravel,
    boolean approximate
) {
  public RoutePlan {
    stops = List.copyOf(stops);
  }

  public List<Long> sequence() {
    return stops.stream().map(RouteStop::workOrderId).toList();
  }
}
