package com.fieldops.dispatch.route;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.TechnicianProfile;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.travel.RouteUnavailableException;
import com.fieldops.dispatch.travel.TravelEstimate;
import com.fieldops.dispatch.travel.TravelTimeEstimator;
import com.fieldops.dispatch.workorder.WorkOrderQuery;
import com.fieldops.dispatch.workorder.WorkOrderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.*;
import java.util.*;

/**
 * Plans technician routes and persists the resulting ETAs and route positions with version-checked writes.
 */
@Service
public class RouteService {
  private static final Logger log = LoggerFactory.getLogger(RouteService.class);
  private static final int MAX_WRITE_ATTEMPTS = 3;

  private final WorkOrderStore store;
  private final TechnicianAvailabilityIndex index;
  private final TravelTimeEstimator travelTimes;
  private final RouteOptimizer optimizer;
  private final Clock clock;

  public RouteService(WorkOrderStore store, TechnicianAvailabilityIndex index, TravelTimeEstimator travelTimes,
                      RouteOptimizer optimizer, Clock clock) {
    this.store = store;
    this.index = index;
    this.travelTimes = travelTimes;
    this.optimizer = optimizer;
    this.clock = clock;
  }

  public RoutePlan plan(Long technicianId, LocalDate date) {
    return optimizer.optimize(request(technicianId, date), travel(false));
  }

  /**
   * Re-plans the route and stores ETAs and positions. {@code fresh} bypasses the travel cache; it is used right
   * after a dispatch commit because the ETAs go to customers.
   */
  public RouteRefresh refresh(Long technicianId, LocalDate date, boolean fresh) {
    RouteRequest request = request(technicianId, date);
    RoutePlan plan = optimizer.optimize(request, travel(fresh));
    if (!plan.feasible()) {
      log.warn("Route infeasible technician={} date={} workOrder={} violation={}",
          technicianId, date, plan.violatingWorkOrderId(), plan.violation());
    }
    List<EtaUpdate> updates = new ArrayList<>();
    for (RouteStop stop : plan.stops()) {
      persist(stop).ifPresent(updates::add);
    }
    return new RouteRefresh(plan, updates);
  }

  @Scheduled(fixedDelayString = "${app.route.refresh-interval-ms:600000}", initialDelayString = "${app.route.refresh-interval-ms:600000}")
  public void refreshToday() {
    LocalDate today = LocalDate.now(clock);
    Set<Long> technicians = new TreeSet<>();
    for (WorkOrderEntity w : store.query(WorkOrderQuery.onDate(today))) {
      if (w.technicianId != null && WorkOrderStatus.ROUTABLE.contains(w.status)) {
        technicians.add(w.technicianId);
      }
    }
    for (Long technicianId : technicians) {
      try {
        RouteRefresh refresh = refresh(technicianId, today, false);
        log.debug("Route refreshed technician={} stops={} etaUpdates={}", technicianId, refresh.plan().stops().size(), refresh.etaUpdates().size());
      } catch (RuntimeException ex) {
        log.error("Route refresh failed technician={} date={}", technicianId, today, ex);
      }
    }
  }

  private RouteRequest request(Long technicianId, LocalDate date) {
    TechnicianProfile technician = index.profile(technicianId)
        .orElseThrow(() -> new NotFoundException("Technician", technicianId));
    ZoneId zone = clock.getZone();
    OffsetDateTime dayStart = date.atTime(technician.workdayStart()).atZone(zone).toOffsetDateTime();
    OffsetDateTime dayEnd = date.atTime(technician.workdayEnd()).atZone(zone).toOffsetDateTime();
    OffsetDateTime now = OffsetDateTime.now(clock);
    OffsetDateTime startAt = now.isAfter(dayStart) ? now : dayStart;
    List<DispatchJob> jobs = store.query(WorkOrderQuery.scheduleOf(technicianId, date)).stream()
        .filter(w -> WorkOrderStatus.ROUTABLE.contains(w.status))
        .map(DispatchJob::from)
        .toList();
    return new RouteRequest(technicianId, date, technician.currentOrHome(), startAt, dayStart, dayEnd, jobs);
  }

  private TravelTimes travel(boolean fresh) {
    return (from, to, departure) -> {
      try {
        return fresh ? travelTimes.estimateFresh(from, to, departure) : travelTimes.estimate(from, to, departure);
      } catch (RouteUnavailableException ex) {
        if (from == null || to == null || !from.isValid() || !to.isValid()) {
          log.warn("Missing coordinates {} -> {}, counting leg as zero: {}", from, to, ex.getMessage());
          return TravelEstimate.fallback(Duration.ZERO);
        }
        log.warn("No route {} -> {}, using straight-line estimate: {}", from, to, ex.getMessage());
        return travelTimes.straightLine(from, to);
      }
    };
  }

  private Optional<EtaUpdate> persist(RouteStop stop) {
    for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
      Optional<WorkOrderEntity> current = store.get(stop.workOrderId());
      if (current.isEmpty() || !WorkOrderStatus.ROUTABLE.contains(current.get().status)) {
        return Optional.empty();
      }
      WorkOrderEntity w = current.get();
      OffsetDateTime previousEta = w.eta;
      Integer previousSequence = w.routeSequence;
      if (sameInstant(previousEta, stop.serviceStart()) && Objects.equals(previousSequence, stop.sequence())) {
        return Optional.empty();
      }
      w.eta = stop.serviceStart();
      w.routeSequence = stop.sequence();
      Optional<WorkOrderEntity> saved = store.saveIfVersion(w);
      if (saved.isPresent()) {
        index.upsertJob(DispatchJob.from(saved.get()));
        return Optional.of(new EtaUpdate(w.id, previousEta, w.eta, previousSequence, w.routeSequence));
      }
    }
    log.warn("Could not store ETA for workOrder={} after {} attempts; next refresh will retry", stop.workOrderId(), MAX_WRITE_ATTEMPTS);
    return Optional.empty();
  }

  private static boolean sameInstant(OffsetDateTime a, OffsetDateTime b) {
    return a == null ? b == null : b != null && a.isEqual(b);
  }
}
