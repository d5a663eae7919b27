package com.fieldops.dispatch.route;

import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.GeoPoint;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.travel.TravelEstimate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * Insertion heuristic over one technician's day.
 *
 * <ol>
 *   <li>EN_ROUTE jobs stay at the head.</li>
 *   <li>Emergencies and jobs with a window narrower than the workday are seeded by window start, emergencies first
 *   on ties. Emergencies that already hold a route position keep it.</li>
 *   <li>Each remaining job goes to the feasible position with the least total travel, never ahead of an emergency.
 *   When no position is feasible the cheapest one is used and the plan is reported infeasible.</li>
 * </ol>
 * Suboptimal but feasible routes are accepted. Jobs are never dropped.
 */
@Component
public class RouteOptimizer {
  public static final String WINDOW_MISSED = "WINDOW_MISSED";

  public RoutePlan optimize(RouteRequest request, TravelTimes travelTimes) {
    MemoizedTravel travel = new MemoizedTravel(travelTimes);
    List<DispatchJob> pinned = new ArrayList<>();
    List<DispatchJob> anchored = new ArrayList<>();
    List<DispatchJob> constrained = new ArrayList<>();
    List<DispatchJob> flexible = new ArrayList<>();
    for (DispatchJob job : request.jobs()) {
      if (job.status() == WorkOrderStatus.EN_ROUTE) {
        pinned.add(job);
      } else if (job.isEmergency() && job.routeSequence() != null) {
        anchored.add(job);
      } else if (job.isEmergency() || isTimeConstrained(job, request)) {
        constrained.add(job);
      } else {
        flexible.add(job);
      }
    }
    pinned.sort(Comparator.comparing(DispatchJob::routeSequence, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(DispatchJob::id));
    constrained.sort(Comparator.comparing((DispatchJob j) -> seedTime(j, request))
        .thenComparing(j -> j.isEmergency() ? 0 : 1)
        .thenComparing(DispatchJob::id));
    anchored.sort(Comparator.comparing(DispatchJob::routeSequence).thenComparing(DispatchJob::id));
    flexible.sort(Comparator.comparing((DispatchJob j) -> j.priority().rank()).thenComparing(DispatchJob::id));

    List<DispatchJob> tail = new ArrayList<>(constrained);
    for (DispatchJob emergency : anchored) {
      int position = Math.max(0, Math.min(emergency.routeSequence() - pinned.size(), tail.size()));
      tail.add(position, emergency);
    }

    for (DispatchJob job : flexible) {
      int earliest = lastEmergencyIndex(tail) + 1;
      List<DispatchJob> best = null;
      Simulation bestSim = null;
      for (int p = earliest; p <= tail.size(); p++) {
        List<DispatchJob> candidate = new ArrayList<>(tail);
        candidate.add(p, job);
        Simulation sim = simulate(concat(pinned, candidate), request, travel);
        if (bestSim == null || better(sim, bestSim)) {
          best = candidate;
          bestSim = sim;
        }
      }
      tail = best;
    }

    Simulation result = simulate(concat(pinned, tail), request, travel);
    return new RoutePlan(request.technicianId(), request.date(), result.stops, result.violatingId == null,
        result.violatingId, result.violation, result.totalTravel, result.approximate);
  }

  static boolean isTimeConstrained(DispatchJob job, RouteRequest request) {
    if (!job.hasWindow()) {
      return false;
    }
    return job.windowStart().isAfter(request.dayStart()) || job.windowEnd().isBefore(request.dayEnd());
  }

  private static OffsetDateTime seedTime(DispatchJob job, RouteRequest request) {
    return job.windowStart() != null ? job.windowStart() : request.dayStart();
  }

  private static int lastEmergencyIndex(List<DispatchJob> sequence) {
    for (int i = sequence.size() - 1; i >= 0; i--) {
      if (sequence.get(i).isEmergency()) {
        return i;
      }
    }
    return -1;
  }

  /** Feasible beats infeasible, then less travel. Earlier positions win ties because they are tried first. */
  private static boolean better(Simulation a, Simulation b) {
    boolean aFeasible = a.violatingId == null;
    boolean bFeasible = b.violatingId == null;
    if (aFeasible != bFeasible) {
      return aFeasible;
    }
    return a.totalTravel.compareTo(b.totalTravel) < 0;
  }

  private static List<DispatchJob> concat(List<DispatchJob> head, List<DispatchJob> tail) {
    List<DispatchJob> all = new ArrayList<>(head.size() + tail.size());
    all.addAll(head);
    all.addAll(tail);
    return all;
  }

  private Simulation simulate(List<DispatchJob> sequence, RouteRequest request, MemoizedTravel travel) {
    List<RouteStop> stops = new ArrayList<>();
    OffsetDateTime clock = request.startAt();
    GeoPoint position = request.start();
    Duration totalTravel = Duration.ZERO;
    boolean approximate = false;
    Long violatingId = null;
    String violation = null;
    for (int i = 0; i < sequence.size(); i++) {
      DispatchJob job = sequence.get(i);
      TravelEstimate leg = travel.between(position, job.location(), clock);
      OffsetDateTime arrival = clock.plus(leg.duration());
      OffsetDateTime serviceStart = job.windowStart() != null && arrival.isBefore(job.windowStart()) ? job.windowStart() : arrival;
      boolean within = job.windowEnd() == null || !serviceStart.isAfter(job.windowEnd());
      if (!within && violatingId == null) {
        violatingId = job.id();
        violation = WINDOW_MISSED + ": earliest service start " + serviceStart + " is after window end " + job.windowEnd();
      }
      OffsetDateTime departure = serviceStart.plusMinutes(job.estimatedMinutes());
      stops.add(new RouteStop(i, job.id(), job.priority(), job.windowStart(), job.windowEnd(),
          arrival, serviceStart, departure, leg.duration(), leg.approximate(), within));
      totalTravel = totalTravel.plus(leg.duration());
      approximate |= leg.approximate();
      clock = departure;
      if (job.location() != null) {
        position = job.location();
      }
    }
    return new Simulation(stops, totalTravel, approximate, violatingId, violation);
  }

  private record Simulation(List<RouteStop> stops, Duration totalTravel, boolean approximate, Long violatingId, String violation) {}

  /** One lookup per point pair and optimizer run. */
  private static final class MemoizedTravel {
    private final TravelTimes delegate;
    private final Map<List<GeoPoint>, TravelEstimate> memo = new HashMap<>();

    MemoizedTravel(TravelTimes delegate) {
      this.delegate = delegate;
    }

    TravelEstimate between(GeoPoint from, GeoPoint to, OffsetDateTime departure) {
      if (from == null || to == null) {
        return TravelEstimate.fallback(Duration.ZERO);
      }
      return memo.computeIfAbsent(List.of(from, to), k -> delegate.between(from, to, departure));
    }
  }
}
