package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.config.DispatchConfig;
import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.TechnicianProfile;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.scoring.AssignmentScorer;
import com.fieldops.dispatch.scoring.ScoreResult;
import com.fieldops.dispatch.scoring.ScoringContext;
import com.fieldops.dispatch.scoring.ScoringPolicy;
import com.fieldops.dispatch.travel.RouteUnavailableException;
import com.fieldops.dispatch.travel.TravelEstimate;
import com.fieldops.dispatch.travel.TravelTimeEstimator;
import com.fieldops.dispatch.workorder.WorkOrderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Evaluates candidate technicians concurrently on a bounded pool.
 *
 * <p>A travel failure only rejects that candidate. Data store failures propagate and abort the whole evaluation.
 * The cancellation flag is checked before every candidate.
 */
@Component
public class CandidateEvaluator {
  private static final Logger log = LoggerFactory.getLogger(CandidateEvaluator.class);

  private final TechnicianAvailabilityIndex index;
  private final TravelTimeEstimator travelTimes;
  private final AssignmentScorer scorer;
  private final WorkOrderStore store;
  private final ExecutorService executor;
  private final long timeoutMs;
  private final Clock clock;

  public CandidateEvaluator(
      TechnicianAvailabilityIndex index,
      TravelTimeEstimator travelTimes,
      AssignmentScorer scorer,
      WorkOrderStore store,
      @Qualifier(DispatchConfig.CANDIDATE_EXECUTOR) ExecutorService executor,
      DispatchProperties properties,
      Clock clock
  ) {
    this.index = index;
    this.travelTimes = travelTimes;
    this.scorer = scorer;
    this.store = store;
    this.executor = executor;
    this.timeoutMs = properties.getCandidateTimeoutMs();
    this.clock = clock;
  }

  /**
   * All candidates share one deadline. A candidate still running at the deadline is rejected as TIMEOUT and its
   * task is interrupted so the pool thread is released.
   */
  public List<CandidateEvaluation> evaluate(DispatchJob job, List<Long> candidates, ScoringPolicy policy,
                                            boolean enforceSchedule, BooleanSupplier cancelled) {
    OffsetDateTime now = OffsetDateTime.now(clock);
    List<Future<CandidateEvaluation>> futures = new ArrayList<>();
    for (Long technicianId : candidates) {
      futures.add(executor.submit(() -> evaluateOne(job, technicianId, policy, enforceSchedule, cancelled, now)));
    }
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    List<CandidateEvaluation> results = new ArrayList<>();
    try {
      for (int i = 0; i < futures.size(); i++) {
        results.add(await(futures.get(i), candidates.get(i), deadline));
      }
    } finally {
      futures.forEach(f -> f.cancel(true));
    }
    return results;
  }

  private CandidateEvaluation await(Future<CandidateEvaluation> future, Long technicianId, long deadline) {
    try {
      return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      log.warn("Candidate evaluation timed out technician={} after {} ms", technicianId, timeoutMs);
      return CandidateEvaluation.rejected(technicianId, CandidateEvaluation.TIMEOUT, "evaluation exceeded " + timeoutMs + " ms");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Candidate evaluation failed", cause);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while evaluating candidates", ex);
    }
  }

  CandidateEvaluation evaluateOne(DispatchJob job, Long technicianId, ScoringPolicy policy,
                                  boolean enforceSchedule, BooleanSupplier cancelled, OffsetDateTime now) {
    if (cancelled.getAsBoolean()) {
      return CandidateEvaluation.rejected(technicianId, CandidateEvaluation.CANCELLED, "search aborted");
    }
    Optional<TechnicianProfile> found = index.profile(technicianId);
    if (found.isEmpty()) {
      return CandidateEvaluation.rejected(technicianId, CandidateEvaluation.UNKNOWN_TECHNICIAN, null);
    }
    TechnicianProfile technician = found.get();
    if (!technician.active()) {
      return CandidateEvaluation.rejected(technicianId, CandidateEvaluation.INACTIVE, null);
    }
    if (!technician.holdsSkillFor(job.category())) {
      ScoreResult noSkill = scorer.score(job, technician, new ScoringContext(null, 0, false, now, policy));
      return CandidateEvaluation.scored(technicianId, noSkill, null);
    }
    if (enforceSchedule) {
      Optional<String> conflict = scheduleConflict(job, technician, now);
      if (conflict.isPresent()) {
        return CandidateEvaluation.rejected(technicianId, conflict.get(), null);
      }
    }

    TravelEstimate travel;
    try {
      travel = travelTimes.estimate(technician.currentOrHome(), job.location(), departure(job, technician, now));
    } catch (RouteUnavailableException ex) {
      return CandidateEvaluation.rejected(technicianId, CandidateEvaluation.ROUTE_UNAVAILABLE, ex.getMessage());
    } catch (RuntimeException ex) {
      log.warn("Travel estimate failed for technician={} workOrder={}: {}", technicianId, job.id(), ex.toString());
      return CandidateEvaluation.rejected(technicianId, CandidateEvaluation.TRAVEL_FAILED, ex.getMessage());
    }

    int jobsThatDay = (int) index.scheduleOf(technicianId, job.serviceDate()).stream()
        .filter(j -> !j.id().equals(job.id()))
        .count();
    boolean servedBefore = store.hasServed(technicianId, job.customerId(), job.propertyId());
    ScoreResult score = scorer.score(job, technician, new ScoringContext(travel, jobsThatDay, servedBefore, now, policy));
    return CandidateEvaluation.scored(technicianId, score, travel);
  }

  /**
   * Constraints that depend on the technician's current schedule. Checked during evaluation and again under the
   * technician lock right before a commit.
   */
  public Optional<String> scheduleConflict(DispatchJob job, TechnicianProfile technician, OffsetDateTime now) {
    List<DispatchJob> others = index.scheduleOf(technician.id(), job.serviceDate()).stream()
        .filter(j -> !j.id().equals(job.id()))
        .toList();
    if (job.isEmergency()) {
      boolean busy = others.stream().anyMatch(j -> j.isEmergency()
          && (WorkOrderStatus.ROUTABLE.contains(j.status()) || j.status() == WorkOrderStatus.IN_PROGRESS));
      if (busy) {
        return Optional.of(CandidateEvaluation.BUSY_WITH_EMERGENCY);
      }
    } else if (others.size() >= technician.maxJobsPerDay()) {
      return Optional.of(CandidateEvaluation.AT_CAPACITY);
    }
    if (!(job.isEmergency() && technician.onCall()) && !withinWorkingHours(job, technician, now)) {
      return Optional.of(CandidateEvaluation.OUTSIDE_WORKING_HOURS);
    }
    return Optional.empty();
  }

  private boolean withinWorkingHours(DispatchJob job, TechnicianProfile technician, OffsetDateTime now) {
    ZoneId zone = clock.getZone();
    OffsetDateTime dayStart = job.serviceDate().atTime(technician.workdayStart()).atZone(zone).toOffsetDateTime();
    OffsetDateTime dayEnd = job.serviceDate().atTime(technician.workdayEnd()).atZone(zone).toOffsetDateTime();
    if (job.hasWindow()) {
      return job.windowStart().isBefore(dayEnd) && job.windowEnd().isAfter(dayStart);
    }
    return !(job.serviceDate().equals(LocalDate.now(clock)) && !now.isBefore(dayEnd));
  }

  private OffsetDateTime departure(DispatchJob job, TechnicianProfile technician, OffsetDateTime now) {
    OffsetDateTime planned = job.windowStart() != null
        ? job.windowStart()
        : job.serviceDate().atTime(technician.workdayStart()).atZone(clock.getZone()).toOffsetDateTime();
    return planned.isBefore(now) ? now : planned;
  }
}
