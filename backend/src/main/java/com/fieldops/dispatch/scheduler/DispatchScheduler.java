package com.fieldops.dispatch.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.common.Actors;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.Entities.AssignmentEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.TechnicianProfile;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.route.EtaUpdate;
import com.fieldops.dispatch.route.RouteRefresh;
import com.fieldops.dispatch.route.RouteService;
import com.fieldops.dispatch.scoring.AssignmentScorer;
import com.fieldops.dispatch.scoring.ScoringPolicy;
import com.fieldops.dispatch.scoring.ScoringProperties;
import com.fieldops.dispatch.workorder.AuditTrail;
import com.fieldops.dispatch.workorder.IllegalTransitionException;
import com.fieldops.dispatch.workorder.WorkOrderQuery;
import com.fieldops.dispatch.workorder.WorkOrderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Assigns qualified work orders to technicians.
 *
 * <p>Candidate selection runs against the availability index without locks. The commit is serialized per technician
 * and schedule constraints are re-checked under that lock, so two jobs racing for the last slot of one technician
 * cannot both win. The work order write itself is version-checked; when it loses a race the whole selection is re-run
 * on fresh data, up to {@code app.dispatch.max-conflict-retries} times.
 */
@Service
public class DispatchScheduler {
  private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);
  public static final String OUTCOME_ASSIGNED = "ASSIGNED";
  public static final String OUTCOME_NO_ELIGIBLE = "NO_ELIGIBLE_TECHNICIAN";

  private static final Set<String> MANUAL_BLOCKING = Set.of(
      AssignmentScorer.MISSING_SKILL,
      CandidateEvaluation.UNKNOWN_TECHNICIAN,
      CandidateEvaluation.INACTIVE,
      CandidateEvaluation.CANCELLED);

  private final WorkOrderStore store;
  private final TechnicianAvailabilityIndex index;
  private final CandidateEvaluator evaluator;
  private final RouteService routes;
  private final DispatchNotifier notifier;
  private final AuditTrail audit;
  private final AssignmentSearchRegistry searches;
  private final ScoringProperties scoring;
  private final DispatchProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ConcurrentHashMap<Long, ReentrantLock> technicianLocks = new ConcurrentHashMap<>();

  public DispatchScheduler(WorkOrderStore store, TechnicianAvailabilityIndex index, CandidateEvaluator evaluator,
                           RouteService routes, DispatchNotifier notifier, AuditTrail audit,
                           AssignmentSearchRegistry searches, ScoringProperties scoring, DispatchProperties properties,
                           ObjectMapper objectMapper, Clock clock) {
    this.store = store;
    this.index = index;
    this.evaluator = evaluator;
    this.routes = routes;
    this.notifier = notifier;
    this.audit = audit;
    this.searches = searches;
    this.scoring = scoring;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Picks the best eligible technician for a QUALIFIED order. */
  public AssignmentOutcome assign(Long workOrderId) {
    return run(new Request(workOrderId, null, Set.of(), EnumSet.of(WorkOrderStatus.QUALIFIED), Actors.current(), null));
  }

  /** Dispatcher override: assigns to the named technician. Only the skill filter applies. */
  public AssignmentOutcome assignTo(Long workOrderId, Long technicianId, String reason) {
    return run(new Request(workOrderId, technicianId, Set.of(), EnumSet.of(WorkOrderStatus.QUALIFIED), Actors.current(), reason));
  }

  /**
   * Moves an ASSIGNED order to another technician: the named one, or the best candidate other than the current one.
   * The order keeps its current assignment when nobody else is eligible.
   */
  public AssignmentOutcome reassign(Long workOrderId, Long technicianId, String reason) {
    searches.cancel(workOrderId);
    WorkOrderEntity current = load(workOrderId);
    Set<Long> excluded = current.technicianId == null ? Set.of() : Set.of(current.technicianId);
    return run(new Request(workOrderId, technicianId, excluded, EnumSet.of(WorkOrderStatus.ASSIGNED), Actors.current(), reason));
  }

  /** Flags any in-flight search for the order; the search stops before its next candidate. */
  public boolean abortSearch(Long workOrderId) {
    boolean aborted = searches.cancel(workOrderId);
    if (aborted) {
      log.info("Assignment search aborted workOrder={}", workOrderId);
    }
    return aborted;
  }

  /** Assigns every QUALIFIED order of the date: emergencies first, then by priority and creation time. */
  public List<AssignmentOutcome> dispatchPending(LocalDate date) {
    List<WorkOrderEntity> pending = new ArrayList<>(store.query(new WorkOrderQuery(date, WorkOrderStatus.QUALIFIED, null)));
    pending.sort(Comparator.comparing((WorkOrderEntity w) -> w.priority.rank())
        .thenComparing(w -> w.createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(w -> w.id));
    List<AssignmentOutcome> outcomes = new ArrayList<>();
    for (WorkOrderEntity w : pending) {
      try {
        outcomes.add(assign(w.id));
      } catch (IllegalTransitionException | ConcurrencyConflictException ex) {
        log.warn("Batch dispatch skipped workOrder={} code={} message={}", w.id, ex.code(), ex.getMessage());
      }
    }
    log.info("Batch dispatch date={} pending={} assigned={}", date, pending.size(),
        outcomes.stream().filter(AssignmentOutcome::assigned).count());
    return outcomes;
  }

  @Scheduled(fixedDelayString = "${app.dispatch.batch-interval-ms:300000}", initialDelayString = "${app.dispatch.batch-interval-ms:300000}")
  public void dispatchToday() {
    LocalDate today = LocalDate.now(clock);
    try {
      dispatchPending(today);
    } catch (RuntimeException ex) {
      log.error("Batch dispatch failed date={}", today, ex);
    }
  }

  private AssignmentOutcome run(Request request) {
    int attempts = properties.getMaxConflictRetries();
    AtomicBoolean cancelled = searches.begin(request.workOrderId());
    try {
      for (int attempt = 1; attempt <= attempts; attempt++) {
        Attempt result = attempt(request, cancelled);
        if (result.outcome() != null) {
          return result.outcome();
        }
        log.info("Version conflict on workOrder={} attempt={}/{}, retrying on fresh data", request.workOrderId(), attempt, attempts);
      }
      throw new ConcurrencyConflictException(request.workOrderId(), attempts);
    } finally {
      searches.end(request.workOrderId(), cancelled);
    }
  }

  private Attempt attempt(Request request, AtomicBoolean cancelled) {
    WorkOrderEntity current = load(request.workOrderId());
    if (!request.allowedFrom().contains(current.status)) {
      throw new IllegalTransitionException(current.id, current.status, WorkOrderStatus.ASSIGNED);
    }
    DispatchJob job = DispatchJob.from(current);
    ScoringPolicy policy = scoring.toPolicy();
    boolean manual = request.technicianId() != null;
    List<Long> candidates = manual
        ? List.of(request.technicianId())
        : index.candidatesFor(job.category(), job.serviceDate()).stream().filter(id -> !request.excluded().contains(id)).toList();

    List<CandidateEvaluation> evaluations = evaluator.evaluate(job, candidates, policy, !manual, cancelled::get);
    if (cancelled.get()) {
      return new Attempt(AssignmentOutcome.aborted(job.id(), evaluations));
    }
    List<CandidateEvaluation> ranked = manual
        ? evaluations.stream().filter(e -> e.score() != null && !MANUAL_BLOCKING.contains(e.rejection())).toList()
        : evaluations.stream().filter(CandidateEvaluation::eligible).sorted(CandidateEvaluation.RANKING).toList();

    for (CandidateEvaluation pick : ranked) {
      if (cancelled.get()) {
        return new Attempt(AssignmentOutcome.aborted(job.id(), evaluations));
      }
      ReentrantLock lock = technicianLocks.computeIfAbsent(pick.technicianId(), k -> new ReentrantLock());
      Optional<WorkOrderEntity> committed;
      lock.lock();
      try {
        Optional<TechnicianProfile> technician = index.profile(pick.technicianId());
        if (technician.isEmpty()) {
          continue;
        }
        if (!manual) {
          Optional<String> conflict = evaluator.scheduleConflict(job, technician.get(), OffsetDateTime.now(clock));
          if (conflict.isPresent()) {
            log.debug("Candidate technician={} lost eligibility for workOrder={}: {}", pick.technicianId(), job.id(), conflict.get());
            continue;
          }
        }
        String reasoning = reasoning(pick, evaluations.size(), manual, request);
        WorkOrderEntity updated = current.copy();
        updated.status = WorkOrderStatus.ASSIGNED;
        updated.technicianId = pick.technicianId();
        updated.eta = null;
        updated.routeSequence = null;
        updated.heldFrom = null;
        updated.lastDispatchOutcome = OUTCOME_ASSIGNED;
        updated.lastDispatchMessage = reasoning;
        committed = store.commitAssignment(updated, assignment(current.id, pick, reasoning, request.actor()));
        committed.ifPresent(saved -> index.upsertJob(DispatchJob.from(saved)));
      } finally {
        lock.unlock();
      }
      if (committed.isEmpty()) {
        return Attempt.CONFLICT;
      }
      return new Attempt(afterCommit(current, committed.get(), pick, evaluations, request));
    }

    String reasoning = ranked.isEmpty() ? summarize(job, evaluations) : "Every ranked candidate became unavailable before commit";
    if (manual || current.status == WorkOrderStatus.ASSIGNED) {
      throw new NoEligibleTechnicianException(job.id(), reasoning);
    }
    return recordNoEligible(current, job, reasoning, evaluations);
  }

  private AssignmentOutcome afterCommit(WorkOrderEntity before, WorkOrderEntity saved, CandidateEvaluation pick,
                                        List<CandidateEvaluation> evaluations, Request request) {
    boolean reassignment = before.status == WorkOrderStatus.ASSIGNED;
    if (reassignment) {
      audit.statusChanged(saved.id, WorkOrderStatus.ASSIGNED, WorkOrderStatus.QUALIFIED, request.actor(),
          "reassigned away from technician " + before.technicianId + (request.reason() == null ? "" : ": " + request.reason()));
    }
    audit.statusChanged(saved.id, WorkOrderStatus.QUALIFIED, WorkOrderStatus.ASSIGNED, request.actor(), saved.lastDispatchMessage);
    log.info("Assigned workOrder={} technician={} score={}", saved.id, pick.technicianId(), pick.score().value());

    List<EtaUpdate> etaUpdates = new ArrayList<>();
    etaUpdates.addAll(refreshRoute(pick.technicianId(), saved.serviceDate));
    if (reassignment && before.technicianId != null) {
      etaUpdates.addAll(refreshRoute(before.technicianId, before.serviceDate));
    }
    WorkOrderEntity latest = store.get(saved.id).orElse(saved);
    if (reassignment) {
      notifier.reassigned(latest, before.technicianId, request.reason());
    } else {
      notifier.assigned(latest, pick.score().value());
    }
    return new AssignmentOutcome(saved.id, AssignmentOutcome.Kind.ASSIGNED, pick.technicianId(), pick.score().value(),
        pick.score().breakdown(), saved.lastDispatchMessage, false, evaluations, etaUpdates);
  }

  private List<EtaUpdate> refreshRoute(Long technicianId, LocalDate date) {
    try {
      RouteRefresh refresh = routes.refresh(technicianId, date, true);
      return refresh.etaUpdates();
    } catch (RuntimeException ex) {
      log.error("Route refresh after commit failed technician={} date={}; the scheduled refresh will retry", technicianId, date, ex);
      return List.of();
    }
  }

  private Attempt recordNoEligible(WorkOrderEntity current, DispatchJob job, String reasoning, List<CandidateEvaluation> evaluations) {
    WorkOrderEntity updated = current.copy();
    updated.lastDispatchOutcome = OUTCOME_NO_ELIGIBLE;
    updated.lastDispatchMessage = reasoning;
    Optional<WorkOrderEntity> saved = store.saveIfVersion(updated);
    if (saved.isEmpty()) {
      return Attempt.CONFLICT;
    }
    boolean escalate = job.isEmergency();
    if (escalate) {
      notifier.escalated(saved.get(), index.onCall(), reasoning);
    }
    log.info("No eligible technician workOrder={} escalated={} reason={}", job.id(), escalate, reasoning);
    return new Attempt(AssignmentOutcome.noEligible(job.id(), reasoning, escalate, evaluations));
  }

  private AssignmentEntity assignment(Long workOrderId, CandidateEvaluation pick, String reasoning, String actor) {
    AssignmentEntity a = new AssignmentEntity();
    a.workOrderId = workOrderId;
    a.technicianId = pick.technicianId();
    a.score = pick.score().value();
    a.breakdownJson = toJson(pick.score().breakdown());
    a.reasoning = reasoning;
    a.assignedBy = actor;
    return a;
  }

  private String reasoning(CandidateEvaluation pick, int evaluated, boolean manual, Request request) {
    String factors = pick.score().breakdown().entrySet().stream()
        .map(e -> e.getKey() + "=" + String.format(Locale.ROOT, "%.2f", e.getValue()))
        .collect(Collectors.joining(", "));
    String travel = pick.travel() == null ? "" : String.format(Locale.ROOT, "; travel %.1f min%s",
        pick.travel().minutes(), pick.travel().approximate() ? " (approximate)" : "");
    String head = manual
        ? "Manual assignment by " + request.actor() + (request.reason() == null ? "" : " (" + request.reason() + ")")
        : "Best of " + evaluated + " candidates";
    return head + String.format(Locale.ROOT, ": score %.2f [%s]", pick.score().value(), factors) + travel;
  }

  static String summarize(DispatchJob job, List<CandidateEvaluation> evaluations) {
    if (evaluations.isEmpty()) {
      return "No active technician holds " + job.category() + " or GENERAL";
    }
    Map<String, Long> byReason = evaluations.stream()
        .collect(Collectors.groupingBy(e -> Objects.toString(e.rejection(), "UNKNOWN"), TreeMap::new, Collectors.counting()));
    return evaluations.size() + " candidates rejected: " + byReason.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(", "));
  }

  private String toJson(Map<String, Double> breakdown) {
    try {
      return objectMapper.writeValueAsString(breakdown);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot serialize score breakdown", ex);
    }
  }

  private WorkOrderEntity load(Long workOrderId) {
    return store.get(workOrderId).orElseThrow(() -> new NotFoundException("WorkOrder", workOrderId));
  }

  private record Request(Long workOrderId, Long technicianId, Set<Long> excluded, Set<WorkOrderStatus> allowedFrom,
                         String actor, String reason) {}

  private record Attempt(AssignmentOutcome outcome) {
    static final Attempt CONFLICT = new Attempt(null);
  }
}
