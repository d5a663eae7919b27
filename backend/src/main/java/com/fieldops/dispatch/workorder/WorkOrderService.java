package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.common.Actors;
import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.*;
import com.fieldops.dispatch.route.RouteService;
import com.fieldops.dispatch.scheduler.AssignmentOutcome;
import com.fieldops.dispatch.scheduler.ConcurrencyConflictException;
import com.fieldops.dispatch.scheduler.DispatchNotifier;
import com.fieldops.dispatch.scheduler.DispatchProperties;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.UnaryOperator;

@Service
public class WorkOrderService {
  private static final Logger log = LoggerFactory.getLogger(WorkOrderService.class);
  public static final String OUTCOME_UNQUALIFIED = "UNQUALIFIED";
  private static final int MAX_ESTIMATED_MINUTES = 12 * 60;
  private static final Set<WorkOrderStatus> RESCHEDULABLE =
      EnumSet.of(WorkOrderStatus.CREATED, WorkOrderStatus.QUALIFIED, WorkOrderStatus.ASSIGNED);

  private final WorkOrderStore store;
  private final CustomerRepository customers;
  private final PropertyRepository properties;
  private final EquipmentRepository equipment;
  private final QualificationService qualification;
  private final DispatchScheduler scheduler;
  private final RouteService routes;
  private final TechnicianAvailabilityIndex index;
  private final AuditTrail audit;
  private final DispatchNotifier notifier;
  private final DispatchProperties dispatchProperties;
  private final Clock clock;

  public WorkOrderService(WorkOrderStore store, CustomerRepository customers, PropertyRepository properties,
                          EquipmentRepository equipment, QualificationService qualification, DispatchScheduler scheduler,
                          RouteService routes, TechnicianAvailabilityIndex index, AuditTrail audit,
                          DispatchNotifier notifier, DispatchProperties dispatchProperties, Clock clock) {
    this.store = store;
    this.customers = customers;
    this.properties = properties;
    this.equipment = equipment;
    this.qualification = qualification;
    this.scheduler = scheduler;
    this.routes = routes;
    this.index = index;
    this.audit = audit;
    this.notifier = notifier;
    this.dispatchProperties = dispatchProperties;
    this.clock = clock;
  }

  public record NewWorkOrder(
      Long customerId,
      Long propertyId,
      ServiceCategory category,
      Priority priority,
      LocalDate serviceDate,
      OffsetDateTime windowStart,
      OffsetDateTime windowEnd,
      Integer estimatedMinutes,
      Set<Long> equipmentIds,
      String notes
  ) {}

  /**
   * @param created false when the idempotency key matched an existing order, which is returned unchanged
   * @param dispatch outcome of the immediate assignment attempt; only emergencies get one
   */
  public record CreateResult(WorkOrderEntity order, boolean created, List<String> qualificationProblems, AssignmentOutcome dispatch) {}

  public CreateResult create(NewWorkOrder cmd, String idempotencyKey) {
    String key = StringUtils.hasText(idempotencyKey) ? idempotencyKey.trim() : null;
    if (key != null) {
      Optional<WorkOrderEntity> existing = store.findByIdempotencyKey(key);
      if (existing.isPresent()) {
        log.info("Work order create replayed idempotencyKey={} workOrder={}", key, existing.get().id);
        return new CreateResult(existing.get(), false, List.of(), null);
      }
    }
    WorkOrderEntity draft = draft(cmd);
    draft.idempotencyKey = key;
    WorkOrderEntity created;
    try {
      created = store.create(draft);
    } catch (DataIntegrityViolationException ex) {
      if (key == null) {
        throw ex;
      }
      WorkOrderEntity winner = store.findByIdempotencyKey(key).orElseThrow(() -> ex);
      return new CreateResult(winner, false, List.of(), null);
    }
    String actor = Actors.current();
    audit.statusChanged(created.id, null, WorkOrderStatus.CREATED, actor, "created");

    List<String> problems = qualification.problems(created);
    WorkOrderEntity current;
    if (problems.isEmpty()) {
      current = mutate(created.id, w -> {
        requireTransition(w, WorkOrderStatus.QUALIFIED);
        w.status = WorkOrderStatus.QUALIFIED;
        return w;
      });
      audit.statusChanged(created.id, WorkOrderStatus.CREATED, WorkOrderStatus.QUALIFIED, actor, "automatic qualification");
    } else {
      current = markUnqualified(created.id, problems);
      log.info("Work order {} needs manual qualification: {}", created.id, problems);
    }

    AssignmentOutcome dispatch = null;
    if (current.status == WorkOrderStatus.QUALIFIED && current.priority == Priority.EMERGENCY) {
      dispatch = dispatchEmergency(current.id);
      current = get(current.id);
    }
    return new CreateResult(current, true, problems, dispatch);
  }

  /** {@code CREATED -> QUALIFIED}. With {@code override} the checks are skipped and a reason is mandatory. */
  public WorkOrderEntity qualify(Long id, boolean override, String reason) {
    WorkOrderEntity current = get(id);
    requireTransition(current, WorkOrderStatus.QUALIFIED);
    if (override) {
      if (!StringUtils.hasText(reason)) {
        throw new ValidationException("A reason is required to override qualification", "reason");
      }
    } else {
      List<String> problems = qualification.problems(current);
      if (!problems.isEmpty()) {
        markUnqualified(id, problems);
        throw new UnqualifiedLeadException(id, problems);
      }
    }
    WorkOrderEntity saved = mutate(id, w -> {
      requireTransition(w, WorkOrderStatus.QUALIFIED);
      w.status = WorkOrderStatus.QUALIFIED;
      w.lastDispatchOutcome = null;
      w.lastDispatchMessage = null;
      return w;
    });
    audit.statusChanged(id, WorkOrderStatus.CREATED, WorkOrderStatus.QUALIFIED, Actors.current(),
        override ? "override: " + reason : "qualified");
    if (saved.priority == Priority.EMERGENCY) {
      dispatchEmergency(id);
      return get(id);
    }
    return saved;
  }

  /**
   * Lifecycle move driven by a technician or dispatcher. Cancellation goes through {@link #cancel}; assignment through
   * the scheduler.
   */
  public WorkOrderEntity transition(Long id, WorkOrderStatus target, String reason) {
    if (target == null) {
      throw new ValidationException("Target status is required", "status");
    }
    if (target == WorkOrderStatus.CANCELLED) {
      return cancel(id, reason, null);
    }
    String actor = Actors.current();
    for (int attempt = 1; attempt <= dispatchProperties.getMaxConflictRetries(); attempt++) {
      WorkOrderEntity before = get(id);
      WorkOrderEntity updated = before.copy();
      applyStatus(updated, target, OffsetDateTime.now(clock));
      Optional<WorkOrderEntity> saved = commit(before, updated, actor, reason);
      if (saved.isPresent()) {
        return saved.get();
      }
    }
    throw new ConcurrencyConflictException(id, dispatchProperties.getMaxConflictRetries());
  }

  /** Any non-terminal state to CANCELLED. Aborts an in-flight assignment search and releases the assignment. */
  public WorkOrderEntity cancel(Long id, String reasonCode, String note) {
    if (!StringUtils.hasText(reasonCode)) {
      throw new ValidationException("A cancellation reason code is required", "reason");
    }
    scheduler.abortSearch(id);
    String reason = note == null || note.isBlank() ? reasonCode.trim() : reasonCode.trim() + ": " + note.trim();
    String actor = Actors.current();
    for (int attempt = 1; attempt <= dispatchProperties.getMaxConflictRetries(); attempt++) {
      WorkOrderEntity before = get(id);
      WorkOrderEntity updated = before.copy();
      requireTransition(updated, WorkOrderStatus.CANCELLED);
      updated.status = WorkOrderStatus.CANCELLED;
      updated.cancelReason = reasonCode.trim();
      updated.heldFrom = null;
      updated.eta = null;
      updated.routeSequence = null;
      Optional<WorkOrderEntity> saved = commit(before, updated, actor, reason);
      if (saved.isPresent()) {
        return saved.get();
      }
    }
    throw new ConcurrencyConflictException(id, dispatchProperties.getMaxConflictRetries());
  }

  /**
   * Moves an order to another service date or time window. An ASSIGNED order that changes date is released back
   * to QUALIFIED for the next dispatch run; one that keeps its date keeps its technician and the route is re-planned.
   * Orders already under way cannot be rescheduled.
   */
  public WorkOrderEntity reschedule(Long id, LocalDate serviceDate, OffsetDateTime windowStart, OffsetDateTime windowEnd, String reason) {
    if ((windowStart == null) != (windowEnd == null)) {
      throw new ValidationException("windowStart and windowEnd must be given together", "windowStart");
    }
    if (windowStart != null && !windowStart.isBefore(windowEnd)) {
      throw new ValidationException("windowStart must be before windowEnd", "windowStart");
    }
    if (serviceDate == null && windowStart == null) {
      throw new ValidationException("serviceDate or a time window is required", "serviceDate");
    }
    LocalDate date = serviceDate != null ? serviceDate : windowStart.atZoneSameInstant(clock.getZone()).toLocalDate();
    if (date.isBefore(LocalDate.now(clock))) {
      throw new ValidationException("Cannot reschedule into the past", "serviceDate");
    }
    if (windowStart != null && !windowStart.atZoneSameInstant(clock.getZone()).toLocalDate().equals(date)) {
      throw new ValidationException("The time window must fall on the service date", "windowStart");
    }
    scheduler.abortSearch(id);
    String actor = Actors.current();
    String note = "rescheduled to " + date + (StringUtils.hasText(reason) ? ": " + reason.trim() : "");
    for (int attempt = 1; attempt <= dispatchProperties.getMaxConflictRetries(); attempt++) {
      WorkOrderEntity before = get(id);
      if (!RESCHEDULABLE.contains(before.status)) {
        throw new DispatchException(HttpStatus.CONFLICT, "NOT_RESCHEDULABLE",
            "Work order " + id + " is " + before.status + " and can no longer be rescheduled",
            "Cancel the order and create a new one.", Map.of("workOrderId", id, "status", before.status.name()));
      }
      boolean dateChanged = !date.equals(before.serviceDate);
      WorkOrderEntity updated = before.copy();
      updated.serviceDate = date;
      updated.windowStart = windowStart;
      updated.windowEnd = windowEnd;
      updated.updatedAt = OffsetDateTime.now(clock);
      if (updated.status == WorkOrderStatus.QUALIFIED) {
        updated.lastDispatchOutcome = null;
        updated.lastDispatchMessage = null;
      }
      if (dateChanged && before.status == WorkOrderStatus.ASSIGNED) {
        applyStatus(updated, WorkOrderStatus.QUALIFIED, updated.updatedAt);
      }
      Optional<WorkOrderEntity> saved = commit(before, updated, actor, note);
      if (saved.isPresent()) {
        if (before.status == updated.status) {
          audit.statusChanged(id, before.status, updated.status, actor, note);
          if (before.technicianId != null) {
            refreshQuietly(before.technicianId, date);
          }
        }
        log.info("Work order {} rescheduled from {} to {} window={}..{} released={}", id, before.serviceDate, date,
            windowStart, windowEnd, before.technicianId != null && saved.get().technicianId == null);
        return store.get(id).orElse(saved.get());
      }
    }
    throw new ConcurrencyConflictException(id, dispatchProperties.getMaxConflictRetries());
  }

  /**
   * Applies a status change to {@code w} in place, with the bookkeeping each target needs. Throws
   * {@link IllegalTransitionException} when the state machine does not allow it.
   */
  public void applyStatus(WorkOrderEntity w, WorkOrderStatus target, OffsetDateTime at) {
    WorkOrderStatus from = w.status;
    if (target == WorkOrderStatus.ASSIGNED && from == WorkOrderStatus.QUALIFIED) {
      throw new IllegalTransitionException(w.id, from, target);
    }
    if (from == WorkOrderStatus.ON_HOLD && target != WorkOrderStatus.CANCELLED && target != w.heldFrom) {
      throw new IllegalTransitionException(w.id, from, target);
    }
    requireTransition(w, target);
    switch (target) {
      case QUALIFIED -> {
        w.technicianId = null;
        w.eta = null;
        w.routeSequence = null;
      }
      case ON_HOLD -> w.heldFrom = from;
      case IN_PROGRESS -> {
        if (w.actualStart == null) {
          w.actualStart = at;
        }
        w.heldFrom = null;
      }
      case COMPLETED -> {
        if (w.actualEnd == null) {
          w.actualEnd = at;
        }
      }
      case CANCELLED -> {
        w.heldFrom = null;
        w.eta = null;
        w.routeSequence = null;
      }
      default -> w.heldFrom = null;
    }
    w.status = target;
    if (target.requiresTechnician() && w.technicianId == null) {
      throw new IllegalTransitionException(w.id, from, target);
    }
  }

  /**
   * Version-checked write of {@code updated} followed by audit, index, route and notification side effects.
   * Empty when another writer got there first.
   */
  public Optional<WorkOrderEntity> commit(WorkOrderEntity before, WorkOrderEntity updated, String actor, String reason) {
    boolean releases = before.technicianId != null
        && (updated.technicianId == null || updated.status == WorkOrderStatus.CANCELLED);
    Optional<WorkOrderEntity> saved = releases
        ? store.releaseAssignment(updated, OffsetDateTime.now(clock))
        : store.saveIfVersion(updated);
    if (saved.isEmpty()) {
      return saved;
    }
    WorkOrderEntity after = saved.get();
    index.upsertJob(DispatchJob.from(after));
    if (before.status != after.status) {
      audit.statusChanged(after.id, before.status, after.status, actor, reason);
    }
    if (before.technicianId != null && before.status != after.status) {
      refreshQuietly(before.technicianId, before.serviceDate);
    }
    if (after.status == WorkOrderStatus.CANCELLED) {
      notifier.cancelled(after, before.technicianId, after.cancelReason);
    }
    return Optional.of(store.get(after.id).orElse(after));
  }

  public WorkOrderEntity get(Long id) {
    return store.get(id).orElseThrow(() -> new NotFoundException("WorkOrder", id));
  }

  public List<WorkOrderEntity> list(WorkOrderQuery query) {
    return store.query(query);
  }

  public List<AssignmentEntity> assignments(Long id) {
    get(id);
    return store.assignments(id);
  }

  public List<WorkOrderEventEntity> history(Long id) {
    get(id);
    return audit.history(id);
  }

  private AssignmentOutcome dispatchEmergency(Long id) {
    try {
      return scheduler.assign(id);
    } catch (DispatchException ex) {
      log.warn("Immediate dispatch of emergency workOrder={} failed code={} message={}; batch dispatch will retry",
          id, ex.code(), ex.getMessage());
      return null;
    }
  }

  private WorkOrderEntity markUnqualified(Long id, List<String> problems) {
    return mutate(id, w -> {
      w.lastDispatchOutcome = OUTCOME_UNQUALIFIED;
      w.lastDispatchMessage = String.join("; ", problems);
      return w;
    });
  }

  private WorkOrderEntity mutate(Long id, UnaryOperator<WorkOrderEntity> change) {
    int attempts = dispatchProperties.getMaxConflictRetries();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      WorkOrderEntity updated = change.apply(get(id));
      Optional<WorkOrderEntity> saved = store.saveIfVersion(updated);
      if (saved.isPresent()) {
        index.upsertJob(DispatchJob.from(saved.get()));
        return saved.get();
      }
    }
    throw new ConcurrencyConflictException(id, attempts);
  }

  private void refreshQuietly(Long technicianId, LocalDate date) {
    try {
      routes.refresh(technicianId, date, false);
    } catch (RuntimeException ex) {
      log.error("Route refresh failed technician={} date={}; the scheduled refresh will retry", technicianId, date, ex);
    }
  }

  private static void requireTransition(WorkOrderEntity w, WorkOrderStatus target) {
    if (!w.status.canTransitionTo(target)) {
      throw new IllegalTransitionException(w.id, w.status, target);
    }
  }

  private WorkOrderEntity draft(NewWorkOrder cmd) {
    if (cmd.customerId() == null || cmd.propertyId() == null) {
      throw new ValidationException("customerId and propertyId are required");
    }
    if (cmd.category() == null) {
      throw new ValidationException("category is required", "category");
    }
    CustomerEntity customer = customers.findByIdAndDeletedFalse(cmd.customerId())
        .orElseThrow(() -> new NotFoundException("Customer", cmd.customerId()));
    PropertyEntity property = properties.findById(cmd.propertyId())
        .filter(p -> !p.deleted)
        .orElseThrow(() -> new NotFoundException("Property", cmd.propertyId()));
    if (!Objects.equals(property.customerId, customer.id)) {
      throw new ValidationException("Property " + property.id + " does not belong to customer " + customer.id, "propertyId");
    }
    Set<Long> equipmentIds = cmd.equipmentIds() == null ? Set.of() : cmd.equipmentIds();
    for (Long equipmentId : equipmentIds) {
      EquipmentEntity e = equipment.findById(equipmentId).orElseThrow(() -> new NotFoundException("Equipment", equipmentId));
      if (!Objects.equals(e.propertyId, property.id)) {
        throw new ValidationException("Equipment " + equipmentId + " is not installed at property " + property.id, "equipmentIds");
      }
    }
    if ((cmd.windowStart() == null) != (cmd.windowEnd() == null)) {
      throw new ValidationException("windowStart and windowEnd must be given together", "windowStart");
    }
    if (cmd.windowStart() != null && !cmd.windowStart().isBefore(cmd.windowEnd())) {
      throw new ValidationException("windowStart must be before windowEnd", "windowStart");
    }
    int minutes = cmd.estimatedMinutes() == null ? 60 : cmd.estimatedMinutes();
    if (minutes <= 0 || minutes > MAX_ESTIMATED_MINUTES) {
      throw new ValidationException("estimatedMinutes must be between 1 and " + MAX_ESTIMATED_MINUTES, "estimatedMinutes");
    }
    LocalDate serviceDate = cmd.serviceDate();
    if (serviceDate == null) {
      serviceDate = cmd.windowStart() != null
          ? cmd.windowStart().atZoneSameInstant(clock.getZone()).toLocalDate()
          : LocalDate.now(clock);
    }

    WorkOrderEntity w = new WorkOrderEntity();
    w.customerId = customer.id;
    w.propertyId = property.id;
    w.category = cmd.category();
    w.priority = cmd.priority() == null ? Priority.ROUTINE : cmd.priority();
    w.status = WorkOrderStatus.CREATED;
    w.serviceDate = serviceDate;
    w.windowStart = cmd.windowStart();
    w.windowEnd = cmd.windowEnd();
    w.estimatedMinutes = minutes;
    w.equipmentIds = new LinkedHashSet<>(equipmentIds);
    w.latitude = property.latitude;
    w.longitude = property.longitude;
    w.zip = property.zip;
    w.notes = cmd.notes();
    OffsetDateTime now = OffsetDateTime.now(clock);
    w.createdAt = now;
    w.updatedAt = now;
    return w;
  }
}
