package com.fieldops.dispatch.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.Entities.SyncEntityType;
import com.fieldops.dispatch.domain.Entities.SyncFieldStampEntity;
import com.fieldops.dispatch.domain.Entities.SyncItemStatus;
import com.fieldops.dispatch.domain.Entities.SyncPriority;
import com.fieldops.dispatch.domain.Entities.SyncQueueItemEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.SyncFieldStampRepository;
import com.fieldops.dispatch.domain.SyncQueueItemRepository;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.scheduler.ConcurrencyConflictException;
import com.fieldops.dispatch.technician.TechnicianService;
import com.fieldops.dispatch.workorder.IllegalTransitionException;
import com.fieldops.dispatch.workorder.WorkOrderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges changes recorded offline on technician devices.
 *
 * <p>Items from one device are applied one at a time in priority order; different devices proceed in parallel. Each
 * item is keyed by its client idempotency key, so a re-uploaded batch returns the stored results without touching
 * the work order again.
 *
 * <p>A device-owned field written by another device at a version newer than the item's base version sends the item to
 * {@link SyncItemStatus#MANUAL_REVIEW}. Transient failures go to {@link SyncItemStatus#FAILED_RETRY} with exponential
 * backoff and are abandoned after {@link SyncProperties#getMaxAttempts()} attempts.
 */
@Service
public class SyncCoordinator {
  private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);
  private static final int WRITE_ATTEMPTS = 3;
  private static final TypeReference<Map<String, Object>> CHANGES = new TypeReference<>() {};
  static final String DISCARDED = "DISCARDED";

  public enum Resolution { APPLY, DISCARD }

  private final SyncQueueItemRepository queue;
  private final SyncFieldStampRepository stamps;
  private final WorkOrderService workOrders;
  private final TechnicianService technicians;
  private final SyncProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ConcurrentHashMap<String, ReentrantLock> deviceLocks = new ConcurrentHashMap<>();

  public SyncCoordinator(SyncQueueItemRepository queue, SyncFieldStampRepository stamps, WorkOrderService workOrders,
                         TechnicianService technicians, SyncProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.queue = queue;
    this.stamps = stamps;
    this.workOrders = workOrders;
    this.technicians = technicians;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  record Applied(List<String> appliedFields, List<String> rejectedFields, Long entityVersion, String message) {}

  public List<SyncItemResult> submit(String deviceId, String submittedBy, List<SyncItem> items) {
    if (!StringUtils.hasText(deviceId)) {
      throw new ValidationException("deviceId is required", "deviceId");
    }
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    if (items.size() > properties.getMaxBatchSize()) {
      throw new ValidationException("At most " + properties.getMaxBatchSize() + " items per batch", "items");
    }
    for (SyncItem item : items) {
      validate(item);
    }

    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) order.add(i);
    order.sort(Comparator
        .comparing((Integer i) -> priorityOf(items.get(i)))
        .thenComparing(i -> items.get(i).capturedAt(), Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Comparator.naturalOrder()));

    SyncItemResult[] results = new SyncItemResult[items.size()];
    ReentrantLock lock = lockFor(deviceId);
    lock.lock();
    try {
      for (int i : order) {
        results[i] = accept(deviceId, submittedBy, items.get(i));
      }
    } finally {
      lock.unlock();
    }
    long synced = Arrays.stream(results).filter(r -> r.status() == SyncItemStatus.SYNCED).count();
    log.info("Sync batch device={} items={} synced={}", deviceId, items.size(), synced);
    return Arrays.asList(results);
  }

  /** Re-applies items whose backoff has elapsed. */
  @Scheduled(fixedDelayString = "${app.sync.retry-interval-ms:1000}", initialDelayString = "${app.sync.retry-interval-ms:1000}")
  public void retryDue() {
    List<SyncQueueItemEntity> due = queue.findByStatusAndNextAttemptAtLessThanEqualOrderByIdAsc(
        SyncItemStatus.FAILED_RETRY, OffsetDateTime.now(clock));
    for (SyncQueueItemEntity item : due) {
      ReentrantLock lock = lockFor(item.deviceId);
      lock.lock();
      try {
        SyncQueueItemEntity current = queue.findById(item.id).orElse(null);
        if (current != null && current.status == SyncItemStatus.FAILED_RETRY) {
          process(current, false);
        }
      } catch (RuntimeException ex) {
        log.error("Sync retry failed item={} device={}", item.id, item.deviceId, ex);
      } finally {
        lock.unlock();
      }
    }
  }

  public List<SyncQueueItemEntity> reviewQueue() {
    return queue.findByStatusOrderByIdAsc(SyncItemStatus.MANUAL_REVIEW);
  }

  public List<SyncQueueItemEntity> abandoned() {
    return queue.findByStatusOrderByIdAsc(SyncItemStatus.FAILED_ABANDONED);
  }

  /**
   * Dispatcher decision on an item in manual review. {@code APPLY} writes the device's values over the other device's;
   * {@code DISCARD} keeps the server state and closes the item.
   */
  public SyncItemResult resolve(Long itemId, Resolution resolution, String actor) {
    if (resolution == null) {
      throw new ValidationException("resolution is required", "resolution");
    }
    SyncQueueItemEntity found = queue.findById(itemId).orElseThrow(() -> new NotFoundException("SyncItem", itemId));
    ReentrantLock lock = lockFor(found.deviceId);
    lock.lock();
    try {
      SyncQueueItemEntity item = queue.findById(itemId).orElseThrow(() -> new NotFoundException("SyncItem", itemId));
      if (item.status != SyncItemStatus.MANUAL_REVIEW) {
        throw new DispatchException(HttpStatus.CONFLICT, "NOT_IN_REVIEW",
            "Sync item " + itemId + " is " + item.status + ", not awaiting review");
      }
      log.info("Sync review item={} resolution={} actor={}", itemId, resolution, actor);
      if (resolution == Resolution.DISCARD) {
        item.status = SyncItemStatus.SYNCED;
        item.appliedAt = OffsetDateTime.now(clock);
        item.resultJson = toJson(new Applied(List.of(), new ArrayList<>(readChanges(item).keySet()), null,
            DISCARDED + " by " + actor));
        return resultOf(queue.save(item));
      }
      return process(item, true);
    } finally {
      lock.unlock();
    }
  }

  private SyncItemResult accept(String deviceId, String submittedBy, SyncItem item) {
    String key = item.idempotencyKey().trim();
    Optional<SyncQueueItemEntity> existing = queue.findByIdempotencyKey(key);
    if (existing.isPresent()) {
      return resultOf(existing.get()).asDuplicate();
    }
    SyncQueueItemEntity row = new SyncQueueItemEntity();
    row.idempotencyKey = key;
    row.deviceId = deviceId;
    row.entityType = item.entityType();
    row.entityId = item.entityId();
    row.operation = item.operation() == null ? "UPDATE" : item.operation();
    row.payloadJson = toJson(item.changes());
    row.baseVersion = item.baseVersion();
    row.priority = priorityOf(item);
    row.capturedAt = item.capturedAt();
    row.submittedBy = submittedBy;
    row.status = SyncItemStatus.PENDING;
    row.receivedAt = OffsetDateTime.now(clock);
    SyncQueueItemEntity saved;
    try {
      saved = queue.save(row);
    } catch (DataIntegrityViolationException ex) {
      SyncQueueItemEntity winner = queue.findByIdempotencyKey(key).orElseThrow(() -> ex);
      return resultOf(winner).asDuplicate();
    }
    return process(saved, false);
  }

  private SyncItemResult process(SyncQueueItemEntity item, boolean force) {
    item.status = SyncItemStatus.SYNCING;
    item.attempts++;
    item = queue.save(item);
    try {
      Applied applied = apply(item, readChanges(item), force);
      item.status = SyncItemStatus.SYNCED;
      item.appliedAt = OffsetDateTime.now(clock);
      item.lastError = null;
      item.nextAttemptAt = null;
      item.resultJson = toJson(applied);
    } catch (SyncConflictException ex) {
      review(item, ex.getMessage(), ex.fields());
    } catch (ConcurrencyConflictException ex) {
      failed(item, ex);
    } catch (ValidationException | NotFoundException ex) {
      review(item, ex.getMessage(), List.of());
    } catch (RuntimeException ex) {
      failed(item, ex);
    }
    return resultOf(queue.save(item));
  }

  private void review(SyncQueueItemEntity item, String reason, List<String> fields) {
    item.status = SyncItemStatus.MANUAL_REVIEW;
    item.lastError = reason;
    item.nextAttemptAt = null;
    item.resultJson = toJson(new Applied(List.of(), List.copyOf(fields), null, reason));
    log.warn("Sync item {} from device={} needs review: {}", item.idempotencyKey, item.deviceId, reason);
  }

  private void failed(SyncQueueItemEntity item, RuntimeException ex) {
    item.lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
    if (item.attempts >= properties.getMaxAttempts()) {
      item.status = SyncItemStatus.FAILED_ABANDONED;
      item.nextAttemptAt = null;
      log.error("Sync item {} from device={} abandoned after {} attempts", item.idempotencyKey, item.deviceId, item.attempts, ex);
    } else {
      item.status = SyncItemStatus.FAILED_RETRY;
      item.nextAttemptAt = OffsetDateTime.now(clock).plus(properties.backoffAfter(item.attempts));
      log.warn("Sync item {} from device={} failed attempt={} nextAttemptAt={}: {}",
          item.idempotencyKey, item.deviceId, item.attempts, item.nextAttemptAt, ex.getMessage());
    }
  }

  private Applied apply(SyncQueueItemEntity item, Map<String, Object> changes, boolean force) {
    return switch (item.entityType) {
      case WORK_ORDER -> applyWorkOrder(item, changes, force);
      case TECHNICIAN_LOCATION -> applyLocation(item, changes);
      case CUSTOMER, PROPERTY, PRICING -> new Applied(List.of(), new ArrayList<>(changes.keySet()), null,
          item.entityType + " data is owned by the office; changes were not applied");
    };
  }

  private Applied applyWorkOrder(SyncQueueItemEntity item, Map<String, Object> changes, boolean force) {
    Map<String, Object> accepted = new LinkedHashMap<>();
    List<String> rejected = new ArrayList<>();
    changes.forEach((field, value) -> {
      if (ConflictPolicy.deviceWins(SyncEntityType.WORK_ORDER, field)) {
        accepted.put(field, value);
      } else {
        rejected.add(field);
      }
    });
    if (!force) {
      List<String> conflicts = concurrentEdits(item, accepted.keySet());
      if (!conflicts.isEmpty()) {
        throw new SyncConflictException("Fields " + conflicts + " of work order " + item.entityId
            + " were changed on another device since version " + item.baseVersion, conflicts);
      }
    }
    String reason = accepted.containsKey(ConflictPolicy.STATUS_REASON)
        ? asString(accepted.get(ConflictPolicy.STATUS_REASON)) : "offline sync";
    OffsetDateTime at = item.capturedAt == null ? OffsetDateTime.now(clock) : item.capturedAt;

    for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
      WorkOrderEntity before = workOrders.get(item.entityId);
      WorkOrderEntity updated = before.copy();
      merge(updated, accepted, at);
      Optional<WorkOrderEntity> saved = workOrders.commit(before, updated, "device:" + item.deviceId, reason);
      if (saved.isPresent()) {
        long version = saved.get().version;
        for (String field : accepted.keySet()) {
          stamp(item, field, version);
        }
        return new Applied(new ArrayList<>(accepted.keySet()), rejected, version,
            rejected.isEmpty() ? null : "Office-owned fields were not applied");
      }
    }
    throw new ConcurrencyConflictException(item.entityId, WRITE_ATTEMPTS);
  }

  private void merge(WorkOrderEntity w, Map<String, Object> accepted, OffsetDateTime at) {
    if (accepted.containsKey(ConflictPolicy.NOTES)) {
      w.notes = asString(accepted.get(ConflictPolicy.NOTES));
    }
    if (accepted.containsKey(ConflictPolicy.SIGNATURE)) {
      w.signatureRef = asString(accepted.get(ConflictPolicy.SIGNATURE));
    }
    if (accepted.containsKey(ConflictPolicy.PHOTOS)) {
      Object photos = accepted.get(ConflictPolicy.PHOTOS);
      if (!(photos instanceof Collection<?> refs)) {
        throw new ValidationException("photoRefs must be a list", ConflictPolicy.PHOTOS);
      }
      refs.forEach(ref -> w.photoRefs.add(String.valueOf(ref)));
    }
    if (accepted.containsKey(ConflictPolicy.ACTUAL_START)) {
      w.actualStart = asTime(accepted.get(ConflictPolicy.ACTUAL_START), ConflictPolicy.ACTUAL_START);
    }
    if (accepted.containsKey(ConflictPolicy.ACTUAL_END)) {
      w.actualEnd = asTime(accepted.get(ConflictPolicy.ACTUAL_END), ConflictPolicy.ACTUAL_END);
    }
    if (accepted.containsKey(ConflictPolicy.STATUS)) {
      WorkOrderStatus target = asStatus(accepted.get(ConflictPolicy.STATUS));
      if (target != w.status) {
        try {
          workOrders.applyStatus(w, target, at);
        } catch (IllegalTransitionException ex) {
          throw new SyncConflictException(ex.getMessage(), List.of(ConflictPolicy.STATUS));
        }
        if (target == WorkOrderStatus.CANCELLED && w.cancelReason == null) {
          w.cancelReason = "FIELD_CANCELLED";
        }
      }
    }
  }

  private Applied applyLocation(SyncQueueItemEntity item, Map<String, Object> changes) {
    Object lat = changes.get(ConflictPolicy.LATITUDE);
    Object lng = changes.get(ConflictPolicy.LONGITUDE);
    if (!(lat instanceof Number latitude) || !(lng instanceof Number longitude)) {
      throw new ValidationException("latitude and longitude are required numbers", ConflictPolicy.LATITUDE);
    }
    OffsetDateTime fixAt = changes.containsKey(ConflictPolicy.FIX_AT)
        ? asTime(changes.get(ConflictPolicy.FIX_AT), ConflictPolicy.FIX_AT)
        : item.capturedAt;
    TechnicianService.LocationUpdate update = technicians.recordLocation(item.entityId,
        latitude.doubleValue(), longitude.doubleValue(), fixAt);
    if (!update.accepted()) {
      return new Applied(List.of(), new ArrayList<>(changes.keySet()), null, "A newer fix is already recorded");
    }
    return new Applied(new ArrayList<>(changes.keySet()), List.of(), null, null);
  }

  private List<String> concurrentEdits(SyncQueueItemEntity item, Collection<String> fields) {
    if (item.baseVersion == null) {
      return List.of();
    }
    List<String> conflicts = new ArrayList<>();
    for (String field : fields) {
      stamps.findByEntityTypeAndEntityIdAndField(item.entityType, item.entityId, field)
          .filter(s -> !s.deviceId.equals(item.deviceId) && s.entityVersion > item.baseVersion)
          .ifPresent(s -> conflicts.add(field));
    }
    return conflicts;
  }

  private void stamp(SyncQueueItemEntity item, String field, long version) {
    SyncFieldStampEntity s = stamps.findByEntityTypeAndEntityIdAndField(item.entityType, item.entityId, field)
        .orElseGet(SyncFieldStampEntity::new);
    s.entityType = item.entityType;
    s.entityId = item.entityId;
    s.field = field;
    s.deviceId = item.deviceId;
    s.entityVersion = version;
    s.syncedAt = OffsetDateTime.now(clock);
    try {
      stamps.save(s);
    } catch (DataIntegrityViolationException ex) {
      // another device inserted the stamp first
      SyncFieldStampEntity winner = stamps.findByEntityTypeAndEntityIdAndField(item.entityType, item.entityId, field)
          .orElseThrow(() -> ex);
      winner.deviceId = item.deviceId;
      winner.entityVersion = Math.max(winner.entityVersion, version);
      winner.syncedAt = s.syncedAt;
      stamps.save(winner);
    }
  }

  private SyncItemResult resultOf(SyncQueueItemEntity item) {
    Applied applied = item.resultJson == null
        ? new Applied(List.of(), List.of(), null, item.lastError)
        : fromJson(item.resultJson);
    String message = applied.message() != null ? applied.message() : item.lastError;
    return new SyncItemResult(item.idempotencyKey, item.id, item.status, applied.appliedFields(),
        applied.rejectedFields(), applied.entityVersion(), message, false);
  }

  private void validate(SyncItem item) {
    if (item == null || !StringUtils.hasText(item.idempotencyKey())) {
      throw new ValidationException("Every item needs an idempotencyKey", "idempotencyKey");
    }
    if (item.entityType() == null || item.entityId() == null) {
      throw new ValidationException("Item " + item.idempotencyKey() + " needs entityType and entityId", "entityType");
    }
    if (item.changes() == null || item.changes().isEmpty()) {
      throw new ValidationException("Item " + item.idempotencyKey() + " carries no changes", "changes");
    }
  }

  private static SyncPriority priorityOf(SyncItem item) {
    return item.priority() != null
        ? item.priority()
        : ConflictPolicy.defaultPriority(item.entityType(), item.changes().keySet());
  }

  private ReentrantLock lockFor(String deviceId) {
    return deviceLocks.computeIfAbsent(deviceId, k -> new ReentrantLock());
  }

  private Map<String, Object> readChanges(SyncQueueItemEntity item) {
    try {
      return objectMapper.readValue(item.payloadJson, CHANGES);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Stored payload of sync item " + item.id + " is not valid JSON", ex);
    }
  }

  private Applied fromJson(String json) {
    try {
      return objectMapper.readValue(json, Applied.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Stored sync result is not valid JSON", ex);
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot serialize sync data", ex);
    }
  }

  private static String asString(Object value) {
    return value == null ? null : String.valueOf(value);
  }

  private static OffsetDateTime asTime(Object value, String field) {
    if (value == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(String.valueOf(value));
    } catch (DateTimeParseException ex) {
      throw new ValidationException(field + " is not an ISO-8601 timestamp", field);
    }
  }

  private static WorkOrderStatus asStatus(Object value) {
    try {
      return WorkOrderStatus.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("Unknown status " + value, ConflictPolicy.STATUS);
    }
  }
}
