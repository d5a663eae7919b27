package com.fieldops.dispatch.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.*;
import com.fieldops.dispatch.route.RouteService;
import com.fieldops.dispatch.scheduler.DispatchNotifier;
import com.fieldops.dispatch.scheduler.DispatchProperties;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import com.fieldops.dispatch.technician.TechnicianService;
import com.fieldops.dispatch.workorder.AuditTrail;
import com.fieldops.dispatch.workorder.InMemoryWorkOrderStore;
import com.fieldops.dispatch.workorder.QualificationService;
import com.fieldops.dispatch.workorder.WorkOrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SyncCoordinatorTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T15:00:00Z"), ZoneOffset.UTC);
  private static final OffsetDateTime CAPTURED = OffsetDateTime.of(2026, 3, 10, 14, 0, 0, 0, ZoneOffset.UTC);

  private final Map<Long, SyncQueueItemEntity> queueRows = new LinkedHashMap<>();
  private final Map<String, SyncFieldStampEntity> stampRows = new HashMap<>();
  private InMemoryWorkOrderStore store;
  private TechnicianService technicians;
  private SyncProperties properties;
  private SyncCoordinator coordinator;

  @BeforeEach
  void setUp() {
    store = new InMemoryWorkOrderStore();
    technicians = mock(TechnicianService.class);
    properties = new SyncProperties();
    DispatchProperties dispatch = new DispatchProperties();
    TechnicianAvailabilityIndex index = new TechnicianAvailabilityIndex(mock(TechnicianRepository.class),
        mock(WorkOrderRepository.class), CLOCK, Duration.ofHours(4), 7);
    WorkOrderService workOrders = new WorkOrderService(store, mock(CustomerRepository.class), mock(PropertyRepository.class),
        mock(EquipmentRepository.class), new QualificationService(dispatch), mock(DispatchScheduler.class),
        mock(RouteService.class), index, mock(AuditTrail.class), mock(DispatchNotifier.class), dispatch, CLOCK);
    ObjectMapper objectMapper = new ObjectMapper();
    coordinator = new SyncCoordinator(queueRepository(), stampRepository(), workOrders, technicians, properties,
        objectMapper, CLOCK);
  }

  @Test
  void replayedItemIsReportedAsDuplicateAndNotReapplied() {
    WorkOrderEntity w = assignedOrder();
    SyncItem item = workOrderItem("k-1", w.id, w.version, null, Map.of("notes", "replaced filter"));

    SyncItemResult first = coordinator.submit("tablet-1", "tech1", List.of(item)).get(0);
    long versionAfterFirst = store.get(w.id).orElseThrow().version;
    SyncItemResult replay = coordinator.submit("tablet-1", "tech1", List.of(item)).get(0);

    assertEquals(SyncItemStatus.SYNCED, first.status());
    assertFalse(first.duplicate());
    assertTrue(replay.duplicate());
    assertEquals(first.itemId(), replay.itemId());
    assertEquals(versionAfterFirst, store.get(w.id).orElseThrow().version);
    assertEquals(1, queueRows.size());
  }

  @Test
  void officeOwnedFieldsKeepServerValues() {
    WorkOrderEntity w = assignedOrder();
    SyncItemResult mixed = coordinator.submit("tablet-1", "tech1", List.of(
        workOrderItem("k-1", w.id, w.version, null, Map.of("notes", "gate code 4411", "priority", "EMERGENCY")))).get(0);
    SyncItemResult customer = coordinator.submit("tablet-1", "tech1", List.of(
        new SyncItem("k-2", SyncEntityType.CUSTOMER, 1L, "UPDATE", null, null, CAPTURED, Map.of("name", "Someone Else")))).get(0);

    assertEquals(List.of("notes"), mixed.appliedFields());
    assertEquals(List.of("priority"), mixed.rejectedFields());
    WorkOrderEntity stored = store.get(w.id).orElseThrow();
    assertEquals("gate code 4411", stored.notes);
    assertEquals(Priority.ROUTINE, stored.priority);

    assertEquals(SyncItemStatus.SYNCED, customer.status());
    assertTrue(customer.appliedFields().isEmpty());
    assertEquals(List.of("name"), customer.rejectedFields());
  }

  @Test
  void concurrentEditFromAnotherDeviceGoesToReviewAndCanBeApplied() {
    WorkOrderEntity w = assignedOrder();
    long base = w.version;

    SyncItemResult a = coordinator.submit("tablet-a", "tech1", List.of(
        workOrderItem("a-1", w.id, base, null, Map.of("notes", "from A")))).get(0);
    SyncItemResult b = coordinator.submit("tablet-b", "tech2", List.of(
        workOrderItem("b-1", w.id, base, null, Map.of("notes", "from B")))).get(0);

    assertEquals(SyncItemStatus.SYNCED, a.status());
    assertEquals(SyncItemStatus.MANUAL_REVIEW, b.status());
    assertEquals(List.of("notes"), b.rejectedFields());
    assertEquals("from A", store.get(w.id).orElseThrow().notes);
    assertEquals(1, coordinator.reviewQueue().size());

    SyncItemResult resolved = coordinator.resolve(b.itemId(), SyncCoordinator.Resolution.APPLY, "dispatcher1");

    assertEquals(SyncItemStatus.SYNCED, resolved.status());
    assertEquals("from B", store.get(w.id).orElseThrow().notes);
    assertTrue(coordinator.reviewQueue().isEmpty());
  }

  @Test
  void sameDeviceDoesNotConflictWithItself() {
    WorkOrderEntity w = assignedOrder();
    long base = w.version;

    coordinator.submit("tablet-a", "tech1", List.of(workOrderItem("a-1", w.id, base, null, Map.of("notes", "one"))));
    SyncItemResult second = coordinator.submit("tablet-a", "tech1", List.of(
        workOrderItem("a-2", w.id, base, null, Map.of("notes", "two")))).get(0);

    assertEquals(SyncItemStatus.SYNCED, second.status());
    assertEquals("two", store.get(w.id).orElseThrow().notes);
  }

  @Test
  void discardKeepsServerStateAndClosesItem() {
    WorkOrderEntity w = assignedOrder();
    coordinator.submit("tablet-a", "tech1", List.of(workOrderItem("a-1", w.id, w.version, null, Map.of("notes", "from A"))));
    SyncItemResult b = coordinator.submit("tablet-b", "tech2", List.of(
        workOrderItem("b-1", w.id, w.version, null, Map.of("notes", "from B")))).get(0);

    SyncItemResult discarded = coordinator.resolve(b.itemId(), SyncCoordinator.Resolution.DISCARD, "dispatcher1");

    assertEquals(SyncItemStatus.SYNCED, discarded.status());
    assertTrue(discarded.message().startsWith(SyncCoordinator.DISCARDED));
    assertEquals("from A", store.get(w.id).orElseThrow().notes);

    DispatchException again = assertThrows(DispatchException.class,
        () -> coordinator.resolve(b.itemId(), SyncCoordinator.Resolution.APPLY, "dispatcher1"));
    assertEquals("NOT_IN_REVIEW", again.code());
  }

  @Test
  void illegalStatusChangeGoesToReview() {
    WorkOrderEntity w = assignedOrder();

    SyncItemResult result = coordinator.submit("tablet-1", "tech1", List.of(
        workOrderItem("k-1", w.id, w.version, null, Map.of("status", "COMPLETED")))).get(0);

    assertEquals(SyncItemStatus.MANUAL_REVIEW, result.status());
    assertEquals(List.of("status"), result.rejectedFields());
    assertEquals(WorkOrderStatus.ASSIGNED, store.get(w.id).orElseThrow().status);
  }

  @Test
  void signaturesAndPhotosApplyBeforeStatusAndNotes() {
    WorkOrderEntity w = assignedOrder();
    SyncItem notes = workOrderItem("n", w.id, null, null, Map.of("notes", "done"));
    SyncItem status = workOrderItem("s", w.id, null, null, Map.of("status", "IN_PROGRESS"));
    SyncItem signature = workOrderItem("sig", w.id, null, null, Map.of("signatureRef", "blob://sig-1"));

    List<SyncItemResult> results = coordinator.submit("tablet-1", "tech1", List.of(notes, status, signature));

    assertEquals(List.of("n", "s", "sig"), results.stream().map(SyncItemResult::idempotencyKey).toList());
    assertTrue(results.get(2).itemId() < results.get(1).itemId());
    assertTrue(results.get(1).itemId() < results.get(0).itemId());
    assertEquals(List.of(SyncPriority.CRITICAL, SyncPriority.HIGH, SyncPriority.NORMAL), queueRows.values().stream().map(r -> r.priority).toList());
    WorkOrderEntity stored = store.get(w.id).orElseThrow();
    assertEquals(WorkOrderStatus.IN_PROGRESS, stored.status);
    assertEquals(CAPTURED, stored.actualStart);
    assertEquals("blob://sig-1", stored.signatureRef);
  }

  @Test
  void transientFailuresBackOffAndAreAbandonedAfterMaxAttempts() {
    properties.setInitialBackoff(Duration.ZERO);
    when(technicians.recordLocation(anyLong(), anyDouble(), anyDouble(), any()))
        .thenThrow(new IllegalStateException("connection reset"));

    SyncItemResult first = coordinator.submit("tablet-1", "tech1", List.of(new SyncItem("loc-1",
        SyncEntityType.TECHNICIAN_LOCATION, 7L, "UPDATE", null, null, CAPTURED, Map.of("latitude", 40.7, "longitude", -74.0)))).get(0);
    assertEquals(SyncItemStatus.FAILED_RETRY, first.status());

    for (int i = 0; i < 10; i++) {
      coordinator.retryDue();
    }

    SyncQueueItemEntity row = queueRows.get(first.itemId());
    assertEquals(SyncItemStatus.FAILED_ABANDONED, row.status);
    assertEquals(5, row.attempts);
    assertEquals(1, coordinator.abandoned().size());
    verify(technicians, times(5)).recordLocation(anyLong(), anyDouble(), anyDouble(), any());
  }

  @Test
  void locationItemIsRecorded() {
    when(technicians.recordLocation(7L, 40.7, -74.0, CAPTURED))
        .thenReturn(new TechnicianService.LocationUpdate(7L, true, CAPTURED));

    SyncItemResult result = coordinator.submit("tablet-1", "tech1", List.of(new SyncItem("loc-1",
        SyncEntityType.TECHNICIAN_LOCATION, 7L, "UPDATE", null, null, CAPTURED, Map.of("latitude", 40.7, "longitude", -74.0)))).get(0);

    assertEquals(SyncItemStatus.SYNCED, result.status());
    assertTrue(result.rejectedFields().isEmpty());
  }

  @Test
  void backoffDoublesPerAttempt() {
    assertEquals(Duration.ofSeconds(1), properties.backoffAfter(1));
    assertEquals(Duration.ofSeconds(2), properties.backoffAfter(2));
    assertEquals(Duration.ofSeconds(4), properties.backoffAfter(3));
  }

  private WorkOrderEntity assignedOrder() {
    WorkOrderEntity w = new WorkOrderEntity();
    w.customerId = 1L;
    w.propertyId = 2L;
    w.category = ServiceCategory.HVAC;
    w.priority = Priority.ROUTINE;
    w.status = WorkOrderStatus.ASSIGNED;
    w.serviceDate = LocalDate.of(2026, 3, 10);
    w.technicianId = 7L;
    w.latitude = 40.7;
    w.longitude = -74.0;
    return store.create(w);
  }

  private static SyncItem workOrderItem(String key, Long id, Long baseVersion, SyncPriority priority, Map<String, Object> changes) {
    return new SyncItem(key, SyncEntityType.WORK_ORDER, id, "UPDATE", baseVersion, priority, CAPTURED, changes);
  }

  private SyncQueueItemRepository queueRepository() {
    SyncQueueItemRepository repo = mock(SyncQueueItemRepository.class);
    when(repo.save(any(SyncQueueItemEntity.class))).thenAnswer(inv -> {
      SyncQueueItemEntity row = inv.getArgument(0);
      if (row.id == null) {
        row.id = (long) queueRows.size() + 1;
      }
      queueRows.put(row.id, row);
      return row;
    });
    when(repo.findById(anyLong())).thenAnswer(inv -> Optional.ofNullable(queueRows.get(inv.<Long>getArgument(0))));
    when(repo.findByIdempotencyKey(anyString())).thenAnswer(inv -> queueRows.values().stream()
        .filter(r -> r.idempotencyKey.equals(inv.getArgument(0)))
        .findFirst());
    when(repo.findByStatusOrderByIdAsc(any())).thenAnswer(inv -> queueRows.values().stream()
        .filter(r -> r.status == inv.getArgument(0))
        .toList());
    when(repo.findByStatusAndNextAttemptAtLessThanEqualOrderByIdAsc(any(), any())).thenAnswer(inv -> {
      OffsetDateTime cutoff = inv.getArgument(1);
      return queueRows.values().stream()
          .filter(r -> r.status == inv.getArgument(0))
          .filter(r -> r.nextAttemptAt != null && !r.nextAttemptAt.isAfter(cutoff))
          .toList();
    });
    return repo;
  }

  private SyncFieldStampRepository stampRepository() {
    SyncFieldStampRepository repo = mock(SyncFieldStampRepository.class);
    when(repo.findByEntityTypeAndEntityIdAndField(any(), anyLong(), anyString())).thenAnswer(inv ->
        Optional.ofNullable(stampRows.get(inv.getArgument(0) + ":" + inv.getArgument(1) + ":" + inv.getArgument(2))));
    when(repo.save(any(SyncFieldStampEntity.class))).thenAnswer(inv -> {
      SyncFieldStampEntity s = inv.getArgument(0);
      stampRows.put(s.entityType + ":" + s.entityId + ":" + s.field, s);
      return s;
    });
    return repo;
  }
}
