package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.CustomerEntity;
import com.fieldops.dispatch.domain.Entities.PropertyEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.route.RouteService;
import com.fieldops.dispatch.scheduler.AssignmentOutcome;
import com.fieldops.dispatch.scheduler.DispatchNotifier;
import com.fieldops.dispatch.scheduler.DispatchProperties;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkOrderServiceTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T07:00:00Z"), ZoneOffset.UTC);

  private InMemoryWorkOrderStore store;
  private PropertyRepository properties;
  private DispatchScheduler scheduler;
  private RouteService routes;
  private DispatchNotifier notifier;
  private WorkOrderService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryWorkOrderStore();
    CustomerRepository customers = mock(CustomerRepository.class);
    properties = mock(PropertyRepository.class);
    scheduler = mock(DispatchScheduler.class);
    routes = mock(RouteService.class);
    notifier = mock(DispatchNotifier.class);
    DispatchProperties dispatch = new DispatchProperties();
    TechnicianAvailabilityIndex index = new TechnicianAvailabilityIndex(mock(TechnicianRepository.class),
        mock(WorkOrderRepository.class), CLOCK, Duration.ofHours(4), 7);

    CustomerEntity customer = new CustomerEntity();
    customer.id = 1L;
    customer.name = "Dana Reyes";
    when(customers.findByIdAndDeletedFalse(1L)).thenReturn(Optional.of(customer));
    when(properties.findById(10L)).thenReturn(Optional.of(property(10L, 40.7, -74.0)));
    when(properties.findById(11L)).thenReturn(Optional.of(property(11L, null, null)));

    service = new WorkOrderService(store, customers, properties, mock(EquipmentRepository.class),
        new QualificationService(dispatch), scheduler, routes, index, mock(AuditTrail.class), notifier, dispatch, CLOCK);
  }

  @Test
  void repeatedKeyReturnsTheFirstOrder() {
    WorkOrderService.CreateResult first = service.create(routine(10L), "req-1");
    WorkOrderService.CreateResult second = service.create(routine(10L), "req-1");

    assertTrue(first.created());
    assertFalse(second.created());
    assertEquals(first.order().id, second.order().id);
    assertEquals(1, store.query(new WorkOrderQuery(null, null, null)).size());
  }

  @Test
  void serviceableOrderIsQualifiedOnCreate() {
    WorkOrderService.CreateResult result = service.create(routine(10L), null);

    assertEquals(WorkOrderStatus.QUALIFIED, result.order().status);
    assertTrue(result.qualificationProblems().isEmpty());
    assertNull(result.dispatch());
    verifyNoInteractions(scheduler);
  }

  @Test
  void orderWithoutCoordinatesStaysCreatedAndFlagged() {
    WorkOrderService.CreateResult result = service.create(routine(11L), null);

    assertEquals(WorkOrderStatus.CREATED, result.order().status);
    assertEquals(WorkOrderService.OUTCOME_UNQUALIFIED, result.order().lastDispatchOutcome);
    assertFalse(result.qualificationProblems().isEmpty());

    assertThrows(UnqualifiedLeadException.class, () -> service.qualify(result.order().id, false, null));
    assertThrows(ValidationException.class, () -> service.qualify(result.order().id, true, " "));

    WorkOrderEntity overridden = service.qualify(result.order().id, true, "customer gave directions by phone");
    assertEquals(WorkOrderStatus.QUALIFIED, overridden.status);
    assertNull(overridden.lastDispatchOutcome);
  }

  @Test
  void emergencyIsDispatchedImmediately() {
    when(scheduler.assign(anyLong())).thenReturn(AssignmentOutcome.noEligible(1L, "none", true, List.of()));

    WorkOrderService.CreateResult result = service.create(new WorkOrderService.NewWorkOrder(1L, 10L, ServiceCategory.PLUMBING,
        Priority.EMERGENCY, null, null, null, 90, Set.of(), "burst pipe"), "req-e");

    verify(scheduler).assign(result.order().id);
    assertEquals(AssignmentOutcome.Kind.NO_ELIGIBLE_TECHNICIAN, result.dispatch().kind());
  }

  @Test
  void invalidInputIsRejected() {
    assertThrows(ValidationException.class, () -> service.create(new WorkOrderService.NewWorkOrder(1L, 10L, ServiceCategory.HVAC,
        Priority.ROUTINE, null, at(12), at(11), 60, Set.of(), null), null));
    assertThrows(ValidationException.class, () -> service.create(new WorkOrderService.NewWorkOrder(1L, 10L, ServiceCategory.HVAC,
        Priority.ROUTINE, null, at(9), null, 60, Set.of(), null), null));
    assertThrows(ValidationException.class, () -> service.create(new WorkOrderService.NewWorkOrder(1L, 10L, ServiceCategory.HVAC,
        Priority.ROUTINE, null, null, null, 0, Set.of(), null), null));
    assertThrows(NotFoundException.class, () -> service.create(new WorkOrderService.NewWorkOrder(2L, 10L, ServiceCategory.HVAC,
        Priority.ROUTINE, null, null, null, 60, Set.of(), null), null));
  }

  @Test
  void cancelRequiresReasonAndReleasesAssignment() {
    Long id = assigned(7L).id;

    assertThrows(ValidationException.class, () -> service.cancel(id, "", null));

    WorkOrderEntity cancelled = service.cancel(id, "CUSTOMER_REQUEST", "moved out");

    assertEquals(WorkOrderStatus.CANCELLED, cancelled.status);
    assertEquals("CUSTOMER_REQUEST", cancelled.cancelReason);
    assertTrue(store.activeAssignment(id).isEmpty());
    verify(scheduler).abortSearch(id);
    verify(notifier).cancelled(any(), eq(7L), eq("CUSTOMER_REQUEST"));
    verify(routes).refresh(7L, LocalDate.now(CLOCK), false);
  }

  @Test
  void terminalOrdersCannotBeCancelled() {
    Long id = assigned(7L).id;
    service.transition(id, WorkOrderStatus.IN_PROGRESS, null);
    WorkOrderEntity done = service.transition(id, WorkOrderStatus.COMPLETED, null);

    assertNotNull(done.actualStart);
    assertNotNull(done.actualEnd);
    assertThrows(IllegalTransitionException.class, () -> service.cancel(id, "CUSTOMER_REQUEST", null));
  }

  @Test
  void holdResumesOnlyToThePriorState() {
    Long id = assigned(7L).id;
    WorkOrderEntity held = service.transition(id, WorkOrderStatus.ON_HOLD, "waiting for part");
    assertEquals(WorkOrderStatus.ASSIGNED, held.heldFrom);

    assertThrows(IllegalTransitionException.class, () -> service.transition(id, WorkOrderStatus.IN_PROGRESS, null));

    WorkOrderEntity resumed = service.transition(id, WorkOrderStatus.ASSIGNED, "part arrived");
    assertEquals(WorkOrderStatus.ASSIGNED, resumed.status);
    assertNull(resumed.heldFrom);
    assertEquals(7L, resumed.technicianId);
  }

  @Test
  void assignmentOnlyGoesThroughTheScheduler() {
    Long id = service.create(routine(10L), null).order().id;

    assertThrows(IllegalTransitionException.class, () -> service.transition(id, WorkOrderStatus.ASSIGNED, null));
    assertThrows(IllegalTransitionException.class, () -> service.transition(id, WorkOrderStatus.COMPLETED, null));
  }

  @Test
  void rescheduleToAnotherDayReleasesTheTechnician() {
    Long id = assigned(7L).id;
    LocalDate thursday = LocalDate.of(2026, 3, 12);

    WorkOrderEntity moved = service.reschedule(id, thursday, null, null, "customer travelling");

    assertEquals(thursday, moved.serviceDate);
    assertEquals(WorkOrderStatus.QUALIFIED, moved.status);
    assertNull(moved.technicianId);
    assertNull(moved.eta);
    assertTrue(store.activeAssignment(id).isEmpty());
    assertNotNull(store.assignments(id).get(0).supersededAt);
    verify(scheduler).abortSearch(id);
    verify(routes).refresh(7L, LocalDate.now(CLOCK), false);
  }

  @Test
  void newWindowOnTheSameDayKeepsTheTechnician() {
    Long id = assigned(7L).id;

    WorkOrderEntity moved = service.reschedule(id, null, at(13), at(15), null);

    assertEquals(WorkOrderStatus.ASSIGNED, moved.status);
    assertEquals(7L, moved.technicianId);
    assertEquals(at(13), moved.windowStart);
    assertEquals(at(15), moved.windowEnd);
    assertTrue(store.activeAssignment(id).isPresent());
    verify(routes).refresh(7L, LocalDate.now(CLOCK), false);
  }

  @Test
  void rescheduleOfQualifiedOrderClearsTheLastSearchResult() {
    Long id = service.create(routine(10L), null).order().id;
    WorkOrderEntity w = store.get(id).orElseThrow();
    w.lastDispatchOutcome = "NO_ELIGIBLE_TECHNICIAN";
    store.saveIfVersion(w);

    WorkOrderEntity moved = service.reschedule(id, LocalDate.of(2026, 3, 11), null, null, null);

    assertEquals(WorkOrderStatus.QUALIFIED, moved.status);
    assertNull(moved.lastDispatchOutcome);
    verifyNoInteractions(routes);
  }

  @Test
  void invalidRescheduleIsRejected() {
    Long id = assigned(7L).id;

    assertThrows(ValidationException.class, () -> service.reschedule(id, LocalDate.of(2026, 3, 9), null, null, null));
    assertThrows(ValidationException.class, () -> service.reschedule(id, null, null, null, null));
    assertThrows(ValidationException.class, () -> service.reschedule(id, null, at(15), at(13), null));
    assertThrows(ValidationException.class, () -> service.reschedule(id, LocalDate.of(2026, 3, 11), at(13), at(15), null));
    assertEquals(WorkOrderStatus.ASSIGNED, store.get(id).orElseThrow().status);
  }

  @Test
  void startedWorkCannotBeRescheduled() {
    Long id = assigned(7L).id;
    service.transition(id, WorkOrderStatus.IN_PROGRESS, null);

    DispatchException ex = assertThrows(DispatchException.class,
        () -> service.reschedule(id, LocalDate.of(2026, 3, 12), null, null, null));

    assertEquals("NOT_RESCHEDULABLE", ex.code());
    assertEquals(LocalDate.of(2026, 3, 10), store.get(id).orElseThrow().serviceDate);
  }

  private WorkOrderEntity assigned(Long technicianId) {
    WorkOrderEntity w = service.create(routine(10L), null).order();
    w.status = WorkOrderStatus.ASSIGNED;
    w.technicianId = technicianId;
    Entities.AssignmentEntity a = new Entities.AssignmentEntity();
    a.workOrderId = w.id;
    a.technicianId = technicianId;
    return store.commitAssignment(w, a).orElseThrow();
  }

  private static WorkOrderService.NewWorkOrder routine(Long propertyId) {
    return new WorkOrderService.NewWorkOrder(1L, propertyId, ServiceCategory.HVAC, Priority.ROUTINE,
        LocalDate.of(2026, 3, 10), null, null, 60, Set.of(), "annual check");
  }

  private static PropertyEntity property(Long id, Double lat, Double lng) {
    PropertyEntity p = new PropertyEntity();
    p.id = id;
    p.customerId = 1L;
    p.latitude = lat;
    p.longitude = lng;
    p.zip = "10001";
    return p;
  }

  private static OffsetDateTime at(int hour) {
    return OffsetDateTime.of(2026, 3, 10, hour, 0, 0, 0, ZoneOffset.UTC);
  }
}
