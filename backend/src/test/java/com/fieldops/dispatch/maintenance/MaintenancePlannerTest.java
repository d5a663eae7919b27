package com.fieldops.dispatch.maintenance;

import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.MaintenanceAgreementEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.scheduler.AssignmentOutcome;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import com.fieldops.dispatch.workorder.WorkOrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.*;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MaintenancePlannerTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T05:30:00Z"), ZoneOffset.UTC);
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  private MaintenanceAgreementRepository agreements;
  private WorkOrderService workOrders;
  private DispatchScheduler scheduler;
  private MaintenancePlanner planner;

  @BeforeEach
  void setUp() {
    agreements = mock(MaintenanceAgreementRepository.class);
    workOrders = mock(WorkOrderService.class);
    scheduler = mock(DispatchScheduler.class);
    planner = new MaintenancePlanner(agreements, mock(CustomerRepository.class), mock(PropertyRepository.class),
        workOrders, scheduler, new MaintenanceProperties(), CLOCK);
  }

  @Test
  void dueAgreementCreatesMaintenanceOrderAndAdvances() {
    MaintenanceAgreementEntity agreement = agreement(5L, TODAY.plusDays(3), null);
    when(agreements.findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(TODAY.plusDays(14))).thenReturn(List.of(agreement));
    when(workOrders.create(any(), anyString())).thenReturn(result(41L, true, WorkOrderStatus.QUALIFIED));

    List<MaintenancePlanner.Generated> generated = planner.generate(TODAY);

    ArgumentCaptor<WorkOrderService.NewWorkOrder> order = ArgumentCaptor.forClass(WorkOrderService.NewWorkOrder.class);
    verify(workOrders).create(order.capture(), eq("maint-5-2026-03-13"));
    assertEquals(Priority.MAINTENANCE, order.getValue().priority());
    assertEquals(TODAY.plusDays(3), order.getValue().serviceDate());
    assertEquals(ServiceCategory.HVAC, order.getValue().category());
    assertEquals(List.of(new MaintenancePlanner.Generated(5L, TODAY.plusDays(3), 41L, true, null)), generated);
    assertEquals(TODAY.plusDays(3).plusMonths(6), agreement.nextDueDate);
    assertEquals(41L, agreement.lastGeneratedWorkOrderId);
    verify(agreements).save(agreement);
    verifyNoInteractions(scheduler);
  }

  @Test
  void overdueVisitIsScheduledForToday() {
    MaintenanceAgreementEntity agreement = agreement(6L, TODAY.minusDays(10), null);
    when(agreements.findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(any())).thenReturn(List.of(agreement));
    when(workOrders.create(any(), anyString())).thenReturn(result(42L, true, WorkOrderStatus.QUALIFIED));

    planner.generate(TODAY);

    ArgumentCaptor<WorkOrderService.NewWorkOrder> order = ArgumentCaptor.forClass(WorkOrderService.NewWorkOrder.class);
    verify(workOrders).create(order.capture(), eq("maint-6-2026-02-28"));
    assertEquals(TODAY, order.getValue().serviceDate());
  }

  @Test
  void longOverdueAgreementGetsOneCatchUpVisit() {
    MaintenanceAgreementEntity agreement = agreement(12L, TODAY.minusYears(2), null);
    agreement.intervalMonths = 3;
    when(agreements.findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(any())).thenReturn(List.of(agreement));
    when(workOrders.create(any(), anyString())).thenReturn(result(46L, true, WorkOrderStatus.QUALIFIED));

    List<MaintenancePlanner.Generated> generated = planner.generate(TODAY);

    ArgumentCaptor<WorkOrderService.NewWorkOrder> order = ArgumentCaptor.forClass(WorkOrderService.NewWorkOrder.class);
    verify(workOrders, times(1)).create(order.capture(), eq("maint-12-2024-03-10"));
    assertEquals(TODAY, order.getValue().serviceDate());
    assertEquals(1, generated.size());
    assertEquals(LocalDate.of(2026, 6, 10), agreement.nextDueDate);
    verify(agreements).save(agreement);
  }

  @Test
  void preferredTechnicianIsAssignedOnlyForNewOrders() {
    MaintenanceAgreementEntity fresh = agreement(7L, TODAY.plusDays(1), 9L);
    MaintenanceAgreementEntity replayed = agreement(8L, TODAY.plusDays(2), 9L);
    when(agreements.findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(any())).thenReturn(List.of(fresh, replayed));
    when(workOrders.create(any(), eq("maint-7-2026-03-11"))).thenReturn(result(43L, true, WorkOrderStatus.QUALIFIED));
    when(workOrders.create(any(), eq("maint-8-2026-03-12"))).thenReturn(result(44L, false, WorkOrderStatus.QUALIFIED));
    when(scheduler.assignTo(eq(43L), eq(9L), anyString())).thenReturn(new AssignmentOutcome(43L, AssignmentOutcome.Kind.ASSIGNED,
        9L, 80.0, Map.of(), "manual", false, List.of(), List.of()));

    List<MaintenancePlanner.Generated> generated = planner.generate(TODAY);

    assertEquals(9L, generated.get(0).technicianId());
    assertNull(generated.get(1).technicianId());
    verify(scheduler).assignTo(eq(43L), eq(9L), anyString());
    verify(scheduler, never()).assignTo(eq(44L), any(), anyString());
  }

  @Test
  void failingAgreementIsSkippedAndNotAdvanced() {
    MaintenanceAgreementEntity broken = agreement(10L, TODAY, null);
    MaintenanceAgreementEntity fine = agreement(11L, TODAY, null);
    when(agreements.findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(any())).thenReturn(List.of(broken, fine));
    when(workOrders.create(any(), eq("maint-10-2026-03-10"))).thenThrow(new NotFoundException("Property", 2L));
    when(workOrders.create(any(), eq("maint-11-2026-03-10"))).thenReturn(result(45L, true, WorkOrderStatus.QUALIFIED));

    List<MaintenancePlanner.Generated> generated = planner.generate(TODAY);

    assertEquals(1, generated.size());
    assertEquals(11L, generated.get(0).agreementId());
    assertEquals(TODAY, broken.nextDueDate);
    verify(agreements, never()).save(broken);
  }

  private static MaintenanceAgreementEntity agreement(Long id, LocalDate due, Long preferredTechnicianId) {
    MaintenanceAgreementEntity a = new MaintenanceAgreementEntity();
    a.id = id;
    a.customerId = 1L;
    a.propertyId = 2L;
    a.category = ServiceCategory.HVAC;
    a.intervalMonths = 6;
    a.nextDueDate = due;
    a.preferredTechnicianId = preferredTechnicianId;
    return a;
  }

  private static WorkOrderService.CreateResult result(Long id, boolean created, WorkOrderStatus status) {
    WorkOrderEntity w = new WorkOrderEntity();
    w.id = id;
    w.status = status;
    w.priority = Priority.MAINTENANCE;
    return new WorkOrderService.CreateResult(w, created, List.of(), null);
  }
}
