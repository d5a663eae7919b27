package com.fieldops.dispatch.maintenance;

import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.CustomerRepository;
import com.fieldops.dispatch.domain.Entities.MaintenanceAgreementEntity;
import com.fieldops.dispatch.domain.Entities.PropertyEntity;
import com.fieldops.dispatch.domain.MaintenanceAgreementRepository;
import com.fieldops.dispatch.domain.Priority;
import com.fieldops.dispatch.domain.PropertyRepository;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.scheduler.AssignmentOutcome;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import com.fieldops.dispatch.workorder.WorkOrderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns maintenance agreements into work orders. Each (agreement, due date) pair maps to one idempotency key, so a
 * repeated run never creates a second order for the same visit.
 */
@Service
public class MaintenancePlanner {
  private static final Logger log = LoggerFactory.getLogger(MaintenancePlanner.class);

  private final MaintenanceAgreementRepository agreements;
  private final CustomerRepository customers;
  private final PropertyRepository properties;
  private final WorkOrderService workOrders;
  private final DispatchScheduler scheduler;
  private final MaintenanceProperties props;
  private final Clock clock;

  public MaintenancePlanner(MaintenanceAgreementRepository agreements, CustomerRepository customers, PropertyRepository properties,
                            WorkOrderService workOrders, DispatchScheduler scheduler, MaintenanceProperties props, Clock clock) {
    this.agreements = agreements;
    this.customers = customers;
    this.properties = properties;
    this.workOrders = workOrders;
    this.scheduler = scheduler;
    this.props = props;
    this.clock = clock;
  }

  public record Generated(Long agreementId, LocalDate dueDate, Long workOrderId, boolean created, Long technicianId) {}

  public MaintenanceAgreementEntity createAgreement(MaintenanceAgreementEntity draft) {
    if (draft.category == null) {
      throw new ValidationException("category is required", "category");
    }
    if (draft.intervalMonths <= 0) {
      throw new ValidationException("intervalMonths must be positive", "intervalMonths");
    }
    if (draft.nextDueDate == null) {
      throw new ValidationException("nextDueDate is required", "nextDueDate");
    }
    customers.findByIdAndDeletedFalse(draft.customerId).orElseThrow(() -> new NotFoundException("Customer", draft.customerId));
    PropertyEntity property = properties.findById(draft.propertyId).filter(p -> !p.deleted)
        .orElseThrow(() -> new NotFoundException("Property", draft.propertyId));
    if (!Objects.equals(property.customerId, draft.customerId)) {
      throw new ValidationException("Property " + property.id + " does not belong to customer " + draft.customerId, "propertyId");
    }
    draft.id = null;
    draft.active = true;
    draft.createdAt = OffsetDateTime.now(clock);
    return agreements.save(draft);
  }

  @Scheduled(cron = "${app.maintenance.cron:0 30 5 * * *}")
  public void generateDaily() {
    LocalDate today = LocalDate.now(clock);
    try {
      List<Generated> generated = generate(today);
      log.info("Maintenance planning date={} generated={}", today, generated.size());
    } catch (RuntimeException ex) {
      log.error("Maintenance planning failed date={}", today, ex);
    }
  }

  /**
   * Creates the orders for every visit due within the horizon and advances each agreement past them. An overdue
   * agreement gets a single catch-up visit today, however many intervals it missed.
   */
  public List<Generated> generate(LocalDate today) {
    LocalDate cutoff = today.plusDays(props.getHorizonDays());
    List<Generated> out = new ArrayList<>();
    for (MaintenanceAgreementEntity agreement : agreements.findByActiveTrueAndNextDueDateLessThanEqualOrderByIdAsc(cutoff)) {
      try {
        if (agreement.nextDueDate.isBefore(today)) {
          LocalDate overdueSince = agreement.nextDueDate;
          out.add(generateOne(agreement, today, overdueSince));
          int missed = 0;
          while (!agreement.nextDueDate.isAfter(today)) {
            agreement.nextDueDate = agreement.nextDueDate.plusMonths(agreement.intervalMonths);
            missed++;
          }
          if (missed > 1) {
            log.info("Maintenance agreement {} missed {} visits since {}; one catch-up visit scheduled for {}, next due {}",
                agreement.id, missed, overdueSince, today, agreement.nextDueDate);
          }
          agreements.save(agreement);
        }
        while (!agreement.nextDueDate.isAfter(cutoff)) {
          out.add(generateOne(agreement, agreement.nextDueDate, agreement.nextDueDate));
          agreement.nextDueDate = agreement.nextDueDate.plusMonths(agreement.intervalMonths);
          agreements.save(agreement);
        }
      } catch (DispatchException ex) {
        log.warn("Maintenance agreement {} skipped code={} message={}", agreement.id, ex.code(), ex.getMessage());
      }
    }
    return out;
  }

  private Generated generateOne(MaintenanceAgreementEntity agreement, LocalDate serviceDate, LocalDate dueDate) {
    String key = "maint-" + agreement.id + "-" + dueDate;
    Set<Long> equipmentIds = agreement.equipmentId == null ? Set.of() : Set.of(agreement.equipmentId);
    WorkOrderService.CreateResult result = workOrders.create(new WorkOrderService.NewWorkOrder(agreement.customerId,
        agreement.propertyId, agreement.category, Priority.MAINTENANCE, serviceDate, null, null,
        agreement.estimatedMinutes, equipmentIds, "Scheduled maintenance (agreement " + agreement.id + ")"), key);
    Long workOrderId = result.order().id;
    agreement.lastGeneratedWorkOrderId = workOrderId;
    Long technicianId = result.order().technicianId;
    if (result.created() && agreement.preferredTechnicianId != null && result.order().status == WorkOrderStatus.QUALIFIED) {
      try {
        AssignmentOutcome outcome = scheduler.assignTo(workOrderId, agreement.preferredTechnicianId, "maintenance agreement " + agreement.id);
        technicianId = outcome.technicianId();
      } catch (DispatchException ex) {
        log.info("Preferred technician {} not assigned to maintenance workOrder={}: {}; left for batch dispatch",
            agreement.preferredTechnicianId, workOrderId, ex.getMessage());
      }
    }
    return new Generated(agreement.id, dueDate, workOrderId, result.created(), technicianId);
  }
}
