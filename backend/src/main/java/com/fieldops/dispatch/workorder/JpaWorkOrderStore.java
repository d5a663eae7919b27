package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.domain.AssignmentRepository;
import com.fieldops.dispatch.domain.Entities.AssignmentEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.WorkOrderRepository;
import jakarta.persistence.OptimisticLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relies on the {@code @Version} column: the merge of a stale copy fails and the transaction rolls back.
 * Optimistic failures are caught outside the transaction template so the rollback has already completed.
 */
@Component
public class JpaWorkOrderStore implements WorkOrderStore {
  private static final Logger log = LoggerFactory.getLogger(JpaWorkOrderStore.class);

  private final WorkOrderRepository workOrders;
  private final AssignmentRepository assignments;
  private final TransactionTemplate tx;
  private final Clock clock;

  public JpaWorkOrderStore(WorkOrderRepository workOrders, AssignmentRepository assignments,
                           PlatformTransactionManager transactionManager, Clock clock) {
    this.workOrders = workOrders;
    this.assignments = assignments;
    this.tx = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  @Override
  public Optional<WorkOrderEntity> get(Long id) {
    return tx.execute(s -> workOrders.findById(id).map(WorkOrderEntity::copy));
  }

  @Override
  public Optional<WorkOrderEntity> findByIdempotencyKey(String idempotencyKey) {
    return tx.execute(s -> workOrders.findByIdempotencyKey(idempotencyKey).map(WorkOrderEntity::copy));
  }

  @Override
  public WorkOrderEntity create(WorkOrderEntity draft) {
    return tx.execute(s -> {
      WorkOrderEntity fresh = draft.copy();
      fresh.id = null;
      fresh.version = 0;
      return workOrders.saveAndFlush(fresh).copy();
    });
  }

  @Override
  public Optional<WorkOrderEntity> saveIfVersion(WorkOrderEntity updated) {
    return conditional(updated.id, () -> tx.execute(s -> save(updated)));
  }

  @Override
  public Optional<WorkOrderEntity> commitAssignment(WorkOrderEntity updated, AssignmentEntity assignment) {
    return conditional(updated.id, () -> tx.execute(s -> {
      WorkOrderEntity saved = save(updated);
      OffsetDateTime now = OffsetDateTime.now(clock);
      supersede(updated.id, now);
      assignment.id = null;
      assignment.active = true;
      assignment.assignedAt = now;
      assignments.saveAndFlush(assignment);
      return saved;
    }));
  }

  @Override
  public Optional<WorkOrderEntity> releaseAssignment(WorkOrderEntity updated, OffsetDateTime at) {
    return conditional(updated.id, () -> tx.execute(s -> {
      WorkOrderEntity saved = save(updated);
      supersede(updated.id, at);
      return saved;
    }));
  }

  @Override
  public Optional<AssignmentEntity> activeAssignment(Long workOrderId) {
    return assignments.findFirstByWorkOrderIdAndActiveTrue(workOrderId);
  }

  @Override
  public List<AssignmentEntity> assignments(Long workOrderId) {
    return assignments.findByWorkOrderIdOrderByIdAsc(workOrderId);
  }

  @Override
  public List<WorkOrderEntity> query(WorkOrderQuery query) {
    return tx.execute(s -> workOrders.findFiltered(query.serviceDate(), query.status(), query.technicianId())
        .stream().map(WorkOrderEntity::copy).toList());
  }

  @Override
  public boolean hasServed(Long technicianId, Long customerId, Long propertyId) {
    return workOrders.countCompletedFor(technicianId, customerId, propertyId) > 0;
  }

  private WorkOrderEntity save(WorkOrderEntity updated) {
    WorkOrderEntity detached = updated.copy();
    detached.updatedAt = OffsetDateTime.now(clock);
    return workOrders.saveAndFlush(detached).copy();
  }

  private void supersede(Long workOrderId, OffsetDateTime at) {
    for (AssignmentEntity active : assignments.findByWorkOrderIdAndActiveTrue(workOrderId)) {
      active.active = false;
      active.supersededAt = at;
      assignments.save(active);
    }
    assignments.flush();
  }

  private Optional<WorkOrderEntity> conditional(Long id, Supplier<WorkOrderEntity> write) {
    try {
      return Optional.ofNullable(write.get());
    } catch (OptimisticLockingFailureException | OptimisticLockException ex) {
      log.debug("Version conflict on work order id={}: {}", id, ex.getMessage());
      return Optional.empty();
    }
  }
}
