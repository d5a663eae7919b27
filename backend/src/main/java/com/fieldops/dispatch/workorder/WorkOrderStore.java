package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.domain.Entities.AssignmentEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Work order persistence with optimistic version tokens.
 *
 * <p>Every method returns detached copies. Conditional writes compare the {@code version} carried by the argument
 * with the stored one and return empty when they differ; nothing is written in that case. A successful write
 * increments the version.
 */
public interface WorkOrderStore {
  Optional<WorkOrderEntity> get(Long id);

  Optional<WorkOrderEntity> findByIdempotencyKey(String idempotencyKey);

  WorkOrderEntity create(WorkOrderEntity draft);

  Optional<WorkOrderEntity> saveIfVersion(WorkOrderEntity updated);

  /** Writes the order and, in the same unit, supersedes any active assignment and inserts {@code assignment}. */
  Optional<WorkOrderEntity> commitAssignment(WorkOrderEntity updated, AssignmentEntity assignment);

  /** Writes the order and deactivates its active assignment, if any. */
  Optional<WorkOrderEntity> releaseAssignment(WorkOrderEntity updated, OffsetDateTime at);

  Optional<AssignmentEntity> activeAssignment(Long workOrderId);

  List<AssignmentEntity> assignments(Long workOrderId);

  List<WorkOrderEntity> query(WorkOrderQuery query);

  /** True when the technician has completed work for this customer or property before. */
  boolean hasServed(Long technicianId, Long customerId, Long propertyId);
}
