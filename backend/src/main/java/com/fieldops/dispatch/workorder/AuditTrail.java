package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.domain.Entities.WorkOrderEventEntity;
import com.fieldops.dispatch.domain.WorkOrderEventRepository;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Status history of work orders, persisted and mirrored to the {@code audit} logger.
 */
@Component
public class AuditTrail {
  private static final Logger audit = LoggerFactory.getLogger("audit");

  private final WorkOrderEventRepository events;
  private final Clock clock;

  public AuditTrail(WorkOrderEventRepository events, Clock clock) {
    this.events = events;
    this.clock = clock;
  }

  public void statusChanged(Long workOrderId, WorkOrderStatus from, WorkOrderStatus to, String actor, String reason) {
    WorkOrderEventEntity e = new WorkOrderEventEntity();
    e.workOrderId = workOrderId;
    e.fromStatus = from;
    e.toStatus = to;
    e.actor = actor;
    e.reason = reason;
    e.createdAt = OffsetDateTime.now(clock);
    events.save(e);
    audit.info("workOrder={} {} -> {} actor={} reason={}", workOrderId, from, to, actor, reason);
  }

  public List<WorkOrderEventEntity> history(Long workOrderId) {
    return events.findByWorkOrderIdOrderByIdAsc(workOrderId);
  }
}
