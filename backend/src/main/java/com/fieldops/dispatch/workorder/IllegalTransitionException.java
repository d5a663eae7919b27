package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.common.DispatchException;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class IllegalTransitionException extends DispatchException {
  public IllegalTransitionException(Long workOrderId, WorkOrderStatus from, WorkOrderStatus to) {
    super(HttpStatus.CONFLICT, "ILLEGAL_TRANSITION",
        "Work order " + workOrderId + " cannot move from " + from + " to " + to,
        from == null ? null : "Allowed targets: " + from.allowedTargets(),
        Map.of("workOrderId", workOrderId, "from", String.valueOf(from), "to", String.valueOf(to)));
  }
}
