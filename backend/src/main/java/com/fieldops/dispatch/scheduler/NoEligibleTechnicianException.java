package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.common.DispatchException;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class NoEligibleTechnicianException extends DispatchException {
  public NoEligibleTechnicianException(Long workOrderId, String reasoning) {
    super(HttpStatus.CONFLICT, "NO_ELIGIBLE_TECHNICIAN", "No eligible technician for work order " + workOrderId + ": " + reasoning,
        "The order stays in the manual dispatch queue.", Map.of("workOrderId", workOrderId));
  }
}
