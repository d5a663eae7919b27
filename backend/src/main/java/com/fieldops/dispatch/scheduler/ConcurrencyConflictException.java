package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.common.DispatchException;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class ConcurrencyConflictException extends DispatchException {
  public ConcurrencyConflictException(Long workOrderId, int attempts) {
    super(HttpStatus.CONFLICT, "CONCURRENCY_CONFLICT",
        "Work order " + workOrderId + " kept changing; gave up after " + attempts + " attempts",
        "Reload the work order and retry.", Map.of("workOrderId", workOrderId, "attempts", attempts));
  }
}
