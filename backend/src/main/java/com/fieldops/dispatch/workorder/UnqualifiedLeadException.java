package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.common.DispatchException;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/** The order cannot be serviced as submitted; a dispatcher may override with a reason. */
public class UnqualifiedLeadException extends DispatchException {
  private final List<String> reasons;

  public UnqualifiedLeadException(Long workOrderId, List<String> reasons) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, "UNQUALIFIED_LEAD",
        "Work order " + workOrderId + " is not serviceable: " + String.join("; ", reasons),
        "Fix the property data or qualify with override=true and a reason.",
        Map.of("workOrderId", String.valueOf(workOrderId), "reasons", List.copyOf(reasons)));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> reasons() {
    return reasons;
  }
}
