package com.fieldops.dispatch.workorder;

import com.fieldops.dispatch.domain.Entities.AssignmentEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEventEntity;
import com.fieldops.dispatch.domain.Priority;
import com.fieldops.dispatch.domain.ServiceCategory;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.scheduler.AssignmentOutcome;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController @RequestMapping("/api") @Validated
public class WorkOrderController {
  private final WorkOrderService workOrders;
  private final DispatchScheduler scheduler;

  public WorkOrderController(WorkOrderService workOrders, DispatchScheduler scheduler){
    this.workOrders=workOrders;
    this.scheduler=scheduler;
  }

  public record CreateWorkOrderReq(
      @NotNull Long customerId,
      @NotNull Long propertyId,
      @NotNull ServiceCategory category,
      Priority priority,
      LocalDate serviceDate,
      OffsetDateTime windowStart,
      OffsetDateTime windowEnd,
      @Min(1) @Max(720) Integer estimatedMinutes,
      Set<Long> equipmentIds,
      String notes) {}
  public record QualifyReq(boolean override, String reason) {}
  public record AssignReq(Long technicianId, String reason) {}
  public record StatusReq(@NotNull WorkOrderStatus status, String reason) {}
  public record CancelReq(@NotBlank String reasonCode, String note) {}
  public record RescheduleReq(LocalDate serviceDate, OffsetDateTime windowStart, OffsetDateTime windowEnd, String reason) {}

  @PostMapping("/work-orders")
  ResponseEntity<Map<String,Object>> create(@Valid @RequestBody CreateWorkOrderReq req, @RequestHeader(value="Idempotency-Key", required=false) String idempotencyKey){
    var result = workOrders.create(new WorkOrderService.NewWorkOrder(req.customerId(), req.propertyId(), req.category(), req.priority(),
        req.serviceDate(), req.windowStart(), req.windowEnd(), req.estimatedMinutes(), req.equipmentIds(), req.notes()), idempotencyKey);
    Map<String,Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("created", result.created());
    body.put("workOrder", result.order());
    if (!result.qualificationProblems().isEmpty()) body.put("qualificationProblems", result.qualificationProblems());
    if (result.dispatch() != null) body.put("dispatch", result.dispatch());
    return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
  }

  @GetMapping("/work-orders/{id}")
  WorkOrderEntity get(@PathVariable Long id){
    return workOrders.get(id);
  }

  @GetMapping("/work-orders")
  List<WorkOrderEntity> list(@RequestParam(required=false) @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date,
                             @RequestParam(required=false) WorkOrderStatus status,
                             @RequestParam(required=false) Long technicianId){
    return workOrders.list(new WorkOrderQuery(date, status, technicianId));
  }

  @PostMapping("/work-orders/{id}/qualify")
  WorkOrderEntity qualify(@PathVariable Long id, @RequestBody(required=false) QualifyReq req){
    boolean override = req != null && req.override();
    return workOrders.qualify(id, override, req == null ? null : req.reason());
  }

  @PostMapping("/work-orders/{id}/assign")
  AssignmentOutcome assign(@PathVariable Long id, @RequestBody(required=false) AssignReq req){
    if (req != null && req.technicianId() != null) {
      return scheduler.assignTo(id, req.technicianId(), req.reason());
    }
    return scheduler.assign(id);
  }

  @PostMapping("/work-orders/{id}/reassign")
  AssignmentOutcome reassign(@PathVariable Long id, @RequestBody(required=false) AssignReq req){
    return scheduler.reassign(id, req == null ? null : req.technicianId(), req == null ? null : req.reason());
  }

  @PostMapping("/work-orders/{id}/status")
  WorkOrderEntity status(@PathVariable Long id, @Valid @RequestBody StatusReq req){
    return workOrders.transition(id, req.status(), req.reason());
  }

  @PostMapping("/work-orders/{id}/cancel")
  WorkOrderEntity cancel(@PathVariable Long id, @Valid @RequestBody CancelReq req){
    return workOrders.cancel(id, req.reasonCode(), req.note());
  }

  @PostMapping("/work-orders/{id}/reschedule")
  WorkOrderEntity reschedule(@PathVariable Long id, @RequestBody RescheduleReq req){
    return workOrders.reschedule(id, req.serviceDate(), req.windowStart(), req.windowEnd(), req.reason());
  }

  @PostMapping("/work-orders/{id}/abort-search")
  Map<String,Object> abortSearch(@PathVariable Long id){
    return Map.of("ok", true, "aborted", scheduler.abortSearch(id));
  }

  @GetMapping("/work-orders/{id}/assignments")
  List<AssignmentEntity> assignments(@PathVariable Long id){
    return workOrders.assignments(id);
  }

  @GetMapping("/work-orders/{id}/history")
  List<WorkOrderEventEntity> history(@PathVariable Long id){
    return workOrders.history(id);
  }

  @PostMapping("/dispatch/run")
  Map<String,Object> run(@RequestParam @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date){
    var outcomes = scheduler.dispatchPending(date);
    long assigned = outcomes.stream().filter(AssignmentOutcome::assigned).count();
    return Map.of("ok", true, "date", date.toString(), "processed", outcomes.size(), "assigned", assigned, "outcomes", outcomes);
  }
}
