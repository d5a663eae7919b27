package com.fieldops.dispatch.board;

import com.fieldops.dispatch.domain.Entities.SyncItemStatus;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.SyncQueueItemRepository;
import com.fieldops.dispatch.domain.WorkOrderStatus;
import com.fieldops.dispatch.scheduler.DispatchScheduler;
import com.fieldops.dispatch.workorder.WorkOrderQuery;
import com.fieldops.dispatch.workorder.WorkOrderService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.*;

@RestController @RequestMapping("/api/dispatch/board")
public class DispatchBoardController {
  private static final Set<String> MANUAL_OUTCOMES = Set.of(DispatchScheduler.OUTCOME_NO_ELIGIBLE, WorkOrderService.OUTCOME_UNQUALIFIED);
  private static final Set<WorkOrderStatus> AWAITING = EnumSet.of(WorkOrderStatus.CREATED, WorkOrderStatus.QUALIFIED);

  private final WorkOrderService workOrders;
  private final SyncQueueItemRepository syncQueue;

  public DispatchBoardController(WorkOrderService workOrders, SyncQueueItemRepository syncQueue){
    this.workOrders=workOrders;
    this.syncQueue=syncQueue;
  }

  @GetMapping
  Map<String,Object> board(@RequestParam @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date){
    var orders = workOrders.list(WorkOrderQuery.onDate(date));
    var byStatus = new EnumMap<WorkOrderStatus,Long>(WorkOrderStatus.class);
    orders.forEach(w -> byStatus.merge(w.status, 1L, Long::sum));
    var manual = orders.stream()
        .filter(w -> AWAITING.contains(w.status) && w.lastDispatchOutcome != null && MANUAL_OUTCOMES.contains(w.lastDispatchOutcome))
        .map(w -> Map.<String,Object>of("id", w.id, "status", w.status, "priority", w.priority, "category", w.category,
            "outcome", w.lastDispatchOutcome, "message", Objects.toString(w.lastDispatchMessage, "")))
        .toList();
    Map<String,Object> body = new LinkedHashMap<>();
    body.put("date", date.toString());
    body.put("total", orders.size());
    body.put("byStatus", byStatus);
    body.put("manualQueue", manual);
    body.put("syncReview", syncQueue.countByStatus(SyncItemStatus.MANUAL_REVIEW));
    body.put("syncAbandoned", syncQueue.countByStatus(SyncItemStatus.FAILED_ABANDONED));
    return body;
  }

  @GetMapping(value="/export", produces="text/csv")
  String export(@RequestParam @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date){
    StringBuilder sb = new StringBuilder("id,status,priority,category,technician_id,window_start,window_end,eta,route_sequence,last_outcome\n");
    for (WorkOrderEntity w : workOrders.list(WorkOrderQuery.onDate(date))) {
      sb.append(w.id).append(',').append(w.status).append(',').append(w.priority).append(',').append(w.category).append(',')
          .append(cell(w.technicianId)).append(',').append(cell(w.windowStart)).append(',').append(cell(w.windowEnd)).append(',')
          .append(cell(w.eta)).append(',').append(cell(w.routeSequence)).append(',').append(cell(w.lastDispatchOutcome)).append('\n');
    }
    return sb.toString();
  }

  private static String cell(Object value) {
    if (value == null) return "";
    String s = value.toString();
    if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0) return s;
    return '"' + s.replace("\"", "\"\"") + '"';
  }
}
