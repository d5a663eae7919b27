package com.fieldops.dispatch.route;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;

@RestController @RequestMapping("/api/technicians")
public class RouteController {
  private final RouteService routes;
  private final Clock clock;

  public RouteController(RouteService routes, Clock clock){
    this.routes=routes;
    this.clock=clock;
  }

  @GetMapping("/{id}/route")
  RoutePlan route(@PathVariable Long id, @RequestParam(required=false) @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date){
    return routes.plan(id, date == null ? LocalDate.now(clock) : date);
  }

  @PostMapping("/{id}/route/refresh")
  RouteRefresh refresh(@PathVariable Long id, @RequestParam(required=false) @DateTimeFormat(iso=DateTimeFormat.ISO.DATE) LocalDate date){
    return routes.refresh(id, date == null ? LocalDate.now(clock) : date, true);
  }
}
