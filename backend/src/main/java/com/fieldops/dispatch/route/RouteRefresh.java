package com.fieldops.dispatch.route;

import java.util.List;

public record RouteRefresh(RoutePlan plan, List<EtaUpdate> etaUpdates) {
  public static RouteRefresh empty(RoutePlan plan) {
    return new RouteRefresh(plan, List.of());
  }
}
