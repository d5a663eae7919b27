package com.fieldops.dispatch.route;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.travel.RouteUnavailableException;
import com.fieldops.dispatch.travel.RoutingProperties;
import com.fieldops.dispatch.travel.TravelTimeEstimator;
import com.fieldops.dispatch.workorder.InMemoryWorkOrderStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RouteServiceTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T07:00:00Z"), ZoneOffset.UTC);
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
  private static final GeoPoint HOME = new GeoPoint(40.0, -74.0);

  private InMemoryWorkOrderStore store;
  private TechnicianAvailabilityIndex index;
  private TravelTimeEstimator travel;
  private RouteService routes;

  @BeforeEach
  void setUp() {
    store = new InMemoryWorkOrderStore();
    index = new TechnicianAvailabilityIndex(mock(TechnicianRepository.class), mock(WorkOrderRepository.class),
        CLOCK, Duration.ofHours(4), 7);
    index.upsertTechnician(new TechnicianProfile(1L, "Tech 1", Set.of(ServiceCategory.HVAC), true, false,
        HOME, null, null, LocalTime.of(8, 0), LocalTime.of(17, 0), 8, Set.of()));
    RoutingProperties routing = new RoutingProperties();
    routing.setInitialBackoffMs(1);
    travel = new TravelTimeEstimator((o, d, t) -> {
      throw new RouteUnavailableException("no road network between points", o, d);
    }, routing);
    routes = new RouteService(store, index, travel, new RouteOptimizer(), CLOCK);
  }

  @Test
  void unroutableLegUsesStraightLineAndFlagsUnreachableWindow() {
    GeoPoint farAway = new GeoPoint(42.7, -74.0);
    WorkOrderEntity job = assigned(farAway, at(8, 0), at(8, 10));

    RoutePlan plan = routes.plan(1L, TODAY);

    RouteStop stop = plan.stops().get(0);
    Duration straightLine = travel.straightLine(HOME, farAway).duration();
    assertTrue(straightLine.toHours() >= 9, straightLine.toString());
    assertEquals(straightLine, stop.travel());
    assertTrue(stop.approximateTravel());
    assertFalse(stop.withinWindow());
    assertFalse(plan.feasible());
    assertEquals(job.id, plan.violatingWorkOrderId());
    assertTrue(plan.approximate());
  }

  @Test
  void jobWithoutCoordinatesCountsAsZeroLeg() {
    WorkOrderEntity job = assigned(null, at(8, 0), at(9, 0));

    RoutePlan plan = routes.plan(1L, TODAY);

    assertEquals(Duration.ZERO, plan.stops().get(0).travel());
    assertEquals(at(8, 0), plan.stops().get(0).serviceStart());
    assertTrue(plan.feasible());
    assertEquals(job.id, plan.stops().get(0).workOrderId());
  }

  private WorkOrderEntity assigned(GeoPoint location, OffsetDateTime from, OffsetDateTime to) {
    WorkOrderEntity w = new WorkOrderEntity();
    w.customerId = 100L;
    w.propertyId = 200L;
    w.category = ServiceCategory.HVAC;
    w.priority = Priority.ROUTINE;
    w.status = WorkOrderStatus.ASSIGNED;
    w.technicianId = 1L;
    w.serviceDate = TODAY;
    w.windowStart = from;
    w.windowEnd = to;
    if (location != null) {
      w.latitude = location.latitude();
      w.longitude = location.longitude();
    }
    WorkOrderEntity saved = store.create(w);
    index.upsertJob(DispatchJob.from(saved));
    return saved;
  }

  private static OffsetDateTime at(int hour, int minute) {
    return TODAY.atTime(hour, minute).atOffset(ZoneOffset.UTC);
  }
}
