package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.scoring.AssignmentScorer;
import com.fieldops.dispatch.scoring.ScoringProperties;
import com.fieldops.dispatch.travel.RoutingProperties;
import com.fieldops.dispatch.travel.RoutingProvider;
import com.fieldops.dispatch.travel.TravelTimeEstimator;
import com.fieldops.dispatch.workorder.InMemoryWorkOrderStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CandidateEvaluatorTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T07:00:00Z"), ZoneOffset.UTC);

  private InMemoryWorkOrderStore store;
  private TechnicianAvailabilityIndex index;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    store = new InMemoryWorkOrderStore();
    index = new TechnicianAvailabilityIndex(mock(TechnicianRepository.class), mock(WorkOrderRepository.class),
        CLOCK, Duration.ofHours(4), 7);
    pool = Executors.newFixedThreadPool(2);
    technician(1L, new GeoPoint(40.01, -74.0));
    technician(2L, new GeoPoint(40.02, -74.0));
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void slowCandidateTimesOutAndItsThreadIsInterrupted() throws Exception {
    CountDownLatch interrupted = new CountDownLatch(1);
    GeoPoint slowOrigin = new GeoPoint(40.02, -74.0);
    CandidateEvaluator evaluator = evaluator(1000, (origin, destination, departure) -> {
      if (!origin.equals(slowOrigin)) {
        return Duration.ofMinutes(12);
      }
      try {
        new CountDownLatch(1).await(30, TimeUnit.SECONDS);
        return Duration.ofMinutes(12);
      } catch (InterruptedException ex) {
        interrupted.countDown();
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted", ex);
      }
    });

    List<CandidateEvaluation> results = evaluator.evaluate(job(), List.of(1L, 2L), new ScoringProperties().toPolicy(), true, () -> false);

    assertEquals(2, results.size());
    assertTrue(results.get(0).eligible());
    assertEquals(CandidateEvaluation.TIMEOUT, results.get(1).rejection());
    assertTrue(interrupted.await(5, TimeUnit.SECONDS), "timed-out evaluation kept running");
  }

  @Test
  void cancelledSearchRejectsEveryCandidate() {
    CandidateEvaluator evaluator = evaluator(5000, (origin, destination, departure) -> Duration.ofMinutes(12));

    List<CandidateEvaluation> results = evaluator.evaluate(job(), List.of(1L, 2L), new ScoringProperties().toPolicy(), true, () -> true);

    assertTrue(results.stream().allMatch(r -> CandidateEvaluation.CANCELLED.equals(r.rejection())));
  }

  private void technician(Long id, GeoPoint home) {
    index.upsertTechnician(new TechnicianProfile(id, "Tech " + id, Set.of(ServiceCategory.HVAC), true, false,
        home, null, null, LocalTime.of(8, 0), LocalTime.of(17, 0), 8, Set.of()));
  }

  private CandidateEvaluator evaluator(long timeoutMs, RoutingProvider provider) {
    RoutingProperties routing = new RoutingProperties();
    routing.setInitialBackoffMs(1);
    DispatchProperties properties = new DispatchProperties();
    properties.setCandidateTimeoutMs(timeoutMs);
    return new CandidateEvaluator(index, new TravelTimeEstimator(provider, routing), new AssignmentScorer(), store, pool,
        properties, CLOCK);
  }

  private DispatchJob job() {
    WorkOrderEntity w = new WorkOrderEntity();
    w.customerId = 100L;
    w.propertyId = 200L;
    w.category = ServiceCategory.HVAC;
    w.priority = Priority.ROUTINE;
    w.status = WorkOrderStatus.QUALIFIED;
    w.serviceDate = LocalDate.now(CLOCK);
    w.latitude = 40.2;
    w.longitude = -74.0;
    return DispatchJob.from(store.create(w));
  }
}
