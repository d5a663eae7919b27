package com.fieldops.dispatch.scoring;

import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.travel.TravelEstimate;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentScorerTest {
  private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 10, 9, 0, 0, 0, ZoneOffset.UTC);

  private final AssignmentScorer scorer = new AssignmentScorer();

  @Test
  void identicalInputsGiveIdenticalScores() {
    DispatchJob job = job(ServiceCategory.PLUMBING);
    TechnicianProfile tech = tech(Set.of(ServiceCategory.PLUMBING), NOW.minusMinutes(5));
    ScoringContext ctx = new ScoringContext(TravelEstimate.routed(Duration.ofMinutes(20)), 2, true, NOW, ScoringPolicy.DEFAULT);

    ScoreResult first = scorer.score(job, tech, ctx);
    for (int i = 0; i < 20; i++) {
      ScoreResult again = scorer.score(job, tech, ctx);
      assertEquals(first.value(), again.value());
      assertEquals(first.breakdown(), again.breakdown());
    }
  }

  @Test
  void breakdownAddsUpToTheScore() {
    ScoreResult result = scorer.score(job(ServiceCategory.PLUMBING), tech(Set.of(ServiceCategory.PLUMBING), NOW),
        new ScoringContext(TravelEstimate.routed(Duration.ofMinutes(30)), 1, false, NOW, ScoringPolicy.DEFAULT));

    assertTrue(result.eligible());
    // skill 40 + travel 0.25*50 + workload 0.20*80 + continuity 0 + recency 5
    assertEquals(40.0 + 12.5 + 16.0 + 0.0 + 5.0, result.value(), 1e-9);
    double sum = result.breakdown().values().stream().mapToDouble(Double::doubleValue).sum();
    assertEquals(result.value(), sum, 1e-9);
  }

  @Test
  void generalistScoresBelowSpecialist() {
    ScoringContext ctx = new ScoringContext(TravelEstimate.routed(Duration.ofMinutes(10)), 0, false, NOW, ScoringPolicy.DEFAULT);
    double specialist = scorer.score(job(ServiceCategory.HVAC), tech(Set.of(ServiceCategory.HVAC), null), ctx).value();
    double generalist = scorer.score(job(ServiceCategory.HVAC), tech(Set.of(ServiceCategory.GENERAL), null), ctx).value();

    assertTrue(specialist > generalist);
    assertEquals(8.0, specialist - generalist, 1e-9);
  }

  @Test
  void missingSkillIsRejected() {
    ScoreResult result = scorer.score(job(ServiceCategory.ELECTRICAL), tech(Set.of(ServiceCategory.PLUMBING), NOW),
        new ScoringContext(TravelEstimate.routed(Duration.ofMinutes(5)), 0, false, NOW, ScoringPolicy.DEFAULT));

    assertFalse(result.eligible());
    assertEquals(AssignmentScorer.MISSING_SKILL, result.rejection());
    assertEquals(0.0, result.value());
  }

  @Test
  void travelBeyondCeilingIsRejected() {
    ScoreResult result = scorer.score(job(ServiceCategory.PLUMBING), tech(Set.of(ServiceCategory.PLUMBING), NOW),
        new ScoringContext(TravelEstimate.routed(Duration.ofMinutes(61)), 0, false, NOW, ScoringPolicy.DEFAULT));

    assertFalse(result.eligible());
    assertEquals(AssignmentScorer.TRAVEL_CEILING, result.rejection());
  }

  @Test
  void approximateTravelIsDiscounted() {
    TechnicianProfile tech = tech(Set.of(ServiceCategory.PLUMBING), null);
    double routed = scorer.score(job(ServiceCategory.PLUMBING), tech,
        new ScoringContext(TravelEstimate.routed(Duration.ZERO), 0, false, NOW, ScoringPolicy.DEFAULT)).breakdown().get(AssignmentScorer.TRAVEL);
    double approximate = scorer.score(job(ServiceCategory.PLUMBING), tech,
        new ScoringContext(TravelEstimate.fallback(Duration.ZERO), 0, false, NOW, ScoringPolicy.DEFAULT)).breakdown().get(AssignmentScorer.TRAVEL);

    assertEquals(25.0, routed, 1e-9);
    assertEquals(20.0, approximate, 1e-9);
  }

  @Test
  void locationRecencyDecaysBetweenFreshAndStale() {
    ScoringContext ctx = new ScoringContext(TravelEstimate.routed(Duration.ZERO), 0, false, NOW, ScoringPolicy.DEFAULT);
    double fresh = recency(tech(Set.of(ServiceCategory.PLUMBING), NOW.minusMinutes(10)), ctx);
    double middle = recency(tech(Set.of(ServiceCategory.PLUMBING), NOW.minusMinutes(15 + 112).minusSeconds(30)), ctx);
    double stale = recency(tech(Set.of(ServiceCategory.PLUMBING), NOW.minusHours(5)), ctx);

    assertEquals(5.0, fresh, 1e-9);
    assertEquals(2.5, middle, 1e-9);
    assertEquals(0.0, stale, 1e-9);
  }

  @Test
  void weightsComeFromPolicy() {
    ScoringPolicy skillOnly = ScoringPolicy.DEFAULT.withWeights(new ScoringWeights(1.0, 0, 0, 0, 0));
    ScoreResult result = scorer.score(job(ServiceCategory.PLUMBING), tech(Set.of(ServiceCategory.PLUMBING), NOW),
        new ScoringContext(TravelEstimate.routed(Duration.ofMinutes(45)), 5, true, NOW, skillOnly));

    assertEquals(100.0, result.value(), 1e-9);
  }

  private double recency(TechnicianProfile tech, ScoringContext ctx) {
    return scorer.score(job(ServiceCategory.PLUMBING), tech, ctx).breakdown().get(AssignmentScorer.LOCATION_RECENCY);
  }

  private static DispatchJob job(ServiceCategory category) {
    return new DispatchJob(1L, 10L, 20L, category, Priority.ROUTINE, WorkOrderStatus.QUALIFIED, LocalDate.of(2026, 3, 10),
        null, null, null, 60, new GeoPoint(40.7, -74.0), null, NOW);
  }

  private static TechnicianProfile tech(Set<ServiceCategory> skills, OffsetDateTime lastFixAt) {
    GeoPoint location = lastFixAt == null ? null : new GeoPoint(40.71, -74.01);
    return new TechnicianProfile(5L, "Dana", skills, true, false, new GeoPoint(40.6, -74.1), location, lastFixAt,
        LocalTime.of(8, 0), LocalTime.of(17, 0), 8, Set.of());
  }
}
