package com.fieldops.dispatch.domain;

import com.fieldops.dispatch.domain.Entities.TechnicianEntity;

import java.time.Duration;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable technician snapshot. {@code location} is null when the last GPS fix is older than the staleness threshold.
 */
public record TechnicianProfile(
    Long id,
    String name,
    Set<ServiceCategory> skills,
    boolean active,
    boolean onCall,
    GeoPoint home,
    GeoPoint location,
    OffsetDateTime lastFixAt,
    LocalTime workdayStart,
    LocalTime workdayEnd,
    int maxJobsPerDay,
    Set<String> serviceAreas
) {
  public TechnicianProfile {
    skills = skills == null || skills.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(skills));
    serviceAreas = serviceAreas == null ? Set.of() : Set.copyOf(serviceAreas);
  }

  public static TechnicianProfile from(TechnicianEntity t, OffsetDateTime now, Duration staleAfter) {
    GeoPoint last = GeoPoint.ofNullable(t.lastLatitude, t.lastLongitude);
    if (last != null && (t.lastFixAt == null || t.lastFixAt.isBefore(now.minus(staleAfter)))) {
      last = null;
    }
    return new TechnicianProfile(
        t.id, t.name, t.skills, t.active, t.onCall,
        GeoPoint.ofNullable(t.homeLatitude, t.homeLongitude), last, t.lastFixAt,
        t.workdayStart == null ? LocalTime.of(8, 0) : t.workdayStart,
        t.workdayEnd == null ? LocalTime.of(17, 0) : t.workdayEnd,
        t.maxJobsPerDay, t.serviceAreas);
  }

  /** Exact category match, or the cross-trained GENERAL skill. */
  public boolean holdsSkillFor(ServiceCategory category) {
    return skills.contains(category) || skills.contains(ServiceCategory.GENERAL);
  }

  public GeoPoint currentOrHome() {
    return location != null ? location : home;
  }

  public TechnicianProfile withLocation(GeoPoint point, OffsetDateTime fixAt) {
    return new TechnicianProfile(id, name, skills, active, onCall, home, point, fixAt,
        workdayStart, workdayEnd, maxJobsPerDay, serviceAreas);
  }
}
