package com.fieldops.dispatch.technician;

import com.fieldops.dispatch.availability.TechnicianAvailabilityIndex;
import com.fieldops.dispatch.common.NotFoundException;
import com.fieldops.dispatch.common.ValidationException;
import com.fieldops.dispatch.domain.Entities.TechnicianEntity;
import com.fieldops.dispatch.domain.GeoPoint;
import com.fieldops.dispatch.domain.ServiceCategory;
import com.fieldops.dispatch.domain.TechnicianProfile;
import com.fieldops.dispatch.domain.TechnicianRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class TechnicianService {
  private static final Logger log = LoggerFactory.getLogger(TechnicianService.class);

  private final TechnicianRepository technicians;
  private final TechnicianAvailabilityIndex index;
  private final Clock clock;
  private final Duration locationStaleAfter;

  public TechnicianService(TechnicianRepository technicians, TechnicianAvailabilityIndex index, Clock clock,
                           @Value("${app.scoring.location-stale-after:PT4H}") Duration locationStaleAfter) {
    this.technicians = technicians;
    this.index = index;
    this.clock = clock;
    this.locationStaleAfter = locationStaleAfter;
  }

  public record NewTechnician(String name, Set<ServiceCategory> skills, Set<String> certifications, Set<String> serviceAreas,
                              Double homeLatitude, Double homeLongitude, LocalTime workdayStart, LocalTime workdayEnd,
                              Integer maxJobsPerDay, boolean onCall) {}

  /** Result of a location fix; {@code accepted} is false when the fix is older than the stored one. */
  public record LocationUpdate(Long technicianId, boolean accepted, OffsetDateTime lastFixAt) {}

  @Transactional
  public TechnicianEntity create(NewTechnician cmd) {
    if (cmd.skills() == null || cmd.skills().isEmpty()) {
      throw new ValidationException("A technician needs at least one skill", "skills");
    }
    GeoPoint home = GeoPoint.ofNullable(cmd.homeLatitude(), cmd.homeLongitude());
    if (home != null && !home.isValid()) {
      throw new ValidationException("Home coordinates are out of range", "homeLatitude");
    }
    TechnicianEntity t = new TechnicianEntity();
    t.name = cmd.name();
    t.skills = new LinkedHashSet<>(cmd.skills());
    t.certifications = cmd.certifications() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(cmd.certifications());
    t.serviceAreas = cmd.serviceAreas() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(cmd.serviceAreas());
    t.homeLatitude = cmd.homeLatitude();
    t.homeLongitude = cmd.homeLongitude();
    if (cmd.workdayStart() != null) t.workdayStart = cmd.workdayStart();
    if (cmd.workdayEnd() != null) t.workdayEnd = cmd.workdayEnd();
    if (!t.workdayStart.isBefore(t.workdayEnd)) {
      throw new ValidationException("workdayStart must be before workdayEnd", "workdayStart");
    }
    if (cmd.maxJobsPerDay() != null) t.maxJobsPerDay = cmd.maxJobsPerDay();
    t.onCall = cmd.onCall();
    t.createdAt = OffsetDateTime.now(clock);
    TechnicianEntity saved = technicians.save(t);
    index.upsertTechnician(profile(saved));
    log.info("Technician created id={} skills={}", saved.id, saved.skills);
    return saved;
  }

  public List<TechnicianEntity> list() {
    return technicians.findAll();
  }

  public TechnicianEntity get(Long id) {
    return technicians.findById(id).orElseThrow(() -> new NotFoundException("Technician", id));
  }

  @Transactional
  public TechnicianEntity setActive(Long id, boolean active, boolean onCall) {
    TechnicianEntity t = get(id);
    t.active = active;
    t.onCall = onCall;
    TechnicianEntity saved = technicians.save(t);
    index.upsertTechnician(profile(saved));
    return saved;
  }

  /** Stores a GPS fix. Fixes older than the stored one are ignored so late telemetry cannot move a technician back. */
  @Transactional
  public LocationUpdate recordLocation(Long id, double latitude, double longitude, OffsetDateTime fixAt) {
    GeoPoint point = new GeoPoint(latitude, longitude);
    if (!point.isValid()) {
      throw new ValidationException("Coordinates are out of range", "latitude");
    }
    TechnicianEntity t = get(id);
    OffsetDateTime at = fixAt == null ? OffsetDateTime.now(clock) : fixAt;
    if (t.lastFixAt != null && at.isBefore(t.lastFixAt)) {
      log.debug("Ignoring stale fix technician={} fixAt={} stored={}", id, at, t.lastFixAt);
      return new LocationUpdate(id, false, t.lastFixAt);
    }
    t.lastLatitude = latitude;
    t.lastLongitude = longitude;
    t.lastFixAt = at;
    TechnicianEntity saved = technicians.save(t);
    index.upsertTechnician(profile(saved));
    return new LocationUpdate(id, true, at);
  }

  private TechnicianProfile profile(TechnicianEntity t) {
    return TechnicianProfile.from(t, OffsetDateTime.now(clock), locationStaleAfter);
  }
}
