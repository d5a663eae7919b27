package com.fieldops.dispatch.availability;

import com.fieldops.dispatch.domain.DispatchJob;
import com.fieldops.dispatch.domain.TechnicianProfile;
import com.fieldops.dispatch.domain.WorkOrderStatus;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * Immutable view of technicians and their scheduled jobs. Every mutation returns a new snapshot.
 */
public final class AvailabilitySnapshot {
  static final Comparator<DispatchJob> SCHEDULE_ORDER = Comparator
      .comparing(DispatchJob::windowStart, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(DispatchJob::routeSequence, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(DispatchJob::id);

  private final Map<Long, TechnicianProfile> technicians;
  private final Map<Long, DispatchJob> jobs;
  private final Map<ScheduleKey, List<DispatchJob>> schedules;
  private final OffsetDateTime builtAt;

  private AvailabilitySnapshot(Map<Long, TechnicianProfile> technicians, Map<Long, DispatchJob> jobs, OffsetDateTime builtAt) {
    this.technicians = Collections.unmodifiableMap(technicians);
    this.jobs = Collections.unmodifiableMap(jobs);
    this.builtAt = builtAt;
    Map<ScheduleKey, List<DispatchJob>> bySchedule = new HashMap<>();
    for (DispatchJob job : jobs.values()) {
      bySchedule.computeIfAbsent(new ScheduleKey(job.technicianId(), job.serviceDate()), k -> new ArrayList<>()).add(job);
    }
    bySchedule.replaceAll((k, v) -> {
      v.sort(SCHEDULE_ORDER);
      return List.copyOf(v);
    });
    this.schedules = Collections.unmodifiableMap(bySchedule);
  }

  public static AvailabilitySnapshot empty() {
    return new AvailabilitySnapshot(new TreeMap<>(), new HashMap<>(), null);
  }

  public static AvailabilitySnapshot of(Collection<TechnicianProfile> technicians, Collection<DispatchJob> jobs, OffsetDateTime builtAt) {
    Map<Long, TechnicianProfile> t = new TreeMap<>();
    technicians.forEach(p -> t.put(p.id(), p));
    Map<Long, DispatchJob> j = new HashMap<>();
    jobs.stream().filter(AvailabilitySnapshot::onSchedule).forEach(job -> j.put(job.id(), job));
    return new AvailabilitySnapshot(t, j, builtAt);
  }

  static boolean onSchedule(DispatchJob job) {
    return job.technicianId() != null && WorkOrderStatus.ON_TECHNICIAN_SCHEDULE.contains(job.status());
  }

  public AvailabilitySnapshot withJob(DispatchJob job) {
    Map<Long, DispatchJob> j = new HashMap<>(jobs);
    j.remove(job.id());
    if (onSchedule(job)) {
      j.put(job.id(), job);
    }
    return new AvailabilitySnapshot(new TreeMap<>(technicians), j, builtAt);
  }

  public AvailabilitySnapshot withoutJob(Long jobId) {
    if (!jobs.containsKey(jobId)) {
      return this;
    }
    Map<Long, DispatchJob> j = new HashMap<>(jobs);
    j.remove(jobId);
    return new AvailabilitySnapshot(new TreeMap<>(technicians), j, builtAt);
  }

  public AvailabilitySnapshot withTechnician(TechnicianProfile profile) {
    Map<Long, TechnicianProfile> t = new TreeMap<>(technicians);
    t.put(profile.id(), profile);
    return new AvailabilitySnapshot(t, new HashMap<>(jobs), builtAt);
  }

  public Collection<TechnicianProfile> technicians() {
    return technicians.values();
  }

  public Optional<TechnicianProfile> technician(Long id) {
    return Optional.ofNullable(technicians.get(id));
  }

  public List<DispatchJob> scheduleOf(Long technicianId, LocalDate date) {
    return schedules.getOrDefault(new ScheduleKey(technicianId, date), List.of());
  }

  public Optional<DispatchJob> job(Long id) {
    return Optional.ofNullable(jobs.get(id));
  }

  public OffsetDateTime builtAt() {
    return builtAt;
  }

  private record ScheduleKey(Long technicianId, LocalDate date) {}
}
