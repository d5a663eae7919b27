package com.fieldops.dispatch.availability;

import com.fieldops.dispatch.domain.*;
import com.fieldops.dispatch.domain.Entities.TechnicianEntity;
import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Read-mostly index of technicians and their schedules.
 *
 * <p>Readers always see a complete snapshot. A rebuild loads a new snapshot from the data store without blocking
 * readers or writers and swaps it in; incremental updates made while the rebuild was loading are replayed on top of
 * it before the swap. Between rebuilds the view may lag the data store by up to the rebuild interval.
 */
@Component
public class TechnicianAvailabilityIndex {
  private static final Logger log = LoggerFactory.getLogger(TechnicianAvailabilityIndex.class);

  private final TechnicianRepository technicians;
  private final WorkOrderRepository workOrders;
  private final Clock clock;
  private final Duration locationStaleAfter;
  private final int horizonDays;
  private final AtomicReference<AvailabilitySnapshot> current = new AtomicReference<>(AvailabilitySnapshot.empty());
  private final Object journalLock = new Object();
  private final Object rebuildLock = new Object();
  private List<UnaryOperator<AvailabilitySnapshot>> journal;

  public TechnicianAvailabilityIndex(
      TechnicianRepository technicians,
      WorkOrderRepository workOrders,
      Clock clock,
      @Value("${app.scoring.location-stale-after:PT4H}") Duration locationStaleAfter,
      @Value("${app.availability.horizon-days:7}") int horizonDays
  ) {
    this.technicians = technicians;
    this.workOrders = workOrders;
    this.clock = clock;
    this.locationStaleAfter = locationStaleAfter;
    this.horizonDays = horizonDays;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    rebuild();
  }

  @Scheduled(fixedDelayString = "${app.availability.rebuild-interval-ms:180000}", initialDelayString = "${app.availability.rebuild-interval-ms:180000}")
  public void scheduledRebuild() {
    try {
      rebuild();
    } catch (RuntimeException ex) {
      log.error("Availability index rebuild failed, keeping snapshot built at {}", current.get().builtAt(), ex);
    }
  }

  public void rebuild() {
    synchronized (rebuildLock) {
      synchronized (journalLock) {
        journal = new ArrayList<>();
      }
      AvailabilitySnapshot fresh;
      try {
        fresh = load();
      } catch (RuntimeException ex) {
        synchronized (journalLock) {
          journal = null;
        }
        throw ex;
      }
      synchronized (journalLock) {
        for (UnaryOperator<AvailabilitySnapshot> op : journal) {
          fresh = op.apply(fresh);
        }
        journal = null;
        current.set(fresh);
      }
      log.info("Availability index rebuilt technicians={} builtAt={}", fresh.technicians().size(), fresh.builtAt());
    }
  }

  private AvailabilitySnapshot load() {
    OffsetDateTime now = OffsetDateTime.now(clock);
    LocalDate today = LocalDate.now(clock);
    List<TechnicianProfile> profiles = new ArrayList<>();
    for (TechnicianEntity t : technicians.findAll()) {
      profiles.add(TechnicianProfile.from(t, now, locationStaleAfter));
    }
    List<DispatchJob> jobs = new ArrayList<>();
    for (WorkOrderEntity w : workOrders.findByServiceDateBetweenAndStatusIn(today.minusDays(1), today.plusDays(horizonDays), WorkOrderStatus.ON_TECHNICIAN_SCHEDULE)) {
      jobs.add(DispatchJob.from(w));
    }
    return AvailabilitySnapshot.of(profiles, jobs, now);
  }

  /** Active technicians holding the category (or GENERAL), by ascending id. */
  public List<Long> candidatesFor(ServiceCategory category, LocalDate date) {
    return current.get().technicians().stream()
        .filter(TechnicianProfile::active)
        .filter(t -> t.holdsSkillFor(category))
        .map(TechnicianProfile::id)
        .toList();
  }

  public List<DispatchJob> scheduleOf(Long technicianId, LocalDate date) {
    return current.get().scheduleOf(technicianId, date);
  }

  public Optional<TechnicianProfile> profile(Long technicianId) {
    return current.get().technician(technicianId);
  }

  public List<TechnicianProfile> onCall() {
    return current.get().technicians().stream()
        .filter(TechnicianProfile::active)
        .filter(TechnicianProfile::onCall)
        .toList();
  }

  public AvailabilitySnapshot snapshot() {
    return current.get();
  }

  public void upsertJob(DispatchJob job) {
    apply(s -> s.withJob(job));
  }

  public void removeJob(Long jobId) {
    apply(s -> s.withoutJob(jobId));
  }

  public void upsertTechnician(TechnicianProfile profile) {
    apply(s -> s.withTechnician(profile));
  }

  private void apply(UnaryOperator<AvailabilitySnapshot> op) {
    synchronized (journalLock) {
      if (journal != null) {
        journal.add(op);
      }
    }
    current.updateAndGet(op);
  }
}
