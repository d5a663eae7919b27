package com.fieldops.dispatch.scheduler;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flags of in-flight assignment searches, keyed by work order.
 */
@Component
public class AssignmentSearchRegistry {
  private final Map<Long, Set<AtomicBoolean>> searches = new ConcurrentHashMap<>();

  public AtomicBoolean begin(Long workOrderId) {
    AtomicBoolean flag = new AtomicBoolean(false);
    searches.computeIfAbsent(workOrderId, k -> ConcurrentHashMap.newKeySet()).add(flag);
    return flag;
  }

  public void end(Long workOrderId, AtomicBoolean flag) {
    searches.computeIfPresent(workOrderId, (k, flags) -> {
      flags.remove(flag);
      return flags.isEmpty() ? null : flags;
    });
  }

  /** Flags every search running for the order; returns true when at least one was in flight. */
  public boolean cancel(Long workOrderId) {
    Set<AtomicBoolean> flags = searches.get(workOrderId);
    if (flags == null || flags.isEmpty()) {
      return false;
    }
    flags.forEach(f -> f.set(true));
    return true;
  }

  public boolean inFlight(Long workOrderId) {
    Set<AtomicBoolean> flags = searches.get(workOrderId);
    return flags != null && !flags.isEmpty();
  }
}
