package com.fieldops.dispatch.sync;

import com.fieldops.dispatch.domain.Entities.SyncEntityType;
import com.fieldops.dispatch.domain.Entities.SyncPriority;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Field ownership for offline changes. Device-owned fields take the technician's value; everything else keeps the
 * server's value and is reported back as rejected.
 */
public final class ConflictPolicy {
  public static final String STATUS = "status";
  public static final String STATUS_REASON = "statusReason";
  public static final String NOTES = "notes";
  public static final String PHOTOS = "photoRefs";
  public static final String SIGNATURE = "signatureRef";
  public static final String ACTUAL_START = "actualStart";
  public static final String ACTUAL_END = "actualEnd";
  public static final String LATITUDE = "latitude";
  public static final String LONGITUDE = "longitude";
  public static final String FIX_AT = "fixAt";

  private static final Map<SyncEntityType, Set<String>> DEVICE_OWNED = Map.of(
      SyncEntityType.WORK_ORDER, Set.of(STATUS, STATUS_REASON, NOTES, PHOTOS, SIGNATURE, ACTUAL_START, ACTUAL_END),
      SyncEntityType.TECHNICIAN_LOCATION, Set.of(LATITUDE, LONGITUDE, FIX_AT),
      SyncEntityType.CUSTOMER, Set.of(),
      SyncEntityType.PROPERTY, Set.of(),
      SyncEntityType.PRICING, Set.of());

  private ConflictPolicy() {
  }

  public static boolean deviceWins(SyncEntityType type, String field) {
    return DEVICE_OWNED.getOrDefault(type, Set.of()).contains(field);
  }

  /** Signatures and photos first, then status, then notes, telemetry last. */
  public static SyncPriority defaultPriority(SyncEntityType type, Collection<String> fields) {
    if (type == SyncEntityType.TECHNICIAN_LOCATION) {
      return SyncPriority.LOW;
    }
    if (type == SyncEntityType.WORK_ORDER) {
      if (fields.contains(SIGNATURE) || fields.contains(PHOTOS)) {
        return SyncPriority.CRITICAL;
      }
      if (fields.contains(STATUS)) {
        return SyncPriority.HIGH;
      }
    }
    return SyncPriority.NORMAL;
  }
}
