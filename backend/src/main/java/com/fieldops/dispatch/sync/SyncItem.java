package com.fieldops.dispatch.sync;

import com.fieldops.dispatch.domain.Entities.SyncEntityType;
import com.fieldops.dispatch.domain.Entities.SyncPriority;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One offline change as uploaded by a device.
 *
 * @param baseVersion entity version the device last saw; enables detection of concurrent edits from other devices
 * @param priority    optional; derived from the changed fields when absent
 */
public record SyncItem(
    String idempotencyKey,
    SyncEntityType entityType,
    Long entityId,
    String operation,
    Long baseVersion,
    SyncPriority priority,
    OffsetDateTime capturedAt,
    Map<String, Object> changes
) {}
