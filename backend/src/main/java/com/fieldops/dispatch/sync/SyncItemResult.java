package com.fieldops.dispatch.sync;

import com.fieldops.dispatch.domain.Entities.SyncItemStatus;

import java.util.List;

/**
 * @param duplicate true when the idempotency key had already been processed; nothing was applied again
 */
public record SyncItemResult(
    String idempotencyKey,
    Long itemId,
    SyncItemStatus status,
    List<String> appliedFields,
    List<String> rejectedFields,
    Long entityVersion,
    String message,
    boolean duplicate
) {
  public SyncItemResult asDuplicate() {
    return new SyncItemResult(idempotencyKey, itemId, status, appliedFields, rejectedFields, entityVersion, message, true);
  }
}
