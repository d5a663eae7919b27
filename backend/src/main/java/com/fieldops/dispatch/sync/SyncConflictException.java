package com.fieldops.dispatch.sync;

import com.fieldops.dispatch.common.DispatchException;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/** The change cannot be merged automatically and goes to dispatcher review. */
public class SyncConflictException extends DispatchException {
  private final List<String> fields;

  public SyncConflictException(String message, List<String> fields) {
    super(HttpStatus.CONFLICT, "SYNC_CONFLICT", message, "A dispatcher must apply or discard the change.",
        Map.of("fields", List.copyOf(fields)));
    this.fields = List.copyOf(fields);
  }

  public List<String> fields() {
    return fields;
  }
}
