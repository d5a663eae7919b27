package com.fieldops.dispatch.common;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class NotFoundException extends DispatchException {
  public NotFoundException(String entity, Object id) {
    super(HttpStatus.NOT_FOUND, "NOT_FOUND", entity + " " + id + " not found", null, Map.of("entity", entity, "id", String.valueOf(id)));
  }
}
