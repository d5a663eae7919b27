package com.fieldops.dispatch.common;

import org.springframework.http.HttpStatus;

import java.util.Map;

/** Bad input; always fixable by the caller. */
public class ValidationException extends DispatchException {
  public ValidationException(String message) {
    super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
  }

  public ValidationException(String message, String field) {
    super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, null, Map.of("field", field));
  }
}
