package com.fieldops.dispatch.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<?> validation(MethodArgumentNotValidException ex){
    var fieldError = ex.getBindingResult().getFieldError();
    String message = fieldError == null
        ? "Validation error"
        : fieldError.getField() + ": " + Objects.toString(fieldError.getDefaultMessage(), "invalid");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "VALIDATION_ERROR");
    body.put("message", message);
    if (fieldError != null) {
      body.put("details", Map.of("field", fieldError.getField()));
    }
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
  ResponseEntity<?> badRequest(Exception ex){
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "VALIDATION_ERROR");
    body.put("message", Objects.toString(ex.getMessage(), "Bad request"));
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(DispatchException.class)
  ResponseEntity<?> dispatch(DispatchException ex) {
    if (ex.status().is5xxServerError()) {
      log.warn("Dispatch error code={} message={}", ex.code(), ex.getMessage());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", ex.code());
    body.put("message", Objects.toString(ex.getMessage(), "Dispatch error"));
    ex.hint().ifPresent(hint -> body.put("hint", hint));
    ex.details().ifPresent(details -> body.put("details", details));
    return ResponseEntity.status(ex.status()).body(body);
  }

  @ExceptionHandler(AccessDeniedException.class)
  ResponseEntity<?> denied(AccessDeniedException ex){
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "FORBIDDEN");
    body.put("message", Objects.toString(ex.getMessage(), "Access denied"));
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
  }

  @ExceptionHandler(IllegalStateException.class)
  ResponseEntity<?> illegalState(IllegalStateException ex){
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "BUSINESS_ERROR");
    body.put("message", Objects.toString(ex.getMessage(), "Business rule violation"));
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<?> generic(Exception ex){
    log.error("Unhandled error", ex);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "INTERNAL_ERROR");
    body.put("message", Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()));
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }
}
