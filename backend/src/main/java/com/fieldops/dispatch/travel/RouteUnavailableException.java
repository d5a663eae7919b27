package com.fieldops.dispatch.travel;

import com.fieldops.dispatch.common.DispatchException;
import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class RouteUnavailableException extends DispatchException {
  public RouteUnavailableException(String message, Object origin, Object destination) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, "ROUTE_UNAVAILABLE", message,
        "Check the property coordinates and the technician location.", points(origin, destination));
  }

  private static Map<String, Object> points(Object origin, Object destination) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("origin", Objects.toString(origin, "unknown"));
    details.put("destination", Objects.toString(destination, "unknown"));
    return details;
  }
}
