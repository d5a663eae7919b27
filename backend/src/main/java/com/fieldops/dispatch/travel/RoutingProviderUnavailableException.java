package com.fieldops.dispatch.travel;

import com.fieldops.dispatch.common.DispatchException;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class RoutingProviderUnavailableException extends DispatchException {
  public RoutingProviderUnavailableException(String message, String cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, "ROUTING_PROVIDER_UNAVAILABLE", message,
        "Verify app.routing.base-url and the routing provider status.", Map.of("cause", cause));
  }
}
