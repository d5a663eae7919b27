package com.fieldops.dispatch.route;

import com.fieldops.dispatch.domain.Priority;

import java.time.Duration;
import java.time.OffsetDateTime;

public record RouteStop(
    int sequence,
    Long workOrderId,
    Priority priority,
    OffsetDateTime windowStart,
    OffsetDateTime windowEnd,
    OffsetDateTime arrival,
    OffsetDateTime serviceStart,
    OffsetDateTime departure,
    Duration travel,
    boolean approximateTravel,
    boolean withinWindow
) {}
