package com.fieldops.dispatch.route;

import java.time.OffsetDateTime;

public record EtaUpdate(Long workOrderId, OffsetDateTime previousEta, OffsetDateTime eta, Integer previousSequence, Integer sequence) {}
