package com.fieldops.dispatch.scoring;

import com.fieldops.dispatch.travel.TravelEstimate;

import java.time.OffsetDateTime;

/**
 * Everything the scorer needs besides the job and the technician. {@code now} is passed in so scoring never reads a clock.
 */
public record ScoringContext(
    TravelEstimate travel,
    int jobsThatDay,
    boolean servedBefore,
    OffsetDateTime now,
    ScoringPolicy policy
) {}
