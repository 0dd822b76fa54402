package com.cumulo.service.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Pre-aggregated activity of one entity in one dimension on one day. Produced by the upstream aggregation
 * pipeline; a fact exists only for days with at least one event.
 */
public record DailyActivityFact(String entityKey, LocalDate activityDate, long eventCount, String dimension) {

    /** Dimension label used when activity is tracked without a breakdown. */
    public static final String NO_DIMENSION = "";

    public DailyActivityFact {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("Activity fact requires an entity key");
        }
        Objects.requireNonNull(activityDate, "activityDate");
        if (eventCount < 1) {
            throw new IllegalArgumentException(
                    "Activity fact for " + entityKey + " on " + activityDate + " has no events: " + eventCount);
        }
        dimension = dimension == null ? NO_DIMENSION : dimension;
    }

    public DailyActivityFact(String entityKey, LocalDate activityDate, long eventCount) {
        this(entityKey, activityDate, eventCount, NO_DIMENSION);
    }
}
