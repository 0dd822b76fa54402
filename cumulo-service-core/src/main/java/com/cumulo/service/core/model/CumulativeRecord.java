package com.cumulo.service.core.model;

import com.cumulo.service.core.bitset.ActivityBitset;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Snapshot of an entity's activity as of one day, keyed by dimension label. Dimensions are kept sorted so two
 * records built from the same inputs are equal and serialize identically.
 */
public record CumulativeRecord(String entityKey, LocalDate asOfDate, SortedMap<String, ActivityHistory> activity) {

    public CumulativeRecord {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("Cumulative record requires an entity key");
        }
        Objects.requireNonNull(asOfDate, "asOfDate");
        activity = Collections.unmodifiableSortedMap(new TreeMap<>(activity == null ? Map.of() : activity));
    }

    public CumulativeRecord(String entityKey, LocalDate asOfDate, Map<String, ActivityHistory> activity) {
        this(entityKey, asOfDate, activity == null ? null : new TreeMap<>(activity));
    }

    public static CumulativeRecord single(String entityKey, LocalDate asOfDate, ActivityHistory history) {
        return new CumulativeRecord(entityKey, asOfDate, Map.of(DailyActivityFact.NO_DIMENSION, history));
    }

    public Optional<ActivityHistory> history(String dimension) {
        return Optional.ofNullable(activity.get(dimension == null ? DailyActivityFact.NO_DIMENSION : dimension));
    }

    /** Days on which the entity was active in any dimension. */
    public ActivityBitset combinedBitset(int width) {
        ActivityBitset combined = ActivityBitset.empty(width);
        for (ActivityHistory history : activity.values()) {
            combined = combined.or(history.toBitset(asOfDate, width));
        }
        return combined;
    }
}
