package com.cumulo.service.core.model;

import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One metric of one entity for one month as a positional array: index 0 holds day 1. Days before
 * {@code firstObservedDay} are zero-filled placeholders, not observed zero activity.
 */
public record MonthlyMetricArray(
        String entityKey, YearMonth month, String metricName, List<Long> values, int firstObservedDay) {

    public MonthlyMetricArray {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("Monthly metric array requires an entity key");
        }
        Objects.requireNonNull(month, "month");
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("Monthly metric array requires a metric name");
        }
        values = List.copyOf(values);
        if (values.isEmpty() || values.size() > month.lengthOfMonth()) {
            throw new IllegalArgumentException(
                    "Array for " + month + " must hold 1.." + month.lengthOfMonth() + " days: " + values.size());
        }
        if (firstObservedDay < 1 || firstObservedDay > values.size()) {
            throw new IllegalArgumentException("First observed day " + firstObservedDay + " is outside the array");
        }
    }

    /** Number of days of the month already recorded. */
    public int length() {
        return values.size();
    }

    public long valueOn(int dayOfMonth) {
        if (dayOfMonth < 1 || dayOfMonth > values.size()) {
            throw new IllegalArgumentException("Day " + dayOfMonth + " not recorded for " + month);
        }
        return values.get(dayOfMonth - 1);
    }

    public boolean observedOn(int dayOfMonth) {
        return dayOfMonth >= firstObservedDay && dayOfMonth <= values.size();
    }

    public long total() {
        long sum = 0L;
        for (Long value : values) {
            sum += value;
        }
        return sum;
    }

    /**
     * Drops {@code dayOfMonth} and every later day so that day can be appended again. Empty when nothing the
     * entity was observed on remains.
     */
    public Optional<MonthlyMetricArray> truncateTo(int dayOfMonth) {
        if (dayOfMonth < 1) {
            throw new IllegalArgumentException("Day of month must be positive: " + dayOfMonth);
        }
        int keep = Math.min(dayOfMonth - 1, values.size());
        if (keep < firstObservedDay) {
            return Optional.empty();
        }
        return Optional.of(
                new MonthlyMetricArray(entityKey, month, metricName, values.subList(0, keep), firstObservedDay));
    }
}
