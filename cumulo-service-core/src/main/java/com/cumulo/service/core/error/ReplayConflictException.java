package com.cumulo.service.core.error;

import java.time.YearMonth;

/**
 * A monthly array already holds the day being appended. Recover by truncating the array back to that day
 * before retrying.
 */
public class ReplayConflictException extends IllegalStateException {
    private final String entityKey;
    private final String metricName;
    private final YearMonth month;
    private final int dayOfMonth;
    private final int currentLength;

    public ReplayConflictException(
            String entityKey, String metricName, YearMonth month, int dayOfMonth, int currentLength) {
        super("Array " + metricName + " for entity " + entityKey + " in " + month + " already holds " + currentLength
                + " days; refusing to append day " + dayOfMonth);
        this.entityKey = entityKey;
        this.metricName = metricName;
        this.month = month;
        this.dayOfMonth = dayOfMonth;
        this.currentLength = currentLength;
    }

    public String entityKey() {
        return entityKey;
    }

    public String metricName() {
        return metricName;
    }

    public YearMonth month() {
        return month;
    }

    public int dayOfMonth() {
        return dayOfMonth;
    }

    public int currentLength() {
        return currentLength;
    }
}
