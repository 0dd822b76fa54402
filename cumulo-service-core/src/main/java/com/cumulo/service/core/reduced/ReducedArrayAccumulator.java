package com.cumulo.service.core.reduced;

import com.cumulo.service.core.error.ReplayConflictException;
import com.cumulo.service.core.model.MonthlyMetricArray;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends one day per run to per-entity monthly metric arrays. Every array of a month has the same length after
 * a run, so position {@code n} means day {@code n + 1} for all entities.
 */
@Slf4j
public class ReducedArrayAccumulator {

    /**
     * @param array the entity's current array, or {@code null} if it has none
     * @throws ReplayConflictException if {@code dayOfMonth} is already recorded
     */
    public MonthlyMetricArray appendDay(
            MonthlyMetricArray array,
            String entityKey,
            String metricName,
            int dayOfMonth,
            long value,
            YearMonth month) {
        Objects.requireNonNull(month, "month");
        checkDay(dayOfMonth, month);
        if (array == null || array.month().isBefore(month)) {
            List<Long> values = new ArrayList<>(Collections.nCopies(dayOfMonth - 1, 0L));
            values.add(value);
            return new MonthlyMetricArray(entityKey, month, metricName, values, dayOfMonth);
        }
        if (array.month().isAfter(month)) {
            throw new IllegalArgumentException("Array " + array.metricName() + " for " + array.entityKey()
                    + " is already in " + array.month() + "; cannot append to " + month);
        }
        if (!array.entityKey().equals(entityKey) || !array.metricName().equals(metricName)) {
            throw new IllegalArgumentException("Array belongs to " + array.entityKey() + "/" + array.metricName()
                    + ", not " + entityKey + "/" + metricName);
        }
        int length = array.length();
        if (length >= dayOfMonth) {
            throw new ReplayConflictException(entityKey, metricName, month, dayOfMonth, length);
        }
        List<Long> values = new ArrayList<>(dayOfMonth);
        values.addAll(array.values());
        if (length < dayOfMonth - 1) {
            log.warn(
                    "Zero-filling missed days metric={} entity={} month={} days={}..{}",
                    metricName,
                    entityKey,
                    month,
                    length + 1,
                    dayOfMonth - 1);
            values.addAll(Collections.nCopies(dayOfMonth - 1 - length, 0L));
        }
        values.add(value);
        return new MonthlyMetricArray(entityKey, month, metricName, values, array.firstObservedDay());
    }

    public MonthlyMetricArray appendDay(MonthlyMetricArray array, int dayOfMonth, long value, YearMonth month) {
        Objects.requireNonNull(array, "array");
        return appendDay(array, array.entityKey(), array.metricName(), dayOfMonth, value, month);
    }

    /** Records an explicit zero for an entity that already has an array this month but no activity today. */
    public MonthlyMetricArray appendInactive(MonthlyMetricArray array, int dayOfMonth, YearMonth month) {
        return appendDay(array, dayOfMonth, 0L, month);
    }

    private static void checkDay(int dayOfMonth, YearMonth month) {
        if (dayOfMonth < 1 || dayOfMonth > month.lengthOfMonth()) {
            throw new IllegalArgumentException("Day " + dayOfMonth + " does not exist in " + month);
        }
    }
}
