package com.cumulo.service.core.window;

import com.cumulo.service.core.bitset.ActivityBitset;
import com.cumulo.service.core.error.WindowTooWideException;
import com.cumulo.service.core.model.ActivityHistory;
import com.cumulo.service.core.model.CumulativeRecord;
import java.util.Optional;

/** Rollups computed on read from an activity bitset. Nothing here is stored. */
public class WindowMetrics {

    public static final int WEEK_DAYS = 7;

    private final int bitsetWidth;
    private final int monthlyDays;

    public WindowMetrics(int bitsetWidth, int monthlyDays) {
        if (monthlyDays < 1 || monthlyDays > bitsetWidth) {
            throw new WindowTooWideException(monthlyDays, bitsetWidth);
        }
        if (bitsetWidth < 2 * WEEK_DAYS) {
            throw new IllegalArgumentException("Bitset width " + bitsetWidth + " cannot hold two weeks");
        }
        this.bitsetWidth = bitsetWidth;
        this.monthlyDays = monthlyDays;
    }

    public int bitsetWidth() {
        return bitsetWidth;
    }

    public int monthlyDays() {
        return monthlyDays;
    }

    public boolean isMonthlyActive(ActivityBitset bits) {
        return bits.isActiveWithin(monthlyDays);
    }

    public boolean isWeeklyActive(ActivityBitset bits) {
        return bits.isActiveWithin(WEEK_DAYS);
    }

    /** Active during days 7..13 before the as-of date. */
    public boolean isWeeklyActivePreviousWeek(ActivityBitset bits) {
        return bits.shiftOlder(WEEK_DAYS).isActiveWithin(WEEK_DAYS);
    }

    public int daysActiveInWindow(ActivityBitset bits, int window) {
        return bits.countActiveWithin(window);
    }

    /** Rollup across every dimension of the record. */
    public WindowSummary summarize(CumulativeRecord record) {
        return summarize(record, null, record.combinedBitset(bitsetWidth));
    }

    /** Rollup for one dimension, empty if the record never saw it. */
    public Optional<WindowSummary> summarize(CumulativeRecord record, String dimension) {
        if (dimension == null) {
            return Optional.of(summarize(record));
        }
        return record.history(dimension)
                .map(history -> summarize(record, dimension, toBitset(record, history)));
    }

    private ActivityBitset toBitset(CumulativeRecord record, ActivityHistory history) {
        return history.toBitset(record.asOfDate(), bitsetWidth);
    }

    private WindowSummary summarize(CumulativeRecord record, String dimension, ActivityBitset bits) {
        return new WindowSummary(
                record.entityKey(),
                record.asOfDate(),
                dimension,
                isMonthlyActive(bits),
                isWeeklyActive(bits),
                isWeeklyActivePreviousWeek(bits),
                daysActiveInWindow(bits, WEEK_DAYS),
                daysActiveInWindow(bits, monthlyDays),
                bits.value(),
                bits.toBinaryString());
    }
}
