package com.cumulo.service.core.model;

import com.cumulo.service.core.bitset.ActivityBitset;
import java.time.LocalDate;

/**
 * Activity of one entity in one dimension, relative to the as-of date of the owning {@link CumulativeRecord}.
 * Implementations are immutable; every transition returns a new instance.
 */
public interface ActivityHistory {

    HistoryFormat format();

    /** History for {@code asOfDate} when the entity was active on that day. */
    ActivityHistory extend(LocalDate asOfDate);

    /** History for {@code asOfDate} when the entity was not active on that day. */
    ActivityHistory carryForward(LocalDate asOfDate);

    /** Packs the history as seen from {@code asOfDate} into a bitset of the given width. */
    ActivityBitset toBitset(LocalDate asOfDate, int width);

    boolean isEmpty();

    /** A history whose only active day is {@code asOfDate}. */
    static ActivityHistory firstSeen(HistoryFormat format, LocalDate asOfDate, int width) {
        return switch (format) {
            case DATE_LIST -> DateListHistory.of(asOfDate);
            case BITSET -> new BitsetHistory(ActivityBitset.empty(width).shiftAndSet(true));
        };
    }
}
