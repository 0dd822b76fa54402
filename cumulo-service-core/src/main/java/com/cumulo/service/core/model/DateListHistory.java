package com.cumulo.service.core.model;

import com.cumulo.service.core.bitset.ActivityBitset;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Unbounded chronological list of distinct active dates. */
public record DateListHistory(List<LocalDate> dates) implements ActivityHistory {

    public DateListHistory {
        dates = dates == null ? List.of() : List.copyOf(dates);
        for (int i = 1; i < dates.size(); i++) {
            if (!dates.get(i).isAfter(dates.get(i - 1))) {
                throw new IllegalArgumentException(
                        "Active dates must be strictly ascending: " + dates.get(i - 1) + " then " + dates.get(i));
            }
        }
    }

    public static DateListHistory of(LocalDate... dates) {
        return new DateListHistory(List.of(dates));
    }

    @Override
    public HistoryFormat format() {
        return HistoryFormat.DATE_LIST;
    }

    @Override
    public DateListHistory extend(LocalDate asOfDate) {
        LocalDate last = lastActive();
        if (last != null && !asOfDate.isAfter(last)) {
            throw new IllegalArgumentException(
                    "Cannot append " + asOfDate + " to a history already active through " + last);
        }
        List<LocalDate> next = new ArrayList<>(dates.size() + 1);
        next.addAll(dates);
        next.add(asOfDate);
        return new DateListHistory(next);
    }

    @Override
    public DateListHistory carryForward(LocalDate asOfDate) {
        return this;
    }

    @Override
    public ActivityBitset toBitset(LocalDate asOfDate, int width) {
        return ActivityBitset.fromDates(dates, asOfDate, width);
    }

    @Override
    public boolean isEmpty() {
        return dates.isEmpty();
    }

    public LocalDate lastActive() {
        return dates.isEmpty() ? null : dates.get(dates.size() - 1);
    }
}
