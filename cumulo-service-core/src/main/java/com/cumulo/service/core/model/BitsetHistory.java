package com.cumulo.service.core.model;

import com.cumulo.service.core.bitset.ActivityBitset;
import java.time.LocalDate;
import java.util.Objects;

/** Bounded history: only the last {@code bits.width()} days survive. */
public record BitsetHistory(ActivityBitset bits) implements ActivityHistory {

    public BitsetHistory {
        Objects.requireNonNull(bits, "bits");
    }

    @Override
    public HistoryFormat format() {
        return HistoryFormat.BITSET;
    }

    @Override
    public BitsetHistory extend(LocalDate asOfDate) {
        return new BitsetHistory(bits.shiftAndSet(true));
    }

    // bit 0 always means the owning record's as-of day, so an idle day still ages the history
    @Override
    public BitsetHistory carryForward(LocalDate asOfDate) {
        return new BitsetHistory(bits.shiftAndSet(false));
    }

    @Override
    public ActivityBitset toBitset(LocalDate asOfDate, int width) {
        if (width == bits.width()) {
            return bits;
        }
        return ActivityBitset.fromDates(bits.toDates(asOfDate), asOfDate, width);
    }

    @Override
    public boolean isEmpty() {
        return bits.isEmpty();
    }
}
