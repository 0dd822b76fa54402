package com.cumulo.service.core.bitset;

import com.cumulo.service.core.error.WindowTooWideException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fixed-width activity history packed into a {@code long}. Bit 0 is the as-of day (least significant),
 * bit {@code width - 1} is the oldest tracked day. Instances are immutable.
 */
public final class ActivityBitset {

    public static final int MAX_WIDTH = Long.SIZE;
    public static final int DEFAULT_WIDTH = 32;

    private final long bits;
    private final int width;

    private ActivityBitset(long bits, int width) {
        this.bits = bits & mask(width);
        this.width = width;
    }

    public static ActivityBitset empty(int width) {
        return new ActivityBitset(0L, checkWidth(width));
    }

    public static ActivityBitset of(long bits, int width) {
        return new ActivityBitset(bits, checkWidth(width));
    }

    /** Packs the dates falling in {@code (asOfDate - width, asOfDate]}; anything older or later is ignored. */
    public static ActivityBitset fromDates(Collection<LocalDate> dates, LocalDate asOfDate, int width) {
        checkWidth(width);
        long packed = 0L;
        if (dates != null) {
            for (LocalDate date : dates) {
                long daysAgo = ChronoUnit.DAYS.between(date, asOfDate);
                if (daysAgo >= 0 && daysAgo < width) {
                    packed |= 1L << daysAgo;
                }
            }
        }
        return new ActivityBitset(packed, width);
    }

    public long value() {
        return bits;
    }

    public int width() {
        return width;
    }

    public boolean isEmpty() {
        return bits == 0L;
    }

    /** Ages every tracked day by one; the oldest day falls off and bit 0 records today. */
    public ActivityBitset shiftAndSet(boolean activeToday) {
        long shifted = bits << 1;
        if (activeToday) {
            shifted |= 1L;
        }
        return new ActivityBitset(shifted, width);
    }

    /** Drops the {@code days} most recent days, so bit {@code days} becomes bit 0. */
    public ActivityBitset shiftOlder(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Shift must not be negative: " + days);
        }
        if (days >= MAX_WIDTH) {
            return new ActivityBitset(0L, width);
        }
        return new ActivityBitset(bits >>> days, width);
    }

    public ActivityBitset or(ActivityBitset other) {
        if (other.width != width) {
            throw new IllegalArgumentException("Bitset widths differ: " + width + " vs " + other.width);
        }
        return new ActivityBitset(bits | other.bits, width);
    }

    public boolean isActiveOn(int daysAgo) {
        if (daysAgo < 0 || daysAgo >= width) {
            throw new WindowTooWideException(daysAgo + 1, width);
        }
        return (bits & (1L << daysAgo)) != 0L;
    }

    public boolean isActiveWithin(int window) {
        return (bits & windowMask(window)) != 0L;
    }

    public int countActiveWithin(int window) {
        return Long.bitCount(bits & windowMask(window));
    }

    /** Chronological dates represented by the set bits, oldest first. */
    public List<LocalDate> toDates(LocalDate asOfDate) {
        List<LocalDate> dates = new ArrayList<>(Long.bitCount(bits));
        for (int i = width - 1; i >= 0; i--) {
            if ((bits & (1L << i)) != 0L) {
                dates.add(asOfDate.minusDays(i));
            }
        }
        return dates;
    }

    /** Renders oldest day first, so the rightmost character is the as-of day. */
    public String toBinaryString() {
        StringBuilder sb = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            sb.append((bits & (1L << i)) != 0L ? '1' : '0');
        }
        return sb.toString();
    }

    private long windowMask(int window) {
        if (window < 1 || window > width) {
            throw new WindowTooWideException(window, width);
        }
        return mask(window);
    }

    private static long mask(int width) {
        return width >= MAX_WIDTH ? -1L : (1L << width) - 1L;
    }

    private static int checkWidth(int width) {
        if (width < 1 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("Bitset width must be within 1.." + MAX_WIDTH + ": " + width);
        }
        return width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActivityBitset other)) {
            return false;
        }
        return bits == other.bits && width == other.width;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(bits) + width;
    }

    @Override
    public String toString() {
        return "ActivityBitset{" + toBinaryString() + "}";
    }
}
