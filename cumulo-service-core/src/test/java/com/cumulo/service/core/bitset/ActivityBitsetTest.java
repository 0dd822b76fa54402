package com.cumulo.service.core.bitset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.cumulo.service.core.error.WindowTooWideException;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ActivityBitsetTest {

    private static final LocalDate AS_OF = LocalDate.parse("2023-03-31");

    @Test
    void threeConsecutiveDaysPackToSeven() {
        ActivityBitset bits = ActivityBitset.fromDates(
                List.of(AS_OF.minusDays(2), AS_OF.minusDays(1), AS_OF), AS_OF, ActivityBitset.DEFAULT_WIDTH);

        assertEquals(7L, bits.value());
        assertThat(bits.toBinaryString()).hasSize(32).endsWith("0111");
    }

    @Test
    void shiftAndSetAgesHistoryAndTruncatesOldestDay() {
        ActivityBitset bits = ActivityBitset.of(0b1000, 4);

        assertEquals(0b0001L, bits.shiftAndSet(true).value());
        assertEquals(0L, bits.shiftAndSet(false).value());
        assertEquals(0b11L, ActivityBitset.of(0b1, 4).shiftAndSet(true).value());
    }

    @Test
    void thirtyTwoInactiveDaysClearEverything() {
        ActivityBitset bits = ActivityBitset.of(-1L, 32);
        assertEquals(0xFFFF_FFFFL, bits.value());

        for (int i = 0; i < 32; i++) {
            bits = bits.shiftAndSet(false);
        }

        assertThat(bits.isEmpty()).isTrue();
    }

    @Test
    void fullWidthBitsetAgesOutToo() {
        ActivityBitset bits = ActivityBitset.of(-1L, 64);
        for (int i = 0; i < 64; i++) {
            bits = bits.shiftAndSet(false);
        }
        assertEquals(ActivityBitset.empty(64), bits);
    }

    @Test
    void datesRoundTripThroughEveryTrackedDay() {
        Set<LocalDate> active = Set.of(
                AS_OF, AS_OF.minusDays(3), AS_OF.minusDays(10), AS_OF.minusDays(31), AS_OF.minusDays(40));

        ActivityBitset bits = ActivityBitset.fromDates(active, AS_OF, 32);

        for (int daysAgo = 0; daysAgo < 32; daysAgo++) {
            assertEquals(active.contains(AS_OF.minusDays(daysAgo)), bits.isActiveOn(daysAgo), "day " + daysAgo);
        }
        assertThat(bits.toDates(AS_OF))
                .containsExactly(AS_OF.minusDays(31), AS_OF.minusDays(10), AS_OF.minusDays(3), AS_OF);
    }

    @Test
    void futureDatesAreIgnored() {
        ActivityBitset bits = ActivityBitset.fromDates(List.of(AS_OF.plusDays(1)), AS_OF, 32);
        assertThat(bits.isEmpty()).isTrue();
    }

    @Test
    void windowQueriesLookAtMostRecentBits() {
        ActivityBitset bits = ActivityBitset.of(0b1011_0000_0000L, 32);

        assertThat(bits.isActiveWithin(7)).isFalse();
        assertThat(bits.isActiveWithin(9)).isTrue();
        assertEquals(1, bits.countActiveWithin(9));
        assertEquals(3, bits.countActiveWithin(32));
    }

    @Test
    void shiftOlderDropsRecentDays() {
        ActivityBitset bits = ActivityBitset.of(0b1000_0001L, 32);

        assertEquals(0b1L, bits.shiftOlder(7).value());
        assertEquals(0L, bits.shiftOlder(64).value());
        assertThrows(IllegalArgumentException.class, () -> bits.shiftOlder(-1));
    }

    @Test
    void windowWiderThanBitsetIsRejected() {
        ActivityBitset bits = ActivityBitset.empty(32);

        WindowTooWideException ex = assertThrows(WindowTooWideException.class, () -> bits.isActiveWithin(33));
        assertEquals(33, ex.window());
        assertEquals(32, ex.width());
        assertThrows(WindowTooWideException.class, () -> bits.countActiveWithin(0));
        assertThrows(WindowTooWideException.class, () -> bits.isActiveOn(32));
    }

    @Test
    void widthMustFitInLong() {
        assertThrows(IllegalArgumentException.class, () -> ActivityBitset.empty(0));
        assertThrows(IllegalArgumentException.class, () -> ActivityBitset.empty(65));
    }

    @Test
    void orRequiresMatchingWidths() {
        ActivityBitset a = ActivityBitset.of(0b01, 8);
        ActivityBitset b = ActivityBitset.of(0b10, 8);

        assertEquals(0b11L, a.or(b).value());
        assertThrows(IllegalArgumentException.class, () -> a.or(ActivityBitset.empty(16)));
    }
}
