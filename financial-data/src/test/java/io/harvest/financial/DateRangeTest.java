package io.harvest.financial;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DateRangeTest {
    @Test
    void bisectSplitsAtFloorMidpoint() {
        DateRange r = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 4));
        List<DateRange> halves = r.bisect();
        assertEquals(DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)), halves.get(0));
        assertEquals(DateRange.of(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4)), halves.get(1));

        List<DateRange> two = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)).bisect();
        assertTrue(two.get(0).isSingleDay());
        assertTrue(two.get(1).isSingleDay());
    }

    @Test
    void oddLengthPutsExtraDayOnTheRight() {
        List<DateRange> halves = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 5)).bisect();
        assertEquals(3, halves.get(0).days());
        assertEquals(2, halves.get(1).days());
    }

    @Test
    void singleDayCannotBeSplit() {
        DateRange d = DateRange.day(LocalDate.of(2024, 2, 29));
        assertEquals(1, d.days());
        assertThrows(IllegalStateException.class, d::bisect);
    }

    @Test
    void rejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> DateRange.of(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)));
    }

    @Test
    void monthChunksCoverRangeWithoutGapsOrOverlap() {
        DateRange window = DateRange.of(LocalDate.of(2023, 11, 20), LocalDate.of(2024, 2, 10));
        List<DateRange> chunks = window.monthChunks();
        assertEquals(4, chunks.size());
        // first chunk starts at the window start, not at the 1st of its month
        assertEquals(window.start(), chunks.get(0).start());
        assertEquals(DateRange.of(LocalDate.of(2023, 11, 20), LocalDate.of(2023, 11, 30)), chunks.get(0));
        assertEquals(DateRange.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 10)), chunks.get(3));

        long total = 0;
        for (int i = 0; i < chunks.size(); i++) {
            total += chunks.get(i).days();
            if (i > 0) assertEquals(chunks.get(i - 1).end().plusDays(1), chunks.get(i).start());
        }
        assertEquals(window.days(), total);
    }

    @Test
    void rangeInsideOneMonthIsOneChunk() {
        DateRange r = DateRange.of(LocalDate.of(2024, 3, 5), LocalDate.of(2024, 3, 9));
        assertEquals(List.of(r), r.monthChunks());
    }

    @Test
    void splitCutsIntoPiecesOfAtMostMaxDays() {
        DateRange r = DateRange.of(LocalDate.of(2024, 2, 15), LocalDate.of(2024, 2, 29));
        assertEquals(List.of(
                DateRange.of(LocalDate.of(2024, 2, 15), LocalDate.of(2024, 2, 21)),
                DateRange.of(LocalDate.of(2024, 2, 22), LocalDate.of(2024, 2, 28)),
                DateRange.day(LocalDate.of(2024, 2, 29))), r.split(7));
        assertEquals(List.of(r), r.split(15));
        assertEquals(List.of(r), r.split(Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> r.split(0));
    }
}
