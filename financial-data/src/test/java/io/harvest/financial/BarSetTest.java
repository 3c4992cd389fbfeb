package io.harvest.financial;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BarSetTest {
    private static Bar bar(int day, int hour, int minute, double close) {
        return new Bar(LocalDate.of(2024, 1, day), LocalTime.of(hour, minute), close, close, close, close, 100);
    }

    @Test
    void sortsByDateThenTimeAndKeepsFirstDuplicate() {
        BarSet set = BarSet.of(List.of(bar(3, 9, 0, 1), bar(2, 9, 1, 2), bar(2, 9, 0, 3), bar(2, 9, 1, 4)));
        assertEquals(3, set.size());
        assertEquals(LocalDate.of(2024, 1, 2), set.bars().get(0).date());
        assertEquals(LocalTime.of(9, 0), set.bars().get(0).time());
        assertEquals(2.0, set.bars().get(1).close());
        assertEquals(LocalDate.of(2024, 1, 3), set.bars().get(2).date());
    }

    @Test
    void concatPrefersLeftOnConflict() {
        BarSet left = BarSet.of(List.of(bar(2, 9, 0, 1)));
        BarSet right = BarSet.of(List.of(bar(2, 9, 0, 9), bar(2, 9, 1, 9)));
        BarSet both = left.concat(right);
        assertEquals(2, both.size());
        assertEquals(1.0, both.bars().get(0).close());
        assertSame(left, left.concat(BarSet.empty()));
    }

    @Test
    void emptyInputGivesEmptySet() {
        assertTrue(BarSet.of(List.of()).isEmpty());
        assertSame(BarSet.empty(), BarSet.of(List.of()));
    }
}
