package io.harvest.financial;

import io.harvest.retry.FailureKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GranularityClassifierTest {
    private final GranularityClassifier classifier = new GranularityClassifier();

    private static List<Bar> minutes(LocalDate day, LocalTime from, int count) {
        List<Bar> out = new ArrayList<>();
        for (int i = 0; i < count; i++) out.add(new Bar(day, from.plusMinutes(i), 1, 1, 1, 1, 1));
        return out;
    }

    @Test
    void dailyBarsAtSessionCloseAreCoarse() {
        List<Bar> daily = new ArrayList<>();
        for (int d = 1; d <= 20; d++) daily.add(new Bar(LocalDate.of(2024, 1, d), LocalTime.of(15, 30), 1, 1, 1, 1, 1));
        assertEquals(Optional.of(FailureKind.COARSE_GRANULARITY), classifier.problem(daily));
        assertFalse(classifier.isFineGrained(daily));
    }

    @Test
    void fewTimesWithoutCloseMarkerAreAccepted() {
        assertTrue(classifier.isFineGrained(minutes(LocalDate.of(2024, 1, 2), LocalTime.of(9, 0), 3)));
    }

    @Test
    void manyTimesIncludingCloseAreFine() {
        assertTrue(classifier.isFineGrained(minutes(LocalDate.of(2024, 1, 2), LocalTime.of(15, 20), 11)));
    }

    @Test
    void emptyIsReportedSeparately() {
        assertEquals(Optional.of(FailureKind.EMPTY_RESPONSE), classifier.problem(List.of()));
        assertEquals(Optional.of(FailureKind.EMPTY_RESPONSE), classifier.problem(null));
    }
}
