package io.harvest.financial;

import io.harvest.core.WorkItem;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentCodesTest {
    private static Optional<WorkItem> item(String id) {
        return Optional.of(new WorkItem(id));
    }

    @Test
    void padsAndSuffixesByMarket() {
        assertEquals(item("005930.KS"), InstrumentCodes.normalize("5930", Market.KOSPI));
        assertEquals(item("035720.KQ"), InstrumentCodes.normalize(" 035720 ", Market.KOSDAQ));
    }

    @Test
    void explicitSuffixWins() {
        assertEquals(item("005930.KQ"), InstrumentCodes.normalize("005930.kq", Market.KOSPI));
        assertEquals(item("000660.KS"), InstrumentCodes.normalize("000660.KS", Market.KOSPI));
    }

    @Test
    void parenthesizedCodeIsPreferred() {
        assertEquals(item("005930.KS"), InstrumentCodes.normalize("Samsung 2024 (005930)", Market.KOSPI));
    }

    @Test
    void rejectsUnusableCodes() {
        assertTrue(InstrumentCodes.normalize(null, Market.KOSPI).isEmpty());
        assertTrue(InstrumentCodes.normalize("  ", Market.KOSPI).isEmpty());
        assertTrue(InstrumentCodes.normalize("ABC", Market.KOSPI).isEmpty());
        assertTrue(InstrumentCodes.normalize("1234567", Market.KOSPI).isEmpty());
    }
}
