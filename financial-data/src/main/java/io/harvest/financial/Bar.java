package io.harvest.financial;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * One OHLCV observation. Bars are keyed by (date, time).
 */
public record Bar(LocalDate date, LocalTime time, double open, double high, double low, double close, long volume) {
    public Bar {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(time, "time");
    }

    public boolean sameKey(Bar other) {
        return date.equals(other.date) && time.equals(other.time);
    }
}
