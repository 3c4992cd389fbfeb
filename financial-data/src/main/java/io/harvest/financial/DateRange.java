package io.harvest.financial;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive calendar-date interval [start, end].
 */
public record DateRange(LocalDate start, LocalDate end) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) throw new IllegalArgumentException("range start " + start + " is after end " + end);
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange day(LocalDate date) {
        return new DateRange(date, date);
    }

    /** Number of calendar days covered, at least 1. */
    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }

    /**
     * Splits into [start, mid] and [mid + 1, end], mid = start + floor((end - start) / 2).
     */
    public List<DateRange> bisect() {
        if (isSingleDay()) throw new IllegalStateException("cannot split single day " + start);
        LocalDate mid = start.plusDays(ChronoUnit.DAYS.between(start, end) / 2);
        return List.of(new DateRange(start, mid), new DateRange(mid.plusDays(1), end));
    }

    /**
     * Calendar-month pieces in chronological order. The first and last pieces are clipped to this range.
     */
    public List<DateRange> monthChunks() {
        List<DateRange> out = new ArrayList<>();
        LocalDate cur = start;
        while (!cur.isAfter(end)) {
            LocalDate monthEnd = cur.with(TemporalAdjusters.lastDayOfMonth());
            LocalDate e = monthEnd.isAfter(end) ? end : monthEnd;
            out.add(new DateRange(cur, e));
            cur = monthEnd.plusDays(1);
        }
        return out;
    }

    /** Consecutive pieces of at most {@code maxDays} days each, the last one possibly shorter. */
    public List<DateRange> split(int maxDays) {
        if (maxDays < 1) throw new IllegalArgumentException("maxDays must be >= 1");
        List<DateRange> out = new ArrayList<>();
        LocalDate cur = start;
        while (!cur.isAfter(end)) {
            LocalDate e = cur.plusDays(maxDays - 1L);
            if (e.isAfter(end)) e = end;
            out.add(new DateRange(cur, e));
            cur = e.plusDays(1);
        }
        return out;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
