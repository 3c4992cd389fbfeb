package io.harvest.financial;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Bars of one work item, sorted by (date, time) with unique keys. When the input holds several bars
 * for one key, the one that came first is kept.
 */
public final class BarSet implements Iterable<Bar> {
    public static final Comparator<Bar> KEY_ORDER = Comparator.comparing(Bar::date).thenComparing(Bar::time);

    private static final BarSet EMPTY = new BarSet(List.of());

    private final List<Bar> bars;

    private BarSet(List<Bar> bars) {
        this.bars = bars;
    }

    public static BarSet empty() {
        return EMPTY;
    }

    public static BarSet of(Collection<Bar> raw) {
        if (raw.isEmpty()) return EMPTY;
        List<Bar> sorted = new ArrayList<>(raw);
        sorted.sort(KEY_ORDER); // stable, so earlier duplicates stay in front
        List<Bar> unique = new ArrayList<>(sorted.size());
        Bar prev = null;
        for (Bar b : sorted) {
            if (prev != null && prev.sameKey(b)) continue;
            unique.add(b);
            prev = b;
        }
        return new BarSet(List.copyOf(unique));
    }

    /** This set's bars followed by {@code other}'s; on key conflicts this set wins. */
    public BarSet concat(BarSet other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<Bar> all = new ArrayList<>(bars.size() + other.bars.size());
        all.addAll(bars);
        all.addAll(other.bars);
        return of(all);
    }

    public List<Bar> bars() { return bars; }
    public int size() { return bars.size(); }
    public boolean isEmpty() { return bars.isEmpty(); }


    @Override
    public Iterator<Bar> iterator() {
        return bars.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BarSet that && bars.equals(that.bars);
    }

    @Override
    public int hashCode() {
        return bars.hashCode();
    }

    @Override
    public String toString() {
        return "BarSet{size=" + bars.size() + '}';
    }
}
