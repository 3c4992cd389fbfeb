package io.harvest.financial;

import io.harvest.retry.FailureKind;

import java.time.LocalTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Detects the upstream silently answering a minute request with daily bars: an answer whose
 * times-of-day are few (at most {@code maxCoarseDistinctTimes}) and include the session-close marker.
 */
public final class GranularityClassifier {
    public static final int DEFAULT_MAX_COARSE_DISTINCT_TIMES = 5;
    public static final LocalTime DEFAULT_SESSION_CLOSE = LocalTime.of(15, 30);

    private final int maxCoarseDistinctTimes;
    private final LocalTime sessionClose;

    public GranularityClassifier() {
        this(DEFAULT_MAX_COARSE_DISTINCT_TIMES, DEFAULT_SESSION_CLOSE);
    }

    public GranularityClassifier(int maxCoarseDistinctTimes, LocalTime sessionClose) {
        this.maxCoarseDistinctTimes = maxCoarseDistinctTimes;
        this.sessionClose = sessionClose;
    }

    public boolean isFineGrained(Collection<Bar> bars) {
        return problem(bars).isEmpty();
    }

    /** Why the answer is unusable, or empty when it is a non-empty minute series. */
    public Optional<FailureKind> problem(Collection<Bar> bars) {
        if (bars == null || bars.isEmpty()) return Optional.of(FailureKind.EMPTY_RESPONSE);
        Set<LocalTime> times = new HashSet<>();
        for (Bar b : bars) {
            times.add(b.time());
            if (times.size() > maxCoarseDistinctTimes) return Optional.empty();
        }
        return times.contains(sessionClose) ? Optional.of(FailureKind.COARSE_GRANULARITY) : Optional.empty();
    }
}
