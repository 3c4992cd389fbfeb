package io.harvest.budget;

import io.harvest.core.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Single gate for outbound provider requests. Combines a local sliding window (at most maxCalls
 * timestamps within the trailing window) with the upstream's reported remaining quota.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final Duration WINDOW_SLACK = Duration.ofMillis(10);
    static final Duration QUOTA_MARGIN = Duration.ofMillis(200);

    private final int maxCalls;
    private final Duration window;
    private final QuotaProbe quota; // optional
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> calls = new ArrayDeque<>();

    public RateLimiter(int maxCalls, Duration window) {
        this(maxCalls, window, null, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimiter(int maxCalls, Duration window, QuotaProbe quota, Clock clock, Sleeper sleeper) {
        if (maxCalls < 1) throw new IllegalArgumentException("maxCalls must be >= 1");
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("window must be positive");
        this.maxCalls = maxCalls;
        this.window = window;
        this.quota = quota;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    /**
     * Blocks until both the local window and the upstream quota admit one more request, then records it.
     */
    public synchronized void acquire() throws InterruptedException {
        evictStale(clock.instant());
        while (calls.size() >= maxCalls) {
            Instant now = clock.instant();
            Duration age = Duration.between(calls.peekFirst(), now);
            Duration wait = window.minus(age).plus(WINDOW_SLACK);
            if (!wait.isNegative() && !wait.isZero()) {
                log.debug("rate window full ({} calls / {}), waiting {} ms", calls.size(), window, wait.toMillis());
                sleeper.sleep(wait);
            }
            evictStale(clock.instant());
        }
        awaitUpstreamQuota();
        calls.addLast(clock.instant());
    }

    private void awaitUpstreamQuota() throws InterruptedException {
        if (quota == null) return;
        Duration wait;
        try {
            if (quota.remaining() > 0) return;
            wait = quota.resetWait();
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            // the sliding window alone still bounds the call rate
            log.debug("quota probe unavailable: {}", e.toString());
            return;
        }
        Duration sleep = (wait == null || wait.isNegative() ? Duration.ZERO : wait).plus(QUOTA_MARGIN);
        log.info("upstream quota exhausted, waiting {} ms", sleep.toMillis());
        sleeper.sleep(sleep);
    }

    private void evictStale(Instant now) {
        while (!calls.isEmpty() && Duration.between(calls.peekFirst(), now).compareTo(window) > 0) {
            calls.pollFirst();
        }
    }

    public int maxCalls() { return maxCalls; }
    public Duration window() { return window; }

    /** Timestamps currently inside the window, oldest first. */
    public synchronized List<Instant> recentCalls() {
        return List.copyOf(calls);
    }
}
