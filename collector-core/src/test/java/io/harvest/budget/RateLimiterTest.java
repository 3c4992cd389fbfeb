package io.harvest.budget;

import io.harvest.core.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-02T00:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = d -> { sleeps.add(d); clock.advance(d); };

    @Test
    void neverAdmitsMoreThanMaxCallsPerWindow() throws Exception {
        Duration window = Duration.ofSeconds(60);
        RateLimiter limiter = new RateLimiter(13, window, null, clock, sleeper);
        List<Instant> admitted = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            limiter.acquire();
            admitted.add(clock.instant());
            clock.advance(Duration.ofMillis(700)); // work between calls
        }
        for (int i = 0; i + 13 < admitted.size(); i++) {
            Duration span = Duration.between(admitted.get(i), admitted.get(i + 13));
            assertTrue(span.compareTo(window) > 0, "14 calls inside one window at index " + i + ": " + span);
        }
        assertFalse(sleeps.isEmpty(), "limiter should have waited");
    }

    @Test
    void doesNotWaitBelowTheLimit() throws Exception {
        RateLimiter limiter = new RateLimiter(5, Duration.ofSeconds(10), null, clock, sleeper);
        for (int i = 0; i < 5; i++) limiter.acquire();
        assertTrue(sleeps.isEmpty());
        assertEquals(5, limiter.recentCalls().size());
    }

    @Test
    void waitsUntilOldestCallLeavesTheWindow() throws Exception {
        RateLimiter limiter = new RateLimiter(2, Duration.ofSeconds(10), null, clock, sleeper);
        limiter.acquire();
        clock.advance(Duration.ofSeconds(4));
        limiter.acquire();
        limiter.acquire();
        assertEquals(List.of(Duration.ofSeconds(10).minusSeconds(4).plus(RateLimiter.WINDOW_SLACK)), sleeps);
        assertEquals(2, limiter.recentCalls().size());
    }

    @Test
    void sleepsForReportedResetWhenUpstreamQuotaIsExhausted() throws Exception {
        AtomicInteger probes = new AtomicInteger();
        QuotaProbe probe = new QuotaProbe() {
            @Override public int remaining() { return probes.getAndIncrement() == 0 ? 0 : 10; }
            @Override public Duration resetWait() { return Duration.ofSeconds(3); }
        };
        RateLimiter limiter = new RateLimiter(100, Duration.ofSeconds(60), probe, clock, sleeper);
        limiter.acquire();
        limiter.acquire();
        assertEquals(List.of(Duration.ofSeconds(3).plus(RateLimiter.QUOTA_MARGIN)), sleeps);
    }

    @Test
    void failingProbeFallsBackToTheLocalWindow() throws Exception {
        QuotaProbe broken = new QuotaProbe() {
            @Override public int remaining() throws Exception { throw new IllegalStateException("session lost"); }
            @Override public Duration resetWait() { return Duration.ZERO; }
        };
        RateLimiter limiter = new RateLimiter(1, Duration.ofSeconds(1), broken, clock, sleeper);
        assertDoesNotThrow(limiter::acquire);
        assertDoesNotThrow(limiter::acquire);
        assertEquals(1, sleeps.size());
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(1, Duration.ZERO));
    }
}
