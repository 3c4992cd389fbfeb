package io.harvest.retry;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class LinearBackoffRetryPolicyTest {
    @Test
    void defaultsAllowThreeAttempts() {
        RetryPolicy p = LinearBackoffRetryPolicy.defaults();
        assertTrue(p.shouldRetry(1, FailureKind.EMPTY_RESPONSE));
        assertTrue(p.shouldRetry(2, FailureKind.TRANSIENT_ERROR));
        assertFalse(p.shouldRetry(3, FailureKind.COARSE_GRANULARITY));
    }

    @Test
    void delayGrowsLinearlyPerKind() {
        RetryPolicy p = LinearBackoffRetryPolicy.defaults();
        assertEquals(800, p.backoffMillis(1, FailureKind.TRANSIENT_ERROR));
        assertEquals(1300, p.backoffMillis(2, FailureKind.TRANSIENT_ERROR));
        assertEquals(400, p.backoffMillis(1, FailureKind.EMPTY_RESPONSE));
        assertEquals(700, p.backoffMillis(2, FailureKind.EMPTY_RESPONSE));
        assertEquals(600, p.backoffMillis(1, FailureKind.COARSE_GRANULARITY));
        assertEquals(1100, p.backoffMillis(2, FailureKind.COARSE_GRANULARITY));
    }

    @Test
    void exponentialPolicyDoublesUpToCap() {
        RetryPolicy p = new ExponentialBackoffRetryPolicy(6, 400, 2_000);
        assertEquals(400, p.backoffMillis(1, FailureKind.TRANSIENT_ERROR));
        assertEquals(800, p.backoffMillis(2, FailureKind.TRANSIENT_ERROR));
        assertEquals(1600, p.backoffMillis(3, FailureKind.TRANSIENT_ERROR));
        assertEquals(2000, p.backoffMillis(4, FailureKind.TRANSIENT_ERROR));
        assertTrue(p.shouldRetry(5, FailureKind.TRANSIENT_ERROR));
        assertFalse(p.shouldRetry(6, FailureKind.TRANSIENT_ERROR));

        RetryPolicy errorsOnly = new ExponentialBackoffRetryPolicy(6, 400, 2_000, EnumSet.of(FailureKind.TRANSIENT_ERROR));
        assertFalse(errorsOnly.shouldRetry(1, FailureKind.EMPTY_RESPONSE));
        assertTrue(errorsOnly.shouldRetry(1, FailureKind.TRANSIENT_ERROR));
    }
}
