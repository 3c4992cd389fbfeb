package io.harvest.retry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Doubling backoff: {@code baseMillis * 2^(attempt-1)}, capped at {@code maxMillis}. Only the given
 * failure kinds are retried.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final Set<FailureKind> retryOn;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, EnumSet.allOf(FailureKind.class));
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, Set<FailureKind> retryOn) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.retryOn = retryOn.isEmpty() ? EnumSet.noneOf(FailureKind.class) : EnumSet.copyOf(retryOn);
    }

    @Override
    public boolean shouldRetry(int attempt, FailureKind kind) {
        return attempt < maxAttempts && retryOn.contains(kind);
    }

    @Override
    public long backoffMillis(int attempt, FailureKind kind) {
        int doublings = Math.min(30, Math.max(0, attempt - 1));
        return Math.min(baseMillis << doublings, maxMillis);
    }
}
