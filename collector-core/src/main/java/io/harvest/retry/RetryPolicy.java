package io.harvest.retry;

/**
 * Attempts are numbered from 1; {@code attempt} is the number of attempts already made.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, FailureKind kind);
    long backoffMillis(int attempt, FailureKind kind);
}
