package io.harvest.retry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Bounded retry whose delay grows linearly with the attempt number, with a separate base and step per
 * failure kind: {@code base + step * (attempt - 1)}.
 */
public class LinearBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Map<FailureKind, Step> steps;

    public LinearBackoffRetryPolicy(int maxAttempts, Map<FailureKind, Step> steps) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.steps = new EnumMap<>(FailureKind.class);
        this.steps.putAll(steps);
        for (FailureKind k : FailureKind.values()) {
            this.steps.putIfAbsent(k, new Step(500, 500));
        }
    }

    /**
     * Three attempts: transport errors 800 ms + 500 ms/attempt, empty answers 400 ms + 300 ms/attempt,
     * coarse answers 600 ms + 500 ms/attempt.
     */
    public static LinearBackoffRetryPolicy defaults() {
        return withAttempts(3);
    }

    public static LinearBackoffRetryPolicy withAttempts(int maxAttempts) {
        Map<FailureKind, Step> m = new EnumMap<>(FailureKind.class);
        m.put(FailureKind.TRANSIENT_ERROR, new Step(800, 500));
        m.put(FailureKind.EMPTY_RESPONSE, new Step(400, 300));
        m.put(FailureKind.COARSE_GRANULARITY, new Step(600, 500));
        return new LinearBackoffRetryPolicy(maxAttempts, m);
    }

    @Override
    public boolean shouldRetry(int attempt, FailureKind kind) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt, FailureKind kind) {
        Step s = steps.get(kind);
        return s.baseMillis() + s.stepMillis() * Math.max(0, attempt - 1);
    }


    public record Step(long baseMillis, long stepMillis) {
        public Step {
            if (baseMillis < 0 || stepMillis < 0) throw new IllegalArgumentException("backoff must be >= 0");
        }
    }
}
