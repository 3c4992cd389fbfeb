package io.harvest.budget;

import java.time.Duration;

/**
 * Best-effort view of the upstream's own request quota. Either call may fail; callers treat a failure
 * as "no information".
 */
public interface QuotaProbe {
    /** Requests the upstream will still accept right now. 0 means exhausted. */
    int remaining() throws Exception;

    /** Suggested wait until the quota refills. Only meaningful when {@link #remaining()} is 0. */
    Duration resetWait() throws Exception;
}
