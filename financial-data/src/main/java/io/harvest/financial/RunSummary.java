package io.harvest.financial;

/**
 * Outcome counts of one orchestrator run. {@code processed} counts every item the run visited.
 */
public record RunSummary(int total, int startIndex, int processed, int saved, int skipped, int empty, int failed, long rows) {
    public boolean completed() {
        return startIndex + processed >= total;
    }
}
