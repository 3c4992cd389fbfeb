package io.harvest.financial;

import io.harvest.core.WorkItem;

/**
 * Collects the full lookback history of one work item.
 */
@FunctionalInterface
public interface ItemCollector {
    BarSet collect(WorkItem item) throws InterruptedException;
}
