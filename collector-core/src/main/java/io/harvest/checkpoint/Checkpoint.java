package io.harvest.checkpoint;

import io.harvest.core.WorkItem;

import java.util.List;

/**
 * Resumption state of a batch: the work list snapshot taken when the batch started and the index of
 * the next item nobody has processed yet.
 */
public record Checkpoint(int nextIndex, List<WorkItem> items) {
    public Checkpoint {
        if (nextIndex < 0) throw new IllegalArgumentException("nextIndex must be >= 0");
        items = List.copyOf(items);
    }

    public static Checkpoint empty() {
        return new Checkpoint(0, List.of());
    }

    /**
     * Keeps the persisted position only when {@code freshItems} is exactly the persisted list; any
     * difference restarts the batch from the first item of the fresh list.
     */
    public Checkpoint reconcile(List<WorkItem> freshItems) {
        if (items.equals(freshItems)) return this;
        return new Checkpoint(0, freshItems);
    }
}
