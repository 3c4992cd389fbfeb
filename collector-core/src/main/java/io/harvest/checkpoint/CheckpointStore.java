package io.harvest.checkpoint;

import io.harvest.core.WorkItem;

import java.util.List;

/**
 * Persistent home of the single {@link Checkpoint}. There is one writer at a time.
 */
public interface CheckpointStore {
    /** Persisted checkpoint, or {@link Checkpoint#empty()} when there is none or it cannot be read. */
    Checkpoint load();

    /** Replaces the persisted checkpoint. Readers never observe a partially written record. */
    void save(int nextIndex, List<WorkItem> items);
}
