package io.harvest.core;

import java.util.Objects;

/**
 * One unit of collection, identified by a normalized instrument symbol. Equality by id.
 */
public record WorkItem(String id) implements Comparable<WorkItem> {
    public WorkItem {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("work item id must not be blank");
    }

    @Override
    public int compareTo(WorkItem o) {
        return id.compareTo(o.id);
    }

    @Override
    public String toString() {
        return id;
    }
}
