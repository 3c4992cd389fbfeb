package io.harvest.core;

import java.io.IOException;
import java.util.List;

/**
 * Produces the batch's work list: de-duplicated, validated and in a deterministic order, so that two
 * calls over unchanged inputs return equal lists.
 */
@FunctionalInterface
public interface WorkItemSource {
    List<WorkItem> listItems() throws IOException;
}
