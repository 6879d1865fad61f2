package org.netpreserve.trawler.storage;

import org.jetbrains.annotations.Nullable;

/**
 * A store of work items. Implementations must be safe to call from multiple threads.
 */
public interface WorkSource {
    /**
     * Takes the next available item and marks it in flight.
     *
     * @return the item, or null if none is available right now
     */
    @Nullable
    WorkItem fetchNext();

    void markHandled(WorkItem item);

    /**
     * Marks an in-flight item as permanently failed. The item counts as handled.
     */
    void markFailed(WorkItem item, @Nullable String error);

    /**
     * Returns an in-flight item to the store so it will be fetched again, incrementing its retry count.
     */
    void reclaim(WorkItem item, @Nullable String error);

    /**
     * Whether no item is currently available. A store that cannot prove it is empty returns false.
     */
    boolean isEmpty();

    /**
     * Whether no item is available and none is in flight.
     */
    boolean isFinished();

    /**
     * Number of items that were handled or failed.
     */
    long handledCount();

    /**
     * Number of items available or in flight.
     */
    long pendingCount();
}
