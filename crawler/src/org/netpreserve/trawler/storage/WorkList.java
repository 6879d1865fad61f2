package org.netpreserve.trawler.storage;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.Url;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An in-memory, fixed list of work items. Duplicates by unique key are dropped. Reclaimed items are fetched
 * before the rest of the list.
 */
public class WorkList implements WorkSource {
    private final Deque<WorkItem> available = new ArrayDeque<>();
    private final Map<String, WorkItem> inFlight = new HashMap<>();
    private final Set<String> seen = new HashSet<>();
    private long handled;

    public WorkList(Collection<WorkItem> items) {
        for (var item : items) {
            if (seen.add(item.uniqueKey())) {
                available.addLast(item.withState(WorkItem.State.AVAILABLE));
            }
        }
    }

    public static WorkList ofUrls(Collection<Url> urls) {
        return new WorkList(urls.stream().map(url -> WorkItem.of(url, 0)).toList());
    }

    public static WorkList of(String... urls) {
        return new WorkList(List.of(urls).stream().map(WorkItem::of).toList());
    }

    /**
     * Number of distinct items the list was created with.
     */
    public synchronized int size() {
        return seen.size();
    }

    @Override
    public synchronized @Nullable WorkItem fetchNext() {
        WorkItem item = available.pollFirst();
        if (item == null) return null;
        item = item.withState(WorkItem.State.IN_FLIGHT);
        inFlight.put(item.uniqueKey(), item);
        return item;
    }

    @Override
    public synchronized void markHandled(WorkItem item) {
        removeInFlight(item);
        handled++;
    }

    @Override
    public synchronized void markFailed(WorkItem item, @Nullable String error) {
        removeInFlight(item);
        handled++;
    }

    @Override
    public synchronized void reclaim(WorkItem item, @Nullable String error) {
        WorkItem current = removeInFlight(item);
        available.addFirst(current.reclaimed(error));
    }

    private WorkItem removeInFlight(WorkItem item) {
        WorkItem current = inFlight.remove(item.uniqueKey());
        if (current == null) {
            throw new WorkSourceException("Item is not in flight: " + item.uniqueKey());
        }
        return current;
    }

    @Override
    public synchronized boolean isEmpty() {
        return available.isEmpty();
    }

    @Override
    public synchronized boolean isFinished() {
        return available.isEmpty() && inFlight.isEmpty();
    }

    @Override
    public synchronized long handledCount() {
        return handled;
    }

    @Override
    public synchronized long pendingCount() {
        return available.size() + inFlight.size();
    }
}
