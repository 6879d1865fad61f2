package org.netpreserve.trawler.autoscaling;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Time-ordered snapshots of one resource. Each insert drops snapshots older than the retention window, so the
 * size is bounded by retention / sampling interval.
 */
class SnapshotHistory {
    private final Duration retention;
    private final ArrayDeque<ResourceSnapshot> snapshots = new ArrayDeque<>();

    SnapshotHistory(Duration retention) {
        this.retention = retention;
    }

    synchronized void add(ResourceSnapshot snapshot) {
        ResourceSnapshot last = snapshots.peekLast();
        // clock went backwards, keep the history ordered
        if (last != null && snapshot.capturedAt().isBefore(last.capturedAt())) {
            snapshot = snapshot.withCapturedAt(last.capturedAt());
        }
        prune(snapshot.capturedAt());
        snapshots.addLast(snapshot);
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(retention);
        while (!snapshots.isEmpty() && snapshots.peekFirst().capturedAt().isBefore(cutoff)) {
            snapshots.removeFirst();
        }
    }

    /**
     * Returns the snapshots captured at or after the cutoff, oldest first. A null cutoff returns everything.
     */
    synchronized List<ResourceSnapshot> since(@Nullable Instant cutoff) {
        if (cutoff == null) return List.copyOf(snapshots);
        var result = new ArrayList<ResourceSnapshot>();
        Iterator<ResourceSnapshot> it = snapshots.descendingIterator();
        while (it.hasNext()) {
            ResourceSnapshot snapshot = it.next();
            if (snapshot.capturedAt().isBefore(cutoff)) break;
            result.add(snapshot);
        }
        Collections.reverse(result);
        return result;
    }
}
