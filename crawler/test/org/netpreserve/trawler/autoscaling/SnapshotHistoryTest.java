package org.netpreserve.trawler.autoscaling;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotHistoryTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static ResourceSnapshot snapshot(Instant at, boolean overloaded) {
        return new ResourceSnapshot(ResourceKind.CPU, at, overloaded, overloaded ? 1.0 : 0.1);
    }

    @Test
    void dropsSnapshotsOlderThanRetention() {
        var history = new SnapshotHistory(Duration.ofSeconds(10));
        for (int i = 0; i <= 30; i++) {
            history.add(snapshot(T0.plusSeconds(i), false));
        }
        var retained = history.since(null);
        assertEquals(11, retained.size());
        assertEquals(T0.plusSeconds(20), retained.get(0).capturedAt());
        assertEquals(T0.plusSeconds(30), retained.get(retained.size() - 1).capturedAt());
    }

    @Test
    void sinceReturnsOldestFirst() {
        var history = new SnapshotHistory(Duration.ofSeconds(60));
        history.add(snapshot(T0, true));
        history.add(snapshot(T0.plusSeconds(5), false));
        history.add(snapshot(T0.plusSeconds(10), true));

        var recent = history.since(T0.plusSeconds(5));
        assertEquals(2, recent.size());
        assertEquals(T0.plusSeconds(5), recent.get(0).capturedAt());
        assertEquals(T0.plusSeconds(10), recent.get(1).capturedAt());
        assertTrue(history.since(T0.plusSeconds(11)).isEmpty());
    }

    @Test
    void keepsOrderWhenClockGoesBackwards() {
        var history = new SnapshotHistory(Duration.ofSeconds(60));
        history.add(snapshot(T0.plusSeconds(10), false));
        history.add(snapshot(T0.plusSeconds(5), true));

        var all = history.since(null);
        assertEquals(2, all.size());
        assertEquals(T0.plusSeconds(10), all.get(1).capturedAt());
        assertTrue(all.get(1).overloaded());
    }
}
