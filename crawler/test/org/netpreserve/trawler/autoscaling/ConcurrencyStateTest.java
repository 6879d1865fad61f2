package org.netpreserve.trawler.autoscaling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyStateTest {
    @Test
    void acquireIsBoundedByDesired() {
        var state = new ConcurrencyState(1, 10, 2);
        state.acquire();
        state.acquire();
        assertFalse(state.hasCapacity());
        assertThrows(IllegalStateException.class, state::acquire);
        state.release();
        assertTrue(state.hasCapacity());
        assertEquals(1, state.current());
    }

    @Test
    void releaseWithoutAcquireFails() {
        assertThrows(IllegalStateException.class, () -> new ConcurrencyState(1, 1, 1).release());
    }

    @Test
    void scaleUpStepsByAtLeastOneAndStopsAtMax() {
        var state = new ConcurrencyState(1, 20, 10);
        assertEquals(11, state.scaleUp(0.05));
        int previous = 11;
        for (int i = 0; i < 50; i++) {
            int desired = state.scaleUp(0.05);
            assertTrue(desired <= 20);
            assertTrue(desired >= previous);
            previous = desired;
        }
        assertEquals(20, state.desired());

        var large = new ConcurrencyState(1, 1000, 100);
        assertEquals(105, large.scaleUp(0.05));
    }

    @Test
    void scaleDownStopsAtMin() {
        var state = new ConcurrencyState(3, 20, 10);
        assertEquals(9, state.scaleDown(0.05));
        for (int i = 0; i < 20; i++) state.scaleDown(0.05);
        assertEquals(3, state.desired());
    }

    @Test
    void isSaturated() {
        var state = new ConcurrencyState(1, 100, 20);
        for (int i = 0; i < 18; i++) state.acquire();
        assertFalse(state.isSaturated(0.95));
        state.acquire();
        assertTrue(state.isSaturated(0.95));
    }

    @Test
    void updateBoundsClampsDesired() {
        var state = new ConcurrencyState(1, 100, 50);
        state.updateBounds(1, 10);
        assertEquals(10, state.desired());
        state.updateBounds(20, 30);
        assertEquals(20, state.desired());
        assertThrows(IllegalArgumentException.class, () -> state.updateBounds(5, 4));
    }
}
