package org.netpreserve.trawler.autoscaling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.trawler.config.PoolConfig;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AutoscaledPoolTest {
    private static final SystemInfo HEALTHY = new SystemInfo(true, Map.of());
    private static final SystemInfo OVERLOADED = new SystemInfo(false, Map.of());

    private final Snapshotter snapshotter = mock(Snapshotter.class);
    private final SystemStatus systemStatus = mock(SystemStatus.class);
    private final CountDownLatch gate = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        when(systemStatus.getCurrentStatus()).thenReturn(HEALTHY);
        when(systemStatus.getHistoricalStatus()).thenReturn(HEALTHY);
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
    }

    private static PoolConfig config(int min, int max, int desired) {
        return new PoolConfig(min, max, desired, null, null, null, Duration.ofMillis(10), Duration.ofHours(1),
                null, null, null, null, null);
    }

    private AutoscaledPool pool(PoolConfig config, TaskProvider provider) {
        return new AutoscaledPool(config, provider, snapshotter, systemStatus);
    }

    private TaskResult blockUntilGateOpens() throws InterruptedException {
        gate.await();
        return TaskResult.ok();
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("Timed out waiting: " + message);
            Thread.sleep(5);
        }
    }

    @Test
    void runsAllTasksWithinDesiredConcurrency() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(20), n -> {
            Thread.sleep(20);
            return TaskResult.ok();
        });
        var pool = pool(config(1, 10, 5), provider);

        assertEquals(PoolState.FINISHED, pool.run());
        assertEquals(20, provider.started.get());
        assertTrue(provider.maxRunning.get() <= 5, "max running was " + provider.maxRunning.get());
        assertEquals(0, pool.currentConcurrency());
        verify(snapshotter).start(any());
        verify(snapshotter).stop();
    }

    @Test
    void doesNotFinishWhileTasksAreRunning() throws Exception {
        var remaining = new AtomicInteger(1);
        var provider = new CountingProvider(remaining, n -> {
            Thread.sleep(50);
            // the first task discovers more work just before it completes
            if (n == 1) remaining.addAndGet(2);
            return TaskResult.ok();
        });
        var pool = pool(config(1, 3, 3), provider);

        assertEquals(PoolState.FINISHED, pool.run());
        assertEquals(3, provider.started.get());
        assertFalse(provider.finishCheckedWhileRunning.get());
    }

    @Test
    void scalesUpOneStepAtATimeUpToMax() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(1, 20, 10), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 10, "pool to fill");

        pool.autoscaleNow();
        assertEquals(11, pool.desiredConcurrency());
        assertEquals(11, pool.currentConcurrency());

        for (int i = 0; i < 30; i++) {
            pool.autoscaleNow();
            assertTrue(pool.desiredConcurrency() <= 20);
        }
        assertEquals(20, pool.desiredConcurrency());

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void doesNotScaleUpWhenNotSaturated() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(5), n -> blockUntilGateOpens());
        var pool = pool(config(1, 20, 10), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 5, "tasks to start");

        pool.autoscaleNow();
        assertEquals(10, pool.desiredConcurrency());

        gate.countDown();
        assertEquals(PoolState.FINISHED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void doesNotScaleUpWhenHistoricallyOverloaded() throws Exception {
        when(systemStatus.getHistoricalStatus()).thenReturn(OVERLOADED);
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(1, 20, 10), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 10, "pool to fill");

        pool.autoscaleNow();
        assertEquals(10, pool.desiredConcurrency());

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void scalesDownWhenOverloadedEvenIfSaturated() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(2, 20, 10), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 10, "pool to fill");

        // the pool is full so the control loop is not reading the status while it is restubbed
        when(systemStatus.getCurrentStatus()).thenReturn(OVERLOADED);

        int previous = pool.desiredConcurrency();
        while (previous > 2) {
            pool.autoscaleNow();
            int desired = pool.desiredConcurrency();
            assertTrue(desired < previous, "desired went from " + previous + " to " + desired);
            previous = desired;
        }
        pool.autoscaleNow();
        assertEquals(2, pool.desiredConcurrency());
        assertEquals(10, provider.started.get());

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void overloadOnlyAdmitsUpToMinConcurrency() throws Exception {
        when(systemStatus.getCurrentStatus()).thenReturn(OVERLOADED);
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(2, 20, 10), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 2, "min concurrency to start");
        Thread.sleep(100);
        assertEquals(2, provider.started.get());

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void fatalResultFailsWithSameException() throws InterruptedException {
        var boom = new IllegalStateException("boom");
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> TaskResult.fatal(boom));
        var pool = pool(config(1, 1, 1), provider);

        var e = assertThrows(TaskFailedException.class, pool::run);
        assertSame(boom, e.getCause());
        assertEquals(PoolState.ERRORED, pool.state());
        Thread.sleep(50);
        assertEquals(1, provider.started.get());
    }

    @Test
    void thrownExceptionFailsWithSameException() {
        var boom = new IllegalStateException("boom");
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> {
            throw boom;
        });
        var pool = pool(config(1, 1, 1), provider);

        var e = assertThrows(TaskFailedException.class, pool::run);
        assertSame(boom, e.getCause());
        assertEquals(1, provider.started.get());
    }

    @Test
    void failureWaitsForRunningTasksAndAdmitsNoMore() throws Exception {
        var boom = new RuntimeException("boom");
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> {
            if (n == 1) return TaskResult.fatal(boom);
            return blockUntilGateOpens();
        });
        var pool = pool(config(3, 3, 3), provider);
        CompletableFuture<PoolState> outcome = pool.runAsync();

        await(() -> pool.state() == PoolState.ERRORED, "pool to fail");
        Thread.sleep(50);
        assertFalse(outcome.isDone());

        gate.countDown();
        var e = assertThrows(ExecutionException.class, () -> outcome.get(5, TimeUnit.SECONDS));
        assertSame(boom, e.getCause());
        assertEquals(3, provider.started.get());
    }

    @Test
    void retryableFailureKeepsPoolRunning() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(5),
                n -> TaskResult.retryable(new RuntimeException("try again")));
        assertEquals(PoolState.FINISHED, pool(config(1, 2, 2), provider).run());
        assertEquals(5, provider.started.get());
    }

    @Test
    void hookExceptionFailsThePool() {
        var boom = new IllegalStateException("broken hook");
        var provider = new TaskProvider() {
            @Override
            public TaskResult runTask() {
                return TaskResult.ok();
            }

            @Override
            public boolean isTaskReady() {
                throw boom;
            }

            @Override
            public boolean isFinished() {
                return false;
            }
        };
        var e = assertThrows(TaskFailedException.class, () -> pool(config(1, 1, 1), provider).run());
        assertSame(boom, e.getCause());
    }

    @Test
    void abortResolvesWithoutWaitingForTasks() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(2, 2, 2), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 2, "tasks to start");

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(1, TimeUnit.SECONDS));
        assertEquals(PoolState.ABORTED, pool.state());
        Thread.sleep(50);
        assertEquals(2, provider.started.get());

        pool.abort();
        assertEquals(PoolState.ABORTED, pool.state());
    }

    @Test
    void runCanOnlyBeCalledOnce() throws Exception {
        var pool = pool(config(1, 1, 1), new CountingProvider(new AtomicInteger(1), n -> TaskResult.ok()));
        assertEquals(PoolState.FINISHED, pool.run());
        assertThrows(IllegalStateException.class, pool::run);
    }

    @Test
    void pauseWaitsForRunningTasksAndResumeRestartsAdmission() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(2, 2, 2), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 2, "tasks to start");

        var paused = pool.pause();
        assertEquals(PoolState.PAUSING, pool.state());
        assertFalse(paused.isDone());

        gate.countDown();
        paused.get(5, TimeUnit.SECONDS);
        assertEquals(PoolState.PAUSED, pool.state());
        Thread.sleep(50);
        assertEquals(2, provider.started.get());
        assertEquals(2, pool.desiredConcurrency());

        pool.resume();
        await(() -> provider.started.get() > 2, "tasks to start after resume");
        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void taskTimeoutFailsThePool() {
        var config = new PoolConfig(1, 1, 1, null, null, null, Duration.ofMillis(10), Duration.ofHours(1),
                null, Duration.ofMillis(100), null, null, null);
        var provider = new CountingProvider(new AtomicInteger(1), n -> {
            Thread.sleep(10_000);
            return TaskResult.ok();
        });

        var e = assertThrows(TaskFailedException.class, () -> pool(config, provider).run());
        assertInstanceOf(TimeoutException.class, e.getCause());
    }

    @Test
    void maxTasksPerMinuteLimitsStarts() throws Exception {
        var config = new PoolConfig(1, 5, 5, null, null, null, Duration.ofMillis(10), Duration.ofHours(1),
                null, null, 2, null, null);
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> TaskResult.ok());
        var pool = pool(config, provider);
        var outcome = pool.runAsync();
        Thread.sleep(200);
        assertEquals(2, provider.started.get());

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void updateConcurrencyBoundsClampsDesired() throws Exception {
        var provider = new CountingProvider(new AtomicInteger(Integer.MAX_VALUE), n -> blockUntilGateOpens());
        var pool = pool(config(1, 10, 5), provider);
        var outcome = pool.runAsync();
        await(() -> pool.currentConcurrency() == 5, "pool to fill");

        pool.updateConcurrencyBounds(1, 3);
        await(() -> pool.desiredConcurrency() == 3, "desired to be clamped");
        assertEquals(3, pool.maxConcurrency());
        assertThrows(IllegalArgumentException.class, () -> pool.updateConcurrencyBounds(0, 3));

        pool.abort();
        assertEquals(PoolState.ABORTED, outcome.get(5, TimeUnit.SECONDS));
    }

    interface TaskBody {
        TaskResult run(int taskNumber) throws Exception;
    }

    static class CountingProvider implements TaskProvider {
        final AtomicInteger remaining;
        final TaskBody body;
        final AtomicInteger started = new AtomicInteger();
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxRunning = new AtomicInteger();
        final AtomicBoolean finishCheckedWhileRunning = new AtomicBoolean();

        CountingProvider(AtomicInteger remaining, TaskBody body) {
            this.remaining = remaining;
            this.body = body;
        }

        @Override
        public TaskResult runTask() throws Exception {
            int n = started.incrementAndGet();
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                return body.run(n);
            } finally {
                running.decrementAndGet();
            }
        }

        @Override
        public boolean isTaskReady() {
            return remaining.getAndUpdate(r -> r > 0 ? r - 1 : 0) > 0;
        }

        @Override
        public boolean isFinished() {
            if (running.get() != 0) finishCheckedWhileRunning.set(true);
            return remaining.get() == 0;
        }
    }
}
