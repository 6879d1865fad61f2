package org.netpreserve.trawler.autoscaling;

import org.netpreserve.trawler.config.PoolConfig;
import org.netpreserve.trawler.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tasks from a {@link TaskProvider} with a concurrency that adapts to system load.
 * <p>
 * All scheduling decisions are made on a single control-loop thread which owns the concurrency counters. Task
 * bodies run on worker threads and post their results back to the control loop. A slot freed by a finished task
 * is offered to the next task straight away.
 * <p>
 * Every autoscale tick desired concurrency is lowered when the system is currently overloaded, or raised when the
 * pool is close to saturated and the system has been healthy over the historical window.
 */
public class AutoscaledPool {
    private static final Logger log = LoggerFactory.getLogger(AutoscaledPool.class);
    private static final long RATE_LIMIT_WINDOW_NANOS = TimeUnit.MINUTES.toNanos(1);

    private final PoolConfig config;
    private final TaskProvider provider;
    private final Snapshotter snapshotter;
    private final SystemStatus systemStatus;
    private final ConcurrencyState concurrency;
    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.IDLE);
    private final CompletableFuture<PoolState> outcome = new CompletableFuture<>();
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private final Deque<Long> recentStarts = new ArrayDeque<>();
    private volatile ScheduledExecutorService control;
    private volatile ExecutorService workers;
    private volatile CompletableFuture<Void> pauseFuture;
    private volatile Throwable failure;
    private long lastStateLogNanos;

    public AutoscaledPool(PoolConfig config, TaskProvider provider) {
        this(config, provider, new Snapshotter(config.snapshotter()));
    }

    public AutoscaledPool(PoolConfig config, TaskProvider provider, Snapshotter snapshotter) {
        this(config, provider, snapshotter, new SystemStatus(snapshotter, config.systemStatus()));
    }

    public AutoscaledPool(PoolConfig config, TaskProvider provider, Snapshotter snapshotter,
                          SystemStatus systemStatus) {
        this.config = config;
        this.provider = provider;
        this.snapshotter = snapshotter;
        this.systemStatus = systemStatus;
        this.concurrency = new ConcurrencyState(config.minConcurrency(), config.maxConcurrency(),
                config.initialDesiredConcurrency());
    }

    /**
     * Runs tasks until the provider reports it is finished, the pool is aborted or a task fails.
     *
     * @return {@link PoolState#FINISHED} or {@link PoolState#ABORTED}
     * @throws TaskFailedException   if a task or provider hook failed, with the original error as its cause
     * @throws IllegalStateException if the pool was already started
     * @throws InterruptedException  if the calling thread was interrupted, in which case the pool is aborted
     */
    public PoolState run() throws TaskFailedException, InterruptedException {
        var future = runAsync();
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new TaskFailedException(e.getCause());
        } catch (InterruptedException e) {
            abort();
            throw e;
        }
    }

    /**
     * Starts the pool and returns a future for its outcome. On failure the future completes exceptionally with the
     * original error of the task or hook.
     */
    public CompletableFuture<PoolState> runAsync() {
        if (!state.compareAndSet(PoolState.IDLE, PoolState.RUNNING)) {
            throw new IllegalStateException("Pool can only be run once, state is " + state.get());
        }
        control = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("pool-control"));
        workers = Executors.newCachedThreadPool(new NamedThreadFactory("pool-worker"));
        lastStateLogNanos = System.nanoTime();
        log.atDebug().addKeyValue("concurrency", concurrency).log("Starting pool");

        snapshotter.start(control);
        long maybeRunMillis = config.maybeRunInterval().toMillis();
        control.scheduleWithFixedDelay(this::maybeRunTasks, maybeRunMillis, maybeRunMillis, TimeUnit.MILLISECONDS);
        long autoscaleMillis = config.autoscaleInterval().toMillis();
        control.scheduleWithFixedDelay(this::autoscale, autoscaleMillis, autoscaleMillis, TimeUnit.MILLISECONDS);
        post(this::maybeRunTasks);
        return outcome;
    }

    /**
     * Stops the pool without waiting for running tasks. Their results are discarded. Does nothing if the pool
     * already stopped.
     */
    public void abort() {
        PoolState previous;
        do {
            previous = state.get();
            if (previous.isTerminal()) return;
        } while (!state.compareAndSet(previous, PoolState.ABORTED));
        log.info("Pool aborted");
        if (previous != PoolState.IDLE) destroy();
        outcome.complete(PoolState.ABORTED);
    }

    /**
     * Stops admitting new tasks. The returned future completes once all running tasks have settled.
     */
    public synchronized CompletableFuture<Void> pause() {
        PoolState current = state.get();
        if (current == PoolState.PAUSING || current == PoolState.PAUSED) return pauseFuture;
        if (current != PoolState.RUNNING) throw new IllegalStateException("Can only pause a RUNNING pool, state is " + current);
        var future = new CompletableFuture<Void>();
        pauseFuture = future;
        if (!state.compareAndSet(PoolState.RUNNING, PoolState.PAUSING)) {
            throw new IllegalStateException("Pool stopped while pausing, state is " + state.get());
        }
        log.info("Pausing pool");
        post(this::checkPaused);
        return future;
    }

    public synchronized void resume() {
        PoolState current = state.get();
        if (current == PoolState.RUNNING) return;
        if (current != PoolState.PAUSING && current != PoolState.PAUSED) {
            throw new IllegalStateException("Can only resume a paused pool, state is " + current);
        }
        if (!state.compareAndSet(current, PoolState.RUNNING)) {
            throw new IllegalStateException("Pool stopped while resuming, state is " + state.get());
        }
        var future = pauseFuture;
        if (future != null) future.cancel(false);
        log.info("Resuming pool");
        post(this::maybeRunTasks);
    }

    /**
     * Changes the bounds desired concurrency moves between. Desired concurrency is clamped into the new range.
     */
    public void updateConcurrencyBounds(int minConcurrency, int maxConcurrency) {
        if (minConcurrency < 1 || maxConcurrency < minConcurrency) {
            throw new IllegalArgumentException("Invalid bounds " + minConcurrency + ".." + maxConcurrency);
        }
        if (control == null) {
            concurrency.updateBounds(minConcurrency, maxConcurrency);
            return;
        }
        post(() -> {
            concurrency.updateBounds(minConcurrency, maxConcurrency);
            maybeRunTasks();
        });
    }

    public PoolState state() {
        return state.get();
    }

    public int currentConcurrency() {
        return concurrency.current();
    }

    public int desiredConcurrency() {
        return concurrency.desired();
    }

    public int minConcurrency() {
        return concurrency.min();
    }

    public int maxConcurrency() {
        return concurrency.max();
    }

    /**
     * Runs one autoscale tick on the control loop and waits for it.
     */
    void autoscaleNow() {
        CompletableFuture.runAsync(this::autoscale, control).join();
    }

    private void maybeRunTasks() {
        if (state.get() != PoolState.RUNNING) return;
        try {
            while (state.get() == PoolState.RUNNING && concurrency.hasCapacity()) {
                if (concurrency.current() >= concurrency.min() && !systemStatus.getCurrentStatus().idle()) {
                    log.trace("System overloaded, not starting new tasks");
                    return;
                }
                if (!withinRateLimit()) return;
                if (!provider.isTaskReady()) {
                    maybeFinish();
                    return;
                }
                startTask();
            }
        } catch (Exception e) {
            fail(e);
        }
    }

    private void maybeFinish() throws Exception {
        if (concurrency.current() != 0) return;
        if (!provider.isFinished()) return;
        if (state.compareAndSet(PoolState.RUNNING, PoolState.FINISHED)) {
            log.info("Pool finished");
            destroy();
            outcome.complete(PoolState.FINISHED);
        }
    }

    private boolean withinRateLimit() {
        Integer maxTasksPerMinute = config.maxTasksPerMinute();
        if (maxTasksPerMinute == null) return true;
        long now = System.nanoTime();
        while (!recentStarts.isEmpty() && now - recentStarts.peekFirst() >= RATE_LIMIT_WINDOW_NANOS) {
            recentStarts.removeFirst();
        }
        return recentStarts.size() < maxTasksPerMinute;
    }

    private void startTask() {
        concurrency.acquire();
        if (config.maxTasksPerMinute() != null) recentStarts.addLast(System.nanoTime());
        CompletableFuture<TaskResult> task = CompletableFuture.supplyAsync(this::invokeTask, workers);
        if (config.taskTimeout() != null) {
            task = task.orTimeout(config.taskTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        task.whenComplete((result, error) -> post(() -> onTaskSettled(result, error)));
    }

    private TaskResult invokeTask() {
        try {
            return provider.runTask();
        } catch (Exception e) {
            return TaskResult.fatal(e);
        }
    }

    private void onTaskSettled(TaskResult result, Throwable error) {
        concurrency.release();
        Throwable cause = null;
        if (error != null) {
            cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        } else if (result instanceof TaskResult.FatalFailure fatal) {
            cause = fatal.cause();
        } else if (result == null) {
            cause = new NullPointerException("Task returned a null result");
        } else if (result instanceof TaskResult.RetryableFailure retryable) {
            log.debug("Task failed and will be retried", retryable.cause());
        }
        if (cause != null) fail(cause);

        switch (state.get()) {
            case ERRORED -> {
                if (concurrency.current() == 0) completeWithFailure();
            }
            case PAUSING -> checkPaused();
            case RUNNING -> maybeRunTasks();
            default -> {
            }
        }
    }

    private void checkPaused() {
        if (concurrency.current() != 0) return;
        if (state.compareAndSet(PoolState.PAUSING, PoolState.PAUSED)) {
            log.info("Pool paused");
            var future = pauseFuture;
            if (future != null) future.complete(null);
        }
    }

    /**
     * Moves the pool to ERRORED and stops admission. The outcome is settled once running tasks have drained.
     */
    private void fail(Throwable cause) {
        PoolState previous;
        do {
            previous = state.get();
            if (previous.isTerminal()) {
                log.debug("Ignoring error from pool in state {}", previous, cause);
                return;
            }
        } while (!state.compareAndSet(previous, PoolState.ERRORED));
        failure = cause;
        log.atError().addKeyValue("runningTasks", concurrency.current()).setCause(cause)
                .log("Task failed, stopping pool");
        if (concurrency.current() == 0) completeWithFailure();
    }

    private void completeWithFailure() {
        destroy();
        outcome.completeExceptionally(failure);
    }

    private void autoscale() {
        if (state.get() != PoolState.RUNNING) return;
        try {
            SystemInfo currentStatus = systemStatus.getCurrentStatus();
            int before = concurrency.desired();
            if (!currentStatus.idle()) {
                int after = concurrency.scaleDown(config.scaleDownStepRatio());
                if (after != before) {
                    log.atDebug().addKeyValue("from", before).addKeyValue("to", after)
                            .addKeyValue("status", currentStatus).log("Scaling down");
                }
            } else if (concurrency.isSaturated(config.desiredConcurrencyRatio())
                       && systemStatus.getHistoricalStatus().idle()) {
                int after = concurrency.scaleUp(config.scaleUpStepRatio());
                if (after != before) {
                    log.atDebug().addKeyValue("from", before).addKeyValue("to", after).log("Scaling up");
                    maybeRunTasks();
                }
            }
            maybeLogState(currentStatus);
        } catch (Exception e) {
            fail(e);
        }
    }

    private void maybeLogState(SystemInfo currentStatus) {
        if (config.loggingInterval() == null) return;
        long now = System.nanoTime();
        if (now - lastStateLogNanos < config.loggingInterval().toNanos()) return;
        lastStateLogNanos = now;
        log.atInfo().addKeyValue("state", state.get())
                .addKeyValue("currentConcurrency", concurrency.current())
                .addKeyValue("desiredConcurrency", concurrency.desired())
                .addKeyValue("system", currentStatus)
                .log("Pool state");
    }

    private void post(Runnable action) {
        var executor = control;
        if (executor == null) return;
        try {
            executor.execute(action);
        } catch (RejectedExecutionException e) {
            log.debug("Control loop has stopped, dropping event", e);
        }
    }

    private void destroy() {
        if (!destroyed.compareAndSet(false, true)) return;
        snapshotter.stop();
        var future = pauseFuture;
        if (future != null) future.complete(null);
        if (control != null) control.shutdown();
        if (workers != null) workers.shutdownNow();
    }
}
