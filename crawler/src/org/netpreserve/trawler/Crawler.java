package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.autoscaling.AutoscaledPool;
import org.netpreserve.trawler.autoscaling.PoolState;
import org.netpreserve.trawler.autoscaling.Snapshotter;
import org.netpreserve.trawler.autoscaling.TaskFailedException;
import org.netpreserve.trawler.autoscaling.TaskProvider;
import org.netpreserve.trawler.autoscaling.TaskResult;
import org.netpreserve.trawler.config.CrawlConfig;
import org.netpreserve.trawler.config.PoolConfig;
import org.netpreserve.trawler.storage.WorkItem;
import org.netpreserve.trawler.storage.WorkList;
import org.netpreserve.trawler.storage.WorkQueue;
import org.netpreserve.trawler.storage.WorkSource;
import org.netpreserve.trawler.storage.WorkSourceException;
import org.netpreserve.trawler.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds work items from a {@link WorkList} and/or a {@link WorkQueue} through an {@link ItemHandler}, using an
 * {@link AutoscaledPool} to decide how many items are handled at once.
 * <p>
 * When both a list and a queue are given the list is moved into the queue once at the start of {@link #run()} and
 * only the queue is used after that.
 */
public class Crawler implements TaskProvider {
    private static final Logger log = LoggerFactory.getLogger(Crawler.class);
    private final CrawlConfig config;
    private final @Nullable WorkList list;
    private final @Nullable WorkQueue queue;
    private final ItemHandler handler;
    private final @Nullable ItemErrorHandler errorHandler;
    private final @Nullable FailedItemHandler failedHandler;
    private final Snapshotter snapshotter;
    private final AutoscaledPool pool;
    private final ExecutorService handlerExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("item-handler"));
    private final CrawlStatistics statistics = new CrawlStatistics();
    private final ProgressTracker progressTracker;
    private final AtomicLong started = new AtomicLong();
    private final AtomicBoolean limitLogged = new AtomicBoolean();
    private final AtomicBoolean merged = new AtomicBoolean();

    public Crawler(CrawlConfig config, PoolConfig poolConfig, @Nullable WorkList list, @Nullable WorkQueue queue,
                   ItemHandler handler, @Nullable FailedItemHandler failedHandler) {
        this(config, poolConfig, new Snapshotter(poolConfig.snapshotter()), list, queue, handler, failedHandler);
    }

    public Crawler(CrawlConfig config, PoolConfig poolConfig, Snapshotter snapshotter, @Nullable WorkList list,
                   @Nullable WorkQueue queue, ItemHandler handler, @Nullable FailedItemHandler failedHandler) {
        this(config, poolConfig, snapshotter, list, queue, handler, null, failedHandler);
    }

    public Crawler(CrawlConfig config, PoolConfig poolConfig, Snapshotter snapshotter, @Nullable WorkList list,
                   @Nullable WorkQueue queue, ItemHandler handler, @Nullable ItemErrorHandler errorHandler,
                   @Nullable FailedItemHandler failedHandler) {
        if (list == null && queue == null) throw new IllegalArgumentException("A work list or work queue is required");
        this.config = config;
        this.list = list;
        this.queue = queue;
        this.handler = handler;
        this.errorHandler = errorHandler;
        this.failedHandler = failedHandler;
        this.snapshotter = snapshotter;
        this.pool = new AutoscaledPool(poolConfig, this, snapshotter);
        this.progressTracker = new ProgressTracker(statistics, config.statisticsInterval());
    }

    /**
     * Runs the crawl until every item has been handled or has failed, the item limit is reached or the crawl is
     * aborted.
     *
     * @return final statistics
     * @throws TaskFailedException if the work source broke or a failed-item handler threw
     */
    public Progress run() throws TaskFailedException, InterruptedException {
        try {
            mergeListIntoQueue();
        } catch (WorkSourceException e) {
            throw new TaskFailedException(e);
        }
        progressTracker.start();
        try {
            pool.run();
        } finally {
            handlerExecutor.shutdownNow();
            progressTracker.close();
        }
        return statistics.snapshot();
    }

    public void abort() {
        pool.abort();
    }

    public Progress progress() {
        return statistics.snapshot();
    }

    public AutoscaledPool pool() {
        return pool;
    }

    /**
     * Moves every item of the work list into the work queue. Only the first call does anything.
     */
    void mergeListIntoQueue() {
        if (list == null || queue == null || !merged.compareAndSet(false, true)) return;
        int added = 0;
        int total = 0;
        WorkItem item;
        while ((item = list.fetchNext()) != null) {
            total++;
            if (queue.add(item)) added++;
            list.markHandled(item);
        }
        log.atInfo().addKeyValue("items", total).addKeyValue("new", added).log("Moved work list into work queue");
    }

    private WorkSource source() {
        return queue != null ? queue : list;
    }

    private boolean limitReached() {
        Long max = config.maxItemsPerCrawl();
        if (max == null || started.get() < max) return false;
        if (limitLogged.compareAndSet(false, true)) {
            log.atInfo().addKeyValue("maxItemsPerCrawl", max).log("Item limit reached, not starting new items");
        }
        return true;
    }

    @Override
    public boolean isTaskReady() {
        if (limitReached()) return false;
        return !source().isEmpty();
    }

    @Override
    public boolean isFinished() {
        if (limitReached()) return true;
        return source().isFinished();
    }

    @Override
    public TaskResult runTask() {
        if (!reserveItem()) return TaskResult.ok();
        WorkSource source = source();
        WorkItem item;
        try {
            item = source.fetchNext();
        } catch (WorkSourceException e) {
            releaseItem();
            return TaskResult.fatal(e);
        }
        if (item == null) {
            releaseItem();
            return TaskResult.ok();
        }
        statistics.itemStarted();

        try {
            long startNanos = System.nanoTime();
            Throwable error = handle(item);
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            if (pool.state() == PoolState.ABORTED) {
                // left in flight, a reopened WorkQueue makes it available again
                log.atDebug().addKeyValue("url", item.url()).log("Discarding result of item after abort");
                return TaskResult.ok();
            }
            if (error == null) {
                source.markHandled(item);
                statistics.itemHandled(item, duration);
                return TaskResult.ok();
            }
            return handleFailure(source, item, error, duration);
        } catch (WorkSourceException e) {
            return TaskResult.fatal(e);
        }
    }

    /**
     * Counts an item against the crawl limit before fetching it.
     */
    private boolean reserveItem() {
        Long max = config.maxItemsPerCrawl();
        if (max == null) {
            started.incrementAndGet();
            return true;
        }
        if (started.incrementAndGet() > max) {
            started.decrementAndGet();
            return false;
        }
        return true;
    }

    private void releaseItem() {
        started.decrementAndGet();
    }

    /**
     * Runs the handler under the handler timeout.
     *
     * @return the error the handler failed with, or null on success
     */
    private @Nullable Throwable handle(WorkItem item) {
        var context = new ItemContext(item, config, queue, snapshotter.clientErrors());
        Future<Void> future = handlerExecutor.submit(() -> {
            handler.handle(context);
            return null;
        });
        try {
            future.get(config.handlerTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (TimeoutException e) {
            future.cancel(true);
            return new TimeoutException("Handler timed out after " + config.handlerTimeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return e;
        }
    }

    private TaskResult handleFailure(WorkSource source, WorkItem item, Throwable error, Duration duration) {
        statistics.errorOccurred(error);
        int maxRetries = item.maxRetries() != null ? item.maxRetries() : config.maxRetries();
        boolean retry = !item.noRetry() && !(error instanceof NonRetryableException) && item.retryCount() < maxRetries;
        String message = String.valueOf(error);
        if (retry && errorHandler != null) {
            var context = new ItemContext(item, config, queue, snapshotter.clientErrors());
            try {
                errorHandler.handleError(context, error);
            } catch (Exception e) {
                return TaskResult.fatal(e);
            }
            retry = !context.retriesSkipped();
        }
        if (retry) {
            log.atWarn().addKeyValue("url", item.url()).addKeyValue("retry", item.retryCount() + 1)
                    .addKeyValue("maxRetries", maxRetries).addKeyValue("error", message)
                    .log("Item failed, will retry");
            source.reclaim(item, message);
            statistics.itemRetried();
            return TaskResult.retryable(error);
        }

        log.atError().addKeyValue("url", item.url()).addKeyValue("retries", item.retryCount()).setCause(error)
                .log("Item failed");
        source.markFailed(item, message);
        statistics.itemFailed(item, duration);
        if (failedHandler != null) {
            try {
                failedHandler.handleFailed(new ItemContext(item.withState(WorkItem.State.FAILED), config, queue,
                        snapshotter.clientErrors()), error);
            } catch (Exception e) {
                return TaskResult.fatal(e);
            }
        }
        return TaskResult.retryable(error);
    }
}
