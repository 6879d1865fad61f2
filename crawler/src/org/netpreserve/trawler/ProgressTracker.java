package org.netpreserve.trawler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically logs the current crawl progress, and once more when closed.
 */
public class ProgressTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    private final CrawlStatistics statistics;
    private final @Nullable Duration interval;
    private ScheduledExecutorService scheduler;

    public ProgressTracker(CrawlStatistics statistics, @Nullable Duration interval) {
        this.statistics = statistics;
        this.interval = interval;
    }

    public synchronized void start() {
        statistics.start();
        if (interval == null || scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("progress"));
        scheduler.scheduleAtFixedRate(() -> logProgress("Crawl progress"), interval.toMillis(),
                interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void logProgress(String message) {
        Progress progress = statistics.snapshot();
        log.atInfo()
                .addKeyValue("runtime", progress.runtime())
                .addKeyValue("handled", progress.handled())
                .addKeyValue("failed", progress.failed())
                .addKeyValue("retried", progress.retried())
                .addKeyValue("itemsPerMinute", String.format("%.1f", progress.itemsPerMinute()))
                .addKeyValue("retryHistogram", progress.retryHistogram())
                .log(message);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        logProgress("Crawl finished");
        for (Progress.ErrorCount error : statistics.snapshot().commonErrors()) {
            log.atInfo().addKeyValue("count", error.count()).log("Common error: {}", error.error());
        }
    }
}
