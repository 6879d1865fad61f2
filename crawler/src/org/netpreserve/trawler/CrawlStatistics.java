package org.netpreserve.trawler;

import org.netpreserve.trawler.storage.WorkItem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Counters updated by worker threads as items are processed.
 */
public class CrawlStatistics {
    static final int COMMON_ERRORS = 3;
    private static final Pattern URL = Pattern.compile("\\b[a-zA-Z][a-zA-Z0-9+.-]*://\\S+");
    private final Clock clock;
    private final LongAdder started = new LongAdder();
    private final LongAdder handled = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder retried = new LongAdder();
    private final LongAdder handledNanos = new LongAdder();
    private final LongAdder failedNanos = new LongAdder();
    private final Map<Integer, LongAdder> retryHistogram = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> errorGroups = new ConcurrentHashMap<>();
    private volatile Instant startTime;

    public CrawlStatistics() {
        this(Clock.systemUTC());
    }

    public CrawlStatistics(Clock clock) {
        this.clock = clock;
    }

    public void start() {
        if (startTime == null) startTime = clock.instant();
    }

    public void itemStarted() {
        started.increment();
    }

    public void itemHandled(WorkItem item, Duration duration) {
        handled.increment();
        handledNanos.add(duration.toNanos());
        retryHistogram.computeIfAbsent(item.retryCount(), k -> new LongAdder()).increment();
    }

    public void itemFailed(WorkItem item, Duration duration) {
        failed.increment();
        failedNanos.add(duration.toNanos());
        retryHistogram.computeIfAbsent(item.retryCount(), k -> new LongAdder()).increment();
    }

    public void itemRetried() {
        retried.increment();
    }

    /**
     * Counts a failed attempt under a key made of the error class and its message with URLs blanked out, so that
     * the same failure on different items lands in one group.
     */
    public void errorOccurred(Throwable error) {
        errorGroups.computeIfAbsent(errorKey(error), k -> new LongAdder()).increment();
    }

    static String errorKey(Throwable error) {
        String message = error.getMessage();
        if (message == null) return error.getClass().getName();
        return error.getClass().getName() + ": " + URL.matcher(message).replaceAll("<url>");
    }

    private List<Progress.ErrorCount> commonErrors() {
        return errorGroups.entrySet().stream()
                .map(entry -> new Progress.ErrorCount(entry.getKey(), entry.getValue().sum()))
                .sorted(Comparator.comparingLong(Progress.ErrorCount::count).reversed()
                        .thenComparing(Progress.ErrorCount::error))
                .limit(COMMON_ERRORS)
                .toList();
    }

    public Progress snapshot() {
        Instant start = startTime;
        Duration runtime = start == null ? Duration.ZERO : Duration.between(start, clock.instant());
        var histogram = new TreeMap<Integer, Long>();
        retryHistogram.forEach((retries, count) -> histogram.put(retries, count.sum()));
        long handledCount = handled.sum();
        long failedCount = failed.sum();
        return new Progress(runtime, started.sum(), handledCount, failedCount, retried.sum(),
                histogram, average(handledNanos.sum(), handledCount), average(failedNanos.sum(), failedCount),
                commonErrors());
    }

    private static Duration average(long totalNanos, long count) {
        return count == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / count);
    }
}
