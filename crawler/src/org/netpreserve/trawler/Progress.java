package org.netpreserve.trawler;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of crawl statistics.
 *
 * @param runtime                 time since the crawl started
 * @param started                 items taken from the work source
 * @param handled                 items handled successfully
 * @param failed                  items that gave up after exhausting retries
 * @param retried                 failed attempts that were retried
 * @param retryHistogram          number of completed items by how many retries they needed
 * @param averageHandledDuration  mean handler time of successful attempts
 * @param averageFailedDuration   mean handler time of items that failed permanently
 * @param commonErrors            the most frequent handler errors, most frequent first
 */
public record Progress(Duration runtime, long started, long handled, long failed, long retried,
                       Map<Integer, Long> retryHistogram, Duration averageHandledDuration,
                       Duration averageFailedDuration, List<ErrorCount> commonErrors) {

    public double itemsPerMinute() {
        long millis = runtime.toMillis();
        if (millis == 0) return 0;
        return (handled + failed) * 60_000.0 / millis;
    }

    /**
     * How many failed attempts ended with errors of one kind.
     */
    public record ErrorCount(String error, long count) {
    }
}
