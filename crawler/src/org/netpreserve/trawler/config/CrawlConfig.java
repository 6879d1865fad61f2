package org.netpreserve.trawler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.trawler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent          User-Agent string to identify as to servers
 * @param maxRetries         retries per item unless the item sets its own limit
 * @param maxItemsPerCrawl   stop starting new items once this many have been started
 * @param maxDepth           maximum link depth from any seed
 * @param handlerTimeout     longest a handler may run on one item before it counts as failed
 * @param statisticsInterval how often crawl statistics are logged, null to disable
 */
public record CrawlConfig(
        String userAgent,
        Integer maxRetries,
        @Nullable Long maxItemsPerCrawl,
        @Nullable Integer maxDepth,
        @JsonDeserialize(using = DurationDeserializer.class) Duration handlerTimeout,
        @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration statisticsInterval) {

    @JsonCreator
    public CrawlConfig {
        if (userAgent == null) userAgent = "trawler";
        if (maxRetries == null) maxRetries = 3;
        if (handlerTimeout == null) handlerTimeout = Duration.ofSeconds(60);

        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must not be negative");
        if (maxItemsPerCrawl != null && maxItemsPerCrawl < 1) {
            throw new IllegalArgumentException("maxItemsPerCrawl must be at least 1");
        }
        if (maxDepth != null && maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative");
        Validation.requirePositive("handlerTimeout", handlerTimeout);
        if (statisticsInterval != null) Validation.requirePositive("statisticsInterval", statisticsInterval);
    }

    public CrawlConfig() {
        this(null, null, null, null, null, null);
    }
}
