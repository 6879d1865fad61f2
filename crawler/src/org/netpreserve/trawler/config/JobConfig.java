package org.netpreserve.trawler.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.netpreserve.trawler.util.Url;

import java.util.List;

/**
 * Root configuration for a crawl job.
 *
 * @param seeds URLs to start from
 * @param crawl how to crawl (retries, limits, timeouts)
 * @param pool  how many items to work on at once and how to adapt that number
 */
public record JobConfig(
        List<Url> seeds,
        CrawlConfig crawl,
        PoolConfig pool
) {
    @JsonCreator
    public JobConfig {
        if (seeds == null) seeds = List.of();
        if (crawl == null) crawl = new CrawlConfig();
        if (pool == null) pool = new PoolConfig();
    }

    public JobConfig() {
        this(List.of(), null, null);
    }
}
